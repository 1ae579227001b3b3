/**
 * (c) Copyright 2025 SpiralDB Inc. All rights reserved.
 * <p>
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.wcps.api.expressions;

import static dev.wcps.api.WcpsClientException.Kind.CONFLICTING_ITERATION_DOMAIN;
import static dev.wcps.api.WcpsClientException.Kind.EMPTY_NAME;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;
import static dev.wcps.api.WcpsClientException.Kind.MISSING_ITERATION_DOMAIN;

import com.google.common.base.Strings;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;

/**
 * An iterator variable for the {@code over} clause of a {@link Condense} or a {@link Coverage}. It ranges
 * over exactly one domain: an integer {@link #interval(Object, Object) interval}, the
 * {@link #ofGridAxis(Expression) grid domain} of a coverage axis, or the {@link #ofGeoAxis(Expression) geo
 * domain} of a coverage axis.
 * <pre>{@code
 * AxisIter.of("$x", "X").interval(0, 100);
 * AxisIter.of("$pt", "time").ofGridAxis(Datacube.of("timeseries"));
 * AxisIter.of("$pLat", "Lat").ofGeoAxis(Datacube.of("cov"));
 * }</pre>
 * Use {@link #ref()} to cite the variable in {@code using}, {@code where} or {@code values} expressions.
 */
public final class AxisIter extends Expression {
    public enum Domain {
        INTERVAL,
        GRID_AXIS,
        GEO_AXIS,
    }

    private final String varName;
    private final String axisName;
    private Domain domain;
    private Object low;
    private Object high;
    private Expression domainOf;

    private AxisIter(String varName, String axisName) {
        this.varName = varName;
        this.axisName = axisName;
    }

    /**
     * @param varName the iterator variable; a leading {@code $} is added if missing
     * @param axisName the axis iterated over
     */
    public static AxisIter of(String varName, String axisName) {
        WcpsClientException.check(!Strings.isNullOrEmpty(varName), EMPTY_NAME, "AxisIter variable name cannot be empty.");
        WcpsClientException.check(!Strings.isNullOrEmpty(axisName), EMPTY_NAME, "AxisIter axis name cannot be empty.");
        return new AxisIter(varName.startsWith("$") ? varName : "$" + varName, axisName);
    }

    /**
     * Iterate over the inclusive interval {@code [low, high]}. Bounds are numbers, raw WCPS text or
     * expressions.
     */
    public AxisIter interval(Object low, Object high) {
        checkNoDomain(Domain.INTERVAL);
        this.low = checkBound(low, "low");
        this.high = checkBound(high, "high");
        this.domain = Domain.INTERVAL;
        return this;
    }

    /**
     * Iterate over the grid domain of {@code coverage} along this iterator's axis.
     */
    public AxisIter ofGridAxis(Expression coverage) {
        return setDomainOf(Domain.GRID_AXIS, coverage);
    }

    /**
     * Iterate over the geo domain of {@code coverage} along this iterator's axis.
     */
    public AxisIter ofGeoAxis(Expression coverage) {
        return setDomainOf(Domain.GEO_AXIS, coverage);
    }

    private AxisIter setDomainOf(Domain requested, Expression coverage) {
        checkNoDomain(requested);
        this.domainOf = addRequiredOperand(coverage, "iteration domain");
        this.domain = requested;
        return this;
    }

    private void checkNoDomain(Domain requested) {
        WcpsClientException.check(
                domain == null,
                CONFLICTING_ITERATION_DOMAIN,
                "Cannot iterate over %s, the iteration domain of %s is already set to %s.",
                requested,
                varName,
                domain);
    }

    private Object checkBound(Object bound, String role) {
        if (bound instanceof Expression) {
            return addOperand(bound);
        }
        WcpsClientException.check(
                bound instanceof Number || bound instanceof String,
                INVALID_OPERAND,
                "Interval %s bound must be a number, a string or an expression, got %s instead.",
                role,
                bound == null ? "null" : bound.getClass().getName());
        return bound;
    }

    /**
     * A reference to this variable for use inside the body of a condense or coverage expression.
     */
    public AxisIterRef ref() {
        return AxisIterRef.of(this);
    }

    public String getVarName() {
        return varName;
    }

    public String getAxisName() {
        return axisName;
    }

    /**
     * @throws WcpsClientException of kind {@code MISSING_ITERATION_DOMAIN} if no domain was set
     */
    public Domain getDomain() {
        WcpsClientException.check(
                domain != null,
                MISSING_ITERATION_DOMAIN,
                "No iteration domain provided for %s; use one of interval(), ofGridAxis() or ofGeoAxis().",
                varName);
        return domain;
    }

    public Object getLow() {
        return low;
    }

    public Object getHigh() {
        return high;
    }

    public Expression getDomainOf() {
        return domainOf;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitAxisIter(this);
    }
}
