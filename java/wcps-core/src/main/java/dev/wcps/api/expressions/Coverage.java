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

import static dev.wcps.api.WcpsClientException.Kind.CONFLICTING_VALUES_SPECIFICATION;
import static dev.wcps.api.WcpsClientException.Kind.EMPTY_NAME;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;
import static dev.wcps.api.WcpsClientException.Kind.MISSING_VALUES_CLAUSE;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A general coverage constructor. For each point in the iteration domain the cell value is computed by the
 * {@link #values(Object) values} expression, or taken from an explicit {@link #valueList(List) value list}.
 * Renders as {@code (coverage NAME over $v1 ..., $v2 ... values V)} or
 * {@code (coverage NAME over $v1 ... value list < a; b; ... >)}.
 * <pre>{@code
 * Datacube cov = Datacube.of("mycov");
 * AxisIter lat = AxisIter.of("$pLat", "Lat").ofGeoAxis(cov.subset("Lat", -30, -28.5));
 * AxisIter lon = AxisIter.of("$pLon", "Lon").ofGeoAxis(cov.subset("Lon", 111.975, 113.475));
 * Coverage.of("copy_of_mycov")
 *         .over(lat, lon)
 *         .values(cov.subset(new Object[] {"Lat", lat.ref()}, new Object[] {"Lon", lon.ref()}));
 * }</pre>
 */
public final class Coverage extends Iterating<Coverage> {
    private final String name;
    private Expression values;
    private ImmutableList<Scalar> valueList;

    private Coverage(String name) {
        this.name = name;
    }

    /**
     * @param name name of the constructed coverage
     */
    public static Coverage of(String name) {
        WcpsClientException.check(!Strings.isNullOrEmpty(name), EMPTY_NAME, "Coverage name must not be empty.");
        return new Coverage(name);
    }

    @Override
    protected Coverage self() {
        return this;
    }

    /**
     * The expression evaluated at every point of the iteration domain.
     */
    public Coverage values(Object values) {
        checkNoValues();
        this.values = addRequiredOperand(values, "values");
        return this;
    }

    public Coverage valueList(Object... values) {
        return valueList(Arrays.asList(values));
    }

    /**
     * Enumerate every cell value of the constructed coverage. The values must be numbers or booleans.
     */
    public Coverage valueList(List<?> values) {
        checkNoValues();
        WcpsClientException.check(!values.isEmpty(), INVALID_OPERAND, "The value list must not be empty.");
        ImmutableList.Builder<Scalar> scalars = ImmutableList.builder();
        for (Object value : values) {
            WcpsClientException.check(
                    value instanceof Number || value instanceof Boolean,
                    INVALID_OPERAND,
                    "Value list entries must be numbers or booleans, got %s.",
                    value == null ? "null" : value.getClass().getName());
            scalars.add(Scalar.of(value));
        }
        this.valueList = scalars.build();
        return this;
    }

    private void checkNoValues() {
        WcpsClientException.check(
                values == null && valueList == null,
                CONFLICTING_VALUES_SPECIFICATION,
                "Cannot specify the values of coverage %s more than once, either as an expression or as a list.",
                name);
    }

    public String getName() {
        return name;
    }

    /**
     * @throws WcpsClientException of kind {@code MISSING_VALUES_CLAUSE} if neither values form was set
     */
    public void checkValuesPresent() {
        WcpsClientException.check(
                values != null || valueList != null,
                MISSING_VALUES_CLAUSE,
                "A VALUES or VALUE LIST clause is mandatory in a COVERAGE operation, none was specified.");
    }

    public Optional<Expression> getValues() {
        return Optional.ofNullable(values);
    }

    public Optional<ImmutableList<Scalar>> getValueList() {
        return Optional.ofNullable(valueList);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCoverage(this);
    }
}
