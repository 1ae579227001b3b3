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

import static dev.wcps.api.WcpsClientException.Kind.EMPTY_CRS;
import static dev.wcps.api.WcpsClientException.Kind.EMPTY_NAME;

import com.google.common.base.Strings;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.Optional;

/**
 * An interval (trim) or a single coordinate (slice) along one named axis, optionally in a CRS other than the
 * native one of the coverage. Rendered as {@code X(low:high)}, {@code X(low)} or {@code X:"crs"(low:high)}.
 * <p>
 * Bounds may be numbers, strings (e.g. timestamps), expressions (e.g. {@link AxisIterRef}), or {@link #MIN}
 * and {@link #MAX} for an open end.
 */
public final class Axis extends Expression {
    /**
     * The lowest coordinate of an axis.
     */
    public static final String MIN = "*";
    /**
     * The highest coordinate of an axis.
     */
    public static final String MAX = "*";

    private final String axisName;
    private final Expression low;
    private final Expression high;
    private final String crs;

    private Axis(String axisName, Object low, Object high, String crs) {
        this.axisName = axisName;
        this.low = addRequiredOperand(low, "axis " + axisName + " low bound");
        this.high = addOperand(high);
        this.crs = crs;
    }

    public static Axis of(String axisName, Object low) {
        return of(axisName, low, null, null);
    }

    public static Axis of(String axisName, Object low, Object high) {
        return of(axisName, low, high, null);
    }

    /**
     * @param high upper bound of a trim, or {@code null} for a slice
     * @param crs CRS of the bounds, or {@code null} for the native CRS
     */
    public static Axis of(String axisName, Object low, Object high, String crs) {
        WcpsClientException.check(!Strings.isNullOrEmpty(axisName), EMPTY_NAME, "Axis name must not be empty.");
        WcpsClientException.check(crs == null || !crs.isBlank(), EMPTY_CRS, "Axis %s has an empty CRS.", axisName);
        return new Axis(axisName, low, high, crs);
    }

    public String getAxisName() {
        return axisName;
    }

    public Expression getLow() {
        return low;
    }

    public Optional<Expression> getHigh() {
        return Optional.ofNullable(high);
    }

    public Optional<String> getCrs() {
        return Optional.ofNullable(crs);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitAxis(this);
    }
}
