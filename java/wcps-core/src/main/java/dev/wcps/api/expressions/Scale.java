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

import static dev.wcps.api.WcpsClientException.Kind.CONFLICTING_CONFIGURATION;
import static dev.wcps.api.WcpsClientException.Kind.INCOMPLETE_CONFIGURATION;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_AXIS_CONSTRAINT;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_SCALE_FACTOR;

import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.Optional;

/**
 * Resample a coverage to a new grid domain. Exactly one target must be chosen:
 * <ol>
 *   <li>{@link #toExplicitGridDomain(Object...)}: {@code scale(c, { X(0:100), Y(0:200) })}</li>
 *   <li>{@link #toGridDomainOf(Expression)}: {@code scale(c, { imageCrsDomain(other) })}</li>
 *   <li>{@link #byFactor(Number)}: {@code scale(c, 0.5)}</li>
 *   <li>{@link #byFactorPerAxis(Object...)}: {@code scale(c, { X(0.5), Y(2) })}</li>
 * </ol>
 */
public final class Scale extends Expression {
    private final Expression target;
    private Mode mode;
    private ImmutableList<Axis> axes = ImmutableList.of();
    private Expression gridDomainOf;
    private Scalar factor;

    private Scale(Object target) {
        this.target = addRequiredOperand(target, "scale target");
    }

    public static Scale of(Object target) {
        return new Scale(target);
    }

    /**
     * Scale to the grid bounds given per axis; {@code axes} is any shape accepted by
     * {@link Axes#normalize(Object)}.
     */
    public Scale toExplicitGridDomain(Object... axes) {
        checkNoMode(Mode.GRID_AXES);
        ImmutableList<Axis> gridAxes = Axes.fromVarargs(axes);
        this.mode = Mode.GRID_AXES;
        gridAxes.forEach(this::addOperand);
        this.axes = gridAxes;
        return this;
    }

    public Scale toGridDomainOf(Expression other) {
        checkNoMode(Mode.GRID_DOMAIN_OF);
        WcpsClientException.check(other != null, INVALID_OPERAND, "The coverage to scale to must not be null.");
        this.mode = Mode.GRID_DOMAIN_OF;
        this.gridDomainOf = addOperand(other);
        return this;
    }

    /**
     * @param factor greater than 1 scales up, between 0 and 1 scales down
     */
    public Scale byFactor(Number factor) {
        checkNoMode(Mode.FACTOR);
        WcpsClientException.check(factor != null, INVALID_SCALE_FACTOR, "Scale factor must not be null.");
        checkFactor(factor.doubleValue());
        this.mode = Mode.FACTOR;
        this.factor = (Scalar) addOperand(Scalar.of(factor));
        return this;
    }

    /**
     * Scale each axis by its own factor, given as the low bound of the axis, e.g. {@code ("X", 0.5)}.
     */
    public Scale byFactorPerAxis(Object... axes) {
        checkNoMode(Mode.AXIS_FACTORS);
        ImmutableList<Axis> factors = Axes.fromVarargs(axes);
        for (Axis axis : factors) {
            WcpsClientException.check(
                    axis.getHigh().isEmpty(),
                    INVALID_AXIS_CONSTRAINT,
                    "When scaling by axis factors only a single factor per axis should be specified (axis %s).",
                    axis.getAxisName());
            WcpsClientException.check(
                    axis.getCrs().isEmpty(),
                    INVALID_AXIS_CONSTRAINT,
                    "When scaling by axis factors a CRS must not be specified (axis %s).",
                    axis.getAxisName());
            WcpsClientException.check(
                    axis.getLow() instanceof Scalar && ((Scalar) axis.getLow()).isNumber(),
                    INVALID_SCALE_FACTOR,
                    "Expected a number scale factor for axis %s.",
                    axis.getAxisName());
            checkFactor(((Number) ((Scalar) axis.getLow()).getValue()).doubleValue());
        }
        this.mode = Mode.AXIS_FACTORS;
        factors.forEach(this::addOperand);
        this.axes = factors;
        return this;
    }

    private void checkNoMode(Mode requested) {
        WcpsClientException.check(
                mode == null,
                CONFLICTING_CONFIGURATION,
                "Cannot set multiple scale targets: %s is already set, %s was requested. Exactly one of "
                        + "toExplicitGridDomain, toGridDomainOf, byFactor, or byFactorPerAxis must be used.",
                mode,
                requested);
    }

    private static void checkFactor(double factor) {
        WcpsClientException.check(
                factor > 0, INVALID_SCALE_FACTOR, "Scale factor must be greater than zero, got %s.", factor);
    }

    /**
     * @throws WcpsClientException of kind {@code INCOMPLETE_CONFIGURATION} if no target was chosen
     */
    public Mode getMode() {
        WcpsClientException.check(
                mode != null,
                INCOMPLETE_CONFIGURATION,
                "No scale target specified, exactly one of toExplicitGridDomain, toGridDomainOf, byFactor, "
                        + "or byFactorPerAxis must be used.");
        return mode;
    }

    public Expression getTarget() {
        return target;
    }

    /**
     * Grid bounds or per-axis factors, depending on the {@link Mode}.
     */
    public ImmutableList<Axis> getAxes() {
        return axes;
    }

    public Optional<Expression> getGridDomainOf() {
        return Optional.ofNullable(gridDomainOf);
    }

    public Optional<Scalar> getFactor() {
        return Optional.ofNullable(factor);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitScale(this);
    }

    public enum Mode {
        GRID_AXES,
        GRID_DOMAIN_OF,
        FACTOR,
        AXIS_FACTORS,
    }
}
