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
import static dev.wcps.api.WcpsClientException.Kind.EMPTY_CRS;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_AXIS_CONSTRAINT;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.Optional;

/**
 * Reproject a coverage to another CRS, rendered as
 * {@code crsTransform(target, "crs"[, { interpolation }][, { resolutions }][, { subset } | , { domain(other) }])}.
 * <p>
 * The target CRS can be a full CRS URL ({@code http://localhost:8080/rasdaman/def/crs/EPSG/0/4326}), or a
 * shorthand like {@code EPSG/0/4326} or {@code EPSG:4326}. The result can additionally be resampled to
 * {@link #toAxisResolutions(Object...) axis resolutions}, and cropped either to
 * {@link #subsetByAxes(Object...) axis bounds} or to {@link #subsetByCoverageDomain(Expression) the domain of
 * another coverage}.
 */
public final class Reproject extends Expression {
    private final Expression target;
    private final String targetCrs;
    private final ResampleAlg interpolation;
    private ImmutableList<Axis> axisResolutions;
    private ImmutableList<Axis> axisSubsets;
    private Expression subsetDomain;

    private Reproject(Object target, String targetCrs, ResampleAlg interpolation) {
        this.target = addRequiredOperand(target, "reprojection target");
        this.targetCrs = targetCrs;
        this.interpolation = interpolation;
    }

    public static Reproject of(Object target, String targetCrs) {
        return of(target, targetCrs, (ResampleAlg) null);
    }

    /**
     * @param interpolation may be {@code null}
     */
    public static Reproject of(Object target, String targetCrs, ResampleAlg interpolation) {
        WcpsClientException.check(
                !Strings.isNullOrEmpty(targetCrs) && !targetCrs.isBlank(),
                EMPTY_CRS,
                "Reproject target CRS cannot be empty.");
        return new Reproject(target, targetCrs, interpolation);
    }

    /**
     * @param interpolation one of the {@link ResampleAlg} tokens, e.g. {@code "bilinear"}, or {@code null}
     */
    public static Reproject of(Object target, String targetCrs, String interpolation) {
        return of(target, targetCrs, interpolation == null ? null : ResampleAlg.fromString(interpolation));
    }

    /**
     * Resample the result to these resolutions, one axis each with only the low bound set, e.g.
     * {@code ("X", 1.5), ("Y", 2)}.
     */
    public Reproject toAxisResolutions(Object... axes) {
        WcpsClientException.check(
                axisResolutions == null, CONFLICTING_CONFIGURATION, "Axis resolutions are already set.");
        ImmutableList<Axis> resolutions = Axes.fromVarargs(axes);
        for (Axis axis : resolutions) {
            WcpsClientException.check(
                    axis.getHigh().isEmpty(),
                    INVALID_AXIS_CONSTRAINT,
                    "When reprojecting to axis resolutions only a single resolution per axis should be "
                            + "specified (axis %s).",
                    axis.getAxisName());
            WcpsClientException.check(
                    axis.getCrs().isEmpty(),
                    INVALID_AXIS_CONSTRAINT,
                    "When reprojecting to axis resolutions a CRS must not be specified (axis %s).",
                    axis.getAxisName());
        }
        resolutions.forEach(this::addOperand);
        this.axisResolutions = resolutions;
        return this;
    }

    /**
     * Crop the result to these axis bounds; every axis needs both bounds and no CRS.
     */
    public Reproject subsetByAxes(Object... axes) {
        checkNoCrop();
        ImmutableList<Axis> subsets = Axes.fromVarargs(axes);
        for (Axis axis : subsets) {
            WcpsClientException.check(
                    axis.getHigh().isPresent(),
                    INVALID_AXIS_CONSTRAINT,
                    "When reprojecting, an axis subset must include both lower and upper bounds (axis %s).",
                    axis.getAxisName());
            WcpsClientException.check(
                    axis.getCrs().isEmpty(),
                    INVALID_AXIS_CONSTRAINT,
                    "When reprojecting, an axis subset must not include a CRS (axis %s).",
                    axis.getAxisName());
        }
        subsets.forEach(this::addOperand);
        this.axisSubsets = subsets;
        return this;
    }

    /**
     * Crop the result to the geo domain of {@code other}.
     */
    public Reproject subsetByCoverageDomain(Expression other) {
        checkNoCrop();
        WcpsClientException.check(other != null, INVALID_OPERAND, "The coverage to crop to must not be null.");
        this.subsetDomain = addOperand(other);
        return this;
    }

    private void checkNoCrop() {
        WcpsClientException.check(
                axisSubsets == null && subsetDomain == null,
                CONFLICTING_CONFIGURATION,
                "The reprojected result can be cropped either by axis subsets or by a coverage domain, only once.");
    }

    public Expression getTarget() {
        return target;
    }

    public String getTargetCrs() {
        return targetCrs;
    }

    public Optional<ResampleAlg> getInterpolation() {
        return Optional.ofNullable(interpolation);
    }

    public Optional<ImmutableList<Axis>> getAxisResolutions() {
        return Optional.ofNullable(axisResolutions);
    }

    public Optional<ImmutableList<Axis>> getAxisSubsets() {
        return Optional.ofNullable(axisSubsets);
    }

    public Optional<Expression> getSubsetDomain() {
        return Optional.ofNullable(subsetDomain);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitReproject(this);
    }
}
