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
package dev.wcps.api;

import dev.wcps.api.expressions.Axis;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.immutables.value.Value;

/**
 * Targets for {@link Expression#scale(ScaleOptions)}. Exactly one of them must be set.
 */
@Value.Immutable
public interface ScaleOptions {
    /**
     * Grid bounds to scale to, one axis each.
     */
    List<Axis> gridAxes();

    /**
     * Scale to the grid domain of another expression.
     */
    Optional<Expression> gridDomainOf();

    /**
     * Factor applied to all axes; greater than 1 scales up, between 0 and 1 scales down.
     */
    OptionalDouble factor();

    /**
     * Factor per axis, given as the low bound of each axis.
     */
    List<Axis> axisFactors();

    static ImmutableScaleOptions.Builder builder() {
        return ImmutableScaleOptions.builder();
    }
}
