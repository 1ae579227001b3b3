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
import dev.wcps.api.expressions.ResampleAlg;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Settings for {@link Expression#reproject(ReprojectOptions)}.
 */
@Value.Immutable
public interface ReprojectOptions {
    /**
     * CRS to reproject to, e.g. {@code EPSG:4326}.
     */
    String targetCrs();

    Optional<ResampleAlg> interpolation();

    /**
     * Resolutions to keep in the result, given as the low bound of each axis.
     */
    List<Axis> axisResolutions();

    /**
     * Crop the result to these axis bounds. Cannot be combined with {@link #domainOf()}.
     */
    List<Axis> axisSubsets();

    /**
     * Crop the result to the geo domain of another expression.
     */
    Optional<Expression> domainOf();

    static ReprojectOptions of(String targetCrs) {
        return ImmutableReprojectOptions.builder().targetCrs(targetCrs).build();
    }

    static ImmutableReprojectOptions.Builder builder() {
        return ImmutableReprojectOptions.builder();
    }
}
