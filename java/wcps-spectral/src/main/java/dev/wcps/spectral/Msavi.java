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
package dev.wcps.spectral;

import dev.wcps.api.expressions.Binary;
import dev.wcps.api.expressions.FunctionCall;

/**
 * Modified Soil-Adjusted Vegetation Index: {@code 0.5 * (2.0 * N + 1 - (((2 * N + 1) ** 2) - 8 * (N - R)) ** 0.5)}.
 * <p>
 * A {@link Savi} variant where the soil adjustment factor is derived from the bands.
 */
public final class Msavi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("MSAVI")
            .longName("Modified Soil-Adjusted Vegetation Index")
            .addBands("N", "R")
            .formula("0.5 * (2.0 * N + 1 - (((2 * N + 1) ** 2) - 8 * (N - R)) ** 0.5)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1016/0034-4257(94)90134-1")
            .build();

    private Msavi(Binary formula) {
        super(formula);
    }

    public static Msavi of(Object n, Object r) {
        return new Msavi(Binary.mul(
                0.5,
                Binary.sub(
                        Binary.add(Binary.mul(2.0, n), 1),
                        FunctionCall.pow(
                                Binary.sub(
                                        FunctionCall.pow(Binary.add(Binary.mul(2, n), 1), 2),
                                        Binary.mul(8, Binary.sub(n, r))),
                                0.5))));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
