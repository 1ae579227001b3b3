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

/**
 * Soil-Adjusted Vegetation Index: {@code (1.0 + L) * (N - R) / (N + R + L)}.
 * <p>
 * {@code L} is the soil adjustment factor, commonly 0.5.
 */
public final class Savi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("SAVI")
            .longName("Soil-Adjusted Vegetation Index")
            .addBands("L", "N", "R")
            .formula("(1.0 + L) * (N - R) / (N + R + L)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1016/0034-4257(88)90106-X")
            .build();

    private Savi(Binary formula) {
        super(formula);
    }

    public static Savi of(Object l, Object n, Object r) {
        return new Savi(Binary.div(Binary.mul(Binary.add(1.0, l), Binary.sub(n, r)), Binary.add(Binary.add(n, r), l)));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
