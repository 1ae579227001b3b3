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
 * Enhanced Vegetation Index: {@code g * (N - R) / (N + C1 * R - C2 * B + L)}.
 * <p>
 * Typical constants are {@code g = 2.5}, {@code C1 = 6}, {@code C2 = 7.5} and {@code L = 1}.
 */
public final class Evi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("EVI")
            .longName("Enhanced Vegetation Index")
            .addBands("g", "N", "R", "C1", "C2", "B", "L")
            .formula("g * (N - R) / (N + C1 * R - C2 * B + L)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1016/S0034-4257(96)00112-5")
            .build();

    private Evi(Binary formula) {
        super(formula);
    }

    public static Evi of(Object gain, Object n, Object r, Object c1, Object c2, Object b, Object l) {
        return new Evi(Binary.div(
                Binary.mul(gain, Binary.sub(n, r)),
                Binary.add(Binary.sub(Binary.add(n, Binary.mul(c1, r)), Binary.mul(c2, b)), l)));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
