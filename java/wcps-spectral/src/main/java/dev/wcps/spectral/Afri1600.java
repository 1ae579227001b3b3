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
 * Aerosol Free Vegetation Index (1600 nm): {@code (N - 0.66 * S1) / (N + 0.66 * S1)}.
 */
public final class Afri1600 extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("AFRI1600")
            .longName("Aerosol Free Vegetation Index (1600 nm)")
            .addBands("N", "S1")
            .formula("(N - 0.66 * S1) / (N + 0.66 * S1)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS")
            .reference("https://doi.org/10.1016/S0034-4257(01)00190-0")
            .build();

    private Afri1600(Binary formula) {
        super(formula);
    }

    public static Afri1600 of(Object n, Object s1) {
        return new Afri1600(Binary.div(Binary.sub(n, Binary.mul(0.66, s1)), Binary.add(n, Binary.mul(0.66, s1))));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
