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
 * Green Normalized Difference Vegetation Index: {@code (N - G)/(N + G)}.
 */
public final class Gndvi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("GNDVI")
            .longName("Green Normalized Difference Vegetation Index")
            .addBands("N", "G")
            .formula("(N - G)/(N + G)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1016/S0034-4257(96)00072-7")
            .build();

    private Gndvi(Binary formula) {
        super(formula);
    }

    public static Gndvi of(Object n, Object g) {
        return new Gndvi(normalizedDifference(n, g));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
