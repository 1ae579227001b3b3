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
 * Normalized Difference Water Index: {@code (G - N) / (G + N)}.
 */
public final class Ndwi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("NDWI")
            .longName("Normalized Difference Water Index")
            .addBands("G", "N")
            .formula("(G - N) / (G + N)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1080/01431169608948714")
            .build();

    private Ndwi(Binary formula) {
        super(formula);
    }

    public static Ndwi of(Object g, Object n) {
        return new Ndwi(normalizedDifference(g, n));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
