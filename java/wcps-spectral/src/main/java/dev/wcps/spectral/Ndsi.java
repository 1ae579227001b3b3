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
 * Normalized Difference Snow Index: {@code (G - S1) / (G + S1)}.
 */
public final class Ndsi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("NDSI")
            .longName("Normalized Difference Snow Index")
            .addBands("G", "S1")
            .formula("(G - S1) / (G + S1)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS")
            .reference("https://doi.org/10.1109/IGARSS.1994.399618")
            .build();

    private Ndsi(Binary formula) {
        super(formula);
    }

    public static Ndsi of(Object g, Object s1) {
        return new Ndsi(normalizedDifference(g, s1));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
