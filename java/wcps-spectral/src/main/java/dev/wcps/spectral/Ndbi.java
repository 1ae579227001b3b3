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
 * Normalized Difference Built-Up Index: {@code (S1 - N) / (S1 + N)}.
 */
public final class Ndbi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("NDBI")
            .longName("Normalized Difference Built-Up Index")
            .addBands("S1", "N")
            .formula("(S1 - N) / (S1 + N)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS")
            .reference("http://dx.doi.org/10.1080/01431160304987")
            .build();

    private Ndbi(Binary formula) {
        super(formula);
    }

    public static Ndbi of(Object s1, Object n) {
        return new Ndbi(normalizedDifference(s1, n));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
