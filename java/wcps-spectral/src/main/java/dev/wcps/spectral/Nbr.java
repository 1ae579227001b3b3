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
 * Normalized Burn Ratio: {@code (N - S2) / (N + S2)}.
 */
public final class Nbr extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("NBR")
            .longName("Normalized Burn Ratio")
            .addBands("N", "S2")
            .formula("(N - S2) / (N + S2)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS")
            .reference("https://doi.org/10.3133/ofr0211")
            .build();

    private Nbr(Binary formula) {
        super(formula);
    }

    public static Nbr of(Object n, Object s2) {
        return new Nbr(normalizedDifference(n, s2));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
