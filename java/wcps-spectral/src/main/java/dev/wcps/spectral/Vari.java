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
 * Visible Atmospherically Resistant Index: {@code (G - R) / (G + R - B)}.
 */
public final class Vari extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("VARI")
            .longName("Visible Atmospherically Resistant Index")
            .addBands("G", "R", "B")
            .formula("(G - R) / (G + R - B)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1016/S0034-4257(01)00289-9")
            .build();

    private Vari(Binary formula) {
        super(formula);
    }

    public static Vari of(Object g, Object r, Object b) {
        return new Vari(Binary.div(Binary.sub(g, r), Binary.sub(Binary.add(g, r), b)));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
