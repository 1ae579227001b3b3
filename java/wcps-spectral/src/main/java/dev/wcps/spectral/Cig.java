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
 * Chlorophyll Index Green: {@code (N / G) - 1.0}.
 */
public final class Cig extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("CIG")
            .longName("Chlorophyll Index Green")
            .addBands("N", "G")
            .formula("(N / G) - 1.0")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://doi.org/10.1078/0176-1617-00887")
            .build();

    private Cig(Binary formula) {
        super(formula);
    }

    public static Cig of(Object n, Object g) {
        return new Cig(Binary.sub(Binary.div(n, g), 1.0));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
