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
 * Normalized Difference Vegetation Index: {@code (N - R)/(N + R)}.
 * <p>
 * Renders as {@code (($N - $R) / ($N + $R))} for datacubes {@code N} and {@code R}.
 */
public final class Ndvi extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("NDVI")
            .longName("Normalized Difference Vegetation Index")
            .addBands("N", "R")
            .formula("(N - R)/(N + R)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://ntrs.nasa.gov/citations/19740022614")
            .build();

    private Ndvi(Binary formula) {
        super(formula);
    }

    public static Ndvi of(Object n, Object r) {
        return new Ndvi(normalizedDifference(n, r));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
