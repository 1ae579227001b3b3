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
import dev.wcps.api.expressions.FunctionCall;

/**
 * Burned Area Index: {@code 1.0 / ((0.1 - R) ** 2.0 + (0.06 - N) ** 2.0)}.
 * <p>
 * Highlights burned land by the distance of each pixel to a reference spectral point in the red and NIR bands.
 */
public final class Bai extends SpectralIndex {
    public static final SpectralIndexInfo INFO = SpectralIndexInfo.builder()
            .shortName("BAI")
            .longName("Burned Area Index")
            .addBands("R", "N")
            .formula("1.0 / ((0.1 - R) ** 2.0 + (0.06 - N) ** 2.0)")
            .addPlatforms(
                    "Sentinel-2",
                    "Landsat-OLI",
                    "Landsat-TM",
                    "Landsat-ETM+",
                    "MODIS",
                    "Planet-Fusion")
            .reference("https://digital.csic.es/bitstream/10261/6426/1/Martin_Isabel_Serie_Geografica.pdf")
            .build();

    private Bai(Binary formula) {
        super(formula);
    }

    public static Bai of(Object r, Object n) {
        return new Bai(Binary.div(
                1.0,
                Binary.add(
                        FunctionCall.pow(Binary.sub(0.1, r), 2.0),
                        FunctionCall.pow(Binary.sub(0.06, n), 2.0))));
    }

    @Override
    public SpectralIndexInfo info() {
        return INFO;
    }
}
