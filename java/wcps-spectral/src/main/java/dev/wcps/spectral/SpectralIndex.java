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
import dev.wcps.api.expressions.Composite;

/**
 * A spectral index: a named formula over bands (and constants) of one or more coverages. The formula is
 * expanded into an expression tree when the index is created, and rendered in place of the index.
 * <pre>{@code
 * Datacube red = Datacube.of("S2_L2A_32631_B04_10m");
 * Datacube nir = Datacube.of("S2_L2A_32631_B08_10m");
 * String query = Ndvi.of(nir, red).encode("PNG").render();
 * }</pre>
 * Band arguments accept anything an operand accepts: expressions, numbers, strings and booleans.
 */
public abstract class SpectralIndex extends Composite {
    protected SpectralIndex(Binary formula) {
        super(formula);
    }

    /**
     * Name, bands, formula and provenance of this index.
     */
    public abstract SpectralIndexInfo info();

    /**
     * {@code (a - b) / (a + b)}
     */
    static Binary normalizedDifference(Object a, Object b) {
        return Binary.div(Binary.sub(a, b), Binary.add(a, b));
    }
}
