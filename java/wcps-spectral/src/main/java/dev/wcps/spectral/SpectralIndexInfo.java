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

import java.util.List;
import org.immutables.value.Value;

/**
 * Description of a {@link SpectralIndex}, following the catalogue at
 * https://awesome-ee-spectral-indices.readthedocs.io.
 */
@Value.Immutable
public interface SpectralIndexInfo {
    /**
     * Acronym of the index, e.g. {@code NDVI}.
     */
    String shortName();

    String longName();

    /**
     * Band and constant names, in the order the index factory takes them.
     */
    List<String> bands();

    /**
     * The formula over {@link #bands()}, in the catalogue's notation.
     */
    String formula();

    /**
     * Sensors the index applies to.
     */
    List<String> platforms();

    /**
     * Link to the publication defining the index.
     */
    String reference();

    static ImmutableSpectralIndexInfo.Builder builder() {
        return ImmutableSpectralIndexInfo.builder();
    }
}
