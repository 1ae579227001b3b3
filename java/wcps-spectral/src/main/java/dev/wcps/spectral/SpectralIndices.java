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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lookup of the available spectral indices by their short name, e.g. {@code "NDVI"}.
 * <p>
 * Only the common broadband indices are provided: {@code AFRI1600, BAI, CIG, EVI, GNDVI, MSAVI, NBR, NDBI, NDMI,
 * NDSI, NDVI, NDWI, SAVI, VARI}. Not available are the red-edge vegetation indices (e.g. {@code NDVI705, CIRE}),
 * the other water and snow variants (e.g. {@code ANDWI, AWEInsh, MNDWI}), the soil and urban indices (e.g.
 * {@code BI, DBSI, BLFEI}), the other burn indices (e.g. {@code BAIS2, NBR2}), the thermal and radar (SAR)
 * indices, and the kernel indices. Any of them can be written as a {@link SpectralIndex} subclass from the
 * factories of {@code dev.wcps.api.expressions}.
 */
public final class SpectralIndices {
    private static final ImmutableMap<String, Entry> INDICES = ImmutableMap.<String, Entry>builder()
            .put(Afri1600.INFO.shortName(), new Entry(Afri1600.INFO, b -> Afri1600.of(b.apply("N"), b.apply("S1"))))
            .put(Bai.INFO.shortName(), new Entry(Bai.INFO, b -> Bai.of(b.apply("R"), b.apply("N"))))
            .put(Cig.INFO.shortName(), new Entry(Cig.INFO, b -> Cig.of(b.apply("N"), b.apply("G"))))
            .put(
                    Evi.INFO.shortName(),
                    new Entry(
                            Evi.INFO,
                            b -> Evi.of(
                                    b.apply("g"),
                                    b.apply("N"),
                                    b.apply("R"),
                                    b.apply("C1"),
                                    b.apply("C2"),
                                    b.apply("B"),
                                    b.apply("L"))))
            .put(Gndvi.INFO.shortName(), new Entry(Gndvi.INFO, b -> Gndvi.of(b.apply("N"), b.apply("G"))))
            .put(Msavi.INFO.shortName(), new Entry(Msavi.INFO, b -> Msavi.of(b.apply("N"), b.apply("R"))))
            .put(Nbr.INFO.shortName(), new Entry(Nbr.INFO, b -> Nbr.of(b.apply("N"), b.apply("S2"))))
            .put(Ndbi.INFO.shortName(), new Entry(Ndbi.INFO, b -> Ndbi.of(b.apply("S1"), b.apply("N"))))
            .put(Ndmi.INFO.shortName(), new Entry(Ndmi.INFO, b -> Ndmi.of(b.apply("N"), b.apply("S1"))))
            .put(Ndsi.INFO.shortName(), new Entry(Ndsi.INFO, b -> Ndsi.of(b.apply("G"), b.apply("S1"))))
            .put(Ndvi.INFO.shortName(), new Entry(Ndvi.INFO, b -> Ndvi.of(b.apply("N"), b.apply("R"))))
            .put(Ndwi.INFO.shortName(), new Entry(Ndwi.INFO, b -> Ndwi.of(b.apply("G"), b.apply("N"))))
            .put(Savi.INFO.shortName(), new Entry(Savi.INFO, b -> Savi.of(b.apply("L"), b.apply("N"), b.apply("R"))))
            .put(Vari.INFO.shortName(), new Entry(Vari.INFO, b -> Vari.of(b.apply("G"), b.apply("R"), b.apply("B"))))
            .build();

    private SpectralIndices() {}

    /**
     * Short names of all indices, in alphabetical order.
     */
    public static ImmutableSet<String> shortNames() {
        return INDICES.keySet();
    }

    public static Optional<SpectralIndexInfo> info(String shortName) {
        Entry entry = INDICES.get(shortName);
        return entry == null ? Optional.empty() : Optional.of(entry.info);
    }

    /**
     * Create the index {@code shortName} with its bands and constants given by name, e.g.
     * {@code create("NDVI", Map.of("N", nir, "R", red))}.
     *
     * @throws IllegalArgumentException if the index is unknown or a band of it is missing from {@code bands}
     */
    public static SpectralIndex create(String shortName, Map<String, ?> bands) {
        Entry entry = INDICES.get(shortName);
        Preconditions.checkArgument(entry != null, "Unknown spectral index %s", shortName);
        return entry.factory.apply(name -> {
            Object band = bands.get(name);
            Preconditions.checkArgument(band != null, "Missing band %s for spectral index %s", name, shortName);
            return band;
        });
    }

    private static final class Entry {
        private final SpectralIndexInfo info;
        private final Function<Function<String, Object>, SpectralIndex> factory;

        Entry(SpectralIndexInfo info, Function<Function<String, Object>, SpectralIndex> factory) {
            this.info = info;
            this.factory = factory;
        }
    }
}
