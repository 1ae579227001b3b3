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
package dev.wcps.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.wcps.api.expressions.*;
import org.junit.jupiter.api.Test;

public final class TestOptions {
    private static String body(Expression root) {
        String query = root.render();
        return query.substring(query.lastIndexOf('\n') + 3);
    }

    @Test
    public void testScaleOptions() {
        assertEquals(
                "scale($cov, 0.5)", body(Datacube.of("cov").scale(ScaleOptions.builder().factor(0.5).build())));
        assertEquals(
                "scale($cov, { X(0:99), Y(0:49) })",
                body(Datacube.of("cov")
                        .scale(ScaleOptions.builder()
                                .addGridAxes(Axis.of("X", 0, 99), Axis.of("Y", 0, 49))
                                .build())));
        assertEquals(
                "scale($cov, { imageCrsDomain($other) })",
                body(Datacube.of("cov")
                        .scale(ScaleOptions.builder()
                                .gridDomainOf(Datacube.of("other"))
                                .build())));
        assertEquals(
                "scale($cov, { X(2) })",
                body(Datacube.of("cov")
                        .scale(ScaleOptions.builder().addAxisFactors(Axis.of("X", 2)).build())));
    }

    @Test
    public void testScaleOptionsNeedExactlyOneTarget() {
        ScaleOptions none = ScaleOptions.builder().build();
        WcpsClientException missing = assertThrows(WcpsClientException.class, () -> Datacube.of("cov").scale(none));
        assertEquals(WcpsClientException.Kind.INCOMPLETE_CONFIGURATION, missing.getKind());

        ScaleOptions two = ScaleOptions.builder()
                .factor(2)
                .addAxisFactors(Axis.of("X", 2))
                .build();
        WcpsClientException conflict = assertThrows(WcpsClientException.class, () -> Datacube.of("cov").scale(two));
        assertEquals(WcpsClientException.Kind.CONFLICTING_CONFIGURATION, conflict.getKind());
    }

    @Test
    public void testReprojectOptions() {
        assertEquals(
                "crsTransform($cov, \"EPSG:4326\")", body(Datacube.of("cov").reproject(ReprojectOptions.of("EPSG:4326"))));
        ReprojectOptions options = ReprojectOptions.builder()
                .targetCrs("EPSG:32633")
                .interpolation(ResampleAlg.NEAR)
                .addAxisResolutions(Axis.of("E", 10), Axis.of("N", 10))
                .addAxisSubsets(Axis.of("E", 0, 1000), Axis.of("N", 0, 2000))
                .build();
        assertEquals(
                "crsTransform($cov, \"EPSG:32633\", { near }, { E:10, N:10 }, { E(0:1000), N(0:2000) })",
                body(Datacube.of("cov").reproject(options)));
    }

    @Test
    public void testReprojectOptionsCropConflict() {
        ReprojectOptions options = ReprojectOptions.builder()
                .targetCrs("EPSG:4326")
                .addAxisSubsets(Axis.of("X", 0, 10))
                .domainOf(Datacube.of("other"))
                .build();
        WcpsClientException e = assertThrows(WcpsClientException.class, () -> Datacube.of("cov").reproject(options));
        assertEquals(WcpsClientException.Kind.CONFLICTING_CONFIGURATION, e.getKind());
    }
}
