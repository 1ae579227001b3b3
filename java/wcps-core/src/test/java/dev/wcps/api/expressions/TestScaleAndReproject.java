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
package dev.wcps.api.expressions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import dev.wcps.api.WcpsClientException.Kind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public final class TestScaleAndReproject {
    private static String body(Expression root) {
        String query = root.render();
        return query.substring(query.lastIndexOf('\n') + 3);
    }

    private static void assertKind(Kind kind, Executable executable) {
        assertEquals(kind, assertThrows(WcpsClientException.class, executable).getKind());
    }

    @Test
    public void testScaleToGridAxes() {
        Scale scale = Datacube.of("cov1")
                .scale()
                .toExplicitGridDomain(new Object[] {"X", 15, 30}, new Object[] {"Y", 20, 40});
        assertEquals("scale($cov1, { X(15:30), Y(20:40) })", body(scale));
        assertEquals(Scale.Mode.GRID_AXES, scale.getMode());
    }

    @Test
    public void testScaleToGridDomainOf() {
        Scale scale = Datacube.of("cov1").scale().toGridDomainOf(Datacube.of("cov2"));
        assertEquals(
                "for $cov1 in (cov1), $cov2 in (cov2)\nreturn\n  scale($cov1, { imageCrsDomain($cov2) })",
                scale.render());
    }

    @Test
    public void testScaleByFactor() {
        assertEquals("scale($cov1, 2.0)", body(Datacube.of("cov1").scale().byFactor(2.0)));
        assertEquals("scale($cov1, 2)", body(Datacube.of("cov1").scale().byFactor(2)));
        assertEquals(
                "scale($cov1, { X(1.5), Y(2) })",
                body(Datacube.of("cov1").scale().byFactorPerAxis(new Object[] {"X", 1.5}, new Object[] {"Y", 2})));
    }

    @Test
    public void testScaleFactorMustBePositive() {
        assertKind(Kind.INVALID_SCALE_FACTOR, () -> Datacube.of("cov").scale().byFactor(0));
        assertKind(Kind.INVALID_SCALE_FACTOR, () -> Datacube.of("cov").scale().byFactor(-1.5));
        assertKind(Kind.INVALID_SCALE_FACTOR, () -> Datacube.of("cov").scale().byFactorPerAxis("X", 0));
        assertKind(Kind.INVALID_SCALE_FACTOR, () -> Datacube.of("cov").scale().byFactorPerAxis("X", "2"));
    }

    @Test
    public void testScaleAxisFactorConstraints() {
        assertKind(Kind.INVALID_AXIS_CONSTRAINT, () -> Datacube.of("cov").scale().byFactorPerAxis("X", 1, 2));
        assertKind(
                Kind.INVALID_AXIS_CONSTRAINT,
                () -> Datacube.of("cov").scale().byFactorPerAxis(Axis.of("X", 1, null, "EPSG:4326")));
    }

    @Test
    public void testScaleOnlyOneMode() {
        Scale scale = Datacube.of("cov").scale().byFactor(2);
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> scale.byFactor(3));
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> scale.toGridDomainOf(Datacube.of("other")));
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> scale.toExplicitGridDomain("X", 0, 10));
        // the mode conflict is reported before the factor is validated
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> scale.byFactorPerAxis("X", -1));
        assertEquals("scale($cov, 2)", body(scale));
    }

    @Test
    public void testScaleWithoutMode() {
        assertKind(Kind.INCOMPLETE_CONFIGURATION, () -> Datacube.of("cov").scale().render());
    }

    @Test
    public void testReprojectWithInterpolation() {
        assertEquals(
                "crsTransform($cov1, \"EPSG:4326\", { average })",
                body(Reproject.of(Datacube.of("cov1"), "EPSG:4326", ResampleAlg.AVERAGE)));
        assertEquals(
                "crsTransform($cov1, \"EPSG:4326\", { bilinear })",
                body(Reproject.of(Datacube.of("cov1"), "EPSG:4326", " bilinear ")));
        assertEquals("crsTransform($cov1, \"EPSG:4326\")", body(Datacube.of("cov1").reproject("EPSG:4326")));
        assertEquals(
                "crsTransform($cov1, \"EPSG:4326\")",
                body(Reproject.of(Datacube.of("cov1"), "EPSG:4326", (String) null)));
    }

    @Test
    public void testReprojectToCoverageDomain() {
        Reproject reproject = Datacube.of("cov1").reproject("EPSG:4326").subsetByCoverageDomain(Datacube.of("cov2"));
        assertEquals("crsTransform($cov1, \"EPSG:4326\", { domain($cov2) })", body(reproject));
    }

    @Test
    public void testReprojectToResolutions() {
        Reproject reproject = Reproject.of(Datacube.of("cov1"), "EPSG:4326", "average")
                .toAxisResolutions(new Object[] {"X", 1.5}, new Object[] {"Y", 2});
        assertEquals("crsTransform($cov1, \"EPSG:4326\", { average }, { X:1.5, Y:2 })", body(reproject));
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> reproject.toAxisResolutions("X", 3));
        assertKind(
                Kind.INVALID_AXIS_CONSTRAINT,
                () -> Datacube.of("cov").reproject("EPSG:4326").toAxisResolutions("X", 1, 2));
    }

    @Test
    public void testReprojectSubset() {
        Reproject reproject = Datacube.of("cov1")
                .reproject("EPSG:4326")
                .subsetByAxes(new Object[] {"X", 1.5, 2.5}, new Object[] {"Y", 2, 4});
        assertEquals("crsTransform($cov1, \"EPSG:4326\", { X(1.5:2.5), Y(2:4) })", body(reproject));
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> reproject.subsetByCoverageDomain(Datacube.of("cov2")));
        assertKind(
                Kind.INVALID_AXIS_CONSTRAINT, () -> Datacube.of("cov").reproject("EPSG:4326").subsetByAxes("X", 1));
        assertKind(
                Kind.INVALID_AXIS_CONSTRAINT,
                () -> Datacube.of("cov").reproject("EPSG:4326").subsetByAxes("X", 1, 2, "EPSG:32633"));
    }

    @Test
    public void testReprojectResolutionsAndCrop() {
        Reproject reproject = Datacube.of("cov1")
                .reproject("EPSG:4326")
                .toAxisResolutions("X", 10)
                .subsetByCoverageDomain(Datacube.of("cov2"));
        assertEquals("crsTransform($cov1, \"EPSG:4326\", { X:10 }, { domain($cov2) })", body(reproject));
    }

    @Test
    public void testReprojectArguments() {
        assertKind(Kind.EMPTY_CRS, () -> Datacube.of("cov").reproject(""));
        assertKind(Kind.EMPTY_CRS, () -> Datacube.of("cov").reproject("  "));
        assertKind(Kind.INVALID_INTERPOLATION, () -> Reproject.of(Datacube.of("cov"), "EPSG:4326", "nearest"));
        assertEquals(ResampleAlg.Q3, ResampleAlg.fromString("q3"));
    }
}
