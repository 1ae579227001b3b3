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
package dev.wcps.api.expressions.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import dev.wcps.api.expressions.*;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

public final class TestExpressionRendering {
    private static final String RETURN = "\nreturn\n  ";

    private static String body(Expression root) {
        String query = root.render();
        return query.substring(query.indexOf(RETURN) + RETURN.length());
    }

    @Test
    public void testPrologueDeclaresEachDatacubeOnceSortedByName() {
        Datacube cov2 = Datacube.of("cov2");
        Datacube cov1 = Datacube.of("cov1");
        Expression query = cov2.add(cov1).mul(Datacube.of("cov2"));
        assertEquals("for $cov1 in (cov1), $cov2 in (cov2)\nreturn\n  (($cov2 + $cov1) * $cov2)", query.render());
    }

    @Test
    public void testSingleDatacube() {
        assertEquals("for $cov1 in (cov1)\nreturn\n  $cov1", Datacube.of("cov1").render());
    }

    @Test
    public void testNonRootRendersBodyOnly() {
        Datacube cov1 = Datacube.of("cov1");
        Binary sum = cov1.add(Datacube.of("cov2"));
        Not negated = Not.of(sum);
        assertEquals("($cov1 + $cov2)", sum.render());
        assertEquals("$cov1", cov1.render());
        assertEquals("$cov1", cov1.toString());
        assertEquals(negated.render(), negated.toString());
    }

    @Test
    public void testRootWithoutDatacubeFails() {
        WcpsClientException e = assertThrows(WcpsClientException.class, () -> Binary.add(1, 2).render());
        assertEquals(WcpsClientException.Kind.NO_DATASET_REFERENCED, e.getKind());
        assertEquals("for $c in (c)\nreturn\n  $c", Datacube.of("c").render());
    }

    @Test
    public void testScalars() {
        Datacube cov = Datacube.of("cov");
        assertEquals("($cov + 2)", body(cov.add(2)));
        assertEquals("($cov + 2.5)", body(Datacube.of("cov").add(2.5)));
        assertEquals("($cov * 0.00001)", body(Datacube.of("cov").mul(1e-5)));
        assertEquals("($cov * 10000000000.0)", body(Datacube.of("cov").mul(1e10)));
        assertEquals("($cov * 10000000.0)", body(Datacube.of("cov").mul(1e7)));
        assertEquals("($cov * 10000000)", body(Datacube.of("cov").mul(10000000L)));
        assertEquals("($cov + 1.5)", body(Datacube.of("cov").add(1.5f)));
        assertEquals("($cov + 0.10)", body(Datacube.of("cov").add(new BigDecimal("0.10"))));
        assertEquals("($cov = \"abc\")", body(Datacube.of("cov").eq("abc")));
        assertEquals("($cov and true)", body(Datacube.of("cov").and(true)));
    }

    @Test
    public void testOperators() {
        Datacube cov1 = Datacube.of("cov1");
        Datacube cov2 = Datacube.of("cov2");
        assertEquals("($cov1 + $cov2)", body(cov1.add(cov2)));
        assertEquals("($cov1 - $cov2)", body(cov1.sub(cov2)));
        assertEquals("($cov1 / $cov2)", body(cov1.div(cov2)));
        assertEquals("($cov1 >= $cov2)", body(cov1.gtEq(cov2)));
        assertEquals("($cov1 != $cov2)", body(cov1.notEq(cov2)));
        assertEquals("($cov1 < 5)", body(cov1.lt(5)));
        assertEquals("($cov1 <= 5)", body(cov1.ltEq(5)));
        assertEquals("($cov1 xor $cov2)", body(cov1.xor(cov2)));
        assertEquals("($cov1 overlay $cov2)", body(cov1.overlay(cov2)));
        assertEquals("(not $cov1)", body(cov1.not()));
        assertEquals("((($cov1 > 1) and ($cov1 < 5)) and $cov2)", body(Binary.and(cov1.gt(1), cov1.lt(5), cov2)));
        assertEquals("(($cov1 or $cov2) or false)", body(Binary.or(cov1, cov2, false)));
    }

    @Test
    public void testFunctions() {
        Datacube cov1 = Datacube.of("cov1");
        Datacube cov2 = Datacube.of("cov2");
        assertEquals("mod($cov1, $cov2)", body(cov1.mod(cov2)));
        assertEquals("pow($cov1, 2)", body(cov1.pow(2)));
        assertEquals("bit($cov1, 3)", body(cov1.bit(3)));
        assertEquals("sqrt(abs($cov1))", body(cov1.abs().sqrt()));
        assertEquals("arctan2($cov1)", body(cov1.arctan2()));
        assertEquals("avg($cov1)", body(cov1.avg()));
        assertEquals("count(($cov1 > 0))", body(cov1.gt(0).count()));
        assertThrows(IllegalArgumentException.class, () -> FunctionCall.of(FunctionCall.FunctionName.MOD, cov1));
    }

    @Test
    public void testBands() {
        Datacube cov1 = Datacube.of("cov1");
        assertEquals("$cov1.red", body(cov1.band("red")));
        assertEquals("$cov1.0", body(Datacube.of("cov1").band(0)));
        assertEquals("{red: $cov1; blue: 2}", body(MultiBand.of(ImmutableMap.of("red", Datacube.of("cov1"), "blue", 2))));
        Datacube cov = Datacube.of("cov");
        assertEquals(
                "{red: $cov.red; green: $cov.green; blue: $cov.blue}",
                body(MultiBand.rgb(cov.band("red"), cov.band("green"), cov.band("blue"))));
        assertThrows(WcpsClientException.class, () -> Datacube.of("cov").band(-1));
        assertThrows(WcpsClientException.class, () -> Datacube.of("cov").band(""));
    }

    @Test
    public void testCast() {
        assertEquals("((int) $cov1)", body(Datacube.of("cov1").cast(CastType.INT)));
        assertEquals("((unsigned char) $cov1)", body(Cast.of(Datacube.of("cov1"), "unsigned char")));
        assertEquals("((float) $cov1)", body(Cast.of(Datacube.of("cov1")).to(CastType.FLOAT)));

        WcpsClientException invalid =
                assertThrows(WcpsClientException.class, () -> Cast.of(Datacube.of("cov1"), "quad"));
        assertEquals(WcpsClientException.Kind.INVALID_CAST_TYPE, invalid.getKind());
        WcpsClientException incomplete =
                assertThrows(WcpsClientException.class, () -> Cast.of(Datacube.of("cov1")).render());
        assertEquals(WcpsClientException.Kind.INCOMPLETE_CONFIGURATION, incomplete.getKind());
    }

    @Test
    public void testClip() {
        String wkt = "POLYGON((13589894.568 -2015496.69612, 15086830.0246 -1780682.3822))";
        assertEquals("clip($cov, " + wkt + ")", body(Datacube.of("cov").clip(wkt)));
        assertEquals(
                "clip($cov, CURTAIN(projection(Lat, Long), Polygon((25 40, 30 40, 30 45, 30 42))))",
                body(Clip.of(Datacube.of("cov"), "CURTAIN(projection(Lat, Long), Polygon((25 40, 30 40, 30 45, 30 42)))")));

        WcpsClientException e = assertThrows(WcpsClientException.class, () -> Datacube.of("cov").clip("POINT(1 2)"));
        assertEquals(WcpsClientException.Kind.INVALID_GEOMETRY, e.getKind());
        assertThrows(WcpsClientException.class, () -> Datacube.of("cov").clip("POLYGONS((1 2))"));
    }

    @Test
    public void testUdf() {
        Datacube cov1 = Datacube.of("cov1");
        assertEquals("image.stretch($cov1, 2)", body(Udf.of("image.stretch", cov1, 2)));
        WcpsClientException e = assertThrows(WcpsClientException.class, () -> Udf.of("", cov1));
        assertEquals(WcpsClientException.Kind.EMPTY_NAME, e.getKind());
    }

    @Test
    public void testEncode() {
        assertEquals("encode($cov1, \"PNG\", \"params\")", body(Datacube.of("cov1").encode("PNG").params("params")));
        assertEquals("encode($cov1, \"GTiff\")", body(Encode.of(Datacube.of("cov1")).to("GTiff")));
        assertEquals(
                "encode($cov1, \"GTiff\", \"{\\\"nodata\\\": [0]}\")",
                body(Datacube.of("cov1").encode("GTiff").params("{\"nodata\": [0]}")));
        assertEquals(
                "encode($cov1, \"GTiff\", \"{\\\"nodata\\\": [0]}\")",
                body(Datacube.of("cov1").encode("GTiff").params("{\\\"nodata\\\": [0]}")));

        WcpsClientException e = assertThrows(WcpsClientException.class, () -> Datacube.of("cov1").encode().render());
        assertEquals(WcpsClientException.Kind.INCOMPLETE_CONFIGURATION, e.getKind());
    }
}
