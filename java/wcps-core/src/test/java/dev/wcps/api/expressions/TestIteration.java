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

import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import dev.wcps.api.WcpsClientException.Kind;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public final class TestIteration {
    private static String body(Expression root) {
        String query = root.render();
        return query.substring(query.lastIndexOf('\n') + 3);
    }

    private static void assertKind(Kind kind, Executable executable) {
        assertEquals(kind, assertThrows(WcpsClientException.class, executable).getKind());
    }

    @Test
    public void testAxisIterDomains() {
        Datacube cov1 = Datacube.of("cov1");
        AxisIter px = AxisIter.of("px", "X").ofGeoAxis(cov1);
        AxisIter pt = AxisIter.of("$pt", "time").ofGridAxis(cov1);
        AxisIter x = AxisIter.of("$x", "X").interval(0, 100);
        Condense.of(CondenseOp.MAX).over(px, pt, x).using(cov1);

        assertEquals("$px X(domain($cov1, X))", px.render());
        assertEquals("$pt time(imageCrsDomain($cov1, time))", pt.render());
        assertEquals("$x X(0 : 100)", x.render());
        assertEquals("$px", px.getVarName());
        assertEquals(AxisIter.Domain.GEO_AXIS, px.getDomain());
    }

    @Test
    public void testAxisIterIntervalBounds() {
        Datacube cov = Datacube.of("cov");
        AxisIter x = AxisIter.of("$x", "X").interval(0.5, "$n");
        AxisIter y = AxisIter.of("$y", "Y").interval(0, FunctionCall.count(cov));
        Condense.of(CondenseOp.PLUS).over(x, y).using(cov);
        assertEquals("$x X(0.5 : $n)", x.render());
        assertEquals("$y Y(0 : count($cov))", y.render());
        assertKind(Kind.INVALID_OPERAND, () -> AxisIter.of("$z", "Z").interval(true, 1));
    }

    @Test
    public void testAxisIterConflictingDomains() {
        Datacube cov = Datacube.of("cov");
        assertKind(Kind.CONFLICTING_ITERATION_DOMAIN, () -> AxisIter.of("$x", "X").interval(0, 1).ofGridAxis(cov));
        assertKind(Kind.CONFLICTING_ITERATION_DOMAIN, () -> AxisIter.of("$x", "X").ofGridAxis(cov).ofGeoAxis(cov));
        assertKind(Kind.CONFLICTING_ITERATION_DOMAIN, () -> AxisIter.of("$x", "X").ofGeoAxis(cov).interval(0, 1));
        assertKind(Kind.EMPTY_NAME, () -> AxisIter.of("", "X"));
        assertKind(Kind.EMPTY_NAME, () -> AxisIter.of("$x", ""));
    }

    @Test
    public void testAxisIterWithoutDomain() {
        Datacube cov = Datacube.of("cov");
        Condense condense = Condense.of(CondenseOp.PLUS).over(AxisIter.of("$x", "X")).using(cov);
        assertKind(Kind.MISSING_ITERATION_DOMAIN, condense::render);
    }

    @Test
    public void testCondense() {
        Datacube cov1 = Datacube.of("cov1");
        AxisIter pt = AxisIter.of("$pt", "time").ofGridAxis(cov1);
        Condense condense = Condense.of(CondenseOp.PLUS).over(pt).using(cov1.add(pt.ref()));
        assertEquals(
                "for $cov1 in (cov1)\nreturn\n  "
                        + "(condense + over $pt time(imageCrsDomain($cov1, time)) using ($cov1 + $pt))",
                condense.render());
    }

    @Test
    public void testCondenseWhere() {
        Datacube cov = Datacube.of("cov");
        AxisIter x = AxisIter.of("$x", "X").interval(0, 10);
        AxisIter y = AxisIter.of("$y", "Y").interval(0, 20);
        Condense condense = Condense.of("max")
                .over(x)
                .over(List.of(y))
                .where(cov.subset(new Object[] {"X", x.ref()}, new Object[] {"Y", y.ref()}).gt(0))
                .using(cov.subset(new Object[] {"X", x.ref()}, new Object[] {"Y", y.ref()}));
        assertEquals(
                "(condense max over $x X(0 : 10), $y Y(0 : 20) where ($cov[X($x), Y($y)] > 0) using $cov[X($x), Y($y)])",
                body(condense));
        assertEquals(ImmutableList.of(x, y), condense.getIterators());
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> condense.where(true));
        assertKind(Kind.CONFLICTING_CONFIGURATION, () -> condense.using(1));
    }

    @Test
    public void testCondenseMissingClauses() {
        Datacube cov = Datacube.of("cov");
        assertKind(Kind.MISSING_OVER_CLAUSE, () -> Condense.of(CondenseOp.PLUS).using(cov).render());
        assertKind(
                Kind.MISSING_USING_CLAUSE,
                () -> Condense.of(CondenseOp.PLUS).over(AxisIter.of("$x", "X").ofGridAxis(cov)).render());
    }

    @Test
    public void testCondenseOperators() {
        assertEquals(CondenseOp.OVERLAY, CondenseOp.fromString(" overlay"));
        assertEquals("*", CondenseOp.MULTIPLY.toString());
        assertKind(Kind.INVALID_CONDENSE_OPERATOR, () -> Condense.of("-"));
        assertKind(Kind.INVALID_CONDENSE_OPERATOR, () -> Condense.of((CondenseOp) null));
    }

    @Test
    public void testDuplicateIteratorNames() {
        AxisIter x = AxisIter.of("$x", "X").interval(0, 10);
        Condense condense = Condense.of(CondenseOp.PLUS).over(x);
        assertKind(Kind.DUPLICATE_ITERATOR_NAME, () -> condense.over(AxisIter.of("x", "Y").interval(0, 5)));
        assertKind(
                Kind.DUPLICATE_ITERATOR_NAME,
                () -> Coverage.of("c").over(AxisIter.of("$i", "X").interval(0, 1), AxisIter.of("$i", "Y").interval(0, 1)));
    }

    @Test
    public void testCoverage() {
        Datacube cov1 = Datacube.of("cov1");
        AxisIter lat = AxisIter.of("$pLat", "Lat").ofGeoAxis(cov1.subset("Lat", -30, -28.5));
        AxisIter lon = AxisIter.of("$pLon", "Lon").ofGeoAxis(cov1.subset("Lon", 111.975, 113.475));
        Coverage coverage = Coverage.of("targetCoverage")
                .over(lat)
                .over(lon)
                .values(cov1.subset(new Object[] {"Lat", lat.ref()}, new Object[] {"Lon", lon.ref()}));
        assertEquals(
                "for $cov1 in (cov1)\nreturn\n  (coverage targetCoverage over "
                        + "$pLat Lat(domain($cov1[Lat(-30:-28.5)], Lat)), "
                        + "$pLon Lon(domain($cov1[Lon(111.975:113.475)], Lon)) "
                        + "values $cov1[Lat($pLat), Lon($pLon)])",
                coverage.render());
    }

    @Test
    public void testCoverageValueList() {
        Datacube cov = Datacube.of("cov");
        Coverage coverage = Coverage.of("grid")
                .over(AxisIter.of("$x", "X").ofGridAxis(cov))
                .valueList(1, 2.5, -3);
        assertEquals("(coverage grid over $x X(imageCrsDomain($cov, X)) value list < 1; 2.5; -3 >)", body(coverage));
        assertKind(Kind.INVALID_OPERAND, () -> Coverage.of("c").valueList("a"));
        assertKind(Kind.INVALID_OPERAND, () -> Coverage.of("c").valueList(List.of()));
    }

    @Test
    public void testCoverageValuesClause() {
        Datacube cov = Datacube.of("cov");
        assertKind(Kind.CONFLICTING_VALUES_SPECIFICATION, () -> Coverage.of("c").values(cov).valueList(1));
        assertKind(Kind.CONFLICTING_VALUES_SPECIFICATION, () -> Coverage.of("c").valueList(1).values(cov));
        assertKind(
                Kind.MISSING_VALUES_CLAUSE,
                () -> Coverage.of("c").over(AxisIter.of("$x", "X").ofGridAxis(cov)).render());
        assertKind(Kind.MISSING_OVER_CLAUSE, () -> Coverage.of("c").values(cov).render());
        assertKind(Kind.EMPTY_NAME, () -> Coverage.of(""));
    }
}
