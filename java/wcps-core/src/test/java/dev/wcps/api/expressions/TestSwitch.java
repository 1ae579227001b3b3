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

import dev.wcps.api.WcpsClientException;
import dev.wcps.api.WcpsClientException.Kind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public final class TestSwitch {
    private static void assertKind(Kind kind, Executable executable) {
        assertEquals(kind, assertThrows(WcpsClientException.class, executable).getKind());
    }

    @Test
    public void testSingleBranch() {
        Datacube a = Datacube.of("A");
        Datacube b = Datacube.of("B");
        Switch switchExpr = Switch.of().when(a.gt(5)).then(b).otherwise(a);
        assertEquals(
                "for $A in (A), $B in (B)\nreturn\n  (switch case ($A > 5) return $B default return $A)",
                switchExpr.render());
    }

    @Test
    public void testBranchesWithScalars() {
        Datacube cov1 = Datacube.of("cov1");
        Switch switchExpr = Switch.of()
                .when(cov1.lt(0))
                .then(0)
                .when(cov1.gt(100))
                .then(100)
                .otherwise(cov1);
        assertEquals(
                "(switch case ($cov1 < 0) return 0 case ($cov1 > 100) return 100 default return $cov1)",
                switchExpr.render().split("\n  ")[1]);
        assertEquals(2, switchExpr.getConditions().size());
    }

    @Test
    public void testNestedSwitch() {
        Datacube cov = Datacube.of("cov");
        Switch inner = Switch.of().when(cov.gt(10)).then(2).otherwise(1);
        Switch outer = Switch.of().when(cov.gt(0)).then(inner).otherwise(0);
        assertEquals(
                "(switch case ($cov > 0) return (switch case ($cov > 10) return 2 default return 1) default return 0)",
                outer.render().split("\n  ")[1]);
    }

    @Test
    public void testOutOfOrderCalls() {
        Datacube cov = Datacube.of("cov");
        assertKind(Kind.MISMATCHED_BRANCHES, () -> Switch.of().then(cov));
        assertKind(Kind.MISMATCHED_BRANCHES, () -> Switch.of().when(cov).when(cov));
        assertKind(Kind.MISMATCHED_BRANCHES, () -> Switch.of().when(cov).then(1).then(2));
        assertKind(Kind.MISSING_BRANCHES, () -> Switch.of().otherwise(cov));
        assertKind(Kind.MISMATCHED_BRANCHES, () -> Switch.of().when(cov).then(1).when(cov).otherwise(2));
        assertKind(Kind.DUPLICATE_DEFAULT, () -> Switch.of().when(cov).then(1).otherwise(2).otherwise(3));
        assertKind(Kind.MISMATCHED_BRANCHES, () -> Switch.of().when(cov).then(1).otherwise(2).when(cov));
    }

    @Test
    public void testIncompleteSwitch() {
        Datacube cov = Datacube.of("cov");
        assertKind(Kind.MISSING_DEFAULT, () -> Switch.of().when(cov.gt(0)).then(1).render());
        assertKind(Kind.MISSING_BRANCHES, () -> Datacube.of("cov").add(Switch.of()).render());
        assertKind(Kind.NO_DATASET_REFERENCED, () -> Switch.of().render());
    }
}
