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

import static dev.wcps.api.WcpsClientException.Kind.DUPLICATE_DEFAULT;
import static dev.wcps.api.WcpsClientException.Kind.MISMATCHED_BRANCHES;
import static dev.wcps.api.WcpsClientException.Kind.MISSING_BRANCHES;
import static dev.wcps.api.WcpsClientException.Kind.MISSING_DEFAULT;

import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.ArrayList;
import java.util.List;

/**
 * Conditional evaluation, rendered as
 * {@code (switch case C1 return T1 case C2 return T2 ... default return D)}.
 * <p>
 * Branches are built with alternating {@link #when(Object)} and {@link #then(Object)} calls and closed with
 * {@link #otherwise(Object)}:
 * <pre>{@code
 * Switch.of().when(cov1.gt(5)).then(cov2).otherwise(cov1);
 * }</pre>
 */
public final class Switch extends Expression {
    private final List<Expression> conditions = new ArrayList<>();
    private final List<Expression> results = new ArrayList<>();
    private Expression otherwise;

    private Switch() {}

    public static Switch of() {
        return new Switch();
    }

    /**
     * Add the condition of a new branch.
     *
     * @throws WcpsClientException of kind {@code MISMATCHED_BRANCHES} if the previous condition has no result
     *     yet, or the default was already set
     */
    public Switch when(Object condition) {
        WcpsClientException.check(
                conditions.size() == results.size() && otherwise == null,
                MISMATCHED_BRANCHES,
                "A switch consists of alternating when/then expressions, finalized with an otherwise expression.");
        conditions.add(addRequiredOperand(condition, "case"));
        return this;
    }

    /**
     * Set the result of the branch opened by the last {@link #when(Object)}.
     */
    public Switch then(Object result) {
        WcpsClientException.check(
                conditions.size() == results.size() + 1,
                MISMATCHED_BRANCHES,
                "A switch consists of alternating when/then expressions, finalized with an otherwise expression.");
        results.add(addRequiredOperand(result, "then"));
        return this;
    }

    /**
     * Set the result used when no branch condition holds.
     */
    public Switch otherwise(Object result) {
        WcpsClientException.check(
                !results.isEmpty(),
                MISSING_BRANCHES,
                "In a switch the when/then expressions must be specified first, followed by the otherwise expression.");
        WcpsClientException.check(
                conditions.size() == results.size(),
                MISMATCHED_BRANCHES,
                "The last switch case has no then expression.");
        WcpsClientException.check(
                otherwise == null,
                DUPLICATE_DEFAULT,
                "A default expression has already been specified for this switch expression.");
        this.otherwise = addRequiredOperand(result, "default");
        return this;
    }

    /**
     * @throws WcpsClientException of kind {@code MISSING_BRANCHES} if no complete branch exists
     */
    public ImmutableList<Expression> getConditions() {
        checkBranches();
        return ImmutableList.copyOf(conditions.subList(0, results.size()));
    }

    public ImmutableList<Expression> getResults() {
        checkBranches();
        return ImmutableList.copyOf(results);
    }

    /**
     * @throws WcpsClientException of kind {@code MISSING_DEFAULT} if no default was set
     */
    public Expression getOtherwise() {
        WcpsClientException.check(
                otherwise != null,
                MISSING_DEFAULT,
                "No default expression has been specified for the switch expression.");
        return otherwise;
    }

    private void checkBranches() {
        WcpsClientException.check(
                !results.isEmpty(),
                MISSING_BRANCHES,
                "No case expressions have been specified for the switch expression.");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSwitch(this);
    }
}
