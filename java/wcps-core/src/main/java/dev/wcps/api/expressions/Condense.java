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

import static dev.wcps.api.WcpsClientException.Kind.CONFLICTING_CONFIGURATION;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_CONDENSE_OPERATOR;
import static dev.wcps.api.WcpsClientException.Kind.MISSING_USING_CLAUSE;

import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.Optional;

/**
 * A general condense (aggregation) operation, rendered as
 * {@code (condense OP over $v1 ..., $v2 ... [where W] using U)}. For each point in the iteration domain the
 * {@code using} expression is evaluated, and the results are combined with the operator; the optional
 * {@code where} expression filters out points.
 * <pre>{@code
 * Datacube cov = Datacube.of("mycov");
 * AxisIter pt = AxisIter.of("$pt", "time").ofGridAxis(cov);
 * Condense.of(CondenseOp.PLUS).over(pt).using(cov.subset("time", pt.ref()));
 * }</pre>
 */
public final class Condense extends Iterating<Condense> {
    private final CondenseOp operator;
    private Expression using;
    private Expression where;

    private Condense(CondenseOp operator) {
        this.operator = operator;
    }

    public static Condense of(CondenseOp operator) {
        WcpsClientException.check(
                operator != null, INVALID_CONDENSE_OPERATOR, "No condense operation provided.");
        return new Condense(operator);
    }

    /**
     * @param operator one of the {@link CondenseOp} tokens, e.g. {@code "+"} or {@code "max"}
     */
    public static Condense of(String operator) {
        return new Condense(CondenseOp.fromString(operator));
    }

    @Override
    protected Condense self() {
        return this;
    }

    /**
     * The expression evaluated at every point of the iteration domain.
     */
    public Condense using(Object using) {
        WcpsClientException.check(this.using == null, CONFLICTING_CONFIGURATION, "The USING clause is already set.");
        this.using = addRequiredOperand(using, "using");
        return this;
    }

    /**
     * A filter evaluated at every point of the iteration domain; points where it is false are skipped.
     */
    public Condense where(Object where) {
        WcpsClientException.check(this.where == null, CONFLICTING_CONFIGURATION, "The WHERE clause is already set.");
        this.where = addRequiredOperand(where, "where");
        return this;
    }

    public CondenseOp getOperator() {
        return operator;
    }

    /**
     * @throws WcpsClientException of kind {@code MISSING_USING_CLAUSE} if no using expression was set
     */
    public Expression getUsing() {
        WcpsClientException.check(
                using != null,
                MISSING_USING_CLAUSE,
                "A USING clause is mandatory in a CONDENSE operation, none was specified.");
        return using;
    }

    public Optional<Expression> getWhere() {
        return Optional.ofNullable(where);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCondense(this);
    }
}
