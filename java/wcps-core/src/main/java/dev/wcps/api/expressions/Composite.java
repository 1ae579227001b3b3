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

import dev.wcps.api.Expression;

/**
 * Base class for named expressions that are defined in terms of other expressions, e.g. spectral indices.
 * The wrapped expression is the only operand and is rendered in place of this node.
 */
public abstract class Composite extends Expression {
    private final Expression expression;

    protected Composite(Object expression) {
        this.expression = addRequiredOperand(expression, getClass().getSimpleName());
    }

    public final Expression getExpression() {
        return expression;
    }

    @Override
    public final <T> T accept(Visitor<T> visitor) {
        return visitor.visitComposite(this);
    }
}
