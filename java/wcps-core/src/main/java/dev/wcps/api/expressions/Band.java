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

import static dev.wcps.api.WcpsClientException.Kind.EMPTY_NAME;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;

import com.google.common.base.Strings;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;

/**
 * Select a field (band, channel) of a multiband operand, rendered as {@code child.field}.
 */
public final class Band extends Expression {
    private final String field;
    private final Expression child;

    private Band(Object child, String field) {
        this.field = field;
        this.child = addRequiredOperand(child, "multiband");
    }

    public static Band of(Object child, String field) {
        WcpsClientException.check(!Strings.isNullOrEmpty(field), EMPTY_NAME, "Band name must not be empty.");
        return new Band(child, field);
    }

    /**
     * Select a band by its 0-based position.
     */
    public static Band of(Object child, int index) {
        WcpsClientException.check(index >= 0, INVALID_OPERAND, "Band index must not be negative, got %s.", index);
        return new Band(child, Integer.toString(index));
    }

    public Expression getChild() {
        return child;
    }

    public String getField() {
        return field;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBand(this);
    }
}
