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

import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;

import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;

/**
 * Turns caller supplied values into tree nodes.
 */
public final class Operands {
    private Operands() {}

    /**
     * @return {@code value} itself if it is an {@link Expression}, a {@link Scalar} wrapping it if it is a
     *     number, string or boolean, or {@code null} if it is {@code null}
     * @throws WcpsClientException of kind {@code INVALID_OPERAND} for any other type
     */
    public static Expression of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Expression) {
            return (Expression) value;
        }
        if (Scalar.isScalarValue(value)) {
            return Scalar.of(value);
        }
        throw new WcpsClientException(
                INVALID_OPERAND,
                "Invalid operand type " + value.getClass().getName() + ", expected an Expression or a scalar value.");
    }
}
