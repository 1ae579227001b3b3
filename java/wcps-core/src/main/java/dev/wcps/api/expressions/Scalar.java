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

import com.google.common.base.Preconditions;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A scalar value: an integer or floating point number, a string, or a boolean.
 */
public final class Scalar extends Expression {
    private final Object value;

    private Scalar(Object value) {
        this.value = value;
    }

    public static Scalar of(long value) {
        return new Scalar(value);
    }

    public static Scalar of(double value) {
        WcpsClientException.check(
                Double.isFinite(value), INVALID_OPERAND, "Scalar value must be finite, got %s.", value);
        return new Scalar(value);
    }

    public static Scalar of(String value) {
        Preconditions.checkNotNull(value, "value");
        return new Scalar(value);
    }

    public static Scalar of(boolean value) {
        return new Scalar(value);
    }

    /**
     * Wrap a boxed number, string or boolean.
     */
    public static Scalar of(Object value) {
        WcpsClientException.check(
                isScalarValue(value),
                INVALID_OPERAND,
                "Invalid scalar type %s, expected a number, string or boolean.",
                value == null ? "null" : value.getClass().getName());
        if (value instanceof Double || value instanceof Float) {
            WcpsClientException.check(
                    Double.isFinite(((Number) value).doubleValue()),
                    INVALID_OPERAND,
                    "Scalar value must be finite, got %s.",
                    value);
        }
        return new Scalar(value);
    }

    static boolean isScalarValue(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof Double
                || value instanceof Float
                || value instanceof BigDecimal
                || value instanceof BigInteger
                || value instanceof String
                || value instanceof Boolean;
    }

    public Object getValue() {
        return value;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitScalar(this);
    }
}
