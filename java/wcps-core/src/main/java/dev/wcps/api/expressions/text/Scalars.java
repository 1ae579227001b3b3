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

import dev.wcps.api.expressions.Axis;
import dev.wcps.api.expressions.Scalar;
import java.math.BigDecimal;

/**
 * Text forms of scalar values.
 */
final class Scalars {
    private Scalars() {}

    static String format(Scalar scalar) {
        Object value = scalar.getValue();
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        return formatRaw(value);
    }

    /**
     * Format a bound of an axis subset, where the open bound {@code "*"} is not quoted.
     */
    static String formatBound(Scalar scalar) {
        if (Axis.MIN.equals(scalar.getValue())) {
            return Axis.MIN;
        }
        return format(scalar);
    }

    /**
     * Format a value without quoting strings.
     */
    static String formatRaw(Object value) {
        if (value instanceof Double || value instanceof Float) {
            String text = value.toString();
            if (text.indexOf('E') < 0) {
                return text;
            }
            // no exponent notation in WCPS, and the decimal point keeps it a floating-point literal
            String plain = new BigDecimal(text).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return value.toString();
    }
}
