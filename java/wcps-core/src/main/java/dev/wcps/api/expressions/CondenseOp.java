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

import static dev.wcps.api.WcpsClientException.Kind.INVALID_CONDENSE_OPERATOR;

import com.google.common.base.Joiner;
import dev.wcps.api.WcpsClientException;
import java.util.Arrays;

/**
 * Aggregation operators of a general {@link Condense}.
 */
public enum CondenseOp {
    PLUS("+"),
    MULTIPLY("*"),
    MIN("min"),
    MAX("max"),
    AND("and"),
    OR("or"),
    OVERLAY("overlay"),
    ;

    private final String token;

    CondenseOp(String token) {
        this.token = token;
    }

    public static CondenseOp fromString(String token) {
        String trimmed = token == null ? "" : token.trim();
        for (CondenseOp op : values()) {
            if (op.token.equals(trimmed)) {
                return op;
            }
        }
        throw new WcpsClientException(
                INVALID_CONDENSE_OPERATOR,
                "Invalid condense operation '" + trimmed + "', expected one of: "
                        + Joiner.on(", ").join(Arrays.asList(values())) + ".");
    }

    @Override
    public String toString() {
        return token;
    }
}
