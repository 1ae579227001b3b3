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
package dev.wcps.api;

import com.google.common.base.Strings;

/**
 * Thrown when an expression tree is built or rendered in a way the WCPS grammar does not allow.
 * <p>
 * Every failure is a misuse of the builder API, so none of them is retryable. The {@link Kind}
 * identifies which precondition was violated.
 */
public final class WcpsClientException extends RuntimeException {
    private final Kind kind;

    public WcpsClientException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Throw a {@link WcpsClientException} of the given kind unless {@code condition} holds. The message is
     * formatted with {@link Strings#lenientFormat(String, Object...)}.
     */
    public static void check(boolean condition, Kind kind, String template, Object... args) {
        if (!condition) {
            throw new WcpsClientException(kind, Strings.lenientFormat(template, args));
        }
    }

    public enum Kind {
        INVALID_OPERAND,
        NO_DATASET_REFERENCED,
        INVALID_AXIS_SHAPE,
        // scale and reproject
        CONFLICTING_CONFIGURATION,
        INCOMPLETE_CONFIGURATION,
        INVALID_SCALE_FACTOR,
        INVALID_AXIS_CONSTRAINT,
        EMPTY_CRS,
        INVALID_INTERPOLATION,
        // enumerated tokens
        INVALID_CAST_TYPE,
        INVALID_CONDENSE_OPERATOR,
        INVALID_GEOMETRY,
        EMPTY_NAME,
        // iteration
        CONFLICTING_ITERATION_DOMAIN,
        MISSING_ITERATION_DOMAIN,
        DUPLICATE_ITERATOR_NAME,
        MISSING_OVER_CLAUSE,
        MISSING_USING_CLAUSE,
        MISSING_VALUES_CLAUSE,
        CONFLICTING_VALUES_SPECIFICATION,
        // switch
        MISMATCHED_BRANCHES,
        MISSING_BRANCHES,
        MISSING_DEFAULT,
        DUPLICATE_DEFAULT,
        ;
    }
}
