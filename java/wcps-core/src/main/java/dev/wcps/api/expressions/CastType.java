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

import static dev.wcps.api.WcpsClientException.Kind.INVALID_CAST_TYPE;

import com.google.common.base.Joiner;
import dev.wcps.api.WcpsClientException;
import java.util.Arrays;

/**
 * Cell types a value can be cast to with {@link Cast}.
 */
public enum CastType {
    BOOLEAN("boolean"),
    CHAR("char"),
    UNSIGNED_CHAR("unsigned char"),
    SHORT("short"),
    UNSIGNED_SHORT("unsigned short"),
    INT("int"),
    UNSIGNED_INT("unsigned int"),
    LONG("long"),
    UNSIGNED_LONG("unsigned long"),
    FLOAT("float"),
    DOUBLE("double"),
    CINT16("cint16"),
    CINT32("cint32"),
    COMPLEX("complex"),
    COMPLEX2("complex2"),
    ;

    private final String token;

    CastType(String token) {
        this.token = token;
    }

    /**
     * Look up a cell type by its WCPS name, e.g. {@code "unsigned char"}.
     */
    public static CastType fromString(String token) {
        String trimmed = token == null ? "" : token.trim();
        for (CastType type : values()) {
            if (type.token.equals(trimmed)) {
                return type;
            }
        }
        throw new WcpsClientException(
                INVALID_CAST_TYPE,
                "Invalid target cast type '" + trimmed + "', expected one of: "
                        + Joiner.on(", ").join(Arrays.asList(values())) + ".");
    }

    @Override
    public String toString() {
        return token;
    }
}
