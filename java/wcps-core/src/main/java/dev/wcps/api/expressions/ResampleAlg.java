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

import static dev.wcps.api.WcpsClientException.Kind.INVALID_INTERPOLATION;

import com.google.common.base.Joiner;
import dev.wcps.api.WcpsClientException;
import java.util.Arrays;

/**
 * Interpolation methods for {@link Reproject}.
 */
public enum ResampleAlg {
    NEAR("near"),
    BILINEAR("bilinear"),
    CUBIC("cubic"),
    CUBICSPLINE("cubicspline"),
    LANCZOS("lanczos"),
    AVERAGE("average"),
    MODE("mode"),
    MAX("max"),
    MIN("min"),
    MED("med"),
    Q1("q1"),
    Q3("q3"),
    ;

    private final String token;

    ResampleAlg(String token) {
        this.token = token;
    }

    /**
     * Look up a method by its WCPS token, e.g. {@code "bilinear"}. Surrounding whitespace is ignored.
     */
    public static ResampleAlg fromString(String token) {
        String trimmed = token == null ? "" : token.trim();
        for (ResampleAlg alg : values()) {
            if (alg.token.equals(trimmed)) {
                return alg;
            }
        }
        throw new WcpsClientException(
                INVALID_INTERPOLATION,
                "Invalid interpolation method '" + trimmed + "', expected one of: "
                        + Joiner.on(", ").join(Arrays.asList(values())) + ".");
    }

    @Override
    public String toString() {
        return token;
    }
}
