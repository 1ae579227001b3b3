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

import static dev.wcps.api.WcpsClientException.Kind.INCOMPLETE_CONFIGURATION;

import com.google.common.base.Preconditions;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.Optional;

/**
 * Encode a coverage in a data format, rendered as {@code encode(child, "format"[, "params"])}. The format
 * must be given up front or with {@link #to(String)} before rendering.
 */
public final class Encode extends Expression {
    private final Expression child;
    private String format;
    private String params;

    private Encode(Object child, String format) {
        this.child = addRequiredOperand(child, "encode");
        this.format = format;
    }

    public static Encode of(Object child) {
        return new Encode(child, null);
    }

    /**
     * @param format e.g. {@code "GTiff"} or {@code "PNG"}
     */
    public static Encode of(Object child, String format) {
        return new Encode(child, format);
    }

    public Encode to(String format) {
        this.format = Preconditions.checkNotNull(format, "format");
        return this;
    }

    /**
     * Extra parameters for the encoder. Unescaped double quotes are escaped when rendering.
     */
    public Encode params(String params) {
        this.params = Preconditions.checkNotNull(params, "params");
        return this;
    }

    public Expression getChild() {
        return child;
    }

    /**
     * @throws WcpsClientException of kind {@code INCOMPLETE_CONFIGURATION} if no format was given yet
     */
    public String getFormat() {
        WcpsClientException.check(
                format != null, INCOMPLETE_CONFIGURATION, "No target format to which to encode the operand was provided.");
        return format;
    }

    public Optional<String> getParams() {
        return Optional.ofNullable(params);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitEncode(this);
    }
}
