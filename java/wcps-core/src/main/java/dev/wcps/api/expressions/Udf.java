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

import com.google.common.base.Strings;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;

/**
 * Call a user-defined function, or any WCPS function without a dedicated node, rendered as
 * {@code name(op1, op2, ...)}, e.g. {@code Udf.of("image.stretch", cube)}.
 */
public final class Udf extends Expression {
    private final String functionName;

    private Udf(String functionName, Object... arguments) {
        this.functionName = functionName;
        for (Object argument : arguments) {
            addRequiredOperand(argument, functionName + " argument");
        }
    }

    public static Udf of(String functionName, Object... arguments) {
        WcpsClientException.check(
                !Strings.isNullOrEmpty(functionName), EMPTY_NAME, "Function name must not be empty.");
        return new Udf(functionName, arguments);
    }

    public String getFunctionName() {
        return functionName;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitUdf(this);
    }
}
