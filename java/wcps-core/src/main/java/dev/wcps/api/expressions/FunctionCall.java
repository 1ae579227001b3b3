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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;

/**
 * A builtin WCPS function applied to one or two operands, rendered as {@code name(op1[, op2])}.
 */
public final class FunctionCall extends Expression {
    private final FunctionName function;
    private final ImmutableList<Expression> arguments;

    private FunctionCall(FunctionName function, Object... arguments) {
        this.function = function;
        ImmutableList.Builder<Expression> args = ImmutableList.builder();
        for (int i = 0; i < arguments.length; i++) {
            args.add(addRequiredOperand(arguments[i], function.toString() + " argument #" + (i + 1)));
        }
        this.arguments = args.build();
    }

    public static FunctionCall of(FunctionName function, Object operand) {
        Preconditions.checkArgument(function.getArity() == 1, "%s expects %s argument(s), got one", function, function.getArity());
        return new FunctionCall(function, operand);
    }

    public static FunctionCall of(FunctionName function, Object first, Object second) {
        Preconditions.checkArgument(function.getArity() == 2, "%s expects %s argument(s), got two", function, function.getArity());
        return new FunctionCall(function, first, second);
    }

    // arithmetic

    public static FunctionCall mod(Object dividend, Object divisor) {
        return new FunctionCall(FunctionName.MOD, dividend, divisor);
    }

    public static FunctionCall abs(Object operand) {
        return new FunctionCall(FunctionName.ABS, operand);
    }

    public static FunctionCall round(Object operand) {
        return new FunctionCall(FunctionName.ROUND, operand);
    }

    public static FunctionCall floor(Object operand) {
        return new FunctionCall(FunctionName.FLOOR, operand);
    }

    public static FunctionCall ceil(Object operand) {
        return new FunctionCall(FunctionName.CEIL, operand);
    }

    // exponential

    public static FunctionCall exp(Object operand) {
        return new FunctionCall(FunctionName.EXP, operand);
    }

    /**
     * Base 10 logarithm.
     */
    public static FunctionCall log(Object operand) {
        return new FunctionCall(FunctionName.LOG, operand);
    }

    public static FunctionCall ln(Object operand) {
        return new FunctionCall(FunctionName.LN, operand);
    }

    public static FunctionCall sqrt(Object operand) {
        return new FunctionCall(FunctionName.SQRT, operand);
    }

    public static FunctionCall pow(Object base, Object exponent) {
        return new FunctionCall(FunctionName.POW, base, exponent);
    }

    // trigonometric

    public static FunctionCall sin(Object operand) {
        return new FunctionCall(FunctionName.SIN, operand);
    }

    public static FunctionCall cos(Object operand) {
        return new FunctionCall(FunctionName.COS, operand);
    }

    public static FunctionCall tan(Object operand) {
        return new FunctionCall(FunctionName.TAN, operand);
    }

    public static FunctionCall sinh(Object operand) {
        return new FunctionCall(FunctionName.SINH, operand);
    }

    public static FunctionCall cosh(Object operand) {
        return new FunctionCall(FunctionName.COSH, operand);
    }

    public static FunctionCall tanh(Object operand) {
        return new FunctionCall(FunctionName.TANH, operand);
    }

    public static FunctionCall arcsin(Object operand) {
        return new FunctionCall(FunctionName.ARCSIN, operand);
    }

    public static FunctionCall arccos(Object operand) {
        return new FunctionCall(FunctionName.ARCCOS, operand);
    }

    public static FunctionCall arctan(Object operand) {
        return new FunctionCall(FunctionName.ARCTAN, operand);
    }

    public static FunctionCall arctan2(Object operand) {
        return new FunctionCall(FunctionName.ARCTAN2, operand);
    }

    // bits

    public static FunctionCall bit(Object operand, Object pos) {
        return new FunctionCall(FunctionName.BIT, operand, pos);
    }

    // aggregation

    public static FunctionCall sum(Object operand) {
        return new FunctionCall(FunctionName.SUM, operand);
    }

    /**
     * Number of true cells in a boolean operand.
     */
    public static FunctionCall count(Object operand) {
        return new FunctionCall(FunctionName.COUNT, operand);
    }

    public static FunctionCall avg(Object operand) {
        return new FunctionCall(FunctionName.AVG, operand);
    }

    public static FunctionCall min(Object operand) {
        return new FunctionCall(FunctionName.MIN, operand);
    }

    public static FunctionCall max(Object operand) {
        return new FunctionCall(FunctionName.MAX, operand);
    }

    public static FunctionCall all(Object operand) {
        return new FunctionCall(FunctionName.ALL, operand);
    }

    public static FunctionCall some(Object operand) {
        return new FunctionCall(FunctionName.SOME, operand);
    }

    public FunctionName getFunction() {
        return function;
    }

    public ImmutableList<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    public enum FunctionName {
        MOD("mod", 2),
        ABS("abs", 1),
        ROUND("round", 1),
        FLOOR("floor", 1),
        CEIL("ceil", 1),
        EXP("exp", 1),
        LOG("log", 1),
        LN("ln", 1),
        SQRT("sqrt", 1),
        POW("pow", 2),
        SIN("sin", 1),
        COS("cos", 1),
        TAN("tan", 1),
        SINH("sinh", 1),
        COSH("cosh", 1),
        TANH("tanh", 1),
        ARCSIN("arcsin", 1),
        ARCCOS("arccos", 1),
        ARCTAN("arctan", 1),
        ARCTAN2("arctan2", 1),
        BIT("bit", 2),
        SUM("sum", 1),
        COUNT("count", 1),
        AVG("avg", 1),
        MIN("min", 1),
        MAX("max", 1),
        ALL("all", 1),
        SOME("some", 1),
        ;

        private final String token;
        private final int arity;

        FunctionName(String token, int arity) {
            this.token = token;
            this.arity = arity;
        }

        public int getArity() {
            return arity;
        }

        @Override
        public String toString() {
            return token;
        }
    }
}
