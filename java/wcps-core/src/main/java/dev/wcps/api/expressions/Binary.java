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

import dev.wcps.api.Expression;
import java.util.stream.Stream;

/**
 * An infix operator applied to two operands, rendered as {@code (left OP right)}.
 */
public final class Binary extends Expression {
    private final BinaryOp operator;
    private final Expression left;
    private final Expression right;

    private Binary(BinaryOp operator, Object left, Object right) {
        this.operator = operator;
        this.left = addRequiredOperand(left, "left");
        this.right = addRequiredOperand(right, "right");
    }

    public static Binary of(BinaryOp operator, Object left, Object right) {
        return new Binary(operator, left, right);
    }

    public static Binary add(Object left, Object right) {
        return new Binary(BinaryOp.ADD, left, right);
    }

    public static Binary sub(Object left, Object right) {
        return new Binary(BinaryOp.SUB, left, right);
    }

    public static Binary mul(Object left, Object right) {
        return new Binary(BinaryOp.MUL, left, right);
    }

    public static Binary div(Object left, Object right) {
        return new Binary(BinaryOp.DIV, left, right);
    }

    public static Binary eq(Object left, Object right) {
        return new Binary(BinaryOp.EQ, left, right);
    }

    public static Binary notEq(Object left, Object right) {
        return new Binary(BinaryOp.NOT_EQ, left, right);
    }

    public static Binary gt(Object left, Object right) {
        return new Binary(BinaryOp.GT, left, right);
    }

    public static Binary gtEq(Object left, Object right) {
        return new Binary(BinaryOp.GT_EQ, left, right);
    }

    public static Binary lt(Object left, Object right) {
        return new Binary(BinaryOp.LT, left, right);
    }

    public static Binary ltEq(Object left, Object right) {
        return new Binary(BinaryOp.LT_EQ, left, right);
    }

    /**
     * Left-associative conjunction of all operands: {@code ((first and second) and ...)}.
     */
    public static Binary and(Object first, Object second, Object... rest) {
        Binary lhs = new Binary(BinaryOp.AND, first, second);
        return Stream.of(rest).reduce(lhs, (acc, next) -> new Binary(BinaryOp.AND, acc, next), (a, b) -> b);
    }

    /**
     * Left-associative disjunction of all operands: {@code ((first or second) or ...)}.
     */
    public static Binary or(Object first, Object second, Object... rest) {
        Binary lhs = new Binary(BinaryOp.OR, first, second);
        return Stream.of(rest).reduce(lhs, (acc, next) -> new Binary(BinaryOp.OR, acc, next), (a, b) -> b);
    }

    public static Binary xor(Object left, Object right) {
        return new Binary(BinaryOp.XOR, left, right);
    }

    public static Binary overlay(Object left, Object right) {
        return new Binary(BinaryOp.OVERLAY, left, right);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    public enum BinaryOp {
        // arithmetic
        ADD,
        SUB,
        MUL,
        DIV,
        // comparison
        EQ,
        NOT_EQ,
        GT,
        GT_EQ,
        LT,
        LT_EQ,
        // boolean algebra
        AND,
        OR,
        XOR,
        OVERLAY,
        ;

        @Override
        public String toString() {
            switch (this) {
                case ADD:
                    return "+";
                case SUB:
                    return "-";
                case MUL:
                    return "*";
                case DIV:
                    return "/";
                case EQ:
                    return "=";
                case NOT_EQ:
                    return "!=";
                case GT:
                    return ">";
                case GT_EQ:
                    return ">=";
                case LT:
                    return "<";
                case LT_EQ:
                    return "<=";
                case AND:
                    return "and";
                case OR:
                    return "or";
                case XOR:
                    return "xor";
                case OVERLAY:
                    return "overlay";
                default:
                    throw new IllegalStateException("Unknown Operator: " + this.name());
            }
        }
    }
}
