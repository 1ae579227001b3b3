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

/**
 * Cast the cell values of an operand to another type, rendered as {@code ((type) child)}. The type can be
 * given up front or later with {@link #to(CastType)}.
 */
public final class Cast extends Expression {
    private final Expression child;
    private CastType targetType;

    private Cast(Object child, CastType targetType) {
        this.child = addRequiredOperand(child, "cast");
        this.targetType = targetType;
    }

    public static Cast of(Object child) {
        return new Cast(child, null);
    }

    public static Cast of(Object child, CastType targetType) {
        return new Cast(child, Preconditions.checkNotNull(targetType, "targetType"));
    }

    public static Cast of(Object child, String targetType) {
        return new Cast(child, CastType.fromString(targetType));
    }

    public Cast to(CastType targetType) {
        this.targetType = Preconditions.checkNotNull(targetType, "targetType");
        return this;
    }

    public Cast to(String targetType) {
        return to(CastType.fromString(targetType));
    }

    public Expression getChild() {
        return child;
    }

    /**
     * @throws WcpsClientException of kind {@code INCOMPLETE_CONFIGURATION} if no type was given yet
     */
    public CastType getTargetType() {
        WcpsClientException.check(
                targetType != null,
                INCOMPLETE_CONFIGURATION,
                "No target type to which to cast the operand was provided.");
        return targetType;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCast(this);
    }
}
