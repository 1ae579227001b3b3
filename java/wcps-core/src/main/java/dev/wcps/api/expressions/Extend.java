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

import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;

/**
 * Enlarge a coverage to a new domain with the new cells set to null, rendered as
 * {@code extend(target, { X(0:10), Y(0:20) })}.
 */
public final class Extend extends Expression {
    private final Expression target;
    private final ImmutableList<Axis> axes;

    private Extend(Object target, ImmutableList<Axis> axes) {
        this.target = addRequiredOperand(target, "extend target");
        axes.forEach(this::addOperand);
        this.axes = axes;
    }

    /**
     * @param axes any shape accepted by {@link Axes#normalize(Object)}
     */
    public static Extend of(Object target, Object axes) {
        return new Extend(target, Axes.normalize(axes));
    }

    public Expression getTarget() {
        return target;
    }

    public ImmutableList<Axis> getAxes() {
        return axes;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitExtend(this);
    }
}
