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
import dev.wcps.api.Expression;

/**
 * Cites an {@link AxisIter} inside an expression without declaring it again. It has no operands and renders
 * to the variable name.
 */
public final class AxisIterRef extends Expression {
    private final AxisIter axisIter;

    private AxisIterRef(AxisIter axisIter) {
        this.axisIter = axisIter;
    }

    public static AxisIterRef of(AxisIter axisIter) {
        return new AxisIterRef(Preconditions.checkNotNull(axisIter, "axisIter"));
    }

    public AxisIter getAxisIter() {
        return axisIter;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitAxisIterRef(this);
    }
}
