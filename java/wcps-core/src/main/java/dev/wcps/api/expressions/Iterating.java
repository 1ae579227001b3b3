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

import static dev.wcps.api.WcpsClientException.Kind.DUPLICATE_ITERATOR_NAME;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;
import static dev.wcps.api.WcpsClientException.Kind.MISSING_OVER_CLAUSE;

import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Base class for expressions that iterate {@code over} a domain formed by one or more {@link AxisIter}.
 *
 * @param <T> the concrete type, returned from the fluent setters
 */
public abstract class Iterating<T extends Iterating<T>> extends Expression {
    private final List<AxisIter> iterators = new ArrayList<>();

    protected abstract T self();

    public final T over(AxisIter... iterators) {
        return over(Arrays.asList(iterators));
    }

    /**
     * Add iterator variables to the iteration domain.
     *
     * @throws WcpsClientException of kind {@code DUPLICATE_ITERATOR_NAME} if a variable of the same name was
     *     already added
     */
    public final T over(List<AxisIter> iterators) {
        for (AxisIter iterator : iterators) {
            WcpsClientException.check(iterator != null, INVALID_OPERAND, "Iterator variables must not be null.");
            WcpsClientException.check(
                    this.iterators.stream().noneMatch(e -> e.getVarName().equals(iterator.getVarName())),
                    DUPLICATE_ITERATOR_NAME,
                    "Duplicate iterator variable name: %s",
                    iterator.getVarName());
            addOperand(iterator);
            this.iterators.add(iterator);
        }
        return self();
    }

    /**
     * @throws WcpsClientException of kind {@code MISSING_OVER_CLAUSE} if no iterator variable was added
     */
    public final ImmutableList<AxisIter> getIterators() {
        WcpsClientException.check(
                !iterators.isEmpty(),
                MISSING_OVER_CLAUSE,
                "An OVER clause is mandatory in a %s operation, none was specified.",
                getClass().getSimpleName().toUpperCase());
        return ImmutableList.copyOf(iterators);
    }
}
