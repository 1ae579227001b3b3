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
package dev.wcps.api;

import static dev.wcps.api.WcpsClientException.Kind.CONFLICTING_CONFIGURATION;
import static dev.wcps.api.WcpsClientException.Kind.INCOMPLETE_CONFIGURATION;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import dev.wcps.api.expressions.*;
import dev.wcps.api.expressions.text.WcpsQuerySerializer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A node of a WCPS expression tree.
 * <p>
 * A node owns an ordered list of operands and knows the node it is an operand of, if any. Trees are
 * composed either from the static factories of the node classes, e.g. {@code FunctionCall.sum(Datacube.of("cube"))},
 * or by chaining methods on this class, e.g. {@code Datacube.of("cube").sum()}. Raw numbers, strings and
 * booleans are accepted wherever an operand is expected and wrapped in a {@link Scalar}.
 * <p>
 * {@link #render()} on the root of a tree produces the complete query text, i.e. a {@code for ... return}
 * prologue declaring every referenced {@link Datacube} followed by the body of the tree.
 */
public abstract class Expression {
    private final List<Expression> operands = new ArrayList<>();
    private Expression parent;

    protected Expression() {}

    public abstract <T> T accept(Visitor<T> visitor);

    public final List<Expression> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * The expression this node was most recently added to as an operand.
     */
    public final Optional<Expression> getParent() {
        return Optional.ofNullable(parent);
    }

    public final boolean isRoot() {
        return parent == null;
    }

    /**
     * Normalize {@code operand} and append it to the operands of this node. {@code null} is ignored and
     * returned as is, so that unset builder slots do not produce an operand.
     *
     * @return the appended node, or {@code null}
     */
    protected final Expression addOperand(Object operand) {
        Expression expression = Operands.of(operand);
        if (expression == null) {
            return null;
        }
        WcpsClientException.check(
                !expression.reaches(this), INVALID_OPERAND, "An expression cannot be its own operand: %s", this);
        operands.add(expression);
        expression.parent = this;
        return expression;
    }

    /**
     * Same as {@link #addOperand(Object)}, but {@code null} is rejected.
     */
    protected final Expression addRequiredOperand(Object operand, String role) {
        WcpsClientException.check(operand != null, INVALID_OPERAND, "The %s operand must not be null.", role);
        return addOperand(operand);
    }

    private boolean reaches(Expression target) {
        Set<Expression> visited = Sets.newIdentityHashSet();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.add(this);
        while (!pending.isEmpty()) {
            Expression next = pending.poll();
            if (next == target) {
                return true;
            }
            if (visited.add(next)) {
                pending.addAll(next.operands);
            }
        }
        return false;
    }

    /**
     * Collect every distinct {@link Datacube} reachable from this node, this node included.
     *
     * @return the datacubes sorted by name
     */
    public final ImmutableSortedSet<Datacube> collectDatacubes() {
        ImmutableSortedSet.Builder<Datacube> datacubes = ImmutableSortedSet.naturalOrder();
        Set<Expression> visited = Sets.newIdentityHashSet();
        Deque<Expression> pending = new ArrayDeque<>();
        pending.add(this);
        while (!pending.isEmpty()) {
            Expression next = pending.poll();
            if (!visited.add(next)) {
                continue;
            }
            if (next instanceof Datacube) {
                datacubes.add((Datacube) next);
            }
            pending.addAll(next.operands);
        }
        return datacubes.build();
    }

    /**
     * Render this expression. On the root of a tree the result is a complete WCPS query; on any other node it
     * is only the body text of that node.
     *
     * @throws WcpsClientException if a root is rendered without any datacube in the tree, or a builder node in
     *     the tree is incomplete
     */
    public final String render() {
        return WcpsQuerySerializer.serialize(this);
    }

    @Override
    public String toString() {
        return render();
    }

    // arithmetic

    public final Binary add(Object other) {
        return Binary.add(this, other);
    }

    public final Binary sub(Object other) {
        return Binary.sub(this, other);
    }

    public final Binary mul(Object other) {
        return Binary.mul(this, other);
    }

    public final Binary div(Object other) {
        return Binary.div(this, other);
    }

    public final FunctionCall mod(Object other) {
        return FunctionCall.mod(this, other);
    }

    public final FunctionCall abs() {
        return FunctionCall.abs(this);
    }

    public final FunctionCall round() {
        return FunctionCall.round(this);
    }

    public final FunctionCall floor() {
        return FunctionCall.floor(this);
    }

    public final FunctionCall ceil() {
        return FunctionCall.ceil(this);
    }

    // exponential

    public final FunctionCall exp() {
        return FunctionCall.exp(this);
    }

    public final FunctionCall log() {
        return FunctionCall.log(this);
    }

    public final FunctionCall ln() {
        return FunctionCall.ln(this);
    }

    public final FunctionCall sqrt() {
        return FunctionCall.sqrt(this);
    }

    public final FunctionCall pow(Object exponent) {
        return FunctionCall.pow(this, exponent);
    }

    // trigonometric

    public final FunctionCall sin() {
        return FunctionCall.sin(this);
    }

    public final FunctionCall cos() {
        return FunctionCall.cos(this);
    }

    public final FunctionCall tan() {
        return FunctionCall.tan(this);
    }

    public final FunctionCall sinh() {
        return FunctionCall.sinh(this);
    }

    public final FunctionCall cosh() {
        return FunctionCall.cosh(this);
    }

    public final FunctionCall tanh() {
        return FunctionCall.tanh(this);
    }

    public final FunctionCall arcsin() {
        return FunctionCall.arcsin(this);
    }

    public final FunctionCall arccos() {
        return FunctionCall.arccos(this);
    }

    public final FunctionCall arctan() {
        return FunctionCall.arctan(this);
    }

    public final FunctionCall arctan2() {
        return FunctionCall.arctan2(this);
    }

    // comparison

    public final Binary gt(Object other) {
        return Binary.gt(this, other);
    }

    public final Binary lt(Object other) {
        return Binary.lt(this, other);
    }

    public final Binary gtEq(Object other) {
        return Binary.gtEq(this, other);
    }

    public final Binary ltEq(Object other) {
        return Binary.ltEq(this, other);
    }

    public final Binary eq(Object other) {
        return Binary.eq(this, other);
    }

    public final Binary notEq(Object other) {
        return Binary.notEq(this, other);
    }

    // logical; bitwise operators are intentionally not offered under these names

    public final Binary and(Object other) {
        return Binary.and(this, other);
    }

    public final Binary or(Object other) {
        return Binary.or(this, other);
    }

    public final Binary xor(Object other) {
        return Binary.xor(this, other);
    }

    public final Not not() {
        return Not.of(this);
    }

    /**
     * Place {@code other} on top of this operand: wherever a cell of {@code other} is neither zero nor null it
     * wins, elsewhere the cell of this operand is taken.
     */
    public final Binary overlay(Object other) {
        return Binary.overlay(this, other);
    }

    /**
     * Extract the bit at position {@code pos} (0 is the least significant bit) of every cell.
     */
    public final FunctionCall bit(Object pos) {
        return FunctionCall.bit(this, pos);
    }

    // multiband

    public final Band band(String field) {
        return Band.of(this, field);
    }

    public final Band band(int index) {
        return Band.of(this, index);
    }

    /**
     * Alias of {@link #band(String)}.
     */
    public final Band field(String field) {
        return band(field);
    }

    // subsetting

    /**
     * Select a spatio-temporal subset. See {@link Axes#normalize(Object)} for the accepted shapes of
     * {@code axes}, e.g. {@code cube.subset("X", 0, 100)} or {@code cube.subset(Axis.of("X", 0, 100), Axis.of("Y", 5))}.
     */
    public final Subset subset(Object... axes) {
        return Subset.of(this, Axes.fromVarargs(axes));
    }

    /**
     * Enlarge this operand to the domain given by {@code axes}; new cells are null.
     */
    public final Extend extend(Object... axes) {
        return Extend.of(this, Axes.fromVarargs(axes));
    }

    public final Scale scale() {
        return Scale.of(this);
    }

    /**
     * Rescale this operand with exactly one of the targets set in {@code options}.
     */
    public final Scale scale(ScaleOptions options) {
        int targets = (options.gridAxes().isEmpty() ? 0 : 1)
                + (options.gridDomainOf().isPresent() ? 1 : 0)
                + (options.factor().isPresent() ? 1 : 0)
                + (options.axisFactors().isEmpty() ? 0 : 1);
        WcpsClientException.check(
                targets <= 1, CONFLICTING_CONFIGURATION, "scale expects exactly one target, but %s were set.", targets);
        WcpsClientException.check(targets == 1, INCOMPLETE_CONFIGURATION, "scale expects exactly one target.");

        Scale scale = Scale.of(this);
        if (!options.gridAxes().isEmpty()) {
            return scale.toExplicitGridDomain(options.gridAxes());
        } else if (options.gridDomainOf().isPresent()) {
            return scale.toGridDomainOf(options.gridDomainOf().get());
        } else if (options.factor().isPresent()) {
            return scale.byFactor(options.factor().getAsDouble());
        } else {
            return scale.byFactorPerAxis(options.axisFactors());
        }
    }

    public final Reproject reproject(String targetCrs) {
        return Reproject.of(this, targetCrs);
    }

    public final Reproject reproject(ReprojectOptions options) {
        Reproject reproject = Reproject.of(this, options.targetCrs(), options.interpolation().orElse(null));
        if (!options.axisResolutions().isEmpty()) {
            reproject.toAxisResolutions(options.axisResolutions());
        }
        if (!options.axisSubsets().isEmpty()) {
            reproject.subsetByAxes(options.axisSubsets());
        }
        if (options.domainOf().isPresent()) {
            reproject.subsetByCoverageDomain(options.domainOf().get());
        }
        return reproject;
    }

    public final Cast cast(CastType targetType) {
        return Cast.of(this, targetType);
    }

    public final Clip clip(String wkt) {
        return Clip.of(this, wkt);
    }

    // aggregation

    public final FunctionCall sum() {
        return FunctionCall.sum(this);
    }

    public final FunctionCall count() {
        return FunctionCall.count(this);
    }

    public final FunctionCall avg() {
        return FunctionCall.avg(this);
    }

    public final FunctionCall min() {
        return FunctionCall.min(this);
    }

    public final FunctionCall max() {
        return FunctionCall.max(this);
    }

    public final FunctionCall all() {
        return FunctionCall.all(this);
    }

    public final FunctionCall some() {
        return FunctionCall.some(this);
    }

    // encoding

    public final Encode encode() {
        return Encode.of(this);
    }

    public final Encode encode(String format) {
        return Encode.of(this, format);
    }

    public interface Visitor<T> {
        T visitDatacube(Datacube datacube);

        T visitScalar(Scalar scalar);

        T visitBinary(Binary binary);

        T visitNot(Not not);

        T visitFunctionCall(FunctionCall call);

        T visitBand(Band band);

        T visitMultiBand(MultiBand multiBand);

        T visitAxis(Axis axis);

        T visitSubset(Subset subset);

        T visitExtend(Extend extend);

        T visitScale(Scale scale);

        T visitReproject(Reproject reproject);

        T visitCast(Cast cast);

        T visitClip(Clip clip);

        T visitUdf(Udf udf);

        T visitEncode(Encode encode);

        T visitAxisIter(AxisIter axisIter);

        T visitAxisIterRef(AxisIterRef ref);

        T visitCondense(Condense condense);

        T visitCoverage(Coverage coverage);

        T visitSwitch(Switch switchExpr);

        T visitComposite(Composite composite);
    }
}
