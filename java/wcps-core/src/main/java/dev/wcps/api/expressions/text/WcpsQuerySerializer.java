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
package dev.wcps.api.expressions.text;

import static dev.wcps.api.WcpsClientException.Kind.NO_DATASET_REFERENCED;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import dev.wcps.api.expressions.*;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generate the WCPS query text of an {@link Expression}.
 * <p>
 * A root expression is rendered as a complete query: a {@code for} clause binding every referenced
 * {@link Datacube}, sorted by name, followed by the body. Any other expression is rendered as its body only.
 */
public final class WcpsQuerySerializer implements Expression.Visitor<String> {
    private static final Logger logger = LoggerFactory.getLogger(WcpsQuerySerializer.class);

    private static final Pattern UNESCAPED_QUOTE = Pattern.compile("(?<!\\\\)\"");

    public static final WcpsQuerySerializer INSTANCE = new WcpsQuerySerializer();

    private WcpsQuerySerializer() {}

    /**
     * Serialize an {@link Expression} to WCPS query text.
     *
     * @throws WcpsClientException if {@code expression} is a root without any datacube in its tree, or a node
     *     in the tree is incompletely configured
     */
    public static String serialize(Expression expression) {
        if (!expression.isRoot()) {
            return body(expression);
        }
        ImmutableSortedSet<Datacube> datacubes = expression.collectDatacubes();
        WcpsClientException.check(!datacubes.isEmpty(), NO_DATASET_REFERENCED, "No datacubes have been specified.");
        String prologue = "for "
                + datacubes.stream()
                        .map(d -> d.getVariable() + " in (" + d.getName() + ")")
                        .collect(Collectors.joining(", "))
                + "\nreturn\n  ";
        String query = prologue + body(expression);
        if (logger.isDebugEnabled()) {
            logger.debug("rendered WCPS query datacubes={} length={}", datacubes.size(), query.length());
        }
        return query;
    }

    private static String body(Expression expression) {
        return expression.accept(INSTANCE);
    }

    private static String join(List<? extends Expression> expressions, String separator) {
        return expressions.stream().map(WcpsQuerySerializer::body).collect(Collectors.joining(separator));
    }

    private static String braces(List<Axis> axes, Function<Axis, String> format) {
        return "{ " + axes.stream().map(format).collect(Collectors.joining(", ")) + " }";
    }

    private static String bound(Expression bound) {
        if (bound instanceof Scalar) {
            return Scalars.formatBound((Scalar) bound);
        }
        return body(bound);
    }

    @Override
    public String visitDatacube(Datacube datacube) {
        return datacube.getVariable();
    }

    @Override
    public String visitScalar(Scalar scalar) {
        return Scalars.format(scalar);
    }

    @Override
    public String visitBinary(Binary binary) {
        return "(" + body(binary.getLeft()) + " " + binary.getOperator() + " " + body(binary.getRight()) + ")";
    }

    @Override
    public String visitNot(Not not) {
        return "(not " + body(not.getChild()) + ")";
    }

    @Override
    public String visitFunctionCall(FunctionCall call) {
        return call.getFunction() + "(" + join(call.getArguments(), ", ") + ")";
    }

    @Override
    public String visitBand(Band band) {
        return body(band.getChild()) + "." + band.getField();
    }

    @Override
    public String visitMultiBand(MultiBand multiBand) {
        StringBuilder builder = new StringBuilder("{");
        String separator = "";
        for (Map.Entry<String, Expression> band : multiBand.getBands().entrySet()) {
            builder.append(separator).append(band.getKey()).append(": ").append(body(band.getValue()));
            separator = "; ";
        }
        return builder.append('}').toString();
    }

    @Override
    public String visitAxis(Axis axis) {
        StringBuilder builder = new StringBuilder(axis.getAxisName());
        axis.getCrs().ifPresent(crs -> builder.append(":\"").append(crs).append('"'));
        builder.append('(').append(bound(axis.getLow()));
        axis.getHigh().ifPresent(high -> builder.append(':').append(bound(high)));
        return builder.append(')').toString();
    }

    private static String resolution(Axis axis) {
        return axis.getAxisName() + ":" + bound(axis.getLow());
    }

    @Override
    public String visitSubset(Subset subset) {
        return body(subset.getTarget()) + "[" + join(subset.getAxes(), ", ") + "]";
    }

    @Override
    public String visitExtend(Extend extend) {
        return "extend(" + body(extend.getTarget()) + ", " + braces(extend.getAxes(), WcpsQuerySerializer::body)
                + ")";
    }

    @Override
    public String visitScale(Scale scale) {
        String target = body(scale.getTarget());
        switch (scale.getMode()) {
            case GRID_DOMAIN_OF:
                return "scale(" + target + ", { imageCrsDomain(" + body(scale.getGridDomainOf().get()) + ") })";
            case FACTOR:
                return "scale(" + target + ", " + body(scale.getFactor().get()) + ")";
            case GRID_AXES:
            case AXIS_FACTORS:
            default:
                return "scale(" + target + ", " + braces(scale.getAxes(), WcpsQuerySerializer::body) + ")";
        }
    }

    @Override
    public String visitReproject(Reproject reproject) {
        StringBuilder builder = new StringBuilder("crsTransform(")
                .append(body(reproject.getTarget()))
                .append(", \"")
                .append(reproject.getTargetCrs())
                .append('"');
        reproject.getInterpolation().ifPresent(alg -> builder.append(", { ").append(alg).append(" }"));
        reproject
                .getAxisResolutions()
                .ifPresent(axes -> builder.append(", ").append(braces(axes, WcpsQuerySerializer::resolution)));
        reproject
                .getAxisSubsets()
                .ifPresent(axes -> builder.append(", ").append(braces(axes, WcpsQuerySerializer::body)));
        reproject
                .getSubsetDomain()
                .ifPresent(other -> builder.append(", { domain(").append(body(other)).append(") }"));
        return builder.append(')').toString();
    }

    @Override
    public String visitCast(Cast cast) {
        return "((" + cast.getTargetType() + ") " + body(cast.getChild()) + ")";
    }

    @Override
    public String visitClip(Clip clip) {
        return "clip(" + body(clip.getChild()) + ", " + clip.getWkt() + ")";
    }

    @Override
    public String visitUdf(Udf udf) {
        return udf.getFunctionName() + "(" + join(udf.getOperands(), ", ") + ")";
    }

    @Override
    public String visitEncode(Encode encode) {
        StringBuilder builder = new StringBuilder("encode(")
                .append(body(encode.getChild()))
                .append(", \"")
                .append(encode.getFormat())
                .append('"');
        encode.getParams()
                .ifPresent(params -> builder.append(", \"")
                        .append(UNESCAPED_QUOTE.matcher(params).replaceAll("\\\\\""))
                        .append('"'));
        return builder.append(')').toString();
    }

    @Override
    public String visitAxisIter(AxisIter axisIter) {
        String domain;
        switch (axisIter.getDomain()) {
            case INTERVAL:
                domain = intervalBound(axisIter.getLow()) + " : " + intervalBound(axisIter.getHigh());
                break;
            case GRID_AXIS:
                domain = "imageCrsDomain(" + body(axisIter.getDomainOf()) + ", " + axisIter.getAxisName() + ")";
                break;
            case GEO_AXIS:
            default:
                domain = "domain(" + body(axisIter.getDomainOf()) + ", " + axisIter.getAxisName() + ")";
                break;
        }
        return axisIter.getVarName() + " " + axisIter.getAxisName() + "(" + domain + ")";
    }

    private static String intervalBound(Object bound) {
        if (bound instanceof Expression) {
            return body((Expression) bound);
        }
        return Scalars.formatRaw(bound);
    }

    @Override
    public String visitAxisIterRef(AxisIterRef ref) {
        return ref.getAxisIter().getVarName();
    }

    @Override
    public String visitCondense(Condense condense) {
        String over = join(condense.getIterators(), ", ");
        Expression using = condense.getUsing();
        StringBuilder builder = new StringBuilder("(condense ")
                .append(condense.getOperator())
                .append(" over ")
                .append(over);
        condense.getWhere().ifPresent(where -> builder.append(" where ").append(body(where)));
        return builder.append(" using ").append(body(using)).append(')').toString();
    }

    @Override
    public String visitCoverage(Coverage coverage) {
        String over = join(coverage.getIterators(), ", ");
        coverage.checkValuesPresent();
        String prefix = "(coverage " + coverage.getName() + " over " + over;
        if (coverage.getValues().isPresent()) {
            return prefix + " values " + body(coverage.getValues().get()) + ")";
        }
        List<String> values = coverage.getValueList().get().stream()
                .map(Scalars::format)
                .collect(Collectors.toList());
        return prefix + " value list < " + Joiner.on("; ").join(values) + " >)";
    }

    @Override
    public String visitSwitch(Switch switchExpr) {
        List<Expression> conditions = switchExpr.getConditions();
        List<Expression> results = switchExpr.getResults();
        Expression otherwise = switchExpr.getOtherwise();
        StringBuilder builder = new StringBuilder("(switch");
        for (int i = 0; i < conditions.size(); i++) {
            builder.append(" case ").append(body(conditions.get(i)));
            builder.append(" return ").append(body(results.get(i)));
        }
        return builder.append(" default return ").append(body(otherwise)).append(')').toString();
    }

    @Override
    public String visitComposite(Composite composite) {
        return body(composite.getExpression());
    }
}
