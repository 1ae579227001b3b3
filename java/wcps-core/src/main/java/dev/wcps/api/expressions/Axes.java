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

import static dev.wcps.api.WcpsClientException.Kind.INVALID_AXIS_SHAPE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import dev.wcps.api.WcpsClientException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Normalizes the accepted shapes of axis specifications into a list of {@link Axis}.
 */
public final class Axes {
    private Axes() {}

    /**
     * Accepted shapes of {@code axes}:
     * <ol>
     *   <li>a single {@link Axis}: {@code Axis.of("X", 0, 100.5, "EPSG:4326")}</li>
     *   <li>a single slice, i.e. a {@link Map.Entry} of axis name to a bound or to a {@link Range} of bounds:
     *       {@code Map.entry("X", Range.closed(0, 100))}, {@code Map.entry("time", "2025-01-01")}</li>
     *   <li>an array or list of {@link Axis}</li>
     *   <li>a positional tuple {@code new Object[] {name, low[, high[, crs]]}}</li>
     *   <li>an array or list of positional tuples</li>
     *   <li>an array or list of slices</li>
     * </ol>
     * Equivalent specifications in any of these shapes normalize to axes that render identically.
     *
     * @throws WcpsClientException of kind {@code INVALID_AXIS_SHAPE} for any other shape, including arrays or
     *     lists mixing several shapes
     */
    public static ImmutableList<Axis> normalize(Object axes) {
        if (axes instanceof Axis) {
            return ImmutableList.of((Axis) axes);
        }
        if (axes instanceof Map.Entry) {
            return ImmutableList.of(fromSlice((Map.Entry<?, ?>) axes));
        }
        if (axes instanceof Object[]) {
            Object[] tuple = (Object[]) axes;
            if (tuple.length > 0 && tuple[0] instanceof String) {
                return ImmutableList.of(fromTuple(tuple));
            }
            return fromSequence(Arrays.asList(tuple));
        }
        if (axes instanceof List) {
            return fromSequence((List<?>) axes);
        }
        throw invalidShape();
    }

    /**
     * Normalize the arguments of a varargs call such as {@code subset(Object... axes)}: a single argument is
     * normalized on its own, several arguments are treated as one array.
     */
    public static ImmutableList<Axis> fromVarargs(Object... axes) {
        if (axes.length == 1) {
            return normalize(axes[0]);
        }
        return normalize(axes);
    }

    private static ImmutableList<Axis> fromSequence(List<?> items) {
        if (items.isEmpty()) {
            throw invalidShape();
        }
        Object first = items.get(0);
        ImmutableList.Builder<Axis> result = ImmutableList.builder();
        if (first instanceof Axis) {
            for (Object item : items) {
                checkSameShape(item instanceof Axis, "Axis");
                result.add((Axis) item);
            }
        } else if (first instanceof Object[]) {
            for (Object item : items) {
                checkSameShape(item instanceof Object[], "tuple");
                result.add(fromTuple((Object[]) item));
            }
        } else if (first instanceof Map.Entry) {
            for (Object item : items) {
                checkSameShape(item instanceof Map.Entry, "slice");
                result.add(fromSlice((Map.Entry<?, ?>) item));
            }
        } else {
            throw invalidShape();
        }
        return result.build();
    }

    private static Axis fromTuple(Object[] tuple) {
        WcpsClientException.check(
                tuple.length >= 2 && tuple.length <= 4,
                INVALID_AXIS_SHAPE,
                "An axis tuple must have the shape (axis_name, low, high?, crs?), got %s elements.",
                tuple.length);
        WcpsClientException.check(
                tuple[0] instanceof String, INVALID_AXIS_SHAPE, "An axis tuple must start with the axis name.");
        Object high = tuple.length > 2 ? tuple[2] : null;
        Object crs = tuple.length > 3 ? tuple[3] : null;
        WcpsClientException.check(
                crs == null || crs instanceof String, INVALID_AXIS_SHAPE, "The CRS of an axis tuple must be a string.");
        return Axis.of((String) tuple[0], tuple[1], high, (String) crs);
    }

    private static Axis fromSlice(Map.Entry<?, ?> slice) {
        WcpsClientException.check(
                slice.getKey() instanceof String, INVALID_AXIS_SHAPE, "The key of an axis slice must be the axis name.");
        String axisName = (String) slice.getKey();
        if (slice.getValue() instanceof Range) {
            Range<?> range = (Range<?>) slice.getValue();
            Object low = range.hasLowerBound() ? range.lowerEndpoint() : Axis.MIN;
            Object high = range.hasUpperBound() ? range.upperEndpoint() : Axis.MAX;
            return Axis.of(axisName, low, high);
        }
        return Axis.of(axisName, slice.getValue());
    }

    private static void checkSameShape(boolean sameShape, String expected) {
        WcpsClientException.check(
                sameShape,
                INVALID_AXIS_SHAPE,
                "Mixed types of axis specifications provided, expected all objects to be of type %s.",
                expected);
    }

    private static WcpsClientException invalidShape() {
        return new WcpsClientException(
                INVALID_AXIS_SHAPE,
                "Invalid axis specification, expected one or more Axis objects, slices, "
                        + "or tuples of the shape: (axis_name, low, high, crs)");
    }
}
