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

import static dev.wcps.api.WcpsClientException.Kind.INVALID_GEOMETRY;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.regex.Pattern;

/**
 * Clip a coverage with a WKT geometry, rendered as {@code clip(child, WKT)}, e.g.
 * <pre>{@code
 * Clip.of(cube, "POLYGON((13589894.568 -2015496.69612, 15086830.0246 -1780682.3822))");
 * Clip.of(cube, "CURTAIN(projection(Lat, Long), Polygon((25 40, 30 40, 30 45, 30 42)))");
 * }</pre>
 */
public final class Clip extends Expression {
    public static final ImmutableList<String> VALID_GEOMETRIES =
            ImmutableList.of("LineString", "Polygon", "MultiLineString", "MultiPolygon", "Curtain", "Corridor");

    private static final Pattern GEOMETRY = Pattern.compile(
            "\\b(" + Joiner.on('|').join(VALID_GEOMETRIES) + ")\\b", Pattern.CASE_INSENSITIVE);

    private final Expression child;
    private final String wkt;

    private Clip(Object child, String wkt) {
        this.child = addRequiredOperand(child, "clip");
        this.wkt = wkt;
    }

    public static Clip of(Object child, String wkt) {
        WcpsClientException.check(
                wkt != null && GEOMETRY.matcher(wkt).find(),
                INVALID_GEOMETRY,
                "The given WKT does not contain a valid geometry type. Expected one of: %s",
                Joiner.on(", ").join(VALID_GEOMETRIES));
        return new Clip(child, wkt);
    }

    public Expression getChild() {
        return child;
    }

    public String getWkt() {
        return wkt;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitClip(this);
    }
}
