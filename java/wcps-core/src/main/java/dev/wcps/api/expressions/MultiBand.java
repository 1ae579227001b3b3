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

import static dev.wcps.api.WcpsClientException.Kind.EMPTY_NAME;
import static dev.wcps.api.WcpsClientException.Kind.INVALID_OPERAND;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A multiband value built from named bands, rendered as {@code {red: v1; green: v2}} in insertion order.
 */
public final class MultiBand extends Expression {
    private final ImmutableMap<String, Expression> bands;

    private MultiBand(Map<String, ?> bands) {
        ImmutableMap.Builder<String, Expression> builder = ImmutableMap.builder();
        for (Map.Entry<String, ?> band : bands.entrySet()) {
            WcpsClientException.check(
                    !Strings.isNullOrEmpty(band.getKey()), EMPTY_NAME, "Band name must not be empty.");
            builder.put(band.getKey(), addRequiredOperand(band.getValue(), "band " + band.getKey()));
        }
        this.bands = builder.build();
    }

    /**
     * @param bands band name to value; iteration order of the map is the band order
     */
    public static MultiBand of(Map<String, ?> bands) {
        WcpsClientException.check(!bands.isEmpty(), INVALID_OPERAND, "A multiband value needs at least one band.");
        return new MultiBand(bands);
    }

    public static MultiBand rgb(Object red, Object green, Object blue) {
        Map<String, Object> bands = new LinkedHashMap<>();
        bands.put("red", red);
        bands.put("green", green);
        bands.put("blue", blue);
        return new MultiBand(bands);
    }

    public static MultiBand rgba(Object red, Object green, Object blue, Object alpha) {
        Map<String, Object> bands = new LinkedHashMap<>();
        bands.put("red", red);
        bands.put("green", green);
        bands.put("blue", blue);
        bands.put("alpha", alpha);
        return new MultiBand(bands);
    }

    public ImmutableMap<String, Expression> getBands() {
        return bands;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitMultiBand(this);
    }
}
