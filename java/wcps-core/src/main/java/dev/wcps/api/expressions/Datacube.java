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

import com.google.common.base.Strings;
import dev.wcps.api.Expression;
import dev.wcps.api.WcpsClientException;

/**
 * Reference to a datacube (coverage) on the WCPS server, e.g. {@code Datacube.of("S2_L2A_B04")}.
 * <p>
 * Datacubes are identified by name: all references to the same name in a tree are declared once.
 */
public final class Datacube extends Expression implements Comparable<Datacube> {
    private final String name;

    private Datacube(String name) {
        this.name = name;
    }

    public static Datacube of(String name) {
        WcpsClientException.check(!Strings.isNullOrEmpty(name), EMPTY_NAME, "Datacube name must not be empty.");
        return new Datacube(name);
    }

    public String getName() {
        return name;
    }

    /**
     * The variable this datacube is bound to in the query prologue.
     */
    public String getVariable() {
        return "$" + name;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDatacube(this);
    }

    @Override
    public int compareTo(Datacube other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Datacube)) return false;
        return name.equals(((Datacube) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
