/*
 * Copyright (C) 2024 fontcat contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.everydaythings.fontcat;

import java.io.Serializable;

/**
 * A requested slant: normal, italic, or oblique at an angle in degrees.
 */
public record Slant(Kind kind, double angle) implements Serializable {

    /** CSS default angle for {@code oblique} without an explicit angle. */
    public static final double DEFAULT_OBLIQUE_ANGLE = 14.0;

    public static final Slant NORMAL = new Slant(Kind.NORMAL, 0);
    public static final Slant ITALIC = new Slant(Kind.ITALIC, 0);

    public enum Kind {
        NORMAL,
        ITALIC,
        OBLIQUE
    }

    public Slant {
        if (kind == null) {
            throw new IllegalArgumentException("Slant kind is required");
        }
    }

    public static Slant oblique(double angle) {
        return new Slant(Kind.OBLIQUE, angle);
    }

    public static Slant oblique() {
        return oblique(DEFAULT_OBLIQUE_ANGLE);
    }
}
