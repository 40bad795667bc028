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
 * The slant a face provides. Oblique faces may cover a range of angles
 * (from a variable {@code slnt} axis); angles are ignored for the other kinds.
 */
public record SlantRange(Slant.Kind kind, double minAngle, double maxAngle) implements Serializable {

    public static final SlantRange NORMAL = new SlantRange(Slant.Kind.NORMAL, 0, 0);
    public static final SlantRange ITALIC = new SlantRange(Slant.Kind.ITALIC, 0, 0);

    public SlantRange {
        if (kind == null) {
            throw new IllegalArgumentException("Slant kind is required");
        }
        if (minAngle > maxAngle) {
            throw new IllegalArgumentException("Invalid slant range [" + minAngle + ", " + maxAngle + "]");
        }
        // Fold -0.0 so negated axis bounds compare equal.
        minAngle += 0.0;
        maxAngle += 0.0;
    }

    public static SlantRange oblique(double minAngle, double maxAngle) {
        return new SlantRange(Slant.Kind.OBLIQUE, minAngle, maxAngle);
    }

    /** Distance in degrees from {@code angle} to the nearest angle in the range. */
    public double angleDistance(double angle) {
        if (angle < minAngle) return minAngle - angle;
        if (angle > maxAngle) return angle - maxAngle;
        return 0;
    }
}
