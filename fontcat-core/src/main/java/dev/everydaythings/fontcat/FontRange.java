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
 * A closed interval {@code [min, max]} on a style axis. Static faces have
 * {@code min == max}; variable faces carry the declared axis range.
 */
public record FontRange(double min, double max) implements Serializable {

    public FontRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
        }
    }

    public static FontRange of(double value) {
        return new FontRange(value, value);
    }

    public static FontRange of(double min, double max) {
        return new FontRange(min, max);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /** The value nearest to {@code value} inside the range. */
    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean isSingle() {
        return min == max;
    }

    @Override
    public String toString() {
        return isSingle() ? format(min) : format(min) + ".." + format(max);
    }

    private static String format(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
