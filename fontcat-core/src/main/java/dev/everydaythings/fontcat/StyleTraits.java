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

/**
 * Conversions between platform style traits and CSS style values.
 *
 * <p>Platforms report weight and width as continuous traits in [-1, 1]. Weight
 * is mapped through a table of observed anchor points with linear
 * interpolation between them; width maps piecewise-linearly to a stretch
 * percentage of 50..200.
 */
public final class StyleTraits {

    public static final double MIN_WEIGHT = 1;
    public static final double MAX_WEIGHT = 1000;

    /** Weight trait anchors, ascending. */
    private static final double[] TRAITS = {
            -1.0, -0.8, -0.6, -0.4, 0.0, 0.23, 0.3, 0.4, 0.56, 0.62, 1.0
    };

    /** CSS weight at each anchor in {@link #TRAITS}. */
    private static final double[] WEIGHTS = {
            1, 100, 200, 300, 400, 500, 600, 700, 800, 900, 1000
    };

    private StyleTraits() {
    }

    /**
     * CSS weight for a weight trait. Values past either end clamp to 1 or
     * 1000; values between anchors interpolate and are not rounded, so they
     * land strictly between the two anchor weights.
     */
    public static double weightFromTrait(double trait) {
        return interpolate(TRAITS, WEIGHTS, trait);
    }

    /** Inverse of {@link #weightFromTrait}, for providers that report CSS weights. */
    public static double traitFromWeight(double weight) {
        return interpolate(WEIGHTS, TRAITS, weight);
    }

    /** Stretch percentage for a width trait: 100..200 above zero, 50..100 below. */
    public static double stretchFromTrait(double trait) {
        double t = Math.max(-1.0, Math.min(1.0, trait));
        return t >= 0 ? 100 + 100 * t : 100 + 50 * t;
    }

    /** Inverse of {@link #stretchFromTrait}. */
    public static double traitFromStretch(double stretch) {
        double s = Math.max(50, Math.min(200, stretch));
        return s >= 100 ? (s - 100) / 100 : (s - 100) / 50;
    }

    /**
     * Normalize an administratively configured weight: rounded to the nearest
     * multiple of 100 and clamped to [100, 900].
     */
    public static double overrideWeight(int configured) {
        int hundreds = (configured + 50) / 100;
        hundreds = Math.max(1, Math.min(9, hundreds));
        return hundreds * 100.0;
    }

    private static double interpolate(double[] from, double[] to, double value) {
        if (Double.isNaN(value) || value <= from[0]) {
            return to[0];
        }
        int last = from.length - 1;
        if (value >= from[last]) {
            return to[last];
        }
        // First anchor at or above value.
        int lo = 0;
        int hi = last;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (from[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        if (from[lo] == value) {
            return to[lo];
        }
        double t = (value - from[lo - 1]) / (from[lo] - from[lo - 1]);
        return to[lo - 1] + t * (to[lo] - to[lo - 1]);
    }
}
