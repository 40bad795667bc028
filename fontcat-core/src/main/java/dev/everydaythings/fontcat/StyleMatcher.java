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

import java.util.List;

/**
 * CSS font matching over a family's faces.
 *
 * <p>Candidates are compared by stretch distance, then slant distance, then
 * weight distance. Faces on the non-preferred side of a requested value are
 * pushed behind every face on the preferred side. Among equal distances the
 * earlier face in family order wins, which is why families keep "Regular"
 * ahead of faces with the same attributes.
 */
public final class StyleMatcher {

    /** Penalty that moves a candidate behind every face on the preferred side. */
    static final double REVERSE = 1000;

    private StyleMatcher() {
    }

    /**
     * @return the best face, or null if {@code faces} is empty
     */
    public static FontFace bestMatch(List<FontFace> faces, StyleRequest request) {
        FontFace best = null;
        double bestStretch = 0;
        double bestSlant = 0;
        double bestWeight = 0;
        for (FontFace face : faces) {
            double stretch = stretchDistance(face.stretch(), request.stretch());
            double slant = slantDistance(face.slant(), request.slant());
            double weight = weightDistance(face.weight(), request.weight());
            if (best == null
                    || stretch < bestStretch
                    || (stretch == bestStretch && slant < bestSlant)
                    || (stretch == bestStretch && slant == bestSlant && weight < bestWeight)) {
                best = face;
                bestStretch = stretch;
                bestSlant = slant;
                bestWeight = weight;
            }
        }
        return best;
    }

    /**
     * Below 400 lighter faces come first; above 500 heavier faces come first;
     * in between, faces up to 500 come first, then lighter, then heavier.
     */
    static double weightDistance(FontRange range, double requested) {
        if (range.contains(requested)) {
            return 0;
        }
        boolean heavier = range.min() > requested;
        double distance = heavier ? range.min() - requested : requested - range.max();
        if (requested < 400) {
            return heavier ? distance + REVERSE : distance;
        }
        if (requested > 500) {
            return heavier ? distance : distance + REVERSE;
        }
        if (heavier) {
            return range.min() <= 500 ? distance : distance + 2 * REVERSE;
        }
        return distance + REVERSE;
    }

    /** At or below 100% narrower faces come first, above it wider faces do. */
    static double stretchDistance(FontRange range, double requested) {
        if (range.contains(requested)) {
            return 0;
        }
        boolean wider = range.min() > requested;
        double distance = wider ? range.min() - requested : requested - range.max();
        if (requested <= 100) {
            return wider ? distance + REVERSE : distance;
        }
        return wider ? distance : distance + REVERSE;
    }

    static double slantDistance(SlantRange range, Slant requested) {
        return switch (requested.kind()) {
            case ITALIC -> switch (range.kind()) {
                case ITALIC -> 0;
                case OBLIQUE -> 1 + range.angleDistance(Slant.DEFAULT_OBLIQUE_ANGLE) / 180;
                case NORMAL -> 3;
            };
            case OBLIQUE -> switch (range.kind()) {
                case OBLIQUE -> range.angleDistance(requested.angle()) / 180;
                case ITALIC -> 2;
                case NORMAL -> 3;
            };
            case NORMAL -> switch (range.kind()) {
                case NORMAL -> 0;
                case OBLIQUE -> range.angleDistance(0) / 180;
                case ITALIC -> 2;
            };
        };
    }
}
