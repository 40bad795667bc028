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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StyleTraitsTest {

    @Test
    void anchorsMapExactly() {
        assertEquals(1, StyleTraits.weightFromTrait(-1.0));
        assertEquals(400, StyleTraits.weightFromTrait(0.0));
        assertEquals(500, StyleTraits.weightFromTrait(0.23));
        assertEquals(700, StyleTraits.weightFromTrait(0.4));
        assertEquals(1000, StyleTraits.weightFromTrait(1.0));
    }

    @Test
    void valuesBeyondAnchorsClamp() {
        assertEquals(1, StyleTraits.weightFromTrait(-3.0));
        assertEquals(1000, StyleTraits.weightFromTrait(1.5));
        assertEquals(1, StyleTraits.weightFromTrait(Double.NaN));
    }

    @Test
    void valuesBetweenAnchorsFallStrictlyBetween() {
        double[] traits = {-0.9, -0.5, 0.1, 0.25, 0.35, 0.5, 0.6, 0.8};
        double[][] bounds = {{1, 100}, {200, 300}, {400, 500}, {500, 600}, {600, 700}, {700, 800},
                {800, 900}, {900, 1000}};
        for (int i = 0; i < traits.length; i++) {
            double w = StyleTraits.weightFromTrait(traits[i]);
            double lo = bounds[i][0];
            double hi = bounds[i][1];
            assertTrue(w > lo && w < hi, () -> w + " not strictly within (" + lo + ", " + hi + ")");
        }
        assertEquals(450, StyleTraits.weightFromTrait(0.115), 1e-9);
    }

    @Test
    void inverseWeightMapping() {
        assertEquals(0.4, StyleTraits.traitFromWeight(700), 1e-12);
        assertEquals(0.0, StyleTraits.traitFromWeight(400), 1e-12);
        assertEquals(550, StyleTraits.weightFromTrait(StyleTraits.traitFromWeight(550)), 1e-9);
    }

    @Test
    void stretchIsPiecewiseLinear() {
        assertEquals(100, StyleTraits.stretchFromTrait(0));
        assertEquals(200, StyleTraits.stretchFromTrait(1));
        assertEquals(150, StyleTraits.stretchFromTrait(0.5));
        assertEquals(50, StyleTraits.stretchFromTrait(-1));
        assertEquals(75, StyleTraits.stretchFromTrait(-0.5));
        assertEquals(-0.5, StyleTraits.traitFromStretch(75), 1e-12);
    }

    @Test
    void overrideRoundsToHundredAndClamps() {
        assertEquals(600, StyleTraits.overrideWeight(649));
        assertEquals(700, StyleTraits.overrideWeight(650));
        assertEquals(100, StyleTraits.overrideWeight(30));
        assertEquals(900, StyleTraits.overrideWeight(950));
        assertEquals(900, StyleTraits.overrideWeight(1200));
    }
}
