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
 * A requested style: CSS weight (1..1000), stretch percentage, slant, and
 * size in CSS pixels.
 */
public record StyleRequest(double weight, double stretch, Slant slant, double size) implements Serializable {

    public static final StyleRequest NORMAL = new StyleRequest(400, 100, Slant.NORMAL, 16);

    public StyleRequest {
        if (slant == null) {
            throw new IllegalArgumentException("Slant is required");
        }
        if (weight < 1 || weight > 1000) {
            throw new IllegalArgumentException("Weight out of range: " + weight);
        }
        if (stretch <= 0) {
            throw new IllegalArgumentException("Stretch must be positive: " + stretch);
        }
    }

    public StyleRequest withWeight(double weight) {
        return new StyleRequest(weight, stretch, slant, size);
    }

    public StyleRequest withStretch(double stretch) {
        return new StyleRequest(weight, stretch, slant, size);
    }

    public StyleRequest withSlant(Slant slant) {
        return new StyleRequest(weight, stretch, slant, size);
    }

    public StyleRequest withSize(double size) {
        return new StyleRequest(weight, stretch, slant, size);
    }
}
