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
import java.util.Arrays;
import java.util.Objects;

/**
 * Replicated metadata of one face. Holds no native handles.
 *
 * @param coverage flat {@code [start, end, ...]} code point ranges after
 *                 filtering; null is read as empty
 */
public record FaceRecord(
        String name,
        String styleName,
        FontRange weight,
        FontRange stretch,
        SlantRange slant,
        boolean fixedPitch,
        boolean standardFace,
        boolean requiresAlternateShaping,
        int uvsOffset,
        int[] coverage
) implements Serializable {

    public FaceRecord {
        coverage = coverage == null ? new int[0] : coverage.clone();
    }

    /** Snapshot of a face, building its coverage first if needed. */
    public static FaceRecord of(FontFace face) {
        int[] coverage = face.characterMap().ranges();
        return new FaceRecord(face.name(), face.styleName(), face.weight(), face.stretch(), face.slant(),
                face.isFixedPitch(), face.isStandardFace(), face.requiresAlternateShaping(),
                face.uvsOffset(), coverage);
    }

    @Override
    public int[] coverage() {
        return coverage.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FaceRecord other)) return false;
        return fixedPitch == other.fixedPitch
                && standardFace == other.standardFace
                && requiresAlternateShaping == other.requiresAlternateShaping
                && uvsOffset == other.uvsOffset
                && name.equals(other.name)
                && Objects.equals(styleName, other.styleName)
                && weight.equals(other.weight)
                && stretch.equals(other.stretch)
                && slant.equals(other.slant)
                && Arrays.equals(coverage, other.coverage);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(coverage);
    }

    @Override
    public String toString() {
        return String.format("FaceRecord[%s, %s, weight %s, stretch %s, %s, %s]", name, styleName, weight,
                stretch, slant.kind(), (coverage.length / 2) + " ranges");
    }
}
