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

import dev.everydaythings.fontcat.sfnt.CharacterMap;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Trims a face's claimed coverage to the complex scripts it can actually shape.
 *
 * <p>A face that maps Arabic or Indic code points without layout tables for
 * them renders broken text, so its claim is dropped and fallback picks a
 * better face. Faces carrying AAT layout tables are shaped by the AAT engine
 * and keep their claims. A small blocklist of families is known to claim
 * Tibetan and Arabic code points they cannot draw, even with AAT tables; those
 * points are always cleared for them.
 *
 * <p>The filter only ever removes code points, and applying it twice gives the
 * same map as applying it once.
 */
public final class ComplexScriptFilter {

    private static final Logger log = Logger.getLogger(ComplexScriptFilter.class.getName());

    /** Families reporting Tibetan and Arabic coverage they do not have. */
    public static final Set<String> DEFAULT_SPURIOUS_COVERAGE_FAMILIES = Set.of(
            "Songti SC", "Songti TC", "STSong", "Kaiti SC", "Kaiti TC", "STKaiti");

    /** Inclusive ranges cleared for blocklisted families. */
    private static final int[][] SPURIOUS_RANGES = {
            {0x0F6B, 0x0F70}, {0x0F8C, 0x0F8F}, {0x0F98, 0x0F98}, {0x0FBD, 0x0FBD},
            {0x0FCD, 0x0FFF}, {0x0620, 0x0620}, {0x065F, 0x065F}, {0x06EE, 0x06EF},
            {0x06FF, 0x06FF}
    };

    /**
     * Layout capabilities of a face.
     *
     * @param aatLayout   {@code morx} or {@code mort} present
     * @param aatKerning  {@code kerx} present
     * @param gsub        {@code GSUB} present
     * @param gpos        {@code GPOS} present
     * @param gsubScripts script tags listed in the {@code GSUB} ScriptList
     */
    public record FaceLayout(boolean aatLayout, boolean aatKerning, boolean gsub, boolean gpos,
                             Set<Integer> gsubScripts) {

        public static final FaceLayout NONE = new FaceLayout(false, false, false, false, Set.of());

        public FaceLayout {
            gsubScripts = Set.copyOf(gsubScripts);
        }

        /** AAT shaping is needed when AAT tables stand alone, or whenever {@code kerx} is present. */
        public boolean requiresAlternateShaping() {
            return (aatLayout && !(gsub || gpos)) || aatKerning;
        }
    }

    /**
     * @param map                      filtered coverage
     * @param requiresAlternateShaping whether the face must be shaped with the AAT engine
     */
    public record Result(CharacterMap map, boolean requiresAlternateShaping) {}

    private final Set<String> spuriousCoverageFamilies;

    public ComplexScriptFilter() {
        this(DEFAULT_SPURIOUS_COVERAGE_FAMILIES);
    }

    /**
     * @param spuriousCoverageFamilies family names, matched case-insensitively
     */
    public ComplexScriptFilter(Collection<String> spuriousCoverageFamilies) {
        this.spuriousCoverageFamilies = spuriousCoverageFamilies.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public Result apply(CharacterMap map, FaceLayout layout, String familyName) {
        boolean alternateShaping = layout.requiresAlternateShaping();
        CharacterMap.Builder builder = null;

        for (ScriptRange range : ScriptRange.COMPLEX_SCRIPTS) {
            if (!map.intersects(range.start(), range.end())) {
                continue;
            }
            if (layout.aatLayout()) {
                // AAT shaping handles it.
                alternateShaping = true;
                continue;
            }
            if (layout.gsub() && range.declaredBy(layout.gsubScripts())) {
                continue;
            }
            if (builder == null) {
                builder = map.toBuilder();
            }
            builder.clearRange(range.start(), range.end());
            log.finer(() -> String.format("%s: dropped unshapable coverage U+%04X..U+%04X",
                    familyName, range.start(), range.end()));
        }

        if (alternateShaping && isSpuriousCoverageFamily(familyName)) {
            if (builder == null) {
                builder = map.toBuilder();
            }
            for (int[] range : SPURIOUS_RANGES) {
                builder.clearRange(range[0], range[1]);
            }
            log.fine(() -> familyName + ": cleared known-spurious Tibetan/Arabic coverage");
        }

        return new Result(builder == null ? map : builder.build(), alternateShaping);
    }

    boolean isSpuriousCoverageFamily(String familyName) {
        return familyName != null && spuriousCoverageFamilies.contains(familyName.toLowerCase(Locale.ROOT));
    }
}
