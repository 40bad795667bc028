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

import dev.everydaythings.fontcat.sfnt.SfntTags;

import java.util.List;
import java.util.Set;

/**
 * A block of code points belonging to a script that needs contextual shaping,
 * with the OpenType script tags a {@code GSUB} table uses to declare support.
 */
public record ScriptRange(int start, int end, Set<Integer> scriptTags) {

    /** Complex-script blocks whose claimed coverage must be backed by layout tables. */
    public static final List<ScriptRange> COMPLEX_SCRIPTS = List.of(
            // Arabic, with U+060C and U+061C left to any font.
            of(0x0600, 0x060B, "arab"),
            of(0x060D, 0x061B, "arab"),
            of(0x061D, 0x06FF, "arab"),
            of(0x0700, 0x074F, "syrc"),
            of(0x0750, 0x077F, "arab"),
            of(0x08A0, 0x08FF, "arab"),
            of(0x0900, 0x097F, "dev2", "deva"),
            of(0x0980, 0x09FF, "bng2", "beng"),
            of(0x0A00, 0x0A7F, "gur2", "guru"),
            of(0x0A80, 0x0AFF, "gjr2", "gujr"),
            of(0x0B00, 0x0B7F, "ory2", "orya"),
            of(0x0B80, 0x0BFF, "tml2", "taml"),
            of(0x0C00, 0x0C7F, "tel2", "telu"),
            of(0x0C80, 0x0CFF, "knd2", "knda"),
            of(0x0D00, 0x0D7F, "mlm2", "mlym"),
            of(0x0D80, 0x0DFF, "sinh"),
            of(0x0E80, 0x0EFF, "lao "),
            of(0x0F00, 0x0FFF, "tibt"),
            of(0x1000, 0x109F, "mym2", "mymr"),
            of(0x1780, 0x17FF, "khmr"),
            of(0xAA60, 0xAA7F, "mym2", "mymr")
    );

    public ScriptRange {
        scriptTags = Set.copyOf(scriptTags);
    }

    private static ScriptRange of(int start, int end, String... tags) {
        Integer[] packed = new Integer[tags.length];
        for (int i = 0; i < tags.length; i++) {
            packed[i] = SfntTags.tag(tags[i]);
        }
        return new ScriptRange(start, end, Set.of(packed));
    }

    /** Whether any of this range's tags appears in {@code declared}. */
    public boolean declaredBy(Set<Integer> declared) {
        for (Integer tag : scriptTags) {
            if (declared.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
