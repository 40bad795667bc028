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

package dev.everydaythings.fontcat.sfnt;

import java.nio.charset.StandardCharsets;

/**
 * Four-byte SFNT table and OpenType script tags used by the catalog.
 */
public final class SfntTags {

    public static final int CMAP = tag("cmap");
    public static final int NAME = tag("name");
    public static final int OS2 = tag("OS/2");
    public static final int FVAR = tag("fvar");
    public static final int GSUB = tag("GSUB");
    public static final int GPOS = tag("GPOS");

    /** AAT extended glyph metamorphosis. */
    public static final int MORX = tag("morx");
    /** AAT legacy glyph metamorphosis. */
    public static final int MORT = tag("mort");
    /** AAT extended kerning. */
    public static final int KERX = tag("kerx");
    /** Graphite glyph substitution; such fonts shape their own scripts. */
    public static final int SILF = tag("Silf");

    /** TrueType collection header ('ttcf'). */
    static final int TTC = tag("ttcf");

    private SfntTags() {
    }

    /**
     * Pack a four-character ASCII tag into an int. Shorter tags are padded
     * with spaces, as in {@code "lao "}.
     */
    public static int tag(String name) {
        if (name.length() > 4) {
            throw new IllegalArgumentException("Tag longer than 4 characters: " + name);
        }
        int value = 0;
        for (int i = 0; i < 4; i++) {
            char c = i < name.length() ? name.charAt(i) : ' ';
            if (c > 0x7E) {
                throw new IllegalArgumentException("Tag must be ASCII: " + name);
            }
            value = (value << 8) | c;
        }
        return value;
    }

    /** The four-character form of a packed tag. */
    public static String toString(int tag) {
        byte[] bytes = {
                (byte) (tag >>> 24), (byte) (tag >>> 16), (byte) (tag >>> 8), (byte) tag
        };
        return new String(bytes, StandardCharsets.US_ASCII);
    }
}
