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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads localized strings from a {@code name} table.
 *
 * <p>Used to discover the other names a family is known by (for example its
 * Japanese or Chinese family name) so that lookups by those names succeed.
 */
public final class NameTableReader {

    private static final String TABLE = "name";

    public static final int NAME_ID_FAMILY = 1;
    public static final int NAME_ID_SUBFAMILY = 2;
    public static final int NAME_ID_FULL_NAME = 4;
    public static final int NAME_ID_POSTSCRIPT = 6;
    public static final int NAME_ID_TYPOGRAPHIC_FAMILY = 16;

    private NameTableReader() {
    }

    /**
     * All distinct strings recorded under {@code nameId}, in table order,
     * across every platform and language.
     *
     * @throws FontTableException if the table is malformed
     */
    public static List<String> names(byte[] name, int nameId) {
        if (name == null || name.length < 6) {
            throw new FontTableException(TABLE, "table too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(name).order(ByteOrder.BIG_ENDIAN);
        int count = buf.getShort(2) & 0xFFFF;
        int stringOffset = buf.getShort(4) & 0xFFFF;
        if (6 + count * 12 > name.length) {
            throw new FontTableException(TABLE, "name records exceed table length", 6);
        }

        Set<String> found = new LinkedHashSet<>();
        for (int i = 0; i < count; i++) {
            int rec = 6 + i * 12;
            int platformId = buf.getShort(rec) & 0xFFFF;
            int id = buf.getShort(rec + 6) & 0xFFFF;
            if (id != nameId) {
                continue;
            }
            int length = buf.getShort(rec + 8) & 0xFFFF;
            int offset = buf.getShort(rec + 10) & 0xFFFF;
            int start = stringOffset + offset;
            if (start + length > name.length) {
                throw new FontTableException(TABLE, "string out of range", start);
            }
            String value = new String(name, start, length, charset(platformId)).trim();
            if (!value.isEmpty()) {
                found.add(value);
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Family names (legacy and typographic) for every language.
     */
    public static List<String> familyNames(byte[] name) {
        Set<String> all = new LinkedHashSet<>(names(name, NAME_ID_TYPOGRAPHIC_FAMILY));
        all.addAll(names(name, NAME_ID_FAMILY));
        return new ArrayList<>(all);
    }

    /**
     * Family names other than {@code canonical}, compared case-insensitively.
     */
    public static List<String> otherFamilyNames(String canonical, byte[] name) {
        String key = canonical.toLowerCase(Locale.ROOT);
        List<String> others = new ArrayList<>();
        for (String family : familyNames(name)) {
            if (!family.toLowerCase(Locale.ROOT).equals(key)) {
                others.add(family);
            }
        }
        return others;
    }

    private static Charset charset(int platformId) {
        // Unicode and Windows strings are UTF-16BE, Macintosh Roman approximated as Latin-1.
        return platformId == 0 || platformId == 3 ? StandardCharsets.UTF_16BE : StandardCharsets.ISO_8859_1;
    }
}
