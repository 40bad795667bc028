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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the script list shared by the OpenType {@code GSUB} and {@code GPOS} tables.
 */
public final class LayoutTables {

    private LayoutTables() {
    }

    /**
     * Script tags listed in a {@code GSUB} or {@code GPOS} ScriptList.
     *
     * @param table the complete layout table
     * @param tag   tag of the table, for error messages
     * @throws FontTableException if the header or script list is out of bounds
     */
    public static Set<Integer> scriptTags(byte[] table, String tag) {
        if (table == null || table.length < 10) {
            throw new FontTableException(tag, "table too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(table).order(ByteOrder.BIG_ENDIAN);
        int scriptListOffset = buf.getShort(4) & 0xFFFF;
        if (scriptListOffset == 0) {
            return Set.of();
        }
        if (scriptListOffset + 2 > table.length) {
            throw new FontTableException(tag, "ScriptList offset out of range", 4);
        }
        int count = buf.getShort(scriptListOffset) & 0xFFFF;
        if (scriptListOffset + 2 + count * 6 > table.length) {
            throw new FontTableException(tag, "ScriptRecords exceed table length", scriptListOffset);
        }

        Set<Integer> tags = new LinkedHashSet<>();
        for (int i = 0; i < count; i++) {
            tags.add(buf.getInt(scriptListOffset + 2 + i * 6));
        }
        return tags;
    }
}
