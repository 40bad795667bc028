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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Table directory of one face inside a TrueType/OpenType file or collection.
 *
 * <p>Only the directory is parsed up front; {@link #table(int)} slices a copy of
 * the requested table out of the backing data on demand.
 */
public final class SfntFile {

    /** TrueType sfnt version (0x00010000). */
    private static final int SFNT_VERSION_TRUETYPE = 0x00010000;

    /** OpenType/CFF sfnt version ('OTTO'). */
    private static final int SFNT_VERSION_CFF = 0x4F54544F;

    /** Legacy Apple TrueType version ('true'). */
    private static final int SFNT_VERSION_APPLE = 0x74727565;

    private static final int TABLE_RECORD_SIZE = 16;

    private final byte[] data;
    private final Map<Integer, TableRecord> tables;

    private SfntFile(byte[] data, Map<Integer, TableRecord> tables) {
        this.data = data;
        this.tables = tables;
    }

    /**
     * Number of faces in the data: the collection size for a TTC, otherwise 1.
     *
     * @throws FontTableException if the header is not a font header
     */
    public static int faceCount(byte[] data) {
        ByteBuffer buf = wrap(data);
        requireLength(data, 0, 12, "sfnt");
        if (buf.getInt(0) == SfntTags.TTC) {
            long numFonts = buf.getInt(8) & 0xFFFFFFFFL;
            requireLength(data, 12, numFonts * 4, "ttcf");
            return (int) numFonts;
        }
        return 1;
    }

    /**
     * Parse the table directory of the face at {@code faceIndex}.
     *
     * @param data      complete font file contents
     * @param faceIndex face index within a collection, 0 for a single font
     * @throws FontTableException if the directory is malformed or the index is out of range
     */
    public static SfntFile parse(byte[] data, int faceIndex) {
        ByteBuffer buf = wrap(data);
        requireLength(data, 0, 12, "sfnt");

        int fontOffset = 0;
        if (buf.getInt(0) == SfntTags.TTC) {
            int numFonts = faceCount(data);
            if (faceIndex < 0 || faceIndex >= numFonts) {
                throw new FontTableException("ttcf", "face index " + faceIndex + " out of range, "
                        + numFonts + " faces");
            }
            fontOffset = buf.getInt(12 + faceIndex * 4);
            requireLength(data, fontOffset, 12, "sfnt");
        } else if (faceIndex != 0) {
            throw new FontTableException("sfnt", "face index " + faceIndex + " in a single-face font");
        }

        int sfntVersion = buf.getInt(fontOffset);
        if (sfntVersion != SFNT_VERSION_TRUETYPE && sfntVersion != SFNT_VERSION_CFF
                && sfntVersion != SFNT_VERSION_APPLE) {
            throw new FontTableException("sfnt", String.format("unknown version 0x%08x", sfntVersion),
                    fontOffset);
        }

        int numTables = buf.getShort(fontOffset + 4) & 0xFFFF;
        int recordsStart = fontOffset + 12;
        requireLength(data, recordsStart, (long) numTables * TABLE_RECORD_SIZE, "sfnt");

        Map<Integer, TableRecord> tables = new LinkedHashMap<>();
        for (int i = 0; i < numTables; i++) {
            int pos = recordsStart + i * TABLE_RECORD_SIZE;
            int tag = buf.getInt(pos);
            long offset = buf.getInt(pos + 8) & 0xFFFFFFFFL;
            long length = buf.getInt(pos + 12) & 0xFFFFFFFFL;
            if (offset + length > data.length) {
                throw new FontTableException(SfntTags.toString(tag),
                        "table extends past end of data (" + (offset + length) + " > " + data.length + ")",
                        offset);
            }
            tables.put(tag, new TableRecord(tag, (int) offset, (int) length));
        }

        return new SfntFile(data, Collections.unmodifiableMap(tables));
    }

    /** Whether the directory lists the given table. */
    public boolean hasTable(int tag) {
        return tables.containsKey(tag);
    }

    /** Tags of all tables in the directory, in directory order. */
    public Set<Integer> tags() {
        return tables.keySet();
    }

    /**
     * Copy of the table's bytes.
     *
     * @return the table, or null if the face has no such table
     */
    public byte[] table(int tag) {
        TableRecord record = tables.get(tag);
        if (record == null) {
            return null;
        }
        return Arrays.copyOfRange(data, record.offset(), record.offset() + record.length());
    }

    private static ByteBuffer wrap(byte[] data) {
        if (data == null) {
            throw new FontTableException("sfnt", "no font data");
        }
        return ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
    }

    private static void requireLength(byte[] data, long offset, long length, String table) {
        if (offset < 0 || offset + length > data.length) {
            throw new FontTableException(table, "truncated, need " + (offset + length)
                    + " bytes, have " + data.length);
        }
    }

    private record TableRecord(int tag, int offset, int length) {}
}
