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

/**
 * Reads a {@code cmap} table into a {@link CharacterMap}.
 *
 * <p>Of the encoding sub-tables present, the one with the widest Unicode
 * coverage is used: a format 12 or 13 full-range table, then a format 4 BMP
 * table, then a Windows symbol table. The offset of a format 14 variation
 * selector sub-table, if any, is reported alongside the map.
 *
 * <p>Validation is strict. Partially trusting a damaged table would let a face
 * claim glyphs it cannot draw, so any inconsistency throws
 * {@link FontTableException} and no map is produced.
 */
public final class CharacterMapReader {

    private static final String TABLE = "cmap";

    private static final int PLATFORM_UNICODE = 0;
    private static final int PLATFORM_MICROSOFT = 3;

    private static final int EID_UNICODE_FULL = 4;
    private static final int EID_UNICODE_VARIATIONS = 5;
    private static final int EID_UNICODE_FULL_LAST_RESORT = 6;
    private static final int EID_MS_SYMBOL = 0;
    private static final int EID_MS_UNICODE_BMP = 1;
    private static final int EID_MS_UNICODE_FULL = 10;

    private static final int FORMAT_SEGMENT_MAPPING = 4;
    private static final int FORMAT_SEGMENTED_COVERAGE = 12;
    private static final int FORMAT_MANY_TO_ONE = 13;
    private static final int FORMAT_VARIATION_SEQUENCES = 14;

    /** Symbol fonts place their glyphs at U+F020..U+F0FF. */
    private static final int SYMBOL_AREA_START = 0xF020;
    private static final int SYMBOL_AREA_END = 0xF0FF;
    private static final int SYMBOL_AREA_SHIFT = 0xF000;

    /**
     * @param map       the code points with a non-zero glyph mapping
     * @param uvsOffset offset of the format 14 sub-table within {@code cmap}, or 0
     */
    public record Result(CharacterMap map, int uvsOffset) {}

    private CharacterMapReader() {
    }

    /**
     * Parse a complete {@code cmap} table.
     *
     * @throws FontTableException if the table is malformed or has no usable Unicode sub-table
     */
    public static Result read(byte[] cmap) {
        if (cmap == null || cmap.length < 4) {
            throw new FontTableException(TABLE, "table too short");
        }
        ByteBuffer buf = ByteBuffer.wrap(cmap).order(ByteOrder.BIG_ENDIAN);

        int numTables = u16(buf, 2);
        require(buf, 4, numTables * 8);

        int bestOffset = -1;
        int bestRank = 0;
        boolean bestSymbol = false;
        int uvsOffset = 0;

        for (int i = 0; i < numTables; i++) {
            int rec = 4 + i * 8;
            int platformId = u16(buf, rec);
            int encodingId = u16(buf, rec + 2);
            long offset = u32(buf, rec + 4);
            if (offset + 2 > cmap.length) {
                throw new FontTableException(TABLE, "sub-table offset out of range", offset);
            }
            int format = u16(buf, (int) offset);

            if (platformId == PLATFORM_UNICODE && encodingId == EID_UNICODE_VARIATIONS
                    && format == FORMAT_VARIATION_SEQUENCES) {
                uvsOffset = (int) offset;
                continue;
            }

            int rank = rank(platformId, encodingId, format);
            if (rank > bestRank) {
                bestRank = rank;
                bestOffset = (int) offset;
                bestSymbol = platformId == PLATFORM_MICROSOFT && encodingId == EID_MS_SYMBOL;
            }
        }

        if (bestOffset < 0) {
            throw new FontTableException(TABLE, "no Unicode encoding sub-table");
        }

        CharacterMap.Builder builder = new CharacterMap.Builder();
        int format = u16(buf, bestOffset);
        switch (format) {
            case FORMAT_SEGMENT_MAPPING -> readFormat4(buf, bestOffset, builder);
            case FORMAT_SEGMENTED_COVERAGE -> readFormat12(buf, bestOffset, builder, false);
            case FORMAT_MANY_TO_ONE -> readFormat12(buf, bestOffset, builder, true);
            default -> throw new FontTableException(TABLE, "unsupported format " + format, bestOffset);
        }

        if (bestSymbol) {
            for (int cp = SYMBOL_AREA_START; cp <= SYMBOL_AREA_END; cp++) {
                if (builder.contains(cp)) {
                    builder.set(cp - SYMBOL_AREA_SHIFT);
                }
            }
        }

        return new Result(builder.build(), uvsOffset);
    }

    /** Higher is better; 0 means unusable. */
    private static int rank(int platformId, int encodingId, int format) {
        boolean fullRepertoire = (platformId == PLATFORM_MICROSOFT && encodingId == EID_MS_UNICODE_FULL)
                || (platformId == PLATFORM_UNICODE
                        && (encodingId == EID_UNICODE_FULL || encodingId == EID_UNICODE_FULL_LAST_RESORT));
        if (fullRepertoire && format == FORMAT_SEGMENTED_COVERAGE) {
            return 5;
        }
        if (fullRepertoire && format == FORMAT_MANY_TO_ONE) {
            return 4;
        }
        if (format == FORMAT_SEGMENT_MAPPING) {
            if (platformId == PLATFORM_MICROSOFT && encodingId == EID_MS_UNICODE_BMP) {
                return 3;
            }
            if (platformId == PLATFORM_UNICODE && encodingId <= 3) {
                return 3;
            }
            if (platformId == PLATFORM_MICROSOFT && encodingId == EID_MS_SYMBOL) {
                return 2;
            }
        }
        return 0;
    }

    // ==================================================================================
    // Format 4: segment mapping to delta values (BMP)
    // ==================================================================================

    private static void readFormat4(ByteBuffer buf, int base, CharacterMap.Builder builder) {
        require(buf, base, 14);
        int length = u16(buf, base + 2);
        require(buf, base, length);

        int segCountX2 = u16(buf, base + 6);
        if (segCountX2 == 0 || (segCountX2 & 1) != 0) {
            throw new FontTableException(TABLE, "bad segCountX2 " + segCountX2, base + 6);
        }
        int segCount = segCountX2 / 2;
        if (14 + segCountX2 * 4 + 2 > length) {
            throw new FontTableException(TABLE, "format 4 segment arrays exceed sub-table length", base);
        }

        int endCodes = base + 14;
        int startCodes = endCodes + segCountX2 + 2;
        int idDeltas = startCodes + segCountX2;
        int idRangeOffsets = idDeltas + segCountX2;
        int limit = base + length;

        if (u16(buf, endCodes + (segCount - 1) * 2) != 0xFFFF) {
            throw new FontTableException(TABLE, "last format 4 segment does not end at 0xFFFF", base);
        }

        int prevEnd = -1;
        for (int i = 0; i < segCount; i++) {
            int end = u16(buf, endCodes + i * 2);
            int start = u16(buf, startCodes + i * 2);
            int delta = buf.getShort(idDeltas + i * 2);
            int rangeOffsetPos = idRangeOffsets + i * 2;
            int rangeOffset = u16(buf, rangeOffsetPos);

            if (start > end) {
                throw new FontTableException(TABLE, "segment start after end", endCodes + i * 2);
            }
            if (start <= prevEnd) {
                throw new FontTableException(TABLE, "segments out of order", startCodes + i * 2);
            }
            prevEnd = end;

            if (start == 0xFFFF) {
                // Terminating segment, maps nothing.
                break;
            }
            int last = end == 0xFFFF ? 0xFFFE : end;

            if (rangeOffset == 0) {
                for (int c = start; c <= last; c++) {
                    if (((c + delta) & 0xFFFF) != 0) {
                        builder.set(c);
                    }
                }
            } else {
                for (int c = start; c <= last; c++) {
                    int addr = rangeOffsetPos + rangeOffset + (c - start) * 2;
                    if (addr + 2 > limit) {
                        throw new FontTableException(TABLE, "glyph index address out of range", addr);
                    }
                    int glyph = u16(buf, addr);
                    if (glyph != 0 && ((glyph + delta) & 0xFFFF) != 0) {
                        builder.set(c);
                    }
                }
            }
        }
    }

    // ==================================================================================
    // Formats 12 and 13: sequential and constant map groups (full range)
    // ==================================================================================

    private static void readFormat12(ByteBuffer buf, int base, CharacterMap.Builder builder,
                                     boolean manyToOne) {
        require(buf, base, 16);
        long length = u32(buf, base + 4);
        require(buf, base, length);

        long numGroups = u32(buf, base + 12);
        if (16 + numGroups * 12 > length) {
            throw new FontTableException(TABLE, "group count " + numGroups + " exceeds sub-table length", base);
        }

        long prevEnd = -1;
        for (int i = 0; i < numGroups; i++) {
            int group = base + 16 + i * 12;
            long start = u32(buf, group);
            long end = u32(buf, group + 4);
            long glyph = u32(buf, group + 8);

            if (start > end || end > CharacterMap.MAX_CODE_POINT) {
                throw new FontTableException(TABLE, String.format("bad group 0x%X..0x%X", start, end), group);
            }
            if (start <= prevEnd) {
                throw new FontTableException(TABLE, "groups out of order", group);
            }
            prevEnd = end;

            if (manyToOne) {
                if (glyph != 0) {
                    builder.setRange((int) start, (int) end);
                }
            } else {
                // The first code point of a group starting at glyph 0 maps to .notdef.
                long first = glyph == 0 ? start + 1 : start;
                if (first <= end) {
                    builder.setRange((int) first, (int) end);
                }
            }
        }
    }

    // ==================================================================================
    // Helpers
    // ==================================================================================

    private static int u16(ByteBuffer buf, int pos) {
        if (pos < 0 || pos + 2 > buf.limit()) {
            throw new FontTableException(TABLE, "read past end of table", pos);
        }
        return buf.getShort(pos) & 0xFFFF;
    }

    private static long u32(ByteBuffer buf, int pos) {
        if (pos < 0 || pos + 4 > buf.limit()) {
            throw new FontTableException(TABLE, "read past end of table", pos);
        }
        return buf.getInt(pos) & 0xFFFFFFFFL;
    }

    private static void require(ByteBuffer buf, long pos, long length) {
        if (pos < 0 || pos + length > buf.limit()) {
            throw new FontTableException(TABLE, "truncated sub-table", pos);
        }
    }
}
