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

import java.util.Arrays;

/**
 * Immutable set of the Unicode code points a face can render.
 *
 * <p>Stored as a sparse bit set of 256-code-point blocks; blocks with no bits
 * set are not allocated, so a typical Latin font costs a few hundred bytes.
 * Equality and {@link #hashCode()} are by content, which lets a catalog intern
 * identical maps shared by many faces of a family.
 *
 * <p>Instances are built with a {@link Builder} and never change afterwards, so
 * they can be read from any thread without synchronization.
 */
public final class CharacterMap {

    public static final int MAX_CODE_POINT = 0x10FFFF;

    static final int BLOCK_SHIFT = 8;
    static final int BLOCK_SIZE = 1 << BLOCK_SHIFT;
    static final int WORDS_PER_BLOCK = BLOCK_SIZE / Long.SIZE;
    static final int BLOCK_COUNT = (MAX_CODE_POINT >> BLOCK_SHIFT) + 1;

    private static final CharacterMap EMPTY = new CharacterMap(new long[0][]);

    /** Trimmed so the last entry is non-null; null entries are empty blocks. */
    private final long[][] blocks;
    private final int cardinality;
    private final int hash;

    private CharacterMap(long[][] blocks) {
        this.blocks = blocks;
        int count = 0;
        for (long[] block : blocks) {
            if (block != null) {
                for (long word : block) {
                    count += Long.bitCount(word);
                }
            }
        }
        this.cardinality = count;
        this.hash = Arrays.deepHashCode(blocks);
    }

    /** The map that contains nothing. */
    public static CharacterMap empty() {
        return EMPTY;
    }

    /**
     * Rebuild a map from the flat {@code [start, end, start, end, ...]} form
     * produced by {@link #ranges()}.
     */
    public static CharacterMap fromRanges(int[] ranges) {
        if (ranges.length % 2 != 0) {
            throw new IllegalArgumentException("ranges must hold start/end pairs");
        }
        Builder builder = new Builder();
        for (int i = 0; i < ranges.length; i += 2) {
            builder.setRange(ranges[i], ranges[i + 1]);
        }
        return builder.build();
    }

    public boolean contains(int codePoint) {
        return test(blocks, codePoint);
    }

    /** Whether any code point in {@code [start, end]} is present. */
    public boolean intersects(int start, int end) {
        int next = nextSetBit(blocks, start);
        return next >= 0 && next <= end;
    }

    /**
     * The smallest code point at or after {@code from} that is present.
     *
     * @return the code point, or -1 if there is none
     */
    public int nextCodePoint(int from) {
        return nextSetBit(blocks, from);
    }

    /** Number of code points present. */
    public int cardinality() {
        return cardinality;
    }

    public boolean isEmpty() {
        return cardinality == 0;
    }

    /**
     * Present code points as inclusive ranges, flattened to
     * {@code [start, end, start, end, ...]} in ascending order.
     */
    public int[] ranges() {
        int[] out = new int[16];
        int n = 0;
        int cp = nextSetBit(blocks, 0);
        while (cp >= 0) {
            int end = cp;
            while (end < MAX_CODE_POINT && test(blocks, end + 1)) {
                end++;
            }
            if (n + 2 > out.length) {
                out = Arrays.copyOf(out, out.length * 2);
            }
            out[n++] = cp;
            out[n++] = end;
            cp = end < MAX_CODE_POINT ? nextSetBit(blocks, end + 1) : -1;
        }
        return Arrays.copyOf(out, n);
    }

    /** Approximate heap footprint, for font list logging. */
    public long sizeInBytes() {
        long size = 16L + 8L * blocks.length;
        for (long[] block : blocks) {
            if (block != null) {
                size += 16L + 8L * WORDS_PER_BLOCK;
            }
        }
        return size;
    }

    /** A mutable copy, for filters that need to clear ranges. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        for (int i = 0; i < blocks.length; i++) {
            if (blocks[i] != null) {
                builder.blocks[i] = blocks[i].clone();
            }
        }
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharacterMap other)) return false;
        return hash == other.hash && cardinality == other.cardinality
                && Arrays.deepEquals(blocks, other.blocks);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return String.format("CharacterMap[%d code points, hash %08x]", cardinality, hash);
    }

    // ==================================================================================
    // Bit operations shared with Builder
    // ==================================================================================

    private static boolean test(long[][] blocks, int codePoint) {
        if (codePoint < 0 || codePoint > MAX_CODE_POINT) return false;
        int b = codePoint >>> BLOCK_SHIFT;
        if (b >= blocks.length || blocks[b] == null) return false;
        int bit = codePoint & (BLOCK_SIZE - 1);
        return (blocks[b][bit >>> 6] & (1L << (bit & 63))) != 0;
    }

    private static int nextSetBit(long[][] blocks, int from) {
        if (from < 0) from = 0;
        if (from > MAX_CODE_POINT) return -1;
        int b = from >>> BLOCK_SHIFT;
        int bit = from & (BLOCK_SIZE - 1);
        for (; b < blocks.length; b++, bit = 0) {
            long[] block = blocks[b];
            if (block == null) continue;
            for (int w = bit >>> 6; w < WORDS_PER_BLOCK; w++) {
                long word = block[w];
                if (w == bit >>> 6) {
                    word &= -1L << (bit & 63);
                }
                if (word != 0) {
                    return (b << BLOCK_SHIFT) + (w << 6) + Long.numberOfTrailingZeros(word);
                }
            }
        }
        return -1;
    }

    /**
     * Mutable bit set used while reading a {@code cmap} table and while
     * filtering. Not thread safe.
     */
    public static final class Builder {

        private final long[][] blocks = new long[BLOCK_COUNT][];

        public Builder set(int codePoint) {
            checkCodePoint(codePoint);
            int b = codePoint >>> BLOCK_SHIFT;
            if (blocks[b] == null) {
                blocks[b] = new long[WORDS_PER_BLOCK];
            }
            int bit = codePoint & (BLOCK_SIZE - 1);
            blocks[b][bit >>> 6] |= 1L << (bit & 63);
            return this;
        }

        /** Set every code point in {@code [start, end]}. */
        public Builder setRange(int start, int end) {
            checkCodePoint(start);
            checkCodePoint(end);
            for (int cp = start; cp <= end; cp++) {
                int b = cp >>> BLOCK_SHIFT;
                int bit = cp & (BLOCK_SIZE - 1);
                if (bit == 0 && cp + BLOCK_SIZE - 1 <= end) {
                    long[] full = new long[WORDS_PER_BLOCK];
                    Arrays.fill(full, -1L);
                    blocks[b] = full;
                    cp += BLOCK_SIZE - 1;
                } else {
                    set(cp);
                }
            }
            return this;
        }

        public Builder clear(int codePoint) {
            checkCodePoint(codePoint);
            int b = codePoint >>> BLOCK_SHIFT;
            if (blocks[b] != null) {
                int bit = codePoint & (BLOCK_SIZE - 1);
                blocks[b][bit >>> 6] &= ~(1L << (bit & 63));
            }
            return this;
        }

        /** Clear every code point in {@code [start, end]}. */
        public Builder clearRange(int start, int end) {
            checkCodePoint(start);
            checkCodePoint(end);
            for (int cp = start; cp <= end; cp++) {
                int b = cp >>> BLOCK_SHIFT;
                if (blocks[b] == null) {
                    cp = ((b + 1) << BLOCK_SHIFT) - 1;
                    continue;
                }
                if ((cp & (BLOCK_SIZE - 1)) == 0 && cp + BLOCK_SIZE - 1 <= end) {
                    blocks[b] = null;
                    cp += BLOCK_SIZE - 1;
                } else {
                    clear(cp);
                }
            }
            return this;
        }

        public boolean contains(int codePoint) {
            return test(blocks, codePoint);
        }

        /** Whether any code point in {@code [start, end]} is set. */
        public boolean intersects(int start, int end) {
            int next = nextSetBit(blocks, start);
            return next >= 0 && next <= end;
        }

        /** Snapshot the current contents as an immutable map. */
        public CharacterMap build() {
            int last = -1;
            long[][] copy = new long[BLOCK_COUNT][];
            for (int i = 0; i < BLOCK_COUNT; i++) {
                long[] block = blocks[i];
                if (block != null && !isZero(block)) {
                    copy[i] = block.clone();
                    last = i;
                }
            }
            if (last < 0) {
                return EMPTY;
            }
            return new CharacterMap(Arrays.copyOf(copy, last + 1));
        }

        private static boolean isZero(long[] block) {
            for (long word : block) {
                if (word != 0) return false;
            }
            return true;
        }

        private static void checkCodePoint(int codePoint) {
            if (codePoint < 0 || codePoint > MAX_CODE_POINT) {
                throw new IllegalArgumentException(String.format("Not a code point: 0x%X", codePoint));
            }
        }
    }
}
