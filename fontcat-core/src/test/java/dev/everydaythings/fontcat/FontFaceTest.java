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
import dev.everydaythings.fontcat.sfnt.SfntBuilder;
import dev.everydaythings.fontcat.sfnt.SfntTags;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FontFaceTest {

    /** Table source over a map, counting reads per tag. */
    private static final class CountingTables implements FaceTables {
        final Map<Integer, byte[]> tables = new HashMap<>();
        final Map<Integer, AtomicInteger> reads = new ConcurrentHashMap<>();

        CountingTables put(String tag, byte[] data) {
            tables.put(SfntTags.tag(tag), data);
            return this;
        }

        int reads(String tag) {
            AtomicInteger count = reads.get(SfntTags.tag(tag));
            return count == null ? 0 : count.get();
        }

        @Override
        public byte[] table(int tag) {
            reads.computeIfAbsent(tag, k -> new AtomicInteger()).incrementAndGet();
            return tables.get(tag);
        }
    }

    private static FontFace face(FaceTables tables) {
        return FontFace.builder("Test-Regular")
                .familyName("Test")
                .tables(tables)
                .filter(new ComplexScriptFilter())
                .build();
    }

    @Test
    void malformedCmapCoversNothing() {
        CountingTables tables = new CountingTables().put("cmap", new byte[]{0, 0, 0, 1, 0, 3});
        FontFace face = face(tables);

        assertTrue(face.characterMap().isEmpty());
        assertFalse(face.hasCharacter('A'));
        assertFalse(face.hasCmapTable());
    }

    @Test
    void missingCmapCoversNothing() {
        FontFace face = face(new CountingTables());

        assertTrue(face.characterMap().isEmpty());
        assertFalse(face.hasCmapTable());
    }

    @Test
    void providerFailureCoversNothing() {
        FontFace face = face(tag -> {
            throw new ProviderUnavailableException("gone");
        });

        assertTrue(face.characterMap().isEmpty());
        assertFalse(face.hasTable(SfntTags.GSUB));
    }

    @Test
    void coverageIsFilteredOnce() {
        CountingTables tables = new CountingTables().put("cmap", SfntBuilder.bmpCmap(0x41, 0x5A, 0x0600, 0x06FF));
        FontFace face = face(tables);

        assertTrue(face.hasCharacter('A'));
        assertFalse(face.hasCharacter(0x0627));
        face.characterMap();
        face.hasCharacter('B');

        assertEquals(1, tables.reads("cmap"));
        assertTrue(face.hasCmapTable());
        assertTrue(face.isCharacterMapLoaded());
    }

    @Test
    void concurrentReadersShareOneBuild() throws Exception {
        CountingTables tables = new CountingTables().put("cmap", SfntBuilder.bmpCmap(0x20, 0x7E));
        FontFace face = face(tables);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Set<CharacterMap> seen = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    seen.add(face.characterMap());
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, seen.size());
        assertEquals(1, tables.reads("cmap"));
    }

    @Test
    void graphiteFacesAreNotFiltered() {
        CountingTables tables = new CountingTables()
                .put("cmap", SfntBuilder.bmpCmap(0x0600, 0x06FF))
                .put("Silf", SfntBuilder.stub());

        assertTrue(face(tables).hasCharacter(0x0627));
    }

    @Test
    void dataUserFontsAreTrusted() {
        CountingTables tables = new CountingTables().put("cmap", SfntBuilder.bmpCmap(0x0600, 0x06FF));
        FontFace face = FontFace.builder("User-1")
                .tables(tables)
                .filter(new ComplexScriptFilter())
                .dataUserFont(true)
                .build();

        assertTrue(face.hasCharacter(0x0627));
        assertTrue(face.isUserProvided());
        assertEquals(0, tables.reads("GSUB"));
    }

    @Test
    void aatFaceRecordsAlternateShaping() {
        CountingTables tables = new CountingTables()
                .put("cmap", SfntBuilder.bmpCmap(0x0600, 0x06FF))
                .put("morx", SfntBuilder.stub());
        FontFace face = face(tables);

        assertTrue(face.hasCharacter(0x0620));
        assertTrue(face.requiresAlternateShaping());
    }

    @Test
    void tablePresenceIsCached() {
        CountingTables tables = new CountingTables().put("GPOS", SfntBuilder.stub());
        FontFace face = face(tables);

        assertTrue(face.hasTable(SfntTags.GPOS));
        assertTrue(face.hasTable(SfntTags.GPOS));
        assertFalse(face.hasTable(SfntTags.KERX));
        assertEquals(1, tables.reads("GPOS"));
    }

    @Test
    void presetCoverageIsNeverRead() {
        CountingTables tables = new CountingTables();
        CharacterMap coverage = new CharacterMap.Builder().setRange(0x41, 0x5A).build();
        FontFace face = FontFace.builder("Preset").tables(tables).coverage(coverage).build();

        assertSame(coverage, face.characterMap());
        assertEquals(0, tables.reads("cmap"));
    }

    @Test
    void standardFaceNames() {
        assertTrue(FontFace.builder("A").styleName("Bold Italic").build().isStandardFace());
        assertFalse(FontFace.builder("B").styleName("Semibold").build().isStandardFace());
        assertFalse(FontFace.builder("C").styleName("Semibold").standardFace(false).build().isStandardFace());
    }
}
