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

package dev.everydaythings.fontcat.examples;

import dev.everydaythings.fontcat.FaceDescriptor;
import dev.everydaythings.fontcat.FamilyDataLoader;
import dev.everydaythings.fontcat.FontCatalog;
import dev.everydaythings.fontcat.PlatformFontProvider;
import dev.everydaythings.fontcat.StyleRequest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FontLookupTest {

    /** A platform with a single one-face family and no font tables. */
    private static final class OneFamily implements PlatformFontProvider {
        @Override
        public List<String> enumerateFamilies() {
            return List.of("Plain");
        }

        @Override
        public List<FaceDescriptor> enumerateFaces(String familyName) {
            return List.of(new FaceDescriptor("Plain-Regular", "Plain", "Regular", 0, 0, false, false));
        }

        @Override
        public byte[] getTable(FaceDescriptor face, int tag) {
            return null;
        }

        @Override
        public String suggestFallbackFamily(int codePoint, Character.UnicodeScript script, StyleRequest style) {
            return null;
        }

        @Override
        public FaceDescriptor resolveLocalFace(String name) {
            return null;
        }

        @Override
        public void registerChangeNotification(Runnable callback) {
        }

        @Override
        public void unregisterChangeNotification(Runnable callback) {
        }
    }

    @Test
    void preloadShutsDownTheExecutorWhenDone() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (FontCatalog catalog = new FontCatalog(new OneFamily())) {
            FamilyDataLoader.LoadStats stats = FontLookup.preload(catalog, executor, 30, TimeUnit.SECONDS);

            assertEquals(1, stats.families());
            assertEquals(1, stats.faces());
        }
        assertTrue(executor.isShutdown());
    }

    @Test
    void preloadShutsDownTheExecutorWhenTheWaitTimesOut() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch gate = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        try (FontCatalog catalog = new FontCatalog(new OneFamily())) {
            assertThrows(TimeoutException.class,
                    () -> FontLookup.preload(catalog, executor, 50, TimeUnit.MILLISECONDS));
            assertTrue(executor.isShutdown());
        } finally {
            gate.countDown();
        }
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
    }

    @Test
    void preloadShutsDownTheExecutorWhenLoadingFails() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        FontCatalog catalog = new FontCatalog(new OneFamily());
        catalog.close();

        assertThrows(IllegalStateException.class,
                () -> FontLookup.preload(catalog, executor, 30, TimeUnit.SECONDS));
        assertTrue(executor.isShutdown());
    }
}
