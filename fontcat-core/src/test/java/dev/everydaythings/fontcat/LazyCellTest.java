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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LazyCellTest {

    @Test
    void buildsOnce() {
        LazyCell<String> cell = new LazyCell<>();
        AtomicInteger builds = new AtomicInteger();

        assertNull(cell.peek());
        String first = cell.get(() -> "v" + builds.incrementAndGet());
        String second = cell.get(() -> "v" + builds.incrementAndGet());

        assertEquals("v1", first);
        assertSame(first, second);
        assertEquals(1, builds.get());
        assertTrue(cell.isSet());
    }

    @Test
    void presetWinsOverBuilder() {
        LazyCell<String> cell = new LazyCell<>();

        assertEquals("preset", cell.preset("preset"));
        assertEquals("preset", cell.preset("later"));
        assertEquals("preset", cell.get(() -> "built"));
    }

    @Test
    void nullBuildIsRejectedAndRetried() {
        LazyCell<String> cell = new LazyCell<>();

        assertThrows(IllegalStateException.class, () -> cell.get(() -> null));
        assertFalse(cell.isSet());
        assertEquals("ok", cell.get(() -> "ok"));
    }

    @Test
    void concurrentFirstReadersBuildOnce() throws Exception {
        LazyCell<Object> cell = new LazyCell<>();
        AtomicInteger builds = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Object>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cell.get(() -> {
                        builds.incrementAndGet();
                        return new Object();
                    });
                }));
            }
            start.countDown();
            Object first = results.get(0).get(10, TimeUnit.SECONDS);
            for (Future<Object> result : results) {
                assertSame(first, result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, builds.get());
    }
}
