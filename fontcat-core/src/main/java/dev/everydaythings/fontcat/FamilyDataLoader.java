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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Fills a catalog's caches in the background: faces of every family, their
 * coverage, and the families' other names.
 *
 * <p>There is no cancellation. A caller that stops waiting on the future
 * leaves the work running; whatever it loads stays cached for later queries.
 * Each provider call made during loading is serialized like any other, so the
 * loader interleaves with foreground queries family by family.
 */
public final class FamilyDataLoader {

    private static final Logger log = Logger.getLogger(FamilyDataLoader.class.getName());

    /**
     * @param families      families visited
     * @param faces         faces visited
     * @param emptyCoverage faces that turned out to cover nothing
     * @param elapsedMillis wall time of the load
     */
    public record LoadStats(int families, int faces, int emptyCoverage, long elapsedMillis) {}

    private final FontCatalog catalog;

    public FamilyDataLoader(FontCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Start loading on {@code executor}. The catalog is retained until loading ends.
     */
    public CompletableFuture<LoadStats> loadAsync(Executor executor) {
        catalog.retain();
        return CompletableFuture.supplyAsync(this::load, executor)
                .whenComplete((stats, error) -> catalog.release());
    }

    /** Load synchronously on the calling thread. */
    public LoadStats load() {
        long start = System.nanoTime();
        List<FontFamily> families = catalog.allFamilies();
        int faceCount = 0;
        int empty = 0;
        for (FontFamily family : families) {
            for (FontFace face : family.faces()) {
                faceCount++;
                if (face.characterMap().isEmpty()) {
                    empty++;
                }
            }
        }
        catalog.loadOtherFamilyNames();

        LoadStats stats = new LoadStats(families.size(), faceCount, empty,
                (System.nanoTime() - start) / 1_000_000);
        log.info(() -> String.format("Loaded font data: %d families, %d faces (%d without coverage) in %d ms",
                stats.families(), stats.faces(), stats.emptyCoverage(), stats.elapsedMillis()));
        return stats;
    }
}
