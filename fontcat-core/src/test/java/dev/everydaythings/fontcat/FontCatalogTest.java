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

import dev.everydaythings.fontcat.sfnt.SfntBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.everydaythings.fontcat.FakeFontProvider.face;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FontCatalogTest {

    private static final double BOLD = 0.4;

    private final FakeFontProvider provider = new FakeFontProvider();
    private FontCatalog catalog;

    @AfterEach
    void closeCatalog() {
        if (catalog != null) {
            catalog.close();
        }
    }

    private FontCatalog catalog() {
        return catalog(CatalogConfig.empty());
    }

    private FontCatalog catalog(CatalogConfig config) {
        catalog = new FontCatalog(provider, config);
        return catalog;
    }

    private FakeFontProvider helvetica() {
        return provider.family("Helvetica",
                face("Helvetica", "Helvetica", "Regular", 0, false),
                face("Helvetica-Bold", "Helvetica", "Bold", BOLD, false),
                face("Helvetica-Oblique", "Helvetica", "Oblique", 0, true));
    }

    // ==================================================================================
    // Family lookup
    // ==================================================================================

    @Test
    void findsFamiliesIgnoringCase() {
        helvetica();
        FontCatalog catalog = catalog();

        FontFamily family = catalog.findFamily("HELVETICA");

        assertNotNull(family);
        assertSame(family, catalog.findFamily("helvetica"));
        assertEquals("Helvetica", family.name());
        assertNull(catalog.findFamily("Helvetica Neue"));
        assertNull(catalog.findFamily(""));
    }

    @Test
    void hiddenFamiliesNeedExplicitRequest() {
        helvetica();
        provider.family(".Keyboard", face(".Keyboard", ".Keyboard", "Regular", 0, false));
        provider.family("Secret", face("Secret", "Secret", "Regular", 0, false));
        provider.visibility("Secret", FontVisibility.HIDDEN);
        FontCatalog catalog = catalog();

        assertNull(catalog.findFamily(".Keyboard"));
        assertNull(catalog.findFamily("Secret"));
        assertNotNull(catalog.findFamily(".Keyboard", true));
        assertNull(catalog.resolveStyle("Secret", StyleRequest.NORMAL));
        assertEquals(List.of("Helvetica"), catalog.familyNames());
    }

    @Test
    void placeholderFamiliesAreNotListed() {
        helvetica();
        provider.family("LastResort", face("LastResort", "LastResort", "Regular", 0, false));
        FontCatalog catalog = catalog();

        assertNull(catalog.findFamily("LastResort", true));
        assertFalse(catalog.familyNames().contains("LastResort"));
    }

    @Test
    void failedEnumerationGivesEmptyCatalog() {
        helvetica();
        provider.failEnumeration = true;
        FontCatalog catalog = catalog();

        assertTrue(catalog.familyNames().isEmpty());
        assertNull(catalog.resolveStyle("Helvetica", StyleRequest.NORMAL));
    }

    @Test
    void duplicateFamilyNamesAreMerged() {
        helvetica();
        provider.family("HELVETICA", face("Other", "HELVETICA", "Regular", 0, false));
        FontCatalog catalog = catalog();

        assertEquals(List.of("Helvetica"), catalog.familyNames());
    }

    @Test
    void facesAreLoadedOnFirstUse() {
        helvetica();
        FontCatalog catalog = catalog();
        catalog.familyNames();
        assertEquals(0, provider.calls("enumerateFaces"));

        FontFamily family = catalog.findFamily("Helvetica");
        assertFalse(family.hasStyles());
        assertEquals(3, family.faces().size());
        family.faces();

        assertEquals(1, provider.calls("enumerateFaces"));
    }

    @Test
    void repeatedDescriptorsAreSkipped() {
        provider.family("Skia",
                face("Skia-Regular", "Skia", "Regular", 0, false),
                face("Skia-Regular", "Skia", "Regular", 0, false),
                face("Skia-Bold", "Skia", "Bold", BOLD, false));

        assertEquals(2, catalog().findFamily("Skia").faces().size());
    }

    // ==================================================================================
    // Style resolution
    // ==================================================================================

    @Test
    void resolvesWeightAndSlant() {
        helvetica();
        FontCatalog catalog = catalog();

        assertEquals("Helvetica", catalog.resolveStyle("Helvetica", StyleRequest.NORMAL).name());
        assertEquals("Helvetica-Bold", catalog.resolveStyle("helvetica",
                StyleRequest.NORMAL.withWeight(700)).name());
        assertEquals("Helvetica-Oblique", catalog.resolveStyle("Helvetica",
                StyleRequest.NORMAL.withSlant(Slant.ITALIC)).name());
        assertNull(catalog.resolveStyle("Nope", StyleRequest.NORMAL));
    }

    @Test
    void resolveStyleIsStable() {
        helvetica();
        FontCatalog catalog = catalog();
        StyleRequest request = StyleRequest.NORMAL.withWeight(600);

        FontFace first = catalog.resolveStyle("Helvetica", request);

        assertSame(first, catalog.resolveStyle("Helvetica", request));
        assertEquals("Helvetica-Bold", first.name());
    }

    @Test
    void facesGetNormalizedStyles() {
        helvetica();
        FontFamily family = catalog().findFamily("Helvetica");

        FontFace bold = family.findFace("Helvetica-Bold");
        assertEquals(FontRange.of(700), bold.weight());
        assertEquals(FontRange.of(100), bold.stretch());
        assertEquals(SlantRange.NORMAL, bold.slant());
        assertTrue(bold.isStandardFace());
        assertEquals(SlantRange.ITALIC, family.findFace("Helvetica-Oblique").slant());
        assertEquals("Helvetica", bold.familyName());
    }

    @Test
    void configuredWeightOverridesTrait() {
        provider.family("Avenir",
                face("Avenir-Book", "Avenir", "Book", 0, false),
                face("Avenir-Medium", "Avenir", "Medium", 0, false));
        FontCatalog catalog = catalog(CatalogConfig.of(Map.of(
                CatalogConfig.WEIGHT_OVERRIDE_PREFIX + "Avenir-Medium", "480")));

        FontFamily family = catalog.findFamily("Avenir");

        assertEquals(FontRange.of(500), family.findFace("Avenir-Medium").weight());
        assertEquals(FontRange.of(400), family.findFace("Avenir-Book").weight());
        assertEquals("Avenir-Medium", catalog.resolveStyle("Avenir", StyleRequest.NORMAL.withWeight(500)).name());
    }

    @Test
    void variationAxesWidenRanges() {
        provider.family("Skia", face("Skia-Regular", "Skia", "Regular", 0, false));
        provider.table("Skia-Regular", "fvar", SfntBuilder.fvar(
                "wght", 100, 400, 900,
                "wdth", 75, 100, 125,
                "slnt", -12, 0, 0));

        FontFace face = catalog().findFamily("Skia").faces().get(0);

        assertEquals(FontRange.of(100, 900), face.weight());
        assertEquals(FontRange.of(75, 125), face.stretch());
        assertEquals(SlantRange.oblique(0, 12), face.slant());
    }

    @Test
    void italicAxisDefaultMarksFaceItalic() {
        provider.family("Roman", face("Roman-Italic", "Roman", "Italic", 0, false));
        provider.table("Roman-Italic", "fvar", SfntBuilder.fvar("ital", 0, 1, 1));

        assertEquals(SlantRange.ITALIC, catalog().findFamily("Roman").faces().get(0).slant());
    }

    @Test
    void badVariationTableIsIgnored() {
        provider.family("Skia", face("Skia-Bold", "Skia", "Bold", BOLD, false));
        provider.table("Skia-Bold", "fvar", new byte[]{0, 1, 0, 0});

        assertEquals(FontRange.of(700), catalog().findFamily("Skia").faces().get(0).weight());
    }

    // ==================================================================================
    // System UI families
    // ==================================================================================

    private void systemUi() {
        helvetica();
        provider.systemText = ".SF NS Text";
        provider.systemDisplay = ".SF NS Display";
        provider.systemTextFaces = List.of(face(".SFNSText", ".SF NS Text", "Regular", 0, false));
        provider.systemDisplayFaces = List.of(face(".SFNSDisplay", ".SF NS Display", "Regular", 0, false));
    }

    @Test
    void systemUiPicksTextOrDisplayBySize() {
        systemUi();
        FontCatalog catalog = catalog();

        FontFamily small = catalog.findFamilyForGeneric("system-ui", 12, Locale.ENGLISH);
        FontFamily large = catalog.findFamilyForGeneric("-apple-system", 24, Locale.ENGLISH);

        assertEquals(".SF NS Text", small.name());
        assertEquals(FamilyKind.SYSTEM_TEXT, small.kind());
        assertEquals(".SF NS Display", large.name());
        assertEquals(".SFNSDisplay", catalog.resolveStyle("system-ui", StyleRequest.NORMAL.withSize(30)).name());
        assertEquals(".SFNSText", catalog.resolveStyle("SYSTEM-UI", StyleRequest.NORMAL).name());
        assertNull(catalog.findFamilyForGeneric("serif", 12, Locale.ENGLISH));
    }

    @Test
    void crossoverSizeIsConfigurable() {
        systemUi();
        FontCatalog catalog = catalog(CatalogConfig.of(Map.of(CatalogConfig.SYSTEM_UI_CROSSOVER_SIZE, "30")));

        assertEquals(".SF NS Text", catalog.findFamilyForGeneric("system-ui", 24, Locale.ROOT).name());
        assertEquals(".SF NS Display", catalog.findFamilyForGeneric("system-ui", 30, Locale.ROOT).name());
    }

    @Test
    void textFamilyServesLargeSizesWithoutDisplayFamily() {
        systemUi();
        provider.systemDisplay = null;
        FontCatalog catalog = catalog();

        assertEquals(".SF NS Text", catalog.findFamilyForGeneric("system-ui", 48, Locale.ROOT).name());
    }

    @Test
    void systemFamiliesAreFoundBySystemLookup() {
        systemUi();
        FontCatalog catalog = catalog();

        assertNull(catalog.findFamily(".SF NS Text"));
        assertNotNull(catalog.findSystemFamily(".sf ns text"));
        assertEquals(".SF NS Text", catalog.defaultFamily().name());
        assertFalse(catalog.familyNames().contains(".SF NS Text"));
    }

    // ==================================================================================
    // Other family names
    // ==================================================================================

    private void hiragino() {
        provider.family("Hiragino Sans",
                face("HiraginoSans-W3", "Hiragino Sans", "W3", 0, false),
                face("HiraginoSans-W6", "Hiragino Sans", "W6", BOLD, false));
        provider.table("HiraginoSans-W3", "name", SfntBuilder.name(1, "Hiragino Sans", 16, "ヒラギノ角ゴシック W3"));
        provider.table("HiraginoSans-W6", "name", SfntBuilder.name(1, "Hiragino Sans", 16, "ヒラギノ角ゴシック W6"));
    }

    @Test
    void otherNamesResolveToTheirFaces() {
        hiragino();
        FontCatalog catalog = catalog();

        FontFamily family = catalog.findFamily("ヒラギノ角ゴシック W6");

        assertNotNull(family);
        assertEquals("Hiragino Sans", family.name());
        assertTrue(family.aliases().contains("ヒラギノ角ゴシック W3"));
        FontFace face = catalog.resolveStyle("ヒラギノ角ゴシック W3", StyleRequest.NORMAL.withWeight(700));
        assertEquals("HiraginoSans-W3", face.name());
    }

    @Test
    void otherNamesAreReadOnce() {
        hiragino();
        FontCatalog catalog = catalog();
        catalog.loadOtherFamilyNames();
        provider.resetCalls();

        assertNull(catalog.findFamily("Missing Family"));
        catalog.loadOtherFamilyNames();

        assertEquals(0, provider.totalCalls());
    }

    @Test
    void familiesWithoutOtherNamesStopAtFirstFace() {
        provider.family("Plain",
                face("Plain-Regular", "Plain", "Regular", 0, false),
                face("Plain-Bold", "Plain", "Bold", BOLD, false));
        provider.table("Plain-Bold", "name", SfntBuilder.name(1, "Plain Alias"));
        FontCatalog catalog = catalog();

        catalog.loadOtherFamilyNames();

        assertNull(catalog.findFamily("Plain Alias"));
    }

    @Test
    void preloadedFamiliesKnowTheirOtherNames() {
        hiragino();
        helvetica();
        FontCatalog catalog = catalog(CatalogConfig.of(Map.of(CatalogConfig.PRELOAD_NAMES_LIST, "Hiragino Sans")));
        catalog.familyNames();
        provider.resetCalls();

        assertNotNull(catalog.findFamily("ヒラギノ角ゴシック W3"));
        assertEquals(0, provider.calls("getTable"));
    }

    // ==================================================================================
    // User fonts
    // ==================================================================================

    @Test
    void localFontsKeepRequestedRanges() {
        helvetica();
        FontCatalog catalog = catalog();

        FontFace face = catalog.lookupLocalFont("Helvetica-Bold", FontRange.of(600, 800), FontRange.of(100),
                SlantRange.NORMAL);

        assertNotNull(face);
        assertTrue(face.isLocalUserFont());
        assertEquals(FontRange.of(600, 800), face.weight());
        assertEquals("Helvetica", face.familyName());
        assertNull(catalog.lookupLocalFont("Nope-Bold", FontRange.of(400), FontRange.of(100), SlantRange.NORMAL));
        assertNull(catalog.lookupLocalFont(".Hidden", FontRange.of(400), FontRange.of(100), SlantRange.NORMAL));
    }

    @Test
    void localFontsInHiddenFamiliesAreRefused() {
        provider.family(".Private", face("PrivateFace", ".Private", "Regular", 0, false));

        assertNull(catalog().lookupLocalFont("PrivateFace", FontRange.of(400), FontRange.of(100),
                SlantRange.NORMAL));
    }

    @Test
    void userFontCoverageIsTrusted() {
        byte[] font = new SfntBuilder()
                .table("cmap", SfntBuilder.bmpCmap(0x20, 0x7E, 0x0600, 0x06FF))
                .table("name", SfntBuilder.name(1, "Web Font", 2, "Bold"))
                .build();
        FontCatalog catalog = catalog();

        FontFace face = catalog.makeUserFont("Web Font", font, FontRange.of(700), FontRange.of(100),
                SlantRange.NORMAL);

        assertTrue(face.isDataUserFont());
        assertTrue(face.hasCharacter(0x0627));
        assertEquals("Bold", face.styleName());
        assertEquals(FontRange.of(700), face.weight());
        FontFace second = catalog.makeUserFont("Web Font", font, FontRange.of(700), FontRange.of(100),
                SlantRange.NORMAL);
        assertFalse(face.name().equals(second.name()));
    }

    @Test
    void garbageUserFontIsRejected() {
        assertNull(catalog().makeUserFont("Broken", new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12},
                FontRange.of(400), FontRange.of(100), SlantRange.NORMAL));
    }

    // ==================================================================================
    // Rebuild
    // ==================================================================================

    @Test
    void rebuildSwapsListAndNotifies() {
        helvetica();
        provider.family("Times", face("Times-Roman", "Times", "Roman", 0, false));
        FontCatalog catalog = catalog();
        FontFamily times = catalog.findFamily("Times");
        assertEquals(1, times.faces().size());
        long generation = catalog.generation();
        AtomicInteger notified = new AtomicInteger();
        catalog.addFontsChangedListener(c -> notified.incrementAndGet());

        provider.removeFamily("Times");
        provider.fireFontsChanged();

        assertNull(catalog.findFamily("Times"));
        assertEquals(1, notified.get());
        assertTrue(catalog.generation() > generation);
        assertEquals("Times-Roman", times.faces().get(0).name());
    }

    @Test
    void changesBeforeFirstQueryAreIgnored() {
        helvetica();
        FontCatalog catalog = catalog();

        catalog.onFontsChanged();

        assertEquals(0, provider.totalCalls());
        assertEquals(0, catalog.generation());
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        helvetica();
        FontCatalog catalog = catalog();
        AtomicInteger notified = new AtomicInteger();
        catalog.addFontsChangedListener(c -> {
            throw new IllegalStateException("listener failure");
        });
        catalog.addFontsChangedListener(c -> notified.incrementAndGet());

        catalog.rebuild();

        assertEquals(1, notified.get());
    }

    @Test
    void readersNeverSeeAHalfBuiltList() throws Exception {
        List<String> before = List.of("Alpha", "Beta", "Gamma");
        List<String> after = List.of("Delta", "Epsilon");
        before.forEach(name -> provider.family(name, face(name, name, "Regular", 0, false)));
        FontCatalog catalog = catalog();
        assertEquals(before, catalog.familyNames());

        AtomicBoolean done = new AtomicBoolean();
        List<List<String>> unexpected = new java.util.concurrent.CopyOnWriteArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                readers.add(pool.submit(() -> {
                    while (!done.get()) {
                        List<String> names = catalog.familyNames();
                        if (!names.equals(before) && !names.equals(after)) {
                            unexpected.add(names);
                        }
                    }
                }));
            }
            before.forEach(provider::removeFamily);
            after.forEach(name -> provider.family(name, face(name, name, "Regular", 0, false)));
            provider.delayMillis = 2;
            catalog.rebuild();
            done.set(true);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            done.set(true);
            pool.shutdownNow();
        }

        assertTrue(unexpected.isEmpty(), () -> "saw " + unexpected);
        assertEquals(after, catalog.familyNames());
    }

    // ==================================================================================
    // Lifecycle
    // ==================================================================================

    @Test
    void lastReleaseTearsDown() {
        helvetica();
        FontCatalog catalog = catalog();
        catalog.familyNames();
        assertEquals(1, provider.callbackCount());

        catalog.retain();
        catalog.close();
        catalog.close();
        assertFalse(catalog.isClosed());
        assertEquals(1, catalog.referenceCount());
        assertNotNull(catalog.findFamily("Helvetica"));

        catalog.release();

        assertTrue(catalog.isClosed());
        assertEquals(0, provider.callbackCount());
        assertThrows(IllegalStateException.class, catalog::familyNames);
        assertThrows(IllegalStateException.class, catalog::retain);
        assertThrows(IllegalStateException.class, catalog::rebuild);
    }

    @Test
    void notificationAfterTeardownIsIgnored() {
        helvetica();
        FontCatalog catalog = catalog();
        catalog.familyNames();
        Runnable leaked = () -> catalog.onFontsChanged();
        catalog.close();

        leaked.run();

        assertTrue(catalog.isClosed());
    }

    @Test
    void providerIsNeverEnteredConcurrently() throws Exception {
        List<String> names = List.of("One", "Two", "Three", "Four", "Five", "Six");
        for (String name : names) {
            provider.family(name,
                    face(name + "-Regular", name, "Regular", 0, false),
                    face(name + "-Bold", name, "Bold", BOLD, false));
            provider.table(name + "-Regular", "cmap", SfntBuilder.bmpCmap(0x20, 0x7E));
            provider.table(name + "-Bold", "cmap", SfntBuilder.bmpCmap(0x20, 0x7E, 0x0900, 0x097F));
            provider.table(name + "-Bold", "GSUB", SfntBuilder.gsub("dev2"));
        }
        provider.fallback(0x0915, "Three");
        provider.delayMillis = 1;
        FontCatalog catalog = catalog();

        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String name : names) {
                futures.add(pool.submit(() -> {
                    start.await();
                    FontFace face = catalog.resolveStyle(name, StyleRequest.NORMAL.withWeight(700));
                    assertTrue(face.hasCharacter(0x0915));
                    catalog.resolveFallback(0x0915, Character.UnicodeScript.DEVANAGARI, StyleRequest.NORMAL);
                    catalog.loadOtherFamilyNames();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, provider.maxConcurrentCalls());
        assertEquals(1, provider.calls("enumerateFamilies"));
    }
}
