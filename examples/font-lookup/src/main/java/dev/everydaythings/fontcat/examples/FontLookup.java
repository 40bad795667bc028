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

import dev.everydaythings.fontcat.*;
import dev.everydaythings.fontcat.freetype.FreeTypeFontProvider;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Resolves a family for a string and reports which face renders each
 * character, falling back where the family has no glyph.
 *
 * Usage:
 *   FontLookup [--weight N] [--italic] [--size PX] [--preload] family text...
 *
 * The family may be a generic keyword such as {@code system-ui}.
 */
public class FontLookup {

    public static void main(String[] args) throws Exception {
        StyleRequest style = StyleRequest.NORMAL;
        boolean preload = false;
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            switch (args[i]) {
                case "--weight" -> style = style.withWeight(Double.parseDouble(args[++i]));
                case "--italic" -> style = style.withSlant(Slant.ITALIC);
                case "--size" -> style = style.withSize(Double.parseDouble(args[++i]));
                case "--preload" -> preload = true;
                default -> throw new IllegalArgumentException("Unknown option " + args[i]);
            }
            i++;
        }
        if (args.length - i < 2) {
            System.err.println("usage: FontLookup [--weight N] [--italic] [--size PX] [--preload] family text...");
            System.exit(2);
        }
        String familyName = args[i];
        String text = String.join(" ", java.util.Arrays.copyOfRange(args, i + 1, args.length));

        CatalogConfig config = CatalogConfig.load();
        try (FreeTypeFontProvider provider = new FreeTypeFontProvider(config);
             FontCatalog catalog = new FontCatalog(provider, config)) {

            // Warm caches in the background, as an application would at startup
            if (preload) {
                FamilyDataLoader.LoadStats stats = preload(catalog, Executors.newSingleThreadExecutor(),
                        5, TimeUnit.MINUTES);
                System.out.printf("Preloaded %d families, %d faces%n", stats.families(), stats.faces());
            }

            FontFace primary = catalog.resolveStyle(familyName, style);
            if (primary == null) {
                System.out.printf("No family named '%s'; %d families installed%n",
                        familyName, catalog.familyNames().size());
            } else {
                System.out.printf("%s -> %s (%s, weight %s, stretch %s)%n", familyName, primary.name(),
                        primary.styleName(), primary.weight(), primary.stretch());
            }

            for (int offset = 0; offset < text.length(); ) {
                int cp = text.codePointAt(offset);
                offset += Character.charCount(cp);
                if (Character.isWhitespace(cp)) {
                    continue;
                }
                String glyph = new String(Character.toChars(cp));
                if (primary != null && primary.hasCharacter(cp)) {
                    System.out.printf("  U+%04X %s  %s%n", cp, glyph, primary.name());
                    continue;
                }
                Character.UnicodeScript script = Character.UnicodeScript.of(cp);
                FallbackMatch match = catalog.resolveFallback(cp, script, style);
                if (match != null) {
                    System.out.printf("  U+%04X %s  %s (fallback, %s)%n", cp, glyph,
                            match.face().name(), script.name().toLowerCase(Locale.ROOT));
                } else {
                    System.out.printf("  U+%04X %s  (no font)%n", cp, glyph);
                }
            }

            System.out.println(catalog.fallbackStats());
        }
    }

    /**
     * Load family data on {@code executor} and wait for it. The executor is
     * shut down however the wait ends.
     */
    static FamilyDataLoader.LoadStats preload(FontCatalog catalog, ExecutorService executor,
                                              long timeout, TimeUnit unit) throws Exception {
        try {
            return new FamilyDataLoader(catalog).loadAsync(executor).get(timeout, unit);
        } finally {
            executor.shutdown();
        }
    }
}
