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
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Finds a face for a character that the requested family cannot render.
 *
 * <p>The platform is asked for one suggestion. The suggested family is
 * resolved through the catalog (hidden families included, then the system UI
 * table), the requested style is matched within it, and the chosen face's
 * filtered coverage must contain the character. Any failure yields no result;
 * a suggestion that does not cover the character is counted as a bad fallback
 * and no second suggestion is requested.
 */
public final class FallbackResolver {

    private static final Logger log = Logger.getLogger(FallbackResolver.class.getName());

    private final FontCatalog catalog;
    private final SerializedFontProvider provider;
    private final Set<String> placeholderFamilies;
    private final FallbackStats stats;

    FallbackResolver(FontCatalog catalog, SerializedFontProvider provider, List<String> placeholderFamilies,
                     FallbackStats stats) {
        this.catalog = catalog;
        this.provider = provider;
        this.placeholderFamilies = placeholderFamilies.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.stats = stats;
    }

    /**
     * @param codePoint full code point; supplementary characters are never split
     * @return the face and its family, or null if no valid fallback exists
     */
    public FallbackMatch resolve(int codePoint, Character.UnicodeScript script, StyleRequest style) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException(String.format("Not a code point: 0x%X", codePoint));
        }
        stats.recordRequest();

        String suggested;
        try {
            suggested = provider.call(p -> p.suggestFallbackFamily(codePoint, script, style));
        } catch (ProviderUnavailableException e) {
            log.warning(() -> String.format("Fallback lookup for U+%04X failed: %s", codePoint, e.getMessage()));
            stats.recordNoSuggestion();
            return null;
        }
        if (suggested == null || suggested.isEmpty()) {
            log.finer(() -> String.format("No fallback suggestion for U+%04X", codePoint));
            stats.recordNoSuggestion();
            return null;
        }
        if (isPlaceholder(suggested)) {
            log.finer(() -> String.format("Rejected placeholder family %s for U+%04X", suggested, codePoint));
            stats.recordPlaceholder();
            return null;
        }

        FontFamily family = catalog.findFamily(suggested, true);
        if (family == null) {
            family = catalog.findSystemFamily(suggested);
        }
        if (family == null) {
            log.fine(() -> String.format("Fallback family %s for U+%04X is not in the catalog", suggested, codePoint));
            stats.recordUnknownFamily();
            return null;
        }

        FontFace face = family.findFaceForStyle(style);
        if (face == null || !face.hasCharacter(codePoint)) {
            String faceName = face == null ? "(no faces)" : face.name();
            log.fine(() -> String.format("Bad fallback: %s (%s) does not cover U+%04X",
                    suggested, faceName, codePoint));
            stats.recordBadFallback();
            return null;
        }

        stats.recordMatch();
        return new FallbackMatch(face, family);
    }

    boolean isPlaceholder(String familyName) {
        return placeholderFamilies.contains(familyName.toLowerCase(Locale.ROOT));
    }
}
