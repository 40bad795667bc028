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
import dev.everydaythings.fontcat.sfnt.CharacterMapReader;
import dev.everydaythings.fontcat.sfnt.FontTableException;
import dev.everydaythings.fontcat.sfnt.LayoutTables;
import dev.everydaythings.fontcat.sfnt.SfntTags;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One concrete face: identity, style ranges, capability flags and lazily built
 * coverage.
 *
 * <p>Style attributes are fixed at construction. Coverage is read from the
 * face's {@code cmap} on first use, filtered by {@link ComplexScriptFilter},
 * interned and then published once; later callers share the same map. A face
 * whose table cannot be read covers nothing rather than failing the query.
 */
public final class FontFace {

    private static final Logger log = Logger.getLogger(FontFace.class.getName());

    private static final Set<String> STANDARD_FACE_NAMES = Set.of(
            "Regular", "Bold", "Italic", "Oblique", "Bold Italic", "Bold Oblique");

    private final String name;
    private final String styleName;
    private final String familyName;
    private final FontRange weight;
    private final FontRange stretch;
    private final SlantRange slant;
    private final boolean fixedPitch;
    private final boolean standardFace;
    private final boolean dataUserFont;
    private final boolean localUserFont;
    private final boolean badUnderline;

    private final FaceTables tables;
    private final ComplexScriptFilter filter;
    private final CharacterMapCache mapCache;

    private final LazyCell<CharacterMap> characterMap = new LazyCell<>();
    private final Map<Integer, Boolean> tablePresence = new ConcurrentHashMap<>();

    private volatile boolean requiresAlternateShaping;
    private volatile boolean hasCmapTable;
    private volatile int uvsOffset;

    private FontFace(Builder b) {
        this.name = b.name;
        this.styleName = b.styleName;
        this.familyName = b.familyName;
        this.weight = b.weight;
        this.stretch = b.stretch;
        this.slant = b.slant;
        this.fixedPitch = b.fixedPitch;
        this.standardFace = b.standardFace != null ? b.standardFace : isStandardFaceName(b.styleName);
        this.dataUserFont = b.dataUserFont;
        this.localUserFont = b.localUserFont;
        this.badUnderline = b.badUnderline;
        this.tables = b.tables;
        this.filter = b.filter;
        this.mapCache = b.mapCache;
        this.requiresAlternateShaping = b.requiresAlternateShaping;
        this.uvsOffset = b.uvsOffset;
        if (b.coverage != null) {
            this.hasCmapTable = !b.coverage.isEmpty();
            this.characterMap.preset(mapCache != null ? mapCache.intern(b.coverage) : b.coverage);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Whether {@code styleName} is one of the six names platforms give to plain faces. */
    public static boolean isStandardFaceName(String styleName) {
        return styleName != null && STANDARD_FACE_NAMES.contains(styleName);
    }

    // ==================================================================================
    // Identity and style
    // ==================================================================================

    /** Canonical (PostScript or unique) name. */
    public String name() {
        return name;
    }

    public String styleName() {
        return styleName;
    }

    public String familyName() {
        return familyName;
    }

    public FontRange weight() {
        return weight;
    }

    public FontRange stretch() {
        return stretch;
    }

    public SlantRange slant() {
        return slant;
    }

    public boolean isFixedPitch() {
        return fixedPitch;
    }

    /** Named exactly "Regular", "Bold", "Italic", "Oblique", "Bold Italic" or "Bold Oblique". */
    public boolean isStandardFace() {
        return standardFace;
    }

    /** Loaded from bytes supplied at runtime; coverage is trusted as-is. */
    public boolean isDataUserFont() {
        return dataUserFont;
    }

    /** An installed face addressed by name from a font-face rule. */
    public boolean isLocalUserFont() {
        return localUserFont;
    }

    public boolean isUserProvided() {
        return dataUserFont || localUserFont;
    }

    public boolean hasBadUnderline() {
        return badUnderline;
    }

    // ==================================================================================
    // Coverage
    // ==================================================================================

    /** Filtered coverage, built on first call. */
    public CharacterMap characterMap() {
        return characterMap.get(this::loadCharacterMap);
    }

    public boolean hasCharacter(int codePoint) {
        return characterMap().contains(codePoint);
    }

    /** Whether coverage has been built (or was supplied) yet. */
    public boolean isCharacterMapLoaded() {
        return characterMap.isSet();
    }

    /** Set once coverage is built; meaningful only after that. */
    public boolean requiresAlternateShaping() {
        return requiresAlternateShaping;
    }

    /** Whether a usable {@code cmap} was found; meaningful once coverage is built. */
    public boolean hasCmapTable() {
        return hasCmapTable;
    }

    /** Offset of the variation sequence sub-table inside {@code cmap}, or 0. */
    public int uvsOffset() {
        return uvsOffset;
    }

    /** Whether the face has the given table. Results are cached per tag. */
    public boolean hasTable(int tag) {
        Boolean known = tablePresence.get(tag);
        if (known != null) {
            return known;
        }
        boolean present = readTable(tag) != null;
        tablePresence.putIfAbsent(tag, present);
        return present;
    }

    /** The raw table, or null if absent or unreadable. */
    public byte[] table(int tag) {
        byte[] data = readTable(tag);
        tablePresence.putIfAbsent(tag, data != null);
        return data;
    }

    private byte[] readTable(int tag) {
        if (tables == null) {
            return null;
        }
        try {
            return tables.table(tag);
        } catch (ProviderUnavailableException e) {
            log.log(Level.WARNING, String.format("Cannot read '%s' of %s", SfntTags.toString(tag), name), e);
            return null;
        }
    }

    private CharacterMap loadCharacterMap() {
        byte[] cmap = readTable(SfntTags.CMAP);
        if (cmap == null) {
            log.fine(() -> "No cmap in " + name + ", face covers nothing");
            return CharacterMap.empty();
        }

        CharacterMapReader.Result result;
        try {
            result = CharacterMapReader.read(cmap);
        } catch (FontTableException e) {
            log.warning(() -> String.format("Bad cmap in %s, face covers nothing: %s", name, e.getMessage()));
            return CharacterMap.empty();
        }
        hasCmapTable = true;
        uvsOffset = result.uvsOffset();

        CharacterMap map = result.map();
        if (!dataUserFont && filter != null && !hasTable(SfntTags.SILF)) {
            ComplexScriptFilter.Result filtered = filter.apply(map, readLayout(), familyName);
            map = filtered.map();
            requiresAlternateShaping = filtered.requiresAlternateShaping();
        }

        CharacterMap built = map;
        log.finer(() -> String.format("%s: %d code points", name, built.cardinality()));
        return mapCache != null ? mapCache.intern(built) : built;
    }

    private ComplexScriptFilter.FaceLayout readLayout() {
        boolean aat = hasTable(SfntTags.MORX) || hasTable(SfntTags.MORT);
        boolean kerx = hasTable(SfntTags.KERX);
        boolean gpos = hasTable(SfntTags.GPOS);
        byte[] gsubTable = table(SfntTags.GSUB);
        Set<Integer> scripts = Set.of();
        if (gsubTable != null) {
            try {
                scripts = LayoutTables.scriptTags(gsubTable, "GSUB");
            } catch (FontTableException e) {
                log.warning(() -> String.format("Bad GSUB in %s: %s", name, e.getMessage()));
            }
        }
        return new ComplexScriptFilter.FaceLayout(aat, kerx, gsubTable != null, gpos, scripts);
    }

    @Override
    public String toString() {
        return String.format("FontFace[%s, %s, weight %s, stretch %s, %s]",
                name, styleName, weight, stretch, slant.kind());
    }

    /**
     * Fluent builder. Weight, stretch and slant default to a regular face.
     */
    public static final class Builder {
        private final String name;
        private String styleName = "Regular";
        private String familyName;
        private FontRange weight = FontRange.of(400);
        private FontRange stretch = FontRange.of(100);
        private SlantRange slant = SlantRange.NORMAL;
        private boolean fixedPitch;
        private Boolean standardFace;
        private boolean dataUserFont;
        private boolean localUserFont;
        private boolean badUnderline;
        private FaceTables tables = FaceTables.NONE;
        private ComplexScriptFilter filter;
        private CharacterMapCache mapCache;
        private CharacterMap coverage;
        private boolean requiresAlternateShaping;
        private int uvsOffset;

        private Builder(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Face name is required");
            }
            this.name = name;
        }

        public Builder styleName(String styleName) {
            this.styleName = styleName;
            return this;
        }

        public Builder familyName(String familyName) {
            this.familyName = familyName;
            return this;
        }

        public Builder weight(FontRange weight) {
            this.weight = weight;
            return this;
        }

        public Builder stretch(FontRange stretch) {
            this.stretch = stretch;
            return this;
        }

        public Builder slant(SlantRange slant) {
            this.slant = slant;
            return this;
        }

        public Builder fixedPitch(boolean fixedPitch) {
            this.fixedPitch = fixedPitch;
            return this;
        }

        /** Overrides the value derived from the style name. */
        public Builder standardFace(boolean standardFace) {
            this.standardFace = standardFace;
            return this;
        }

        public Builder dataUserFont(boolean dataUserFont) {
            this.dataUserFont = dataUserFont;
            return this;
        }

        public Builder localUserFont(boolean localUserFont) {
            this.localUserFont = localUserFont;
            return this;
        }

        public Builder badUnderline(boolean badUnderline) {
            this.badUnderline = badUnderline;
            return this;
        }

        public Builder tables(FaceTables tables) {
            this.tables = tables;
            return this;
        }

        /** Filter applied to coverage; null leaves coverage unfiltered. */
        public Builder filter(ComplexScriptFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder mapCache(CharacterMapCache mapCache) {
            this.mapCache = mapCache;
            return this;
        }

        /** Already-resolved coverage, used instead of reading {@code cmap}. */
        public Builder coverage(CharacterMap coverage) {
            this.coverage = coverage;
            return this;
        }

        public Builder requiresAlternateShaping(boolean requiresAlternateShaping) {
            this.requiresAlternateShaping = requiresAlternateShaping;
            return this;
        }

        public Builder uvsOffset(int uvsOffset) {
            this.uvsOffset = uvsOffset;
            return this;
        }

        public FontFace build() {
            return new FontFace(this);
        }
    }
}
