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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named, ordered collection of faces.
 *
 * <p>Faces are loaded on first access from a {@link FaceSource}, under the
 * family's write lock, then sorted by weight and stretch. A face whose style
 * name is "Regular" sorts ahead of faces with the same attributes so that it
 * wins ties in {@link #findFaceForStyle}. Once loaded, the face list is an
 * immutable snapshot that readers use without locking.
 */
public final class FontFamily {

    private static final Logger log = Logger.getLogger(FontFamily.class.getName());

    /** Weight, then stretch, then "Regular" first. */
    static final Comparator<FontFace> FACE_ORDER = Comparator
            .comparingDouble((FontFace f) -> f.weight().min())
            .thenComparingDouble(f -> f.stretch().min())
            .thenComparing(f -> !"Regular".equals(f.styleName()));

    /** Produces the faces of a family. Called at most once per family. */
    @FunctionalInterface
    public interface FaceSource {
        List<FontFace> loadFaces(FontFamily family);
    }

    private final String name;
    private final String key;
    private final FontVisibility visibility;
    private final FamilyKind kind;
    private final boolean badUnderline;
    private final FaceSource source;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile List<FontFace> faces = List.of();
    private volatile boolean hasStyles;
    private final Set<String> aliases = Collections.synchronizedSet(new LinkedHashSet<>());

    public FontFamily(String name, FontVisibility visibility, FamilyKind kind, boolean badUnderline,
                      FaceSource source) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Family name is required");
        }
        this.name = name;
        this.key = key(name);
        this.visibility = visibility;
        this.kind = kind;
        this.badUnderline = badUnderline;
        this.source = source;
    }

    /**
     * A family whose faces are already known, such as one received in a
     * snapshot. No source is ever consulted.
     */
    public static FontFamily withFaces(String name, FontVisibility visibility, FamilyKind kind,
                                       boolean badUnderline, List<FontFace> faces) {
        FontFamily family = new FontFamily(name, visibility, kind, badUnderline, null);
        List<FontFace> sorted = new ArrayList<>(faces);
        sorted.sort(FACE_ORDER);
        family.faces = Collections.unmodifiableList(sorted);
        family.hasStyles = true;
        return family;
    }

    /** Case-folded lookup key for a family name. */
    public static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public String name() {
        return name;
    }

    public String key() {
        return key;
    }

    public FontVisibility visibility() {
        return visibility;
    }

    public FamilyKind kind() {
        return kind;
    }

    public boolean isHidden() {
        return visibility == FontVisibility.HIDDEN;
    }

    public boolean hasBadUnderline() {
        return badUnderline;
    }

    /** Whether faces have been loaded. */
    public boolean hasStyles() {
        return hasStyles;
    }

    /**
     * Load the family's faces if not done yet. Safe to call from any thread;
     * the source runs once.
     */
    public void findStyleVariations() {
        if (hasStyles) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (hasStyles) {
                return;
            }
            List<FontFace> loaded;
            try {
                loaded = source == null ? List.of() : source.loadFaces(this);
            } catch (ProviderUnavailableException e) {
                log.log(Level.WARNING, "Could not load faces of " + name, e);
                loaded = List.of();
            }
            List<FontFace> sorted = new ArrayList<>(loaded);
            sorted.sort(FACE_ORDER);
            faces = Collections.unmodifiableList(sorted);
            hasStyles = true;
            log.fine(() -> String.format("Family %s: %d faces", name, faces.size()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Faces in match order, loading them first if needed. */
    public List<FontFace> faces() {
        findStyleVariations();
        return faces;
    }

    /**
     * The face that best matches {@code request} by CSS font matching.
     *
     * @return the face, or null if the family has no faces
     */
    public FontFace findFaceForStyle(StyleRequest request) {
        return StyleMatcher.bestMatch(faces(), request);
    }

    /** The face with the given canonical name, or null. */
    public FontFace findFace(String faceName) {
        for (FontFace face : faces()) {
            if (face.name().equals(faceName)) {
                return face;
            }
        }
        return null;
    }

    /** Other names this family is known by. */
    public List<String> aliases() {
        synchronized (aliases) {
            return List.copyOf(aliases);
        }
    }

    void addAlias(String alias) {
        aliases.add(alias);
    }

    @Override
    public String toString() {
        return "FontFamily[" + name + ", " + visibility + (hasStyles ? ", " + faces.size() + " faces" : "") + "]";
    }
}
