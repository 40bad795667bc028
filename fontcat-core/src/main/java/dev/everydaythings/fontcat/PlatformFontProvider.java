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

/**
 * Host font enumeration, consumed by {@link FontCatalog}.
 *
 * <p>Implementations need not be thread safe: the catalog serializes every
 * call through a {@link SerializedFontProvider}. Methods may throw
 * {@link ProviderUnavailableException} (or any runtime exception) on failure;
 * the catalog turns failures into absent results.
 */
public interface PlatformFontProvider {

    /** Names of all installed families. */
    List<String> enumerateFamilies();

    /** Faces of a family in platform order; empty if the family is unknown. */
    List<FaceDescriptor> enumerateFaces(String familyName);

    /**
     * Raw SFNT table of a face.
     *
     * @return the table bytes, or null if the face has no such table
     */
    byte[] getTable(FaceDescriptor face, int tag);

    /**
     * The platform's own guess at a family that can render {@code codePoint}.
     *
     * @param codePoint full Unicode code point, never a lone surrogate
     * @param script    script of the surrounding run
     * @param style     requested style, as a hint
     * @return a family name, or null if the platform has no suggestion
     */
    String suggestFallbackFamily(int codePoint, Character.UnicodeScript script, StyleRequest style);

    /**
     * Find an installed face by full or PostScript name.
     *
     * @return the face, or null if no installed face has that name
     */
    FaceDescriptor resolveLocalFace(String name);

    /** Arrange for {@code callback} to run whenever installed fonts change. */
    void registerChangeNotification(Runnable callback);

    void unregisterChangeNotification(Runnable callback);

    /**
     * Name of the system UI family, or null if there is none.
     *
     * @param display true for the optical family used at large sizes
     */
    default String systemUiFamilyName(boolean display) {
        return null;
    }

    /**
     * Faces of the system UI family. These may not be reachable through
     * {@link #enumerateFaces}.
     */
    default List<FaceDescriptor> systemUiFaces(boolean display) {
        String name = systemUiFamilyName(display);
        return name == null ? List.of() : enumerateFaces(name);
    }

    /** Family used when nothing else is requested. */
    default String defaultFamilyName() {
        return systemUiFamilyName(false);
    }

    /** Visibility to assign to an enumerated family. */
    default FontVisibility visibility(String familyName) {
        return FontVisibility.BASE;
    }
}
