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

/**
 * Font catalog and resolution.
 *
 * <p>{@link dev.everydaythings.fontcat.FontCatalog} enumerates installed families
 * through a {@link dev.everydaythings.fontcat.PlatformFontProvider}, loads faces
 * and their coverage on demand, and answers three questions: which family a
 * name refers to, which face of it best matches a requested style, and which
 * other face can render a character the requested family lacks.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * CatalogConfig config = CatalogConfig.load();   // fontcat.properties + -Dfontcat.* overrides
 * try (FontCatalog catalog = new FontCatalog(provider, config)) {
 *     FontFace face = catalog.resolveStyle("Helvetica", StyleRequest.NORMAL.withWeight(700));
 *     if (!face.hasCharacter(0x0915)) {
 *         FallbackMatch match = catalog.resolveFallback(0x0915,
 *                 Character.UnicodeScript.DEVANAGARI, StyleRequest.NORMAL);
 *     }
 * }
 * }</pre>
 *
 * <h2>Coverage</h2>
 * <p>A face's coverage is its {@code cmap} minus complex-script ranges it has no
 * layout tables for (see {@link dev.everydaythings.fontcat.ComplexScriptFilter}).
 * Faces loaded from runtime data are trusted as-is.
 *
 * <h2>Threading</h2>
 * <p>All public operations are thread safe. Provider calls are serialized on a
 * single lock that is always taken last, so providers never see concurrent calls.
 *
 * @see dev.everydaythings.fontcat.FontCatalog
 * @see dev.everydaythings.fontcat.FamilyDataLoader
 */
package dev.everydaythings.fontcat;
