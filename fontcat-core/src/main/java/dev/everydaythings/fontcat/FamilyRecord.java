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

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replicated metadata of one family, as exchanged between processes by
 * {@link FontCatalog#exportSnapshot()} and {@link FontCatalog#importSnapshot(List)}.
 *
 * @param aliases other family names, each mapped to the names of the faces
 *                that carry it
 */
public record FamilyRecord(
        String name,
        FontVisibility visibility,
        FamilyKind kind,
        boolean badUnderline,
        Map<String, List<String>> aliases,
        List<FaceRecord> faces
) implements Serializable {

    public FamilyRecord {
        visibility = visibility == null ? FontVisibility.UNKNOWN : visibility;
        kind = kind == null ? FamilyKind.STANDARD : kind;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((alias, faceNames) -> copy.put(alias, List.copyOf(faceNames)));
        }
        aliases = Collections.unmodifiableMap(copy);
        faces = faces == null ? List.of() : List.copyOf(faces);
    }
}
