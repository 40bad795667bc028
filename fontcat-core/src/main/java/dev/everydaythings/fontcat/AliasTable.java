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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Other family names (localized or typographic) mapped to the family and
 * faces that carry them.
 */
public final class AliasTable {

    /**
     * @param alias  the other name as read from the font
     * @param family canonical family
     * @param faces  faces of {@code family} that carry the alias
     */
    public record AliasRecord(String alias, FontFamily family, List<FontFace> faces) {
        public AliasRecord {
            faces = List.copyOf(faces);
        }
    }

    private final Map<String, AliasRecord> aliases = new ConcurrentHashMap<>();

    /** The record for a case-folded alias key, or null. */
    public AliasRecord find(String name) {
        return aliases.get(FontFamily.key(name));
    }

    /**
     * Register an alias unless the name is already taken; the first family to
     * claim a name keeps it.
     *
     * @return whether the alias was added
     */
    public boolean add(String alias, FontFamily family, List<FontFace> faces) {
        AliasRecord existing = aliases.putIfAbsent(FontFamily.key(alias), new AliasRecord(alias, family, faces));
        if (existing == null) {
            family.addAlias(alias);
            return true;
        }
        return false;
    }

    /** Records pointing at {@code family}, ordered by alias. */
    public List<AliasRecord> forFamily(FontFamily family) {
        return aliases.values().stream()
                .filter(record -> record.family() == family)
                .sorted(Comparator.comparing(AliasRecord::alias))
                .collect(Collectors.toList());
    }

    public int size() {
        return aliases.size();
    }
}
