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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interns character maps by content so faces with identical coverage share
 * one instance. One cache belongs to one catalog state and is dropped with it.
 */
public final class CharacterMapCache {

    private final ConcurrentMap<CharacterMap, CharacterMap> maps = new ConcurrentHashMap<>();

    /** The shared instance equal to {@code map}, registering {@code map} if new. */
    public CharacterMap intern(CharacterMap map) {
        if (map.isEmpty()) {
            return CharacterMap.empty();
        }
        CharacterMap existing = maps.putIfAbsent(map, map);
        return existing != null ? existing : map;
    }

    /** Number of distinct maps held. */
    public int size() {
        return maps.size();
    }

    public long sizeInBytes() {
        long total = 0;
        for (CharacterMap map : maps.keySet()) {
            total += map.sizeInBytes();
        }
        return total;
    }
}
