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

/**
 * Source of a face's raw SFNT tables.
 */
@FunctionalInterface
public interface FaceTables {

    /** A face with no readable tables, e.g. one received in a snapshot. */
    FaceTables NONE = tag -> null;

    /**
     * @param tag packed four-byte table tag
     * @return the table bytes, or null if the face has no such table
     * @throws ProviderUnavailableException if the tables cannot be read
     */
    byte[] table(int tag);
}
