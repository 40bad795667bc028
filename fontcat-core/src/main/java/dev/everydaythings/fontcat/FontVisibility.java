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
 * Who may see a family through name lookup.
 */
public enum FontVisibility {
    /** Installed with the operating system. */
    BASE,
    /** Installed by the user. */
    USER,
    /** Internal platform family; reachable only by fallback and system UI lookup. */
    HIDDEN,
    /** Not classified, e.g. families received in a snapshot without a flag. */
    UNKNOWN
}
