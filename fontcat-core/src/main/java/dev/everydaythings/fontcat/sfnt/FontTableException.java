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

package dev.everydaythings.fontcat.sfnt;

/**
 * Thrown when an SFNT table is truncated, inconsistent or otherwise unusable.
 *
 * <p>Callers in the catalog never let this escape a query: a face whose table
 * cannot be read is treated as covering nothing.
 */
public class FontTableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String table;
    private final long offset;

    /**
     * @param table   four-character tag of the table being read
     * @param message what was wrong
     */
    public FontTableException(String table, String message) {
        super("'" + table + "': " + message);
        this.table = table;
        this.offset = -1;
    }

    /**
     * @param table   four-character tag of the table being read
     * @param message what was wrong
     * @param offset  byte offset within the table where the problem was found
     */
    public FontTableException(String table, String message, long offset) {
        super("'" + table + "': " + message + " at offset " + offset);
        this.table = table;
        this.offset = offset;
    }

    public FontTableException(String table, String message, Throwable cause) {
        super("'" + table + "': " + message, cause);
        this.table = table;
        this.offset = -1;
    }

    /** The tag of the table that failed to parse. */
    public String getTable() {
        return table;
    }

    /** Offset of the failure within the table, or -1 if not known. */
    public long getOffset() {
        return offset;
    }
}
