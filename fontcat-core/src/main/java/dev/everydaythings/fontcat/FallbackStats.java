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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters describing fallback outcomes, for diagnostics.
 */
public final class FallbackStats {

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong matches = new AtomicLong();
    private final AtomicLong noSuggestion = new AtomicLong();
    private final AtomicLong placeholders = new AtomicLong();
    private final AtomicLong unknownFamilies = new AtomicLong();
    private final AtomicLong badFallbacks = new AtomicLong();

    void recordRequest() {
        requests.incrementAndGet();
    }

    void recordMatch() {
        matches.incrementAndGet();
    }

    void recordNoSuggestion() {
        noSuggestion.incrementAndGet();
    }

    void recordPlaceholder() {
        placeholders.incrementAndGet();
    }

    void recordUnknownFamily() {
        unknownFamilies.incrementAndGet();
    }

    void recordBadFallback() {
        badFallbacks.incrementAndGet();
    }

    public long requests() {
        return requests.get();
    }

    public long matches() {
        return matches.get();
    }

    /** The provider had no suggestion or failed. */
    public long noSuggestion() {
        return noSuggestion.get();
    }

    /** The provider suggested a placeholder family. */
    public long placeholders() {
        return placeholders.get();
    }

    /** The suggested family is not in the catalog. */
    public long unknownFamilies() {
        return unknownFamilies.get();
    }

    /** The suggested family's face does not cover the character. */
    public long badFallbacks() {
        return badFallbacks.get();
    }

    @Override
    public String toString() {
        return String.format("FallbackStats[requests=%d, matches=%d, noSuggestion=%d, placeholders=%d, "
                        + "unknownFamilies=%d, badFallbacks=%d]",
                requests(), matches(), noSuggestion(), placeholders(), unknownFamilies(), badFallbacks());
    }
}
