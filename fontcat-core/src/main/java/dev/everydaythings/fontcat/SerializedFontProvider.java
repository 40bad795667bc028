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

import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serializes every call into a {@link PlatformFontProvider}.
 *
 * <p>Native font enumeration APIs can corrupt shared caches when entered
 * concurrently, so all provider access goes through one reentrant lock. The
 * lock is independent of the catalog's read/write lock and is always the
 * innermost lock taken: nothing acquires another catalog, family or face lock
 * while holding it.
 */
public final class SerializedFontProvider {

    private static final Logger log = Logger.getLogger(SerializedFontProvider.class.getName());

    private final PlatformFontProvider provider;
    private final ReentrantLock lock = new ReentrantLock();

    public SerializedFontProvider(PlatformFontProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required");
        }
        this.provider = provider;
    }

    /**
     * Run {@code call} against the provider while holding the provider lock.
     *
     * @throws ProviderUnavailableException if the provider threw
     */
    public <T> T call(ProviderCall<T> call) {
        lock.lock();
        try {
            return call.apply(provider);
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.log(Level.FINE, "Font provider call failed", e);
            throw new ProviderUnavailableException("Font provider call failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /** The wrapped provider. Calls made on it directly are not serialized. */
    public PlatformFontProvider provider() {
        return provider;
    }

    /** One call into the provider. */
    @FunctionalInterface
    public interface ProviderCall<T> {
        T apply(PlatformFontProvider provider);
    }
}
