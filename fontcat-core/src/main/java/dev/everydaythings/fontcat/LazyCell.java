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

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A slot that is either empty or holds an immutable value, filled at most once.
 *
 * <p>Readers take the read lock to check for a published value; on a miss the
 * caller takes the write lock, checks again and builds. Concurrent first
 * readers therefore build the value once.
 */
public final class LazyCell<T> {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private T value;

    /**
     * The published value, building it with {@code builder} on first use.
     * {@code builder} must not return null.
     */
    public T get(Supplier<? extends T> builder) {
        lock.readLock().lock();
        try {
            if (value != null) {
                return value;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (value == null) {
                T built = builder.get();
                if (built == null) {
                    throw new IllegalStateException("LazyCell builder returned null");
                }
                value = built;
            }
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** The value if already built, otherwise null. Never builds. */
    public T peek() {
        lock.readLock().lock();
        try {
            return value;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isSet() {
        return peek() != null;
    }

    /**
     * Publish a value built elsewhere. Ignored if the cell is already set.
     *
     * @return the value now held
     */
    public T preset(T preset) {
        lock.writeLock().lock();
        try {
            if (value == null) {
                value = preset;
            }
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
