package me.locai.messaging.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fair per-key locks that are created on demand and dropped once no thread
 * holds or waits for them.
 *
 * <p>
 * Each entry counts its holders and waiters; the count is only changed inside
 * {@link ConcurrentHashMap#compute}, so an entry is never removed while a
 * thread is about to lock it.
 *
 * @param <K>
 *            key type
 */
public class KeyedLockRegistry<K> {

    private final Map<K, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Tries to lock the key within the timeout.
     *
     * @return a lease to close when done, or empty if the timeout elapsed
     * @throws InterruptedException
     *             if interrupted while waiting
     */
    public Optional<Lease> tryAcquire(K key, Duration timeout) throws InterruptedException {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry result = existing != null ? existing : new LockEntry();
            result.references++;
            return result;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
        return acquired ? Optional.of(new Lease(key, entry)) : Optional.empty();
    }

    /**
     * Number of keys with a live lock entry.
     */
    public int size() {
        return locks.size();
    }

    private void release(K key) {
        locks.compute(key, (k, existing) -> {
            if (existing == null) {
                return null;
            }
            existing.references--;
            return existing.references <= 0 ? null : existing;
        });
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int references;
    }

    /**
     * Held lock for one key. Must be closed by the thread that acquired it.
     */
    public final class Lease implements AutoCloseable {

        private final K key;
        private final LockEntry entry;

        private Lease(K key, LockEntry entry) {
            this.key = key;
            this.entry = entry;
        }

        public K getKey() {
            return key;
        }

        @Override
        public void close() {
            entry.lock.unlock();
            release(key);
        }
    }
}
