package me.locai.messaging.cache;

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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Thread-safe map whose entries expire after a time-to-live and whose size is
 * bounded by least-recently-used eviction.
 *
 * <p>
 * Expiry is evaluated lazily against the injected {@link Clock} on every
 * access, so tests can move time forward without sleeping. Each entry carries
 * its own TTL; {@link #put(Object, Object)} uses the default one.
 *
 * <p>
 * Access order is maintained by a {@link LinkedHashMap} in access-order mode.
 * All operations hold the instance monitor; the critical sections are O(1)
 * apart from {@link #purgeExpired()}.
 *
 * @param <K>
 *            key type
 * @param <V>
 *            value type
 */
public class ExpiringCache<K, V> {

    private final Clock clock;
    private final Duration defaultTtl;
    private final int maxEntries;
    private final boolean refreshOnAccess;
    private final LinkedHashMap<K, Entry<V>> entries;

    /**
     * @param clock
     *            time source for expiry decisions
     * @param defaultTtl
     *            TTL applied by {@link #put(Object, Object)}
     * @param maxEntries
     *            upper bound on live entries; the least recently used entry is
     *            evicted beyond it
     * @param refreshOnAccess
     *            when {@code true} a successful read restarts the entry's TTL
     *            (idle expiry); otherwise the TTL counts from the write
     */
    public ExpiringCache(Clock clock, Duration defaultTtl, int maxEntries, boolean refreshOnAccess) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTtl = defaultTtl;
        this.maxEntries = maxEntries;
        this.refreshOnAccess = refreshOnAccess;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public ExpiringCache(Clock clock, Duration defaultTtl, int maxEntries) {
        this(clock, defaultTtl, maxEntries, false);
    }

    public synchronized Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            entries.remove(key);
            return Optional.empty();
        }
        if (refreshOnAccess) {
            entries.put(key, entry.renewedAt(now));
        }
        return Optional.of(entry.value());
    }

    public boolean containsKey(K key) {
        return get(key).isPresent();
    }

    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    public synchronized void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new Entry<>(value, clock.instant(), ttl));
        evictOverflow();
    }

    /**
     * Stores the value only when no live entry exists for the key.
     *
     * @return {@code true} if the value was stored, {@code false} if a live
     *         entry was already present
     */
    public synchronized boolean putIfAbsent(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Instant now = clock.instant();
        Entry<V> existing = entries.get(key);
        if (existing != null && !existing.isExpired(now)) {
            return false;
        }
        entries.put(key, new Entry<>(value, now, defaultTtl));
        evictOverflow();
        return true;
    }

    /**
     * Returns the live value for the key, creating and storing it with the
     * default TTL when absent or expired.
     */
    public synchronized V computeIfAbsent(K key, Function<? super K, ? extends V> factory) {
        Optional<V> existing = get(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        V created = Objects.requireNonNull(factory.apply(key), "factory returned null");
        entries.put(key, new Entry<>(created, clock.instant(), defaultTtl));
        evictOverflow();
        return created;
    }

    /**
     * Returns the age of the live entry for the key, if any.
     */
    public synchronized Optional<Duration> ageOf(K key) {
        Entry<V> entry = entries.get(key);
        Instant now = clock.instant();
        if (entry == null || entry.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(entry.writtenAt(), now));
    }

    public synchronized Optional<V> remove(K key) {
        Entry<V> removed = entries.remove(key);
        if (removed == null || removed.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(removed.value());
    }

    /**
     * Drops every expired entry and returns how many were removed.
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Number of stored entries, including ones that expired but were not yet
     * touched.
     */
    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private void evictOverflow() {
        Iterator<K> eldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    private record Entry<V>(V value, Instant writtenAt, Duration ttl) {

        boolean isExpired(Instant now) {
            return !now.isBefore(writtenAt.plus(ttl));
        }

        Entry<V> renewedAt(Instant now) {
            return new Entry<>(value, now, ttl);
        }
    }
}
