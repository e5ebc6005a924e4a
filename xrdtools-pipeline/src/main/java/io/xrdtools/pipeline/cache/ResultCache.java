package io.xrdtools.pipeline.cache;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory memo of frame results for one batch run.
///
/// Unbounded and never evicts on its own. Concurrent readers and writers are safe; two workers
/// racing on the same key may both compute, and the first stored value wins.
///
/// @param <V> cached value type
public class ResultCache<V> {

    private final ConcurrentMap<CacheKey, V> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public Optional<V> get(CacheKey key) {
        V value = entries.get(key);
        if (value == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(value);
    }

    /// @return the value now stored under `key`, which is the earlier one if present
    public V putIfAbsent(CacheKey key, V value) {
        V previous = entries.putIfAbsent(key, value);
        return previous == null ? value : previous;
    }

    public void evict(CacheKey key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }
}
