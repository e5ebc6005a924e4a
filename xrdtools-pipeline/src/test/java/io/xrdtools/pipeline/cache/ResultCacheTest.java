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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultCache")
class ResultCacheTest {

    private static final Path FILE = Path.of("/data/images/frame_00001.tif");

    private static CacheKey key(int frame) {
        return CacheKey.of(FILE, "S1", frame, "spacing=5|", CacheKey.Role.SAMPLE);
    }

    @Test
    @DisplayName("should key on every fingerprint component")
    void shouldDistinguishKeys() {
        CacheKey base = key(1);

        assertThat(key(1)).isEqualTo(base);
        assertThat(base.fingerprint()).hasSize(64);
        assertThat(key(2)).isNotEqualTo(base);
        assertThat(CacheKey.of(FILE, "S2", 1, "spacing=5|", CacheKey.Role.SAMPLE)).isNotEqualTo(base);
        assertThat(CacheKey.of(FILE, "S1", 1, "spacing=10|", CacheKey.Role.SAMPLE)).isNotEqualTo(base);
        assertThat(CacheKey.of(FILE, "S1", 1, "spacing=5|", CacheKey.Role.REFERENCE)).isNotEqualTo(base);
        assertThat(CacheKey.of(Path.of("/data/other.tif"), "S1", 1, "spacing=5|", CacheKey.Role.SAMPLE))
            .isNotEqualTo(base);
        assertThat(CacheKey.of(FILE, "S1", 1, "spacing=5|", CacheKey.Role.SAMPLE, CacheKey.NO_CONTEXT))
            .isEqualTo(base);
        assertThat(CacheKey.of(FILE, "S1", 1, "spacing=5|", CacheKey.Role.SAMPLE, "3fa9"))
            .isNotEqualTo(base);
    }

    @Test
    @DisplayName("should count hits and misses and keep the first stored value")
    void shouldKeepFirstValue() {
        ResultCache<String> cache = new ResultCache<>();

        assertThat(cache.get(key(1))).isEmpty();
        assertThat(cache.putIfAbsent(key(1), "first")).isEqualTo("first");
        assertThat(cache.putIfAbsent(key(1), "second")).isEqualTo("first");
        assertThat(cache.get(key(1))).contains("first");
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);

        cache.evict(key(1));
        assertThat(cache.get(key(1))).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should not lose updates under concurrent put-if-absent")
    void shouldTolerateConcurrentPuts() throws Exception {
        ResultCache<Integer> cache = new ResultCache<>();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> stored = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int value = t;
                stored.add(pool.submit(() -> {
                    start.await();
                    int last = -1;
                    for (int frame = 0; frame < 200; frame++) {
                        last = cache.putIfAbsent(key(frame), value);
                    }
                    return last;
                }));
            }
            start.countDown();
            List<Integer> seen = new ArrayList<>();
            for (Future<Integer> future : stored) {
                seen.add(future.get(10, TimeUnit.SECONDS));
            }
            Integer winner = cache.get(key(199)).orElseThrow();
            assertThat(seen).containsOnly(winner);
        } finally {
            pool.shutdownNow();
        }
        assertThat(cache.size()).isEqualTo(200);
    }
}
