package io.xrdtools.pipeline.core;

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

import io.xrdtools.dataset.ReferenceTables;
import io.xrdtools.pipeline.cache.CacheKey;
import io.xrdtools.refine.BackgroundPeak;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ReferenceContext")
class ReferenceContextTest {

    private static ReferenceContext context(float position, double backgroundIntensity) {
        ReferenceTables tables = ReferenceTables.of(Map.of(
            Measurements.POSITION, new float[][]{{position, position}},
            Measurements.AREA, new float[][]{{100f, 100f}},
            Measurements.SIGMA, new float[][]{{0.05f, 0.05f}},
            Measurements.GAMMA, new float[][]{{0.02f, Float.NaN}}));
        BackgroundTemplate background = BackgroundTemplate.average(List.of(new FrameResult(0, List.of(
            new SliceFit(0, 0, List.of(), List.of(new BackgroundPeak(6.5, backgroundIntensity, 0.1, 0))),
            new SliceFit(1, 180, List.of(), List.of(new BackgroundPeak(6.5, backgroundIntensity, 0.1, 0)))))),
            2, 1);
        return new ReferenceContext(tables, background);
    }

    @Test
    @DisplayName("should seed only cells where every reference parameter is finite")
    void shouldSeedFiniteCells() {
        ReferenceContext context = context(6.01f, 500);

        assertThat(context.seedFor(0, 0)).hasValueSatisfying(seed -> {
            assertThat(seed.position()).isCloseTo(6.01, within(1e-6));
            assertThat(seed.area()).isEqualTo(100.0);
        });
        assertThat(context.seedFor(0, 1)).isEmpty();
        assertThat(ReferenceContext.EMPTY.seedFor(0, 0)).isEmpty();
    }

    @Test
    @DisplayName("should fingerprint the tables and the background template")
    void shouldFingerprintContent() {
        String fingerprint = context(6.01f, 500).fingerprint();

        assertThat(ReferenceContext.EMPTY.fingerprint()).isEqualTo(CacheKey.NO_CONTEXT);
        assertThat(fingerprint).hasSize(64).isEqualTo(context(6.01f, 500).fingerprint());
        assertThat(context(6.02f, 500).fingerprint()).isNotEqualTo(fingerprint);
        assertThat(context(6.01f, 501).fingerprint()).isNotEqualTo(fingerprint);
        assertThat(new ReferenceContext(ReferenceTables.empty(), context(6.01f, 500).background()).fingerprint())
            .isNotEqualTo(fingerprint)
            .isNotEqualTo(CacheKey.NO_CONTEXT);
    }
}
