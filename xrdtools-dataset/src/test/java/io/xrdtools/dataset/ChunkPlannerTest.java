package io.xrdtools.dataset;

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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ChunkPlanner")
class ChunkPlannerTest {

    private static final long MB = 1024L * 1024;

    @Nested
    @DisplayName("Whole-plane chunks")
    class WholePlane {

        @Test
        @DisplayName("should use a single chunk when the whole dataset fits the budget")
        void shouldUseSingleChunkForSmallDataset() {
            ChunkDims dims = ChunkPlanner.plan(1, 1000, 72, 10, 100 * MB);

            assertThat(dims).isEqualTo(new ChunkDims(1, 1000, 72, 10));
        }

        @Test
        @DisplayName("should keep the peak chunk at 1 even with many peaks")
        void shouldChunkPeaksIndividually() {
            ChunkDims dims = ChunkPlanner.plan(12, 50, 36, 8, 100 * MB);

            assertThat(dims.peak()).isEqualTo(1);
            assertThat(dims.measurement()).isEqualTo(8);
        }
    }

    @Nested
    @DisplayName("Aspect-ratio split")
    class AspectSplit {

        @Test
        @DisplayName("should favour the frame axis when frames outnumber azimuths")
        void shouldFavourFramesForTimeSeries() {
            // 4000 elements per measurement budget, 100000 x 72 plane
            ChunkDims dims = ChunkPlanner.plan(1, 100_000, 72, 10, 160_000);

            assertThat(dims.frame()).isEqualTo(4000);
            assertThat(dims.azimuth()).isEqualTo(1);
        }

        @Test
        @DisplayName("should favour the azimuth axis when azimuths outnumber frames")
        void shouldFavourAzimuthsForWideGrids() {
            ChunkDims dims = ChunkPlanner.plan(1, 10, 3600, 1, 4 * 1000);

            assertThat(dims.azimuth()).isEqualTo(1000);
            assertThat(dims.frame()).isEqualTo(1);
        }

        @Test
        @DisplayName("should treat zero azimuths as an aspect ratio of one")
        void shouldTreatZeroAzimuthsAsSquare() {
            ChunkDims dims = ChunkPlanner.plan(1, 500, 0, 2, 4 * 200);

            assertThat(dims.azimuth()).isEqualTo(1);
            assertThat(dims.frame()).isBetween(1, 100);
        }
    }

    @ParameterizedTest(name = "plan({0}, {1}, {2}, {3}, {4})")
    @DisplayName("should keep every dimension in [1, extent] and within the byte budget")
    @CsvSource({
        "1, 1000, 72, 10, 104857600",
        "3, 250000, 72, 30, 104857600",
        "2, 7, 3, 5, 64",
        "1, 1, 1, 1, 4",
        "5, 123457, 361, 17, 1048576",
        "1, 17, 100000, 4, 40000",
        "0, 0, 0, 0, 1024",
        "4, 90000, 90000, 2, 8388608"
    })
    void shouldRespectBoundsAndBudget(int peaks, int frames, int azimuths, int measurements, long target) {
        ChunkDims dims = ChunkPlanner.plan(peaks, frames, azimuths, measurements, target);

        assertThat(dims.peak()).isEqualTo(1);
        assertThat(dims.frame()).isBetween(1, Math.max(1, frames));
        assertThat(dims.azimuth()).isBetween(1, Math.max(1, azimuths));
        assertThat(dims.measurement()).isBetween(1, Math.max(1, measurements));
        if ((long) Math.max(1, measurements) * Float.BYTES <= target) {
            assertThat(dims.bytes(Float.BYTES)).isLessThanOrEqualTo((long) (target * 1.5));
        }
    }

    @Test
    @DisplayName("should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> ChunkPlanner.plan(-1, 1, 1, 1, 100))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("non-negative");
        assertThatThrownBy(() -> ChunkPlanner.plan(1, 1, 1, 1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("targetBytes");
        assertThatThrownBy(() -> ChunkPlanner.plan(1, 1, 1, 1, 100, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("itemSize");
    }

    @Test
    @DisplayName("should report the chunk grid for edge chunks")
    void shouldComputeChunkGrid() {
        ChunkDims dims = new ChunkDims(1, 4, 3, 2);

        assertThat(dims.grid(2, 10, 7)).containsExactly(2, 3, 3);
        assertThat(dims.elements()).isEqualTo(24);
    }
}
