package io.xrdtools.pipeline.config;

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

import io.xrdtools.pipeline.frames.FrameRange;
import io.xrdtools.pipeline.testing.TestParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OutputNaming")
class OutputNamingTest {

    private static final Path IMAGES = Path.of("/data/images");

    @Test
    @DisplayName("should describe coverage, frames, window and peak counts in the directory name")
    void shouldNameDirectory() {
        ProcessingParameters params = TestParameters.twoPeaks(IMAGES).build();

        String name = OutputNaming.datasetDirectoryName(params, LocalTime.of(14, 25, 1));

        assertThat(name).isEqualTo("360deg-4bins-0sf-allfr-5.5l2t_7.5u2t-2peaks-1bkg-142501");
    }

    @Test
    @DisplayName("should place each dataset under its date and sample")
    void shouldNestByDateAndSample() {
        ProcessingParameters params = TestParameters.twoPeaks(IMAGES).sample("steel/weld 3").build();

        Path directory = OutputNaming.datasetDirectory(Path.of("/out"), params, LocalDateTime.of(2026, 3, 14, 14, 25, 1));

        assertThat(directory).isEqualTo(Path.of("/out", "2026-03-14", "steel_weld_3",
            "360deg-4bins-0sf-allfr-5.5l2t_7.5u2t-2peaks-1bkg-142501"));
    }

    @ParameterizedTest
    @CsvSource({
        "S1, S1",
        "a/b, a_b",
        "'x:y*z', x_y_z",
        "'..', _..",
        "run-2.b, run-2.b"
    })
    @DisplayName("should turn sample names into safe path segments")
    void shouldSanitizeSegments(String sample, String expected) {
        assertThat(OutputNaming.pathSegment(sample)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should use the end frame when the range is bounded")
    void shouldNameBoundedRange() {
        ProcessingParameters params = TestParameters.twoPeaks(IMAGES).frames(new FrameRange(5, 50, 5)).build();

        String name = OutputNaming.datasetDirectoryName(params, LocalTime.of(9, 0, 0));

        assertThat(name).startsWith("360deg-4bins-5sf-50efr-").endsWith("-090000");
    }

    @Test
    @DisplayName("should give a stable 8-digit id that changes with the parameters")
    void shouldDeriveDatasetId() {
        ProcessingParameters params = TestParameters.twoPeaks(IMAGES).build();
        ProcessingParameters same = TestParameters.twoPeaks(IMAGES).build();
        ProcessingParameters other = TestParameters.twoPeaks(IMAGES).sample("S2").build();

        String id = OutputNaming.datasetId(params);

        assertThat(id).hasSize(8).matches("[0-9a-f]{8}");
        assertThat(OutputNaming.datasetId(same)).isEqualTo(id);
        assertThat(OutputNaming.datasetId(other)).isNotEqualTo(id);
    }

    @Test
    @DisplayName("should ignore the worker count, which does not change results")
    void shouldIgnoreWorkers() {
        ProcessingParameters params = TestParameters.twoPeaks(IMAGES).build();

        assertThat(OutputNaming.datasetId(params.withOptions(params.options().withWorkers(8))))
            .isEqualTo(OutputNaming.datasetId(params));
        assertThat(params.withOptions(params.options().withWorkers(8)).signature()).isEqualTo(params.signature());
    }
}
