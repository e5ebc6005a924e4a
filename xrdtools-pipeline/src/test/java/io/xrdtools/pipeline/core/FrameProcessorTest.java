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
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.pipeline.frames.FrameDescriptor;
import io.xrdtools.pipeline.testing.SyntheticEngine;
import io.xrdtools.pipeline.testing.SyntheticIntegrator;
import io.xrdtools.pipeline.testing.TestParameters;
import io.xrdtools.refine.BackgroundPeak;
import io.xrdtools.refine.ParameterSnapshot;
import io.xrdtools.refine.PeakParameters;
import io.xrdtools.refine.RefinementRecipe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.xrdtools.pipeline.testing.TestParameters.BACKGROUND;
import static io.xrdtools.pipeline.testing.TestParameters.PEAK_A;
import static io.xrdtools.pipeline.testing.TestParameters.PEAK_B;
import static org.assertj.core.api.Assertions.*;

@DisplayName("FrameProcessor")
class FrameProcessorTest {

    private final ProcessingParameters params = TestParameters.twoPeaks(Path.of("/synthetic/images")).build();
    private final FrameProcessor processor =
        new FrameProcessor(new SyntheticIntegrator(PEAK_A, PEAK_B), new SyntheticEngine(), params);

    private static float[][] table(float value) {
        float[][] t = new float[2][4];
        for (float[] row : t) {
            Arrays.fill(row, value);
        }
        return t;
    }

    @Test
    @DisplayName("should seed peaks at their configured positions and background at fixed defaults")
    void shouldSeedFromConfiguration() {
        ParameterSnapshot seed = processor.seed(ReferenceContext.EMPTY, 2);

        assertThat(seed.peaks()).containsExactly(
            new PeakParameters(PEAK_A, 1.0, 0.01, 0.01),
            new PeakParameters(PEAK_B, 1.0, 0.01, 0.01));
        assertThat(seed.backgroundPeaks()).containsExactly(new BackgroundPeak(BACKGROUND, 100, 2000, 0));
    }

    @Test
    @DisplayName("should seed from finite reference values and the averaged background")
    void shouldSeedFromReference() {
        ReferenceTables tables = ReferenceTables.of(Map.of(
            "pos", table(6.25f), "area", table(40f), "sigma", table(0.5f), "gamma", table(0.25f)));
        FrameResult reference = new FrameResult(0, List.of(
            new SliceFit(0, 0, List.of(), List.of(new BackgroundPeak(6.4, 250, 0.2, 0.1))),
            new SliceFit(1, 90, List.of(), List.of(new BackgroundPeak(6.4, 350, 0.2, 0.1))),
            new SliceFit(2, 180, List.of(), List.of(new BackgroundPeak(6.4, 450, 0.2, 0.1))),
            new SliceFit(3, 270, List.of(), List.of(new BackgroundPeak(6.4, 550, 0.2, 0.1)))));
        ReferenceContext context = new ReferenceContext(tables, BackgroundTemplate.average(List.of(reference), 4, 1));

        ParameterSnapshot seed = processor.seed(context, 1);

        assertThat(seed.peak(0)).isEqualTo(new PeakParameters(6.25, 40, 0.5, 0.25));
        assertThat(seed.backgroundPeaks()).singleElement().extracting(BackgroundPeak::intensity).isEqualTo(350.0);
    }

    @Test
    @DisplayName("should fall back to configured seeds where the reference is not finite")
    void shouldIgnoreNonFiniteReference() {
        ReferenceTables tables = ReferenceTables.of(Map.of(
            "pos", table(Float.NaN), "area", table(40f), "sigma", table(0.5f), "gamma", table(0.25f)));

        ParameterSnapshot seed = processor.seed(new ReferenceContext(tables, BackgroundTemplate.EMPTY), 0);

        assertThat(seed.peak(0)).isEqualTo(new PeakParameters(PEAK_A, 1.0, 0.01, 0.01));
    }

    @Test
    @DisplayName("should refine every slice of a frame in azimuth order")
    void shouldRefineAllSlices() {
        WorkUnit unit = new WorkUnit(FrameDescriptor.single(Path.of("/synthetic/images/frame_00005.tif"), 5),
            false, ReferenceContext.EMPTY, RefinementRecipe.standard(false, true), null);

        FrameOutcome outcome = processor.process(unit);

        assertThat(outcome).isInstanceOfSatisfying(FrameOutcome.Completed.class, completed -> {
            assertThat(completed.result().frameNumber()).isEqualTo(5);
            assertThat(completed.result().slices()).extracting(SliceFit::azimuthIndex).containsExactly(0, 1, 2, 3);
            assertThat(completed.result().slices().get(3).peaks().get(0).area()).isEqualTo(105.0);
            assertThat(completed.result().slices().get(3).background().get(0).intensity())
                .isEqualTo(SyntheticEngine.BACKGROUND_INTENSITY);
        });
    }
}
