package io.xrdtools.refine;

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

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ParameterCorrector")
class ParameterCorrectorTest {

    private final ParameterCorrector corrector = new ParameterCorrector();
    private final AnalysisWindow window = new AnalysisWindow(5.0, 8.0);
    private final ParameterSnapshot seed = ParameterSnapshot.of(
        List.of(new PeakParameters(6.0, 1, 0.01, 0.01), new PeakParameters(7.0, 1, 0.01, 0.01)), List.of());

    private static ParameterSnapshot peaks(PeakParameters... peaks) {
        return ParameterSnapshot.of(List.of(peaks), List.of());
    }

    @Test
    @DisplayName("should reset every violating free parameter")
    void shouldResetViolations() {
        ParameterSnapshot bad = peaks(new PeakParameters(9.5, -3, -0.2, -0.1), new PeakParameters(7.1, 20, 0.1, 0.2));

        ParameterCorrector.Correction correction = corrector.correct(bad, ParameterMask.ALL, seed, window);

        assertThat(correction.corrections()).isEqualTo(4);
        assertThat(correction.snapshot().peak(0)).isEqualTo(new PeakParameters(6.0, 1, 0, 0));
        assertThat(correction.snapshot().peak(1)).isEqualTo(bad.peak(1));
    }

    @Test
    @DisplayName("should leave parameters that were held fixed alone")
    void shouldIgnoreFixedParameters() {
        ParameterSnapshot bad = peaks(new PeakParameters(9.5, -3, -0.2, 0.1), new PeakParameters(7, 1, 0.1, 0.1));

        ParameterCorrector.Correction correction = corrector.correct(bad, ParameterMask.SIGMA, seed, window);

        assertThat(correction.corrections()).isEqualTo(1);
        assertThat(correction.snapshot().peak(0).area()).isEqualTo(-3);
        assertThat(correction.snapshot().peak(0).position()).isEqualTo(9.5);
        assertThat(correction.snapshot().peak(0).sigma()).isZero();
    }

    @Test
    @DisplayName("should treat NaN results as violations")
    void shouldCorrectNaN() {
        ParameterSnapshot bad = peaks(new PeakParameters(Double.NaN, Double.NaN, 0.1, 0.1), new PeakParameters(7, 1, 0.1, 0.1));

        ParameterCorrector.Correction correction = corrector.correct(bad, ParameterMask.ALL, seed, window);

        assertThat(correction.snapshot().peak(0).area()).isEqualTo(1.0);
        assertThat(correction.snapshot().peak(0).position()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("should return the same snapshot when nothing is free")
    void shouldSkipEmptyMask() {
        ParameterSnapshot bad = peaks(new PeakParameters(9.5, -3, -0.2, -0.1), new PeakParameters(7, 1, 0.1, 0.1));

        ParameterCorrector.Correction correction = corrector.correct(bad, ParameterMask.NONE, seed, window);

        assertThat(correction.corrected()).isFalse();
        assertThat(correction.snapshot()).isSameAs(bad);
    }
}
