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

import java.util.List;
import java.util.function.UnaryOperator;

/// Immutable parameters of one slice at one point of refinement.
///
/// Each engine call produces a new snapshot; the controller compares snapshots across passes
/// to decide convergence.
///
/// @param peaks tracked peaks, in peak order
/// @param backgroundPeaks background peaks, in candidate order
/// @param backgroundCoefficients engine-specific smooth background terms
public record ParameterSnapshot(List<PeakParameters> peaks, List<BackgroundPeak> backgroundPeaks,
                                List<Double> backgroundCoefficients) {

    public ParameterSnapshot {
        peaks = List.copyOf(peaks);
        backgroundPeaks = List.copyOf(backgroundPeaks);
        backgroundCoefficients = List.copyOf(backgroundCoefficients);
    }

    public static ParameterSnapshot of(List<PeakParameters> peaks, List<BackgroundPeak> backgroundPeaks) {
        return new ParameterSnapshot(peaks, backgroundPeaks, List.of());
    }

    public ParameterSnapshot withPeaks(List<PeakParameters> newPeaks) {
        return new ParameterSnapshot(newPeaks, backgroundPeaks, backgroundCoefficients);
    }

    public ParameterSnapshot mapPeaks(UnaryOperator<PeakParameters> fn) {
        return withPeaks(peaks.stream().map(fn).toList());
    }

    public PeakParameters peak(int index) {
        return peaks.get(index);
    }

    public boolean hasSameShapeAs(ParameterSnapshot other) {
        return peaks.size() == other.peaks.size() && backgroundPeaks.size() == other.backgroundPeaks.size();
    }
}
