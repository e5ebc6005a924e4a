package io.xrdtools.pipeline.testing;

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

import io.xrdtools.refine.AnalysisWindow;
import io.xrdtools.refine.AzimuthalSlice;
import io.xrdtools.refine.BackgroundMask;
import io.xrdtools.refine.BackgroundPeak;
import io.xrdtools.refine.ParameterMask;
import io.xrdtools.refine.ParameterSnapshot;
import io.xrdtools.refine.PeakParameters;
import io.xrdtools.refine.RefinementEngine;
import io.xrdtools.refine.RefinementException;
import io.xrdtools.refine.RefinementStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/// Deterministic engine that jumps every free parameter straight to the value the
/// [SyntheticIntegrator] encoded in the slice, and counts its calls.
///
/// Frames listed in `failingFrames` fail on their second slice.
public class SyntheticEngine implements RefinementEngine {

    public static final double SIGMA = 0.05;
    public static final double GAMMA = 0.02;
    public static final double BACKGROUND_INTENSITY = 500;

    private final AtomicInteger calls = new AtomicInteger();
    private final Set<Integer> failingFrames;

    public SyntheticEngine() {
        this(Set.of());
    }

    public SyntheticEngine(Set<Integer> failingFrames) {
        this.failingFrames = Set.copyOf(failingFrames);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public ParameterSnapshot seedBackground(AzimuthalSlice slice, ParameterSnapshot seed, AnalysisWindow window) {
        calls.incrementAndGet();
        return seed;
    }

    @Override
    public ParameterSnapshot refine(AzimuthalSlice slice, ParameterSnapshot current, RefinementStep step,
                                    AnalysisWindow window) throws RefinementException {
        calls.incrementAndGet();
        if (slice.index() == 1 && failingFrames.contains(SyntheticIntegrator.frameOf(slice))) {
            throw new RefinementException("synthetic divergence in " + step.label());
        }
        ParameterMask mask = step.peaks();
        List<PeakParameters> peaks = new ArrayList<>();
        for (int p = 0; p < current.peaks().size(); p++) {
            PeakParameters peak = current.peak(p);
            if (mask.area()) {
                peak = peak.withArea(slice.intensity()[p]);
            }
            if (mask.position()) {
                peak = peak.withPosition(slice.twoTheta()[p]);
            }
            if (mask.sigma()) {
                peak = peak.withSigma(SIGMA);
            }
            if (mask.gamma()) {
                peak = peak.withGamma(GAMMA);
            }
            peaks.add(peak);
        }
        BackgroundMask bg = step.background();
        List<BackgroundPeak> background = current.backgroundPeaks().stream()
            .map(b -> bg.intensity() ? new BackgroundPeak(b.position(), BACKGROUND_INTENSITY, b.sigma(), b.gamma()) : b)
            .toList();
        return new ParameterSnapshot(peaks, background, current.backgroundCoefficients());
    }
}
