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

import io.xrdtools.refine.BackgroundPeak;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Background peaks averaged over the reference frames, one list per azimuth bin.
public final class BackgroundTemplate {

    public static final BackgroundTemplate EMPTY = new BackgroundTemplate(List.of());

    static final double DEFAULT_POSITION = 4.5;
    static final double DEFAULT_INTENSITY = 1000;
    static final double DEFAULT_WIDTH = 0.1;

    private final List<List<BackgroundPeak>> perAzimuth;

    private BackgroundTemplate(List<List<BackgroundPeak>> perAzimuth) {
        this.perAzimuth = perAzimuth.stream().map(List::copyOf).toList();
    }

    /// Averages each background peak parameter per azimuth, ignoring non-finite values.
    /// A parameter with no finite value at all falls back to a fixed default.
    public static BackgroundTemplate average(Collection<FrameResult> results, int azimuths, int backgroundPeaks) {
        if (backgroundPeaks == 0) {
            return EMPTY;
        }
        List<List<BackgroundPeak>> perAzimuth = new ArrayList<>(azimuths);
        for (int a = 0; a < azimuths; a++) {
            List<BackgroundPeak> peaks = new ArrayList<>(backgroundPeaks);
            for (int b = 0; b < backgroundPeaks; b++) {
                double[] sums = new double[4];
                int[] counts = new int[4];
                for (FrameResult result : results) {
                    BackgroundPeak peak = result.slices().get(a).background().get(b);
                    accumulate(sums, counts, 0, peak.position());
                    accumulate(sums, counts, 1, peak.intensity());
                    accumulate(sums, counts, 2, peak.sigma());
                    accumulate(sums, counts, 3, peak.gamma());
                }
                peaks.add(new BackgroundPeak(
                    mean(sums, counts, 0, DEFAULT_POSITION),
                    mean(sums, counts, 1, DEFAULT_INTENSITY),
                    mean(sums, counts, 2, DEFAULT_WIDTH),
                    mean(sums, counts, 3, DEFAULT_WIDTH)));
            }
            perAzimuth.add(peaks);
        }
        return new BackgroundTemplate(perAzimuth);
    }

    private static void accumulate(double[] sums, int[] counts, int i, double value) {
        if (Double.isFinite(value)) {
            sums[i] += value;
            counts[i]++;
        }
    }

    private static double mean(double[] sums, int[] counts, int i, double fallback) {
        return counts[i] == 0 ? fallback : sums[i] / counts[i];
    }

    public boolean isEmpty() {
        return perAzimuth.isEmpty();
    }

    public List<BackgroundPeak> peaksFor(int azimuthIndex) {
        return perAzimuth.get(azimuthIndex);
    }

    public int azimuths() {
        return perAzimuth.size();
    }
}
