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

/// Relative-change convergence test between two successive snapshots.
///
/// The change of a parameter is `|new - old| / |old|`; parameters whose previous magnitude is at
/// most [#MIN_MAGNITUDE] are ignored, so values sitting at zero never block convergence.
///
/// @param threshold maximum relative change accepted as converged
public record ConvergenceCriteria(double threshold) {

    public static final double DEFAULT_THRESHOLD = 1e-4;
    public static final double MIN_MAGNITUDE = 1e-10;
    public static final ConvergenceCriteria DEFAULT = new ConvergenceCriteria(DEFAULT_THRESHOLD);

    public ConvergenceCriteria {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
    }

    /// @return the largest relative change over peaks and background peaks; infinite if the
    ///     snapshots differ in shape or a new value is non-finite
    public double maxRelativeChange(ParameterSnapshot previous, ParameterSnapshot current) {
        if (!previous.hasSameShapeAs(current)) {
            return Double.POSITIVE_INFINITY;
        }
        double max = 0;
        for (int i = 0; i < current.peaks().size(); i++) {
            max = Math.max(max, maxChange(previous.peak(i).toArray(), current.peak(i).toArray()));
        }
        for (int i = 0; i < current.backgroundPeaks().size(); i++) {
            max = Math.max(max, maxChange(previous.backgroundPeaks().get(i).toArray(),
                current.backgroundPeaks().get(i).toArray()));
        }
        return max;
    }

    public boolean isConverged(ParameterSnapshot previous, ParameterSnapshot current) {
        return maxRelativeChange(previous, current) < threshold;
    }

    private static double maxChange(double[] old, double[] now) {
        double max = 0;
        for (int k = 0; k < old.length; k++) {
            if (!Double.isFinite(now[k])) {
                return Double.POSITIVE_INFINITY;
            }
            if (Math.abs(old[k]) > MIN_MAGNITUDE) {
                max = Math.max(max, Math.abs(now[k] - old[k]) / Math.abs(old[k]));
            }
        }
        return max;
    }
}
