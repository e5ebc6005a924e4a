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

import java.util.Collection;

/// The 2θ range over which slices are refined. Peak positions outside it are corrected.
///
/// @param lower lower 2θ bound in degrees, inclusive
/// @param upper upper 2θ bound in degrees, inclusive
public record AnalysisWindow(double lower, double upper) {

    public static final AnalysisWindow DEFAULT = new AnalysisWindow(4.5, 9.0);

    public AnalysisWindow {
        if (!(upper > lower)) {
            throw new IllegalArgumentException("upper must exceed lower: " + lower + " .. " + upper);
        }
    }

    public boolean contains(double twoTheta) {
        return twoTheta >= lower && twoTheta <= upper;
    }

    /// The smallest window covering every given window, or [#DEFAULT] if there are none.
    public static AnalysisWindow union(Collection<AnalysisWindow> windows) {
        if (windows.isEmpty()) {
            return DEFAULT;
        }
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (AnalysisWindow window : windows) {
            lo = Math.min(lo, window.lower());
            hi = Math.max(hi, window.upper());
        }
        return new AnalysisWindow(lo, hi);
    }
}
