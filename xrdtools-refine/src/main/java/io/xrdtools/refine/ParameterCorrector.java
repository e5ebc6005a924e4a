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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Resets physically impossible peak parameters after a refinement step.
///
/// Only parameters that were free in the step are inspected:
///
/// | Parameter | Violation | Reset to |
/// |-----------|-----------|----------|
/// | area | `< 0` or non-finite | `1` |
/// | sigma | `< 0` or non-finite | `0` |
/// | gamma | `< 0` or non-finite | `0` |
/// | position | outside the analysis window or non-finite | the peak's seed position |
public class ParameterCorrector {

    private static final Logger logger = LogManager.getLogger(ParameterCorrector.class);

    public static final double AREA_RESET = 1.0;
    public static final double WIDTH_RESET = 0.0;

    /// Result of a correction pass.
    ///
    /// @param snapshot corrected parameters
    /// @param corrections number of individual parameter resets
    public record Correction(ParameterSnapshot snapshot, int corrections) {

        public boolean corrected() {
            return corrections > 0;
        }
    }

    public Correction correct(ParameterSnapshot snapshot, ParameterMask mask, ParameterSnapshot seed,
                              AnalysisWindow window) {
        if (mask.isEmpty()) {
            return new Correction(snapshot, 0);
        }
        List<PeakParameters> corrected = new ArrayList<>(snapshot.peaks().size());
        int count = 0;
        for (int i = 0; i < snapshot.peaks().size(); i++) {
            PeakParameters peak = snapshot.peak(i);
            if (mask.area() && !(peak.area() >= 0)) {
                logger.debug("peak {}: area {} reset to {}", i, peak.area(), AREA_RESET);
                peak = peak.withArea(AREA_RESET);
                count++;
            }
            if (mask.sigma() && !(peak.sigma() >= 0)) {
                logger.debug("peak {}: sigma {} reset to {}", i, peak.sigma(), WIDTH_RESET);
                peak = peak.withSigma(WIDTH_RESET);
                count++;
            }
            if (mask.gamma() && !(peak.gamma() >= 0)) {
                logger.debug("peak {}: gamma {} reset to {}", i, peak.gamma(), WIDTH_RESET);
                peak = peak.withGamma(WIDTH_RESET);
                count++;
            }
            if (mask.position() && !window.contains(peak.position())) {
                double reset = seed.peak(i).position();
                logger.debug("peak {}: position {} outside [{}, {}], reset to {}",
                    i, peak.position(), window.lower(), window.upper(), reset);
                peak = peak.withPosition(reset);
                count++;
            }
            corrected.add(peak);
        }
        return new Correction(count == 0 ? snapshot : snapshot.withPeaks(corrected), count);
    }
}
