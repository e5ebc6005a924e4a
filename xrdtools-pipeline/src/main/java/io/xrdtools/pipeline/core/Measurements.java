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

import io.xrdtools.dataset.DiffractionDataset;
import io.xrdtools.refine.PeakParameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Names of the per-cell measurements a reduction produces.
public final class Measurements {

    public static final String POSITION = "pos";
    public static final String AREA = "area";
    public static final String SIGMA = "sigma";
    public static final String GAMMA = "gamma";
    public static final String D_SPACING = DiffractionDataset.D_SPACING;

    /// Columns written per frame, in column order.
    public static final List<String> PRIMARY = List.of(POSITION, AREA, SIGMA, GAMMA, D_SPACING);

    /// Measurements that get a `delta` column, in the order they are derived.
    public static final List<String> DELTAS = List.of(D_SPACING, DiffractionDataset.STRAIN, AREA, SIGMA, GAMMA, POSITION);

    private Measurements() {
    }

    /// Bragg d-spacing for a 2θ position in degrees.
    ///
    /// @return `λ / (2 sin(θ))`, or NaN where that is not finite
    public static double dSpacing(double twoTheta, double wavelength) {
        double d = wavelength / (2 * Math.sin(Math.toRadians(twoTheta / 2)));
        return Double.isFinite(d) ? d : Double.NaN;
    }

    /// Primary measurement values of one refined peak.
    public static Map<String, Double> of(PeakParameters peak, double wavelength) {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(POSITION, peak.position());
        values.put(AREA, peak.area());
        values.put(SIGMA, peak.sigma());
        values.put(GAMMA, peak.gamma());
        values.put(D_SPACING, dSpacing(peak.position(), wavelength));
        return values;
    }
}
