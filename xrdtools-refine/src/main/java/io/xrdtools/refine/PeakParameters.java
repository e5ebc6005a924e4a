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

/// Pseudo-Voigt parameters of one tracked peak in one azimuthal slice.
///
/// @param position 2θ centre in degrees
/// @param area integrated intensity
/// @param sigma Gaussian width
/// @param gamma Lorentzian width
public record PeakParameters(double position, double area, double sigma, double gamma) {

    public PeakParameters withPosition(double value) {
        return new PeakParameters(value, area, sigma, gamma);
    }

    public PeakParameters withArea(double value) {
        return new PeakParameters(position, value, sigma, gamma);
    }

    public PeakParameters withSigma(double value) {
        return new PeakParameters(position, area, value, gamma);
    }

    public PeakParameters withGamma(double value) {
        return new PeakParameters(position, area, sigma, value);
    }

    public boolean isFinite() {
        return Double.isFinite(position) && Double.isFinite(area)
            && Double.isFinite(sigma) && Double.isFinite(gamma);
    }

    double[] toArray() {
        return new double[]{position, area, sigma, gamma};
    }
}
