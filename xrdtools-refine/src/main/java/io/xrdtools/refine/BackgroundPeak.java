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

/// An interfering reflection modelled as part of the background.
///
/// @param position 2θ centre in degrees
/// @param intensity peak intensity
/// @param sigma Gaussian width
/// @param gamma Lorentzian width
public record BackgroundPeak(double position, double intensity, double sigma, double gamma) {

    double[] toArray() {
        return new double[]{position, intensity, sigma, gamma};
    }
}
