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

/// The 1-D 2θ/intensity histogram of one azimuth bin of one frame.
///
/// @param index azimuth bin index
/// @param azimuth integration angle in degrees
/// @param twoTheta 2θ sample points in degrees
/// @param intensity intensity at each sample point
public record AzimuthalSlice(int index, double azimuth, double[] twoTheta, double[] intensity) {

    public AzimuthalSlice {
        if (twoTheta.length != intensity.length) {
            throw new IllegalArgumentException("twoTheta and intensity lengths differ: "
                + twoTheta.length + " vs " + intensity.length);
        }
    }

    public int size() {
        return twoTheta.length;
    }
}
