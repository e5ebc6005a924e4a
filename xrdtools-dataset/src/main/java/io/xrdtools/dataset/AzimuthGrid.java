package io.xrdtools.dataset;

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

/// The frame-invariant azimuthal binning of every diffraction image.
///
/// Bin `i` is centred on `start + i * spacing`; an angle maps to the nearest bin and is clamped
/// into range, so stray integration angles never index outside the dataset.
///
/// @param start first bin angle in degrees
/// @param end exclusive upper bound in degrees
/// @param spacing bin width in degrees
public record AzimuthGrid(double start, double end, double spacing) {

    private static final double EPSILON = 1e-9;

    public AzimuthGrid {
        if (!(spacing > 0) || !Double.isFinite(spacing)) {
            throw new IllegalArgumentException("spacing must be a positive number: " + spacing);
        }
        if (!(end > start)) {
            throw new IllegalArgumentException("end must be greater than start: " + start + " .. " + end);
        }
    }

    /// A grid of `bins` equal bins over the full circle.
    public static AzimuthGrid fullCircle(int bins) {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be >= 1: " + bins);
        }
        return new AzimuthGrid(0, 360, 360.0 / bins);
    }

    /// @return the number of azimuth bins
    public int count() {
        return Math.max(1, (int) Math.floor((end - start) / spacing + EPSILON));
    }

    /// @return the bin index nearest to `angle`, clamped to `[0, count - 1]`
    public int indexOf(double angle) {
        long index = Math.round((angle - start) / spacing);
        return (int) Math.max(0, Math.min(count() - 1, index));
    }

    /// @return the nominal angle of bin `index`
    public double angleOf(int index) {
        return start + index * spacing;
    }

    /// @return total angular span in degrees
    public double span() {
        return end - start;
    }
}
