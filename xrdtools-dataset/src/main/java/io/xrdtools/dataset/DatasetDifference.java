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

import io.xrdtools.dataset.exceptions.ShapeMismatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/// Frame-aligned differences between two datasets of the same shape, for example the same
/// sample measured before and after a treatment.
public final class DatasetDifference {

    private static final Logger logger = LogManager.getLogger(DatasetDifference.class);

    public static final String DIFF_PREFIX = "diff ";
    /// Stage recorded on every difference dataset.
    public static final String DIFFERENCE_STAGE = "DELT";

    private DatasetDifference() {
    }

    /// Copies `after` and appends `diff {m}` = after − before for every named measurement that both
    /// datasets carry. The copy's stage attribute becomes [#DIFFERENCE_STAGE].
    ///
    /// A positive `shift` moves `after` forward by that many frames before subtracting; a negative
    /// shift moves `before` forward by `|shift|`. Frames vacated by the shift are NaN.
    ///
    /// @throws ShapeMismatchException if the (peak, frame, azimuth) shapes differ
    public static DiffractionDataset subtract(DiffractionDataset before, DiffractionDataset after,
                                              List<String> measurements, int shift) {
        int[] beforeShape = {before.peaks(), before.frames(), before.azimuths()};
        int[] afterShape = {after.peaks(), after.frames(), after.azimuths()};
        if (beforeShape[0] != afterShape[0] || beforeShape[1] != afterShape[1] || beforeShape[2] != afterShape[2]) {
            throw new ShapeMismatchException("before/after", beforeShape, afterShape);
        }
        before.seal();
        DiffractionDataset result = after.copy();
        result.putAttribute(DiffractionDataset.STAGE_ATTRIBUTE, DIFFERENCE_STAGE);
        for (String measurement : measurements) {
            if (!before.hasMeasurement(measurement) || !after.hasMeasurement(measurement)) {
                logger.warn("skipping '{}': not present in both datasets", measurement);
                continue;
            }
            float[][][] b = before.measurement(measurement);
            float[][][] a = after.measurement(measurement);
            if (shift > 0) {
                a = shiftFrames(a, shift);
            } else if (shift < 0) {
                b = shiftFrames(b, -shift);
            }
            float[][][] diff = new float[a.length][][];
            for (int p = 0; p < a.length; p++) {
                diff[p] = new float[a[p].length][];
                for (int f = 0; f < a[p].length; f++) {
                    diff[p][f] = new float[a[p][f].length];
                    for (int z = 0; z < a[p][f].length; z++) {
                        diff[p][f][z] = a[p][f][z] - b[p][f][z];
                    }
                }
            }
            result.addMeasurement(DIFF_PREFIX + measurement, diff);
        }
        return result;
    }

    static float[][][] shiftFrames(float[][][] values, int shift) {
        float[][][] shifted = new float[values.length][][];
        for (int p = 0; p < values.length; p++) {
            int frames = values[p].length;
            shifted[p] = new float[frames][];
            for (int f = 0; f < frames; f++) {
                int source = f - shift;
                if (source >= 0) {
                    shifted[p][f] = values[p][source].clone();
                } else {
                    shifted[p][f] = new float[values[p][f].length];
                    Arrays.fill(shifted[p][f], Float.NaN);
                }
            }
        }
        return shifted;
    }
}
