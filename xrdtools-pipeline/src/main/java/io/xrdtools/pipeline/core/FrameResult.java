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

import io.xrdtools.pipeline.cache.CacheKey;
import io.xrdtools.pipeline.exceptions.CacheCorruptionException;

import java.util.List;

/// Refined parameters of every slice of one frame, in azimuth-bin order. This is the cached value.
public record FrameResult(int frameNumber, List<SliceFit> slices) {

    public FrameResult {
        slices = List.copyOf(slices);
    }

    /// @throws CacheCorruptionException if this result does not have the given shape
    public void checkShape(CacheKey key, int peaks, int azimuths, int backgroundPeaks) {
        if (slices.size() != azimuths) {
            throw new CacheCorruptionException(key.toString(),
                "expected " + azimuths + " slices but found " + slices.size());
        }
        for (int a = 0; a < slices.size(); a++) {
            SliceFit slice = slices.get(a);
            if (slice.azimuthIndex() != a || slice.peaks().size() != peaks
                || slice.background().size() != backgroundPeaks) {
                throw new CacheCorruptionException(key.toString(), "slice " + a + " has the wrong shape");
            }
        }
    }
}
