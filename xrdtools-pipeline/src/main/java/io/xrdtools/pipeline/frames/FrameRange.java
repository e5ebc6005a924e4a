package io.xrdtools.pipeline.frames;

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

/// Selection of global frame indices: every `step`-th frame from `start`, stopping before `end`.
///
/// @param start first selected global index
/// @param end exclusive upper bound, or `-1` for no bound
/// @param step selection stride
public record FrameRange(int start, int end, int step) {

    public static final int ALL_FRAMES = -1;
    public static final FrameRange ALL = new FrameRange(0, ALL_FRAMES, 1);

    public FrameRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative: " + start);
        }
        if (step < 1) {
            throw new IllegalArgumentException("step must be >= 1: " + step);
        }
        if (end != ALL_FRAMES && end < start) {
            throw new IllegalArgumentException("end must be -1 or >= start: " + start + " .. " + end);
        }
    }

    public boolean selects(int globalIndex) {
        return globalIndex >= start
            && (globalIndex - start) % step == 0
            && (end == ALL_FRAMES || globalIndex < end);
    }

    /// @return true once `globalIndex` is at or past a bounded end
    public boolean isPastEnd(int globalIndex) {
        return end != ALL_FRAMES && globalIndex >= end;
    }
}
