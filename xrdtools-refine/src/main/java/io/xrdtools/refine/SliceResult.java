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

import java.util.List;
import java.util.Optional;

/// Final outcome of refining one azimuthal slice.
///
/// @param sliceIndex azimuth bin index
/// @param azimuth integration angle in degrees
/// @param state `DONE` or `FAILED`
/// @param parameters last parameters reached, which for a failed slice are those before the failing step
/// @param stages one report per completed stage
/// @param engineCalls number of refinement engine invocations
/// @param failure failure description when `state` is `FAILED`, otherwise null
public record SliceResult(int sliceIndex, double azimuth, RefinementState state, ParameterSnapshot parameters,
                          List<StageReport> stages, int engineCalls, String failure) {

    public SliceResult {
        stages = List.copyOf(stages);
    }

    public boolean succeeded() {
        return state == RefinementState.DONE;
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failure);
    }
}
