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

/// States of the per-slice refinement state machine, in the order they are reached.
///
/// ```
/// INIT → BACKGROUND_SEEDED → [REFERENCE_REFINED] → [DYNAMIC_BACKGROUND_REFINED]
///      → INTENSITY_REFINED → POSITION_REFINED → SHAPE_REFINED → FULL_REFINED → DONE
/// ```
/// Any engine failure moves the machine to the terminal `FAILED` state.
public enum RefinementState {
    INIT,
    BACKGROUND_SEEDED,
    REFERENCE_REFINED,
    DYNAMIC_BACKGROUND_REFINED,
    INTENSITY_REFINED,
    POSITION_REFINED,
    SHAPE_REFINED,
    FULL_REFINED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /// A transition is legal from a non-terminal state to `FAILED`, or to any state not earlier
    /// than this one. Repeating a state covers multi-stage phases such as reference refinement.
    public boolean canTransitionTo(RefinementState next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() >= ordinal();
    }
}
