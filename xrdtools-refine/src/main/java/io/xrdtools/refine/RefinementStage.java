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

/// A group of steps repeated as a pass until convergence or until the iteration budget runs out.
///
/// @param target state reached when the stage completes
/// @param steps steps run in order on every pass
/// @param minIterations passes with a 0-based index below this never count as converged
/// @param maxIterations maximum number of passes
public record RefinementStage(RefinementState target, List<RefinementStep> steps,
                              int minIterations, int maxIterations) {

    public RefinementStage {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("a stage needs at least one step");
        }
        if (minIterations < 0 || maxIterations < 1 || minIterations > maxIterations) {
            throw new IllegalArgumentException(String.format(
                "invalid iteration bounds for %s: min=%d, max=%d", target, minIterations, maxIterations));
        }
        if (target == null || target.isTerminal() || target.ordinal() <= RefinementState.BACKGROUND_SEEDED.ordinal()) {
            throw new IllegalArgumentException("stage target must be a refinement state, got " + target);
        }
        steps = List.copyOf(steps);
    }
}
