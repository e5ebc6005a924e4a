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

/// Outcome of one refinement step, branched on explicitly by the controller.
public interface StepResult {

    /// The engine produced new parameters.
    record Updated(ParameterSnapshot snapshot) implements StepResult {
    }

    /// The engine could not refine the slice.
    record Failure(String step, String reason, Throwable cause) implements StepResult {
    }

    static StepResult attempt(RefinementEngine engine, AzimuthalSlice slice, ParameterSnapshot current,
                              RefinementStep step, AnalysisWindow window) {
        try {
            ParameterSnapshot next = engine.refine(slice, current, step, window);
            if (next == null) {
                return new Failure(step.label(), "engine returned no parameters", null);
            }
            if (!next.hasSameShapeAs(current)) {
                return new Failure(step.label(), "engine changed the number of peaks", null);
            }
            return new Updated(next);
        } catch (RefinementException | RuntimeException e) {
            return new Failure(step.label(), String.valueOf(e.getMessage()), e);
        }
    }
}
