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

/// What happened during one stage of a slice refinement.
///
/// @param state state the stage targeted
/// @param passes passes executed
/// @param converged whether the stage stopped early on convergence
/// @param corrections parameter resets applied across all passes
/// @param finalChange relative change measured on the last pass
public record StageReport(RefinementState state, int passes, boolean converged, int corrections, double finalChange) {
}
