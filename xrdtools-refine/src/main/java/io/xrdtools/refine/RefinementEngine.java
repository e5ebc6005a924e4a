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

/// The external curve-refinement routine.
///
/// Each call performs one local optimisation of the slice with the parameters allowed by
/// `step` free and everything else held fixed, and returns the updated parameters. Engines must
/// not change the number of peaks or background peaks. Implementations must be safe to call
/// from several threads on different slices at once.
public interface RefinementEngine {

    /// Establishes the background model for a slice before any peak refinement.
    /// The default keeps the seeded parameters as they are.
    default ParameterSnapshot seedBackground(AzimuthalSlice slice, ParameterSnapshot seed, AnalysisWindow window)
        throws RefinementException {
        return seed;
    }

    ParameterSnapshot refine(AzimuthalSlice slice, ParameterSnapshot current, RefinementStep step,
                             AnalysisWindow window) throws RefinementException;
}
