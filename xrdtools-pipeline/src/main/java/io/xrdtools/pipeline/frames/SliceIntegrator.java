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

import io.xrdtools.dataset.AzimuthGrid;
import io.xrdtools.refine.AnalysisWindow;
import io.xrdtools.refine.AzimuthalSlice;

import java.io.IOException;
import java.util.List;

/// Decodes a frame and integrates it into one 2θ histogram per azimuth bin.
///
/// Implementations must be safe to call from several threads on different frames at once.
public interface SliceIntegrator {

    /// @return one slice per bin of `grid`, in bin order
    List<AzimuthalSlice> integrate(FrameDescriptor frame, AzimuthGrid grid, AnalysisWindow window) throws IOException;
}
