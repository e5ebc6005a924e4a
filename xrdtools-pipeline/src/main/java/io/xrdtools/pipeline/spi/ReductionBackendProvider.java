package io.xrdtools.pipeline.spi;

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

import io.xrdtools.pipeline.frames.SliceIntegrator;
import io.xrdtools.refine.RefinementEngine;

/// Supplies the detector-specific collaborators of a reduction: the image integrator and the
/// curve-refinement engine.
///
/// Implementations are discovered with [java.util.ServiceLoader] through
/// `META-INF/services/io.xrdtools.pipeline.spi.ReductionBackendProvider`.
public interface ReductionBackendProvider {

    /// Name used to select this backend on the command line.
    String name();

    SliceIntegrator integrator();

    RefinementEngine engine();
}
