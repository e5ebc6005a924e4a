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

import io.xrdtools.refine.BackgroundPeak;
import io.xrdtools.refine.PeakParameters;

import java.util.List;

/// Final parameters of one azimuthal slice of one frame.
public record SliceFit(int azimuthIndex, double azimuth, List<PeakParameters> peaks,
                       List<BackgroundPeak> background) {

    public SliceFit {
        peaks = List.copyOf(peaks);
        background = List.copyOf(background);
    }
}
