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

/// One frame left out of a reduction.
///
/// @param frameNumber global frame index
/// @param file image file, as a path string
/// @param role `reference` or `sample`
/// @param reason first failure reported for the frame
public record FrameFailure(int frameNumber, String file, String role, String reason) {
}
