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

import java.nio.file.Path;
import java.util.Map;

/// One discovered frame.
///
/// @param file image file holding the frame
/// @param globalIndex index across every file of the directory, strictly increasing in discovery order
/// @param frameInFile position of the frame inside `file`
/// @param multiFrame whether `file` holds several frames
/// @param metadata free-form facts gathered during discovery
public record FrameDescriptor(Path file, int globalIndex, int frameInFile, boolean multiFrame,
                              Map<String, String> metadata) {

    public FrameDescriptor {
        metadata = Map.copyOf(metadata);
    }

    public static FrameDescriptor single(Path file, int globalIndex) {
        return new FrameDescriptor(file, globalIndex, 0, false, Map.of());
    }
}
