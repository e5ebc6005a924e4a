package io.xrdtools.pipeline.exceptions;

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

/// Thrown when a frame directory yields no usable frames, or frames out of order.
/// Fatal for the batch.
public class FrameDiscoveryException extends RuntimeException {

    private final Path directory;

    public FrameDiscoveryException(Path directory, String message) {
        super(String.format("Frame discovery failed for %s: %s", directory, message));
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
