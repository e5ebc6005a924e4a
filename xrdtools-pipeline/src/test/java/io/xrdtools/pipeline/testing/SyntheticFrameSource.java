package io.xrdtools.pipeline.testing;

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

import io.xrdtools.pipeline.frames.FrameDescriptor;
import io.xrdtools.pipeline.frames.FrameRange;
import io.xrdtools.pipeline.frames.FrameSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/// In-memory directories of single-frame files named `frame_00000.tif` upwards.
public class SyntheticFrameSource implements FrameSource {

    private final Map<Path, Integer> directories = new HashMap<>();

    public SyntheticFrameSource with(Path directory, int frames) {
        directories.put(directory, frames);
        return this;
    }

    @Override
    public List<FrameDescriptor> discover(Path directory, FrameRange range) throws IOException {
        Integer count = directories.get(directory);
        if (count == null) {
            throw new IOException("not a directory: " + directory);
        }
        List<FrameDescriptor> frames = new ArrayList<>();
        for (int i = 0; i < count && !range.isPastEnd(i); i++) {
            if (range.selects(i)) {
                frames.add(FrameDescriptor.single(directory.resolve(String.format("frame_%05d.tif", i)), i));
            }
        }
        return frames;
    }
}
