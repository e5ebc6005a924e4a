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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Finds diffraction images under a directory.
///
/// Files are visited recursively in lexicographic path order. TIFF files hold one frame; EDF and
/// GE files hold as many as the [FrameCounter] reports. A single global counter runs across all
/// files, so frame `n` is the `n`-th exposure of the whole directory.
public class DirectoryFrameSource implements FrameSource {

    private static final Logger logger = LogManager.getLogger(DirectoryFrameSource.class);

    private static final Pattern SINGLE_FRAME = Pattern.compile(".*\\.tiff?$");
    private static final Pattern MULTI_FRAME = Pattern.compile(".*\\.edf(\\.ge[1-5])?$");

    private final FrameCounter counter;

    public DirectoryFrameSource() {
        this(new DetectorFrameCounter());
    }

    public DirectoryFrameSource(FrameCounter counter) {
        this.counter = counter;
    }

    @Override
    public List<FrameDescriptor> discover(Path directory, FrameRange range) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                .filter(DirectoryFrameSource::isImage)
                .sorted()
                .collect(Collectors.toList());
        }

        List<FrameDescriptor> frames = new ArrayList<>();
        int global = 0;
        for (Path file : files) {
            if (range.isPastEnd(global)) {
                break;
            }
            if (isSingleFrame(file)) {
                if (range.selects(global)) {
                    frames.add(FrameDescriptor.single(file, global));
                }
                global++;
                continue;
            }
            int count;
            try {
                count = counter.countFrames(file);
            } catch (IOException e) {
                logger.warn("skipping unreadable multi-frame file {}: {}", file, e.getMessage());
                continue;
            }
            for (int i = 0; i < count; i++) {
                if (range.selects(global)) {
                    frames.add(new FrameDescriptor(file, global, i, true,
                        Map.of("frames_in_file", Integer.toString(count))));
                }
                global++;
            }
        }
        FrameSource.requireStrictlyIncreasing(directory, frames);
        logger.debug("discovered {} of {} frames in {} ({} files)", frames.size(), global, directory, files.size());
        return frames;
    }

    private static boolean isImage(Path file) {
        return isSingleFrame(file) || MULTI_FRAME.matcher(lowerName(file)).matches();
    }

    private static boolean isSingleFrame(Path file) {
        return SINGLE_FRAME.matcher(lowerName(file)).matches();
    }

    private static String lowerName(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT);
    }
}
