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

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Frame counts from file layout alone, without decoding pixels.
///
/// GE detector files (`.ge1` to `.ge5`) are an 8192-byte header followed by 2048×2048 16-bit
/// frames. EDF files are a sequence of `{...}` text headers, each followed by the number of
/// data bytes its `Size` key declares.
public class DetectorFrameCounter implements FrameCounter {

    static final int GE_HEADER_BYTES = 8192;
    static final long GE_FRAME_BYTES = 2048L * 2048L * 2L;

    private static final Pattern SIZE = Pattern.compile("(?m)^\\s*Size\\s*=\\s*(\\d+)\\s*;");
    private static final Pattern GE_SUFFIX = Pattern.compile(".*\\.ge[1-5]$");

    @Override
    public int countFrames(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (GE_SUFFIX.matcher(name).matches()) {
            long size = Files.size(file);
            if (size < GE_HEADER_BYTES) {
                throw new IOException("GE file " + file + " is shorter than its header");
            }
            return (int) ((size - GE_HEADER_BYTES) / GE_FRAME_BYTES);
        }
        return countEdfFrames(file);
    }

    private int countEdfFrames(Path file) throws IOException {
        int frames = 0;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            while (true) {
                int first = skipToHeader(in);
                if (first < 0) {
                    return frames;
                }
                String header = readHeader(in, file);
                Matcher m = SIZE.matcher(header);
                if (!m.find()) {
                    throw new IOException("EDF header " + frames + " in " + file + " has no Size key");
                }
                long remaining = Long.parseLong(m.group(1));
                while (remaining > 0) {
                    long skipped = in.skip(remaining);
                    if (skipped <= 0) {
                        if (in.read() < 0) {
                            throw new EOFException("EDF frame " + frames + " in " + file + " is truncated");
                        }
                        skipped = 1;
                    }
                    remaining -= skipped;
                }
                frames++;
            }
        }
    }

    /// Consumes padding up to and including the next `{`; returns -1 at end of stream.
    private static int skipToHeader(InputStream in) throws IOException {
        int b;
        while ((b = in.read()) >= 0) {
            if (b == '{') {
                return b;
            }
        }
        return -1;
    }

    private static String readHeader(InputStream in, Path file) throws IOException {
        ByteArrayOutputStream header = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) >= 0) {
            if (b == '}') {
                // the closing brace is followed by a newline before the data block
                int next = in.read();
                if (next >= 0 && next != '\n') {
                    throw new IOException("EDF header in " + file + " is not terminated by a newline");
                }
                return header.toString(StandardCharsets.ISO_8859_1);
            }
            header.write(b);
        }
        throw new EOFException("EDF header in " + file + " is not closed");
    }
}
