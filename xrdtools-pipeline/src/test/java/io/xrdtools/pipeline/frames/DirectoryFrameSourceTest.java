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

import io.xrdtools.pipeline.exceptions.FrameDiscoveryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DirectoryFrameSource")
class DirectoryFrameSourceTest {

    @TempDir
    Path dir;

    /// a.tif (1), b.edf (3), c/d.tif (1), notes.txt (ignored), e.edf.ge2 (2)
    private void layout() throws IOException {
        Files.createFile(dir.resolve("a.tif"));
        Files.createFile(dir.resolve("b.edf"));
        Files.createDirectories(dir.resolve("c"));
        Files.createFile(dir.resolve("c/d.tif"));
        Files.createFile(dir.resolve("notes.txt"));
        Files.createFile(dir.resolve("e.edf.ge2"));
    }

    private final FrameCounter counter = file -> file.getFileName().toString().endsWith(".ge2") ? 2 : 3;

    @Test
    @DisplayName("should number frames globally across single and multi-frame files in path order")
    void shouldNumberFramesGlobally() throws IOException {
        layout();

        List<FrameDescriptor> frames = new DirectoryFrameSource(counter).discover(dir, FrameRange.ALL);

        assertThat(frames).extracting(FrameDescriptor::globalIndex).containsExactly(0, 1, 2, 3, 4, 5, 6);
        assertThat(frames).extracting(f -> f.file().getFileName().toString())
            .containsExactly("a.tif", "b.edf", "b.edf", "b.edf", "d.tif", "e.edf.ge2", "e.edf.ge2");
        assertThat(frames.get(2).frameInFile()).isEqualTo(1);
        assertThat(frames.get(2).multiFrame()).isTrue();
        assertThat(frames.get(4).multiFrame()).isFalse();
    }

    @Test
    @DisplayName("should honour start, end and step across file boundaries")
    void shouldApplyRange() throws IOException {
        layout();

        List<FrameDescriptor> frames = new DirectoryFrameSource(counter).discover(dir, new FrameRange(1, 6, 2));

        assertThat(frames).extracting(FrameDescriptor::globalIndex).containsExactly(1, 3, 5);
        assertThat(frames).extracting(FrameDescriptor::frameInFile).containsExactly(0, 2, 0);
    }

    @Test
    @DisplayName("should skip a multi-frame file it cannot count")
    void shouldSkipUnreadableFiles() throws IOException {
        layout();
        FrameCounter failing = file -> {
            if (file.getFileName().toString().equals("b.edf")) {
                throw new IOException("truncated");
            }
            return 2;
        };

        List<FrameDescriptor> frames = new DirectoryFrameSource(failing).discover(dir, FrameRange.ALL);

        assertThat(frames).extracting(f -> f.file().getFileName().toString())
            .containsExactly("a.tif", "d.tif", "e.edf.ge2", "e.edf.ge2");
        assertThat(frames).extracting(FrameDescriptor::globalIndex).containsExactly(0, 1, 2, 3);
    }

    @Test
    @DisplayName("should fail for a missing directory")
    void shouldFailForMissingDirectory() {
        assertThatThrownBy(() -> new DirectoryFrameSource().discover(dir.resolve("absent"), FrameRange.ALL))
            .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("should reject frame sequences that do not strictly increase")
    void shouldRejectNonIncreasingFrames() {
        List<FrameDescriptor> frames = List.of(
            FrameDescriptor.single(dir.resolve("a.tif"), 4),
            FrameDescriptor.single(dir.resolve("b.tif"), 4));

        assertThatThrownBy(() -> FrameSource.requireStrictlyIncreasing(dir, frames))
            .isInstanceOf(FrameDiscoveryException.class)
            .hasMessageContaining("does not follow 4");
    }

    @Nested
    @DisplayName("DetectorFrameCounter")
    class Counting {

        private byte[] edfFrame(int dataBytes) {
            String header = "{\nHeaderID = EH:000001:000000:000000 ;\nSize = " + dataBytes + " ;\n"
                + "Dim_1 = 4 ;\n}\n";
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.writeBytes(header.getBytes(StandardCharsets.ISO_8859_1));
            out.writeBytes(new byte[dataBytes]);
            return out.toByteArray();
        }

        @Test
        @DisplayName("should count EDF frames by walking their headers")
        void shouldCountEdfFrames() throws IOException {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.writeBytes(edfFrame(64));
            out.writeBytes(edfFrame(64));
            out.writeBytes(edfFrame(128));
            Path file = dir.resolve("scan.edf");
            Files.write(file, out.toByteArray());

            assertThat(new DetectorFrameCounter().countFrames(file)).isEqualTo(3);
        }

        @Test
        @DisplayName("should fail on a truncated EDF data block")
        void shouldFailOnTruncatedEdf() throws IOException {
            byte[] frame = edfFrame(64);
            Path file = dir.resolve("short.edf");
            Files.write(file, Arrays.copyOf(frame, frame.length - 10));

            assertThatThrownBy(() -> new DetectorFrameCounter().countFrames(file)).isInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should count GE frames from the file size")
        void shouldCountGeFrames() throws IOException {
            Path file = dir.resolve("scan.edf.ge5");
            long size = DetectorFrameCounter.GE_HEADER_BYTES + 2 * DetectorFrameCounter.GE_FRAME_BYTES;
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                channel.write(ByteBuffer.wrap(new byte[1]), size - 1);
            }

            assertThat(new DetectorFrameCounter().countFrames(file)).isEqualTo(2);
        }
    }
}
