package io.xrdtools.dataset;

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

/// Per-axis chunk extents of the 4-D (peak, frame, azimuth, measurement) layout.
///
/// @param peak chunk extent along the peak axis
/// @param frame chunk extent along the frame axis
/// @param azimuth chunk extent along the azimuth axis
/// @param measurement chunk extent along the measurement axis
public record ChunkDims(int peak, int frame, int azimuth, int measurement) {

    public ChunkDims {
        if (peak < 1 || frame < 1 || azimuth < 1 || measurement < 1) {
            throw new IllegalArgumentException(String.format(
                "chunk dimensions must all be >= 1: (%d, %d, %d, %d)", peak, frame, azimuth, measurement));
        }
    }

    /// @return number of elements in one full chunk
    public long elements() {
        return (long) peak * frame * azimuth * measurement;
    }

    /// @param itemSize bytes per element
    /// @return bytes in one full chunk
    public long bytes(int itemSize) {
        return elements() * itemSize;
    }

    /// Number of chunks along each of the first three axes for the given extents.
    ///
    /// @return `{peakChunks, frameChunks, azimuthChunks}`
    public int[] grid(int peaks, int frames, int azimuths) {
        return new int[]{
            chunksAlong(peaks, peak),
            chunksAlong(frames, frame),
            chunksAlong(azimuths, azimuth)
        };
    }

    static int chunksAlong(int extent, int size) {
        return (extent + size - 1) / size;
    }

    @Override
    public String toString() {
        return "(" + peak + ", " + frame + ", " + azimuth + ", " + measurement + ")";
    }
}
