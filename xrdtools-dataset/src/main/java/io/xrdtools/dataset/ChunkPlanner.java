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

/// Computes storage chunk dimensions for a dataset from a target byte budget.
///
/// ## Layout Rules
///
/// - The peak axis is always chunked at 1, since peaks are read and written independently.
/// - The measurement axis always spans every column, so primary and derived values of a
///   single peak sit in the same chunk.
/// - The remaining element budget is shared between the frame and azimuth axes:
///   ```
///   remaining = (targetBytes / itemSize) / measurements
///   ```
///   If the whole frame × azimuth plane fits, it is used whole. Otherwise the plane is split
///   by its aspect ratio, taking the frame axis first when frames ≥ azimuths and the azimuth
///   axis first otherwise.
///
/// Every returned extent lies in `[1, axisExtent]`; an axis of extent 0 gets a chunk size of 1,
/// and an azimuth extent of 0 is treated as an aspect ratio of 1.
///
/// ## Usage
///
/// ```java
/// ChunkDims dims = ChunkPlanner.plan(1, 1000, 72, 10, ChunkPlanner.DEFAULT_TARGET_BYTES);
/// // (1, 1000, 72, 10)
/// ```
public final class ChunkPlanner {

    /// Default chunk budget of 100 MiB.
    public static final long DEFAULT_TARGET_BYTES = 100L * 1024 * 1024;

    /// Bytes per stored element (32-bit floats).
    public static final int DEFAULT_ITEM_SIZE = Float.BYTES;

    /// Fraction of the square-root split given to the leading axis before aspect scaling.
    static final double LEADING_AXIS_SHARE = 0.7;

    private ChunkPlanner() {
    }

    /// Plans chunk dimensions for 4-byte elements.
    ///
    /// @throws IllegalArgumentException if an extent is negative or the budget is not positive
    public static ChunkDims plan(int peaks, int frames, int azimuths, int measurements, long targetBytes) {
        return plan(peaks, frames, azimuths, measurements, targetBytes, DEFAULT_ITEM_SIZE);
    }

    /// Plans chunk dimensions for elements of `itemSize` bytes.
    ///
    /// @throws IllegalArgumentException if an extent is negative, or the budget or item size is not positive
    public static ChunkDims plan(int peaks, int frames, int azimuths, int measurements,
                                 long targetBytes, int itemSize) {
        if (peaks < 0 || frames < 0 || azimuths < 0 || measurements < 0) {
            throw new IllegalArgumentException(String.format(
                "axis extents must be non-negative: (%d, %d, %d, %d)", peaks, frames, azimuths, measurements));
        }
        if (targetBytes <= 0) {
            throw new IllegalArgumentException("targetBytes must be positive: " + targetBytes);
        }
        if (itemSize <= 0) {
            throw new IllegalArgumentException("itemSize must be positive: " + itemSize);
        }

        int measurementChunk = Math.max(1, measurements);
        long targetElements = Math.max(1, targetBytes / itemSize);
        long remaining = Math.max(1, targetElements / measurementChunk);

        int frameExtent = Math.max(1, frames);
        int azimuthExtent = Math.max(1, azimuths);

        if ((long) frameExtent * azimuthExtent <= remaining) {
            return new ChunkDims(1, frameExtent, azimuthExtent, measurementChunk);
        }

        double aspect = azimuths == 0 ? 1.0 : (double) frames / azimuths;
        double base = Math.sqrt(remaining * LEADING_AXIS_SHARE);

        int frameChunk;
        int azimuthChunk;
        if (aspect >= 1.0) {
            frameChunk = clamp((long) (base * aspect), Math.min(frameExtent, remaining));
            azimuthChunk = clamp(remaining / frameChunk, azimuthExtent);
        } else {
            azimuthChunk = clamp((long) (base / aspect), Math.min(azimuthExtent, remaining));
            frameChunk = clamp(remaining / azimuthChunk, frameExtent);
        }
        return new ChunkDims(1, frameChunk, azimuthChunk, measurementChunk);
    }

    private static int clamp(long value, long upper) {
        return (int) Math.max(1, Math.min(value, upper));
    }
}
