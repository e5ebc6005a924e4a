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

import java.util.Arrays;
import java.util.Objects;

/// Immutable chunked storage used once a dataset is sealed.
///
/// Chunks are addressed by their position in the (peak, frame, azimuth) chunk grid; each chunk
/// holds every measurement column. Edge chunks are truncated to the axis extent. Appending a
/// column produces a new instance laid out against a freshly planned chunk shape.
final class ChunkedBacking implements DatasetBacking {

    private final int peaks;
    private final int frames;
    private final int azimuths;
    private final int measurements;
    private final ChunkDims dims;
    private final int[] grid;
    private final float[][][][][] chunks;

    private ChunkedBacking(int peaks, int frames, int azimuths, int measurements,
                           ChunkDims dims, float[][][][][] chunks) {
        this.peaks = peaks;
        this.frames = frames;
        this.azimuths = azimuths;
        this.measurements = measurements;
        this.dims = dims;
        this.grid = dims.grid(peaks, frames, azimuths);
        this.chunks = chunks;
    }

    static ChunkedBacking build(int peaks, int frames, int azimuths, int measurements,
                                ChunkDims dims, CellSource source) {
        int[] grid = dims.grid(peaks, frames, azimuths);
        float[][][][][] chunks = new float[grid[0] * grid[1] * grid[2]][][][][];
        for (int cp = 0; cp < grid[0]; cp++) {
            for (int cf = 0; cf < grid[1]; cf++) {
                for (int ca = 0; ca < grid[2]; ca++) {
                    int p0 = cp * dims.peak();
                    int f0 = cf * dims.frame();
                    int a0 = ca * dims.azimuth();
                    int ep = Math.min(dims.peak(), peaks - p0);
                    int ef = Math.min(dims.frame(), frames - f0);
                    int ea = Math.min(dims.azimuth(), azimuths - a0);
                    float[][][][] chunk = new float[ep][ef][ea][measurements];
                    for (int p = 0; p < ep; p++) {
                        for (int f = 0; f < ef; f++) {
                            for (int a = 0; a < ea; a++) {
                                for (int m = 0; m < measurements; m++) {
                                    chunk[p][f][a][m] = source.get(p0 + p, f0 + f, a0 + a, m);
                                }
                            }
                        }
                    }
                    chunks[(cp * grid[1] + cf) * grid[2] + ca] = chunk;
                }
            }
        }
        return new ChunkedBacking(peaks, frames, azimuths, measurements, dims, chunks);
    }

    /// Reassembles a backing from chunks in grid order, validating each chunk's extents.
    static ChunkedBacking fromChunks(int peaks, int frames, int azimuths, int measurements,
                                     ChunkDims dims, float[][][][][] chunks) {
        int[] grid = dims.grid(peaks, frames, azimuths);
        if (chunks.length != grid[0] * grid[1] * grid[2]) {
            throw new IllegalArgumentException("expected " + (grid[0] * grid[1] * grid[2])
                + " chunks for grid " + Arrays.toString(grid) + " but got " + chunks.length);
        }
        for (int cp = 0; cp < grid[0]; cp++) {
            for (int cf = 0; cf < grid[1]; cf++) {
                for (int ca = 0; ca < grid[2]; ca++) {
                    float[][][][] chunk = chunks[(cp * grid[1] + cf) * grid[2] + ca];
                    int ep = Math.min(dims.peak(), peaks - cp * dims.peak());
                    int ef = Math.min(dims.frame(), frames - cf * dims.frame());
                    int ea = Math.min(dims.azimuth(), azimuths - ca * dims.azimuth());
                    if (chunk.length != ep || chunk[0].length != ef || chunk[0][0].length != ea
                        || chunk[0][0][0].length != measurements) {
                        throw new IllegalArgumentException("chunk " + cp + "," + cf + "," + ca
                            + " does not match the planned extents (" + ep + ", " + ef + ", " + ea + ", "
                            + measurements + ")");
                    }
                }
            }
        }
        return new ChunkedBacking(peaks, frames, azimuths, measurements, dims, chunks);
    }

    ChunkedBacking appendColumn(float[][][] column, ChunkDims newDims) {
        int existing = measurements;
        return build(peaks, frames, azimuths, measurements + 1, newDims,
            (p, f, a, m) -> m < existing ? get(p, f, a, m) : column[p][f][a]);
    }

    @Override
    public float get(int peak, int frame, int azimuth, int measurement) {
        int cp = peak / dims.peak();
        int cf = frame / dims.frame();
        int ca = azimuth / dims.azimuth();
        float[][][][] chunk = chunks[(cp * grid[1] + cf) * grid[2] + ca];
        return chunk[peak % dims.peak()][frame % dims.frame()][azimuth % dims.azimuth()][measurement];
    }

    @Override
    public int measurementCount() {
        return measurements;
    }

    ChunkDims dims() {
        return dims;
    }

    int[] grid() {
        return grid.clone();
    }

    float[][][][] chunkCopy(int cp, int cf, int ca) {
        Objects.checkIndex(cp, grid[0]);
        Objects.checkIndex(cf, grid[1]);
        Objects.checkIndex(ca, grid[2]);
        float[][][][] chunk = chunks[(cp * grid[1] + cf) * grid[2] + ca];
        float[][][][] copy = new float[chunk.length][][][];
        for (int p = 0; p < chunk.length; p++) {
            copy[p] = new float[chunk[p].length][][];
            for (int f = 0; f < chunk[p].length; f++) {
                copy[p][f] = new float[chunk[p][f].length][];
                for (int a = 0; a < chunk[p][f].length; a++) {
                    copy[p][f][a] = chunk[p][f][a].clone();
                }
            }
        }
        return copy;
    }
}
