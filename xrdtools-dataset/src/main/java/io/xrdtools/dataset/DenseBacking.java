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

/// Mutable dense storage used while a dataset is open.
final class DenseBacking implements DatasetBacking {

    private final float[][][][] cells;
    private final int measurements;

    DenseBacking(int peaks, int frames, int azimuths, int measurements) {
        this.cells = new float[peaks][frames][azimuths][measurements];
        this.measurements = measurements;
    }

    void set(int peak, int frame, int azimuth, int measurement, float value) {
        cells[peak][frame][azimuth][measurement] = value;
    }

    @Override
    public float get(int peak, int frame, int azimuth, int measurement) {
        return cells[peak][frame][azimuth][measurement];
    }

    @Override
    public int measurementCount() {
        return measurements;
    }

    ChunkedBacking toChunked(ChunkDims dims) {
        return ChunkedBacking.build(cells.length, cells[0].length, cells[0][0].length, measurements, dims, this);
    }
}
