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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Everything needed to rebuild a sealed [DiffractionDataset] apart from its array content.
///
/// @param peaks peak axis extent
/// @param frames frame axis extent
/// @param azimuths azimuth axis extent
/// @param measurementNames column names in column order
/// @param grid azimuthal binning
/// @param targetBytes chunk byte budget used when planning
/// @param chunkDims chunk shape of the stored arrays
/// @param peakLabels display label per peak
/// @param attributes free-form string metadata
public record DatasetDescriptor(
    int peaks,
    int frames,
    int azimuths,
    List<String> measurementNames,
    AzimuthGrid grid,
    long targetBytes,
    ChunkDims chunkDims,
    List<String> peakLabels,
    Map<String, String> attributes
) {
    public DatasetDescriptor {
        measurementNames = List.copyOf(measurementNames);
        peakLabels = List.copyOf(peakLabels);
        attributes = Collections.unmodifiableMap(new TreeMap<>(attributes));
    }
}
