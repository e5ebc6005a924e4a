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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Immutable per-(peak, azimuth) baseline values, one table per measurement name.
///
/// Produced by the reference calibration pass and consumed by strain and percent-change
/// calculations. All tables share the same `[peaks][azimuths]` shape.
public final class ReferenceTables {

    private static final ReferenceTables EMPTY = new ReferenceTables(0, 0, Map.of());

    private final int peaks;
    private final int azimuths;
    private final Map<String, float[][]> tables;

    private ReferenceTables(int peaks, int azimuths, Map<String, float[][]> tables) {
        this.peaks = peaks;
        this.azimuths = azimuths;
        this.tables = tables;
    }

    public static ReferenceTables empty() {
        return EMPTY;
    }

    /// Copies the given tables.
    ///
    /// @throws IllegalArgumentException if the tables are ragged or disagree in shape
    public static ReferenceTables of(Map<String, float[][]> source) {
        if (source.isEmpty()) {
            return EMPTY;
        }
        int peaks = -1;
        int azimuths = -1;
        Map<String, float[][]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, float[][]> entry : source.entrySet()) {
            float[][] table = entry.getValue();
            if (table.length == 0) {
                throw new IllegalArgumentException("reference table '" + entry.getKey() + "' has no peaks");
            }
            if (peaks < 0) {
                peaks = table.length;
                azimuths = table[0].length;
            }
            if (table.length != peaks) {
                throw new IllegalArgumentException("reference table '" + entry.getKey() + "' has "
                    + table.length + " peaks, expected " + peaks);
            }
            float[][] rows = new float[peaks][];
            for (int p = 0; p < peaks; p++) {
                if (table[p].length != azimuths) {
                    throw new IllegalArgumentException("reference table '" + entry.getKey() + "' row " + p
                        + " has " + table[p].length + " azimuths, expected " + azimuths);
                }
                rows[p] = table[p].clone();
            }
            copy.put(entry.getKey(), rows);
        }
        return new ReferenceTables(peaks, azimuths, Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    public boolean has(String measurement) {
        return tables.containsKey(measurement);
    }

    public List<String> names() {
        return List.copyOf(tables.keySet());
    }

    public int peaks() {
        return peaks;
    }

    public int azimuths() {
        return azimuths;
    }

    /// @return a copy of the table for `measurement`
    /// @throws IllegalArgumentException if no such table exists
    public float[][] table(String measurement) {
        float[][] table = require(measurement);
        float[][] copy = new float[table.length][];
        for (int p = 0; p < table.length; p++) {
            copy[p] = table[p].clone();
        }
        return copy;
    }

    public float value(String measurement, int peak, int azimuth) {
        return require(measurement)[peak][azimuth];
    }

    private float[][] require(String measurement) {
        float[][] table = tables.get(measurement);
        if (table == null) {
            throw new IllegalArgumentException("no reference table for '" + measurement + "', available: "
                + tables.keySet());
        }
        return table;
    }
}
