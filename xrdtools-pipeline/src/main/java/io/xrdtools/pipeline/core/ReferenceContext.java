package io.xrdtools.pipeline.core;

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

import io.xrdtools.dataset.ReferenceTables;
import io.xrdtools.pipeline.cache.CacheKey;
import io.xrdtools.refine.BackgroundPeak;
import io.xrdtools.refine.PeakParameters;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/// What the calibration pass hands to every sample frame: baseline tables and background template.
public record ReferenceContext(ReferenceTables tables, BackgroundTemplate background) {

    public static final ReferenceContext EMPTY = new ReferenceContext(ReferenceTables.empty(), BackgroundTemplate.EMPTY);

    /// Reference peak parameters for a (peak, azimuth) cell, when all four are finite.
    public Optional<PeakParameters> seedFor(int peak, int azimuth) {
        if (!tables.has(Measurements.POSITION) || !tables.has(Measurements.AREA)
            || !tables.has(Measurements.SIGMA) || !tables.has(Measurements.GAMMA)) {
            return Optional.empty();
        }
        PeakParameters seed = new PeakParameters(
            tables.value(Measurements.POSITION, peak, azimuth),
            tables.value(Measurements.AREA, peak, azimuth),
            tables.value(Measurements.SIGMA, peak, azimuth),
            tables.value(Measurements.GAMMA, peak, azimuth));
        return seed.isFinite() ? Optional.of(seed) : Optional.empty();
    }

    public boolean isEmpty() {
        return tables.isEmpty() && background.isEmpty();
    }

    /// SHA-256 over every table cell and template peak, or `CacheKey.NO_CONTEXT` when empty.
    ///
    /// Sample results are only reusable under an identical fingerprint.
    public String fingerprint() {
        if (isEmpty()) {
            return CacheKey.NO_CONTEXT;
        }
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES * 4);
        for (String name : tables.names()) {
            digest.update(name.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            for (int p = 0; p < tables.peaks(); p++) {
                for (int a = 0; a < tables.azimuths(); a++) {
                    buffer.clear();
                    buffer.putFloat(tables.value(name, p, a));
                    digest.update(buffer.array(), 0, Float.BYTES);
                }
            }
        }
        for (int a = 0; a < background.azimuths(); a++) {
            for (BackgroundPeak peak : background.peaksFor(a)) {
                buffer.clear();
                buffer.putDouble(peak.position()).putDouble(peak.intensity())
                    .putDouble(peak.sigma()).putDouble(peak.gamma());
                digest.update(buffer.array());
            }
            digest.update((byte) '|');
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
