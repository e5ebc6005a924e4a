package io.xrdtools.pipeline.cache;

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

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/// Fingerprint of one frame computation.
///
/// Covers the frame's file and index, the sample, the full processing-parameter signature,
/// whether the frame is refined as a reference and the reference context seeding it, so neither
/// a parameter change nor a different calibration ever reuses a stale result.
///
/// @param fingerprint lowercase hex SHA-256 digest
public record CacheKey(String fingerprint) {

    public enum Role {
        REFERENCE,
        SAMPLE
    }

    /// Context fingerprint of a frame refined without reference tables or background template.
    public static final String NO_CONTEXT = "none";

    public static CacheKey of(Path file, String sample, int frameIndex, String signature, Role role) {
        return of(file, sample, frameIndex, signature, role, NO_CONTEXT);
    }

    public static CacheKey of(Path file, String sample, int frameIndex, String signature, Role role,
                              String context) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            update(digest, file.toAbsolutePath().normalize().toString());
            update(digest, sample);
            update(digest, Integer.toString(frameIndex));
            update(digest, signature);
            update(digest, role.name());
            update(digest, context);
            return new CacheKey(HexFormat.of().formatHex(digest.digest()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static void update(MessageDigest digest, String part) {
        byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
        // length prefix keeps ("ab","c") and ("a","bc") apart
        digest.update((byte) (bytes.length >>> 24));
        digest.update((byte) (bytes.length >>> 16));
        digest.update((byte) (bytes.length >>> 8));
        digest.update((byte) bytes.length);
        digest.update(bytes);
    }

    @Override
    public String toString() {
        return fingerprint.substring(0, Math.min(12, fingerprint.length()));
    }
}
