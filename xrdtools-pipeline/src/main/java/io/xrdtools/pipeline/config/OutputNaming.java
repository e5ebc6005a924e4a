package io.xrdtools.pipeline.config;

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

import com.google.gson.Gson;
import io.xrdtools.dataset.AzimuthGrid;
import io.xrdtools.pipeline.frames.FrameRange;
import io.xrdtools.refine.AnalysisWindow;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/// Names of reduction outputs derived from their parameters.
public final class OutputNaming {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmss", Locale.ROOT);
    private static final int ID_LENGTH = 8;

    private OutputNaming() {
    }

    /// Where a reduction saved at `time` goes: `{root}/{date}/{sample}/{directory name}`.
    ///
    /// Two samples reduced with equal parameters in the same second still get distinct paths.
    public static Path datasetDirectory(Path root, ProcessingParameters params, LocalDateTime time) {
        return root.resolve(DATE.format(time))
            .resolve(pathSegment(params.sample()))
            .resolve(datasetDirectoryName(params, time.toLocalTime()));
    }

    /// `value` with every character outside `[A-Za-z0-9._-]` replaced by `_`.
    static String pathSegment(String value) {
        String segment = value.replaceAll("[^A-Za-z0-9._-]", "_");
        if (segment.isEmpty() || segment.chars().allMatch(c -> c == '.')) {
            return "_" + segment;
        }
        return segment;
    }

    /// Directory name describing the azimuth coverage, frame range, 2θ window, peak counts and
    /// creation time, e.g. `360deg-72bins-0sf-allfr-5.5l2t_6.5u2t-1peaks-0bkg-142501`.
    public static String datasetDirectoryName(ProcessingParameters params, LocalTime time) {
        AzimuthGrid grid = params.azimuths();
        FrameRange frames = params.frames();
        AnalysisWindow window = params.analysisWindow();
        String end = frames.end() == FrameRange.ALL_FRAMES ? "allfr" : frames.end() + "efr";
        return String.format(Locale.ROOT, "%sdeg-%dbins-%dsf-%s-%.1fl2t_%.1fu2t-%dpeaks-%dbkg-%s",
            ProcessingParameters.number(grid.span()), grid.count(), frames.start(), end,
            window.lower(), window.upper(), params.peakCount(), params.backgroundCandidates().size(),
            TIME.format(time));
    }

    /// Short stable identifier: the first 8 hex digits of the MD5 of the sorted parameter map.
    public static String datasetId(ProcessingParameters params) {
        SortedMap<String, String> map = new TreeMap<>(params.signatureParameters());
        map.put("sample", params.sample());
        map.put("setting", params.setting());
        map.put("stage", params.stage().name());
        map.put("frame_start", Integer.toString(params.frames().start()));
        map.put("frame_end", Integer.toString(params.frames().end()));
        map.put("step", Integer.toString(params.frames().step()));
        String json = new Gson().toJson(map);
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(json.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
