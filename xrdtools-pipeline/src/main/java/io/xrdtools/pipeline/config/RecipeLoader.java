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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.xrdtools.dataset.AzimuthGrid;
import io.xrdtools.pipeline.exceptions.RecipeException;
import io.xrdtools.pipeline.frames.FrameRange;
import io.xrdtools.refine.AnalysisWindow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/// Reads a JSON processing recipe into [ProcessingParameters].
///
/// Relative `images_path` and `refs_path` values resolve against the directory holding the
/// recipe. Unknown keys are ignored.
public final class RecipeLoader {

    private static final Logger logger = LogManager.getLogger(RecipeLoader.class);

    /// Settings whose name carries the exposure code.
    private static final Set<String> EXPOSURE_SETTINGS = Set.of("Speed", "SpeedTall");

    private RecipeLoader() {
    }

    public static ProcessingParameters load(Path recipe) throws IOException {
        String json = Files.readString(recipe, StandardCharsets.UTF_8);
        Path base = recipe.toAbsolutePath().getParent();
        try {
            return parse(json, base);
        } catch (RecipeException e) {
            throw new RecipeException(recipe + ": " + e.getMessage(), e);
        }
    }

    /// Parses recipe text.
    ///
    /// @param json recipe content
    /// @param baseDir directory that relative paths resolve against
    /// @throws RecipeException if the JSON is malformed, a required field is missing, or a value is invalid
    public static ProcessingParameters parse(String json, Path baseDir) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new RecipeException("Recipe must be a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new RecipeException("Recipe is not valid JSON: " + e.getMessage(), e);
        }

        try {
            ProcessingParameters.Builder builder = ProcessingParameters.builder();
            String exposure = optionalString(root, "exposure", "019");
            builder.sample(requiredString(root, "sample"))
                .setting(settingName(requiredString(root, "setting"), exposure))
                .stage(Stage.parse(requiredString(root, "stage")))
                .exposure(exposure)
                .notes(optionalString(root, "notes", ""));

            String images = optionalString(root, "images_path", null);
            if (images == null) {
                images = optionalString(root, "image_folder", null);
                if (images != null) {
                    logger.debug("recipe uses legacy 'image_folder'");
                }
            }
            if (images == null || images.isBlank()) {
                throw RecipeException.missingField("images_path");
            }
            builder.imagesPath(resolve(baseDir, images));
            String refs = optionalString(root, "refs_path", "");
            if (!refs.isBlank()) {
                builder.refsPath(resolve(baseDir, refs));
            }

            JsonArray active = requiredArray(root, "active_peaks");
            for (JsonElement peak : active) {
                builder.activePeak(peakSpec(peak, "active_peaks"));
            }
            if (root.has("AVAILABLE_PEAKS") && !root.get("AVAILABLE_PEAKS").isJsonNull()) {
                JsonArray available = requiredArray(root, "AVAILABLE_PEAKS");
                for (int i = 0; i < available.size(); i++) {
                    JsonElement peak = available.get(i);
                    if (peak.isJsonPrimitive() && peak.getAsJsonPrimitive().isNumber()) {
                        builder.availablePeak(PeakSpec.positionOnly(i + 1, peak.getAsDouble()));
                    } else {
                        builder.availablePeak(peakSpec(peak, "AVAILABLE_PEAKS"));
                    }
                }
            }

            builder.azimuths(new AzimuthGrid(requiredDouble(root, "az_start"),
                requiredDouble(root, "az_end"), requiredDouble(root, "spacing")));
            builder.frames(new FrameRange(requiredInt(root, "frame_start"),
                optionalInt(root, "frame_end", FrameRange.ALL_FRAMES), optionalInt(root, "step", 1)));

            if (root.has("detector_params") && root.get("detector_params").isJsonObject()) {
                JsonObject detector = root.getAsJsonObject("detector_params");
                if (detector.has("wavelength")) {
                    builder.wavelength(requiredDouble(detector, "wavelength"));
                }
            }
            builder.options(options(root));
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            throw new RecipeException("Invalid recipe value: " + e.getMessage(), e);
        }
    }

    /// `Speed` and `SpeedTall` get the exposure code appended unless it is `1`.
    static String settingName(String setting, String exposure) {
        if (EXPOSURE_SETTINGS.contains(setting) && !"1".equals(exposure)) {
            return setting + exposure;
        }
        return setting;
    }

    private static ProcessingOptions options(JsonObject root) {
        ProcessingOptions defaults = ProcessingOptions.defaults();
        if (!root.has("processing") || !root.get("processing").isJsonObject()) {
            return defaults;
        }
        JsonObject p = root.getAsJsonObject("processing");
        long targetBytes = p.has("target_chunk_mb")
            ? Math.round(requiredDouble(p, "target_chunk_mb") * 1024 * 1024)
            : defaults.targetChunkBytes();
        return new ProcessingOptions(
            targetBytes,
            optionalInt(p, "workers", defaults.workers()),
            p.has("convergence_threshold") ? requiredDouble(p, "convergence_threshold") : defaults.convergenceThreshold(),
            p.has("dynamic_background") ? p.get("dynamic_background").getAsBoolean() : defaults.dynamicBackground(),
            optionalInt(p, "max_stage_iterations", defaults.maxStageIterations()));
    }

    private static PeakSpec peakSpec(JsonElement element, String field) {
        if (!element.isJsonObject()) {
            throw new RecipeException("Entries of '" + field + "' must be objects: " + element);
        }
        JsonObject peak = element.getAsJsonObject();
        double position = requiredDouble(peak, "position");
        String name = optionalString(peak, "name", "");
        String miller = optionalString(peak, "miller_index", "");
        AnalysisWindow limits;
        if (peak.has("limits")) {
            JsonArray bounds = requiredArray(peak, "limits");
            if (bounds.size() != 2) {
                throw new RecipeException("Peak limits must have two values: " + bounds);
            }
            limits = new AnalysisWindow(bounds.get(0).getAsDouble(), bounds.get(1).getAsDouble());
        } else {
            limits = new AnalysisWindow(position - PeakSpec.DEFAULT_HALF_WIDTH, position + PeakSpec.DEFAULT_HALF_WIDTH);
        }
        return new PeakSpec(name.isEmpty() ? miller : name, miller, position, limits);
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }

    private static JsonElement required(JsonObject object, String field) {
        JsonElement element = object.get(field);
        if (element == null || element.isJsonNull()) {
            throw RecipeException.missingField(field);
        }
        return element;
    }

    private static String requiredString(JsonObject object, String field) {
        return required(object, field).getAsString();
    }

    private static double requiredDouble(JsonObject object, String field) {
        return required(object, field).getAsDouble();
    }

    private static int requiredInt(JsonObject object, String field) {
        return required(object, field).getAsInt();
    }

    private static JsonArray requiredArray(JsonObject object, String field) {
        JsonElement element = required(object, field);
        if (!element.isJsonArray()) {
            throw new RecipeException("Recipe field '" + field + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private static String optionalString(JsonObject object, String field, String fallback) {
        JsonElement element = object.get(field);
        return element == null || element.isJsonNull() ? fallback : element.getAsString();
    }

    private static int optionalInt(JsonObject object, String field, int fallback) {
        JsonElement element = object.get(field);
        return element == null || element.isJsonNull() ? fallback : element.getAsInt();
    }
}
