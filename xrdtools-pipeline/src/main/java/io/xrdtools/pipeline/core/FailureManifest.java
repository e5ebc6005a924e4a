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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.xrdtools.dataset.io.DatasetGsonConfig;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// The frames a reduction had to drop, written next to the dataset as `failures.json`.
public final class FailureManifest {

    public static final String FILE_NAME = "failures.json";

    private final List<FrameFailure> failures;

    public FailureManifest(List<FrameFailure> failures) {
        this.failures = List.copyOf(failures);
    }

    public static FailureManifest merge(FailureManifest first, FailureManifest second) {
        List<FrameFailure> all = new ArrayList<>(first.failures);
        all.addAll(second.failures);
        return new FailureManifest(all);
    }

    public List<FrameFailure> failures() {
        return failures;
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public int size() {
        return failures.size();
    }

    public void write(Path file) throws IOException {
        Gson gson = DatasetGsonConfig.gson();
        JsonObject root = new JsonObject();
        root.addProperty("count", failures.size());
        root.add("failures", gson.toJsonTree(failures));
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(root, writer);
        }
    }

    public static FailureManifest read(Path file) throws IOException {
        Gson gson = DatasetGsonConfig.gson();
        String json = Files.readString(file, StandardCharsets.UTF_8);
        JsonObject root = gson.fromJson(json, JsonObject.class);
        FrameFailure[] entries = gson.fromJson(root.get("failures"), FrameFailure[].class);
        return new FailureManifest(List.of(entries));
    }
}
