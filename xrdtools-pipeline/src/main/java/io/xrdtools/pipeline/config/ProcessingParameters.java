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

import io.xrdtools.dataset.AzimuthGrid;
import io.xrdtools.pipeline.frames.FrameRange;
import io.xrdtools.refine.AnalysisWindow;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/// Immutable description of one reduction: the sample, where its frames live, which peaks to
/// track and how to bin and refine them.
///
/// Usually built by [RecipeLoader]; tests build it directly:
///
/// ```java
/// ProcessingParameters params = ProcessingParameters.builder()
///     .sample("S1").setting("Speed").stage(Stage.BEF)
///     .imagesPath(Path.of("images"))
///     .activePeak(new PeakSpec("110", "110", 6.0, new AnalysisWindow(5.5, 6.5)))
///     .azimuths(new AzimuthGrid(0, 360, 5))
///     .build();
/// ```
public final class ProcessingParameters {

    /// Wavelength in ångström used for d-spacing when a recipe gives none.
    public static final double DEFAULT_WAVELENGTH = 0.1729;

    private final String sample;
    private final String setting;
    private final Stage stage;
    private final String exposure;
    private final String notes;
    private final Path imagesPath;
    private final Path refsPath;
    private final List<PeakSpec> activePeaks;
    private final List<PeakSpec> availablePeaks;
    private final AzimuthGrid azimuths;
    private final FrameRange frames;
    private final double wavelength;
    private final ProcessingOptions options;

    private ProcessingParameters(Builder builder) {
        this.sample = Objects.requireNonNull(builder.sample, "sample");
        this.setting = Objects.requireNonNull(builder.setting, "setting");
        this.stage = Objects.requireNonNull(builder.stage, "stage");
        this.exposure = builder.exposure;
        this.notes = builder.notes;
        this.imagesPath = Objects.requireNonNull(builder.imagesPath, "imagesPath");
        this.refsPath = builder.refsPath;
        this.activePeaks = List.copyOf(builder.activePeaks);
        this.availablePeaks = List.copyOf(builder.availablePeaks);
        this.azimuths = Objects.requireNonNull(builder.azimuths, "azimuths");
        this.frames = builder.frames;
        this.wavelength = builder.wavelength;
        this.options = builder.options;
        if (activePeaks.isEmpty()) {
            throw new IllegalArgumentException("at least one active peak is required");
        }
        if (!(wavelength > 0)) {
            throw new IllegalArgumentException("wavelength must be positive: " + wavelength);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
            .sample(sample).setting(setting).stage(stage).exposure(exposure).notes(notes)
            .imagesPath(imagesPath).refsPath(refsPath)
            .azimuths(azimuths).frames(frames).wavelength(wavelength).options(options);
        activePeaks.forEach(b::activePeak);
        availablePeaks.forEach(b::availablePeak);
        return b;
    }

    public String sample() {
        return sample;
    }

    public String setting() {
        return setting;
    }

    public Stage stage() {
        return stage;
    }

    public String exposure() {
        return exposure;
    }

    public String notes() {
        return notes;
    }

    public Path imagesPath() {
        return imagesPath;
    }

    public Optional<Path> refsPath() {
        return Optional.ofNullable(refsPath);
    }

    public List<PeakSpec> activePeaks() {
        return activePeaks;
    }

    public List<PeakSpec> availablePeaks() {
        return availablePeaks;
    }

    public AzimuthGrid azimuths() {
        return azimuths;
    }

    public FrameRange frames() {
        return frames;
    }

    public double wavelength() {
        return wavelength;
    }

    public ProcessingOptions options() {
        return options;
    }

    public int peakCount() {
        return activePeaks.size();
    }

    public ProcessingParameters withOptions(ProcessingOptions newOptions) {
        return toBuilder().options(newOptions).build();
    }

    /// The 2θ range covering every active peak's limits.
    public AnalysisWindow analysisWindow() {
        return AnalysisWindow.union(activePeaks.stream().map(PeakSpec::limits).toList());
    }

    /// Positions of available peaks that are not active peaks and lie inside the analysis window.
    public List<Double> backgroundCandidates() {
        AnalysisWindow window = analysisWindow();
        Set<Double> active = new HashSet<>();
        for (PeakSpec peak : activePeaks) {
            active.add(peak.position());
        }
        List<Double> candidates = new ArrayList<>();
        for (PeakSpec peak : availablePeaks) {
            if (!active.contains(peak.position()) && window.contains(peak.position())) {
                candidates.add(peak.position());
            }
        }
        return candidates;
    }

    public List<String> peakLabels() {
        return activePeaks.stream().map(PeakSpec::label).toList();
    }

    /// Canonical key/value view of every parameter that influences refined values.
    ///
    /// Two runs with equal signatures over the same frames produce the same per-frame results.
    public SortedMap<String, String> signatureParameters() {
        SortedMap<String, String> map = new TreeMap<>();
        map.put("az_start", number(azimuths.start()));
        map.put("az_end", number(azimuths.end()));
        map.put("spacing", number(azimuths.spacing()));
        map.put("wavelength", number(wavelength));
        StringBuilder active = new StringBuilder();
        for (PeakSpec peak : activePeaks) {
            active.append(number(peak.position())).append('[')
                .append(number(peak.limits().lower())).append(',')
                .append(number(peak.limits().upper())).append("];");
        }
        map.put("active_peaks", active.toString());
        StringBuilder background = new StringBuilder();
        for (Double position : backgroundCandidates()) {
            background.append(number(position)).append(';');
        }
        map.put("background_peaks", background.toString());
        map.put("convergence_threshold", number(options.convergenceThreshold()));
        map.put("dynamic_background", Boolean.toString(options.dynamicBackground()));
        map.put("max_stage_iterations", Integer.toString(options.maxStageIterations()));
        return map;
    }

    /// @return `signatureParameters()` rendered as a single `key=value|...` string
    public String signature() {
        StringBuilder sb = new StringBuilder();
        signatureParameters().forEach((k, v) -> sb.append(k).append('=').append(v).append('|'));
        return sb.toString();
    }

    static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%s", value);
    }

    @Override
    public String toString() {
        return "ProcessingParameters{sample=" + sample + ", setting=" + setting + ", stage=" + stage
            + ", peaks=" + peakLabels() + ", frames=" + frames + "}";
    }

    public static final class Builder {
        private String sample;
        private String setting;
        private Stage stage;
        private String exposure = "019";
        private String notes = "";
        private Path imagesPath;
        private Path refsPath;
        private final List<PeakSpec> activePeaks = new ArrayList<>();
        private final List<PeakSpec> availablePeaks = new ArrayList<>();
        private AzimuthGrid azimuths;
        private FrameRange frames = FrameRange.ALL;
        private double wavelength = DEFAULT_WAVELENGTH;
        private ProcessingOptions options = ProcessingOptions.defaults();

        private Builder() {
        }

        public Builder sample(String sample) {
            this.sample = sample;
            return this;
        }

        public Builder setting(String setting) {
            this.setting = setting;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder exposure(String exposure) {
            this.exposure = exposure;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder imagesPath(Path imagesPath) {
            this.imagesPath = imagesPath;
            return this;
        }

        public Builder refsPath(Path refsPath) {
            this.refsPath = refsPath;
            return this;
        }

        public Builder activePeak(PeakSpec peak) {
            this.activePeaks.add(peak);
            return this;
        }

        public Builder availablePeak(PeakSpec peak) {
            this.availablePeaks.add(peak);
            return this;
        }

        public Builder azimuths(AzimuthGrid azimuths) {
            this.azimuths = azimuths;
            return this;
        }

        public Builder frames(FrameRange frames) {
            this.frames = frames;
            return this;
        }

        public Builder wavelength(double wavelength) {
            this.wavelength = wavelength;
            return this;
        }

        public Builder options(ProcessingOptions options) {
            this.options = options;
            return this;
        }

        public ProcessingParameters build() {
            return new ProcessingParameters(this);
        }
    }
}
