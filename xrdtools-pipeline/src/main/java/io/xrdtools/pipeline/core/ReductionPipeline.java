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

import io.xrdtools.dataset.DiffractionDataset;
import io.xrdtools.dataset.io.DatasetStore;
import io.xrdtools.pipeline.cache.ResultCache;
import io.xrdtools.pipeline.compute.ComputeBackend;
import io.xrdtools.pipeline.compute.LocalComputeBackend;
import io.xrdtools.pipeline.config.OutputNaming;
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.pipeline.exceptions.FrameDiscoveryException;
import io.xrdtools.pipeline.frames.FrameDescriptor;
import io.xrdtools.pipeline.frames.FrameRange;
import io.xrdtools.pipeline.frames.FrameSource;
import io.xrdtools.pipeline.frames.SliceIntegrator;
import io.xrdtools.refine.RefinementEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/// Runs a whole reduction: reference pass, then sample pass, then aggregation.
///
/// ```java
/// ReductionPipeline pipeline = new ReductionPipeline(new DirectoryFrameSource(), integrator, engine,
///     new Hdf5DatasetStore());
/// ReductionResult result = pipeline.runAndSave(RecipeLoader.load(recipe), outputRoot);
/// ```
///
/// The sample pass starts only after the reference pass has finished, because every sample work
/// unit carries the reference tables.
public class ReductionPipeline {

    private static final Logger logger = LogManager.getLogger(ReductionPipeline.class);

    public static final String DATASET_FILE = "dataset.h5";

    private final FrameSource frameSource;
    private final SliceIntegrator integrator;
    private final RefinementEngine engine;
    private final DatasetStore store;
    private final IntFunction<ComputeBackend> backends;
    private final Clock clock;

    public ReductionPipeline(FrameSource frameSource, SliceIntegrator integrator, RefinementEngine engine,
                             DatasetStore store) {
        this(frameSource, integrator, engine, store, LocalComputeBackend::new);
    }

    /// @param backends creates the compute backend for a run from its worker count
    public ReductionPipeline(FrameSource frameSource, SliceIntegrator integrator, RefinementEngine engine,
                             DatasetStore store, IntFunction<ComputeBackend> backends) {
        this(frameSource, integrator, engine, store, backends, Clock.systemDefaultZone());
    }

    /// @param clock dates and times the output directories of [#runAndSave]
    public ReductionPipeline(FrameSource frameSource, SliceIntegrator integrator, RefinementEngine engine,
                             DatasetStore store, IntFunction<ComputeBackend> backends, Clock clock) {
        this.frameSource = frameSource;
        this.integrator = integrator;
        this.engine = engine;
        this.store = store;
        this.backends = backends;
        this.clock = clock;
    }

    public ReductionResult run(ProcessingParameters params) throws IOException {
        return run(params, new ResultCache<>());
    }

    /// Reduces the frames `params` describes.
    ///
    /// @param cache results already computed in this batch; filled with new ones
    /// @throws FrameDiscoveryException if no sample frames are found, or a reference directory is
    ///     configured but holds no frames
    /// @throws IOException if a frame directory cannot be read
    public ReductionResult run(ProcessingParameters params, ResultCache<FrameResult> cache) throws IOException {
        long start = System.nanoTime();
        List<FrameDescriptor> samples = frameSource.discover(params.imagesPath(), params.frames());
        if (samples.isEmpty()) {
            throw new FrameDiscoveryException(params.imagesPath(), "no frames selected by " + params.frames());
        }
        List<FrameDescriptor> references = List.of();
        if (params.refsPath().isPresent()) {
            Path refs = params.refsPath().get();
            references = frameSource.discover(refs, FrameRange.ALL);
            if (references.isEmpty()) {
                throw new FrameDiscoveryException(refs, "reference directory holds no frames");
            }
        }
        logger.info("reducing {}: {} sample frames, {} reference frames", params, samples.size(), references.size());

        FrameProcessor processor = new FrameProcessor(integrator, engine, params);
        ReferenceCalibration calibration;
        List<FrameOutcome> outcomes;
        try (ComputeBackend backend = backends.apply(params.options().workers())) {
            SampleProcessingScheduler scheduler = new SampleProcessingScheduler(backend, cache, processor, params);
            calibration = new ReferenceCalibrationPass(scheduler, params).run(references);
            outcomes = scheduler.process(samples, calibration.context());
        }

        List<FrameFailure> failures = new ArrayList<>();
        int cached = 0;
        for (FrameOutcome outcome : outcomes) {
            if (outcome instanceof FrameOutcome.Failed failed) {
                failures.add(new FrameFailure(failed.frame().globalIndex(), failed.frame().file().toString(),
                    "sample", failed.reason()));
            } else if (outcome instanceof FrameOutcome.Completed completed && completed.fromCache()) {
                cached++;
            }
        }
        if (!failures.isEmpty()) {
            logger.warn("{} of {} sample frames failed and are stored as zeros", failures.size(), outcomes.size());
        }

        DiffractionDataset dataset = new ResultAggregator(params).aggregate(outcomes, calibration);
        FailureManifest manifest = FailureManifest.merge(calibration.failures(), new FailureManifest(failures));
        ReductionSummary summary = new ReductionSummary(references.size(), samples.size(), cached,
            failures.size(), Duration.ofNanos(System.nanoTime() - start));
        logger.info("reduction finished: {}", summary);
        return new ReductionResult(dataset, manifest, summary, null);
    }

    /// Runs the reduction and saves it under a new directory of `outputRoot`.
    ///
    /// The directory is laid out by [OutputNaming#datasetDirectory] and holds [#DATASET_FILE] and
    /// [FailureManifest#FILE_NAME]. An existing directory is never reused: a numeric suffix is
    /// appended instead.
    public ReductionResult runAndSave(ProcessingParameters params, Path outputRoot) throws IOException {
        return runAndSave(params, outputRoot, new ResultCache<>());
    }

    public ReductionResult runAndSave(ProcessingParameters params, Path outputRoot, ResultCache<FrameResult> cache)
        throws IOException {
        ReductionResult result = run(params, cache);
        Path directory = createOutputDirectory(
            OutputNaming.datasetDirectory(outputRoot, params, LocalDateTime.now(clock)));
        store.save(result.dataset(), directory.resolve(DATASET_FILE));
        result.failures().write(directory.resolve(FailureManifest.FILE_NAME));
        logger.info("saved dataset to {}", directory);
        return result.savedTo(directory);
    }

    /// Creates `base`, or the first of `base-2`, `base-3`, ... that does not exist yet.
    static Path createOutputDirectory(Path base) throws IOException {
        Files.createDirectories(base.getParent());
        for (int attempt = 1; ; attempt++) {
            Path candidate = attempt == 1 ? base : base.resolveSibling(base.getFileName() + "-" + attempt);
            try {
                return Files.createDirectory(candidate);
            } catch (FileAlreadyExistsException e) {
                logger.debug("output directory {} is taken", candidate);
            }
        }
    }
}
