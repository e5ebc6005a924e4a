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

import io.xrdtools.dataset.AzimuthGrid;
import io.xrdtools.pipeline.config.PeakSpec;
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.pipeline.frames.FrameDescriptor;
import io.xrdtools.pipeline.frames.SliceIntegrator;
import io.xrdtools.refine.AnalysisWindow;
import io.xrdtools.refine.AzimuthalSlice;
import io.xrdtools.refine.BackgroundPeak;
import io.xrdtools.refine.ConvergenceCriteria;
import io.xrdtools.refine.ParameterCorrector;
import io.xrdtools.refine.ParameterSnapshot;
import io.xrdtools.refine.PeakParameters;
import io.xrdtools.refine.RefinementController;
import io.xrdtools.refine.RefinementEngine;
import io.xrdtools.refine.RefinementSession;
import io.xrdtools.refine.SliceResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Refines every azimuthal slice of one frame.
///
/// Slices run one after another on the calling thread. The first failing slice fails the frame.
public class FrameProcessor {

    private static final Logger logger = LogManager.getLogger(FrameProcessor.class);

    static final double SEED_AREA = 1.0;
    static final double SEED_WIDTH = 0.01;
    static final double SEED_BACKGROUND_INTENSITY = 100;
    static final double SEED_BACKGROUND_SIGMA = 2000;

    private final SliceIntegrator integrator;
    private final RefinementController controller;
    private final ProcessingParameters params;
    private final AnalysisWindow window;
    private final List<Double> backgroundCandidates;

    public FrameProcessor(SliceIntegrator integrator, RefinementEngine engine, ProcessingParameters params) {
        this.integrator = integrator;
        this.controller = new RefinementController(engine, new ParameterCorrector(),
            new ConvergenceCriteria(params.options().convergenceThreshold()));
        this.params = params;
        this.window = params.analysisWindow();
        this.backgroundCandidates = params.backgroundCandidates();
    }

    public FrameOutcome process(WorkUnit unit) {
        FrameDescriptor frame = unit.frame();
        AzimuthGrid grid = params.azimuths();
        List<AzimuthalSlice> slices;
        try {
            slices = integrator.integrate(frame, grid, window);
        } catch (IOException | RuntimeException e) {
            logger.warn("frame {} ({}) could not be integrated: {}", frame.globalIndex(), frame.file(), e.toString());
            return new FrameOutcome.Failed(frame, "integration: " + e.getMessage());
        }
        if (slices.size() != grid.count()) {
            return new FrameOutcome.Failed(frame,
                "integration produced " + slices.size() + " slices for " + grid.count() + " azimuth bins");
        }

        List<SliceFit> fits = new ArrayList<>(slices.size());
        for (int a = 0; a < slices.size(); a++) {
            AzimuthalSlice slice = slices.get(a);
            RefinementSession session = new RefinementSession(slice, seed(unit.context(), a), window);
            SliceResult result = controller.run(session, unit.recipe());
            if (!result.succeeded()) {
                String reason = "slice " + a + " (" + slice.azimuth() + " deg): " + result.failure();
                logger.warn("frame {} failed: {}", frame.globalIndex(), reason);
                return new FrameOutcome.Failed(frame, reason);
            }
            ParameterSnapshot parameters = result.parameters();
            fits.add(new SliceFit(a, slice.azimuth(), parameters.peaks(), parameters.backgroundPeaks()));
        }
        logger.debug("frame {} refined over {} slices", frame.globalIndex(), fits.size());
        return new FrameOutcome.Completed(frame, new FrameResult(frame.globalIndex(), fits), false);
    }

    /// Starting parameters of one slice: reference values where known, configured positions otherwise.
    ParameterSnapshot seed(ReferenceContext context, int azimuth) {
        List<PeakSpec> active = params.activePeaks();
        List<PeakParameters> peaks = new ArrayList<>(active.size());
        for (int p = 0; p < active.size(); p++) {
            PeakSpec spec = active.get(p);
            peaks.add(context.seedFor(p, azimuth)
                .orElseGet(() -> new PeakParameters(spec.position(), SEED_AREA, SEED_WIDTH, SEED_WIDTH)));
        }
        List<BackgroundPeak> background;
        if (!context.background().isEmpty()) {
            background = context.background().peaksFor(azimuth);
        } else {
            background = backgroundCandidates.stream()
                .map(position -> new BackgroundPeak(position, SEED_BACKGROUND_INTENSITY, SEED_BACKGROUND_SIGMA, 0))
                .toList();
        }
        return ParameterSnapshot.of(peaks, background);
    }
}
