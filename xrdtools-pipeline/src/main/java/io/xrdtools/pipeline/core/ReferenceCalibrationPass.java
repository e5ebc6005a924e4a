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
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.pipeline.frames.FrameDescriptor;
import io.xrdtools.refine.PeakParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Refines the reference frames and reduces them into baseline tables.
///
/// Every primary measurement gets a `[peaks][azimuths]` mean over the reference frames that
/// completed, skipping non-finite values; cells with no finite value are NaN.
public class ReferenceCalibrationPass {

    private static final Logger logger = LogManager.getLogger(ReferenceCalibrationPass.class);

    private final SampleProcessingScheduler scheduler;
    private final ProcessingParameters params;

    public ReferenceCalibrationPass(SampleProcessingScheduler scheduler, ProcessingParameters params) {
        this.scheduler = scheduler;
        this.params = params;
    }

    public ReferenceCalibration run(List<FrameDescriptor> frames) {
        if (frames.isEmpty()) {
            return ReferenceCalibration.NONE;
        }
        logger.info("reference pass over {} frames", frames.size());
        List<FrameOutcome> outcomes = scheduler.dispatch(frames, CacheKey.Role.REFERENCE, ReferenceContext.EMPTY);

        List<FrameResult> results = new ArrayList<>();
        List<FrameFailure> failures = new ArrayList<>();
        for (FrameOutcome outcome : outcomes) {
            if (outcome instanceof FrameOutcome.Completed completed) {
                results.add(completed.result());
            } else if (outcome instanceof FrameOutcome.Failed failed) {
                failures.add(new FrameFailure(failed.frame().globalIndex(), failed.frame().file().toString(),
                    "reference", failed.reason()));
            }
        }
        if (results.isEmpty()) {
            logger.warn("no reference frame could be refined; continuing without reference tables");
            return new ReferenceCalibration(ReferenceTables.empty(), BackgroundTemplate.EMPTY,
                new FailureManifest(failures), 0);
        }

        ReferenceTables tables = ReferenceTables.of(meanTables(results));
        int backgroundPeaks = params.backgroundCandidates().size();
        BackgroundTemplate template = backgroundPeaks > 0
            ? BackgroundTemplate.average(results, params.azimuths().count(), backgroundPeaks)
            : BackgroundTemplate.EMPTY;
        logger.info("reference pass averaged {} frames ({} failed), background template over {} peaks",
            results.size(), failures.size(), backgroundPeaks);
        return new ReferenceCalibration(tables, template, new FailureManifest(failures), results.size());
    }

    private Map<String, float[][]> meanTables(List<FrameResult> results) {
        int peaks = params.peakCount();
        int azimuths = params.azimuths().count();
        double wavelength = params.wavelength();
        Map<String, double[][]> sums = new LinkedHashMap<>();
        Map<String, int[][]> counts = new LinkedHashMap<>();
        for (String name : Measurements.PRIMARY) {
            sums.put(name, new double[peaks][azimuths]);
            counts.put(name, new int[peaks][azimuths]);
        }
        for (FrameResult result : results) {
            for (SliceFit slice : result.slices()) {
                int a = slice.azimuthIndex();
                for (int p = 0; p < peaks; p++) {
                    PeakParameters peak = slice.peaks().get(p);
                    for (Map.Entry<String, Double> value : Measurements.of(peak, wavelength).entrySet()) {
                        if (Double.isFinite(value.getValue())) {
                            sums.get(value.getKey())[p][a] += value.getValue();
                            counts.get(value.getKey())[p][a]++;
                        }
                    }
                }
            }
        }
        Map<String, float[][]> tables = new LinkedHashMap<>();
        for (String name : Measurements.PRIMARY) {
            double[][] sum = sums.get(name);
            int[][] count = counts.get(name);
            float[][] mean = new float[peaks][azimuths];
            for (int p = 0; p < peaks; p++) {
                for (int a = 0; a < azimuths; a++) {
                    mean[p][a] = count[p][a] == 0 ? Float.NaN : (float) (sum[p][a] / count[p][a]);
                }
            }
            tables.put(name, mean);
        }
        return tables;
    }
}
