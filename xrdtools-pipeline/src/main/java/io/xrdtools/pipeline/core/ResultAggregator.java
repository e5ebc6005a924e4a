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
import io.xrdtools.dataset.MeasurementRow;
import io.xrdtools.pipeline.config.OutputNaming;
import io.xrdtools.pipeline.config.ProcessingParameters;
import io.xrdtools.refine.PeakParameters;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Writes frame outcomes into a dataset and derives the secondary measurements.
///
/// Outcome `i` becomes frame `i` of the dataset. Failed frames keep their frame number but no
/// values, so every cell of that frame stays 0.
public class ResultAggregator {

    private static final Logger logger = LogManager.getLogger(ResultAggregator.class);

    private final ProcessingParameters params;

    public ResultAggregator(ProcessingParameters params) {
        this.params = params;
    }

    /// @param outcomes sample outcomes ordered by global frame index, at least one
    /// @param calibration reference pass output, or [ReferenceCalibration#NONE]
    /// @return a sealed dataset holding primary and derived measurements
    public DiffractionDataset aggregate(List<FrameOutcome> outcomes, ReferenceCalibration calibration) {
        int peaks = params.peakCount();
        DiffractionDataset dataset = DiffractionDataset.create(peaks, outcomes.size(), params.azimuths().count(),
            Measurements.PRIMARY, params.azimuths(), params.options().targetChunkBytes());

        for (int f = 0; f < outcomes.size(); f++) {
            FrameOutcome outcome = outcomes.get(f);
            int frameNumber = outcome.frame().globalIndex();
            if (outcome instanceof FrameOutcome.Completed completed) {
                for (int p = 0; p < peaks; p++) {
                    dataset.setFrameData(p, f, frameNumber, rows(completed.result(), p));
                }
            } else {
                for (int p = 0; p < peaks; p++) {
                    dataset.setFrameData(p, f, frameNumber, List.of());
                }
            }
        }

        dataset.setPeakLabels(params.peakLabels());
        dataset.putAttribute("sample", params.sample());
        dataset.putAttribute("setting", params.setting());
        dataset.putAttribute(DiffractionDataset.STAGE_ATTRIBUTE, params.stage().name());
        dataset.putAttribute("exposure", params.exposure());
        dataset.putAttribute("notes", params.notes());
        dataset.putAttribute("wavelength", Double.toString(params.wavelength()));
        dataset.putAttribute("dataset_id", OutputNaming.datasetId(params));
        dataset.putAttribute("reference_frames", Integer.toString(calibration.framesUsed()));
        if (calibration.isPresent()) {
            dataset.setReferenceTables(calibration.tables());
        }
        dataset.seal();
        logger.info("aggregated {} frames into {}", outcomes.size(), dataset);

        if (hasUsableReferenceD(calibration)) {
            dataset.calculateStrain();
        }
        for (String measurement : Measurements.DELTAS) {
            if (dataset.hasMeasurement(measurement)) {
                dataset.calculateDelta(measurement);
            }
        }
        return dataset;
    }

    private List<MeasurementRow> rows(FrameResult result, int peak) {
        List<MeasurementRow> rows = new ArrayList<>(result.slices().size());
        for (SliceFit slice : result.slices()) {
            PeakParameters parameters = slice.peaks().get(peak);
            rows.add(new MeasurementRow(slice.azimuth(), Measurements.of(parameters, params.wavelength())));
        }
        return rows;
    }

    private static boolean hasUsableReferenceD(ReferenceCalibration calibration) {
        if (!calibration.tables().has(Measurements.D_SPACING)) {
            return false;
        }
        for (float[] row : calibration.tables().table(Measurements.D_SPACING)) {
            for (float value : row) {
                if (value != 0f && Float.isFinite(value)) {
                    return true;
                }
            }
        }
        return false;
    }
}
