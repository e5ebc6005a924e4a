package io.xrdtools.command.subcommands;

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
import io.xrdtools.dataset.io.Hdf5DatasetStore;
import io.xrdtools.pipeline.core.FailureManifest;
import io.xrdtools.pipeline.core.FrameFailure;
import io.xrdtools.pipeline.core.ReductionPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Prints what a stored dataset holds: its shape, chunking, measurements, peaks, attributes,
 * captured reference tables and, when present, the frames its reduction dropped.
 */
@CommandLine.Command(name = "inspect",
    header = "Describe a stored reduction dataset",
    description = "Accepts a dataset file or the directory a reduction was saved to.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: the dataset could not be read", "2: usage error"})
public class CMD_xrdtools_inspect implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_xrdtools_inspect.class);

    @CommandLine.Parameters(index = "0", description = "Dataset file or reduction output directory")
    private Path target;

    @CommandLine.Option(names = {"-m", "--measurement"},
        description = "Also print this measurement as a frame by azimuth table")
    private String measurement;

    @CommandLine.Option(names = {"--peak"}, defaultValue = "0",
        description = "Peak index for --measurement (default: ${DEFAULT-VALUE})")
    private int peak;

    @Override
    public Integer call() {
        Path file = Files.isDirectory(target) ? target.resolve(ReductionPipeline.DATASET_FILE) : target;
        if (!Files.isRegularFile(file)) {
            logger.error("Dataset file not found: {}", file);
            return 1;
        }
        try {
            DiffractionDataset dataset = new Hdf5DatasetStore().load(file);
            StringBuilder out = new StringBuilder();
            describe(dataset, file, out);
            if (measurement != null) {
                if (!dataset.hasMeasurement(measurement) || peak < 0 || peak >= dataset.peaks()) {
                    logger.error("No measurement '{}' for peak {}; measurements are {}",
                        measurement, peak, dataset.measurementNames());
                    return 1;
                }
                table(dataset, out);
            }
            Path failures = file.resolveSibling(FailureManifest.FILE_NAME);
            if (Files.isRegularFile(failures)) {
                failures(FailureManifest.read(failures), out);
            }
            System.out.print(out);
            return 0;
        } catch (IOException | RuntimeException e) {
            logger.error("Error reading dataset {}: {}", file, e.getMessage());
            return 1;
        }
    }

    private void describe(DiffractionDataset dataset, Path file, StringBuilder out) {
        out.append("DATASET ").append(file.toAbsolutePath()).append('\n');
        out.append("==========================\n");
        out.append(String.format(Locale.ROOT, "shape:        %d peaks x %d frames x %d azimuths x %d measurements%n",
            dataset.peaks(), dataset.frames(), dataset.azimuths(), dataset.measurementNames().size()));
        out.append(String.format(Locale.ROOT, "azimuths:     %s%n", dataset.grid()));
        out.append(String.format(Locale.ROOT, "chunks:       %s%n", dataset.chunkDims()));
        int[][] frameNumbers = dataset.frameNumbers();
        out.append(String.format(Locale.ROOT, "frames:       %d .. %d%n",
            frameNumbers[0][0], frameNumbers[0][dataset.frames() - 1]));
        out.append("peaks:        ").append(String.join(", ", dataset.peakLabels())).append('\n');
        out.append("measurements: ").append(String.join(", ", dataset.measurementNames())).append('\n');
        out.append("references:   ")
            .append(dataset.referenceTables().isEmpty() ? "none" : String.join(", ", dataset.referenceTables().names()))
            .append('\n');
        for (Map.Entry<String, String> attribute : dataset.attributes().entrySet()) {
            out.append(String.format(Locale.ROOT, "  %-12s %s%n", attribute.getKey() + ":", attribute.getValue()));
        }
    }

    private void table(DiffractionDataset dataset, StringBuilder out) {
        float[][] values = dataset.peakMeasurement(peak, measurement);
        out.append('\n').append(measurement).append(" of peak ").append(dataset.peakLabels().get(peak)).append('\n');
        out.append(String.format(Locale.ROOT, "%8s", "frame"));
        for (int a = 0; a < dataset.azimuths(); a++) {
            out.append(String.format(Locale.ROOT, " %12.1f", dataset.grid().angleOf(a)));
        }
        out.append('\n');
        for (int f = 0; f < dataset.frames(); f++) {
            out.append(String.format(Locale.ROOT, "%8d", dataset.frameNumber(peak, f)));
            for (int a = 0; a < dataset.azimuths(); a++) {
                out.append(String.format(Locale.ROOT, " %12.6g", values[f][a]));
            }
            out.append('\n');
        }
    }

    private void failures(FailureManifest manifest, StringBuilder out) {
        out.append('\n').append(manifest.size()).append(" failed frames\n");
        for (FrameFailure failure : manifest.failures()) {
            out.append(String.format(Locale.ROOT, "  %6d %-9s %s: %s%n",
                failure.frameNumber(), failure.role(), failure.file(), failure.reason()));
        }
    }
}
