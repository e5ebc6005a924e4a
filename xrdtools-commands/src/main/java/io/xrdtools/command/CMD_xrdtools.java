package io.xrdtools.command;

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

import io.xrdtools.command.subcommands.CMD_xrdtools_inspect;
import io.xrdtools.command.subcommands.CMD_xrdtools_run;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Diffraction Reduction Tool

 Reduces sequences of 2-D diffraction images into a 4-D dataset of refined peak parameters
 (peak × frame × azimuth × measurement).

 ## Subcommands
 - `run`: reduce the frames one recipe describes, or every recipe in a directory
 - `inspect`: print the shape, measurements and metadata of a stored dataset

 # Basic Usage
 ```
 xrdtools run --recipe S12_bef.json --output ./reduced
 xrdtools run --recipes ./recipes --threads 8
 xrdtools inspect ./reduced/360deg-72bins-0sf-allfr-5.8l2t_8.9u2t-2peaks-1bkg-142501
 ```
 */
@CommandLine.Command(name = "xrdtools",
    header = "Reduce diffraction image sequences into peak parameter datasets",
    description = "Runs recipe driven reductions and inspects their results.\n" +
        "Use subcommands to run or inspect.",
    mixinStandardHelpOptions = true,
    version = "xrdtools 0.1.0",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: a reduction failed", "2: usage error"},
    subcommands = {
        CMD_xrdtools_run.class,
        CMD_xrdtools_inspect.class,
        CommandLine.HelpCommand.class
    })
public class CMD_xrdtools implements Callable<Integer> {

    /**
     * Run the xrdtools command
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return a command line for this tool with case-insensitive options
     */
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_xrdtools())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
