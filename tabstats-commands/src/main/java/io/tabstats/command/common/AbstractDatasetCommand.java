package io.tabstats.command.common;

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

import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.DatasetFormatException;
import io.tabstats.dataset.UnknownEntityException;
import io.tabstats.dataset.UnknownFeatureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.Callable;

/// Base for commands that load one dataset and query it.
///
/// Subclasses implement [#run(Dataset, PrintStream)]. Failures are logged and mapped
/// to exit codes here:
///
/// | code | cause |
/// |------|-------|
/// | 0 | success |
/// | 1 | the input could not be read, or has no header |
/// | 2 | an unknown feature or entity name was given |
public abstract class AbstractDatasetCommand implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(AbstractDatasetCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INPUT_ERROR = 1;
    public static final int EXIT_UNKNOWN_NAME = 2;

    @CommandLine.Mixin
    protected DatasetFileOption datasetFile = new DatasetFileOption();

    @CommandLine.Option(
        names = {"-j", "--json"},
        description = "Write results as JSON instead of text"
    )
    protected boolean json = false;

    @Override
    public Integer call() {
        Dataset dataset;
        try {
            dataset = datasetFile.load();
        } catch (IOException | DatasetFormatException e) {
            logger.error("Error loading dataset from {}: {}", datasetFile.getInputPath(), e.toString());
            return EXIT_INPUT_ERROR;
        }
        logger.debug("Loaded {} from {}", dataset, datasetFile.getInputPath());

        try {
            return run(dataset, System.out);
        } catch (UnknownFeatureException | UnknownEntityException e) {
            logger.error(e.getMessage());
            return EXIT_UNKNOWN_NAME;
        }
    }

    /// Runs the command against a loaded dataset.
    ///
    /// @param dataset the dataset
    /// @param out where results are written
    /// @return the exit code
    protected abstract int run(Dataset dataset, PrintStream out);

    /// Writes a result as JSON.
    protected void printJson(PrintStream out, Object result) {
        out.println(TabstatsGsonConfig.gson().toJson(result));
    }
}
