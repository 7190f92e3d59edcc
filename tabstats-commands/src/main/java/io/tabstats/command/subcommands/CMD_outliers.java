package io.tabstats.command.subcommands;

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

import io.tabstats.analysis.AnalysisEngine;
import io.tabstats.analysis.Outlier;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.List;

import static io.tabstats.command.common.ReportFormat.number;

/// Find entities whose z-score on a feature exceeds a threshold.
@CommandLine.Command(
    name = "outliers",
    header = "Find z-score outliers",
    description = "Lists entities whose absolute z-score on a feature exceeds the threshold. "
        + "A feature whose values are all equal has no outliers.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown feature"})
public class CMD_outliers extends AbstractDatasetCommand {

    @CommandLine.Parameters(description = "Feature to scan", arity = "1")
    private String feature;

    @CommandLine.Option(names = {"-t", "--threshold"}, description = "z-score threshold (default: ${DEFAULT-VALUE})",
        defaultValue = "2.0")
    private double threshold;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        List<Outlier> outliers = AnalysisEngine.findOutliers(dataset, feature, threshold);
        if (json) {
            printJson(out, outliers);
            return EXIT_OK;
        }
        out.printf("  Found %d outliers:%n", outliers.size());
        for (Outlier outlier : outliers) {
            out.printf("  %-30s Value: %s, Z-score: %s%n",
                outlier.entityName(), number(outlier.value(), 3), number(outlier.zScore(), 2));
        }
        return EXIT_OK;
    }
}
