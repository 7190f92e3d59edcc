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
import io.tabstats.analysis.FeatureStatistics;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static io.tabstats.command.common.ReportFormat.number;

/// Show descriptive statistics for one or more features.
///
/// ```bash
/// tabstats stats "Ladder score" "Social support"
/// tabstats stats --all --json
/// ```
@CommandLine.Command(
    name = "stats",
    header = "Show feature statistics",
    description = "Computes mean, median, standard deviation, min, max and count over the non-missing values of each feature.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown feature"})
public class CMD_stats extends AbstractDatasetCommand {

    @CommandLine.Parameters(description = "Feature names, exactly as in the header", arity = "0..*")
    private List<String> features = new ArrayList<>();

    @CommandLine.Option(names = {"-a", "--all"}, description = "Show every feature")
    private boolean all = false;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        List<String> selected = all ? dataset.featureNames() : features;
        if (selected.isEmpty()) {
            System.err.println("Error: name at least one feature, or use --all");
            return EXIT_INPUT_ERROR;
        }

        List<FeatureStatistics> results = new ArrayList<>();
        for (String feature : selected) {
            results.add(AnalysisEngine.basicStatistics(dataset, feature));
        }

        if (json) {
            printJson(out, results);
            return EXIT_OK;
        }
        out.printf("%-35s %10s %10s %10s %10s %10s %6s%n", "feature", "mean", "median", "std", "min", "max", "count");
        for (FeatureStatistics s : results) {
            out.printf("%-35s %10s %10s %10s %10s %10s %6d%n", s.feature(),
                number(s.mean(), 4), number(s.median(), 4), number(s.stdDev(), 4),
                number(s.min(), 4), number(s.max(), 4), s.count());
        }
        return EXIT_OK;
    }
}
