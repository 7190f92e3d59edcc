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
import io.tabstats.analysis.CorrelationMatrix;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.tabstats.command.common.ReportFormat.number;

/// Pearson correlations between features.
///
/// Without `--target`, prints the full matrix over complete-case rows. With `--target`,
/// correlates each listed feature with the target separately, each pair over the rows
/// where both are present.
@CommandLine.Command(
    name = "correlate",
    header = "Correlate features",
    description = "Prints the Pearson correlation matrix of the given features, "
        + "or each feature's correlation with a --target feature.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown feature"})
public class CMD_correlate extends AbstractDatasetCommand {

    @CommandLine.Parameters(description = "Features to correlate", arity = "1..*")
    private List<String> features;

    @CommandLine.Option(names = {"-t", "--target"}, description = "Correlate every feature against this one")
    private String target;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        if (target != null) {
            Map<String, Double> coefficients = new LinkedHashMap<>();
            for (String feature : features) {
                coefficients.put(feature, AnalysisEngine.correlation(dataset, target, feature));
            }
            if (json) {
                printJson(out, coefficients);
            } else {
                out.printf("  Correlations with %s%n", target);
                coefficients.forEach((feature, r) -> out.printf("  %-35s r = %s%n", feature, number(r, 3)));
            }
            return EXIT_OK;
        }

        CorrelationMatrix matrix = AnalysisEngine.correlationMatrix(dataset, features);
        if (json) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("features", matrix.featureNames());
            result.put("completeRows", matrix.completeRows());
            result.put("coefficients", matrix.toArray());
            printJson(out, result);
            return EXIT_OK;
        }
        out.printf("  %d complete rows%n", matrix.completeRows());
        out.printf("  %-30s", "");
        for (int j = 0; j < matrix.size(); j++) {
            out.printf(" %8s", "[" + j + "]");
        }
        out.println();
        for (int i = 0; i < matrix.size(); i++) {
            out.printf("  %-30s", "[" + i + "] " + abbreviate(matrix.featureNames().get(i), 26));
            for (int j = 0; j < matrix.size(); j++) {
                out.printf(" %8s", number(matrix.get(i, j), 3));
            }
            out.println();
        }
        return EXIT_OK;
    }

    private static String abbreviate(String name, int width) {
        return name.length() <= width ? name : name.substring(0, width - 1) + "…";
    }
}
