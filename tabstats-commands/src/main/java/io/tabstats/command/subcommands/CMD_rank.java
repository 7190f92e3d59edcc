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
import io.tabstats.analysis.RankedEntity;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.List;

import static io.tabstats.command.common.ReportFormat.number;

/// Rank entities by a feature, highest first unless `--bottom` is given.
@CommandLine.Command(
    name = "rank",
    header = "Rank entities by a feature",
    description = "Lists the entities with the highest (or, with --bottom, lowest) values of a feature. "
        + "Entities with missing values are skipped; ties keep file order.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown feature"})
public class CMD_rank extends AbstractDatasetCommand {

    @CommandLine.Parameters(description = "Feature to rank by", arity = "1")
    private String feature;

    @CommandLine.Option(names = {"-n", "--limit"}, description = "Number of entities to list (default: ${DEFAULT-VALUE})",
        defaultValue = "10")
    private int limit;

    @CommandLine.Option(names = {"-b", "--bottom"}, description = "List the lowest values instead of the highest")
    private boolean bottom = false;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        if (limit < 0) {
            System.err.printf("Error: --limit must be non-negative, got %d%n", limit);
            return EXIT_INPUT_ERROR;
        }
        List<RankedEntity> ranked = bottom
            ? AnalysisEngine.bottomN(dataset, feature, limit)
            : AnalysisEngine.topN(dataset, feature, limit);

        if (json) {
            printJson(out, ranked);
            return EXIT_OK;
        }
        int position = 1;
        for (RankedEntity entity : ranked) {
            out.printf("  %2d. %-30s %s%n", position++, entity.entityName(), number(entity.value(), 3));
        }
        return EXIT_OK;
    }
}
