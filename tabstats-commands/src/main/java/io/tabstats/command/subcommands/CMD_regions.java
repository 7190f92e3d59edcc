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
import io.tabstats.analysis.RegionSlice;
import io.tabstats.analysis.RegionStatistics;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static io.tabstats.command.common.ReportFormat.number;

/// Compare a feature across category labels, or list the members of one label.
@CommandLine.Command(
    name = "regions",
    header = "Compare a feature across regions",
    description = "Shows per-region statistics for a feature, ordered by descending mean. "
        + "With --members, lists the entities of one region instead.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown feature"})
public class CMD_regions extends AbstractDatasetCommand {

    @CommandLine.Parameters(description = "Feature to compare (not needed with --members)", arity = "0..1")
    private String feature;

    @CommandLine.Option(names = {"-m", "--members"}, description = "List the entities whose region is exactly this label")
    private String members;

    @CommandLine.Option(names = {"--by-name"}, description = "Order regions by name instead of by mean")
    private boolean byName = false;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        if (members != null) {
            RegionSlice slice = AnalysisEngine.filterByRegion(dataset, members);
            if (json) {
                printJson(out, slice.entityNames());
            } else {
                out.printf("%s: %d entities%n", members, slice.size());
                slice.entityNames().forEach(name -> out.printf("  %s%n", name));
            }
            return EXIT_OK;
        }
        if (feature == null) {
            System.err.println("Error: name a feature, or use --members");
            return EXIT_INPUT_ERROR;
        }

        List<RegionStatistics> groups = new ArrayList<>(AnalysisEngine.compareRegions(dataset, feature));
        if (!byName) {
            groups.sort(RegionStatistics.BY_MEAN_DESCENDING);
        }
        if (json) {
            printJson(out, groups);
            return EXIT_OK;
        }
        for (RegionStatistics group : groups) {
            out.printf("  %-35s Mean: %s (±%s)  n=%d%n", group.region(),
                number(group.mean(), 3), number(group.stdDev(), 3), group.count());
        }
        return EXIT_OK;
    }
}
