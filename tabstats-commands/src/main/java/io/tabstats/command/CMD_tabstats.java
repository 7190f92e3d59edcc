package io.tabstats.command;

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

import io.tabstats.command.subcommands.CMD_correlate;
import io.tabstats.command.subcommands.CMD_entity;
import io.tabstats.command.subcommands.CMD_outliers;
import io.tabstats.command.subcommands.CMD_rank;
import io.tabstats.command.subcommands.CMD_regions;
import io.tabstats.command.subcommands.CMD_report;
import io.tabstats.command.subcommands.CMD_stats;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The tabstats command line: exploratory statistics over a per-entity feature table.
///
/// This is an umbrella command; each analysis is a subcommand. Without a subcommand
/// the usage is printed.
@CommandLine.Command(name = "tabstats",
    header = "Explore per-entity feature tables",
    description = "Loads a delimited file with one row per entity (name, category label, numeric features) "
        + "and reports statistics, rankings, regional comparisons, correlations and outliers.",
    mixinStandardHelpOptions = true,
    version = "tabstats 0.1.0",
    subcommands = {
        CMD_report.class,
        CMD_stats.class,
        CMD_rank.class,
        CMD_regions.class,
        CMD_correlate.class,
        CMD_entity.class,
        CMD_outliers.class
    })
public class CMD_tabstats implements Callable<Integer> {

    /// Run tabstats
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_tabstats()).execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
