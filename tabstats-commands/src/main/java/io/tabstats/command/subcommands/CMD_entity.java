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
import io.tabstats.analysis.EntityRecord;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.FeatureValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static io.tabstats.command.common.ReportFormat.number;

/// Show one entity's full record, optionally with its percentile rank on a feature.
@CommandLine.Command(
    name = "entity",
    header = "Show one entity's record",
    description = "Prints every field of the named entity's row. "
        + "With --percentile, also prints the entity's percentile rank on that feature.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown entity or feature"})
public class CMD_entity extends AbstractDatasetCommand {

    private static final Logger logger = LogManager.getLogger(CMD_entity.class);

    @CommandLine.Parameters(description = "Entity name, matched exactly", arity = "1")
    private String name;

    @CommandLine.Option(names = {"-p", "--percentile"}, description = "Feature to compute the percentile rank on")
    private String percentileFeature;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        Optional<EntityRecord> found = AnalysisEngine.findEntity(dataset, name);
        if (found.isEmpty()) {
            logger.error("No entity named '{}' in {}", name, datasetFile.getInputPath());
            return EXIT_UNKNOWN_NAME;
        }
        EntityRecord record = found.get();
        Double percentile = percentileFeature == null
            ? null
            : AnalysisEngine.percentileRank(dataset, name, percentileFeature);

        if (json) {
            Map<String, Object> result = new LinkedHashMap<>(record.asMap());
            if (percentile != null) {
                result.put("percentileRank", Map.of(percentileFeature, percentile));
            }
            printJson(out, result);
            return EXIT_OK;
        }

        out.printf("  %s: %s%n", record.identityNames().get(0), record.entityName());
        out.printf("  %s: %s%n", record.identityNames().get(1), record.categoryLabel());
        for (Map.Entry<String, FeatureValue> feature : record.features().entrySet()) {
            out.printf("  %s: %s%n", feature.getKey(), number(feature.getValue(), 3));
        }
        if (percentile != null) {
            out.printf("  Percentile rank (%s): %s%%%n", percentileFeature, number(percentile, 1));
        }
        return EXIT_OK;
    }
}
