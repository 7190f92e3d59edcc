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
import io.tabstats.analysis.EntityRecord;
import io.tabstats.analysis.FeatureStatistics;
import io.tabstats.analysis.Outlier;
import io.tabstats.analysis.RankedEntity;
import io.tabstats.analysis.RegionStatistics;
import io.tabstats.command.common.AbstractDatasetCommand;
import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.FeatureValue;
import picocli.CommandLine;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static io.tabstats.command.common.ReportFormat.BANNER;
import static io.tabstats.command.common.ReportFormat.RULE;
import static io.tabstats.command.common.ReportFormat.capitalize;
import static io.tabstats.command.common.ReportFormat.number;

/// Print the fixed exploratory report over a dataset.
///
/// Every option defaults to the World Happiness Report 2020 layout, so running
/// `tabstats report` next to `WHR20_DataForFigure2.1.csv` prints the standard report:
///
/// 1. basic statistics of the target feature
/// 2. top and 3. bottom entities by the target feature
/// 4. per-region means, highest first
/// 5. correlation of each factor with the target feature
/// 6. one entity's record and percentile rank
/// 7. outliers on a second feature
@CommandLine.Command(
    name = "report",
    header = "Print the exploratory report",
    description = "Prints statistics, rankings, regional comparison, correlations, one entity's profile "
        + "and outliers for a dataset.",
    exitCodeList = {"0: success", "1: error reading input", "2: unknown feature"})
public class CMD_report extends AbstractDatasetCommand {

    static final List<String> DEFAULT_FACTORS = List.of(
        "Logged GDP per capita",
        "Social support",
        "Healthy life expectancy",
        "Freedom to make life choices",
        "Generosity",
        "Perceptions of corruption");

    @CommandLine.Option(names = {"--title"}, defaultValue = "World Happiness Report Data Analysis",
        description = "Report title (default: ${DEFAULT-VALUE})")
    private String title;

    @CommandLine.Option(names = {"-f", "--feature"}, defaultValue = "Ladder score",
        description = "Target feature (default: ${DEFAULT-VALUE})")
    private String feature;

    @CommandLine.Option(names = {"-e", "--entity"}, defaultValue = "India",
        description = "Entity to profile (default: ${DEFAULT-VALUE})")
    private String entity;

    @CommandLine.Option(names = {"--outlier-feature"}, defaultValue = "Logged GDP per capita",
        description = "Feature to scan for outliers (default: ${DEFAULT-VALUE})")
    private String outlierFeature;

    @CommandLine.Option(names = {"--factor"},
        description = "Feature to correlate with the target; repeatable (default: the six WHR explanatory factors)")
    private List<String> factors = new ArrayList<>();

    @CommandLine.Option(names = {"-n", "--limit"}, defaultValue = "10",
        description = "Entities in the top and bottom lists (default: ${DEFAULT-VALUE})")
    private int limit;

    @CommandLine.Option(names = {"-t", "--threshold"}, defaultValue = "2.0",
        description = "Outlier z-score threshold (default: ${DEFAULT-VALUE})")
    private double threshold;

    @CommandLine.Option(names = {"--outlier-limit"}, defaultValue = "5",
        description = "Outliers to list (default: ${DEFAULT-VALUE})")
    private int outlierLimit;

    @Override
    protected int run(Dataset dataset, PrintStream out) {
        if (limit < 0 || outlierLimit < 0) {
            System.err.printf("Error: --limit and --outlier-limit must be non-negative, got %d and %d%n",
                limit, outlierLimit);
            return EXIT_INPUT_ERROR;
        }
        List<String> correlated = factors.isEmpty() ? DEFAULT_FACTORS : factors;
        if (json) {
            printJson(out, collect(dataset, correlated));
            return EXIT_OK;
        }

        out.printf("Loaded data: %d entities, %d features%n", dataset.rowCount(), dataset.featureCount());
        out.println();
        out.println(BANNER);
        out.println(title.toUpperCase(Locale.ROOT));
        out.println(BANNER);

        section(out, 1, "Basic statistics for " + feature);
        FeatureStatistics stats = AnalysisEngine.basicStatistics(dataset, feature);
        out.printf("  Mean: %s%n", number(stats.mean(), 4));
        out.printf("  Median: %s%n", number(stats.median(), 4));
        out.printf("  Std: %s%n", number(stats.stdDev(), 4));
        out.printf("  Min: %s%n", number(stats.min(), 4));
        out.printf("  Max: %s%n", number(stats.max(), 4));
        out.printf("  Count: %d%n", stats.count());

        section(out, 2, "Top " + limit + " by " + feature);
        printRanking(out, AnalysisEngine.topN(dataset, feature, limit));

        section(out, 3, "Bottom " + limit + " by " + feature);
        printRanking(out, AnalysisEngine.bottomN(dataset, feature, limit));

        section(out, 4, feature + " by region");
        for (RegionStatistics group : byMean(dataset)) {
            out.printf("  %-35s Mean: %s (±%s)%n", group.region(),
                number(group.mean(), 3), number(group.stdDev(), 3));
        }

        section(out, 5, "Correlation analysis");
        out.printf("  Analyzing correlations with %s...%n", feature);
        for (Map.Entry<String, Double> factor : correlations(dataset, correlated).entrySet()) {
            out.printf("  %-35s r = %s%n", factor.getKey(), number(factor.getValue(), 3));
        }

        section(out, 6, "Detailed data for " + entity);
        Optional<EntityRecord> record = AnalysisEngine.findEntity(dataset, entity);
        if (record.isPresent()) {
            EntityRecord r = record.get();
            out.printf("  %s: %s%n", capitalize(r.identityNames().get(0)), r.entityName());
            out.printf("  %s: %s%n", capitalize(r.identityNames().get(1)), r.categoryLabel());
            for (Map.Entry<String, FeatureValue> cell : r.features().entrySet()) {
                if (cell.getKey().equals(feature) || correlated.contains(cell.getKey())) {
                    out.printf("  %s: %s%n", cell.getKey(), number(cell.getValue(), 3));
                }
            }
            out.printf("  Percentile rank: %s%%%n",
                number(AnalysisEngine.percentileRank(dataset, entity, feature), 1));
        } else {
            out.printf("  No entity named %s%n", entity);
        }

        section(out, 7, "Outlier detection for " + outlierFeature);
        List<Outlier> outliers = AnalysisEngine.findOutliers(dataset, outlierFeature, threshold);
        if (outliers.isEmpty()) {
            out.println("  No outliers found");
        } else {
            out.printf("  Found %d outliers:%n", outliers.size());
            for (Outlier outlier : outliers.subList(0, Math.min(outlierLimit, outliers.size()))) {
                out.printf("  %-30s Value: %s, Z-score: %s%n",
                    outlier.entityName(), number(outlier.value(), 3), number(outlier.zScore(), 2));
            }
        }

        out.println();
        out.println(BANNER);
        return EXIT_OK;
    }

    private List<RegionStatistics> byMean(Dataset dataset) {
        List<RegionStatistics> groups = new ArrayList<>(AnalysisEngine.compareRegions(dataset, feature));
        groups.sort(RegionStatistics.BY_MEAN_DESCENDING);
        return groups;
    }

    // A factor with no row shared with the target is left out
    private Map<String, Double> correlations(Dataset dataset, List<String> correlated) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (String factor : correlated) {
            CorrelationMatrix pair = AnalysisEngine.correlationMatrix(dataset, List.of(feature, factor));
            if (pair.completeRows() > 0) {
                result.put(factor, pair.get(0, 1));
            }
        }
        return result;
    }

    private Map<String, Object> collect(Dataset dataset, List<String> correlated) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("entities", dataset.rowCount());
        report.put("features", dataset.featureCount());
        report.put("statistics", AnalysisEngine.basicStatistics(dataset, feature));
        report.put("top", AnalysisEngine.topN(dataset, feature, limit));
        report.put("bottom", AnalysisEngine.bottomN(dataset, feature, limit));
        report.put("regions", byMean(dataset));
        report.put("correlations", correlations(dataset, correlated));
        Map<String, Object> profile = new LinkedHashMap<>(AnalysisEngine.getEntityRecord(dataset, entity));
        if (!profile.isEmpty()) {
            profile.put("percentileRank", AnalysisEngine.percentileRank(dataset, entity, feature));
        }
        report.put("entity", profile);
        report.put("outliers", AnalysisEngine.findOutliers(dataset, outlierFeature, threshold));
        return report;
    }

    private static void section(PrintStream out, int number, String heading) {
        out.println();
        out.printf("%d. %s%n", number, heading.toUpperCase(Locale.ROOT));
        out.println(RULE);
    }

    private static void printRanking(PrintStream out, List<RankedEntity> ranked) {
        int position = 1;
        for (RankedEntity entity : ranked) {
            out.printf("  %2d. %-30s %s%n", position++, entity.entityName(), number(entity.value(), 3));
        }
    }
}
