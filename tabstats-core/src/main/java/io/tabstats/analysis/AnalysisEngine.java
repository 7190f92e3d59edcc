package io.tabstats.analysis;

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
import io.tabstats.dataset.FeatureMatrix;
import io.tabstats.dataset.FeatureValue;
import io.tabstats.dataset.UnknownEntityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.TreeSet;

/// Read-only analytical queries over a [Dataset].
///
/// Every method takes the dataset it reads as an argument and keeps no reference to it.
/// Nothing here mutates a dataset, so queries may run concurrently against one instance.
///
/// ## Missing values
///
/// Missing cells are excluded before anything is computed. Where no values remain the
/// result carries `NaN` (statistics, correlations, percentile ranks) or is empty
/// (rankings, groups, outliers). Undefined numbers are returned, never thrown.
///
/// ## Name resolution
///
/// Feature names resolve through [io.tabstats.dataset.ColumnIndex#resolve(String)] and
/// an unknown one raises [io.tabstats.dataset.UnknownFeatureException]. Entity names are
/// matched exactly through [Dataset#rowOf(String)], first match winning. An absent entity
/// yields an empty result from [#findEntity(Dataset, String)] and
/// [#getEntityRecord(Dataset, String)], and an [UnknownEntityException] from
/// [#percentileRank(Dataset, String, String)], which has no empty form.
///
/// ## Outliers on constant features
///
/// When every present value of a feature is equal, the standard deviation is zero and a
/// z-score is undefined. [#findOutliers(Dataset, String, double)] reports no outliers for
/// such a feature, whatever the threshold.
public final class AnalysisEngine {

    private static final Logger logger = LogManager.getLogger(AnalysisEngine.class);

    public static final double DEFAULT_OUTLIER_THRESHOLD = 2.0;

    private AnalysisEngine() {
        // Utility class
    }

    /// Computes mean, median, standard deviation, min, max and count of a feature.
    ///
    /// @return the statistics, all `NaN` with a count of 0 if the feature has no values
    public static FeatureStatistics basicStatistics(Dataset dataset, String feature) {
        int column = dataset.columnIndex().resolve(feature);
        return FeatureStatistics.compute(feature, dataset.matrix().presentValues(column));
    }

    /// Returns the `n` entities with the highest values of a feature, highest first.
    ///
    /// Entities with equal values keep their dataset row order. Fewer than `n` entries
    /// are returned when fewer values are present.
    public static List<RankedEntity> topN(Dataset dataset, String feature, int n) {
        return ranked(dataset, feature, n, Comparator.comparingDouble(RankedEntity::value).reversed());
    }

    /// Returns the `n` entities with the lowest values of a feature, lowest first.
    ///
    /// Entities with equal values keep their dataset row order. Fewer than `n` entries
    /// are returned when fewer values are present.
    public static List<RankedEntity> bottomN(Dataset dataset, String feature, int n) {
        return ranked(dataset, feature, n, Comparator.comparingDouble(RankedEntity::value));
    }

    private static List<RankedEntity> ranked(Dataset dataset, String feature, int n,
                                             Comparator<RankedEntity> order) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        int column = dataset.columnIndex().resolve(feature);
        FeatureMatrix matrix = dataset.matrix();
        List<RankedEntity> entries = new ArrayList<>();
        for (int row = 0; row < matrix.rowCount(); row++) {
            if (!matrix.isMissing(row, column)) {
                entries.add(new RankedEntity(dataset.entityName(row), matrix.valueOrNaN(row, column)));
            }
        }
        // List.sort is stable, which keeps ties in row order
        entries.sort(order);
        return List.copyOf(entries.subList(0, Math.min(n, entries.size())));
    }

    /// Selects the entities whose category label equals `region` exactly, in row order.
    ///
    /// @return the matching entities and rows, empty when nothing matches
    public static RegionSlice filterByRegion(Dataset dataset, String region) {
        Objects.requireNonNull(region, "region cannot be null");
        List<String> names = new ArrayList<>();
        List<Integer> rows = new ArrayList<>();
        for (int row = 0; row < dataset.rowCount(); row++) {
            if (region.equals(dataset.categoryLabel(row))) {
                names.add(dataset.entityName(row));
                rows.add(row);
            }
        }
        int[] selected = rows.stream().mapToInt(Integer::intValue).toArray();
        return new RegionSlice(region, names, dataset.matrix().selectRows(selected));
    }

    /// Returns the distinct category labels of a dataset in lexicographic order.
    public static List<String> regions(Dataset dataset) {
        return List.copyOf(new TreeSet<>(dataset.categoryLabels()));
    }

    /// Computes the Pearson correlation matrix of the given features.
    ///
    /// Rows with a missing cell in any of the given features are left out of every entry.
    ///
    /// @param features the features, in the order of the matrix rows and columns
    /// @return the correlation matrix, see [CorrelationMatrix] for its undefined cases
    public static CorrelationMatrix correlationMatrix(Dataset dataset, List<String> features) {
        Objects.requireNonNull(features, "features cannot be null");
        if (features.isEmpty()) {
            throw new IllegalArgumentException("At least one feature is required for a correlation matrix");
        }
        int[] columns = new int[features.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = dataset.columnIndex().resolve(features.get(i));
        }

        FeatureMatrix matrix = dataset.matrix();
        List<Integer> complete = new ArrayList<>();
        for (int row = 0; row < matrix.rowCount(); row++) {
            if (isComplete(matrix, row, columns)) {
                complete.add(row);
            }
        }

        double[][] values = new double[columns.length][complete.size()];
        for (int r = 0; r < complete.size(); r++) {
            int row = complete.get(r);
            for (int f = 0; f < columns.length; f++) {
                values[f][r] = matrix.valueOrNaN(row, columns[f]);
            }
        }
        logger.debug("Correlating {} over {} of {} rows", features, complete.size(), matrix.rowCount());
        return CorrelationMatrix.compute(features, values);
    }

    /// Correlates two features over the rows where both are present.
    ///
    /// @return the Pearson coefficient, `NaN` if undefined
    public static double correlation(Dataset dataset, String featureA, String featureB) {
        return correlationMatrix(dataset, List.of(featureA, featureB)).get(0, 1);
    }

    private static boolean isComplete(FeatureMatrix matrix, int row, int[] columns) {
        for (int column : columns) {
            if (matrix.isMissing(row, column)) {
                return false;
            }
        }
        return true;
    }

    /// Computes statistics of a feature for each category label.
    ///
    /// Groups are ordered by label. Labels with no present value of the feature are left
    /// out. Use [RegionStatistics#BY_MEAN_DESCENDING] to order groups by mean instead.
    public static List<RegionStatistics> compareRegions(Dataset dataset, String feature) {
        int column = dataset.columnIndex().resolve(feature);
        FeatureMatrix matrix = dataset.matrix();

        Map<String, List<Double>> groups = new TreeMap<>();
        for (int row = 0; row < matrix.rowCount(); row++) {
            List<Double> group = groups.computeIfAbsent(dataset.categoryLabel(row), k -> new ArrayList<>());
            if (!matrix.isMissing(row, column)) {
                group.add(matrix.valueOrNaN(row, column));
            }
        }

        List<RegionStatistics> results = new ArrayList<>();
        for (Map.Entry<String, List<Double>> entry : groups.entrySet()) {
            double[] values = entry.getValue().stream().mapToDouble(Double::doubleValue).toArray();
            if (values.length == 0) {
                logger.trace("Region '{}' has no values for '{}'", entry.getKey(), feature);
                continue;
            }
            results.add(RegionStatistics.of(entry.getKey(), FeatureStatistics.compute(feature, values)));
        }
        return List.copyOf(results);
    }

    /// Finds outliers with the default threshold of [#DEFAULT_OUTLIER_THRESHOLD].
    public static List<Outlier> findOutliers(Dataset dataset, String feature) {
        return findOutliers(dataset, feature, DEFAULT_OUTLIER_THRESHOLD);
    }

    /// Finds entities whose z-score for a feature exceeds a threshold.
    ///
    /// Mean and standard deviation are taken over the present values. An entity is
    /// reported, in row order, when `|value - mean| / stdDev > threshold`. A feature
    /// whose present values are all equal yields no outliers.
    public static List<Outlier> findOutliers(Dataset dataset, String feature, double threshold) {
        int column = dataset.columnIndex().resolve(feature);
        FeatureMatrix matrix = dataset.matrix();
        FeatureStatistics stats = FeatureStatistics.compute(feature, matrix.presentValues(column));

        if (stats.isEmpty()) {
            return List.of();
        }
        if (stats.isConstant()) {
            logger.debug("Feature '{}' is constant over {} values; z-scores are undefined", feature, stats.count());
            return List.of();
        }

        List<Outlier> outliers = new ArrayList<>();
        for (int row = 0; row < matrix.rowCount(); row++) {
            if (matrix.isMissing(row, column)) {
                continue;
            }
            double value = matrix.valueOrNaN(row, column);
            double z = Math.abs(value - stats.mean()) / stats.stdDev();
            if (z > threshold) {
                outliers.add(new Outlier(dataset.entityName(row), value, z));
            }
        }
        return List.copyOf(outliers);
    }

    /// Looks up an entity's full row by exact name, first match winning.
    ///
    /// @return the record, or empty if no entity has that name
    public static Optional<EntityRecord> findEntity(Dataset dataset, String entityName) {
        OptionalInt found = dataset.rowOf(entityName);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        int row = found.getAsInt();
        FeatureMatrix matrix = dataset.matrix();
        List<String> featureNames = dataset.featureNames();
        Map<String, FeatureValue> features = new LinkedHashMap<>();
        for (int c = 0; c < featureNames.size(); c++) {
            features.put(featureNames.get(c), matrix.get(row, c));
        }
        return Optional.of(new EntityRecord(row, dataset.identityNames(), dataset.entityName(row),
            dataset.categoryLabel(row), features));
    }

    /// Returns an entity's row as header name to value, or an empty map if the entity
    /// does not exist.
    ///
    /// @see EntityRecord#asMap()
    public static Map<String, Object> getEntityRecord(Dataset dataset, String entityName) {
        return findEntity(dataset, entityName).map(EntityRecord::asMap).orElse(Map.of());
    }

    /// Computes the percentage of present values of a feature strictly below an entity's value.
    ///
    /// Tied values do not count as below, so the minimum ranks at 0 and a maximum shared by
    /// `k` of `N` entities ranks at `100 * (N - k) / N`.
    ///
    /// @return the percentile rank in `[0, 100)`, or `NaN` if the entity's value is missing
    /// @throws UnknownEntityException if no entity has the given name
    public static double percentileRank(Dataset dataset, String entityName, String feature) {
        int column = dataset.columnIndex().resolve(feature);
        int row = dataset.rowOf(entityName).orElseThrow(() -> new UnknownEntityException(entityName));
        FeatureMatrix matrix = dataset.matrix();
        if (matrix.isMissing(row, column)) {
            return Double.NaN;
        }
        double value = matrix.valueOrNaN(row, column);
        double[] present = matrix.presentValues(column);
        long below = 0;
        for (double v : present) {
            if (v < value) {
                below++;
            }
        }
        return 100.0 * below / present.length;
    }
}
