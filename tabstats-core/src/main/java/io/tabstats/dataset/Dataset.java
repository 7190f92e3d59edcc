package io.tabstats.dataset;

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

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/// An immutable table of entities, one row each, with two identity columns and a
/// matrix of numeric features.
///
/// ## Invariants
///
/// - entity names, category labels and matrix rows all have the same length and order
/// - feature names and matrix columns have the same length and order
/// - the column index covers exactly the identity names and the feature names
///
/// Entity names are not required to be unique; lookups by name take the first match.
///
/// A dataset has no mutators. Every query in `io.tabstats.analysis` reads it and
/// returns new values, so a dataset can be read from several threads at once.
public final class Dataset {

    private final List<String> entityNames;
    private final List<String> categoryLabels;
    private final FeatureMatrix matrix;
    private final ColumnIndex columnIndex;

    /// Creates a dataset, validating the shape invariants.
    ///
    /// @param columnIndex the header index, which also names the features
    /// @param entityNames one name per row
    /// @param categoryLabels one label per row
    /// @param matrix the numeric cells, one row per entity and one column per feature
    public Dataset(ColumnIndex columnIndex, List<String> entityNames, List<String> categoryLabels,
                   FeatureMatrix matrix) {
        this.columnIndex = Objects.requireNonNull(columnIndex, "columnIndex cannot be null");
        this.entityNames = List.copyOf(entityNames);
        this.categoryLabels = List.copyOf(categoryLabels);
        this.matrix = Objects.requireNonNull(matrix, "matrix cannot be null");

        if (this.entityNames.size() != this.categoryLabels.size()
            || this.entityNames.size() != matrix.rowCount()) {
            throw new IllegalArgumentException(String.format(
                "Row count mismatch: %d entity names, %d category labels, %d matrix rows",
                this.entityNames.size(), this.categoryLabels.size(), matrix.rowCount()));
        }
        if (columnIndex.featureCount() != matrix.columnCount()) {
            throw new IllegalArgumentException(String.format(
                "Column count mismatch: %d feature names, %d matrix columns",
                columnIndex.featureCount(), matrix.columnCount()));
        }
    }

    public List<String> entityNames() {
        return entityNames;
    }

    public List<String> categoryLabels() {
        return categoryLabels;
    }

    public List<String> featureNames() {
        return columnIndex.featureNames();
    }

    /// @return the two identity column names from the header, entity name first
    public List<String> identityNames() {
        return columnIndex.identityNames();
    }

    public FeatureMatrix matrix() {
        return matrix;
    }

    public ColumnIndex columnIndex() {
        return columnIndex;
    }

    public int rowCount() {
        return matrix.rowCount();
    }

    public int featureCount() {
        return matrix.columnCount();
    }

    public String entityName(int row) {
        return entityNames.get(row);
    }

    public String categoryLabel(int row) {
        return categoryLabels.get(row);
    }

    /// Finds the first row whose entity name equals the given name exactly.
    public OptionalInt rowOf(String entityName) {
        int row = entityNames.indexOf(entityName);
        return row < 0 ? OptionalInt.empty() : OptionalInt.of(row);
    }

    /// Returns one cell by row and feature name.
    ///
    /// @throws UnknownFeatureException if the feature does not exist
    public FeatureValue value(int row, String featureName) {
        return matrix.get(row, columnIndex.resolve(featureName));
    }

    @Override
    public String toString() {
        return "Dataset{" + rowCount() + " entities, " + featureCount() + " features}";
    }
}
