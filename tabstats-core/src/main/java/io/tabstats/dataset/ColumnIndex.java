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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/// Maps header names to their positions, and feature names to numeric matrix offsets.
///
/// The header of a source is laid out as [#IDENTITY_COLUMN_COUNT] identity columns
/// (entity name, category label) followed by the feature columns. The matrix only holds
/// the feature columns, so a feature's matrix offset is its header position shifted by
/// the identity column count. That translation lives in [#toMatrixOffset(int)] and
/// nowhere else.
///
/// Names are matched exactly and case-sensitively. A name that appears more than once
/// in the header resolves to its last position; every position still keeps its column
/// in the matrix and its entry in [#featureNames()].
public final class ColumnIndex {

    private static final Logger logger = LogManager.getLogger(ColumnIndex.class);

    /// Number of leading non-numeric header columns.
    public static final int IDENTITY_COLUMN_COUNT = 2;

    private final Map<String, Integer> headerPositions;
    private final List<String> identityNames;
    private final List<String> featureNames;

    private ColumnIndex(Map<String, Integer> headerPositions, List<String> identityNames, List<String> featureNames) {
        this.headerPositions = headerPositions;
        this.identityNames = identityNames;
        this.featureNames = featureNames;
    }

    /// Builds the index from a full header record.
    ///
    /// @param header identity column names followed by at least one feature name
    /// @return the index
    /// @throws DatasetFormatException if the header has no feature columns
    public static ColumnIndex fromHeader(List<String> header) {
        Objects.requireNonNull(header, "header cannot be null");
        if (header.size() <= IDENTITY_COLUMN_COUNT) {
            throw new DatasetFormatException(String.format(
                "Header must have more than %d fields (identity columns plus features), found %d: %s",
                IDENTITY_COLUMN_COUNT, header.size(), header));
        }
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = Objects.requireNonNull(header.get(i), "header name cannot be null");
            Integer previous = positions.put(name, i);
            if (previous != null) {
                logger.debug("Header name '{}' repeats at positions {} and {}; position {} is used for lookups",
                    name, previous, i, i);
            }
        }
        List<String> identity = List.copyOf(header.subList(0, IDENTITY_COLUMN_COUNT));
        List<String> features = List.copyOf(header.subList(IDENTITY_COLUMN_COUNT, header.size()));
        return new ColumnIndex(Collections.unmodifiableMap(positions), identity, features);
    }

    /// Translates a raw header position into a numeric matrix offset.
    ///
    /// @param headerPosition the 0-based position in the header record
    /// @return the column offset within the numeric matrix
    public static int toMatrixOffset(int headerPosition) {
        return headerPosition - IDENTITY_COLUMN_COUNT;
    }

    /// Resolves a feature name to its column offset in the numeric matrix.
    ///
    /// @param name the feature name, exactly as it appears in the header
    /// @return the matrix offset
    /// @throws UnknownFeatureException if the name is not a feature column
    public int resolve(String name) {
        Integer position = headerPositions.get(name);
        if (position == null) {
            throw new UnknownFeatureException(name);
        }
        if (position < IDENTITY_COLUMN_COUNT) {
            throw new UnknownFeatureException(name, "identity column has no numeric values");
        }
        return toMatrixOffset(position);
    }

    /// @return the raw header position of any header name, including identity columns
    public OptionalInt headerPosition(String name) {
        Integer position = headerPositions.get(name);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    public boolean isFeature(String name) {
        Integer position = headerPositions.get(name);
        return position != null && position >= IDENTITY_COLUMN_COUNT;
    }

    public List<String> identityNames() {
        return identityNames;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public int featureCount() {
        return featureNames.size();
    }

    @Override
    public String toString() {
        return "ColumnIndex" + headerPositions;
    }
}
