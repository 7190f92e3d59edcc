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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Builds a [Dataset] from delimited text.
///
/// ## Record layout
///
/// The first record is the header: two identity column names, then the feature names.
/// Every later record is a data row:
///
/// | field | becomes |
/// |-------|---------|
/// | 0 | entity name |
/// | 1 | category label |
/// | 2.. | one [FeatureValue] per feature, parsed with [FeatureValue#parse(String)] |
///
/// ## Tolerance
///
/// Loading is lenient about data rows and strict about the header:
///
/// - rows with [ColumnIndex#IDENTITY_COLUMN_COUNT] fields or fewer are dropped
/// - unparseable numeric fields become [FeatureValue#MISSING]
/// - rows narrower than the header are padded with missing cells; extra fields are ignored
/// - a source with no records, or a header without feature columns, is a [DatasetFormatException]
///
/// Read failures propagate as [IOException].
public final class DatasetLoader {

    private static final Logger logger = LogManager.getLogger(DatasetLoader.class);

    public static final char DEFAULT_DELIMITER = ',';

    private static final int BYTE_ORDER_MARK = '\uFEFF';

    private final char delimiter;

    public DatasetLoader() {
        this(DEFAULT_DELIMITER);
    }

    public DatasetLoader(char delimiter) {
        this.delimiter = delimiter;
    }

    /// Loads a UTF-8 encoded file.
    ///
    /// @param path the file to read
    /// @return the loaded dataset
    /// @throws IOException if the file cannot be opened or read
    public Dataset load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        logger.debug("Loading dataset from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Dataset dataset = load(reader);
            logger.debug("Loaded {} from {}", dataset, path);
            return dataset;
        }
    }

    /// Loads from an open reader, which is read to the end and closed.
    public Dataset load(Reader reader) throws IOException {
        return fromRecords(readRecords(reader, delimiter));
    }

    /// Splits delimited text into records of raw field strings.
    ///
    /// Fields follow the RFC 4180 rules of [CSVFormat#DEFAULT]: double quotes may enclose
    /// delimiters, line breaks and doubled quotes. Blank lines are skipped, and a leading
    /// byte order mark is not part of the first field.
    ///
    /// @param reader the source, closed once read
    /// @param delimiter the field separator
    /// @return every record in source order
    /// @throws IllegalArgumentException if the delimiter is the quote character or a line break
    public static List<List<String>> readRecords(Reader reader, char delimiter) throws IOException {
        Objects.requireNonNull(reader, "reader cannot be null");
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter).build();
        BufferedReader buffered = new BufferedReader(reader);
        buffered.mark(1);
        if (buffered.read() != BYTE_ORDER_MARK) {
            buffered.reset();
        }
        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = format.parse(buffered)) {
            for (CSVRecord record : parser) {
                records.add(record.toList());
            }
        } catch (UncheckedIOException e) {
            // the parser's iterator wraps read failures
            throw e.getCause();
        }
        return records;
    }

    /// Builds a dataset from already-split records, header first.
    ///
    /// @param records the header record followed by data records
    /// @return the dataset
    /// @throws DatasetFormatException if there is no header, or the header has no features
    public static Dataset fromRecords(List<List<String>> records) {
        Objects.requireNonNull(records, "records cannot be null");
        if (records.isEmpty()) {
            throw new DatasetFormatException("Source has no records; a header row is required");
        }

        ColumnIndex columnIndex = ColumnIndex.fromHeader(records.get(0));
        int featureCount = columnIndex.featureCount();

        List<String> entityNames = new ArrayList<>();
        List<String> categoryLabels = new ArrayList<>();
        List<FeatureValue[]> rows = new ArrayList<>();
        int dropped = 0;

        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            if (record.size() <= ColumnIndex.IDENTITY_COLUMN_COUNT) {
                dropped++;
                continue;
            }
            int available = record.size() - ColumnIndex.IDENTITY_COLUMN_COUNT;
            if (available != featureCount) {
                logger.debug("Record {} has {} feature fields, header declares {}", i, available, featureCount);
            }

            entityNames.add(record.get(0));
            categoryLabels.add(record.get(1));

            FeatureValue[] row = new FeatureValue[featureCount];
            Arrays.fill(row, FeatureValue.MISSING);
            for (int c = 0; c < Math.min(available, featureCount); c++) {
                row[c] = FeatureValue.parse(record.get(c + ColumnIndex.IDENTITY_COLUMN_COUNT));
            }
            rows.add(row);
        }

        if (dropped > 0) {
            logger.debug("Dropped {} records with too few fields", dropped);
        }

        return new Dataset(columnIndex, entityNames, categoryLabels, FeatureMatrix.of(rows, featureCount));
    }
}
