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

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable rows x columns matrix of {@link FeatureValue} cells.
 *
 * <p>Cells are stored row-major in a flat {@code double[]}, with a {@link BitSet}
 * marking the missing ones. Nothing is exposed that would allow mutation, so a
 * matrix may be shared freely between threads once built.
 */
public final class FeatureMatrix {

    private final int rowCount;
    private final int columnCount;
    private final double[] cells;
    private final BitSet missing;

    private FeatureMatrix(int rowCount, int columnCount, double[] cells, BitSet missing) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.cells = cells;
        this.missing = missing;
    }

    /**
     * Builds a matrix from rows of cells.
     *
     * @param rows the rows, each exactly {@code columnCount} long
     * @param columnCount the number of columns
     * @return the matrix
     * @throws IllegalArgumentException if a row has the wrong width
     */
    public static FeatureMatrix of(List<FeatureValue[]> rows, int columnCount) {
        Objects.requireNonNull(rows, "rows cannot be null");
        if (columnCount < 0) {
            throw new IllegalArgumentException("columnCount must be non-negative: " + columnCount);
        }
        int rowCount = rows.size();
        double[] cells = new double[rowCount * columnCount];
        BitSet missing = new BitSet(cells.length);
        for (int r = 0; r < rowCount; r++) {
            FeatureValue[] row = rows.get(r);
            if (row.length != columnCount) {
                throw new IllegalArgumentException(
                    String.format("Row %d has %d cells, expected %d", r, row.length, columnCount));
            }
            for (int c = 0; c < columnCount; c++) {
                int offset = r * columnCount + c;
                FeatureValue cell = Objects.requireNonNull(row[c], "cell cannot be null");
                if (cell.isMissing()) {
                    missing.set(offset);
                    cells[offset] = Double.NaN;
                } else {
                    cells[offset] = cell.value();
                }
            }
        }
        return new FeatureMatrix(rowCount, columnCount, cells, missing);
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columnCount;
    }

    /**
     * Returns the cell at the given position.
     */
    public FeatureValue get(int row, int column) {
        int offset = offset(row, column);
        return missing.get(offset) ? FeatureValue.MISSING : FeatureValue.of(cells[offset]);
    }

    public boolean isMissing(int row, int column) {
        return missing.get(offset(row, column));
    }

    /**
     * Returns the raw cell value, NaN where the cell is missing.
     */
    public double valueOrNaN(int row, int column) {
        return cells[offset(row, column)];
    }

    /**
     * Returns a copy of one row.
     */
    public FeatureValue[] row(int row) {
        FeatureValue[] values = new FeatureValue[columnCount];
        for (int c = 0; c < columnCount; c++) {
            values[c] = get(row, c);
        }
        return values;
    }

    /**
     * Returns the non-missing values of a column in row order.
     */
    public double[] presentValues(int column) {
        checkColumn(column);
        double[] values = new double[rowCount];
        int n = 0;
        for (int r = 0; r < rowCount; r++) {
            int offset = r * columnCount + column;
            if (!missing.get(offset)) {
                values[n++] = cells[offset];
            }
        }
        return n == values.length ? values : Arrays.copyOf(values, n);
    }

    /**
     * Returns a new matrix holding the given rows, in the given order.
     */
    public FeatureMatrix selectRows(int[] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        double[] selected = new double[rows.length * columnCount];
        BitSet selectedMissing = new BitSet(selected.length);
        for (int i = 0; i < rows.length; i++) {
            checkRow(rows[i]);
            int from = rows[i] * columnCount;
            System.arraycopy(cells, from, selected, i * columnCount, columnCount);
            for (int c = 0; c < columnCount; c++) {
                if (missing.get(from + c)) {
                    selectedMissing.set(i * columnCount + c);
                }
            }
        }
        return new FeatureMatrix(rows.length, columnCount, selected, selectedMissing);
    }

    private int offset(int row, int column) {
        checkRow(row);
        checkColumn(column);
        return row * columnCount + column;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
        }
    }

    private void checkColumn(int column) {
        if (column < 0 || column >= columnCount) {
            throw new IndexOutOfBoundsException("Column " + column + " out of range [0, " + columnCount + ")");
        }
    }

    @Override
    public String toString() {
        return "FeatureMatrix{" + rowCount + "x" + columnCount + ", missing=" + missing.cardinality() + "}";
    }
}
