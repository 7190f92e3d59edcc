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

import java.util.Arrays;
import java.util.List;

/// Pearson correlation coefficients between an ordered list of features.
///
/// Entry `(i, j)` correlates feature `i` with feature `j` over the complete-case rows,
/// which are the rows with no missing cell in any of the listed features.
///
/// - the matrix is symmetric and its values lie in `[-1, 1]`
/// - the diagonal is `1.0` whenever at least one complete row exists
/// - an entry pairing a feature that is constant over the complete rows is `NaN`
/// - with no complete rows every entry is `NaN`
public final class CorrelationMatrix {

    private final List<String> featureNames;
    private final double[][] coefficients;
    private final int completeRows;

    CorrelationMatrix(List<String> featureNames, double[][] coefficients, int completeRows) {
        this.featureNames = List.copyOf(featureNames);
        this.coefficients = coefficients;
        this.completeRows = completeRows;
    }

    /// Computes the matrix from complete-case columns.
    ///
    /// @param featureNames names for the columns, in order
    /// @param columns `columns[f][r]` is the value of feature `f` in complete row `r`
    static CorrelationMatrix compute(List<String> featureNames, double[][] columns) {
        int dims = columns.length;
        int n = dims == 0 ? 0 : columns[0].length;
        double[][] corr = new double[dims][dims];

        if (n == 0) {
            for (double[] row : corr) {
                Arrays.fill(row, Double.NaN);
            }
            return new CorrelationMatrix(featureNames, corr, 0);
        }

        double[] means = new double[dims];
        for (int d = 0; d < dims; d++) {
            double sum = 0;
            for (double v : columns[d]) {
                sum += v;
            }
            means[d] = sum / n;
        }

        // Sums of squared deviations; the 1/n factors cancel out of r
        double[] ss = new double[dims];
        for (int d = 0; d < dims; d++) {
            double acc = 0;
            for (double v : columns[d]) {
                double diff = v - means[d];
                acc += diff * diff;
            }
            ss[d] = acc;
        }

        for (int i = 0; i < dims; i++) {
            corr[i][i] = 1.0;
            for (int j = i + 1; j < dims; j++) {
                double cov = 0;
                for (int r = 0; r < n; r++) {
                    cov += (columns[i][r] - means[i]) * (columns[j][r] - means[j]);
                }
                double r = (ss[i] > 0 && ss[j] > 0)
                    ? cov / Math.sqrt(ss[i] * ss[j])
                    : Double.NaN;
                if (!Double.isNaN(r)) {
                    r = Math.max(-1.0, Math.min(1.0, r));
                }
                corr[i][j] = r;
                corr[j][i] = r;
            }
        }
        return new CorrelationMatrix(featureNames, corr, n);
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public int size() {
        return featureNames.size();
    }

    /// @return the number of complete-case rows the coefficients were computed over
    public int completeRows() {
        return completeRows;
    }

    public double get(int i, int j) {
        return coefficients[i][j];
    }

    /// Looks up a coefficient by feature names, using the first position of each name.
    ///
    /// @throws IllegalArgumentException if either name is not part of this matrix
    public double get(String a, String b) {
        return coefficients[position(a)][position(b)];
    }

    /// @return a copy of the coefficients
    public double[][] toArray() {
        double[][] copy = new double[coefficients.length][];
        for (int i = 0; i < coefficients.length; i++) {
            copy[i] = coefficients[i].clone();
        }
        return copy;
    }

    private int position(String name) {
        int position = featureNames.indexOf(name);
        if (position < 0) {
            throw new IllegalArgumentException("Feature '" + name + "' is not in this matrix: " + featureNames);
        }
        return position;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CorrelationMatrix").append(featureNames)
            .append(" over ").append(completeRows).append(" rows");
        for (double[] row : coefficients) {
            sb.append(System.lineSeparator()).append(Arrays.toString(row));
        }
        return sb.toString();
    }
}
