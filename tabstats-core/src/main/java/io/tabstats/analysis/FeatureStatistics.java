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

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Objects;

/**
 * Descriptive statistics of the non-missing values of one feature.
 *
 * <p>The standard deviation is the population form (divides by {@code count}).
 * When {@code count} is zero every numeric component is {@code NaN}.
 *
 * @param feature the feature name
 * @param mean arithmetic mean
 * @param median middle value, or the average of the two middle values
 * @param stdDev population standard deviation
 * @param min smallest value
 * @param max largest value
 * @param count number of non-missing values
 */
public record FeatureStatistics(
    String feature,
    double mean,
    double median,
    double stdDev,
    double min,
    double max,
    long count
) {

    /**
     * Computes statistics over values that are already free of missing cells.
     *
     * @param feature the feature name
     * @param values the present values, possibly empty
     * @return the statistics
     */
    public static FeatureStatistics compute(String feature, double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        long count = values.length;
        if (count == 0) {
            return new FeatureStatistics(feature, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);
        }

        // First pass: min, max, mean
        double min = values[0];
        double max = values[0];
        double sum = 0;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        // rounding in the sum can push the mean of near-equal values just outside [min, max]
        double mean = Math.max(min, Math.min(max, sum / count));

        // Second pass: squared deviations
        double m2 = 0;
        for (double v : values) {
            double diff = v - mean;
            m2 += diff * diff;
        }
        double stdDev = Math.sqrt(m2 / count);

        double median = new Median().evaluate(values);

        return new FeatureStatistics(feature, mean, median, stdDev, min, max, count);
    }

    /**
     * Returns true if no values were present.
     */
    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Returns true if all present values are equal, so that deviations from the mean are undefined.
     */
    public boolean isConstant() {
        return count > 0 && (min == max || stdDev == 0.0);
    }
}
