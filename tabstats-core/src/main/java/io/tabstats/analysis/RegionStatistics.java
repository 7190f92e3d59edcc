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

import java.util.Comparator;

/**
 * Statistics of one feature within one category label (region).
 *
 * @param region the category label shared by the group
 * @param mean mean of the group's non-missing values
 * @param median median of the group's non-missing values
 * @param stdDev population standard deviation of the group's non-missing values
 * @param count number of non-missing values in the group, always at least 1
 */
public record RegionStatistics(String region, double mean, double median, double stdDev, long count) {

    /** Highest mean first, ties broken by region label. */
    public static final Comparator<RegionStatistics> BY_MEAN_DESCENDING =
        Comparator.comparingDouble(RegionStatistics::mean).reversed()
            .thenComparing(RegionStatistics::region);

    static RegionStatistics of(String region, FeatureStatistics stats) {
        return new RegionStatistics(region, stats.mean(), stats.median(), stats.stdDev(), stats.count());
    }
}
