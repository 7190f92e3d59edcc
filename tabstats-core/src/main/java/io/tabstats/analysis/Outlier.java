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

/**
 * An entity whose value lies unusually far from the feature mean.
 *
 * @param entityName the entity name
 * @param value the entity's value
 * @param zScore {@code |value - mean| / stdDev} over the feature's non-missing values
 */
public record Outlier(String entityName, double value, double zScore) {
}
