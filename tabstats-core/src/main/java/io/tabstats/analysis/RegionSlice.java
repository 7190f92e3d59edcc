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

import io.tabstats.dataset.FeatureMatrix;

import java.util.List;

/**
 * The entities of a dataset carrying one category label, with their full numeric rows.
 *
 * @param region the category label that was matched
 * @param entityNames matching entity names, in dataset row order
 * @param rows the matching numeric rows, in the same order
 */
public record RegionSlice(String region, List<String> entityNames, FeatureMatrix rows) {

    public RegionSlice {
        entityNames = List.copyOf(entityNames);
    }

    public int size() {
        return entityNames.size();
    }

    public boolean isEmpty() {
        return entityNames.isEmpty();
    }
}
