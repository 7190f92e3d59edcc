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

import io.tabstats.dataset.FeatureValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entity's full row.
 *
 * @param row the row position in the dataset
 * @param identityNames the header names of the two identity columns
 * @param entityName the entity name
 * @param categoryLabel the category label
 * @param features every feature name mapped to the entity's cell, in header order
 */
public record EntityRecord(
    int row,
    List<String> identityNames,
    String entityName,
    String categoryLabel,
    Map<String, FeatureValue> features
) {

    public EntityRecord {
        identityNames = List.copyOf(identityNames);
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    /**
     * Returns the cell for a feature.
     *
     * @return the cell, or {@link FeatureValue#MISSING} if the feature is unknown
     */
    public FeatureValue feature(String name) {
        return features.getOrDefault(name, FeatureValue.MISSING);
    }

    /**
     * Flattens the record into header name to value, identity columns first.
     *
     * <p>Identity columns map to their strings, features to their {@link FeatureValue}.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(identityNames.get(0), entityName);
        map.put(identityNames.get(1), categoryLabel);
        map.putAll(features);
        return Collections.unmodifiableMap(map);
    }
}
