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

/// Thrown when a feature name does not resolve to a numeric column of a dataset.
public class UnknownFeatureException extends RuntimeException {

    private final String featureName;

    public UnknownFeatureException(String featureName) {
        super(String.format("Unknown feature column: '%s'", featureName));
        this.featureName = featureName;
    }

    public UnknownFeatureException(String featureName, String reason) {
        super(String.format("Unknown feature column: '%s' (%s)", featureName, reason));
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }
}
