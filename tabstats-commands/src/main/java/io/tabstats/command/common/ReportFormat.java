package io.tabstats.command.common;

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

import java.util.Locale;

/**
 * Text formatting shared by the report commands.
 */
public final class ReportFormat {

    public static final String BANNER = "=".repeat(80);
    public static final String RULE = "-".repeat(60);
    public static final String NOT_AVAILABLE = "n/a";

    private ReportFormat() {
    }

    /**
     * Formats a number with a fixed count of decimals, or n/a for NaN.
     */
    public static String number(double value, int decimals) {
        if (Double.isNaN(value)) {
            return NOT_AVAILABLE;
        }
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    public static String number(FeatureValue value, int decimals) {
        return value.isMissing() ? NOT_AVAILABLE : number(value.value(), decimals);
    }

    /**
     * Capitalizes the first letter of a label.
     */
    public static String capitalize(String label) {
        if (label.isEmpty()) {
            return label;
        }
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
    }
}
