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

import java.util.Locale;
import java.util.NoSuchElementException;

/// A single numeric cell of a dataset, which either holds a real number or is [#MISSING].
///
/// Missing cells are kept distinct from `NaN`: a cell is never NaN, so any NaN seen by a
/// caller came out of a computation (for example statistics over zero values) rather than
/// out of the source data.
///
/// ## Parsing
///
/// [#parse(String)] is tolerant by contract. Blank, non-numeric and `nan` fields become
/// [#MISSING] instead of raising. Surrounding whitespace is ignored, and `inf`, `+inf`,
/// `-inf`, `infinity` (any case) are accepted as infinities. Underscores grouping digits,
/// as in `1_000.5`, are dropped; an underscore anywhere else makes the field missing.
public final class FeatureValue {

    /// The sentinel for "no valid numeric value recorded for this cell".
    public static final FeatureValue MISSING = new FeatureValue(Double.NaN, false);

    private final double value;
    private final boolean present;

    private FeatureValue(double value, boolean present) {
        this.value = value;
        this.present = present;
    }

    /// Wraps a present numeric value.
    ///
    /// @param value the value, which may be infinite but not NaN
    /// @return a present feature value
    /// @throws IllegalArgumentException if value is NaN
    public static FeatureValue of(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("A feature value cannot be NaN; use FeatureValue.MISSING");
        }
        return new FeatureValue(value, true);
    }

    /// Parses a raw text field into a feature value, never failing.
    ///
    /// @param field the raw field text, may be null
    /// @return the parsed value, or [#MISSING] if the field holds no usable number
    public static FeatureValue parse(String field) {
        if (field == null) {
            return MISSING;
        }
        String text = field.strip();
        if (text.isEmpty()) {
            return MISSING;
        }
        if (text.indexOf('_') >= 0) {
            if (!underscoresSeparateDigits(text)) {
                return MISSING;
            }
            text = text.replace("_", "");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "inf":
            case "+inf":
            case "infinity":
            case "+infinity":
                return new FeatureValue(Double.POSITIVE_INFINITY, true);
            case "-inf":
            case "-infinity":
                return new FeatureValue(Double.NEGATIVE_INFINITY, true);
            default:
                break;
        }
        // Double.parseDouble also takes type suffixes and hex floats, which are not data
        char last = lower.charAt(lower.length() - 1);
        if (last == 'd' || last == 'f' || lower.contains("0x")) {
            return MISSING;
        }
        try {
            double parsed = Double.parseDouble(text);
            return Double.isNaN(parsed) ? MISSING : new FeatureValue(parsed, true);
        } catch (NumberFormatException e) {
            return MISSING;
        }
    }

    // Digit grouping as in "1_000.5": each underscore sits between two digits
    private static boolean underscoresSeparateDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '_'
                && (i == 0 || i == text.length() - 1
                    || !Character.isDigit(text.charAt(i - 1)) || !Character.isDigit(text.charAt(i + 1)))) {
                return false;
            }
        }
        return true;
    }

    /// @return true if this cell has no value
    public boolean isMissing() {
        return !present;
    }

    /// @return true if this cell holds a value
    public boolean isPresent() {
        return present;
    }

    /// Returns the numeric value.
    ///
    /// @return the value
    /// @throws NoSuchElementException if this cell is missing
    public double value() {
        if (!present) {
            throw new NoSuchElementException("Feature value is missing");
        }
        return value;
    }

    /// @return the value, or NaN for a missing cell, for arithmetic that propagates missingness
    public double orNaN() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureValue)) return false;
        FeatureValue that = (FeatureValue) o;
        if (present != that.present) return false;
        return !present || Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return present ? Double.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return present ? Double.toString(value) : "MISSING";
    }
}
