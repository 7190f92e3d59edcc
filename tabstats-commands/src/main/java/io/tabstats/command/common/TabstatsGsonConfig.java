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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.tabstats.dataset.FeatureValue;

import java.io.IOException;

/// Gson configuration for the `--json` output of tabstats commands.
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | Enabled |
/// | HTML escaping | Disabled |
/// | NaN and infinities | Written as `NaN`, `Infinity`, `-Infinity` |
/// | [FeatureValue] | A number, or `null` when missing |
///
/// The [Gson] instance is thread-safe and shared.
public final class TabstatsGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private TabstatsGsonConfig() {
        // Utility class
    }

    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a new builder with tabstats defaults, for callers that need more settings
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .serializeNulls()
            .registerTypeAdapter(FeatureValue.class, new FeatureValueAdapter().nullSafe());
    }

    static final class FeatureValueAdapter extends TypeAdapter<FeatureValue> {

        @Override
        public void write(JsonWriter out, FeatureValue value) throws IOException {
            if (value.isMissing()) {
                out.nullValue();
            } else {
                out.value(value.value());
            }
        }

        @Override
        public FeatureValue read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return FeatureValue.MISSING;
            }
            return FeatureValue.of(in.nextDouble());
        }
    }
}
