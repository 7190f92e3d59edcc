package io.tabstats.command;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.tabstats.analysis.AnalysisEngine;
import io.tabstats.analysis.Outlier;
import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.DatasetLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("tabstats subcommands")
class CMD_tabstatsTest {

    @TempDir
    Path tempDir;

    private Path csv;
    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void setUp() throws IOException {
        csv = WhrFixture.write(tempDir);
        originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    private int run(String... args) {
        List<String> all = new ArrayList<>(List.of(args));
        all.add("--input");
        all.add(csv.toString());
        return new CommandLine(new CMD_tabstats()).execute(all.toArray(new String[0]));
    }

    private String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    private JsonElement json() {
        return JsonParser.parseString(output());
    }

    @Test
    @DisplayName("no subcommand prints usage")
    void usage() {
        int exitCode = new CommandLine(new CMD_tabstats()).execute();

        assertThat(exitCode).isZero();
        assertThat(output()).contains("report", "stats", "rank", "regions", "correlate", "entity", "outliers");
    }

    @Nested
    @DisplayName("stats")
    class Stats {

        @Test
        void textTable() {
            assertThat(run("stats", "Ladder score", "Social support")).isZero();
            assertThat(output()).contains("Ladder score").contains("Social support").contains("     9");
        }

        @Test
        void allAsJson() {
            assertThat(run("stats", "--all", "--json")).isZero();
            JsonArray stats = json().getAsJsonArray();
            assertThat(stats).hasSize(7);
            JsonObject social = stats.get(1).getAsJsonObject();
            assertThat(social.get("feature").getAsString()).isEqualTo("Social support");
            assertThat(social.get("count").getAsInt()).isEqualTo(9);
        }

        @Test
        void unknownFeature() {
            assertThat(run("stats", "Happiness")).isEqualTo(2);
        }

        @Test
        void nothingSelected() {
            assertThat(run("stats")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("rank")
    class Rank {

        @Test
        void top() {
            assertThat(run("rank", "Ladder score", "-n", "2")).isZero();
            assertThat(output()).contains("1. Finland").contains("2. Denmark").doesNotContain("3.");
        }

        @Test
        void bottomSkipsMissing() {
            assertThat(run("rank", "Social support", "--bottom", "--limit", "20", "--json")).isZero();
            JsonArray ranked = json().getAsJsonArray();
            assertThat(ranked).hasSize(9);
            assertThat(ranked.get(0).getAsJsonObject().get("entityName").getAsString()).isEqualTo("Afghanistan");
        }
    }

    @Nested
    @DisplayName("regions")
    class Regions {

        @Test
        void byMean() {
            assertThat(run("regions", "Ladder score", "--json")).isZero();
            JsonArray groups = json().getAsJsonArray();
            assertThat(groups).hasSize(4);
            assertThat(groups.get(0).getAsJsonObject().get("region").getAsString()).isEqualTo("Western Europe");
            assertThat(groups.get(3).getAsJsonObject().get("region").getAsString()).isEqualTo("South Asia");
        }

        @Test
        void byName() {
            assertThat(run("regions", "Ladder score", "--by-name", "--json")).isZero();
            assertThat(json().getAsJsonArray().get(0).getAsJsonObject().get("region").getAsString())
                .isEqualTo("Central and Eastern Europe");
        }

        @Test
        void members() {
            assertThat(run("regions", "--members", "Sub-Saharan Africa")).isZero();
            assertThat(output()).contains("Sub-Saharan Africa: 2 entities")
                .contains("Congo (Brazzaville)").contains("Chad");
        }
    }

    @Nested
    @DisplayName("correlate")
    class Correlate {

        @Test
        void matrix() {
            assertThat(run("correlate", "Ladder score", "Logged GDP per capita", "Social support", "--json")).isZero();
            JsonObject result = json().getAsJsonObject();
            assertThat(result.get("completeRows").getAsInt()).isEqualTo(9);
            JsonArray rows = result.getAsJsonArray("coefficients");
            assertThat(rows.get(0).getAsJsonArray().get(0).getAsDouble()).isEqualTo(1.0);
            assertThat(rows.get(0).getAsJsonArray().get(1).getAsDouble()).isGreaterThan(0.5);
        }

        @Test
        void againstTarget() {
            assertThat(run("correlate", "Generosity", "Healthy life expectancy", "--target", "Ladder score")).isZero();
            assertThat(output()).contains("Correlations with Ladder score").contains("Generosity").contains("r = ");
        }
    }

    @Nested
    @DisplayName("entity")
    class Entity {

        @Test
        void recordWithPercentile() {
            assertThat(run("entity", "Kosovo", "--percentile", "Ladder score")).isZero();
            assertThat(output())
                .contains("Country name: Kosovo")
                .contains("Regional indicator: Central and Eastern Europe")
                .contains("Ladder score: 6.325")
                .contains("Percentile rank (Ladder score): 50.0%");
        }

        @Test
        void missingCellIsNullInJson() {
            assertThat(run("entity", "Congo (Brazzaville)", "--json")).isZero();
            JsonObject record = json().getAsJsonObject();
            assertThat(record.get("Social support").isJsonNull()).isTrue();
            assertThat(record.get("Logged GDP per capita").getAsDouble()).isEqualTo(8.4);
        }

        @Test
        void unknownEntity() {
            assertThat(run("entity", "Atlantis")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("outliers")
    class Outliers {

        @Test
        void matchesEngine() throws IOException {
            Dataset dataset = new DatasetLoader().load(csv);
            List<Outlier> expected = AnalysisEngine.findOutliers(dataset, "Healthy life expectancy", 1.5);

            assertThat(run("outliers", "Healthy life expectancy", "--threshold", "1.5", "--json")).isZero();
            JsonArray outliers = json().getAsJsonArray();
            assertThat(outliers).hasSize(expected.size());
            for (int i = 0; i < expected.size(); i++) {
                assertThat(outliers.get(i).getAsJsonObject().get("entityName").getAsString())
                    .isEqualTo(expected.get(i).entityName());
            }
        }

        @Test
        void textSummary() {
            assertThat(run("outliers", "Logged GDP per capita")).isZero();
            assertThat(output()).contains("Found ").contains(" outliers:");
        }
    }
}
