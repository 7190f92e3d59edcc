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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.tabstats.analysis.AnalysisEngine;
import io.tabstats.command.subcommands.CMD_report;
import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.DatasetLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class CMD_reportTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOut() {
        originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOut() {
        System.setOut(originalOut);
    }

    private String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testDefaultReport() throws IOException {
        Path csv = WhrFixture.write(tempDir);

        int exitCode = new CommandLine(new CMD_report()).execute("--input", csv.toString());

        assertEquals(0, exitCode, "Report should exit with code 0");
        String output = output();
        assertThat(output)
            .contains("Loaded data: 10 entities, 7 features")
            .contains("WORLD HAPPINESS REPORT DATA ANALYSIS")
            .contains("1. BASIC STATISTICS FOR LADDER SCORE")
            .contains("  Count: 10")
            .contains("2. TOP 10 BY LADDER SCORE")
            .contains("   1. Finland")
            .contains("3. BOTTOM 10 BY LADDER SCORE")
            .contains("   1. Afghanistan")
            .contains("4. LADDER SCORE BY REGION")
            .contains("5. CORRELATION ANALYSIS")
            .contains("Perceptions of corruption")
            .contains("6. DETAILED DATA FOR INDIA")
            .contains("Country name: India")
            .contains("Regional indicator: South Asia")
            .contains("Percentile rank: 10.0%")
            .contains("7. OUTLIER DETECTION FOR LOGGED GDP PER CAPITA");
        assertThat(output).doesNotContain("Atlantis");
        assertThat(output.indexOf("Western Europe")).isLessThan(output.indexOf("Central and Eastern Europe"));
    }

    @Test
    public void testUnknownEntityIsReportedNotFailed() throws IOException {
        Path csv = WhrFixture.write(tempDir);

        int exitCode = new CommandLine(new CMD_report()).execute("--input", csv.toString(), "--entity", "Atlantis");

        assertEquals(0, exitCode);
        assertThat(output()).contains("No entity named Atlantis");
    }

    @Test
    public void testCustomFactorsAndLimit() throws IOException {
        Path csv = WhrFixture.write(tempDir);

        int exitCode = new CommandLine(new CMD_report()).execute("--input", csv.toString(),
            "--limit", "3", "--factor", "Generosity", "--factor", "Social support");

        assertEquals(0, exitCode);
        assertThat(output())
            .contains("2. TOP 3 BY LADDER SCORE")
            .doesNotContain("   4. ")
            .doesNotContain("Freedom to make life choices  ");
    }

    @Test
    public void testJsonReport() throws IOException {
        Path csv = WhrFixture.write(tempDir);

        int exitCode = new CommandLine(new CMD_report()).execute("--input", csv.toString(), "--json");

        assertEquals(0, exitCode);
        JsonObject report = JsonParser.parseString(output()).getAsJsonObject();
        assertEquals(10, report.get("entities").getAsInt());
        assertEquals(10, report.getAsJsonObject("statistics").get("count").getAsInt());
        assertEquals("Finland", report.getAsJsonArray("top").get(0).getAsJsonObject().get("entityName").getAsString());
        assertEquals(6, report.getAsJsonObject("correlations").size());
        assertEquals(10.0, report.getAsJsonObject("entity").get("percentileRank").getAsDouble(), 1e-9);
        assertThat(report.getAsJsonObject("entity").get("Social support").getAsDouble()).isEqualTo(0.5921);
    }

    @Test
    public void testCorrelationsSkipFactorsWithoutSharedRows() throws IOException {
        Path csv = tempDir.resolve("sparse.csv");
        Files.writeString(csv, String.join("\n",
            "Country name,Regional indicator,Ladder score,Unreported,Generosity",
            "A,R1,7.0,,0.1",
            "B,R1,6.0,,0.3",
            "C,R2,5.0,,0.2",
            "D,R2,4.0,,0.6") + "\n", StandardCharsets.UTF_8);

        int exitCode = new CommandLine(new CMD_report()).execute("--input", csv.toString(), "--json",
            "--entity", "A", "--outlier-feature", "Generosity",
            "--factor", "Unreported", "--factor", "Generosity");

        assertEquals(0, exitCode);
        JsonObject correlations = JsonParser.parseString(output()).getAsJsonObject().getAsJsonObject("correlations");
        assertThat(correlations.keySet()).containsExactly("Generosity");
        Dataset dataset = new DatasetLoader().load(csv);
        assertEquals(AnalysisEngine.correlation(dataset, "Ladder score", "Generosity"),
            correlations.get("Generosity").getAsDouble(), 1e-12);
    }

    @Test
    public void testNegativeLimitsAreRejected() throws IOException {
        Path csv = WhrFixture.write(tempDir);

        assertEquals(1, new CommandLine(new CMD_report()).execute("--input", csv.toString(), "--limit", "-1"));
        assertEquals(1, new CommandLine(new CMD_report()).execute("--input", csv.toString(), "--outlier-limit", "-2"));
        assertThat(output()).doesNotContain("BASIC STATISTICS");
    }

    @Test
    public void testUnknownFeatureExitCode() throws IOException {
        Path csv = WhrFixture.write(tempDir);

        int exitCode = new CommandLine(new CMD_report()).execute("--input", csv.toString(), "--feature", "Happiness");

        assertEquals(2, exitCode);
    }

    @Test
    public void testMissingInputExitCode() {
        int exitCode = new CommandLine(new CMD_report()).execute("--input", tempDir.resolve("absent.csv").toString());

        assertEquals(1, exitCode);
    }
}
