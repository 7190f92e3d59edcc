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

import io.tabstats.dataset.Dataset;
import io.tabstats.dataset.DatasetLoader;
import io.tabstats.dataset.UnknownFeatureException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class CorrelationMatrixTest {

    private static final Dataset DATA = DatasetLoader.fromRecords(List.of(
        List.of("n", "r", "x", "up", "down", "flat", "gappy"),
        List.of("a", "r", "1", "2", "10", "7", "1"),
        List.of("b", "r", "2", "4", "8", "7", ""),
        List.of("c", "r", "3", "6", "6", "7", "2"),
        List.of("d", "r", "4", "8", "4", "7", "")));

    @Test
    public void testPerfectCorrelations() {
        CorrelationMatrix m = AnalysisEngine.correlationMatrix(DATA, List.of("x", "up", "down"));

        assertEquals(3, m.size());
        assertEquals(4, m.completeRows());
        assertEquals(1.0, m.get(0, 0), 1e-12);
        assertEquals(1.0, m.get("x", "up"), 1e-12);
        assertEquals(-1.0, m.get("x", "down"), 1e-12);
        assertEquals(-1.0, m.get("up", "down"), 1e-12);
    }

    @Test
    public void testSymmetricAndBounded() {
        Random random = new Random(12345);
        List<List<String>> records = new ArrayList<>();
        records.add(List.of("n", "r", "a", "b", "c"));
        for (int i = 0; i < 200; i++) {
            double a = random.nextGaussian();
            double b = a * 0.5 + random.nextGaussian();
            records.add(List.of("e" + i, "r", Double.toString(a), Double.toString(b),
                i % 7 == 0 ? "" : Double.toString(random.nextDouble())));
        }
        Dataset dataset = DatasetLoader.fromRecords(records);

        double[][] m = AnalysisEngine.correlationMatrix(dataset, List.of("a", "b", "c")).toArray();
        for (int i = 0; i < 3; i++) {
            assertEquals(1.0, m[i][i], 0.0);
            for (int j = 0; j < 3; j++) {
                assertThat(m[i][j]).isBetween(-1.0, 1.0);
                assertEquals(m[i][j], m[j][i], 0.0);
            }
        }
        assertThat(m[0][1]).isGreaterThan(0.2);
    }

    @Test
    public void testRowsWithAnyMissingCellAreDropped() {
        CorrelationMatrix m = AnalysisEngine.correlationMatrix(DATA, List.of("x", "gappy"));

        assertEquals(2, m.completeRows());
        assertEquals(1.0, m.get(0, 1), 1e-12);
    }

    @Test
    public void testSingleFeatureIsIdentity() {
        for (String feature : DATA.featureNames()) {
            double[][] m = AnalysisEngine.correlationMatrix(DATA, List.of(feature)).toArray();
            assertThat(m).isDeepEqualTo(new double[][]{{1.0}});
        }
    }

    @Test
    public void testConstantColumnIsUndefined() {
        CorrelationMatrix m = AnalysisEngine.correlationMatrix(DATA, List.of("x", "flat"));

        assertThat(m.get(0, 1)).isNaN();
        assertThat(m.get(1, 0)).isNaN();
        assertEquals(1.0, m.get(1, 1), 0.0);
    }

    @Test
    public void testNoCompleteRowsIsAllNaN() {
        Dataset sparse = DatasetLoader.fromRecords(List.of(
            List.of("n", "r", "p", "q"),
            List.of("a", "r", "1", ""),
            List.of("b", "r", "", "2")));

        CorrelationMatrix m = AnalysisEngine.correlationMatrix(sparse, List.of("p", "q"));

        assertEquals(0, m.completeRows());
        for (double[] row : m.toArray()) {
            for (double v : row) {
                assertThat(v).isNaN();
            }
        }
    }

    @Test
    public void testPairwiseCorrelation() {
        assertEquals(-1.0, AnalysisEngine.correlation(DATA, "up", "down"), 1e-12);
        assertThat(AnalysisEngine.correlation(DATA, "up", "flat")).isNaN();
    }

    @Test
    public void testArgumentChecks() {
        assertThatThrownBy(() -> AnalysisEngine.correlationMatrix(DATA, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisEngine.correlationMatrix(DATA, List.of("x", "nope")))
            .isInstanceOf(UnknownFeatureException.class);
        CorrelationMatrix m = AnalysisEngine.correlationMatrix(DATA, List.of("x"));
        assertThatThrownBy(() -> m.get("x", "up"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
