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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeatureMatrixTest {

    private final FeatureMatrix matrix = FeatureMatrix.of(List.of(
        new FeatureValue[]{FeatureValue.of(1.0), FeatureValue.MISSING},
        new FeatureValue[]{FeatureValue.of(2.0), FeatureValue.of(5.0)},
        new FeatureValue[]{FeatureValue.of(3.0), FeatureValue.of(5.0)}), 2);

    @Test
    void shapeAndCells() {
        assertThat(matrix.rowCount()).isEqualTo(3);
        assertThat(matrix.columnCount()).isEqualTo(2);
        assertThat(matrix.get(1, 1)).isEqualTo(FeatureValue.of(5.0));
        assertThat(matrix.isMissing(0, 1)).isTrue();
        assertThat(matrix.valueOrNaN(0, 1)).isNaN();
    }

    @Test
    void presentValuesSkipMissingCells() {
        assertThat(matrix.presentValues(0)).containsExactly(1.0, 2.0, 3.0);
        assertThat(matrix.presentValues(1)).containsExactly(5.0, 5.0);
    }

    @Test
    void selectRowsKeepsMissingness() {
        FeatureMatrix selected = matrix.selectRows(new int[]{2, 0});

        assertThat(selected.rowCount()).isEqualTo(2);
        assertThat(selected.get(0, 0)).isEqualTo(FeatureValue.of(3.0));
        assertThat(selected.isMissing(1, 1)).isTrue();
    }

    @Test
    void rowReturnsCopy() {
        FeatureValue[] row = matrix.row(0);
        row[0] = FeatureValue.of(42.0);

        assertThat(matrix.get(0, 0)).isEqualTo(FeatureValue.of(1.0));
    }

    @Test
    void rejectsRaggedRows() {
        assertThatThrownBy(() -> FeatureMatrix.of(List.<FeatureValue[]>of(new FeatureValue[]{FeatureValue.MISSING}), 2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void boundsAreChecked() {
        assertThatThrownBy(() -> matrix.get(3, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> matrix.presentValues(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
