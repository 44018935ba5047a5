package io.netstab.engine.matrix;

/*
 * Copyright (c) netstab
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


import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class BipartiteMatrixTest {

    @Test
    void sumsAndConnectance() {
        BipartiteMatrix m = new BipartiteMatrix(new double[][]{
            {0.5, 0.0, 0.25},
            {0.0, 0.0, 0.25}
        });

        assertEquals(2, m.plantCount());
        assertEquals(3, m.animalCount());
        assertEquals(0.75, m.rowSum(0), 1e-12);
        assertEquals(0.5, m.columnSum(2), 1e-12);
        assertEquals(1.0, m.total(), 1e-12);
        assertEquals(3, m.linkCount());
        assertEquals(0.5, m.connectance(), 1e-12);
    }

    @Test
    void binarizeMarksPositiveCells() {
        BipartiteMatrix m = new BipartiteMatrix(new double[][]{{0.3, 0.0}, {0.0, 2.0}});
        BinaryBipartiteMatrix b = m.binarize();

        assertTrue(b.isLinked(0, 0));
        assertFalse(b.isLinked(0, 1));
        assertEquals(1, b.plantDegree(1));
        assertEquals(1, b.animalDegree(0));
        assertEquals(2, b.linkCount());
    }

    @Test
    void transposeSwapsRoles() {
        BipartiteMatrix m = new BipartiteMatrix(new double[][]{{1.0, 2.0, 3.0}});
        BipartiteMatrix t = m.transpose();

        assertEquals(3, t.plantCount());
        assertEquals(1, t.animalCount());
        assertEquals(2.0, t.get(1, 0));
        assertEquals(m, t.transpose());
    }

    @Test
    void constructorCopiesInput() {
        double[][] values = {{1.0, 0.0}};
        BipartiteMatrix m = new BipartiteMatrix(values);
        values[0][0] = 7.0;
        m.toArray()[0][1] = 9.0;

        assertEquals(1.0, m.get(0, 0));
        assertEquals(0.0, m.get(0, 1));
    }

    @Test
    void rejectsInvalidShapesAndEntries() {
        assertThrows(IllegalArgumentException.class, () -> new BipartiteMatrix(new double[0][0]));
        assertThrows(IllegalArgumentException.class, () -> new BipartiteMatrix(new double[][]{{1.0}, {1.0, 2.0}}));
        assertThrows(IllegalArgumentException.class, () -> new BipartiteMatrix(new double[][]{{-0.1}}));
        assertThrows(IllegalArgumentException.class, () -> new BipartiteMatrix(new double[][]{{Double.NaN}}));
    }

    @Test
    void emptyAndCompleteTopologies() {
        assertTrue(BipartiteMatrix.zeros(3, 4).binarize().isEmpty());
        BinaryBipartiteMatrix full = new BinaryBipartiteMatrix(new boolean[][]{{true, true}, {true, true}});
        assertTrue(full.isComplete());
        assertEquals(1.0, full.connectance());
        assertEquals(full, full.toWeighted().binarize());
    }
}
