package io.netstab.engine.metrics;

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


import io.netstab.engine.generate.InteractionWeighter;
import io.netstab.engine.generate.RandomGenerators;
import io.netstab.engine.generate.RandomTopologyGenerator;
import io.netstab.engine.matrix.BipartiteMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class WeightedNodfTest {

    private final WeightedNodf nodf = new WeightedNodf();

    /// Upper-left triangle whose weights strictly decrease along rows and columns.
    private static BipartiteMatrix perfectlyNested(int n) {
        double[][] values = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n - i; j++) {
                values[i][j] = (n - i) * (n - j);
            }
        }
        return new BipartiteMatrix(values);
    }

    @Test
    @Tag("accuracy")
    void perfectNestingScoresMaximum() {
        NestednessResult result = nodf.compute(perfectlyNested(4));
        assertEquals(100.0, result.rows(), 1e-9);
        assertEquals(100.0, result.columns(), 1e-9);
        assertEquals(100.0, result.combined(), 1e-9);
    }

    @Test
    void equalWeightsScoreZero() {
        // a binary triangle is nested in topology but no weight strictly decreases
        NestednessResult result = nodf.compute(perfectlyNested(4).binarize().toWeighted());
        assertEquals(0.0, result.combined(), 1e-12);
    }

    @Test
    void equalDegreesNeverScore() {
        BipartiteMatrix diagonal = new BipartiteMatrix(new double[][]{
            {3.0, 0.0, 0.0},
            {0.0, 2.0, 0.0},
            {0.0, 0.0, 1.0}
        });
        assertEquals(0.0, nodf.compute(diagonal).combined(), 1e-12);
    }

    @Test
    void partialOverlapScoresProportionally() {
        // row 0 has degree 3, row 1 degree 2; only column 0 of row 1 is below row 0
        BipartiteMatrix m = new BipartiteMatrix(new double[][]{
            {5.0, 1.0, 1.0},
            {2.0, 3.0, 0.0}
        });
        NestednessResult result = nodf.compute(m);
        assertEquals(50.0, result.rows(), 1e-9);
    }

    @Test
    void degenerateNetworksAreUndefined() {
        assertTrue(Double.isNaN(nodf.compute(BipartiteMatrix.zeros(3, 5)).combined()));
        BipartiteMatrix complete = new BipartiteMatrix(new double[][]{{1.0, 2.0}, {3.0, 4.0}});
        assertFalse(nodf.compute(complete).isDefined());
    }

    @Test
    void randomNetworksStayInRange() {
        UniformRandomProvider rng = RandomGenerators.create(2024L);
        RandomTopologyGenerator topology = new RandomTopologyGenerator();
        InteractionWeighter weighter = new InteractionWeighter();
        for (int trial = 0; trial < 50; trial++) {
            BipartiteMatrix m = weighter.weight(topology.generate(8, 16, 0.3, rng), rng);
            double score = nodf.compute(m).combined();
            if (!Double.isNaN(score)) {
                assertTrue(score >= 0.0 && score <= 100.0, "nestedness out of range: " + score);
            }
        }
    }
}
