package io.netstab.engine.generate;

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


import io.netstab.engine.SimulationParameterException;
import io.netstab.engine.matrix.BinaryBipartiteMatrix;
import io.netstab.engine.matrix.BipartiteMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class InteractionWeighterTest {

    private final InteractionWeighter weighter = new InteractionWeighter();

    @Test
    void simplexSumsToOne() {
        double[][] draws = weighter.drawSimplex(9, 17, RandomGenerators.create(5L));
        double sum = 0.0;
        for (double[] row : draws) {
            for (double v : row) {
                assertThat(v).isGreaterThanOrEqualTo(0.0);
                sum += v;
            }
        }
        assertThat(sum).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void weightsOnlyLinkedCells() {
        BinaryBipartiteMatrix topology = new RandomTopologyGenerator()
            .generate(8, 16, 0.3, RandomGenerators.create(11L));
        BipartiteMatrix weighted = weighter.weight(topology, RandomGenerators.create(12L));

        for (int i = 0; i < topology.plantCount(); i++) {
            for (int j = 0; j < topology.animalCount(); j++) {
                if (topology.isLinked(i, j)) {
                    assertTrue(weighted.get(i, j) > 0.0, "linked cell must carry weight");
                } else {
                    assertEquals(0.0, weighted.get(i, j));
                }
            }
        }
        assertEquals(topology, weighted.binarize());
        assertThat(weighted.total()).isLessThanOrEqualTo(1.0 + 1e-12);
    }

    @Test
    void emptyTopologyStaysUnweighted() {
        BinaryBipartiteMatrix empty = new BinaryBipartiteMatrix(new boolean[3][4]);
        BipartiteMatrix weighted = weighter.weight(empty, RandomGenerators.create(3L));
        assertEquals(0.0, weighted.total());
    }

    @Test
    void sameSeedGivesSameWeights() {
        BinaryBipartiteMatrix topology = new RandomTopologyGenerator()
            .generate(5, 12, 0.5, RandomGenerators.create(1L));
        assertEquals(weighter.weight(topology, RandomGenerators.create(2L)),
            weighter.weight(topology, RandomGenerators.create(2L)));
    }

    @Test
    void rejectsNonPositiveRate() {
        SimulationParameterException e = assertThrows(SimulationParameterException.class,
            () -> new InteractionWeighter(0.0));
        assertEquals("exponential_rate", e.getParameter());
        assertThrows(SimulationParameterException.class, () -> new InteractionWeighter(Double.POSITIVE_INFINITY));
    }
}
