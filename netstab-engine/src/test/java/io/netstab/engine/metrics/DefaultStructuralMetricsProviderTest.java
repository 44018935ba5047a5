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


import io.netstab.engine.generate.RandomGenerators;
import io.netstab.engine.matrix.BinaryBipartiteMatrix;
import io.netstab.engine.matrix.BipartiteMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DefaultStructuralMetricsProviderTest {

    private final DefaultStructuralMetricsProvider provider = new DefaultStructuralMetricsProvider(4);

    @Test
    void scalarMetricsMatchDetail() {
        BipartiteMatrix m = new BipartiteMatrix(new double[][]{
            {0.4, 0.2, 0.1},
            {0.2, 0.1, 0.0},
            {0.1, 0.0, 0.0}
        });
        assertEquals(provider.nestednessDetail(m).combined(), provider.computeNestedness(m));
        assertEquals(provider.modularityDetail(m, true, RandomGenerators.create(8L)).q(),
            provider.computeModularity(m, true, RandomGenerators.create(8L)));
    }

    @Test
    void degenerateNetworksReturnUndefined() {
        BipartiteMatrix empty = BipartiteMatrix.zeros(2, 2);
        assertTrue(Double.isNaN(provider.computeNestedness(empty)));
        assertTrue(Double.isNaN(provider.computeModularity(empty, false)));
        assertTrue(StructuralMetricsProvider.isDegenerate(new BinaryBipartiteMatrix(new boolean[][]{{true}})));
    }
}
