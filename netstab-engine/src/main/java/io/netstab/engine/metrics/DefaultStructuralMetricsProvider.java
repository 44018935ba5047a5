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

import io.netstab.engine.matrix.BipartiteMatrix;
import org.apache.commons.rng.UniformRandomProvider;

/**
 * Structural metrics backed by {@link WeightedNodf} and {@link BipartiteModularity}.
 */
public final class DefaultStructuralMetricsProvider implements StructuralMetricsProvider {

    private final WeightedNodf nestedness;
    private final BipartiteModularity modularity;

    public DefaultStructuralMetricsProvider() {
        this(BipartiteModularity.DEFAULT_RESTARTS);
    }

    /**
     * @param modularityRestarts random restarts of the modularity search
     */
    public DefaultStructuralMetricsProvider(int modularityRestarts) {
        this.nestedness = new WeightedNodf();
        this.modularity = new BipartiteModularity(modularityRestarts);
    }

    @Override
    public double computeNestedness(BipartiteMatrix matrix) {
        return nestedness.compute(matrix).combined();
    }

    @Override
    public double computeModularity(BipartiteMatrix matrix, boolean quantitative, UniformRandomProvider rng) {
        return modularity.compute(matrix, quantitative, rng).q();
    }

    public NestednessResult nestednessDetail(BipartiteMatrix matrix) {
        return nestedness.compute(matrix);
    }

    public ModularityResult modularityDetail(BipartiteMatrix matrix, boolean quantitative, UniformRandomProvider rng) {
        return modularity.compute(matrix, quantitative, rng);
    }
}
