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
import org.apache.commons.rng.UniformRandomProvider;

/// Computes the structural metrics of a bipartite interaction network.
///
/// ## Contract
///
/// | Metric | Range | Undefined when |
/// |--------|-------|----------------|
/// | nestedness | [0, 100] | no links, or every cell linked |
/// | modularity | [0, 1] | no links, or every cell linked |
///
/// Undefined results are reported as [#UNDEFINED] (`Double.NaN`), never as an exception.
///
/// The simulation core depends only on this interface. [DefaultStructuralMetricsProvider]
/// implements it with from-scratch algorithms; other implementations may wrap a graph library.
public interface StructuralMetricsProvider {

    /// Sentinel returned for degenerate networks.
    double UNDEFINED = Double.NaN;

    /// Nestedness of the network, scaled to [0,100].
    ///
    /// @param matrix the weighted interaction matrix
    /// @return the nestedness score, or [#UNDEFINED]
    double computeNestedness(BipartiteMatrix matrix);

    /// Modularity of the best partition found, scaled to [0,1].
    ///
    /// @param matrix the weighted interaction matrix
    /// @param quantitative true to search on the weights, false to search on the binarized links
    /// @param rng random source for the partition search
    /// @return the modularity score, or [#UNDEFINED]
    double computeModularity(BipartiteMatrix matrix, boolean quantitative, UniformRandomProvider rng);

    /// Modularity using a fresh unseeded random source. Results may differ between calls.
    default double computeModularity(BipartiteMatrix matrix, boolean quantitative) {
        return computeModularity(matrix, quantitative, RandomGenerators.createUnseeded());
    }

    /// True when structural metrics are not defined for this topology.
    static boolean isDegenerate(BinaryBipartiteMatrix topology) {
        return topology.isEmpty() || topology.isComplete();
    }
}
