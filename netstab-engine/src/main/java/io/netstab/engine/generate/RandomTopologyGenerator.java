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
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Objects;

/// Draws random bipartite topologies with a target connectance.
///
/// Every one of the P·A cells is an independent Bernoulli trial with success probability c,
/// visited in row-major order. The realized density is itself random; read it back with
/// [BinaryBipartiteMatrix#connectance()].
///
/// ## Edge cases
///
/// - c = 0 always yields the empty network
/// - c = 1 always yields the complete network
public final class RandomTopologyGenerator {

    /// Draws a P × A presence/absence matrix.
    ///
    /// @param plants number of plant species (rows), positive
    /// @param animals number of animal species (columns), positive
    /// @param connectance link probability in [0,1]
    /// @param rng the random source for this trial
    /// @return the drawn topology
    /// @throws SimulationParameterException if an argument is out of range
    public BinaryBipartiteMatrix generate(int plants, int animals, double connectance, UniformRandomProvider rng) {
        SimulationParameterException.requirePositive("plants", plants);
        SimulationParameterException.requirePositive("animals", animals);
        SimulationParameterException.requireProbability("connectance", connectance);
        Objects.requireNonNull(rng, "rng cannot be null");

        boolean[][] links = new boolean[plants][animals];
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                // nextDouble() is in [0,1), so c=0 never links and c=1 always does
                links[i][j] = rng.nextDouble() < connectance;
            }
        }
        return new BinaryBipartiteMatrix(links);
    }
}
