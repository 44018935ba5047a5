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
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.AhrensDieterExponentialSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;

import java.util.Arrays;
import java.util.Objects;

/// Assigns quantitative interaction strengths to an existing topology.
///
/// ## Algorithm
///
/// ```text
/// 1. draw x(i,j) ~ Exp(rate) for all P·A cells        (row-major)
/// 2. w(i,j) = x(i,j) / Σ x                            (simplex projection)
/// 3. w(i,j) = w(i,j) · link(i,j)                      (mask non-links)
/// ```
///
/// Normalization runs over all P·A draws, not only the linked ones, so the weighted matrix
/// sums to roughly the realized connectance and never exceeds 1. Most realized interactions
/// come out weak and a few strong.
public final class InteractionWeighter {

    public static final double DEFAULT_RATE = 1.0;

    private final double rate;

    public InteractionWeighter() {
        this(DEFAULT_RATE);
    }

    /// @param rate rate parameter of the exponential distribution, finite and positive
    public InteractionWeighter(double rate) {
        if (!Double.isFinite(rate) || rate <= 0.0) {
            throw new SimulationParameterException("exponential_rate", "must be finite and positive, got " + rate);
        }
        this.rate = rate;
    }

    public double getRate() {
        return rate;
    }

    /// Weights the links of a topology.
    ///
    /// @param topology the presence/absence matrix
    /// @param rng the random source for this trial
    /// @return weights on linked cells, zero elsewhere
    public BipartiteMatrix weight(BinaryBipartiteMatrix topology, UniformRandomProvider rng) {
        Objects.requireNonNull(topology, "topology cannot be null");
        int plants = topology.plantCount();
        int animals = topology.animalCount();

        double[][] simplex = drawSimplex(plants, animals, rng);
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                if (!topology.isLinked(i, j)) {
                    simplex[i][j] = 0.0;
                }
            }
        }
        return new BipartiteMatrix(simplex);
    }

    /// Draws P·A exponential samples and normalizes them to sum to 1.
    ///
    /// @return the unmasked simplex draws in row-major order
    public double[][] drawSimplex(int plants, int animals, UniformRandomProvider rng) {
        SimulationParameterException.requirePositive("plants", plants);
        SimulationParameterException.requirePositive("animals", animals);
        Objects.requireNonNull(rng, "rng cannot be null");

        ContinuousSampler sampler = AhrensDieterExponentialSampler.of(rng, 1.0 / rate);
        double[][] draws = new double[plants][animals];
        double sum = 0.0;
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                double x = sampler.sample();
                draws[i][j] = x;
                sum += x;
            }
        }
        if (sum <= 0.0) {
            // every draw underflowed to zero; fall back to the uniform point of the simplex
            double uniform = 1.0 / ((double) plants * animals);
            for (double[] row : draws) {
                Arrays.fill(row, uniform);
            }
            return draws;
        }
        for (double[] row : draws) {
            for (int j = 0; j < animals; j++) {
                row[j] /= sum;
            }
        }
        return draws;
    }
}
