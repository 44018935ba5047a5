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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.sampling.distribution.DiscreteSampler;
import org.apache.commons.rng.sampling.distribution.DiscreteUniformSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seedable random number generators for network generation and parameter sampling.
 * Based on Apache Commons RNG. Every stochastic step in the engine receives one of these
 * explicitly; nothing reads process-wide random state.
 */
public final class RandomGenerators {

    /**
     * Available PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiro256++ - 256-bit state, fast, excellent statistical properties.
         * Recommended for general use.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /**
         * SplitMix64 - 64-bit state. Used to expand a master seed into per-trial seeds.
         */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a generator with the given algorithm and seed.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed for deterministic generation
     * @return a restorable uniform random provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * Creates a generator with the default algorithm (XO_SHI_RO_256_PP) and the given seed.
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates an unseeded generator with the default algorithm.
     */
    public static RestorableUniformRandomProvider createUnseeded() {
        return (RestorableUniformRandomProvider) Algorithm.XO_SHI_RO_256_PP.getSource().create();
    }

    /**
     * Expands one master seed into {@code count} independent trial seeds.
     *
     * <p>The same master seed always yields the same sequence, regardless of how the trials are
     * later scheduled.
     *
     * @param masterSeed the master seed, or {@code null} for a non-reproducible run
     * @param count number of seeds to produce
     * @return the per-trial seeds in trial order
     */
    public static long[] deriveSeeds(Long masterSeed, int count) {
        UniformRandomProvider master = masterSeed != null
            ? create(Algorithm.SPLIT_MIX_64, masterSeed)
            : Algorithm.SPLIT_MIX_64.getSource().create();
        long[] seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = master.nextLong();
        }
        return seeds;
    }

    /**
     * Creates a continuous uniform sampler over [lower, upper].
     */
    public static ContinuousSampler createUniformSampler(UniformRandomProvider rng, double lower, double upper) {
        return ContinuousUniformSampler.of(rng, lower, upper);
    }

    /**
     * Creates an integer sampler over the closed range [lower, upper].
     */
    public static DiscreteSampler createIntegerSampler(UniformRandomProvider rng, int lower, int upper) {
        return DiscreteUniformSampler.of(rng, lower, upper);
    }
}
