package io.netstab.engine.simulation;

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
import io.netstab.engine.community.CommunityMatrixBuilder;
import io.netstab.engine.community.CommunityMatrixPair;
import io.netstab.engine.generate.InteractionWeighter;
import io.netstab.engine.generate.RandomGenerators;
import io.netstab.engine.generate.RandomTopologyGenerator;
import io.netstab.engine.matrix.BinaryBipartiteMatrix;
import io.netstab.engine.matrix.BipartiteMatrix;
import io.netstab.engine.metrics.DefaultStructuralMetricsProvider;
import io.netstab.engine.metrics.StructuralMetricsProvider;
import io.netstab.engine.stability.StabilityEstimate;
import io.netstab.engine.stability.StabilityEstimator;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Runs one trial: draw sizes and connectance, sample a network, measure it.
///
/// ## Pipeline
///
/// ```text
///   seed ──► rng ──► P, A, c
///                      │
///                      ▼
///   RandomTopologyGenerator ──► InteractionWeighter ──► weighted network
///                                                            │
///                  ┌─────────────────────────────────────────┤
///                  ▼                                         ▼
///   StructuralMetricsProvider                  CommunityMatrixBuilder (both signs)
///   (nestedness, modularity)                                 │
///                  │                                         ▼
///                  │                               StabilityEstimator (both)
///                  └──────────────► SimulationTrial ◄────────┘
/// ```
///
/// Every random draw of a trial comes from the generator built from its seed, in the order
/// above, so the same seed always gives the same row.
///
/// Stateless apart from its collaborators; one instance may run trials concurrently.
public final class TrialRunner {

    private static final Logger logger = LogManager.getLogger(TrialRunner.class);

    private final SimulationConfig config;
    private final StructuralMetricsProvider metrics;
    private final RandomTopologyGenerator topologyGenerator = new RandomTopologyGenerator();
    private final InteractionWeighter weighter;
    private final CommunityMatrixBuilder communityBuilder = new CommunityMatrixBuilder();
    private final StabilityEstimator stabilityEstimator;

    public TrialRunner(SimulationConfig config) {
        this(config, new DefaultStructuralMetricsProvider(config.getModularityRestarts()));
    }

    /// @param config a validated configuration
    /// @param metrics the structural metrics implementation
    public TrialRunner(SimulationConfig config, StructuralMetricsProvider metrics) {
        this(config, metrics, new StabilityEstimator());
    }

    /// @param config a validated configuration
    /// @param metrics the structural metrics implementation
    /// @param stabilityEstimator eigen analysis of the community matrices
    public TrialRunner(SimulationConfig config, StructuralMetricsProvider metrics,
                       StabilityEstimator stabilityEstimator) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.stabilityEstimator = Objects.requireNonNull(stabilityEstimator, "stabilityEstimator cannot be null");
        this.weighter = new InteractionWeighter(config.getExponentialRate());
    }

    /// Runs trial `index` from its own seed. Never throws for a failure inside the trial;
    /// such a trial comes back with status [TrialStatus#FAILED].
    public SimulationTrial runTrial(int index, long seed) {
        UniformRandomProvider rng = RandomGenerators.create(seed);
        int plants = RandomGenerators.createIntegerSampler(rng, config.getPlantMin(), config.getPlantMax()).sample();
        int animals = RandomGenerators.createIntegerSampler(rng, config.getAnimalMin(), config.getAnimalMax()).sample();
        double connectance = drawConnectance(rng);
        try {
            SampledNetwork network = sampleNetwork(plants, animals, connectance, rng);
            return evaluate(index, connectance, network, rng);
        } catch (RuntimeException e) {
            logger.error("Trial {} failed (P={}, A={}, c={})", index, plants, animals, connectance, e);
            return SimulationTrial.failed(index, plants, animals, connectance);
        }
    }

    private double drawConnectance(UniformRandomProvider rng) {
        double min = config.getConnectanceMin();
        double max = config.getConnectanceMax();
        if (min == max) {
            return min;
        }
        return RandomGenerators.createUniformSampler(rng, min, max).sample();
    }

    /// Samples the binary topology and its weights from `rng`.
    public SampledNetwork sampleNetwork(int plants, int animals, double connectance, UniformRandomProvider rng) {
        BinaryBipartiteMatrix topology = topologyGenerator.generate(plants, animals, connectance, rng);
        BipartiteMatrix weighted = weighter.weight(topology, rng);
        return new SampledNetwork(topology, weighted);
    }

    /// Measures a sampled network and assembles its row.
    ///
    /// @param index the trial index
    /// @param drawnConnectance the connectance probability the network was sampled with
    /// @param network the sampled network
    /// @param rng random source for the modularity search
    public SimulationTrial evaluate(int index, double drawnConnectance, SampledNetwork network,
                                    UniformRandomProvider rng) {
        BinaryBipartiteMatrix topology = network.topology();
        BipartiteMatrix weighted = network.weighted();

        double nestedness = metrics.computeNestedness(weighted);
        double modularity = metrics.computeModularity(weighted, config.isQuantitativeModularity(), rng);

        CommunityMatrixPair pair = communityBuilder.buildPair(weighted);
        StabilityEstimate mutualism = stabilityEstimator.estimate(pair.mutualistic());
        StabilityEstimate antagonism = stabilityEstimator.estimate(pair.antagonistic());

        TrialStatus status;
        if (mutualism.outcome() == StabilityEstimate.Outcome.NOT_CONVERGED
            || antagonism.outcome() == StabilityEstimate.Outcome.NOT_CONVERGED) {
            logger.warn("Trial {} has undefined resilience (P={}, A={}, links={})",
                index, topology.plantCount(), topology.animalCount(), topology.linkCount());
            status = TrialStatus.NUMERIC_INSTABILITY;
        } else if (StructuralMetricsProvider.isDegenerate(topology)) {
            logger.debug("Trial {} sampled a degenerate network with {} links", index, topology.linkCount());
            status = TrialStatus.DEGENERATE;
        } else {
            status = TrialStatus.OK;
        }

        int plants = topology.plantCount();
        int animals = topology.animalCount();
        return new SimulationTrial(index, plants, animals, drawnConnectance, plants + animals,
            topology.connectance(), nestedness, modularity,
            mutualism.resilience(), antagonism.resilience(), status);
    }
}
