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


import io.netstab.engine.community.CommunityMatrix;
import io.netstab.engine.community.InteractionSign;
import io.netstab.engine.generate.RandomGenerators;
import io.netstab.engine.matrix.BipartiteMatrix;
import io.netstab.engine.metrics.DefaultStructuralMetricsProvider;
import io.netstab.engine.metrics.StructuralMetricsProvider;
import io.netstab.engine.stability.StabilityEstimate;
import io.netstab.engine.stability.StabilityEstimator;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TrialRunnerTest {

    private static SimulationConfig config() {
        return SimulationConfig.builder()
            .plants(5, 5).animals(12, 12).connectance(0.5, 0.5)
            .trials(1).parallelism(1).modularityRestarts(4)
            .build();
    }

    @Test
    void sameSeedGivesSameNetworkAndMetrics() {
        TrialRunner runner = new TrialRunner(config());

        SampledNetwork a = runner.sampleNetwork(5, 12, 0.5, RandomGenerators.create(42L));
        SampledNetwork b = runner.sampleNetwork(5, 12, 0.5, RandomGenerators.create(42L));
        assertEquals(a.topology(), b.topology());
        assertEquals(a.weighted(), b.weighted());

        assertEquals(runner.runTrial(0, 42L), runner.runTrial(0, 42L));
    }

    @Test
    void rowDescribesItsNetwork() {
        TrialRunner runner = new TrialRunner(config());
        UniformRandomProvider rng = RandomGenerators.create(9L);
        SampledNetwork network = runner.sampleNetwork(5, 12, 0.5, rng);
        SimulationTrial trial = runner.evaluate(3, 0.5, network, rng);

        assertEquals(3, trial.trial());
        assertEquals(5, trial.plants());
        assertEquals(12, trial.animals());
        assertEquals(17, trial.diversity());
        assertEquals(0.5, trial.drawnConnectance());
        assertEquals(network.topology().connectance(), trial.connectance());
        assertTrue(trial.resilienceMutualism() < trial.resilienceAntagonism());
    }

    @Test
    void drawnParametersStayInRange() {
        SimulationConfig config = SimulationConfig.builder()
            .plants(8, 30).animals(16, 60).connectance(0.05, 0.5)
            .trials(1).parallelism(1).modularityRestarts(1)
            .build();
        TrialRunner runner = new TrialRunner(config);
        long[] seeds = RandomGenerators.deriveSeeds(1L, 20);
        for (int i = 0; i < seeds.length; i++) {
            SimulationTrial trial = runner.runTrial(i, seeds[i]);
            assertTrue(trial.plants() >= 8 && trial.plants() <= 30);
            assertTrue(trial.animals() >= 16 && trial.animals() <= 60);
            assertTrue(trial.drawnConnectance() >= 0.05 && trial.drawnConnectance() <= 0.5);
        }
    }

    @Test
    void emptyNetworkIsDegenerate() {
        SimulationConfig config = SimulationConfig.builder()
            .plants(3, 3).animals(4, 4).connectance(0.0, 0.0).trials(1).parallelism(1)
            .build();
        SimulationTrial trial = new TrialRunner(config).runTrial(0, 5L);

        assertEquals(TrialStatus.DEGENERATE, trial.status());
        assertEquals(0.0, trial.connectance());
        assertTrue(Double.isNaN(trial.nestedness()));
        assertTrue(Double.isNaN(trial.modularity()));
        assertEquals(0.0, trial.resilienceMutualism());
        assertEquals(0.0, trial.resilienceAntagonism());
    }

    @Test
    void unconvergedAntagonismIsNumericInstability() {
        StabilityEstimator noAntagonism = new StabilityEstimator() {
            @Override
            public StabilityEstimate estimate(CommunityMatrix matrix) {
                return matrix.sign() == InteractionSign.ANTAGONISTIC
                    ? StabilityEstimate.NOT_CONVERGED
                    : super.estimate(matrix);
            }
        };
        TrialRunner runner = new TrialRunner(config(), new DefaultStructuralMetricsProvider(), noAntagonism);

        SimulationTrial trial = runner.runTrial(2, 11L);

        assertEquals(TrialStatus.NUMERIC_INSTABILITY, trial.status());
        assertEquals(17, trial.diversity());
        assertTrue(Double.isNaN(trial.resilienceAntagonism()));
        assertTrue(Double.isFinite(trial.resilienceMutualism()));
        assertFalse(Double.isNaN(trial.nestedness()));
    }

    @Test
    void failingMetricsBecomeFailedRow() {
        StructuralMetricsProvider broken = new StructuralMetricsProvider() {
            @Override
            public double computeNestedness(BipartiteMatrix matrix) {
                throw new IllegalStateException("boom");
            }

            @Override
            public double computeModularity(BipartiteMatrix matrix, boolean quantitative, UniformRandomProvider rng) {
                return 0.0;
            }
        };
        SimulationTrial trial = new TrialRunner(config(), broken).runTrial(7, 1L);

        assertEquals(TrialStatus.FAILED, trial.status());
        assertEquals(7, trial.trial());
        assertEquals(17, trial.diversity());
        assertTrue(Double.isNaN(trial.nestedness()));
        assertTrue(Double.isNaN(trial.resilienceAntagonism()));
    }
}
