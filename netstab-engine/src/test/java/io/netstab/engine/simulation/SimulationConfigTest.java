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


import io.netstab.engine.SimulationParameterException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SimulationConfigTest {

    @Test
    void defaultsAreValid() {
        SimulationConfig config = new SimulationConfig().validate();
        assertEquals(8, config.getPlantMin());
        assertEquals(30, config.getPlantMax());
        assertEquals(16, config.getAnimalMin());
        assertEquals(60, config.getAnimalMax());
        assertEquals(0.05, config.getConnectanceMin());
        assertEquals(0.5, config.getConnectanceMax());
        assertEquals(1000, config.getTrials());
        assertFalse(config.isQuantitativeModularity());
        assertNull(config.getSeed());
        assertEquals(10, config.getModularityRestarts());
        assertEquals(1.0, config.getExponentialRate());
    }

    @Test
    void builderRejectsInvalidParameters() {
        assertParameter("plant_max", () -> SimulationConfig.builder().plants(10, 5).build());
        assertParameter("plant_min", () -> SimulationConfig.builder().plants(0, 5).build());
        assertParameter("animal_max", () -> SimulationConfig.builder().animals(20, 19).build());
        assertParameter("connectance_min", () -> SimulationConfig.builder().connectance(-0.1, 0.5).build());
        assertParameter("connectance_max", () -> SimulationConfig.builder().connectance(0.1, 1.5).build());
        assertParameter("connectance_max", () -> SimulationConfig.builder().connectance(0.6, 0.5).build());
        assertParameter("trials", () -> SimulationConfig.builder().trials(0).build());
        assertParameter("parallelism", () -> SimulationConfig.builder().parallelism(0).build());
        assertParameter("modularity_restarts", () -> SimulationConfig.builder().modularityRestarts(-1).build());
        assertParameter("exponential_rate", () -> SimulationConfig.builder().exponentialRate(0.0).build());
    }

    @Test
    void singlePointRangesAreValid() {
        SimulationConfig config = SimulationConfig.builder()
            .plants(5, 5).animals(12, 12).connectance(0.5, 0.5).trials(1)
            .build();
        assertEquals(5, config.getPlantMax());
    }

    @Test
    void jsonUsesSnakeCaseKeys() {
        String json = SimulationConfig.builder().seed(42L).trials(10).build().toJson();
        assertTrue(json.contains("\"plant_min\""));
        assertTrue(json.contains("\"quantitative_modularity\""));
        assertTrue(json.contains("\"seed\": 42"));
    }

    @Test
    void missingKeysKeepDefaults() {
        SimulationConfig config = SimulationConfig.fromJson("{\"trials\": 25, \"seed\": 7}");
        assertEquals(25, config.getTrials());
        assertEquals(7L, config.getSeed());
        assertEquals(SimulationConfig.DEFAULT_PLANT_MIN, config.getPlantMin());
        assertEquals(SimulationConfig.DEFAULT_CONNECTANCE_MAX, config.getConnectanceMax());
    }

    @Test
    void jsonRoundTripKeepsEveryParameter() {
        SimulationConfig original = SimulationConfig.builder()
            .plants(5, 9).animals(12, 20).connectance(0.1, 0.4)
            .trials(50).quantitativeModularity(true).seed(123L)
            .parallelism(2).modularityRestarts(3).exponentialRate(2.0)
            .build();

        SimulationConfig restored = SimulationConfig.fromJson(original.toJson());
        assertEquals(original.toJson(), restored.toJson());
        assertTrue(restored.isQuantitativeModularity());
        assertEquals(2.0, restored.getExponentialRate());
    }

    @Test
    void parsedConfigIsNotValidatedUntilAsked() {
        SimulationConfig config = SimulationConfig.fromJson("{\"plant_min\": 40, \"plant_max\": 30}");
        assertEquals(40, config.getPlantMin());
        assertParameter("plant_max", config::validate);
    }

    private static void assertParameter(String parameter, org.junit.jupiter.api.function.Executable executable) {
        SimulationParameterException e = assertThrows(SimulationParameterException.class, executable);
        assertEquals(parameter, e.getParameter());
    }
}
