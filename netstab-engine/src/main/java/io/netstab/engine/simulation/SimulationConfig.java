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

import com.google.gson.annotations.SerializedName;
import io.netstab.engine.SimulationParameterException;
import io.netstab.engine.generate.InteractionWeighter;
import io.netstab.engine.metrics.BipartiteModularity;
import io.netstab.engine.trace.NetstabGsonConfig;

/**
 * JSON-serializable parameters of a simulation run.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "plant_min": 8,
 *   "plant_max": 30,
 *   "animal_min": 16,
 *   "animal_max": 60,
 *   "connectance_min": 0.05,
 *   "connectance_max": 0.5,
 *   "trials": 1000,
 *   "quantitative_modularity": false,
 *   "seed": 42,                    // optional, omit for a non-reproducible run
 *   "parallelism": 8,              // optional, defaults to available processors
 *   "modularity_restarts": 10,     // optional
 *   "exponential_rate": 1.0        // optional
 * }
 * }</pre>
 *
 * <p>Missing keys keep their defaults. Call {@link #validate()} (the driver always does) before
 * using a configuration parsed from JSON. Where the JSON comes from is up to the caller.
 *
 * @see SimulationDriver
 */
public class SimulationConfig {

    public static final int DEFAULT_PLANT_MIN = 8;
    public static final int DEFAULT_PLANT_MAX = 30;
    public static final int DEFAULT_ANIMAL_MIN = 16;
    public static final int DEFAULT_ANIMAL_MAX = 60;
    public static final double DEFAULT_CONNECTANCE_MIN = 0.05;
    public static final double DEFAULT_CONNECTANCE_MAX = 0.5;
    public static final int DEFAULT_TRIALS = 1000;

    @SerializedName("plant_min")
    private int plantMin = DEFAULT_PLANT_MIN;

    @SerializedName("plant_max")
    private int plantMax = DEFAULT_PLANT_MAX;

    @SerializedName("animal_min")
    private int animalMin = DEFAULT_ANIMAL_MIN;

    @SerializedName("animal_max")
    private int animalMax = DEFAULT_ANIMAL_MAX;

    @SerializedName("connectance_min")
    private double connectanceMin = DEFAULT_CONNECTANCE_MIN;

    @SerializedName("connectance_max")
    private double connectanceMax = DEFAULT_CONNECTANCE_MAX;

    @SerializedName("trials")
    private int trials = DEFAULT_TRIALS;

    /** Search modules on weights instead of binarized links (slower) */
    @SerializedName("quantitative_modularity")
    private boolean quantitativeModularity = false;

    /** Master seed; null means every run differs */
    @SerializedName("seed")
    private Long seed;

    @SerializedName("parallelism")
    private int parallelism = Runtime.getRuntime().availableProcessors();

    @SerializedName("modularity_restarts")
    private int modularityRestarts = BipartiteModularity.DEFAULT_RESTARTS;

    @SerializedName("exponential_rate")
    private double exponentialRate = InteractionWeighter.DEFAULT_RATE;

    public SimulationConfig() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks every parameter.
     *
     * @return this configuration
     * @throws SimulationParameterException naming the first offending parameter
     */
    public SimulationConfig validate() {
        SimulationParameterException.requirePositive("plant_min", plantMin);
        SimulationParameterException.requirePositive("plant_max", plantMax);
        requireOrdered("plant_max", plantMin, plantMax);
        SimulationParameterException.requirePositive("animal_min", animalMin);
        SimulationParameterException.requirePositive("animal_max", animalMax);
        requireOrdered("animal_max", animalMin, animalMax);
        SimulationParameterException.requireProbability("connectance_min", connectanceMin);
        SimulationParameterException.requireProbability("connectance_max", connectanceMax);
        if (connectanceMin > connectanceMax) {
            throw new SimulationParameterException("connectance_max",
                "range is inverted: " + connectanceMin + " > " + connectanceMax);
        }
        SimulationParameterException.requirePositive("trials", trials);
        SimulationParameterException.requirePositive("parallelism", parallelism);
        if (modularityRestarts < 0) {
            throw new SimulationParameterException("modularity_restarts",
                "must not be negative, got " + modularityRestarts);
        }
        if (!Double.isFinite(exponentialRate) || exponentialRate <= 0.0) {
            throw new SimulationParameterException("exponential_rate",
                "must be finite and positive, got " + exponentialRate);
        }
        return this;
    }

    private static void requireOrdered(String parameter, int min, int max) {
        if (min > max) {
            throw new SimulationParameterException(parameter, "range is inverted: " + min + " > " + max);
        }
    }

    public int getPlantMin() {
        return plantMin;
    }

    public void setPlantMin(int plantMin) {
        this.plantMin = plantMin;
    }

    public int getPlantMax() {
        return plantMax;
    }

    public void setPlantMax(int plantMax) {
        this.plantMax = plantMax;
    }

    public int getAnimalMin() {
        return animalMin;
    }

    public void setAnimalMin(int animalMin) {
        this.animalMin = animalMin;
    }

    public int getAnimalMax() {
        return animalMax;
    }

    public void setAnimalMax(int animalMax) {
        this.animalMax = animalMax;
    }

    public double getConnectanceMin() {
        return connectanceMin;
    }

    public void setConnectanceMin(double connectanceMin) {
        this.connectanceMin = connectanceMin;
    }

    public double getConnectanceMax() {
        return connectanceMax;
    }

    public void setConnectanceMax(double connectanceMax) {
        this.connectanceMax = connectanceMax;
    }

    public int getTrials() {
        return trials;
    }

    public void setTrials(int trials) {
        this.trials = trials;
    }

    public boolean isQuantitativeModularity() {
        return quantitativeModularity;
    }

    public void setQuantitativeModularity(boolean quantitativeModularity) {
        this.quantitativeModularity = quantitativeModularity;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getModularityRestarts() {
        return modularityRestarts;
    }

    public void setModularityRestarts(int modularityRestarts) {
        this.modularityRestarts = modularityRestarts;
    }

    public double getExponentialRate() {
        return exponentialRate;
    }

    public void setExponentialRate(double exponentialRate) {
        this.exponentialRate = exponentialRate;
    }

    /**
     * Parses a configuration from a JSON string. The result is not validated.
     *
     * @throws com.google.gson.JsonSyntaxException if the string is not valid JSON for this type
     */
    public static SimulationConfig fromJson(String json) {
        return NetstabGsonConfig.gson().fromJson(json, SimulationConfig.class);
    }

    /**
     * Serializes this configuration to a JSON string.
     */
    public String toJson() {
        return NetstabGsonConfig.gson().toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    /**
     * Fluent builder; {@link #build()} validates.
     */
    public static final class Builder {
        private final SimulationConfig config = new SimulationConfig();

        private Builder() {
        }

        public Builder plants(int min, int max) {
            config.plantMin = min;
            config.plantMax = max;
            return this;
        }

        public Builder animals(int min, int max) {
            config.animalMin = min;
            config.animalMax = max;
            return this;
        }

        public Builder connectance(double min, double max) {
            config.connectanceMin = min;
            config.connectanceMax = max;
            return this;
        }

        public Builder trials(int trials) {
            config.trials = trials;
            return this;
        }

        public Builder quantitativeModularity(boolean quantitative) {
            config.quantitativeModularity = quantitative;
            return this;
        }

        public Builder seed(long seed) {
            config.seed = seed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            config.parallelism = parallelism;
            return this;
        }

        public Builder modularityRestarts(int restarts) {
            config.modularityRestarts = restarts;
            return this;
        }

        public Builder exponentialRate(double rate) {
            config.exponentialRate = rate;
            return this;
        }

        public SimulationConfig build() {
            return config.validate();
        }
    }
}
