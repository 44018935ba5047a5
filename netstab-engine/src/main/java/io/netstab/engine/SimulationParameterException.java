package io.netstab.engine;

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

/**
 * Thrown when a simulation or generator parameter is out of its valid domain: an inverted range,
 * a non-positive species count, a connectance outside [0,1], or a non-positive trial count.
 *
 * <p>Raised before any trial runs, so no partial results exist when it is thrown.
 */
public class SimulationParameterException extends IllegalArgumentException {

    private final String parameter;

    public SimulationParameterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    /**
     * @return the name of the offending parameter, as it appears in the JSON configuration
     */
    public String getParameter() {
        return parameter;
    }

    /**
     * Checks that {@code value} is strictly positive.
     */
    public static int requirePositive(String parameter, int value) {
        if (value <= 0) {
            throw new SimulationParameterException(parameter, "must be positive, got " + value);
        }
        return value;
    }

    /**
     * Checks that {@code value} is a finite probability in [0,1].
     */
    public static double requireProbability(String parameter, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new SimulationParameterException(parameter, "must be within [0,1], got " + value);
        }
        return value;
    }
}
