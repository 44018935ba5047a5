package io.netstab.engine.stability;

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

/// Linear stability of one community matrix.
///
/// @param resilience −Re(λ_dom); positive means perturbations decay, NaN if not converged
/// @param dominantReal real part of the dominant eigenvalue
/// @param dominantImaginary imaginary part of the dominant eigenvalue
/// @param outcome how the estimate was obtained
public record StabilityEstimate(double resilience, double dominantReal, double dominantImaginary, Outcome outcome) {

    public enum Outcome {
        /// dominant eigenvalue has a negative real part
        STABLE,
        /// dominant eigenvalue has a non-negative real part
        UNSTABLE,
        /// no interactions; resilience is 0 by convention
        DEGENERATE,
        /// the eigen decomposition failed; resilience is undefined
        NOT_CONVERGED
    }

    public static final StabilityEstimate DEGENERATE = new StabilityEstimate(0.0, 0.0, 0.0, Outcome.DEGENERATE);

    public static final StabilityEstimate NOT_CONVERGED =
        new StabilityEstimate(Double.NaN, Double.NaN, Double.NaN, Outcome.NOT_CONVERGED);

    public static StabilityEstimate fromDominant(double real, double imaginary) {
        return new StabilityEstimate(-real, real, imaginary, real < 0.0 ? Outcome.STABLE : Outcome.UNSTABLE);
    }

    public boolean isStable() {
        return outcome == Outcome.STABLE;
    }
}
