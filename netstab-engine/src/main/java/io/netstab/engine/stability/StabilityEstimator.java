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

import io.netstab.engine.community.CommunityMatrix;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Estimates local stability from the eigenvalue spectrum of a community matrix.
///
/// ## Resilience
///
/// ```text
///   λ_dom      = argmax_k Re(λ_k)
///   resilience = −Re(λ_dom)
/// ```
///
/// Positive resilience means perturbations decay; larger values mean faster return.
///
/// ## Special cases
///
/// | Case | Result |
/// |------|--------|
/// | no interactions (d = 0, all eigenvalues 0) | resilience 0, [StabilityEstimate.Outcome#DEGENERATE] |
/// | decomposition does not converge | resilience NaN, [StabilityEstimate.Outcome#NOT_CONVERGED], logged |
///
/// The full spectrum comes from commons-math [EigenDecomposition], which handles both the
/// symmetric (mutualistic) and non-symmetric (antagonistic) cases. Subclasses may substitute
/// another solver; [#estimate] must return [StabilityEstimate#NOT_CONVERGED] rather than throw.
public class StabilityEstimator {

    private static final Logger logger = LogManager.getLogger(StabilityEstimator.class);

    public StabilityEstimate estimate(CommunityMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        if (!matrix.hasInteractions()) {
            return StabilityEstimate.DEGENERATE;
        }

        RealMatrix jacobian = matrix.toRealMatrix();
        try {
            EigenDecomposition decomposition = new EigenDecomposition(jacobian);
            double[] real = decomposition.getRealEigenvalues();
            double[] imaginary = decomposition.getImagEigenvalues();
            int dominant = 0;
            for (int k = 1; k < real.length; k++) {
                if (real[k] > real[dominant]) {
                    dominant = k;
                }
            }
            return StabilityEstimate.fromDominant(real[dominant], imaginary[dominant]);
        } catch (MathIllegalStateException | MathArithmeticException e) {
            logger.warn("Eigen decomposition failed for {} community matrix of size {}: {}",
                matrix.sign(), matrix.size(), e.getMessage());
            return StabilityEstimate.NOT_CONVERGED;
        }
    }

    /// Shorthand for [#estimate(CommunityMatrix)] returning only the resilience.
    public double resilience(CommunityMatrix matrix) {
        return estimate(matrix).resilience();
    }
}
