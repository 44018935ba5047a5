package io.netstab.engine.community;

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

import io.netstab.engine.matrix.BipartiteMatrix;

import java.util.Objects;

/// Embeds a bipartite interaction matrix into a square community matrix.
///
/// ## Steps
///
/// 1. allocate an S × S zero matrix, S = P + A
/// 2. rows [0,P), columns [P,S) ← B
/// 3. rows [P,S), columns [0,P) ← σ·Bᵗ
/// 4. d ← max over rows of Σ |off-diagonal entries|; every diagonal entry ← −d
///
/// Using absolute values in step 4 gives both sign variants the same d, so a mutualistic and
/// an antagonistic matrix built from the same B differ only in the sign of the lower-left block.
public final class CommunityMatrixBuilder {

    /// Builds the community matrix for one sign convention.
    public CommunityMatrix build(BipartiteMatrix interactions, InteractionSign sign) {
        Objects.requireNonNull(interactions, "interactions cannot be null");
        Objects.requireNonNull(sign, "sign cannot be null");

        int plants = interactions.plantCount();
        int animals = interactions.animalCount();
        int size = plants + animals;
        double sigma = sign.animalOnPlant();

        double[][] entries = new double[size][size];
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                double w = interactions.get(i, j);
                entries[i][plants + j] = w;
                entries[plants + j][i] = sigma * w;
            }
        }

        double selfRegulation = maxRowMagnitude(entries);
        double diagonal = selfRegulation > 0.0 ? -selfRegulation : 0.0;
        for (int s = 0; s < size; s++) {
            entries[s][s] = diagonal;
        }
        return new CommunityMatrix(entries, plants, animals, sign, selfRegulation);
    }

    /// Builds both sign variants from the same interaction magnitudes.
    public CommunityMatrixPair buildPair(BipartiteMatrix interactions) {
        return new CommunityMatrixPair(
            build(interactions, InteractionSign.MUTUALISTIC),
            build(interactions, InteractionSign.ANTAGONISTIC));
    }

    // diagonal is still zero when this runs
    private static double maxRowMagnitude(double[][] entries) {
        double max = 0.0;
        for (double[] row : entries) {
            double sum = 0.0;
            for (double v : row) {
                sum += Math.abs(v);
            }
            max = Math.max(max, sum);
        }
        return max;
    }
}
