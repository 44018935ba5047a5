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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Arrays;

/// Square community (Jacobian) matrix of a plant–animal network.
///
/// ## Layout (S = P + A)
///
/// ```text
///                 plants (P)        animals (A)
///            ┌─────────────────┬─────────────────┐
///   plants   │   −d·I          │       B         │
///            ├─────────────────┼─────────────────┤
///   animals  │     σ·Bᵗ        │     −d·I        │
///            └─────────────────┴─────────────────┘
/// ```
///
/// σ is +1 for [InteractionSign#MUTUALISTIC] and −1 for [InteractionSign#ANTAGONISTIC].
/// d is the shared self-regulation magnitude: the largest total absolute off-diagonal effect in
/// any row. It is zero only when the network has no interactions.
///
/// Instances are immutable and trial-local.
public final class CommunityMatrix {

    private final double[][] entries;
    private final int plants;
    private final int animals;
    private final InteractionSign sign;
    private final double selfRegulation;

    CommunityMatrix(double[][] entries, int plants, int animals, InteractionSign sign, double selfRegulation) {
        this.entries = entries;
        this.plants = plants;
        this.animals = animals;
        this.sign = sign;
        this.selfRegulation = selfRegulation;
    }

    /// Species richness S = P + A.
    public int size() {
        return plants + animals;
    }

    public int plantCount() {
        return plants;
    }

    public int animalCount() {
        return animals;
    }

    public double get(int row, int column) {
        return entries[row][column];
    }

    public InteractionSign sign() {
        return sign;
    }

    /// Magnitude d of the shared diagonal; every diagonal entry equals −d.
    public double selfRegulation() {
        return selfRegulation;
    }

    /// False for the degenerate all-zero network.
    public boolean hasInteractions() {
        return selfRegulation > 0.0;
    }

    /// Sum of absolute off-diagonal entries in one row.
    public double offDiagonalMagnitude(int row) {
        double sum = 0.0;
        for (int c = 0; c < entries[row].length; c++) {
            if (c != row) {
                sum += Math.abs(entries[row][c]);
            }
        }
        return sum;
    }

    /// Copies the entries into a commons-math matrix for linear algebra.
    public RealMatrix toRealMatrix() {
        return new Array2DRowRealMatrix(entries, true);
    }

    public double[][] toArray() {
        double[][] copy = new double[entries.length][];
        for (int r = 0; r < entries.length; r++) {
            copy[r] = Arrays.copyOf(entries[r], entries[r].length);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "CommunityMatrix[" + size() + "x" + size() + ", " + sign + ", d=" + selfRegulation + "]";
    }
}
