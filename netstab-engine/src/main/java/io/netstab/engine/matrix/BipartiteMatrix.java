package io.netstab.engine.matrix;

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

import java.util.Arrays;
import java.util.Objects;

/// Quantitative plant × animal interaction matrix.
///
/// ## Layout
///
/// ```text
///              animals (columns, A)
///            ┌──────────────────────┐
///   plants   │ w(0,0)  w(0,1)  ...  │
///   (rows,   │ w(1,0)  ...          │
///    P)      │ ...                  │
///            └──────────────────────┘
/// ```
///
/// Entry (i, j) is the interaction strength between plant i and animal j. A zero entry means
/// there is no link. All entries are finite and non-negative, and both dimensions are positive.
///
/// ## Immutability
///
/// The backing array is copied on construction and on [#toArray()], so instances can be shared
/// freely between threads.
///
/// @see BinaryBipartiteMatrix
public final class BipartiteMatrix {

    private final double[][] values;
    private final int plants;
    private final int animals;

    /// Creates a matrix from row-major values.
    ///
    /// @param values rows are plants, columns are animals
    /// @throws IllegalArgumentException if the array is empty, ragged, or holds negative or
    ///     non-finite entries
    public BipartiteMatrix(double[][] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0 || values[0] == null || values[0].length == 0) {
            throw new IllegalArgumentException("bipartite matrix needs at least one plant and one animal");
        }
        this.plants = values.length;
        this.animals = values[0].length;
        this.values = new double[plants][];
        for (int i = 0; i < plants; i++) {
            if (values[i] == null || values[i].length != animals) {
                throw new IllegalArgumentException("row " + i + " does not have " + animals + " columns");
            }
            for (int j = 0; j < animals; j++) {
                double v = values[i][j];
                if (!Double.isFinite(v) || v < 0.0) {
                    throw new IllegalArgumentException(
                        "entry (" + i + "," + j + ") must be finite and non-negative, got " + v);
                }
            }
            this.values[i] = Arrays.copyOf(values[i], animals);
        }
    }

    /// Creates an all-zero matrix of the given shape.
    public static BipartiteMatrix zeros(int plants, int animals) {
        if (plants <= 0 || animals <= 0) {
            throw new IllegalArgumentException("plants and animals must be positive, got " + plants + "x" + animals);
        }
        return new BipartiteMatrix(new double[plants][animals]);
    }

    public int plantCount() {
        return plants;
    }

    public int animalCount() {
        return animals;
    }

    public double get(int plant, int animal) {
        return values[plant][animal];
    }

    /// Total interaction strength of one plant.
    public double rowSum(int plant) {
        double sum = 0.0;
        for (double v : values[plant]) {
            sum += v;
        }
        return sum;
    }

    /// Total interaction strength of one animal.
    public double columnSum(int animal) {
        double sum = 0.0;
        for (int i = 0; i < plants; i++) {
            sum += values[i][animal];
        }
        return sum;
    }

    /// Sum over every entry.
    public double total() {
        double sum = 0.0;
        for (double[] row : values) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum;
    }

    /// Number of non-zero entries.
    public int linkCount() {
        int links = 0;
        for (double[] row : values) {
            for (double v : row) {
                if (v > 0.0) {
                    links++;
                }
            }
        }
        return links;
    }

    /// Realized connectance: links / (P·A).
    public double connectance() {
        return (double) linkCount() / ((long) plants * animals);
    }

    /// Thresholds this matrix: every positive entry becomes a link.
    public BinaryBipartiteMatrix binarize() {
        boolean[][] links = new boolean[plants][animals];
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                links[i][j] = values[i][j] > 0.0;
            }
        }
        return new BinaryBipartiteMatrix(links);
    }

    /// Returns the animal × plant view of this matrix.
    public BipartiteMatrix transpose() {
        double[][] transposed = new double[animals][plants];
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                transposed[j][i] = values[i][j];
            }
        }
        return new BipartiteMatrix(transposed);
    }

    /// Returns a copy of the backing values.
    public double[][] toArray() {
        double[][] copy = new double[plants][];
        for (int i = 0; i < plants; i++) {
            copy[i] = Arrays.copyOf(values[i], animals);
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BipartiteMatrix)) return false;
        BipartiteMatrix that = (BipartiteMatrix) o;
        return Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "BipartiteMatrix[" + plants + "x" + animals + ", links=" + linkCount()
            + ", total=" + total() + "]";
    }
}
