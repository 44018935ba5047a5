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

/// Presence/absence plant × animal matrix.
///
/// Produced either by the topology generator, before any weights are assigned, or by
/// thresholding a [BipartiteMatrix] with [BipartiteMatrix#binarize()].
public final class BinaryBipartiteMatrix {

    private final boolean[][] links;
    private final int plants;
    private final int animals;

    public BinaryBipartiteMatrix(boolean[][] links) {
        Objects.requireNonNull(links, "links cannot be null");
        if (links.length == 0 || links[0] == null || links[0].length == 0) {
            throw new IllegalArgumentException("bipartite matrix needs at least one plant and one animal");
        }
        this.plants = links.length;
        this.animals = links[0].length;
        this.links = new boolean[plants][];
        for (int i = 0; i < plants; i++) {
            if (links[i] == null || links[i].length != animals) {
                throw new IllegalArgumentException("row " + i + " does not have " + animals + " columns");
            }
            this.links[i] = Arrays.copyOf(links[i], animals);
        }
    }

    public int plantCount() {
        return plants;
    }

    public int animalCount() {
        return animals;
    }

    public boolean isLinked(int plant, int animal) {
        return links[plant][animal];
    }

    /// Entry as 0 or 1.
    public int get(int plant, int animal) {
        return links[plant][animal] ? 1 : 0;
    }

    public int plantDegree(int plant) {
        int degree = 0;
        for (boolean linked : links[plant]) {
            if (linked) {
                degree++;
            }
        }
        return degree;
    }

    public int animalDegree(int animal) {
        int degree = 0;
        for (int i = 0; i < plants; i++) {
            if (links[i][animal]) {
                degree++;
            }
        }
        return degree;
    }

    public int linkCount() {
        int count = 0;
        for (int i = 0; i < plants; i++) {
            count += plantDegree(i);
        }
        return count;
    }

    /// Realized connectance: links / (P·A).
    public double connectance() {
        return (double) linkCount() / ((long) plants * animals);
    }

    /// True when no cell is linked.
    public boolean isEmpty() {
        return linkCount() == 0;
    }

    /// True when every cell is linked.
    public boolean isComplete() {
        return linkCount() == plants * animals;
    }

    /// Converts to a 0/1 valued quantitative matrix.
    public BipartiteMatrix toWeighted() {
        double[][] values = new double[plants][animals];
        for (int i = 0; i < plants; i++) {
            for (int j = 0; j < animals; j++) {
                values[i][j] = links[i][j] ? 1.0 : 0.0;
            }
        }
        return new BipartiteMatrix(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryBipartiteMatrix)) return false;
        BinaryBipartiteMatrix that = (BinaryBipartiteMatrix) o;
        return Arrays.deepEquals(links, that.links);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(links);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("BinaryBipartiteMatrix[").append(plants).append('x').append(animals).append("]\n");
        for (boolean[] row : links) {
            for (boolean linked : row) {
                sb.append(linked ? '1' : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
