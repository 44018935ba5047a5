package io.netstab.engine.metrics;

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
import io.netstab.engine.matrix.BinaryBipartiteMatrix;
import io.netstab.engine.matrix.BipartiteMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/// Bipartite modularity search: LPAwb+ label propagation with DIRT restarts (Beckett, 2016).
///
/// ## Objective
///
/// Barber's bipartite modularity for weights W with row totals k, column totals d and grand
/// total m:
///
/// ```text
///   Q = (1/m) Σ_ij ( W_ij − k_i·d_j / m ) · δ(g_i, h_j)
/// ```
///
/// where g are the row (red) labels and h the column (blue) labels.
///
/// ## Search
///
/// ```text
/// ┌───────────────────────────────────────────────────────────────────┐
/// │ STAGE ONE: label propagation                                      │
/// │   columns adopt the red label with the best local gain,           │
/// │   rows adopt the blue label with the best local gain,             │
/// │   repeat while Q strictly increases (ties broken at random)       │
/// └───────────────────────────────────────────────────────────────────┘
///          ↓
/// ┌───────────────────────────────────────────────────────────────────┐
/// │ STAGE TWO: module merging                                         │
/// │   merge two modules when Q improves and no other merge involving  │
/// │   either of them does better, then rerun stage one;               │
/// │   repeat until no merge is made                                   │
/// └───────────────────────────────────────────────────────────────────┘
///          ↓
/// ┌───────────────────────────────────────────────────────────────────┐
/// │ RESTARTS: the first run starts from one label per row; each       │
/// │   restart starts from a random labelling with 2..M+1 initial      │
/// │   modules (M = modules of the first run); the best Q is kept      │
/// └───────────────────────────────────────────────────────────────────┘
/// ```
///
/// The smaller species set is always treated as the red (row) side.
///
/// ## Determinism
///
/// For a given random source state the result is fully deterministic. Across different seeds,
/// networks with near-equal competing partitions may report slightly different maxima; that is
/// inherent to the heuristic. More restarts make the maximum more stable.
///
/// ## Thread Safety
///
/// Instances hold only configuration and are safe to share. All search state is local to a call.
public final class BipartiteModularity {

    private static final Logger logger = LogManager.getLogger(BipartiteModularity.class);

    /// Default number of random restarts after the initial run
    public static final int DEFAULT_RESTARTS = 10;

    /// Default iteration cap for each propagation and merging loop
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    /// Absolute tolerance for Q comparisons and gain ties
    private static final double TOLERANCE = 1e-12;

    private final int restarts;
    private final int maxIterations;

    public BipartiteModularity() {
        this(DEFAULT_RESTARTS, DEFAULT_MAX_ITERATIONS);
    }

    public BipartiteModularity(int restarts) {
        this(restarts, DEFAULT_MAX_ITERATIONS);
    }

    /// @param restarts random restarts after the initial run, zero or more
    /// @param maxIterations cap on every inner loop, positive
    public BipartiteModularity(int restarts, int maxIterations) {
        if (restarts < 0) {
            throw new SimulationParameterException("modularity_restarts", "must not be negative, got " + restarts);
        }
        SimulationParameterException.requirePositive("max_iterations", maxIterations);
        this.restarts = restarts;
        this.maxIterations = maxIterations;
    }

    public int getRestarts() {
        return restarts;
    }

    /// Finds the best partition of a network.
    ///
    /// @param matrix the interaction matrix
    /// @param quantitative true to search on the weights, false on the binarized links
    /// @param rng random source for initial labels and tie-breaking
    /// @return the best partition, or an undefined result for degenerate networks
    public ModularityResult compute(BipartiteMatrix matrix, boolean quantitative, UniformRandomProvider rng) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");

        BinaryBipartiteMatrix topology = matrix.binarize();
        if (StructuralMetricsProvider.isDegenerate(topology)) {
            return ModularityResult.undefined(matrix.plantCount(), matrix.animalCount());
        }

        double[][] weights = quantitative ? matrix.toArray() : topology.toWeighted().toArray();
        boolean flipped = weights.length > weights[0].length;
        if (flipped) {
            weights = transpose(weights);
        }

        Search search = new Search(weights, rng);
        Partition best = search.run(search.uniqueRedLabels());
        int firstModules = best.moduleCount();
        for (int r = 0; r < restarts; r++) {
            int initialModules = 2 + (r % Math.max(1, firstModules));
            Partition candidate = search.run(search.randomRedLabels(initialModules));
            if (candidate.q > best.q) {
                best = candidate;
            }
        }

        ModularityResult result = best.toResult(flipped);
        logger.debug("Modularity search on {}x{} ({}): Q={} with {} modules after {} restarts",
            matrix.plantCount(), matrix.animalCount(), quantitative ? "quantitative" : "binary",
            result.q(), result.moduleCount(), restarts);
        return result;
    }

    /// Barber's modularity of a given labelling, without searching.
    ///
    /// @param weights row-major weights
    /// @param rowLabels label of every row
    /// @param columnLabels label of every column; a row and a column share a module when equal
    /// @return Q, or NaN when the weights sum to zero
    public static double barberModularity(double[][] weights, int[] rowLabels, int[] columnLabels) {
        int rows = weights.length;
        int cols = weights[0].length;
        double[] rowTotals = new double[rows];
        double[] colTotals = new double[cols];
        double total = 0.0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                rowTotals[r] += weights[r][c];
                colTotals[c] += weights[r][c];
                total += weights[r][c];
            }
        }
        if (total <= 0.0) {
            return Double.NaN;
        }
        double q = 0.0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (rowLabels[r] == columnLabels[c]) {
                    q += weights[r][c] - rowTotals[r] * colTotals[c] / total;
                }
            }
        }
        return q / total;
    }

    private static double[][] transpose(double[][] values) {
        double[][] t = new double[values[0].length][values.length];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < values[0].length; j++) {
                t[j][i] = values[i][j];
            }
        }
        return t;
    }

    /// One labelling of red (row) and blue (column) nodes with its modularity.
    private static final class Partition {
        final int[] red;
        final int[] blue;
        final double q;

        Partition(int[] red, int[] blue, double q) {
            this.red = red;
            this.blue = blue;
            this.q = q;
        }

        int moduleCount() {
            return (int) IntStream.concat(Arrays.stream(red), Arrays.stream(blue))
                .filter(label -> label >= 0)
                .distinct()
                .count();
        }

        ModularityResult toResult(boolean flipped) {
            int[] compact = new int[red.length + blue.length];
            int[] mapping = new int[compact.length + maxLabel() + 1];
            Arrays.fill(mapping, -1);
            int next = 0;
            int[] all = new int[compact.length];
            System.arraycopy(red, 0, all, 0, red.length);
            System.arraycopy(blue, 0, all, red.length, blue.length);
            for (int i = 0; i < all.length; i++) {
                int label = all[i];
                if (mapping[label] < 0) {
                    mapping[label] = next++;
                }
                compact[i] = mapping[label];
            }
            int[] rowModules = Arrays.copyOfRange(compact, 0, red.length);
            int[] colModules = Arrays.copyOfRange(compact, red.length, compact.length);
            // the single-module partition always scores 0
            double score = Math.min(1.0, Math.max(0.0, q));
            return flipped
                ? new ModularityResult(score, next, colModules, rowModules)
                : new ModularityResult(score, next, rowModules, colModules);
        }

        private int maxLabel() {
            int max = 0;
            for (int label : red) {
                max = Math.max(max, label);
            }
            for (int label : blue) {
                max = Math.max(max, label);
            }
            return max;
        }
    }

    /// Search state shared by all runs on one network.
    private final class Search {
        private final double[][] weights;
        private final double[][] barber;
        private final double[] rowTotals;
        private final double[] colTotals;
        private final double total;
        private final int rows;
        private final int cols;
        private final UniformRandomProvider rng;

        Search(double[][] weights, UniformRandomProvider rng) {
            this.weights = weights;
            this.rng = rng;
            this.rows = weights.length;
            this.cols = weights[0].length;
            this.rowTotals = new double[rows];
            this.colTotals = new double[cols];
            double sum = 0.0;
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    rowTotals[r] += weights[r][c];
                    colTotals[c] += weights[r][c];
                    sum += weights[r][c];
                }
            }
            this.total = sum;
            this.barber = new double[rows][cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    barber[r][c] = weights[r][c] - rowTotals[r] * colTotals[c] / total;
                }
            }
        }

        int[] uniqueRedLabels() {
            int[] labels = new int[rows];
            for (int r = 0; r < rows; r++) {
                labels[r] = r;
            }
            return labels;
        }

        int[] randomRedLabels(int initialModules) {
            int[] labels = new int[rows];
            for (int r = 0; r < rows; r++) {
                labels[r] = rng.nextInt(initialModules + 1);
            }
            return labels;
        }

        Partition run(int[] initialRed) {
            int capacity = 0;
            for (int label : initialRed) {
                capacity = Math.max(capacity, label + 1);
            }
            int[] blue = new int[cols];
            Arrays.fill(blue, -1);
            Partition propagated = stageOne(initialRed.clone(), blue, capacity);
            return stageTwo(propagated, capacity);
        }

        private Partition stageOne(int[] red, int[] blue, int capacity) {
            double[] redTotals = new double[capacity];
            double[] blueTotals = new double[capacity];
            for (int r = 0; r < rows; r++) {
                redTotals[red[r]] += rowTotals[r];
            }
            for (int c = 0; c < cols; c++) {
                if (blue[c] >= 0) {
                    blueTotals[blue[c]] += colTotals[c];
                }
            }
            return propagate(red, blue, redTotals, blueTotals, capacity);
        }

        private Partition propagate(int[] red, int[] blue, double[] redTotals, double[] blueTotals, int capacity) {
            boolean unlabelled = Arrays.stream(blue).anyMatch(label -> label < 0);
            double qAfter = unlabelled ? Double.NEGATIVE_INFINITY : modularity(red, blue);

            for (int iteration = 0; iteration < maxIterations; iteration++) {
                double qBefore = qAfter;
                int[] oldRed = red.clone();
                int[] oldBlue = blue.clone();

                updateBlue(red, blue, redTotals, blueTotals, capacity);
                updateRed(red, blue, redTotals, blueTotals, capacity);

                qAfter = modularity(red, blue);
                if (qAfter <= qBefore + TOLERANCE) {
                    return new Partition(oldRed, oldBlue, qBefore);
                }
            }
            logger.debug("Label propagation hit the iteration cap of {}", maxIterations);
            return new Partition(red, blue, qAfter);
        }

        private void updateBlue(int[] red, int[] blue, double[] redTotals, double[] blueTotals, int capacity) {
            int[] choices = distinctLabels(red, capacity);
            double[] linkedByLabel = new double[capacity];
            double[] gains = new double[choices.length];
            for (int c = 0; c < cols; c++) {
                if (blue[c] >= 0) {
                    blueTotals[blue[c]] -= colTotals[c];
                }
                Arrays.fill(linkedByLabel, 0.0);
                for (int r = 0; r < rows; r++) {
                    linkedByLabel[red[r]] += weights[r][c];
                }
                for (int k = 0; k < choices.length; k++) {
                    int label = choices[k];
                    gains[k] = linkedByLabel[label] - colTotals[c] * redTotals[label] / total;
                }
                int chosen = choices[pickBest(gains)];
                blue[c] = chosen;
                blueTotals[chosen] += colTotals[c];
            }
        }

        private void updateRed(int[] red, int[] blue, double[] redTotals, double[] blueTotals, int capacity) {
            int[] choices = distinctLabels(blue, capacity);
            double[] linkedByLabel = new double[capacity];
            double[] gains = new double[choices.length];
            for (int r = 0; r < rows; r++) {
                redTotals[red[r]] -= rowTotals[r];
                Arrays.fill(linkedByLabel, 0.0);
                for (int c = 0; c < cols; c++) {
                    linkedByLabel[blue[c]] += weights[r][c];
                }
                for (int k = 0; k < choices.length; k++) {
                    int label = choices[k];
                    gains[k] = linkedByLabel[label] - rowTotals[r] * blueTotals[label] / total;
                }
                int chosen = choices[pickBest(gains)];
                red[r] = chosen;
                redTotals[chosen] += rowTotals[r];
            }
        }

        /// Index of the largest gain, breaking ties uniformly at random.
        private int pickBest(double[] gains) {
            double best = Double.NEGATIVE_INFINITY;
            for (double gain : gains) {
                best = Math.max(best, gain);
            }
            int[] ties = new int[gains.length];
            int tieCount = 0;
            for (int k = 0; k < gains.length; k++) {
                if (gains[k] >= best - TOLERANCE) {
                    ties[tieCount++] = k;
                }
            }
            return tieCount == 1 ? ties[0] : ties[rng.nextInt(tieCount)];
        }

        private Partition stageTwo(Partition start, int capacity) {
            int[] red = start.red;
            int[] blue = start.blue;
            double qNow = start.q;
            int[] divisions = sharedLabels(red, blue, capacity);

            for (int iteration = 0; iteration < maxIterations; iteration++) {
                boolean merged = false;
                if (divisions.length > 1) {
                    double[][] blocks = blockSums(red, blue, capacity);
                    boolean[] absorbed = new boolean[capacity];
                    double qCurrent = trace(blocks) / total;
                    for (int i = 0; i < divisions.length - 1; i++) {
                        int first = divisions[i];
                        for (int j = i + 1; j < divisions.length; j++) {
                            int second = divisions[j];
                            if (absorbed[first] || absorbed[second]) {
                                continue;
                            }
                            double qMerged = qCurrent + mergeGain(blocks, first, second);
                            if (qMerged > qNow + TOLERANCE
                                && !betterMergeExists(blocks, absorbed, divisions, first, second, qCurrent, qMerged)) {
                                relabel(red, first, second);
                                relabel(blue, first, second);
                                mergeBlocks(blocks, first, second);
                                absorbed[first] = true;
                                qCurrent = qMerged;
                                merged = true;
                            }
                        }
                    }
                }
                Partition refined = stageOne(red, blue, capacity);
                red = refined.red;
                blue = refined.blue;
                qNow = refined.q;
                divisions = sharedLabels(red, blue, capacity);
                if (!merged) {
                    break;
                }
            }
            return new Partition(red, blue, qNow);
        }

        private boolean betterMergeExists(double[][] blocks, boolean[] absorbed, int[] divisions,
                                          int first, int second, double qCurrent, double qMerged) {
            for (int other : divisions) {
                if (absorbed[other]) {
                    continue;
                }
                if (qCurrent + mergeGain(blocks, other, first) > qMerged + TOLERANCE) {
                    return true;
                }
                if (qCurrent + mergeGain(blocks, other, second) > qMerged + TOLERANCE) {
                    return true;
                }
            }
            return false;
        }

        /// Change in Q from merging module {@code from} into module {@code into}.
        private double mergeGain(double[][] blocks, int from, int into) {
            if (from == into) {
                return 0.0;
            }
            return (blocks[from][into] + blocks[into][from]) / total;
        }

        private void mergeBlocks(double[][] blocks, int from, int into) {
            int capacity = blocks.length;
            for (int k = 0; k < capacity; k++) {
                blocks[into][k] += blocks[from][k];
                blocks[from][k] = 0.0;
            }
            for (int k = 0; k < capacity; k++) {
                blocks[k][into] += blocks[k][from];
                blocks[k][from] = 0.0;
            }
        }

        /// Sums of the Barber matrix per (red label, blue label) block.
        private double[][] blockSums(int[] red, int[] blue, int capacity) {
            double[][] blocks = new double[capacity][capacity];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    blocks[red[r]][blue[c]] += barber[r][c];
                }
            }
            return blocks;
        }

        private double modularity(int[] red, int[] blue) {
            double q = 0.0;
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    if (red[r] == blue[c]) {
                        q += barber[r][c];
                    }
                }
            }
            return q / total;
        }
    }

    private static double trace(double[][] blocks) {
        double sum = 0.0;
        for (int k = 0; k < blocks.length; k++) {
            sum += blocks[k][k];
        }
        return sum;
    }

    private static void relabel(int[] labels, int from, int into) {
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == from) {
                labels[i] = into;
            }
        }
    }

    private static int[] distinctLabels(int[] labels, int capacity) {
        boolean[] present = new boolean[capacity];
        int count = 0;
        for (int label : labels) {
            if (label >= 0 && !present[label]) {
                present[label] = true;
                count++;
            }
        }
        int[] distinct = new int[count];
        int next = 0;
        for (int label = 0; label < capacity; label++) {
            if (present[label]) {
                distinct[next++] = label;
            }
        }
        return distinct;
    }

    private static int[] sharedLabels(int[] red, int[] blue, int capacity) {
        boolean[] inRed = new boolean[capacity];
        for (int label : red) {
            inRed[label] = true;
        }
        boolean[] shared = new boolean[capacity];
        int count = 0;
        for (int label : blue) {
            if (label >= 0 && inRed[label] && !shared[label]) {
                shared[label] = true;
                count++;
            }
        }
        int[] result = new int[count];
        int next = 0;
        for (int label = 0; label < capacity; label++) {
            if (shared[label]) {
                result[next++] = label;
            }
        }
        return result;
    }
}
