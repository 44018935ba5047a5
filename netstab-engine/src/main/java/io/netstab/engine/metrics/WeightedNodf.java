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

import io.netstab.engine.matrix.BipartiteMatrix;

import java.util.Objects;

/// Weighted NODF nestedness (Almeida-Neto and Ulrich, 2011).
///
/// ## Pair score
///
/// For a pair of rows (or of columns), let `hi` be the one with strictly more links and
/// `lo` the other:
///
/// ```text
///            100 · |{ k : lo[k] > 0  and  hi[k] > lo[k] }|
/// score  =  ───────────────────────────────────────────────     if deg(hi) > deg(lo) > 0
///                             deg(lo)
///
/// score  =  0                                                 otherwise
/// ```
///
/// A pair only contributes when the poorer species' partners are also partners of the richer
/// species, and with strictly larger interaction strength there. Rows and columns are scored
/// separately; the combined score is the mean over every row pair and column pair.
///
/// ## Complexity
///
/// O(P²·A + A²·P) time, O(P + A) extra space.
public final class WeightedNodf {

    private static final double MAX_SCORE = 100.0;

    /// Computes weighted NODF, or [NestednessResult#UNDEFINED] for degenerate networks.
    public NestednessResult compute(BipartiteMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        if (StructuralMetricsProvider.isDegenerate(matrix.binarize())) {
            return NestednessResult.UNDEFINED;
        }

        double[][] values = matrix.toArray();
        PairTotals rows = scorePairs(values);
        PairTotals columns = scorePairs(matrix.transpose().toArray());

        long pairs = rows.pairs + columns.pairs;
        double combined = pairs == 0 ? Double.NaN : (rows.sum + columns.sum) / pairs;
        return new NestednessResult(rows.mean(), columns.mean(), combined);
    }

    /// Scores every pair of rows of {@code values}.
    private PairTotals scorePairs(double[][] values) {
        int n = values.length;
        int[] degrees = new int[n];
        for (int i = 0; i < n; i++) {
            for (double v : values[i]) {
                if (v > 0.0) {
                    degrees[i]++;
                }
            }
        }

        double sum = 0.0;
        long pairs = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                pairs++;
                if (degrees[i] == degrees[j]) {
                    continue;
                }
                int hi = degrees[i] > degrees[j] ? i : j;
                int lo = hi == i ? j : i;
                if (degrees[lo] == 0) {
                    continue;
                }
                sum += pairScore(values[hi], values[lo], degrees[lo]);
            }
        }
        return new PairTotals(sum, pairs);
    }

    private double pairScore(double[] hi, double[] lo, int loDegree) {
        int nested = 0;
        for (int k = 0; k < lo.length; k++) {
            if (lo[k] > 0.0 && hi[k] > lo[k]) {
                nested++;
            }
        }
        return MAX_SCORE * nested / loDegree;
    }

    private static final class PairTotals {
        final double sum;
        final long pairs;

        PairTotals(double sum, long pairs) {
            this.sum = sum;
            this.pairs = pairs;
        }

        double mean() {
            return pairs == 0 ? Double.NaN : sum / pairs;
        }
    }
}
