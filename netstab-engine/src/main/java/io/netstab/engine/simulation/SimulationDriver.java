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
import io.netstab.engine.generate.RandomGenerators;
import io.netstab.engine.metrics.DefaultStructuralMetricsProvider;
import io.netstab.engine.metrics.StructuralMetricsProvider;
import io.netstab.engine.stability.StabilityEstimator;
import io.netstab.engine.trace.TrialObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs a batch of independent trials and collects their rows.
 *
 * <h2>Execution</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │ validate config ─► derive N seeds from the master seed (trial order)    │
 * └─────────────────────────────────────────────────────────────────────────┘
 *                                    │
 *              ┌─────────────────────┴──────────────────────┐
 *              ▼                                            ▼
 *   parallelism == 1: sequential loop        parallelism > 1: ForkJoinPool,
 *                                            ordered parallel stream
 *              └─────────────────────┬──────────────────────┘
 *                                    ▼
 *                     ResultsTable, rows in trial order
 * </pre>
 *
 * <p>Each trial builds its own generator from its derived seed, so a seeded run gives the same table
 * at every parallelism level.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SimulationConfig config = SimulationConfig.builder()
 *     .plants(8, 30).animals(16, 60).connectance(0.05, 0.5)
 *     .trials(1000).seed(42L)
 *     .build();
 * ResultsTable table = new SimulationDriver().run(config);
 * }</pre>
 */
public final class SimulationDriver {

    private static final Logger logger = LogManager.getLogger(SimulationDriver.class);

    private final StructuralMetricsProvider metrics;
    private final StabilityEstimator stabilityEstimator;
    private final TrialObserver observer;
    private final AtomicLong trialsCompleted = new AtomicLong();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public SimulationDriver() {
        this(null, TrialObserver.NOOP);
    }

    public SimulationDriver(TrialObserver observer) {
        this(null, observer);
    }

    /**
     * @param metrics structural metrics implementation, or null for the default one configured
     *                from each run's modularity restarts
     * @param observer per-trial observer
     */
    public SimulationDriver(StructuralMetricsProvider metrics, TrialObserver observer) {
        this(metrics, new StabilityEstimator(), observer);
    }

    /**
     * @param metrics structural metrics implementation, or null for the default one
     * @param stabilityEstimator eigen analysis shared by all trials
     * @param observer per-trial observer
     */
    public SimulationDriver(StructuralMetricsProvider metrics, StabilityEstimator stabilityEstimator,
                            TrialObserver observer) {
        this.metrics = metrics;
        this.stabilityEstimator = Objects.requireNonNull(stabilityEstimator, "stabilityEstimator cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    /**
     * Returns the default parallelism (number of available processors).
     */
    public static int defaultParallelism() {
        return Runtime.getRuntime().availableProcessors();
    }

    public ResultsTable run(SimulationConfig config) {
        return run(config, null);
    }

    /**
     * Runs every trial of {@code config}.
     *
     * @param config the run parameters
     * @param progressCallback receives progress after each trial, may be null
     * @return one row per trial in trial order; after {@link #cancel()}, the completed prefix
     * @throws io.netstab.engine.SimulationParameterException if the configuration is invalid
     */
    public ResultsTable run(SimulationConfig config, ProgressCallback progressCallback) {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();

        StructuralMetricsProvider provider = metrics != null
            ? metrics
            : new DefaultStructuralMetricsProvider(config.getModularityRestarts());
        TrialRunner runner = new TrialRunner(config, provider, stabilityEstimator);
        int trials = config.getTrials();
        long[] seeds = RandomGenerators.deriveSeeds(config.getSeed(), trials);

        trialsCompleted.set(0);
        cancelled.set(false);
        observer.onRunStart(config);
        logger.info("Starting {} trials (plants {}-{}, animals {}-{}, connectance {}-{}, parallelism {}, seed {})",
            trials, config.getPlantMin(), config.getPlantMax(), config.getAnimalMin(), config.getAnimalMax(),
            config.getConnectanceMin(), config.getConnectanceMax(), config.getParallelism(), config.getSeed());
        long startTime = System.currentTimeMillis();

        List<SimulationTrial> rows = config.getParallelism() == 1
            ? runSequential(runner, seeds, progressCallback)
            : runParallel(runner, seeds, config.getParallelism(), progressCallback);

        ResultsTable table = new ResultsTable(rows);
        long elapsed = System.currentTimeMillis() - startTime;
        if (cancelled.get()) {
            logger.info("Run cancelled after {} of {} trials in {} ms", table.size(), trials, elapsed);
        } else {
            logger.info("Completed {} trials in {} ms: {}", table.size(), elapsed, table.countByStatus());
        }
        observer.onRunComplete(table);
        return table;
    }

    private List<SimulationTrial> runSequential(TrialRunner runner, long[] seeds, ProgressCallback progressCallback) {
        List<SimulationTrial> rows = new ArrayList<>(seeds.length);
        for (int i = 0; i < seeds.length && !cancelled.get(); i++) {
            rows.add(runOne(runner, i, seeds[i], seeds.length, progressCallback));
        }
        return rows;
    }

    private List<SimulationTrial> runParallel(TrialRunner runner, long[] seeds, int parallelism,
                                              ProgressCallback progressCallback) {
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            // skipped trials stay in place as null so the list keeps trial order
            List<SimulationTrial> slots = pool.submit(() -> IntStream.range(0, seeds.length)
                .parallel()
                .mapToObj(i -> cancelled.get() ? null : runOne(runner, i, seeds[i], seeds.length, progressCallback))
                .collect(Collectors.toList())
            ).get();
            return completedPrefix(slots);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Simulation failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Rows up to the first skipped trial. After a cancel, pool threads may have finished trials
     * beyond that point; they are dropped so row {@code i} is always trial {@code i}.
     */
    static List<SimulationTrial> completedPrefix(List<SimulationTrial> slots) {
        int end = slots.indexOf(null);
        if (end < 0) {
            return slots;
        }
        long discarded = slots.subList(end, slots.size()).stream().filter(Objects::nonNull).count();
        if (discarded > 0) {
            logger.debug("Discarding {} trials finished after the first skipped trial {}", discarded, end);
        }
        return new ArrayList<>(slots.subList(0, end));
    }

    private SimulationTrial runOne(TrialRunner runner, int index, long seed, int total,
                                   ProgressCallback progressCallback) {
        SimulationTrial trial = runner.runTrial(index, seed);
        observer.onTrialComplete(trial);
        long completed = trialsCompleted.incrementAndGet();
        if (progressCallback != null) {
            progressCallback.onProgress((double) completed / total,
                String.format("Completed %d/%d trials", completed, total));
        }
        return trial;
    }

    /**
     * Stops scheduling further trials. The run returns the longest prefix of trials that all
     * finished; in a parallel run, trials finished past the first skipped one are discarded.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Returns the number of trials finished so far in the current or last run.
     */
    public long getTrialsCompleted() {
        return trialsCompleted.get();
    }

    /**
     * Callback interface for progress reporting.
     */
    @FunctionalInterface
    public interface ProgressCallback {
        /**
         * Called after each finished trial.
         *
         * @param progress fraction complete, 0.0 to 1.0
         * @param message descriptive message
         */
        void onProgress(double progress, String message);
    }
}
