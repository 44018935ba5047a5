package io.netstab.engine.trace;

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
import io.netstab.engine.simulation.ResultsTable;
import io.netstab.engine.simulation.SimulationConfig;
import io.netstab.engine.simulation.SimulationTrial;

/// Observer for monitoring a simulation run trial by trial.
///
/// ## Lifecycle
///
/// ```text
///   ┌────────────┐
///   │ onRunStart │ ──► once, after the configuration is validated
///   └────────────┘
///         │
///         ▼
///   ┌─────────────────┐
///   │ onTrialComplete │ ──► once per finished trial, in completion order
///   └─────────────────┘
///         │
///         ▼
///   ┌───────────────┐
///   │ onRunComplete │ ──► once, with the ordered table
///   └───────────────┘
/// ```
///
/// ## Thread Safety
///
/// With parallelism above 1, [#onTrialComplete] is called concurrently from pool threads.
///
/// @see io.netstab.engine.simulation.SimulationDriver
public interface TrialObserver {

    /// No-op observer.
    TrialObserver NOOP = new TrialObserver() {
        @Override
        public void onRunStart(SimulationConfig config) {
            // No-op
        }

        @Override
        public void onTrialComplete(SimulationTrial trial) {
            // No-op
        }

        @Override
        public void onRunComplete(ResultsTable results) {
            // No-op
        }
    };

    /// @param config the validated configuration of the run
    void onRunStart(SimulationConfig config);

    /// @param trial the finished row, whatever its status
    void onTrialComplete(SimulationTrial trial);

    /// @param results all rows in trial order
    void onRunComplete(ResultsTable results);
}
