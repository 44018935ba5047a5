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
/// How a trial's row was produced.
public enum TrialStatus {
    /// every metric is defined
    OK,
    /// empty or complete network; nestedness and modularity are NaN
    DEGENERATE,
    /// an eigen decomposition failed; the affected resilience is NaN
    NUMERIC_INSTABILITY,
    /// the trial threw; every metric is NaN
    FAILED
}
