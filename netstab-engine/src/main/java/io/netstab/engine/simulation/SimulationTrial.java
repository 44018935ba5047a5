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
import com.google.gson.annotations.SerializedName;

/// One row of the results table.
///
/// Undefined metrics are NaN; [#status()] says why.
///
/// @param trial zero-based trial index
/// @param plants number of plant species
/// @param animals number of animal species
/// @param drawnConnectance the connectance probability drawn for this trial
/// @param diversity plants + animals
/// @param connectance realized connectance, links / (plants × animals)
/// @param nestedness weighted NODF in [0,100]
/// @param modularity bipartite modularity in [0,1]
/// @param resilienceMutualism resilience of the mutualistic community matrix
/// @param resilienceAntagonism resilience of the antagonistic community matrix
/// @param status how the row was produced
public record SimulationTrial(
    @SerializedName("trial") int trial,
    @SerializedName("plants") int plants,
    @SerializedName("animals") int animals,
    @SerializedName("drawn_connectance") double drawnConnectance,
    @SerializedName("diversity") int diversity,
    @SerializedName("connectance") double connectance,
    @SerializedName("nestedness") double nestedness,
    @SerializedName("modularity") double modularity,
    @SerializedName("resilience_mutualism") double resilienceMutualism,
    @SerializedName("resilience_antagonism") double resilienceAntagonism,
    @SerializedName("status") TrialStatus status
) {

    /// A row for a trial that threw after its parameters were drawn.
    public static SimulationTrial failed(int trial, int plants, int animals, double drawnConnectance) {
        return new SimulationTrial(trial, plants, animals, drawnConnectance, plants + animals,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, TrialStatus.FAILED);
    }
}
