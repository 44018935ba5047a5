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

import java.util.Arrays;
import java.util.Objects;

/// Best bipartite partition found by a modularity search. Label arrays are copied in and out;
/// equality compares their contents.
///
/// @param q Barber's bipartite modularity of the partition, in [0,1], or NaN if undefined
/// @param moduleCount number of distinct modules across both species sets
/// @param plantModules module label of every plant, labels compacted to 0..moduleCount-1
/// @param animalModules module label of every animal, same label space as the plants
public record ModularityResult(double q, int moduleCount, int[] plantModules, int[] animalModules) {

    public ModularityResult {
        Objects.requireNonNull(plantModules, "plantModules cannot be null");
        Objects.requireNonNull(animalModules, "animalModules cannot be null");
        plantModules = plantModules.clone();
        animalModules = animalModules.clone();
    }

    public static ModularityResult undefined(int plants, int animals) {
        int[] plantModules = new int[plants];
        int[] animalModules = new int[animals];
        Arrays.fill(plantModules, -1);
        Arrays.fill(animalModules, -1);
        return new ModularityResult(Double.NaN, 0, plantModules, animalModules);
    }

    @Override
    public int[] plantModules() {
        return plantModules.clone();
    }

    @Override
    public int[] animalModules() {
        return animalModules.clone();
    }

    public boolean isDefined() {
        return !Double.isNaN(q);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModularityResult that)) {
            return false;
        }
        return Double.compare(q, that.q) == 0
            && moduleCount == that.moduleCount
            && Arrays.equals(plantModules, that.plantModules)
            && Arrays.equals(animalModules, that.animalModules);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(q, moduleCount);
        result = 31 * result + Arrays.hashCode(plantModules);
        result = 31 * result + Arrays.hashCode(animalModules);
        return result;
    }

    @Override
    public String toString() {
        return "ModularityResult{q=" + q + ", modules=" + moduleCount
            + ", plants=" + Arrays.toString(plantModules)
            + ", animals=" + Arrays.toString(animalModules) + "}";
    }
}
