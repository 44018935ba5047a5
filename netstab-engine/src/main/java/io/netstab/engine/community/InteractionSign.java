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

/**
 * Sign convention for the animal-on-plant block of a community matrix.
 *
 * <p>Plants always benefit animals. Only the effect of animals on plants changes sign.
 */
public enum InteractionSign {

    /** Pollination and seed dispersal: animals benefit plants. */
    MUTUALISTIC(1.0),

    /** Herbivory: animals harm plants. */
    ANTAGONISTIC(-1.0);

    private final double animalOnPlant;

    InteractionSign(double animalOnPlant) {
        this.animalOnPlant = animalOnPlant;
    }

    /**
     * @return +1 or -1, the factor applied to the transposed block
     */
    public double animalOnPlant() {
        return animalOnPlant;
    }
}
