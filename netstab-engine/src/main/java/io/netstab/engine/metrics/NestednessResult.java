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

/// Weighted NODF scores for one network.
///
/// @param rows mean pair score over plant pairs, NaN if there is only one plant
/// @param columns mean pair score over animal pairs, NaN if there is only one animal
/// @param combined mean pair score over all plant and animal pairs
public record NestednessResult(double rows, double columns, double combined) {

    public static final NestednessResult UNDEFINED =
        new NestednessResult(Double.NaN, Double.NaN, Double.NaN);

    public boolean isDefined() {
        return !Double.isNaN(combined);
    }
}
