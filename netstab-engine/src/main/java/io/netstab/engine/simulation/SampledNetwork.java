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
import io.netstab.engine.matrix.BinaryBipartiteMatrix;
import io.netstab.engine.matrix.BipartiteMatrix;

/// One sampled network: its random topology and the exponential weights laid over it.
///
/// @param topology the binary links
/// @param weighted the interaction strengths, zero wherever there is no link
public record SampledNetwork(BinaryBipartiteMatrix topology, BipartiteMatrix weighted) {
}
