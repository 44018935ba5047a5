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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for the JSON form of simulation configs and result rows.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable configs |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floating point | Allowed | Undefined metrics are NaN |
///
/// The instance is thread-safe and shared.
public final class NetstabGsonConfig {

    private static final Gson PRETTY = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private NetstabGsonConfig() {
        // Utility class
    }

    /// Shared pretty-printing instance.
    public static Gson gson() {
        return PRETTY;
    }
}
