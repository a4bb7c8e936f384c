/*
 * Copyright (c) nosqlbench
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

package io.nosqlbench.strokematch.library;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for library snapshots.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable snapshots |
/// | Serialize nulls | Disabled | Compact output |
/// | HTML escaping | Disabled | Entry names are stored verbatim |
///
/// The [Gson] instance is thread-safe and shared.
///
/// @see LibraryCodec
public final class StrokematchGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private StrokematchGsonConfig() {
        // Utility class
    }

    /// @return the shared, pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a new GsonBuilder with the strokematch defaults
    static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping();
    }
}
