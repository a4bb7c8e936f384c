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

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/// Serialized form of a [ShapeLibrary].
///
/// Only the source points of each entry are stored; maps are rebuilt on load.
///
/// ```json
/// {
///   "name": "letters",
///   "empty_precision": 4,
///   "has_empty": true,
///   "weights": {"grid": 1.0, "circle": 1.0, "horizontal": 1.0, "vertical": 1.0},
///   "entries": [
///     {"name": "L", "precision": 5, "points": [[100.0, 300.0], [100.0, 298.0]]}
///   ]
/// }
/// ```
public class LibrarySnapshot {

    @SerializedName("name")
    String name;

    @SerializedName("empty_precision")
    Integer emptyPrecision;

    @SerializedName("has_empty")
    Boolean hasEmpty;

    @SerializedName("weights")
    RecognizerConfig.WeightsConfig weights;

    @SerializedName("entries")
    List<EntrySnapshot> entries = new ArrayList<>();

    /// One stored entry.
    public static class EntrySnapshot {
        @SerializedName("name")
        String name;

        @SerializedName("precision")
        Integer precision;

        @SerializedName("points")
        double[][] points;

        EntrySnapshot() {
        }

        EntrySnapshot(String name, int precision, double[][] points) {
            this.name = name;
            this.precision = precision;
            this.points = points;
        }
    }

    public String getName() {
        return name;
    }

    public int getEntryCount() {
        return entries == null ? 0 : entries.size();
    }
}
