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

/// One ranked entry of a match.
///
/// @param entry the stored entry that was compared
/// @param rawScore fused difference; lower is closer
/// @param percent confidence relative to the other entries, from 0 to 100
public record MatchResult(LabeledShape entry, double rawScore, double percent) {

    /// @return the matched entry's name
    public String name() {
        return entry.name();
    }

    @Override
    public String toString() {
        return String.format("%s (%.2f%%, raw=%.4f)", entry.name(), percent, rawScore);
    }
}
