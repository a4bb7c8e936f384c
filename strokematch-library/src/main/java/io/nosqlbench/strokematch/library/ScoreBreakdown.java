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

/// Component differences behind a raw score.
///
/// `grid` and `circle` are the scaled values after bias coupling; `horizontal` and
/// `vertical` are the flat map mismatch fractions.
///
/// @param grid coupled grid difference, scaled by 100
/// @param circle coupled circle difference, scaled by 100
/// @param horizontal horizontal flat map difference
/// @param vertical vertical flat map difference
/// @param raw weighted sum of the four; lower is a closer match
public record ScoreBreakdown(double grid, double circle, double horizontal, double vertical, double raw) {

    @Override
    public String toString() {
        return String.format("grid=%.4f circle=%.4f horizontal=%.4f vertical=%.4f raw=%.4f",
            grid, circle, horizontal, vertical, raw);
    }
}
