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

/// Per-representation weights applied when fusing differences into a raw score.
///
/// @param grid weight of the grid map difference
/// @param circle weight of the median-centered circle map difference
/// @param horizontal weight of the horizontal flat map difference
/// @param vertical weight of the vertical flat map difference
public record MapWeights(double grid, double circle, double horizontal, double vertical) {

    private static final MapWeights EQUAL = new MapWeights(1.0d, 1.0d, 1.0d, 1.0d);

    public MapWeights {
        requireWeight("grid", grid);
        requireWeight("circle", circle);
        requireWeight("horizontal", horizontal);
        requireWeight("vertical", vertical);
    }

    /// Equal weights of 1.0, the recommended setting for every library.
    public static MapWeights defaults() {
        return EQUAL;
    }

    /// Fuses four differences into one score.
    ///
    /// @return `horizontal*wH + vertical*wV + circle*wC + grid*wG`
    public double combine(double gridDiff, double circleDiff, double horizontalDiff, double verticalDiff) {
        return (horizontalDiff * horizontal) + (verticalDiff * vertical)
            + (circleDiff * circle) + (gridDiff * grid);
    }

    private static void requireWeight(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException(
                String.format("%s weight must be a finite non-negative number, got %s", name, value));
        }
    }
}
