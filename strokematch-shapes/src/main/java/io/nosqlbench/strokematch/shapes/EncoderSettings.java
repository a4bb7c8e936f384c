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

package io.nosqlbench.strokematch.shapes;

/// Tuning constants used when encoding a stroke.
///
/// The defaults assume input coordinates on the order of screen pixels, roughly
/// `0..1200` horizontally and `0..800` vertically. Strokes drawn in much smaller units
/// need proportionally smaller minimum sizes.
///
/// @param minWidth smallest grid box width; narrower strokes are widened around their midpoint
/// @param minHeight smallest grid box height; shorter strokes are heightened around their midpoint
/// @param minRadius smallest circle map radius
/// @param medianTolerance convergence threshold of the geometric median solver
/// @param medianMaxIterations iteration cap of the geometric median solver
/// @param gapDivisor a jump between consecutive points longer than the perpendicular
///                   extent divided by this value starts a new flat map segment
public record EncoderSettings(
    double minWidth,
    double minHeight,
    double minRadius,
    double medianTolerance,
    int medianMaxIterations,
    double gapDivisor
) {

    public static final double DEFAULT_MIN_WIDTH = 50.0d;
    public static final double DEFAULT_MIN_HEIGHT = 50.0d;
    public static final double DEFAULT_MIN_RADIUS = 25.0d;
    public static final double DEFAULT_GAP_DIVISOR = 6.0d;

    private static final EncoderSettings DEFAULTS = new EncoderSettings(
        DEFAULT_MIN_WIDTH,
        DEFAULT_MIN_HEIGHT,
        DEFAULT_MIN_RADIUS,
        StrokeGeometry.MEDIAN_TOLERANCE,
        StrokeGeometry.MEDIAN_MAX_ITERATIONS,
        DEFAULT_GAP_DIVISOR
    );

    public EncoderSettings {
        if (!(minWidth > 0) || !(minHeight > 0) || !(minRadius > 0)) {
            throw new IllegalArgumentException(String.format(
                "Minimum sizes must be positive, got width=%s height=%s radius=%s",
                minWidth, minHeight, minRadius));
        }
        if (!(medianTolerance > 0)) {
            throw new IllegalArgumentException("Median tolerance must be positive, got " + medianTolerance);
        }
        if (medianMaxIterations < 1) {
            throw new IllegalArgumentException("Median iteration cap must be at least 1, got " + medianMaxIterations);
        }
        if (!(gapDivisor > 0)) {
            throw new IllegalArgumentException("Gap divisor must be positive, got " + gapDivisor);
        }
    }

    /// @return the settings used when none are given
    public static EncoderSettings defaults() {
        return DEFAULTS;
    }
}
