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

/// A single sampled position of a stroke.
///
/// Points have no identity beyond their coordinates. Strokes are ordered sequences of
/// these and may contain duplicates.
///
/// @param x horizontal coordinate
/// @param y vertical coordinate, increasing upward
public record StrokePoint(double x, double y) {

    /// The origin, used as the center of an empty stroke.
    public static final StrokePoint ORIGIN = new StrokePoint(0.0d, 0.0d);

    /// Creates a point.
    ///
    /// @param x horizontal coordinate
    /// @param y vertical coordinate
    /// @return the point
    public static StrokePoint of(double x, double y) {
        return new StrokePoint(x, y);
    }

    /// Euclidean distance to another point.
    ///
    /// @param other the other point
    /// @return the distance between the two points
    public double distance(StrokePoint other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
