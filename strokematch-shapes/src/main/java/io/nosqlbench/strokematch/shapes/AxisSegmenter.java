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

import java.util.ArrayList;
import java.util.List;

/// Reduces a stroke to straight segments along one axis.
///
/// The segmenter walks the stroke while tracking whether the axis coordinate is currently
/// increasing or decreasing. A segment closes at point `i` and the next one opens at
/// point `i + 1` when either:
/// - both of the next two points lie on the opposite side of point `i` from the current
///   trend, or
/// - the jump from point `i` to point `i + 1` is longer than the perpendicular extent of
///   the stroke divided by the gap divisor (a pen lift).
///
/// Each split flips the tracked trend. Strokes of three points or fewer become one segment
/// from the first to the last point.
public final class AxisSegmenter {

    private final Axis axis;
    private final double gapDivisor;

    /// @param axis the axis to segment along
    /// @param gapDivisor divisor of the perpendicular extent giving the pen-lift distance
    public AxisSegmenter(Axis axis, double gapDivisor) {
        this.axis = axis;
        this.gapDivisor = gapDivisor;
    }

    /// @param points the stroke, at least one point
    /// @param bounds bounds of the stroke
    /// @return segments in drawing order
    public List<Segment> segment(List<StrokePoint> points, Bounds bounds) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Cannot segment an empty stroke");
        }
        List<Segment> segments = new ArrayList<>();
        StrokePoint first = points.get(0);
        StrokePoint last = points.get(points.size() - 1);
        if (points.size() <= 3) {
            segments.add(new Segment(axis.coordinate(first), axis.coordinate(last)));
            return segments;
        }

        double gap = axis.perpendicularExtent(bounds) / gapDivisor;
        double lineStart = axis.coordinate(first);
        boolean increasing = axis.coordinate(points.get(2)) > lineStart;

        for (int i = 0; i < points.size() - 2; i++) {
            StrokePoint current = points.get(i);
            StrokePoint next = points.get(i + 1);
            double here = axis.coordinate(current);
            double c1 = axis.coordinate(next);
            double c2 = axis.coordinate(points.get(i + 2));

            boolean reversed = increasing ? (c1 < here && c2 < here) : (c1 > here && c2 > here);
            if (reversed || current.distance(next) > gap) {
                segments.add(new Segment(lineStart, here));
                lineStart = c1;
                increasing = !increasing;
            }
        }

        segments.add(new Segment(lineStart, axis.coordinate(last)));
        return segments;
    }
}
