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

import java.util.List;

/// Extrema of a point sequence.
///
/// For any non-empty sequence `left <= right` and `bottom <= top`. The empty sequence
/// yields [#EMPTY], which is all zero.
///
/// @param left smallest x
/// @param right largest x
/// @param top largest y
/// @param bottom smallest y
public record Bounds(double left, double right, double top, double bottom) {

    /// Bounds of an empty stroke.
    public static final Bounds EMPTY = new Bounds(0.0d, 0.0d, 0.0d, 0.0d);

    /// Computes the bounds of a point sequence in a single pass.
    ///
    /// @param points the points, may be empty
    /// @return the bounds, or [#EMPTY] for no points
    public static Bounds of(List<StrokePoint> points) {
        if (points == null || points.isEmpty()) {
            return EMPTY;
        }
        StrokePoint first = points.get(0);
        double left = first.x();
        double right = first.x();
        double top = first.y();
        double bottom = first.y();
        for (StrokePoint p : points) {
            if (p.x() < left) left = p.x();
            if (p.x() > right) right = p.x();
            if (p.y() > top) top = p.y();
            if (p.y() < bottom) bottom = p.y();
        }
        return new Bounds(left, right, top, bottom);
    }

    public double width() {
        return right - left;
    }

    public double height() {
        return top - bottom;
    }

    public double centerX() {
        return (left + right) / 2.0d;
    }

    public double centerY() {
        return (top + bottom) / 2.0d;
    }

    /// Returns bounds that are at least `minWidth` wide and `minHeight` tall.
    ///
    /// A narrow box grows symmetrically around its horizontal midpoint and a short box
    /// grows symmetrically around its vertical midpoint, so a degenerate stroke lands in
    /// the middle of the expanded box.
    ///
    /// @param minWidth smallest allowed width
    /// @param minHeight smallest allowed height
    /// @return these bounds if already large enough, otherwise expanded bounds
    public Bounds expandedTo(double minWidth, double minHeight) {
        double newLeft = left;
        double newRight = right;
        double newTop = top;
        double newBottom = bottom;
        if (width() < minWidth) {
            double mid = centerX();
            newLeft = mid - minWidth / 2.0d;
            newRight = mid + minWidth / 2.0d;
        }
        if (height() < minHeight) {
            double mid = centerY();
            newBottom = mid - minHeight / 2.0d;
            newTop = mid + minHeight / 2.0d;
        }
        if (newLeft == left && newRight == right && newTop == top && newBottom == bottom) {
            return this;
        }
        return new Bounds(newLeft, newRight, newTop, newBottom);
    }
}
