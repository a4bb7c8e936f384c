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

import java.util.Arrays;

/// Ring-by-quadrant matrix of point-density ratios around a center point.
///
/// Rings are equally wide and numbered outward from 0. Each ring is split into four
/// quadrants relative to the center:
///
/// | index | x offset | y offset |
/// |-------|----------|----------|
/// | 0     | `>= 0`   | `>= 0`   |
/// | 1     | `>= 0`   | `< 0`    |
/// | 2     | `< 0`    | `< 0`    |
/// | 3     | `< 0`    | `>= 0`   |
///
/// For a non-empty stroke the cells sum to 1.
public final class CircleMap {

    /// Number of quadrants in every ring.
    public static final int QUADRANTS = 4;

    private final double[][] cells;
    private final StrokePoint center;

    CircleMap(double[][] cells, StrokePoint center) {
        this.cells = cells;
        this.center = center;
    }

    /// @param rings the number of rings
    /// @return a map with every cell zero, centered at the origin
    public static CircleMap empty(int rings) {
        return new CircleMap(new double[rings][QUADRANTS], StrokePoint.ORIGIN);
    }

    /// Finds the quadrant index of a point relative to a center.
    ///
    /// @param point the point
    /// @param center the center
    /// @return quadrant index in `0..3`; a zero offset counts as positive
    public static int quadrantOf(StrokePoint point, StrokePoint center) {
        boolean xPositive = point.x() - center.x() >= 0;
        boolean yPositive = point.y() - center.y() >= 0;
        if (xPositive) {
            return yPositive ? 0 : 1;
        }
        return yPositive ? 3 : 2;
    }

    /// @return the number of rings
    public int rings() {
        return cells.length;
    }

    /// @return the point the rings are centered on
    public StrokePoint center() {
        return center;
    }

    /// @param ring ring index, 0 innermost
    /// @param quadrant quadrant index in `0..3`
    /// @return the density ratio of that cell
    public double get(int ring, int quadrant) {
        return cells[ring][quadrant];
    }

    public double sum() {
        double sum = 0.0d;
        for (double[] ring : cells) {
            for (double v : ring) {
                sum += v;
            }
        }
        return sum;
    }

    /// @return a copy of the cells, indexed `[ring][quadrant]`
    public double[][] toArray() {
        double[][] copy = new double[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CircleMap)) return false;
        CircleMap that = (CircleMap) o;
        return center.equals(that.center) && Arrays.deepEquals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * center.hashCode() + Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return "CircleMap{center=" + center + ", cells=" + Arrays.deepToString(cells) + "}";
    }
}
