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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// # ShapeComparator
///
/// Pairwise difference functions between two [EncodedShape]s, one per representation.
///
/// Lower values mean closer shapes; comparing a shape with itself gives 0 for every
/// representation. Shapes of different precision, or a missing counterpart, are not
/// comparable and yield [#NOT_COMPARABLE] instead of an error.
public final class ShapeComparator {

    private static final Logger logger = LogManager.getLogger(ShapeComparator.class);

    /// Difference reported for shapes that cannot be compared.
    public static final double NOT_COMPARABLE = 100.0d;

    private ShapeComparator() {} // Utility class

    /// @param a first shape
    /// @param b second shape
    /// @return true if both are present and share a precision
    public static boolean comparable(EncodedShape a, EncodedShape b) {
        return a != null && b != null && a.precision() == b.precision();
    }

    /// Mean squared error over all grid cells.
    ///
    /// @param a first shape
    /// @param b second shape
    /// @return the grid difference, or [#NOT_COMPARABLE]
    public static double gridDifference(EncodedShape a, EncodedShape b) {
        if (!comparable(a, b)) {
            return NOT_COMPARABLE;
        }
        GridMap ga = a.gridMap();
        GridMap gb = b.gridMap();
        int n = a.precision();
        double totalSqError = 0.0d;
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                double diff = ga.get(row, col) - gb.get(row, col);
                totalSqError += diff * diff;
            }
        }
        return totalSqError / (n * n);
    }

    /// Mean squared error over the median-centered circle maps.
    ///
    /// @param a first shape
    /// @param b second shape
    /// @return the circle difference, or [#NOT_COMPARABLE]
    public static double circleDifference(EncodedShape a, EncodedShape b) {
        return circleDifference(a, b, CircleCenter.MEDIAN);
    }

    /// Mean squared error over the circle maps built around the given center.
    ///
    /// @param a first shape
    /// @param b second shape
    /// @param center which circle maps to compare
    /// @return the circle difference, or [#NOT_COMPARABLE]
    public static double circleDifference(EncodedShape a, EncodedShape b, CircleCenter center) {
        return circleDifference(a, b, center, 1, CircleMap.QUADRANTS);
    }

    /// Mean squared error over an inclusive range of quadrants of every ring.
    ///
    /// Quadrants are numbered from 1 here, so `1..4` covers the whole map and `1..1`
    /// compares only the upper-right quadrant.
    ///
    /// @param a first shape
    /// @param b second shape
    /// @param center which circle maps to compare
    /// @param firstQuadrant first quadrant number, from 1
    /// @param lastQuadrant last quadrant number, at most 4
    /// @return the difference over the selected cells, or [#NOT_COMPARABLE]
    /// @throws IllegalArgumentException if the quadrant range is empty or out of `1..4`
    public static double circleDifference(
        EncodedShape a, EncodedShape b, CircleCenter center, int firstQuadrant, int lastQuadrant) {
        if (firstQuadrant < 1 || lastQuadrant > CircleMap.QUADRANTS || firstQuadrant > lastQuadrant) {
            throw new IllegalArgumentException(
                "Quadrant range must lie within 1.." + CircleMap.QUADRANTS + ", got " + firstQuadrant + ".." + lastQuadrant);
        }
        if (!comparable(a, b)) {
            return NOT_COMPARABLE;
        }
        CircleMap ca = a.circleMap(center);
        CircleMap cb = b.circleMap(center);
        int rings = a.precision();
        double totalSqError = 0.0d;
        for (int ring = 0; ring < rings; ring++) {
            for (int q = firstQuadrant - 1; q < lastQuadrant; q++) {
                double diff = ca.get(ring, q) - cb.get(ring, q);
                totalSqError += diff * diff;
            }
        }
        return totalSqError / (rings * (lastQuadrant - firstQuadrant + 1));
    }

    /// Mismatch fraction between two flat maps, minimized over small shifts.
    ///
    /// @param a first shape
    /// @param b second shape
    /// @param axis which flat maps to compare
    /// @return the lowest mismatch fraction found, or [#NOT_COMPARABLE]
    /// @see #shiftedMismatch(int[], int[], int)
    public static double flatDifference(EncodedShape a, EncodedShape b, Axis axis) {
        if (a == null || b == null) {
            return NOT_COMPARABLE;
        }
        if (a.precision() != b.precision()) {
            logger.warn("{} flat maps are not comparable: precision {} vs {}", axis, a.precision(), b.precision());
            return NOT_COMPARABLE;
        }
        return shiftedMismatch(a.flatMap(axis).toArray(), b.flatMap(axis).toArray(), a.precision());
    }

    /// Compares two equal-length bin arrays at every shift up to `radius` in each direction.
    ///
    /// At zero shift only the interior bins are compared, since the first and last bins
    /// are sensitive to where the bounds fall, and each mismatch adds `1/n`. At shift `s`
    /// the `n - s` overlapping bins are compared and each mismatch adds `1/(n - s)`.
    ///
    /// @param map bins of the first map
    /// @param reference bins of the second map, same length
    /// @param radius largest shift tried in each direction
    /// @return the smallest mismatch fraction over all shifts
    public static double shiftedMismatch(int[] map, int[] reference, int radius) {
        if (map.length != reference.length) {
            throw new IllegalArgumentException(
                "Flat maps must have the same length, got " + map.length + " and " + reference.length);
        }
        int n = map.length;
        double lowest = 0.0d;
        for (int i = 1; i < n - 1; i++) {
            if (map[i] != reference[i]) {
                lowest += 1.0d / n;
            }
        }

        for (int shift = 1; shift <= radius && shift < n; shift++) {
            int compared = n - shift;
            double left = 0.0d;
            double right = 0.0d;
            for (int i = 0; i < compared; i++) {
                if (map[i + shift] != reference[i]) {
                    left += 1.0d / compared;
                }
                if (map[i] != reference[i + shift]) {
                    right += 1.0d / compared;
                }
            }
            lowest = Math.min(lowest, Math.min(left, right));
        }
        return lowest;
    }

    /// Pulls the larger of the grid and circle differences toward the smaller one.
    ///
    /// With `gap` the absolute difference between the two, the larger value becomes
    /// `smaller + gap * bias` where `bias = 1 / (2 * (1 + gap))`. Small gaps are nearly
    /// halved, large gaps are left mostly intact. Equal values are returned unchanged.
    ///
    /// @param grid scaled grid difference
    /// @param circle scaled circle difference
    /// @return the coupled pair
    public static CoupledScores couple(double grid, double circle) {
        if (circle < grid) {
            double gap = grid - circle;
            double bias = 1.0d / (2.0d * (1.0d + gap));
            return new CoupledScores(circle + gap * bias, circle);
        }
        if (grid < circle) {
            double gap = circle - grid;
            double bias = 1.0d / (2.0d * (1.0d + gap));
            return new CoupledScores(grid, grid + gap * bias);
        }
        return new CoupledScores(grid, circle);
    }
}
