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

import java.util.List;

/// # StrokeGeometry
///
/// Low-level geometry over ordered point sequences.
///
/// ## Purpose
/// Provides the centers and extents that the map encodings are built around:
/// - **Center of mass**: arithmetic mean of all points
/// - **Geometric median**: Weiszfeld approximation of the point minimizing total distance
/// - **Bounds**: per-axis extrema
///
/// ## Usage
/// ```java
/// StrokePoint com = StrokeGeometry.centerOfMass(points);
/// StrokePoint median = StrokeGeometry.geometricMedian(points);
/// Bounds bounds = StrokeGeometry.bounds(points);
/// ```
///
/// All methods are pure and terminate; the median solver is capped at a fixed number of
/// iterations.
public final class StrokeGeometry {

    private static final Logger logger = LogManager.getLogger(StrokeGeometry.class);

    /// Convergence threshold for successive median estimates, in input units.
    public static final double MEDIAN_TOLERANCE = 0.001d;

    /// Iteration cap for the median solver.
    public static final int MEDIAN_MAX_ITERATIONS = 500;

    private StrokeGeometry() {} // Utility class

    /// Computes the arithmetic mean of all points.
    ///
    /// @param points the points
    /// @return the center of mass, or [StrokePoint#ORIGIN] for an empty sequence
    public static StrokePoint centerOfMass(List<StrokePoint> points) {
        if (points == null || points.isEmpty()) {
            return StrokePoint.ORIGIN;
        }
        double sumX = 0.0d;
        double sumY = 0.0d;
        for (StrokePoint p : points) {
            sumX += p.x();
            sumY += p.y();
        }
        return new StrokePoint(sumX / points.size(), sumY / points.size());
    }

    /// Approximates the geometric median with the default tolerance and iteration cap.
    ///
    /// @param points the points
    /// @return the median estimate
    /// @see #geometricMedian(List, double, int)
    public static StrokePoint geometricMedian(List<StrokePoint> points) {
        return geometricMedian(points, MEDIAN_TOLERANCE, MEDIAN_MAX_ITERATIONS);
    }

    /// Approximates the geometric median using Weiszfeld's algorithm.
    ///
    /// The estimate starts at the center of mass and is repeatedly replaced by the
    /// inverse-distance weighted mean of all points. Points coincident with the current
    /// estimate are left out of that iteration's sums. Iteration stops once the estimate
    /// moves less than `tolerance`, or after `maxIterations` updates.
    ///
    /// @param points the points
    /// @param tolerance displacement below which the estimate is considered converged
    /// @param maxIterations upper bound on solver iterations
    /// @return the center of mass for fewer than two points, otherwise the median estimate
    public static StrokePoint geometricMedian(List<StrokePoint> points, double tolerance, int maxIterations) {
        if (points == null || points.size() < 2) {
            return centerOfMass(points);
        }

        StrokePoint estimate = centerOfMass(points);
        for (int i = 0; i < maxIterations; i++) {
            double xNumerator = 0.0d;
            double yNumerator = 0.0d;
            double denominator = 0.0d;
            for (StrokePoint p : points) {
                double distance = estimate.distance(p);
                if (distance != 0.0d) {
                    xNumerator += p.x() / distance;
                    yNumerator += p.y() / distance;
                    denominator += 1.0d / distance;
                }
            }

            StrokePoint next = StrokePoint.ORIGIN;
            if (denominator != 0.0d) {
                next = new StrokePoint(xNumerator / denominator, yNumerator / denominator);
            }

            if (estimate.distance(next) < tolerance) {
                logger.trace("geometric median converged after {} iterations", i + 1);
                return next;
            }
            estimate = next;
        }

        logger.debug("geometric median did not converge within {} iterations over {} points",
            maxIterations, points.size());
        return estimate;
    }

    /// Computes the extrema of a point sequence.
    ///
    /// @param points the points
    /// @return the bounds, all zero for an empty sequence
    public static Bounds bounds(List<StrokePoint> points) {
        return Bounds.of(points);
    }

    /// Finds the largest distance from `center` to any point.
    ///
    /// @param points the points
    /// @param center the reference point
    /// @return the maximum distance, zero for an empty sequence
    public static double maxDistance(List<StrokePoint> points, StrokePoint center) {
        double max = 0.0d;
        for (StrokePoint p : points) {
            double d = p.distance(center);
            if (d > max) max = d;
        }
        return max;
    }
}
