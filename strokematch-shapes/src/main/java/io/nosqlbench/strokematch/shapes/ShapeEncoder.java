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
import java.util.Objects;

/// # ShapeEncoder
///
/// Turns a finished stroke into the four map representations used for matching.
///
/// ## Representations
/// - **Grid map**: `precision x precision` density grid over the bounding box, see [GridMap]
/// - **Circle maps**: `precision` rings by 4 quadrants around the center of mass and
///   around the geometric median, see [CircleMap]
/// - **Flat maps**: `precision²` bins of segment density along x and along y, see [FlatMap]
///
/// ## Usage
/// ```java
/// ShapeEncoder encoder = new ShapeEncoder(EncoderSettings.defaults());
/// EncodedShape shape = encoder.encode(points, 5);
/// ```
///
/// Encoding is deterministic: the same points and precision always give equal maps.
public final class ShapeEncoder {

    private static final ShapeEncoder DEFAULT = new ShapeEncoder(EncoderSettings.defaults());

    private final EncoderSettings settings;

    public ShapeEncoder(EncoderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /// @return an encoder using [EncoderSettings#defaults()]
    public static ShapeEncoder defaults() {
        return DEFAULT;
    }

    public EncoderSettings settings() {
        return settings;
    }

    /// Encodes a stroke.
    ///
    /// @param points the stroke in drawing order, may be empty
    /// @param precision resolution shared by all representations, at least 1
    /// @return the encoded shape
    public EncodedShape encode(List<StrokePoint> points, int precision) {
        requirePrecision(precision);
        List<StrokePoint> copy = List.copyOf(Objects.requireNonNull(points, "points"));
        return encode(copy, StrokeGeometry.bounds(copy), precision);
    }

    EncodedShape encode(List<StrokePoint> points, Bounds bounds, int precision) {
        requirePrecision(precision);
        return new EncodedShape(
            this,
            points,
            bounds,
            precision,
            gridMap(points, bounds, precision),
            circleMap(points, precision, CircleCenter.MASS),
            circleMap(points, precision, CircleCenter.MEDIAN),
            flatMap(points, bounds, precision, Axis.HORIZONTAL),
            flatMap(points, bounds, precision, Axis.VERTICAL)
        );
    }

    /// Builds the density grid.
    ///
    /// The box is widened or heightened to the configured minimum around its midpoint so
    /// that thin strokes still spread across rows and columns. Points on the top or right
    /// edge fall into the last row or column.
    ///
    /// @param points the stroke
    /// @param bounds bounds of the stroke
    /// @param precision grid size
    /// @return the normalized grid
    public GridMap gridMap(List<StrokePoint> points, Bounds bounds, int precision) {
        if (points.isEmpty()) {
            return GridMap.empty(precision);
        }
        Bounds box = bounds.expandedTo(settings.minWidth(), settings.minHeight());
        double cellWidth = box.width() / precision;
        double cellHeight = box.height() / precision;

        double[][] cells = new double[precision][precision];
        for (StrokePoint p : points) {
            int row = gridIndex((p.y() - box.bottom()) / cellHeight, precision);
            int col = gridIndex((p.x() - box.left()) / cellWidth, precision);
            cells[row][col] += 1;
        }
        normalize(cells, points.size());
        return new GridMap(cells);
    }

    private static int gridIndex(double scaled, int precision) {
        int index = (int) scaled;
        if (index < 0) {
            return precision / 2;
        }
        return Math.min(index, precision - 1);
    }

    /// Builds a ring-by-quadrant density map around the chosen center.
    ///
    /// The radius is the distance to the furthest point, raised to the configured minimum
    /// radius, and is split into `precision` equally wide rings.
    ///
    /// @param points the stroke
    /// @param precision number of rings
    /// @param centerKind which center to build around
    /// @return the normalized circle map
    public CircleMap circleMap(List<StrokePoint> points, int precision, CircleCenter centerKind) {
        if (points.isEmpty()) {
            return CircleMap.empty(precision);
        }
        StrokePoint center = centerKind == CircleCenter.MEDIAN
            ? StrokeGeometry.geometricMedian(points, settings.medianTolerance(), settings.medianMaxIterations())
            : StrokeGeometry.centerOfMass(points);

        double radius = Math.max(StrokeGeometry.maxDistance(points, center), settings.minRadius());
        double ringWidth = radius / precision;

        double[][] cells = new double[precision][CircleMap.QUADRANTS];
        for (StrokePoint p : points) {
            int ring = Math.min((int) (p.distance(center) / ringWidth), precision - 1);
            cells[ring][CircleMap.quadrantOf(p, center)] += 1;
        }
        normalize(cells, points.size());
        return new CircleMap(cells, center);
    }

    /// Builds the segment density projection along one axis.
    ///
    /// @param points the stroke
    /// @param bounds bounds of the stroke
    /// @param precision the map has `precision²` bins
    /// @param axis projection axis
    /// @return bin counts; all zero for fewer than two points
    public FlatMap flatMap(List<StrokePoint> points, Bounds bounds, int precision, Axis axis) {
        int length = precision * precision;
        if (points.size() < 2) {
            return FlatMap.empty(axis, length);
        }
        List<Segment> segments = new AxisSegmenter(axis, settings.gapDivisor()).segment(points, bounds);

        double floor = axis.lower(bounds);
        double ceiling = axis.upper(bounds);
        double extent = ceiling - floor;
        int[] bins = new int[length];
        for (int i = 0; i < length; i++) {
            double binStart = floor + extent * i / length;
            // last bin ends exactly on the upper bound
            double binEnd = (i == length - 1) ? ceiling : floor + extent * (i + 1) / length;
            for (Segment segment : segments) {
                if (segment.overlaps(binStart, binEnd)) {
                    bins[i]++;
                }
            }
        }
        return new FlatMap(axis, bins);
    }

    private static void normalize(double[][] cells, int total) {
        if (total <= 0) {
            return;
        }
        for (double[] row : cells) {
            for (int k = 0; k < row.length; k++) {
                row[k] = row[k] / total;
            }
        }
    }

    private static void requirePrecision(int precision) {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision must be at least 1, got " + precision);
        }
    }
}
