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

/// An immutable, encoded stroke.
///
/// Holds the source points, their [Bounds], the shared `precision`, and the map
/// representations built from them. Two shapes can only be compared map-for-map when
/// their precisions match; [ShapeComparator] reports anything else as not comparable.
///
/// Shapes are created by [ShapeEncoder] or the [#encode(List, int)] shortcut. Changing
/// precision produces a new shape via [#reencode(int)].
public final class EncodedShape {

    private final ShapeEncoder encoder;
    private final List<StrokePoint> points;
    private final Bounds bounds;
    private final int precision;
    private final GridMap gridMap;
    private final CircleMap circleMapByMass;
    private final CircleMap circleMapByMedian;
    private final FlatMap flatMapHorizontal;
    private final FlatMap flatMapVertical;

    EncodedShape(
        ShapeEncoder encoder,
        List<StrokePoint> points,
        Bounds bounds,
        int precision,
        GridMap gridMap,
        CircleMap circleMapByMass,
        CircleMap circleMapByMedian,
        FlatMap flatMapHorizontal,
        FlatMap flatMapVertical
    ) {
        this.encoder = encoder;
        this.points = points;
        this.bounds = bounds;
        this.precision = precision;
        this.gridMap = gridMap;
        this.circleMapByMass = circleMapByMass;
        this.circleMapByMedian = circleMapByMedian;
        this.flatMapHorizontal = flatMapHorizontal;
        this.flatMapVertical = flatMapVertical;
    }

    /// Encodes a stroke with the default encoder settings.
    ///
    /// @param points the stroke in drawing order
    /// @param precision resolution of every map
    /// @return the encoded shape
    public static EncodedShape encode(List<StrokePoint> points, int precision) {
        return ShapeEncoder.defaults().encode(points, precision);
    }

    /// Encodes a stroke with no points.
    ///
    /// @param precision resolution of every map
    /// @return a shape whose maps are all zero
    public static EncodedShape empty(int precision) {
        return ShapeEncoder.defaults().encode(List.of(), precision);
    }

    /// Recomputes every map at a new precision from the stored points.
    ///
    /// @param newPrecision resolution of the new maps
    /// @return a new shape with the same points and bounds
    public EncodedShape reencode(int newPrecision) {
        return encoder.encode(points, bounds, newPrecision);
    }

    /// @return the source points, unmodifiable
    public List<StrokePoint> points() {
        return points;
    }

    public int pointCount() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Bounds bounds() {
        return bounds;
    }

    public int precision() {
        return precision;
    }

    public GridMap gridMap() {
        return gridMap;
    }

    public CircleMap circleMapByMass() {
        return circleMapByMass;
    }

    public CircleMap circleMapByMedian() {
        return circleMapByMedian;
    }

    /// @param center which center the rings are built around
    /// @return the matching circle map
    public CircleMap circleMap(CircleCenter center) {
        return center == CircleCenter.MASS ? circleMapByMass : circleMapByMedian;
    }

    public FlatMap flatMapHorizontal() {
        return flatMapHorizontal;
    }

    public FlatMap flatMapVertical() {
        return flatMapVertical;
    }

    /// @param axis projection axis
    /// @return the matching flat map
    public FlatMap flatMap(Axis axis) {
        return axis == Axis.HORIZONTAL ? flatMapHorizontal : flatMapVertical;
    }

    /// @return the settings this shape was encoded with
    public EncoderSettings settings() {
        return encoder.settings();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncodedShape)) return false;
        EncodedShape that = (EncodedShape) o;
        return precision == that.precision
            && points.equals(that.points)
            && bounds.equals(that.bounds)
            && gridMap.equals(that.gridMap)
            && circleMapByMass.equals(that.circleMapByMass)
            && circleMapByMedian.equals(that.circleMapByMedian)
            && flatMapHorizontal.equals(that.flatMapHorizontal)
            && flatMapVertical.equals(that.flatMapVertical);
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, points, bounds, gridMap);
    }

    @Override
    public String toString() {
        return String.format("EncodedShape{precision=%d, points=%d, bounds=%s}", precision, points.size(), bounds);
    }
}
