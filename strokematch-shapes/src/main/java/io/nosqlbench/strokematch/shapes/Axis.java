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

/// Projection axis of a [FlatMap].
public enum Axis {

    /// Projects onto x; segments are split by changes in horizontal direction.
    HORIZONTAL {
        @Override
        public double coordinate(StrokePoint p) {
            return p.x();
        }

        @Override
        public double lower(Bounds bounds) {
            return bounds.left();
        }

        @Override
        public double upper(Bounds bounds) {
            return bounds.right();
        }

        @Override
        public double perpendicularExtent(Bounds bounds) {
            return bounds.height();
        }
    },

    /// Projects onto y; segments are split by changes in vertical direction.
    VERTICAL {
        @Override
        public double coordinate(StrokePoint p) {
            return p.y();
        }

        @Override
        public double lower(Bounds bounds) {
            return bounds.bottom();
        }

        @Override
        public double upper(Bounds bounds) {
            return bounds.top();
        }

        @Override
        public double perpendicularExtent(Bounds bounds) {
            return bounds.width();
        }
    };

    /// @param p a point
    /// @return the point's coordinate along this axis
    public abstract double coordinate(StrokePoint p);

    /// @param bounds stroke bounds
    /// @return the smallest coordinate along this axis
    public abstract double lower(Bounds bounds);

    /// @param bounds stroke bounds
    /// @return the largest coordinate along this axis
    public abstract double upper(Bounds bounds);

    /// @param bounds stroke bounds
    /// @return the extent across the other axis
    public abstract double perpendicularExtent(Bounds bounds);
}
