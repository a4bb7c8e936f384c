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

/// An interval along one axis, in drawing order.
///
/// `start` may be greater than `end` when the stroke moved toward lower coordinates.
///
/// @param start coordinate where the segment begins
/// @param end coordinate where the segment ends
public record Segment(double start, double end) {

    public double low() {
        return Math.min(start, end);
    }

    public double high() {
        return Math.max(start, end);
    }

    /// @param from lower edge of the interval, inclusive
    /// @param to upper edge of the interval, inclusive
    /// @return true if this segment shares at least one coordinate with `[from, to]`
    public boolean overlaps(double from, double to) {
        return low() <= to && high() >= from;
    }
}
