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

/// One-dimensional projection of a stroke's line segments onto an axis.
///
/// The axis extent is split into equal-width bins and each bin counts the segments that
/// overlap it. Values are raw counts, not ratios.
public final class FlatMap {

    private final Axis axis;
    private final int[] bins;

    FlatMap(Axis axis, int[] bins) {
        this.axis = axis;
        this.bins = bins;
    }

    /// @param axis the projection axis
    /// @param length number of bins
    /// @return a map with every bin zero
    public static FlatMap empty(Axis axis, int length) {
        return new FlatMap(axis, new int[length]);
    }

    public Axis axis() {
        return axis;
    }

    /// @return the number of bins
    public int length() {
        return bins.length;
    }

    /// @param index bin index
    /// @return the number of segments overlapping that bin
    public int get(int index) {
        return bins[index];
    }

    /// @return the number of bins with a non-zero count
    public int nonZeroBins() {
        int count = 0;
        for (int b : bins) {
            if (b != 0) count++;
        }
        return count;
    }

    /// @return a copy of the bin counts
    public int[] toArray() {
        return bins.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlatMap)) return false;
        FlatMap that = (FlatMap) o;
        return axis == that.axis && Arrays.equals(bins, that.bins);
    }

    @Override
    public int hashCode() {
        return 31 * axis.hashCode() + Arrays.hashCode(bins);
    }

    @Override
    public String toString() {
        return "FlatMap{" + axis + ", " + Arrays.toString(bins) + "}";
    }
}
