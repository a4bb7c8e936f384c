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

/// Square matrix of point-density ratios over the stroke's bounding box.
///
/// Cell `[row][col]` holds the fraction of the stroke's points that fall in that cell.
/// Row 0 is the bottom of the box and column 0 its left edge. For a non-empty stroke the
/// cells sum to 1; for an empty stroke every cell is 0.
public final class GridMap {

    private final double[][] cells;

    GridMap(double[][] cells) {
        this.cells = cells;
    }

    /// @param precision the number of rows and columns
    /// @return a grid with every cell zero
    public static GridMap empty(int precision) {
        return new GridMap(new double[precision][precision]);
    }

    /// @return the number of rows, which equals the number of columns
    public int size() {
        return cells.length;
    }

    /// @param row row index, 0 at the bottom
    /// @param col column index, 0 at the left
    /// @return the density ratio of that cell
    public double get(int row, int col) {
        return cells[row][col];
    }

    /// @return the sum over all cells
    public double sum() {
        double sum = 0.0d;
        for (double[] row : cells) {
            for (double v : row) {
                sum += v;
            }
        }
        return sum;
    }

    /// @return a copy of the cells, indexed `[row][col]`
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
        if (!(o instanceof GridMap)) return false;
        return Arrays.deepEquals(cells, ((GridMap) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return "GridMap{" + Arrays.deepToString(cells) + "}";
    }
}
