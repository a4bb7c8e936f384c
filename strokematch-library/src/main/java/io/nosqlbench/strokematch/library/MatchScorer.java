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

package io.nosqlbench.strokematch.library;

import io.nosqlbench.strokematch.shapes.Axis;
import io.nosqlbench.strokematch.shapes.CoupledScores;
import io.nosqlbench.strokematch.shapes.EncodedShape;
import io.nosqlbench.strokematch.shapes.ShapeComparator;

import java.util.List;

/// # MatchScorer
///
/// Fuses the four representation differences between two shapes into one raw score,
/// and turns a ranked list of raw scores into confidence percentages.
///
/// ## Scoring
/// 1. Grid and circle mean squared errors are multiplied by [#MSE_SCALE] so that they
///    sit in the same range as the flat map mismatch fractions.
/// 2. The two are coupled with [ShapeComparator#couple(double, double)], since both
///    describe 2-D point density and a disagreement between them is mostly noise.
/// 3. The four values are combined with the library's [MapWeights].
///
/// The constants are tuned against each other; changing one shifts every percentage.
public final class MatchScorer {

    /// Scale applied to the grid and circle mean squared errors.
    public static final double MSE_SCALE = 100.0d;

    private MatchScorer() {} // Utility class

    /// @param shape the stroke being classified
    /// @param reference a stored reference shape
    /// @param weights representation weights
    /// @return every component and the fused raw score
    public static ScoreBreakdown score(EncodedShape shape, EncodedShape reference, MapWeights weights) {
        double grid = MSE_SCALE * ShapeComparator.gridDifference(shape, reference);
        double circle = MSE_SCALE * ShapeComparator.circleDifference(shape, reference);
        double horizontal = ShapeComparator.flatDifference(shape, reference, Axis.HORIZONTAL);
        double vertical = ShapeComparator.flatDifference(shape, reference, Axis.VERTICAL);

        CoupledScores coupled = ShapeComparator.couple(grid, circle);
        double raw = weights.combine(coupled.grid(), coupled.circle(), horizontal, vertical);
        return new ScoreBreakdown(coupled.grid(), coupled.circle(), horizontal, vertical, raw);
    }

    /// @param shape the stroke being classified
    /// @param entry a stored entry
    /// @param weights representation weights
    /// @return every component and the fused raw score
    public static ScoreBreakdown score(EncodedShape shape, LabeledShape entry, MapWeights weights) {
        return score(shape, entry.shape(), weights);
    }

    /// @return the fused raw score; lower is a closer match
    public static double rawScore(EncodedShape shape, LabeledShape entry, MapWeights weights) {
        return score(shape, entry.shape(), weights).raw();
    }

    /// Converts raw scores to confidence percentages relative to their mean.
    ///
    /// Each score becomes `100 - 100 * min(score / mean, 1)`, truncated toward zero at two
    /// decimals. A zero mean is treated as 1. A perfect score gives 100 and anything at
    /// or above the mean gives 0.
    ///
    /// @param rawScores the raw scores
    /// @return percentages in the same order
    public static double[] toPercentages(List<Double> rawScores) {
        double[] percents = new double[rawScores.size()];
        if (rawScores.isEmpty()) {
            return percents;
        }
        double total = 0.0d;
        for (double score : rawScores) {
            total += score;
        }
        double mean = total / rawScores.size();
        if (mean == 0.0d) {
            mean = 1.0d;
        }
        for (int i = 0; i < percents.length; i++) {
            double ratio = Math.min(rawScores.get(i) / mean, 1.0d);
            percents[i] = truncateToHundredths(100.0d - (100.0d * ratio));
        }
        return percents;
    }

    static double truncateToHundredths(double value) {
        return ((long) (value * 100.0d)) / 100.0d;
    }
}
