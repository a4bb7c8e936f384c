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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class StrokeGeometryTest {

    @Test
    public void testCenterOfMass() {
        List<StrokePoint> points = List.of(
            StrokePoint.of(0, 0), StrokePoint.of(4, 0), StrokePoint.of(4, 2), StrokePoint.of(0, 2));
        StrokePoint com = StrokeGeometry.centerOfMass(points);
        assertThat(com.x()).isEqualTo(2.0);
        assertThat(com.y()).isEqualTo(1.0);
    }

    @Test
    public void testCenterOfMassOfEmptyStrokeIsOrigin() {
        assertThat(StrokeGeometry.centerOfMass(List.of())).isEqualTo(StrokePoint.ORIGIN);
    }

    @Test
    public void testMedianOfFewerThanTwoPoints() {
        assertThat(StrokeGeometry.geometricMedian(List.of())).isEqualTo(StrokePoint.ORIGIN);
        StrokePoint only = StrokePoint.of(12.5, -3);
        assertThat(StrokeGeometry.geometricMedian(List.of(only))).isEqualTo(only);
    }

    @Test
    public void testMedianOfSymmetricPointsIsTheirCenter() {
        List<StrokePoint> points = TestStrokes.circle(250, 180, 40, 36);
        points.add(StrokePoint.of(250, 180));

        StrokePoint median = StrokeGeometry.geometricMedian(points);

        assertThat(median.distance(StrokePoint.of(250, 180))).isLessThan(StrokeGeometry.MEDIAN_TOLERANCE);
    }

    @Test
    public void testMedianIsPulledTowardTheCluster() {
        // Nine points bunched near the origin and one far outlier
        List<StrokePoint> points = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            points.add(StrokePoint.of(i % 3, i / 3));
        }
        points.add(StrokePoint.of(400, 400));

        StrokePoint com = StrokeGeometry.centerOfMass(points);
        StrokePoint median = StrokeGeometry.geometricMedian(points);

        assertThat(median.distance(StrokePoint.of(1, 1))).isLessThan(com.distance(StrokePoint.of(1, 1)));
        assertThat(totalDistance(points, median)).isLessThanOrEqualTo(totalDistance(points, com));
    }

    @Test
    public void testMedianStopsAtIterationCap() {
        List<StrokePoint> points = List.of(StrokePoint.of(0, 0), StrokePoint.of(10, 0), StrokePoint.of(0, 30));
        StrokePoint capped = StrokeGeometry.geometricMedian(points, 1e-12, 1);
        StrokePoint converged = StrokeGeometry.geometricMedian(points);

        assertThat(capped).isNotEqualTo(StrokeGeometry.centerOfMass(points));
        assertThat(totalDistance(points, converged)).isLessThanOrEqualTo(totalDistance(points, capped) + 1e-9);
    }

    @Test
    public void testBounds() {
        Bounds bounds = StrokeGeometry.bounds(TestStrokes.ell());
        assertThat(bounds).isEqualTo(new Bounds(100, 250, 300, 100));
        assertThat(bounds.width()).isEqualTo(150.0);
        assertThat(bounds.height()).isEqualTo(200.0);
    }

    @Test
    public void testBoundsOfEmptyStrokeAreZero() {
        assertThat(StrokeGeometry.bounds(List.of())).isEqualTo(Bounds.EMPTY);
        assertThat(Bounds.EMPTY.width()).isZero();
    }

    @Test
    public void testExpandedToGrowsAroundMidpoint() {
        Bounds thin = new Bounds(100, 110, 300, 100);
        Bounds grown = thin.expandedTo(50, 50);
        assertThat(grown.left()).isEqualTo(80.0);
        assertThat(grown.right()).isEqualTo(130.0);
        assertThat(grown.top()).isEqualTo(300.0);
        assertThat(grown.bottom()).isEqualTo(100.0);

        Bounds flat = new Bounds(0, 200, 40, 40);
        Bounds raised = flat.expandedTo(50, 50);
        assertThat(raised.bottom()).isEqualTo(15.0);
        assertThat(raised.top()).isEqualTo(65.0);

        Bounds large = new Bounds(0, 200, 200, 0);
        assertThat(large.expandedTo(50, 50)).isSameAs(large);
    }

    private static double totalDistance(List<StrokePoint> points, StrokePoint from) {
        double sum = 0;
        for (StrokePoint p : points) {
            sum += p.distance(from);
        }
        return sum;
    }
}
