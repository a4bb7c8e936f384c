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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

public class ShapeEncoderTest {

    private static final double TOLERANCE = 1e-9;

    static Stream<Arguments> strokesAndPrecisions() {
        return Stream.of(
            Arguments.of("vee", TestStrokes.vee(), 4),
            Arguments.of("zed", TestStrokes.zed(), 5),
            Arguments.of("ell", TestStrokes.ell(), 6),
            Arguments.of("square", TestStrokes.square(50, 50, 120), 8),
            Arguments.of("circle", TestStrokes.circle(400, 300, 90, 120), 10),
            Arguments.of("dot", List.of(StrokePoint.of(10, 10)), 5),
            Arguments.of("pair", List.of(StrokePoint.of(10, 10), StrokePoint.of(11, 10)), 7)
        );
    }

    @ParameterizedTest(name = "{0} at precision {2}")
    @MethodSource("strokesAndPrecisions")
    public void testDensityMapsAreNormalized(String label, List<StrokePoint> points, int precision) {
        EncodedShape shape = EncodedShape.encode(points, precision);

        assertThat(shape.gridMap().size()).isEqualTo(precision);
        assertThat(shape.circleMapByMass().rings()).isEqualTo(precision);
        assertThat(shape.circleMapByMedian().rings()).isEqualTo(precision);

        assertThat(shape.gridMap().sum()).isCloseTo(1.0, within(TOLERANCE));
        assertThat(shape.circleMapByMass().sum()).isCloseTo(1.0, within(TOLERANCE));
        assertThat(shape.circleMapByMedian().sum()).isCloseTo(1.0, within(TOLERANCE));

        for (double[] row : shape.gridMap().toArray()) {
            for (double v : row) {
                assertThat(v).isBetween(0.0, 1.0);
            }
        }
        for (CircleCenter center : CircleCenter.values()) {
            for (double[] ring : shape.circleMap(center).toArray()) {
                for (double v : ring) {
                    assertThat(v).isBetween(0.0, 1.0);
                }
            }
        }
        assertThat(shape.flatMapHorizontal().length()).isEqualTo(precision * precision);
        assertThat(shape.flatMapVertical().length()).isEqualTo(precision * precision);
    }

    @Test
    public void testEncodingIsDeterministic() {
        List<StrokePoint> points = TestStrokes.zed();
        EncodedShape first = EncodedShape.encode(points, 6);
        EncodedShape second = EncodedShape.encode(points, 6);

        assertThat(second).isEqualTo(first);
        assertThat(second.gridMap().toArray()).isDeepEqualTo(first.gridMap().toArray());
        assertThat(second.circleMapByMedian().toArray()).isDeepEqualTo(first.circleMapByMedian().toArray());
        assertThat(second.flatMapHorizontal().toArray()).isEqualTo(first.flatMapHorizontal().toArray());
    }

    @Test
    public void testEmptyStrokeEncodesToZeroMaps() {
        EncodedShape shape = EncodedShape.empty(4);

        assertThat(shape.isEmpty()).isTrue();
        assertThat(shape.bounds()).isEqualTo(Bounds.EMPTY);
        assertThat(shape.gridMap().sum()).isZero();
        assertThat(shape.circleMapByMass().sum()).isZero();
        assertThat(shape.circleMapByMedian().sum()).isZero();
        assertThat(shape.flatMapHorizontal().toArray()).hasSize(16).containsOnly(0);
        assertThat(shape.flatMapVertical().toArray()).hasSize(16).containsOnly(0);
    }

    @Test
    public void testSinglePointStroke() {
        EncodedShape shape = EncodedShape.encode(List.of(StrokePoint.of(140, 260)), 5);

        assertThat(shape.gridMap().get(2, 2)).isEqualTo(1.0);
        assertThat(shape.gridMap().sum()).isEqualTo(1.0);
        assertThat(shape.circleMapByMass().get(0, 0)).isEqualTo(1.0);
        assertThat(shape.circleMapByMedian().get(0, 0)).isEqualTo(1.0);
        assertThat(shape.flatMapHorizontal().length()).isEqualTo(25);
        assertThat(shape.flatMapVertical().length()).isEqualTo(25);
        assertThat(shape.flatMapHorizontal().nonZeroBins()).isZero();
        assertThat(shape.flatMapVertical().nonZeroBins()).isZero();
    }

    @Test
    public void testHorizontalLineStaysInMiddleRow() {
        EncodedShape shape = EncodedShape.encode(TestStrokes.line(100, 200, 300, 200), 5);

        double middleRow = 0;
        for (int col = 0; col < 5; col++) {
            middleRow += shape.gridMap().get(2, col);
            assertThat(shape.gridMap().get(2, col)).isGreaterThan(0.0);
        }
        assertThat(middleRow).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    public void testVerticalLineStaysInMiddleColumn() {
        EncodedShape shape = EncodedShape.encode(TestStrokes.line(150, 100, 150, 300), 5);

        for (int row = 0; row < 5; row++) {
            assertThat(shape.gridMap().get(row, 2)).isGreaterThan(0.0);
            for (int col : new int[]{0, 1, 3, 4}) {
                assertThat(shape.gridMap().get(row, col)).isZero();
            }
        }
    }

    @Test
    public void testEdgePointsFallInLastRowAndColumn() {
        List<StrokePoint> corners = List.of(StrokePoint.of(0, 0), StrokePoint.of(100, 100));
        EncodedShape shape = EncodedShape.encode(corners, 4);

        assertThat(shape.gridMap().get(0, 0)).isEqualTo(0.5);
        assertThat(shape.gridMap().get(3, 3)).isEqualTo(0.5);
    }

    @Test
    public void testCircleQuadrantsFollowAxisSigns() {
        StrokePoint center = StrokePoint.of(0, 0);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(1, 1), center)).isEqualTo(0);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(1, -1), center)).isEqualTo(1);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(-1, -1), center)).isEqualTo(2);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(-1, 1), center)).isEqualTo(3);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(0, 0), center)).isEqualTo(0);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(0, -1), center)).isEqualTo(1);
        assertThat(CircleMap.quadrantOf(StrokePoint.of(-1, 0), center)).isEqualTo(3);
    }

    @Test
    public void testCirclePointsLandOnOuterRing() {
        EncodedShape shape = EncodedShape.encode(TestStrokes.circle(400, 300, 90, 120), 6);

        CircleMap map = shape.circleMapByMass();
        double outer = 0;
        for (int q = 0; q < CircleMap.QUADRANTS; q++) {
            outer += map.get(5, q);
            assertThat(map.get(5, q)).isCloseTo(0.25, within(0.02));
        }
        assertThat(outer).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    public void testTightClusterUsesMinimumRadius() {
        List<StrokePoint> cluster = List.of(
            StrokePoint.of(100, 100), StrokePoint.of(102, 100), StrokePoint.of(100, 102), StrokePoint.of(102, 102));
        EncodedShape shape = EncodedShape.encode(cluster, 5);

        // Points sit about 1.4 from the center, well inside the first 5-wide ring
        for (int q = 0; q < CircleMap.QUADRANTS; q++) {
            assertThat(shape.circleMapByMass().get(0, q)).isEqualTo(0.25);
        }
    }

    @Test
    public void testFlatMapsOfVee() {
        EncodedShape shape = EncodedShape.encode(TestStrokes.vee(), 5);

        assertThat(shape.flatMapHorizontal().toArray()).hasSize(25).containsOnly(1);
        assertThat(shape.flatMapVertical().toArray()).hasSize(25).containsOnly(2);
    }

    @Test
    public void testFlatMapsOfZed() {
        EncodedShape shape = EncodedShape.encode(TestStrokes.zed(), 4);

        assertThat(shape.flatMapHorizontal().toArray()).hasSize(16).containsOnly(3);
        assertThat(shape.flatMapVertical().toArray()).hasSize(16).containsOnly(1);
    }

    @Test
    public void testReencodeReplacesMapsAndKeepsBounds() {
        EncodedShape shape = EncodedShape.encode(TestStrokes.ell(), 4);
        EncodedShape finer = shape.reencode(7);

        assertThat(finer.precision()).isEqualTo(7);
        assertThat(finer.bounds()).isEqualTo(shape.bounds());
        assertThat(finer.points()).isEqualTo(shape.points());
        assertThat(finer.gridMap().size()).isEqualTo(7);
        assertThat(finer.circleMapByMass().rings()).isEqualTo(7);
        assertThat(finer.circleMapByMedian().rings()).isEqualTo(7);
        assertThat(finer.flatMapHorizontal().length()).isEqualTo(49);
        assertThat(finer.flatMapVertical().length()).isEqualTo(49);

        assertThat(shape.precision()).isEqualTo(4);
        assertThat(finer.reencode(4)).isEqualTo(shape);
    }

    @Test
    public void testSettingsAreApplied() {
        EncoderSettings tiny = new EncoderSettings(1, 1, 1, 0.001, 500, 6);
        List<StrokePoint> small = TestStrokes.polyline(0, 0, 4, 0, 4, 4);

        EncodedShape withDefaults = EncodedShape.encode(small, 4);
        EncodedShape withTiny = new ShapeEncoder(tiny).encode(small, 4);

        assertThat(withTiny.settings()).isEqualTo(tiny);
        assertThat(withTiny.gridMap()).isNotEqualTo(withDefaults.gridMap());
        assertThat(withTiny.reencode(5).settings()).isEqualTo(tiny);
    }

    @Test
    public void testRejectsInvalidPrecision() {
        assertThatThrownBy(() -> EncodedShape.encode(TestStrokes.vee(), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Precision");
        assertThatThrownBy(() -> new EncoderSettings(0, 50, 25, 0.001, 500, 6))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPointsAreCopied() {
        List<StrokePoint> points = new java.util.ArrayList<>(TestStrokes.vee());
        EncodedShape shape = EncodedShape.encode(points, 4);
        points.clear();

        assertThat(shape.pointCount()).isGreaterThan(0);
        assertThatThrownBy(() -> shape.points().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void testSegmentOnUpperEdgeIsCounted() {
        // three points give one horizontal segment sitting at x = 29, the right edge
        List<StrokePoint> points = List.of(StrokePoint.of(29, 0), StrokePoint.of(0, 50), StrokePoint.of(29, 100));
        EncodedShape shape = EncodedShape.encode(points, 5);

        assertThat(shape.flatMapHorizontal().nonZeroBins()).isEqualTo(1);
        assertThat(shape.flatMapHorizontal().get(24)).isEqualTo(1);
    }

    @Test
    public void testSegmentOnLowerEdgeIsCounted() {
        List<StrokePoint> points = List.of(StrokePoint.of(0, 0), StrokePoint.of(29, 50), StrokePoint.of(0, 100));
        EncodedShape shape = EncodedShape.encode(points, 5);

        assertThat(shape.flatMapHorizontal().nonZeroBins()).isEqualTo(1);
        assertThat(shape.flatMapHorizontal().get(0)).isEqualTo(1);
    }
}
