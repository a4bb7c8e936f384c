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

import io.nosqlbench.strokematch.shapes.StrokePoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Letter-like strokes used as library entries and queries.
 */
public final class LibraryStrokes {

    private LibraryStrokes() {
    }

    /** Samples a polyline through the given x, y corners at 2 pixel spacing. */
    public static List<StrokePoint> polyline(double... corners) {
        List<StrokePoint> points = new ArrayList<>();
        points.add(StrokePoint.of(corners[0], corners[1]));
        for (int c = 2; c < corners.length; c += 2) {
            StrokePoint from = StrokePoint.of(corners[c - 2], corners[c - 1]);
            StrokePoint to = StrokePoint.of(corners[c], corners[c + 1]);
            int steps = Math.max(1, (int) Math.ceil(from.distance(to) / 2.0d));
            for (int s = 1; s <= steps; s++) {
                double t = (double) s / steps;
                points.add(StrokePoint.of(
                    from.x() + (to.x() - from.x()) * t,
                    from.y() + (to.y() - from.y()) * t));
            }
        }
        return points;
    }

    public static List<StrokePoint> vee() {
        return polyline(100, 300, 200, 100, 300, 300);
    }

    public static List<StrokePoint> zed() {
        return polyline(100, 300, 300, 300, 100, 100, 300, 100);
    }

    public static List<StrokePoint> ell() {
        return polyline(100, 300, 100, 100, 250, 100);
    }

    public static List<StrokePoint> translate(List<StrokePoint> points, double dx, double dy) {
        List<StrokePoint> moved = new ArrayList<>(points.size());
        for (StrokePoint p : points) {
            moved.add(StrokePoint.of(p.x() + dx, p.y() + dy));
        }
        return moved;
    }
}
