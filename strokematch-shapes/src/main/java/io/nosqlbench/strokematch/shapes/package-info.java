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

/// # Synopsis
/// Encodes freehand strokes into coarse density maps and compares them.
///
/// A stroke is an ordered list of [io.nosqlbench.strokematch.shapes.StrokePoint]s.
/// [io.nosqlbench.strokematch.shapes.ShapeEncoder] turns it into an
/// [io.nosqlbench.strokematch.shapes.EncodedShape] holding four representations, all
/// sharing one `precision`:
///
/// 1. Grid: point density over a `precision x precision` grid of the bounding box
/// 2. Circle (by mass): point density over `precision` rings by 4 quadrants around the mean
/// 3. Circle (by median): the same around the geometric median
/// 4. Flat (horizontal and vertical): line segment density over `precision²` bins per axis
///
/// [io.nosqlbench.strokematch.shapes.ShapeComparator] provides one difference function per
/// representation. Nothing in this package holds shared mutable state.
package io.nosqlbench.strokematch.shapes;
