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
/// Labeled stroke libraries and weighted, ranked matching.
///
/// ## Data Flow
/// 1. A finished stroke is encoded into an [io.nosqlbench.strokematch.shapes.EncodedShape].
/// 2. [io.nosqlbench.strokematch.library.ShapeLibrary#rank] scores it against every stored
///    [io.nosqlbench.strokematch.library.LabeledShape] with
///    [io.nosqlbench.strokematch.library.MatchScorer].
/// 3. Scores are sorted and turned into confidence percentages relative to their mean.
///
/// [io.nosqlbench.strokematch.library.StrokeRecognizer] wires these steps together with a
/// [io.nosqlbench.strokematch.library.RecognizerConfig].
/// [io.nosqlbench.strokematch.library.LibraryCodec] stores libraries as JSON.
package io.nosqlbench.strokematch.library;
