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

import io.nosqlbench.strokematch.shapes.EncodedShape;

import java.util.Objects;

/// A reference stroke stored under a name.
///
/// @param name label returned when this entry matches; unique within a library
/// @param shape the encoded reference stroke
public record LabeledShape(String name, EncodedShape shape) {

    public LabeledShape {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shape, "shape");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Entry name must not be blank");
        }
    }
}
