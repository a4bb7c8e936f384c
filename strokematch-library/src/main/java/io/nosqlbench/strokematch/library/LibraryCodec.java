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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.nosqlbench.strokematch.shapes.EncodedShape;
import io.nosqlbench.strokematch.shapes.ShapeEncoder;
import io.nosqlbench.strokematch.shapes.StrokePoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// # LibraryCodec
///
/// Converts a [ShapeLibrary] to and from its JSON [LibrarySnapshot].
///
/// ## Format
/// A snapshot stores the library name, its weights, the reserved entry's precision and
/// whether that entry was still present, and
/// for every other entry its name, precision and source points, in library order.
/// Decoding re-encodes each entry from its points, so the maps always match the encoder
/// doing the loading.
///
/// ## Usage
/// ```java
/// String json = LibraryCodec.toJson(library);
/// ShapeLibrary restored = LibraryCodec.fromJson(json);
/// ```
public final class LibraryCodec {

    private static final Logger logger = LogManager.getLogger(LibraryCodec.class);

    private LibraryCodec() {
        // Utility class
    }

    /// @param library the library to capture
    /// @return the snapshot of that library
    public static LibrarySnapshot snapshot(ShapeLibrary library) {
        LibrarySnapshot snapshot = new LibrarySnapshot();
        snapshot.name = library.getName();
        snapshot.weights = new RecognizerConfig.WeightsConfig(library.getWeights());
        snapshot.emptyPrecision = library.getEmptyPrecision();
        snapshot.hasEmpty = library.hasReservedEntry();
        for (LabeledShape entry : library.entries()) {
            if (library.isReserved(entry)) {
                continue;
            }
            EncodedShape shape = entry.shape();
            double[][] points = new double[shape.pointCount()][];
            for (int i = 0; i < points.length; i++) {
                StrokePoint p = shape.points().get(i);
                points[i] = new double[]{p.x(), p.y()};
            }
            snapshot.entries.add(new LibrarySnapshot.EntrySnapshot(entry.name(), shape.precision(), points));
        }
        return snapshot;
    }

    /// Rebuilds a library from a snapshot.
    ///
    /// @param snapshot the snapshot
    /// @param encoder encoder used to rebuild every entry's maps
    /// @return a new library
    /// @throws IllegalArgumentException if the snapshot is incomplete
    public static ShapeLibrary restore(LibrarySnapshot snapshot, ShapeEncoder encoder) {
        Objects.requireNonNull(encoder, "encoder");
        if (snapshot == null || snapshot.name == null) {
            throw new IllegalArgumentException("Library snapshot has no name");
        }
        int emptyPrecision = snapshot.emptyPrecision != null
            ? snapshot.emptyPrecision : ShapeLibrary.DEFAULT_EMPTY_PRECISION;
        ShapeLibrary library = new ShapeLibrary(snapshot.name, emptyPrecision);
        if (snapshot.weights != null) {
            library.setWeights(snapshot.weights.toWeights());
        }
        if (snapshot.entries != null) {
            for (LibrarySnapshot.EntrySnapshot entry : snapshot.entries) {
                int precision = requirePrecision(entry);
                library.add(entry.name, encoder.encode(toPoints(entry), precision));
            }
        }
        if (Boolean.FALSE.equals(snapshot.hasEmpty) && library.hasReservedEntry()) {
            library.remove(ShapeLibrary.EMPTY_NAME);
        }
        logger.debug("restored library '{}' with {} entries", library.getName(), library.size());
        return library;
    }

    public static String toJson(ShapeLibrary library) {
        return StrokematchGsonConfig.gson().toJson(snapshot(library));
    }

    public static void toJson(ShapeLibrary library, Writer writer) {
        StrokematchGsonConfig.gson().toJson(snapshot(library), writer);
    }

    /// @param json a snapshot document
    /// @return the restored library, encoded with default settings
    /// @throws IllegalArgumentException if the document is malformed
    public static ShapeLibrary fromJson(String json) {
        return fromJson(json, ShapeEncoder.defaults());
    }

    /// @param json a snapshot document
    /// @param encoder encoder used to rebuild every entry's maps
    /// @return the restored library
    /// @throws IllegalArgumentException if the document is malformed
    public static ShapeLibrary fromJson(String json, ShapeEncoder encoder) {
        Gson gson = StrokematchGsonConfig.gson();
        try {
            return restore(gson.fromJson(json, LibrarySnapshot.class), encoder);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed library snapshot: " + e.getMessage(), e);
        }
    }

    /// @param reader source of a snapshot document
    /// @param encoder encoder used to rebuild every entry's maps
    /// @return the restored library
    /// @throws IllegalArgumentException if the document is malformed
    public static ShapeLibrary fromJson(Reader reader, ShapeEncoder encoder) {
        Gson gson = StrokematchGsonConfig.gson();
        try {
            return restore(gson.fromJson(reader, LibrarySnapshot.class), encoder);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed library snapshot: " + e.getMessage(), e);
        }
    }

    /// @param library the library to write
    /// @param path destination file
    /// @throws IOException if the file cannot be written
    public static void save(ShapeLibrary library, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(library, writer);
        }
        logger.info("saved library '{}' ({} entries) to {}", library.getName(), library.size(), path);
    }

    /// @param path snapshot file
    /// @param encoder encoder used to rebuild every entry's maps
    /// @return the restored library
    /// @throws IOException if the file cannot be read
    public static ShapeLibrary load(Path path, ShapeEncoder encoder) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader, encoder);
        }
    }

    private static List<StrokePoint> toPoints(LibrarySnapshot.EntrySnapshot entry) {
        List<StrokePoint> points = new ArrayList<>();
        if (entry.points == null) {
            return points;
        }
        for (double[] xy : entry.points) {
            if (xy == null || xy.length != 2) {
                throw new IllegalArgumentException("Entry '" + entry.name + "' has a point that is not an [x, y] pair");
            }
            points.add(StrokePoint.of(xy[0], xy[1]));
        }
        return points;
    }

    private static int requirePrecision(LibrarySnapshot.EntrySnapshot entry) {
        if (entry.name == null) {
            throw new IllegalArgumentException("Library snapshot has an entry with no name");
        }
        if (entry.precision == null) {
            throw new IllegalArgumentException("Entry '" + entry.name + "' has no precision");
        }
        return entry.precision;
    }
}
