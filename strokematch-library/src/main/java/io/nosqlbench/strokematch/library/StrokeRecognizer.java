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
import io.nosqlbench.strokematch.shapes.ShapeEncoder;
import io.nosqlbench.strokematch.shapes.StrokePoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// # StrokeRecognizer
///
/// Synchronous entry point for callers that capture strokes: it encodes finished point
/// sequences, teaches them to a library and classifies new ones.
///
/// ## Libraries
/// The recognizer owns any number of named [ShapeLibrary] instances, one of which is
/// active. A library named [#DEFAULT_LIBRARY] is created and selected on construction.
/// New libraries receive the configured weights.
///
/// ## Usage
/// ```java
/// StrokeRecognizer recognizer = new StrokeRecognizer(RecognizerConfig.defaults());
/// recognizer.learn("L", lPoints);
/// recognizer.learn("V", vPoints);
/// MatchResult match = recognizer.recognize(stroke);
/// ```
///
/// Not thread-safe; see [ShapeLibrary].
public class StrokeRecognizer {

    private static final Logger logger = LogManager.getLogger(StrokeRecognizer.class);

    /// Name of the library created with every recognizer.
    public static final String DEFAULT_LIBRARY = "default";

    private final int emptyPrecision;
    private final MapWeights weights;
    private final ShapeEncoder encoder;
    private final Map<String, ShapeLibrary> libraries = new LinkedHashMap<>();
    private ShapeLibrary active;
    private int precision;

    /// Creates a recognizer with the bundled default configuration.
    public StrokeRecognizer() {
        this(RecognizerConfig.defaults());
    }

    /// Later changes to `config` do not affect the recognizer.
    ///
    /// @param config configuration; validated here
    public StrokeRecognizer(RecognizerConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.emptyPrecision = config.getEmptyPrecision();
        this.weights = config.getWeights();
        this.encoder = new ShapeEncoder(config.getEncoderSettings());
        this.precision = config.getPrecision();
        this.active = createLibrary(DEFAULT_LIBRARY);
    }

    /// Encodes a stroke at the configured precision.
    ///
    /// @param points the finished stroke
    /// @return the encoded shape
    public EncodedShape encode(List<StrokePoint> points) {
        return encoder.encode(points, precision);
    }

    /// Encodes a stroke at an explicit precision.
    ///
    /// @param points the finished stroke
    /// @param precision resolution of every map
    /// @return the encoded shape
    public EncodedShape encode(List<StrokePoint> points, int precision) {
        return encoder.encode(points, precision);
    }

    /// Encodes a stroke and stores it in the active library, replacing any entry of that name.
    ///
    /// @param name label for the stroke
    /// @param points the finished stroke
    /// @return the stored entry
    public LabeledShape learn(String name, List<StrokePoint> points) {
        LabeledShape entry = active.add(name, encode(points));
        logger.info("learned '{}' in library '{}' ({} points)", name, active.getName(), points.size());
        return entry;
    }

    /// @param name label to remove from the active library
    /// @return true if an entry was removed
    public boolean forget(String name) {
        return active.remove(name);
    }

    /// @param points the finished stroke
    /// @return the closest entry of the active library
    public MatchResult recognize(List<StrokePoint> points) {
        MatchResult best = active.bestMatch(encode(points));
        logger.debug("recognized stroke of {} points as {}", points.size(), best);
        return best;
    }

    /// @param points the finished stroke
    /// @return every entry of the active library, closest first
    public List<MatchResult> rankAll(List<StrokePoint> points) {
        return active.rank(encode(points));
    }

    /// Creates a library, or returns the existing one of that name.
    ///
    /// @param name library name
    /// @return the library
    public ShapeLibrary createLibrary(String name) {
        Objects.requireNonNull(name, "name");
        return libraries.computeIfAbsent(name, n -> {
            ShapeLibrary library = new ShapeLibrary(n, emptyPrecision);
            library.setWeights(weights);
            logger.info("created library '{}'", n);
            return library;
        });
    }

    /// Adds an existing library, such as one loaded by [LibraryCodec], replacing any library
    /// of the same name. Its entries are re-encoded at the current precision.
    ///
    /// @param library the library
    public void addLibrary(ShapeLibrary library) {
        Objects.requireNonNull(library, "library");
        library.reencodeAll(precision);
        ShapeLibrary previous = libraries.put(library.getName(), library);
        if (previous == active) {
            active = library;
        }
    }

    /// @param name library name
    /// @return the selected library
    /// @throws IllegalArgumentException if no library has that name
    public ShapeLibrary selectLibrary(String name) {
        ShapeLibrary library = libraries.get(name);
        if (library == null) {
            throw new IllegalArgumentException("No library named '" + name + "', known: " + libraries.keySet());
        }
        active = library;
        return library;
    }

    /// Removes a library. The active library cannot be removed.
    ///
    /// @param name library name
    /// @return true if a library was removed
    /// @throws IllegalStateException if `name` is the active library
    public boolean removeLibrary(String name) {
        ShapeLibrary library = libraries.get(name);
        if (library == null) {
            return false;
        }
        if (library == active) {
            throw new IllegalStateException("Cannot remove the active library '" + name + "'");
        }
        libraries.remove(name);
        return true;
    }

    public Optional<ShapeLibrary> library(String name) {
        return Optional.ofNullable(libraries.get(name));
    }

    public ShapeLibrary activeLibrary() {
        return active;
    }

    /// @return library names in creation order
    public List<String> libraryNames() {
        return List.copyOf(libraries.keySet());
    }

    public int getPrecision() {
        return precision;
    }

    /// Changes the precision of new encodings and re-encodes every stored entry to match.
    ///
    /// @param precision the new precision, at least 1
    public void setPrecision(int precision) {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision must be at least 1, got " + precision);
        }
        this.precision = precision;
        for (ShapeLibrary library : libraries.values()) {
            library.reencodeAll(precision);
        }
        logger.info("precision set to {} across {} libraries", precision, libraries.size());
    }

    public ShapeEncoder getEncoder() {
        return encoder;
    }
}
