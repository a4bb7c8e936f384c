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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/// # ShapeLibrary
///
/// A named, ordered collection of labeled reference shapes that incoming strokes are
/// ranked against.
///
/// ## Entries
/// Entries are keyed by name and kept in insertion order. Adding an entry under a name
/// that already exists replaces it in place. Every library holds a reserved entry named
/// [#EMPTY_NAME] encoding a stroke with no points; [#clear()] removes everything else and
/// puts it back.
///
/// ## Ranking
/// ```java
/// ShapeLibrary library = new ShapeLibrary("letters");
/// library.add("L", EncodedShape.encode(lPoints, 4));
/// MatchResult best = library.bestMatch(EncodedShape.encode(stroke, 4));
/// ```
///
/// ## Thread Safety
/// Not thread-safe. [#rank(EncodedShape)] iterates the live entries, so callers sharing a
/// library must serialize mutations against ranking.
public class ShapeLibrary {

    private static final Logger logger = LogManager.getLogger(ShapeLibrary.class);

    /// Name of the reserved entry holding the zero-point shape.
    public static final String EMPTY_NAME = "Empty";

    /// Precision of the reserved entry when none is given.
    public static final int DEFAULT_EMPTY_PRECISION = 4;

    private final String name;
    private final LabeledShape emptyEntry;
    private final LinkedHashMap<String, LabeledShape> entries = new LinkedHashMap<>();
    private MapWeights weights = MapWeights.defaults();

    /// Creates a library holding only the reserved entry.
    ///
    /// @param name library name
    public ShapeLibrary(String name) {
        this(name, DEFAULT_EMPTY_PRECISION);
    }

    /// Creates a library holding only the reserved entry.
    ///
    /// @param name library name
    /// @param emptyPrecision precision the reserved zero-point shape is encoded at
    public ShapeLibrary(String name, int emptyPrecision) {
        this.name = Objects.requireNonNull(name, "name");
        this.emptyEntry = new LabeledShape(EMPTY_NAME, EncodedShape.empty(emptyPrecision));
        entries.put(EMPTY_NAME, emptyEntry);
    }

    public String getName() {
        return name;
    }

    /// Adds an entry, replacing any entry of the same name at its current position.
    ///
    /// @param entry the entry to store
    public void add(LabeledShape entry) {
        Objects.requireNonNull(entry, "entry");
        LabeledShape previous = entries.put(entry.name(), entry);
        if (previous != null) {
            logger.debug("library '{}' replaced entry '{}'", name, entry.name());
        }
    }

    /// Stores an already encoded shape under a name.
    ///
    /// @param entryName the label
    /// @param shape the reference shape
    /// @return the stored entry
    public LabeledShape add(String entryName, EncodedShape shape) {
        LabeledShape entry = new LabeledShape(entryName, shape);
        add(entry);
        return entry;
    }

    /// Removes an entry if that exact entry is stored.
    ///
    /// @param entry the entry to remove
    /// @return true if it was removed
    public boolean remove(LabeledShape entry) {
        if (entry == null) {
            return false;
        }
        return entries.remove(entry.name(), entry);
    }

    /// Removes the entry stored under a name.
    ///
    /// @param entryName the label
    /// @return true if an entry was removed, false if the name was unknown
    public boolean remove(String entryName) {
        if (entryName == null) {
            return false;
        }
        return entries.remove(entryName) != null;
    }

    /// Removes every entry, then restores the reserved [#EMPTY_NAME] entry.
    public void clear() {
        entries.clear();
        entries.put(EMPTY_NAME, emptyEntry);
    }

    /// @param entryName the label
    /// @return the entry stored under that name
    public Optional<LabeledShape> get(String entryName) {
        return Optional.ofNullable(entries.get(entryName));
    }

    public boolean contains(String entryName) {
        return entries.containsKey(entryName);
    }

    /// @return the number of entries, the reserved entry included
    public int size() {
        return entries.size();
    }

    /// @return the entries in insertion order, as an unmodifiable snapshot
    public List<LabeledShape> entries() {
        return List.copyOf(entries.values());
    }

    /// @return the entry names in insertion order, as an unmodifiable snapshot
    public List<String> names() {
        return List.copyOf(entries.keySet());
    }

    public MapWeights getWeights() {
        return weights;
    }

    public void setWeights(MapWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    /// @param grid grid map weight
    /// @param circle circle map weight
    /// @param horizontal horizontal flat map weight
    /// @param vertical vertical flat map weight
    public void setWeights(double grid, double circle, double horizontal, double vertical) {
        setWeights(new MapWeights(grid, circle, horizontal, vertical));
    }

    /// Scores a shape against every entry and ranks the entries.
    ///
    /// Results are sorted by raw score, lowest first; entries with equal scores keep their
    /// insertion order. Percentages are relative to the mean raw score, see
    /// [MatchScorer#toPercentages(List)].
    ///
    /// @param shape the stroke to classify
    /// @return one result per entry
    public List<MatchResult> rank(EncodedShape shape) {
        Objects.requireNonNull(shape, "shape");
        List<Map.Entry<LabeledShape, Double>> scored = new ArrayList<>(entries.size());
        for (LabeledShape entry : entries.values()) {
            ScoreBreakdown breakdown = MatchScorer.score(shape, entry, weights);
            logger.debug("compared to '{}': {}", entry.name(), breakdown);
            scored.add(Map.entry(entry, breakdown.raw()));
        }
        scored.sort(Comparator.comparingDouble((Map.Entry<LabeledShape, Double> e) -> e.getValue()));

        List<Double> rawScores = new ArrayList<>(scored.size());
        for (Map.Entry<LabeledShape, Double> e : scored) {
            rawScores.add(e.getValue());
        }
        double[] percents = MatchScorer.toPercentages(rawScores);

        List<MatchResult> results = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Map.Entry<LabeledShape, Double> e = scored.get(i);
            results.add(new MatchResult(e.getKey(), e.getValue(), percents[i]));
        }
        return Collections.unmodifiableList(results);
    }

    /// @param shape the stroke to classify
    /// @return the closest entry
    /// @throws IllegalStateException if every entry, the reserved one included, was removed
    public MatchResult bestMatch(EncodedShape shape) {
        List<MatchResult> ranked = rank(shape);
        if (ranked.isEmpty()) {
            throw new IllegalStateException("Library '" + name + "' has no entries to match against");
        }
        return ranked.get(0);
    }

    /// Scores two stored entries against each other with this library's weights.
    ///
    /// @param first name of the first entry
    /// @param second name of the second entry
    /// @return the raw score, or empty if either name is unknown
    public OptionalDouble compareEntries(String first, String second) {
        LabeledShape a = entries.get(first);
        LabeledShape b = entries.get(second);
        if (a == null || b == null) {
            logger.debug("cannot compare '{}' and '{}' in library '{}': no such entry", first, second, name);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(MatchScorer.rawScore(a.shape(), b, weights));
    }

    /// Re-encodes every entry except the reserved one at a new precision.
    ///
    /// @param precision the new precision
    public void reencodeAll(int precision) {
        for (Map.Entry<String, LabeledShape> e : entries.entrySet()) {
            LabeledShape entry = e.getValue();
            if (entry != emptyEntry && entry.shape().precision() != precision) {
                e.setValue(new LabeledShape(entry.name(), entry.shape().reencode(precision)));
            }
        }
    }

    /// @return the precision of this library's reserved empty entry
    public int getEmptyPrecision() {
        return emptyEntry.shape().precision();
    }

    /// @return true if the reserved empty entry is currently stored
    public boolean hasReservedEntry() {
        return entries.get(EMPTY_NAME) == emptyEntry;
    }

    /// @param entry an entry
    /// @return true if it is this library's reserved empty entry
    public boolean isReserved(LabeledShape entry) {
        return entry == emptyEntry;
    }

    @Override
    public String toString() {
        return "ShapeLibrary{name='" + name + "', entries=" + entries.keySet() + ", weights=" + weights + "}";
    }
}
