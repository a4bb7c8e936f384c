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
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.strokematch.shapes.EncoderSettings;
import io.nosqlbench.strokematch.shapes.StrokeGeometry;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * JSON-serializable configuration for a {@link StrokeRecognizer}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "precision": 5,
 *   "empty_precision": 4,
 *   "weights": {"grid": 1.0, "circle": 1.0, "horizontal": 1.0, "vertical": 1.0},
 *   "encoder": {
 *     "min_width": 50.0, "min_height": 50.0, "min_radius": 25.0,
 *     "median_tolerance": 0.001, "median_max_iterations": 500, "gap_divisor": 6.0
 *   }
 * }
 * }</pre>
 *
 * <p>Every field is optional; anything left out takes its built-in default. The bundled
 * classpath resource {@value #DEFAULTS_RESOURCE} spells out all defaults.
 */
public class RecognizerConfig {

    /** Classpath resource holding the default configuration. */
    public static final String DEFAULTS_RESOURCE = "strokematch-defaults.json";

    /** Precision used when none is configured. */
    public static final int DEFAULT_PRECISION = 5;

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    @SerializedName("precision")
    private Integer precision;

    @SerializedName("empty_precision")
    private Integer emptyPrecision;

    @SerializedName("weights")
    private WeightsConfig weights;

    @SerializedName("encoder")
    private EncoderConfig encoder;

    /**
     * Representation weights section.
     */
    public static class WeightsConfig {
        @SerializedName("grid")
        private Double grid;

        @SerializedName("circle")
        private Double circle;

        @SerializedName("horizontal")
        private Double horizontal;

        @SerializedName("vertical")
        private Double vertical;

        public WeightsConfig() {
        }

        public WeightsConfig(MapWeights weights) {
            this.grid = weights.grid();
            this.circle = weights.circle();
            this.horizontal = weights.horizontal();
            this.vertical = weights.vertical();
        }

        /**
         * @return the weights, with 1.0 for any missing field
         */
        public MapWeights toWeights() {
            return new MapWeights(
                    orDefault(grid, 1.0d),
                    orDefault(circle, 1.0d),
                    orDefault(horizontal, 1.0d),
                    orDefault(vertical, 1.0d));
        }
    }

    /**
     * Encoder tuning section.
     */
    public static class EncoderConfig {
        @SerializedName("min_width")
        private Double minWidth;

        @SerializedName("min_height")
        private Double minHeight;

        @SerializedName("min_radius")
        private Double minRadius;

        @SerializedName("median_tolerance")
        private Double medianTolerance;

        @SerializedName("median_max_iterations")
        private Integer medianMaxIterations;

        @SerializedName("gap_divisor")
        private Double gapDivisor;

        public EncoderConfig() {
        }

        public EncoderConfig(EncoderSettings settings) {
            this.minWidth = settings.minWidth();
            this.minHeight = settings.minHeight();
            this.minRadius = settings.minRadius();
            this.medianTolerance = settings.medianTolerance();
            this.medianMaxIterations = settings.medianMaxIterations();
            this.gapDivisor = settings.gapDivisor();
        }

        /**
         * @return the encoder settings, with defaults for any missing field
         * @throws IllegalArgumentException if a value is out of range
         */
        public EncoderSettings toSettings() {
            return new EncoderSettings(
                    orDefault(minWidth, EncoderSettings.DEFAULT_MIN_WIDTH),
                    orDefault(minHeight, EncoderSettings.DEFAULT_MIN_HEIGHT),
                    orDefault(minRadius, EncoderSettings.DEFAULT_MIN_RADIUS),
                    orDefault(medianTolerance, StrokeGeometry.MEDIAN_TOLERANCE),
                    medianMaxIterations != null ? medianMaxIterations : StrokeGeometry.MEDIAN_MAX_ITERATIONS,
                    orDefault(gapDivisor, EncoderSettings.DEFAULT_GAP_DIVISOR));
        }
    }

    public RecognizerConfig() {
    }

    /**
     * Loads the bundled defaults from {@value #DEFAULTS_RESOURCE}.
     *
     * @return a new, validated config
     */
    public static RecognizerConfig defaults() {
        try (InputStream in = RecognizerConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return fromJson(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * @param json configuration document
     * @return the parsed and validated config
     * @throws IllegalArgumentException if the document is malformed or a value is out of range
     */
    public static RecognizerConfig fromJson(String json) {
        return validated(parse(() -> GSON.fromJson(json, RecognizerConfig.class)));
    }

    /**
     * @param reader source of a configuration document
     * @return the parsed and validated config
     * @throws IllegalArgumentException if the document is malformed or a value is out of range
     */
    public static RecognizerConfig fromJson(Reader reader) {
        return validated(parse(() -> GSON.fromJson(reader, RecognizerConfig.class)));
    }

    /**
     * @param path JSON file to read
     * @return the parsed and validated config
     * @throws IOException if the file cannot be read
     */
    public static RecognizerConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    /**
     * Writes this config, with every default filled in, to a file.
     *
     * @param path JSON file to write
     * @throws IOException if the file cannot be written
     */
    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(writer);
        }
    }

    public String toJson() {
        return GSON.toJson(resolved());
    }

    public void toJson(Writer writer) {
        GSON.toJson(resolved(), writer);
    }

    /**
     * Checks every value, filling in defaults on the way.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public void validate() {
        if (getPrecision() < 1) {
            throw new IllegalArgumentException("precision must be at least 1, got " + getPrecision());
        }
        if (getEmptyPrecision() < 1) {
            throw new IllegalArgumentException("empty_precision must be at least 1, got " + getEmptyPrecision());
        }
        getWeights();
        getEncoderSettings();
    }

    public int getPrecision() {
        return precision != null ? precision : DEFAULT_PRECISION;
    }

    public void setPrecision(int precision) {
        this.precision = precision;
    }

    public int getEmptyPrecision() {
        return emptyPrecision != null ? emptyPrecision : ShapeLibrary.DEFAULT_EMPTY_PRECISION;
    }

    public void setEmptyPrecision(int emptyPrecision) {
        this.emptyPrecision = emptyPrecision;
    }

    public MapWeights getWeights() {
        return weights != null ? weights.toWeights() : MapWeights.defaults();
    }

    public void setWeights(MapWeights weights) {
        this.weights = new WeightsConfig(weights);
    }

    public EncoderSettings getEncoderSettings() {
        return encoder != null ? encoder.toSettings() : EncoderSettings.defaults();
    }

    public void setEncoderSettings(EncoderSettings settings) {
        this.encoder = new EncoderConfig(settings);
    }

    private RecognizerConfig resolved() {
        RecognizerConfig copy = new RecognizerConfig();
        copy.precision = getPrecision();
        copy.emptyPrecision = getEmptyPrecision();
        copy.weights = new WeightsConfig(getWeights());
        copy.encoder = new EncoderConfig(getEncoderSettings());
        return copy;
    }

    private static RecognizerConfig validated(RecognizerConfig config) {
        RecognizerConfig result = config != null ? config : new RecognizerConfig();
        result.validate();
        return result;
    }

    private static RecognizerConfig parse(Supplier<RecognizerConfig> parser) {
        try {
            return parser.get();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed recognizer configuration: " + e.getMessage(), e);
        }
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    @Override
    public String toString() {
        return "RecognizerConfig{precision=" + getPrecision()
                + ", emptyPrecision=" + getEmptyPrecision()
                + ", weights=" + getWeights()
                + ", encoder=" + getEncoderSettings() + "}";
    }
}
