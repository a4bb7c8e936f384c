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

import io.nosqlbench.strokematch.shapes.EncoderSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

public class RecognizerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testBundledDefaults() {
        RecognizerConfig config = RecognizerConfig.defaults();

        assertThat(config.getPrecision()).isEqualTo(RecognizerConfig.DEFAULT_PRECISION);
        assertThat(config.getEmptyPrecision()).isEqualTo(ShapeLibrary.DEFAULT_EMPTY_PRECISION);
        assertThat(config.getWeights()).isEqualTo(MapWeights.defaults());
        assertThat(config.getEncoderSettings()).isEqualTo(EncoderSettings.defaults());
    }

    @Test
    public void testEmptyDocumentFallsBackToDefaults() {
        RecognizerConfig config = RecognizerConfig.fromJson("{}");

        assertThat(config.getPrecision()).isEqualTo(RecognizerConfig.DEFAULT_PRECISION);
        assertThat(config.getWeights()).isEqualTo(MapWeights.defaults());
        assertThat(config.getEncoderSettings()).isEqualTo(EncoderSettings.defaults());
    }

    @Test
    public void testPartialDocument() {
        RecognizerConfig config = RecognizerConfig.fromJson(
            "{\"precision\": 7, \"weights\": {\"grid\": 2.5}, \"encoder\": {\"min_radius\": 40}}");

        assertThat(config.getPrecision()).isEqualTo(7);
        assertThat(config.getWeights()).isEqualTo(new MapWeights(2.5, 1.0, 1.0, 1.0));
        assertThat(config.getEncoderSettings().minRadius()).isEqualTo(40.0);
        assertThat(config.getEncoderSettings().minWidth()).isEqualTo(EncoderSettings.DEFAULT_MIN_WIDTH);
    }

    @Test
    public void testOutOfRangeValuesAreRejected() {
        assertThatThrownBy(() -> RecognizerConfig.fromJson("{\"precision\": 0}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("precision");
        assertThatThrownBy(() -> RecognizerConfig.fromJson("{\"empty_precision\": -2}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecognizerConfig.fromJson("{\"weights\": {\"vertical\": -1}}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecognizerConfig.fromJson("{\"encoder\": {\"min_width\": 0}}"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testMalformedDocumentIsRejected() {
        assertThatThrownBy(() -> RecognizerConfig.fromJson("{\"precision\": \"fine\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    public void testSaveAndLoad() throws IOException {
        RecognizerConfig config = new RecognizerConfig();
        config.setPrecision(8);
        config.setEmptyPrecision(3);
        config.setWeights(new MapWeights(1.0, 0.5, 2.0, 2.0));
        config.setEncoderSettings(new EncoderSettings(60, 40, 30, 0.01, 100, 4));

        Path file = tempDir.resolve("recognizer.json");
        config.save(file);
        RecognizerConfig loaded = RecognizerConfig.load(file);

        assertThat(Files.readString(file)).contains("\"empty_precision\"", "\"gap_divisor\"");
        assertThat(loaded.getPrecision()).isEqualTo(8);
        assertThat(loaded.getEmptyPrecision()).isEqualTo(3);
        assertThat(loaded.getWeights()).isEqualTo(config.getWeights());
        assertThat(loaded.getEncoderSettings()).isEqualTo(config.getEncoderSettings());
    }

    @Test
    public void testToJsonWritesResolvedValues() {
        String json = new RecognizerConfig().toJson();
        RecognizerConfig reparsed = RecognizerConfig.fromJson(json);

        assertThat(json).contains("\"precision\": 5", "\"median_max_iterations\": 500");
        assertThat(reparsed.getEncoderSettings()).isEqualTo(EncoderSettings.defaults());
    }
}
