package io.nosqlbench.estimators.config;

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

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loading and saving of {@link ModelConfig} values as JSON.
 *
 * <p>Every loaded config is validated before it is returned, so a config
 * obtained from this class can be handed directly to a model constructor.
 *
 * <pre>{@code
 * TruncatedSvdConfig config = ModelConfigs.load(Path.of("svd.json"), TruncatedSvdConfig.class);
 * TruncatedSvd svd = new TruncatedSvd(config);
 * }</pre>
 *
 * @see EstimatorsGsonConfig
 */
public final class ModelConfigs {

    private ModelConfigs() {
        // Utility class
    }

    /**
     * Parses a config from a JSON string.
     *
     * @param json the JSON text
     * @param type the concrete config class
     * @param <C> the config type
     * @return the validated config
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static <C extends ModelConfig> C fromJson(String json, Class<C> type) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return validated(EstimatorsGsonConfig.gson().fromJson(json, type), type);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid " + type.getSimpleName() + " JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Converts an already parsed JSON tree into a config.
     *
     * @param json the JSON tree
     * @param type the concrete config class
     * @param <C> the config type
     * @return the validated config
     */
    public static <C extends ModelConfig> C fromJsonTree(JsonElement json, Class<C> type) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return validated(EstimatorsGsonConfig.gson().fromJson(json, type), type);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid " + type.getSimpleName() + " JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a config from a reader.
     *
     * @param reader the JSON source
     * @param type the concrete config class
     * @param <C> the config type
     * @return the validated config
     */
    public static <C extends ModelConfig> C read(Reader reader, Class<C> type) {
        Objects.requireNonNull(reader, "reader cannot be null");
        try {
            return validated(EstimatorsGsonConfig.gson().fromJson(reader, type), type);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid " + type.getSimpleName() + " JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a config from a JSON file.
     *
     * @param path the JSON file
     * @param type the concrete config class
     * @param <C> the config type
     * @return the validated config
     * @throws IOException if the file cannot be read
     */
    public static <C extends ModelConfig> C load(Path path, Class<C> type) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return read(reader, type);
        }
    }

    /**
     * Serializes a config to JSON.
     *
     * @param config the config
     * @return pretty-printed JSON
     */
    public static String toJson(ModelConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        return EstimatorsGsonConfig.gson().toJson(config);
    }

    /**
     * Writes a config to a writer.
     *
     * @param config the config
     * @param writer the destination
     */
    public static void write(ModelConfig config, Writer writer) {
        Objects.requireNonNull(config, "config cannot be null");
        EstimatorsGsonConfig.gson().toJson(config, writer);
    }

    /**
     * Saves a config to a JSON file, replacing any existing content.
     *
     * @param config the config
     * @param path the destination file
     * @throws IOException if the file cannot be written
     */
    public static void save(ModelConfig config, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(config, writer);
        }
    }

    private static <C extends ModelConfig> C validated(C config, Class<C> type) {
        if (config == null) {
            throw new IllegalArgumentException("empty " + type.getSimpleName() + " JSON");
        }
        config.validate();
        return config;
    }
}
