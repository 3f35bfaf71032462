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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Set;

/// Centralized Gson configuration for model configuration files.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable config files |
/// | Serialize nulls | Disabled | Unset hyperparameters fall back to defaults |
/// | HTML escaping | Disabled | Cleaner output |
/// | Special floats | Enabled | Handle NaN, Infinity, -Infinity |
/// | Config types | [ModelConfigTypeAdapterFactory] | `"type"` discriminator on every [ModelConfig] |
///
/// The [Gson] instance is thread-safe and shared. Modules that define
/// config classes register them with [#registerConfigType] so that they can
/// be read back where only [ModelConfig] is declared.
public final class EstimatorsGsonConfig {

    private static final ModelConfigTypeAdapterFactory CONFIG_TYPES = ModelConfigTypeAdapterFactory.create();

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private static final Gson COMPACT = builder().create();

    private EstimatorsGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns a single-line Gson instance, used for log messages.
    ///
    /// @return the shared compact Gson instance
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Registers a config class for polymorphic reading.
    ///
    /// @param typeName the model type written in the `"type"` field
    /// @param configClass the concrete config class
    /// @throws IllegalArgumentException if the type belongs to another class
    public static void registerConfigType(String typeName, Class<? extends ModelConfig> configClass) {
        CONFIG_TYPES.registerType(typeName, configClass);
    }

    /// @return the model types that can currently be read as [ModelConfig]
    public static Set<String> configTypes() {
        return CONFIG_TYPES.registeredTypes();
    }

    /// Creates a new GsonBuilder with the estimator defaults, for callers that
    /// need to register additional adapters.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(CONFIG_TYPES);
    }
}
