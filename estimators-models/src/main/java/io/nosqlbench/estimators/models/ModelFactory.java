package io.nosqlbench.estimators.models;

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

import io.nosqlbench.estimators.api.Estimator;
import io.nosqlbench.estimators.api.Stage;
import io.nosqlbench.estimators.api.Transformer;
import io.nosqlbench.estimators.config.EstimatorsGsonConfig;
import io.nosqlbench.estimators.config.ModelConfig;
import io.nosqlbench.estimators.config.ModelConfigTypeAdapterFactory;
import io.nosqlbench.estimators.config.ModelConfigs;
import io.nosqlbench.estimators.models.decompose.IncrementalSvd;
import io.nosqlbench.estimators.models.decompose.IncrementalSvdConfig;
import io.nosqlbench.estimators.models.decompose.TruncatedSvd;
import io.nosqlbench.estimators.models.decompose.TruncatedSvdConfig;
import io.nosqlbench.estimators.models.linear.LinearRegression;
import io.nosqlbench.estimators.models.linear.LinearRegressionConfig;
import io.nosqlbench.estimators.models.linear.LogisticRegression;
import io.nosqlbench.estimators.models.linear.LogisticRegressionConfig;
import io.nosqlbench.estimators.models.linear.SgdRegressor;
import io.nosqlbench.estimators.models.linear.SgdRegressorConfig;
import io.nosqlbench.estimators.models.scale.StandardScaler;
import io.nosqlbench.estimators.models.scale.StandardScalerConfig;
import io.nosqlbench.estimators.pipeline.Pipeline;
import io.nosqlbench.estimators.pipeline.PipelineConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Creates unfitted models from JSON descriptions.
 *
 * <p>The JSON object names the model in its {@code "type"} field; every other
 * field is read into that model's config:
 *
 * <pre>{@code
 * {
 *   "type": "truncated_svd",
 *   "rank": 2
 * }
 * }</pre>
 *
 * <h2>Supported Types</h2>
 *
 * <ul>
 *   <li>{@code linear_regression}</li>
 *   <li>{@code logistic_regression}</li>
 *   <li>{@code sgd_regressor}</li>
 *   <li>{@code truncated_svd}</li>
 *   <li>{@code incremental_svd}</li>
 *   <li>{@code standard_scaler}</li>
 *   <li>{@code pipeline}: {@code "stages"} maps stage names to nested model
 *       descriptions; every stage but the last must be a transformer</li>
 * </ul>
 *
 * <p>Loading this class registers every config type above with
 * {@link EstimatorsGsonConfig}, so configs written by
 * {@link ModelConfigs#toJson} can be read back as {@link ModelConfig}.
 */
public final class ModelFactory {

    private static final Logger logger = LogManager.getLogger(ModelFactory.class);

    /** JSON field naming the model type. */
    public static final String TYPE_FIELD = ModelConfigTypeAdapterFactory.TYPE_FIELD;

    private static final Map<String, Entry<?>> ENTRIES = new LinkedHashMap<>();

    static {
        register(LinearRegressionConfig.MODEL_TYPE, LinearRegressionConfig.class, LinearRegression::new);
        register(LogisticRegressionConfig.MODEL_TYPE, LogisticRegressionConfig.class, LogisticRegression::new);
        register(SgdRegressorConfig.MODEL_TYPE, SgdRegressorConfig.class, SgdRegressor::new);
        register(TruncatedSvdConfig.MODEL_TYPE, TruncatedSvdConfig.class, TruncatedSvd::new);
        register(IncrementalSvdConfig.MODEL_TYPE, IncrementalSvdConfig.class, IncrementalSvd::new);
        register(StandardScalerConfig.MODEL_TYPE, StandardScalerConfig.class, StandardScaler::new);
        register(PipelineConfig.MODEL_TYPE, PipelineConfig.class, ModelFactory::pipeline);
    }

    private ModelFactory() {
        // Utility class
    }

    private static <C extends ModelConfig> void register(String type, Class<C> configType,
                                                         Function<C, ? extends Stage> constructor) {
        ENTRIES.put(type, new Entry<>(configType, constructor));
        EstimatorsGsonConfig.registerConfigType(type, configType);
    }

    /**
     * @return the recognized values of the {@code "type"} field, in registration order
     */
    public static Set<String> modelTypes() {
        return Collections.unmodifiableSet(ENTRIES.keySet());
    }

    /**
     * Creates a model from its JSON description.
     *
     * @param json a JSON object with a {@code "type"} field
     * @return the unfitted model
     * @throws IllegalArgumentException if the JSON is malformed, the type is
     *                                  missing or unknown, or a config value is invalid
     */
    public static Stage create(String json) {
        return created(ModelConfigs.fromJson(json, ModelConfig.class));
    }

    /**
     * Creates a model from a JSON file.
     *
     * @param path the JSON file
     * @return the unfitted model
     * @throws IOException if the file cannot be read
     */
    public static Stage create(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        return created(ModelConfigs.load(path, ModelConfig.class));
    }

    /**
     * Creates the model matching an existing config.
     *
     * @param config the config
     * @return the unfitted model
     * @throws IllegalArgumentException if no model is registered for the config's type
     */
    public static Stage create(ModelConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        Entry<?> entry = ENTRIES.get(config.modelType());
        if (entry == null) {
            throw new IllegalArgumentException(
                "unknown model type '" + config.modelType() + "', expected one of " + ENTRIES.keySet());
        }
        return entry.instantiate(config);
    }

    /**
     * Creates a model and checks its class.
     *
     * @param json a JSON object with a {@code "type"} field
     * @param expected the model class the caller requires
     * @param <S> the model type
     * @return the unfitted model
     * @throws IllegalArgumentException if the described model is not an instance of {@code expected}
     */
    public static <S extends Stage> S create(String json, Class<S> expected) {
        Objects.requireNonNull(expected, "expected cannot be null");
        Stage stage = create(json);
        if (!expected.isInstance(stage)) {
            throw new IllegalArgumentException(
                "model type '" + stage.modelType() + "' is a " + stage.getClass().getSimpleName()
                    + ", not a " + expected.getSimpleName());
        }
        return expected.cast(stage);
    }

    private static Stage created(ModelConfig config) {
        Stage stage = create(config);
        logger.debug("created {} from JSON", stage);
        return stage;
    }

    private static Stage pipeline(PipelineConfig config) {
        Pipeline.Builder builder = Pipeline.builder();
        Iterator<Map.Entry<String, ModelConfig>> stages = config.stages().entrySet().iterator();
        while (stages.hasNext()) {
            Map.Entry<String, ModelConfig> named = stages.next();
            Stage stage = create(named.getValue());
            if (!stages.hasNext() && stage instanceof Estimator estimator) {
                return builder.endWith(named.getKey(), estimator);
            }
            if (!(stage instanceof Transformer transformer)) {
                throw new IllegalArgumentException(
                    "pipeline stage '" + named.getKey() + "' is a " + stage.modelType()
                        + " estimator; only the last stage can be an estimator");
            }
            builder.then(named.getKey(), transformer);
        }
        return builder.build();
    }

    private record Entry<C extends ModelConfig>(Class<C> configType, Function<C, ? extends Stage> constructor) {

        Stage instantiate(ModelConfig config) {
            if (!configType.isInstance(config)) {
                throw new IllegalArgumentException(
                    "config for '" + config.modelType() + "' must be a " + configType.getSimpleName());
            }
            return constructor.apply(configType.cast(config));
        }
    }
}
