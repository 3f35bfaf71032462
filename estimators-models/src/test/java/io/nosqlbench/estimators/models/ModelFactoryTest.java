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

import io.nosqlbench.estimators.api.Stage;
import io.nosqlbench.estimators.config.ModelConfig;
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
import io.nosqlbench.estimators.pipeline.EstimatorPipeline;
import io.nosqlbench.estimators.pipeline.Pipeline;
import io.nosqlbench.estimators.pipeline.TransformerPipeline;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ModelFactoryTest {

    @Test
    void testCreatesEveryRegisteredType() {
        assertThat(ModelFactory.modelTypes()).containsExactly(
            "linear_regression", "logistic_regression", "sgd_regressor",
            "truncated_svd", "incremental_svd", "standard_scaler", "pipeline");

        assertInstanceOf(LinearRegression.class, ModelFactory.create("{\"type\": \"linear_regression\"}"));
        assertInstanceOf(LogisticRegression.class, ModelFactory.create("{\"type\": \"logistic_regression\"}"));
        assertInstanceOf(SgdRegressor.class, ModelFactory.create("{\"type\": \"sgd_regressor\"}"));
        assertInstanceOf(TruncatedSvd.class, ModelFactory.create("{\"type\": \"truncated_svd\", \"rank\": 2}"));
        assertInstanceOf(IncrementalSvd.class, ModelFactory.create("{\"type\": \"incremental_svd\", \"rank\": 2}"));
        assertInstanceOf(StandardScaler.class, ModelFactory.create("{\"type\": \"standard_scaler\"}"));
    }

    @Test
    void testConfigFieldsAreApplied() {
        TruncatedSvd svd = ModelFactory.create("""
            {
              "type": "truncated_svd",
              "rank": 3,
              "projection_ridge": 0.5
            }
            """, TruncatedSvd.class);

        assertEquals(3, svd.rank());
        assertEquals(TruncatedSvdConfig.ofRank(3).withProjectionRidge(0.5), svd.config());
        assertFalse(svd.isFitted());

        StandardScaler scaler = ModelFactory.create("{\"type\": \"standard_scaler\", \"with_mean\": false}",
            StandardScaler.class);
        assertFalse(scaler.config().withMean());
        assertTrue(scaler.config().withStd());
    }

    @Test
    void testRejectsBadDescriptions() {
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
            () -> ModelFactory.create("{\"type\": \"random_forest\"}"));
        assertThat(unknown.getMessage()).contains("random_forest").contains("linear_regression");

        assertThrows(IllegalArgumentException.class, () -> ModelFactory.create("{\"rank\": 2}"));
        assertThrows(IllegalArgumentException.class, () -> ModelFactory.create("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> ModelFactory.create("{\"type\": "));
        assertThrows(IllegalArgumentException.class, () -> ModelFactory.create("{\"type\": \"truncated_svd\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> ModelFactory.create("{\"type\": \"sgd_regressor\", \"epochs\": 0}"));
        assertThrows(IllegalArgumentException.class,
            () -> ModelFactory.create("{\"type\": \"standard_scaler\"}", TruncatedSvd.class));
    }

    @Test
    void testCreateFromConfig() {
        Stage stage = ModelFactory.create(IncrementalSvdConfig.ofRank(4));
        assertInstanceOf(IncrementalSvd.class, stage);
        assertEquals(IncrementalSvdConfig.MODEL_TYPE, stage.modelType());
    }

    @Test
    void testCreateFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("model.json");
        Files.writeString(file, "{\"type\": \"logistic_regression\", \"max_iterations\": 50}");

        LogisticRegression model = (LogisticRegression) ModelFactory.create(file);
        assertEquals(50, model.config().maxIterations());
    }

    @Test
    void testEveryConfigRoundTripsThroughJson() {
        List<ModelConfig> configs = List.of(
            LinearRegressionConfig.defaults().withFitIntercept(false).withL2Penalty(0.25),
            LogisticRegressionConfig.defaults().withLearningRate(0.05).withMaxIterations(300).withTolerance(1e-4),
            SgdRegressorConfig.defaults().withEpochs(7).withLearningRate(0.002),
            TruncatedSvdConfig.ofRank(5).withProjectionRidge(1e-3),
            IncrementalSvdConfig.ofRank(2),
            StandardScalerConfig.defaults().withStd(false));

        for (ModelConfig config : configs) {
            String json = ModelConfigs.toJson(config);
            assertThat(json).contains("\"type\": \"" + config.modelType() + "\"");
            assertEquals(config, ModelConfigs.fromJson(json, config.getClass()), json);
            assertEquals(config, ModelConfigs.fromJson(json, ModelConfig.class), json);
            assertEquals(config, ModelFactory.create(json).config(), json);
        }
    }

    @Test
    void testRejectsConfigOfAnotherType() {
        String json = ModelConfigs.toJson(StandardScalerConfig.defaults());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ModelConfigs.fromJson(json, TruncatedSvdConfig.class));
        assertThat(e.getMessage()).contains("standard_scaler");
    }

    @Test
    void testPipelineRoundTripsThroughJson() {
        EstimatorPipeline original = Pipeline.builder()
            .then("scale", new StandardScaler(StandardScalerConfig.defaults().withStd(false)))
            .then("svd", new TruncatedSvd(TruncatedSvdConfig.ofRank(2)))
            .endWith("regression", new LinearRegression(LinearRegressionConfig.defaults().withL2Penalty(0.5)));

        String json = ModelConfigs.toJson(original.config());
        EstimatorPipeline restored = ModelFactory.create(json, EstimatorPipeline.class);

        assertEquals(original.config(), restored.config());
        assertThat(restored.config().stages().keySet()).containsExactly("scale", "svd", "regression");
        assertFalse(restored.isFitted());

        RealMatrix x = ModelFixtures.gaussian(30, 4, ModelFixtures.SEED);
        RealVector y = ModelFixtures.linearTargets(x, new double[]{1, -1, 2, 0.5}, 0.0);
        original.fit(x, y);
        restored.fit(x, y);
        assertArrayEquals(original.predict(x).toArray(), restored.predict(x).toArray(), 0.0);
    }

    @Test
    void testPipelineDescriptions() {
        TransformerPipeline transformers = ModelFactory.create("""
            {
              "type": "pipeline",
              "stages": {
                "scale": {"type": "standard_scaler"},
                "svd": {"type": "incremental_svd", "rank": 2}
              }
            }
            """, TransformerPipeline.class);
        assertThat(transformers.config().stages().keySet()).containsExactly("scale", "svd");

        IllegalArgumentException misplaced = assertThrows(IllegalArgumentException.class,
            () -> ModelFactory.create("""
                {
                  "type": "pipeline",
                  "stages": {
                    "regression": {"type": "linear_regression"},
                    "scale": {"type": "standard_scaler"}
                  }
                }
                """));
        assertThat(misplaced.getMessage()).contains("regression");

        assertThrows(IllegalArgumentException.class,
            () -> ModelFactory.create("{\"type\": \"pipeline\", \"stages\": {\"scale\": {}}}"));
    }
}
