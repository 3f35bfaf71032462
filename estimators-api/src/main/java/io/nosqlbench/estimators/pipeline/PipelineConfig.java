package io.nosqlbench.estimators.pipeline;

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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.estimators.config.ModelConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Hyperparameters of a pipeline: the configs of its stages, keyed by stage
/// name in pipeline order.
public final class PipelineConfig implements ModelConfig {

    /// Model type identifier for pipelines.
    public static final String MODEL_TYPE = "pipeline";

    @SerializedName("stages")
    private final LinkedHashMap<String, ModelConfig> stages;

    private PipelineConfig() {
        this.stages = new LinkedHashMap<>();
    }

    PipelineConfig(List<? extends NamedStage<?>> namedStages) {
        this.stages = new LinkedHashMap<>();
        for (NamedStage<?> named : namedStages) {
            stages.put(named.name(), named.stage().config());
        }
    }

    /// @return stage configs by stage name, in pipeline order
    public Map<String, ModelConfig> stages() {
        return Collections.unmodifiableMap(stages);
    }

    @Override
    public String modelType() {
        return MODEL_TYPE;
    }

    @Override
    public void validate() {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("a pipeline needs at least one stage");
        }
        for (Map.Entry<String, ModelConfig> entry : stages.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("stage '" + entry.getKey() + "' has no config");
            }
            entry.getValue().validate();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipelineConfig that)) return false;
        return stages.equals(that.stages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stages);
    }
}
