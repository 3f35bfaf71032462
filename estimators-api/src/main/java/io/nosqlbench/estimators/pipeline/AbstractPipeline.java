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

import io.nosqlbench.estimators.api.FitMode;
import io.nosqlbench.estimators.api.Stage;
import io.nosqlbench.estimators.api.Transformer;
import io.nosqlbench.estimators.errors.NotFittedException;
import io.nosqlbench.estimators.errors.ShapeMismatchException;
import io.nosqlbench.estimators.matrix.InputFormats;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared chaining logic for {@link TransformerPipeline} and {@link EstimatorPipeline}.
 *
 * <p>Each transformer's output matrix is the next stage's input. After every
 * stage the row count is compared with the stage's input, since downstream
 * stages and any associated targets rely on positional alignment.
 */
abstract class AbstractPipeline implements Stage {

    private static final Logger logger = LogManager.getLogger(AbstractPipeline.class);

    private final List<NamedStage<Transformer>> transformers;
    private final List<NamedStage<?>> stages;
    private final PipelineConfig config;

    AbstractPipeline(List<NamedStage<Transformer>> transformers, List<NamedStage<?>> stages) {
        this.transformers = List.copyOf(transformers);
        this.stages = List.copyOf(stages);
        this.config = new PipelineConfig(this.stages);
    }

    @Override
    public FitMode fitMode() {
        return FitMode.BATCH;
    }

    @Override
    public PipelineConfig config() {
        return config;
    }

    @Override
    public InputFormats inputFormats() {
        return stages.get(0).stage().inputFormats();
    }

    @Override
    public boolean isFitted() {
        return stages.stream().allMatch(named -> named.stage().isFitted());
    }

    @Override
    public int featureCount() {
        requireFitted("featureCount");
        return stages.get(0).stage().featureCount();
    }

    /**
     * Returns every stage in pipeline order.
     *
     * @return the named stages
     */
    public List<NamedStage<?>> stages() {
        return stages;
    }

    /**
     * Looks up a stage by name.
     *
     * @param name the stage name
     * @return the stage, if present
     */
    public Optional<Stage> stage(String name) {
        return stages.stream()
            .filter(named -> named.name().equals(name))
            .<Stage>map(NamedStage::stage)
            .findFirst();
    }

    /**
     * Trains every transformer in order, each on the previous one's output.
     *
     * @param x the pipeline input
     * @return the last transformer's output, or x when there are none
     */
    RealMatrix fitThrough(RealMatrix x) {
        Objects.requireNonNull(x, "x cannot be null");
        RealMatrix current = x;
        for (NamedStage<Transformer> named : transformers) {
            RealMatrix next = named.stage().fitTransform(current);
            checkRows(named.name(), current, next);
            logger.debug("pipeline stage '{}' fitted: {}x{} -> {}x{}", named.name(),
                current.getRowDimension(), current.getColumnDimension(),
                next.getRowDimension(), next.getColumnDimension());
            current = next;
        }
        return current;
    }

    /**
     * Applies every fitted transformer in order.
     *
     * @param x the pipeline input
     * @return the last transformer's output, or x when there are none
     */
    RealMatrix applyThrough(RealMatrix x) {
        Objects.requireNonNull(x, "x cannot be null");
        RealMatrix current = x;
        for (NamedStage<Transformer> named : transformers) {
            RealMatrix next = named.stage().transform(current);
            checkRows(named.name(), current, next);
            current = next;
        }
        return current;
    }

    void requireFitted(String operation) {
        if (!isFitted()) {
            throw new NotFittedException(operation, PipelineConfig.MODEL_TYPE);
        }
    }

    private static void checkRows(String name, RealMatrix input, RealMatrix output) {
        if (output.getRowDimension() != input.getRowDimension()) {
            throw ShapeMismatchException.rowsChanged(name, input.getRowDimension(), output.getRowDimension());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('[');
        for (int i = 0; i < stages.size(); i++) {
            if (i > 0) {
                sb.append(" -> ");
            }
            sb.append(stages.get(i).name()).append(':').append(stages.get(i).stage().modelType());
        }
        return sb.append(']').toString();
    }
}
