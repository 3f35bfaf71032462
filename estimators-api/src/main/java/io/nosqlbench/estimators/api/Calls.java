package io.nosqlbench.estimators.api;

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

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Objects;

/// Subject-first call form.
///
/// Each method is a pure re-dispatch to the corresponding method on the
/// model, so `Calls.predict(x, model)` and `model.predict(x)` are the same
/// call and return identical results:
///
/// ```java
/// import static io.nosqlbench.estimators.api.Calls.*;
///
/// RealMatrix reduced = fitTransform(x, svd);
/// fit(reduced, y, regression);
/// RealVector predictions = predict(transform(newX, svd), regression);
/// ```
///
/// For longer left-to-right chains see [MatrixFlow].
public final class Calls {

    private Calls() {
        // Utility class
    }

    /// @param x features
    /// @param y targets
    /// @param model the estimator to train
    public static void fit(RealMatrix x, RealVector y, Estimator model) {
        Objects.requireNonNull(model, "model cannot be null").fit(x, y);
    }

    /// @param x features
    /// @param model a fitted estimator
    /// @return `model.predict(x)`
    public static RealVector predict(RealMatrix x, Estimator model) {
        return Objects.requireNonNull(model, "model cannot be null").predict(x);
    }

    /// @param x features
    /// @param model the transformer to train
    /// @return `model.fitTransform(x)`
    public static RealMatrix fitTransform(RealMatrix x, Transformer model) {
        return Objects.requireNonNull(model, "model cannot be null").fitTransform(x);
    }

    /// @param x features
    /// @param model a fitted transformer
    /// @return `model.transform(x)`
    public static RealMatrix transform(RealMatrix x, Transformer model) {
        return Objects.requireNonNull(model, "model cannot be null").transform(x);
    }

    /// @param x batch features
    /// @param y batch targets
    /// @param model the online estimator to update
    public static void partialFit(RealMatrix x, RealVector y, OnlineEstimator model) {
        Objects.requireNonNull(model, "model cannot be null").partialFit(x, y);
    }

    /// @param x batch features
    /// @param model the online transformer to update
    public static void partialFit(RealMatrix x, OnlineTransformer model) {
        Objects.requireNonNull(model, "model cannot be null").partialFit(x);
    }
}
