package io.nosqlbench.estimators.models.scale;

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

/// Online accumulator of the mean and variance of one column.
///
/// # Algorithm
///
/// Uses Welford's algorithm for numerically stable single-pass moments:
///
/// ```text
///   For each new value x:
///
///     n = n + 1
///     delta = x - mean
///     mean = mean + delta / n
///     M2 = M2 + delta * (x - mean)
///
///   After all values:
///
///     variance = M2 / n
/// ```
///
/// # Merging
///
/// Two accumulators over disjoint batches combine with the parallel form
/// of the same algorithm, so per-batch accumulators merged in sequence give
/// the same moments as one accumulator over all rows (up to floating-point
/// rounding):
///
/// ```text
/// nAB = nA + nB
/// δ = meanB - meanA
/// meanAB = meanA + δ * nB / nAB
/// M2AB = M2A + M2B + δ² * nA * nB / nAB
/// ```
///
/// Not thread-safe. Owned by one [StandardScaler] state at a time and never
/// modified after being merged.
final class ColumnMomentsAccumulator {

    private long count = 0;
    private double mean = 0;
    private double m2 = 0;   // Second central moment (for variance)

    /// Accepts a new value into the accumulator.
    ///
    /// @param value the value to accumulate
    void accept(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    /// Combines this accumulator with another, leaving both unchanged.
    ///
    /// @param other the accumulator to combine with
    /// @return a new accumulator with combined moments
    ColumnMomentsAccumulator combine(ColumnMomentsAccumulator other) {
        ColumnMomentsAccumulator result = new ColumnMomentsAccumulator();

        if (this.count == 0) {
            result.copyFrom(other);
            return result;
        }
        if (other.count == 0) {
            result.copyFrom(this);
            return result;
        }

        double nA = this.count;
        double nB = other.count;
        double nAB = nA + nB;
        double delta = other.mean - this.mean;

        result.count = this.count + other.count;
        result.mean = this.mean + delta * nB / nAB;
        result.m2 = this.m2 + other.m2 + delta * delta * nA * nB / nAB;
        return result;
    }

    private void copyFrom(ColumnMomentsAccumulator source) {
        this.count = source.count;
        this.mean = source.mean;
        this.m2 = source.m2;
    }

    double mean() {
        return mean;
    }

    /// @return the population variance, zero when fewer than two values were seen
    double variance() {
        return count > 1 ? m2 / count : 0.0;
    }
}
