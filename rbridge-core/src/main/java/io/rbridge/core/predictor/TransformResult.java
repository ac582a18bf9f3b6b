package io.rbridge.core.predictor;

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

import io.rbridge.api.frame.FeatureData;
import io.rbridge.api.frame.SparseMatrix;
import io.rbridge.api.frame.TabularFrame;

import java.util.Optional;

/// The outcome of a transform: transformed features, dense or sparse, and an optional
/// transformed target.
public final class TransformResult {

  private final FeatureData features;
  private final TabularFrame target;

  /// @param features the transformed features, not null
  /// @param target the transformed target, or null if the transform returned none
  public TransformResult(FeatureData features, TabularFrame target) {
    if (features == null) {
      throw new IllegalArgumentException("transform features cannot be null");
    }
    this.features = features;
    this.target = target;
  }

  public FeatureData features() {
    return features;
  }

  public boolean isSparse() {
    return features.isSparse();
  }

  /// @return the features as a frame
  /// @throws IllegalStateException if the features are sparse
  public TabularFrame denseFeatures() {
    if (features instanceof TabularFrame frame) {
      return frame;
    }
    throw new IllegalStateException("transform features are sparse: " + features);
  }

  /// @return the features as a sparse matrix
  /// @throws IllegalStateException if the features are dense
  public SparseMatrix sparseFeatures() {
    if (features instanceof SparseMatrix matrix) {
      return matrix;
    }
    throw new IllegalStateException("transform features are dense: " + features);
  }

  public Optional<TabularFrame> target() {
    return Optional.ofNullable(target);
  }

  @Override
  public String toString() {
    return "TransformResult[features=" + features + ", target=" + target + "]";
  }
}
