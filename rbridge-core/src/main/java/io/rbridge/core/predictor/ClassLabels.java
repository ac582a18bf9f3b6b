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

import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RNull;
import io.rbridge.api.values.RValue;

import java.util.List;

/// The class labels of a classification model, as passed to every structured prediction.
/// Absent labels are sent to R as `NULL`.
/// @param positive the positive class label of a binary model, or null
/// @param negative the negative class label of a binary model, or null
/// @param labels the full label set of a multiclass model, or null
public record ClassLabels(String positive, String negative, List<String> labels) {

  private static final ClassLabels NONE = new ClassLabels(null, null, null);

  public ClassLabels {
    labels = labels == null ? null : List.copyOf(labels);
  }

  /// @return labels for a model without classes
  public static ClassLabels none() {
    return NONE;
  }

  /// @param params predictor parameters
  /// @return the labels the parameters declare
  public static ClassLabels from(PredictorParams params) {
    return new ClassLabels(params.positiveClassLabel(), params.negativeClassLabel(), params.classLabels());
  }

  public RValue positiveToR() {
    return positive == null ? RNull.INSTANCE : RCharacter.of(positive);
  }

  public RValue negativeToR() {
    return negative == null ? RNull.INSTANCE : RCharacter.of(negative);
  }

  public RValue labelsToR() {
    return labels == null ? RNull.INSTANCE : new RCharacter(labels);
  }
}
