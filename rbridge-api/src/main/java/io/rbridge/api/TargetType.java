package io.rbridge.api;

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

import java.util.Arrays;
import java.util.Optional;

/// The kind of model a predictor serves. The value string is what R's `init` receives.
public enum TargetType {
  REGRESSION("regression"),
  BINARY("binary"),
  MULTICLASS("multiclass"),
  ANOMALY("anomaly"),
  UNSTRUCTURED("unstructured"),
  TRANSFORM("transform");

  private final String value;

  TargetType(String value) {
    this.value = value;
  }

  /// @return the wire value of this target type
  public String value() {
    return value;
  }

  /// @return true for target types which produce class probabilities
  public boolean isClassification() {
    return this == BINARY || this == MULTICLASS;
  }

  /// @param value a wire value, case insensitive
  /// @return the matching target type, or empty if none matches
  public static Optional<TargetType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(t -> t.value.equalsIgnoreCase(value.trim())).findFirst();
  }
}
