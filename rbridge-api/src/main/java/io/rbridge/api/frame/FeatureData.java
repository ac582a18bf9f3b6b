package io.rbridge.api.frame;

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

/// Two-dimensional data returned by a prediction or transform, dense or sparse.
public interface FeatureData {

  /// @return the number of rows
  int rowCount();

  /// @return the number of columns
  int columnCount();

  /// @return true if this is a coordinate-encoded sparse matrix
  boolean isSparse();
}
