package io.rbridge.api.errors;

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

/// Base of every failure the bridge reports to its host.
///
/// All bridge failures are unchecked; they propagate to the caller of the predictor with a
/// message naming what was expected and what was found.
public class RBridgeException extends RuntimeException {

  /// @param message the error message
  public RBridgeException(String message) {
    super(message);
  }

  /// @param message the error message
  /// @param cause the underlying cause
  public RBridgeException(String message, Throwable cause) {
    super(message, cause);
  }
}
