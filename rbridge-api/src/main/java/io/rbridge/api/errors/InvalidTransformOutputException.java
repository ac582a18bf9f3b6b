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

/// Thrown when a transform does not return a two-element list of features and target, when
/// its features are not a table, or when its sparse triplet encoding is malformed.
public class InvalidTransformOutputException extends UnexpectedResultTypeException {

  /// @param what which part of the output was malformed
  /// @param expected the expected type
  /// @param actual the R type actually returned
  public InvalidTransformOutputException(String what, String expected, String actual) {
    super("Expected transform " + what + " type: " + expected + ", actual: " + actual + ".",
        expected, actual);
  }
}
