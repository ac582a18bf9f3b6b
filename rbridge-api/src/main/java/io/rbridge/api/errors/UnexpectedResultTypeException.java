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

/// Thrown when an R entry point returned a value of a different type than the calling mode
/// requires.
public class UnexpectedResultTypeException extends RBridgeException {

  private final String expected;
  private final String actual;

  /// @param expected description of the expected type
  /// @param actual the R type actually returned
  public UnexpectedResultTypeException(String expected, String actual) {
    this("Expected result type: " + expected + ", actual: " + actual + ".", expected, actual);
  }

  /// @param message a message which already names both types
  /// @param expected description of the expected type
  /// @param actual the R type actually returned
  protected UnexpectedResultTypeException(String message, String expected, String actual) {
    super(message);
    this.expected = expected;
    this.actual = actual;
  }

  public String getExpected() {
    return expected;
  }

  public String getActual() {
    return actual;
  }
}
