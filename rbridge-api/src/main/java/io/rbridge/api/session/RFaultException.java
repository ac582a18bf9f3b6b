package io.rbridge.api.session;

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

/// Raised by an [RSession] when R signals an error, or when the session itself cannot
/// complete a request.
///
/// This is the raw session-level fault. Callers outside a session implementation never see it
/// directly: the fault capture scope converts it into a
/// [io.rbridge.api.errors.ForeignExecutionException] carrying the R diagnostic text.
public class RFaultException extends RuntimeException {

  /// @param conditionMessage the R condition message
  public RFaultException(String conditionMessage) {
    super(conditionMessage);
  }

  /// @param message the error message
  /// @param cause the underlying cause
  public RFaultException(String message, Throwable cause) {
    super(message, cause);
  }
}
