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

/// Thrown when R raised an error during a call. The message embeds the R diagnostic text
/// verbatim when the session captured one.
public class ForeignExecutionException extends RBridgeException {

  private final String operation;
  private final String diagnostic;

  /// @param operation the bridge operation during which R failed, such as `outer_predict`
  /// @param conditionMessage the R condition message, may be null
  /// @param diagnostic the captured R traceback, or null if none was captured
  /// @param cause the session-level fault
  public ForeignExecutionException(
      String operation, String conditionMessage, String diagnostic, Throwable cause)
  {
    super(formatMessage(operation, conditionMessage, diagnostic), cause);
    this.operation = operation;
    this.diagnostic = diagnostic;
  }

  private static String formatMessage(String operation, String conditionMessage, String diagnostic) {
    if (diagnostic != null && !diagnostic.isBlank()) {
      return "R error during '" + operation + "'. R traceback:\n" + diagnostic;
    }
    String detail = (conditionMessage == null || conditionMessage.isBlank())
        ? "no diagnostic available" : conditionMessage;
    return "R error during '" + operation + "': " + detail;
  }

  public String getOperation() {
    return operation;
  }

  /// @return the captured R traceback, or null if none was available
  public String getDiagnostic() {
    return diagnostic;
  }
}
