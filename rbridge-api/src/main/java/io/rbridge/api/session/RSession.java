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

import io.rbridge.api.values.RReference;
import io.rbridge.api.values.RValue;

import java.util.Optional;

/// A live R interpreter session.
///
/// Sessions are not thread safe. An R interpreter is single threaded and non-reentrant, so the
/// owner of a session must serialize every call into it.
///
/// Every operation which evaluates R code throws [RFaultException] when R signals an error.
/// When fault capture is armed, the session additionally records the R call stack at the point
/// of failure, available from [#capturedTraceback()] until capture is disarmed.
public interface RSession extends AutoCloseable {

  /// Evaluate an R script in the global environment.
  /// @param scriptName a name for the script, used in diagnostics
  /// @param scriptText the R source
  void source(String scriptName, String scriptText);

  /// @param symbol a global symbol
  /// @return true if the symbol is bound in the session's global environment
  boolean exists(String symbol);

  /// Call a global function and convert its result.
  /// @param function the function name
  /// @param arguments the call arguments; [io.rbridge.api.values.RReference] arguments are
  ///     resolved inside the session
  /// @return the converted result
  RValue call(String function, RArguments arguments);

  /// Call a global function and keep its result inside the session, bound to `symbol`.
  /// @param symbol the global symbol to bind the result to
  /// @param function the function name
  /// @param arguments the call arguments
  /// @return a reference to the retained result
  RReference callAndRetain(String symbol, String function, RArguments arguments);

  /// Start recording R tracebacks for faults raised by subsequent calls.
  void armFaultCapture();

  /// Stop recording tracebacks and discard any captured traceback.
  void disarmFaultCapture();

  /// @return the traceback recorded for the most recent fault while capture was armed
  Optional<String> capturedTraceback();

  /// Release the session. Idempotent.
  @Override
  void close();
}
