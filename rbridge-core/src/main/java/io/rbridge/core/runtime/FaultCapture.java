package io.rbridge.core.runtime;

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

import io.rbridge.api.errors.ForeignExecutionException;
import io.rbridge.api.session.RFaultException;
import io.rbridge.api.session.RSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Supplier;

/// A scope which intercepts R faults for the calls made within it.
///
/// Opening the scope arms traceback capture in the session; closing it disarms capture on
/// every exit path, so no capture state survives into the next call. A fault raised inside
/// [#run(Supplier)] is logged at error level and rethrown as a
/// [ForeignExecutionException] carrying the captured traceback.
///
/// ```
/// try (FaultCapture capture = FaultCapture.arm(session, "outer_predict")) {
///   return capture.run(() -> session.call("outer_predict", arguments));
/// }
/// ```
public final class FaultCapture implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(FaultCapture.class);

  private final RSession session;
  private final String operation;
  private boolean closed;

  private FaultCapture(RSession session, String operation) {
    this.session = session;
    this.operation = operation;
  }

  /// Arm traceback capture in the session.
  /// @param session the session to guard
  /// @param operation the operation name reported in errors
  /// @return the open scope
  /// @throws ForeignExecutionException if the session can not arm capture
  public static FaultCapture arm(RSession session, String operation) {
    try {
      session.armFaultCapture();
    } catch (RFaultException fault) {
      throw failure(operation, fault, null);
    }
    return new FaultCapture(session, operation);
  }

  /// Run a call against the guarded session.
  /// @param call the call
  /// @param <T> the result type
  /// @return the call's result
  /// @throws ForeignExecutionException if R raised an error during the call
  public <T> T run(Supplier<T> call) {
    if (closed) {
      throw new IllegalStateException("fault capture for '" + operation + "' is already closed");
    }
    try {
      return call.get();
    } catch (RFaultException fault) {
      String traceback = null;
      RFaultException unreadable = null;
      try {
        traceback = session.capturedTraceback().orElse(null);
      } catch (RFaultException e) {
        unreadable = e;
      }
      ForeignExecutionException error = failure(operation, fault, traceback);
      if (unreadable != null) {
        error.addSuppressed(unreadable);
      }
      throw error;
    }
  }

  /// Run a call with no result against the guarded session.
  /// @param call the call
  public void execute(Runnable call) {
    run(() -> {
      call.run();
      return null;
    });
  }

  private static ForeignExecutionException failure(
      String operation, RFaultException fault, String traceback)
  {
    ForeignExecutionException error =
        new ForeignExecutionException(operation, fault.getMessage(), traceback, fault);
    logger.error(error.getMessage());
    return error;
  }

  /// @throws ForeignExecutionException if the session can not disarm capture
  @Override
  public void close() {
    if (!closed) {
      closed = true;
      try {
        session.disarmFaultCapture();
      } catch (RFaultException fault) {
        throw failure(operation, fault, null);
      }
    }
  }
}
