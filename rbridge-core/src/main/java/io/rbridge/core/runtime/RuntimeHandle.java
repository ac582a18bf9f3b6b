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

import io.rbridge.api.TargetType;
import io.rbridge.api.session.RArguments;
import io.rbridge.api.session.RSession;
import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RReference;
import io.rbridge.api.values.RValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/// The long-lived owner of one R session.
///
/// Every access to the session goes through a single lock, so at most one call is in flight
/// per handle regardless of how many threads share it. Each call that evaluates R code runs
/// inside a [FaultCapture] scope, which is armed and disarmed within the same critical section.
///
/// The handle must be initialized exactly once before any call.
public class RuntimeHandle implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(RuntimeHandle.class);

  /// Global symbol the loaded model is retained under.
  public static final String MODEL_SYMBOL = ".rbridge_model";

  private final RSession session;
  private final ReentrantLock lock = new ReentrantLock();
  private boolean initialized;
  private boolean closed;

  /// @param session the session this handle takes ownership of
  public RuntimeHandle(RSession session) {
    if (session == null) {
      throw new IllegalArgumentException("session cannot be null");
    }
    this.session = session;
  }

  /// Source the support scripts and call R `init`.
  /// @param codeDir the directory holding the model author's code and artifacts
  /// @param targetType the target type of the model
  /// @throws IllegalStateException if the handle was already initialized or is closed
  /// @throws io.rbridge.api.errors.ForeignExecutionException if sourcing or `init` fails in R
  public void initialize(Path codeDir, TargetType targetType) {
    lock.lock();
    try {
      checkOpen();
      if (initialized) {
        throw new IllegalStateException("R runtime handle is already initialized");
      }
      try (FaultCapture capture = FaultCapture.arm(session, EntryPoints.INIT)) {
        for (SupportScript script : SupportScript.values()) {
          logger.debug("sourcing R support script {}", script.resourceName());
          capture.execute(() -> session.source(script.resourceName(), script.text()));
        }
        capture.run(() -> session.call(EntryPoints.INIT, pathAndTarget(codeDir, targetType)));
      }
      initialized = true;
      logger.info("initialized R session for {} model in {}", targetType.value(), codeDir);
    } finally {
      lock.unlock();
    }
  }

  /// @param name a global symbol
  /// @return true if the symbol is bound in the session
  public boolean hookExists(String name) {
    return withSession("exists(" + name + ")", s -> s.exists(name));
  }

  /// Deserialize the model inside R and keep it there.
  /// @param codeDir the model directory
  /// @param targetType the target type
  /// @return a reference to the model, valid for the life of this handle
  public RReference loadModel(Path codeDir, TargetType targetType) {
    RReference model = withSession(EntryPoints.LOAD_SERIALIZED_MODEL,
        s -> s.callAndRetain(MODEL_SYMBOL, EntryPoints.LOAD_SERIALIZED_MODEL,
            pathAndTarget(codeDir, targetType)));
    logger.info("loaded serialized model from {}", codeDir);
    return model;
  }

  /// Call an R function. Arguments must already be R values.
  /// @param function the function name
  /// @param arguments the call arguments
  /// @return the result
  /// @throws io.rbridge.api.errors.ForeignExecutionException if R raised an error
  public RValue invoke(String function, RArguments arguments) {
    logger.debug("invoking R function {} with {} arguments", function, arguments.size());
    return withSession(function, s -> s.call(function, arguments));
  }

  public boolean isInitialized() {
    lock.lock();
    try {
      return initialized;
    } finally {
      lock.unlock();
    }
  }

  /// Close the session. Idempotent; waits for an in-flight call to finish.
  @Override
  public void close() {
    lock.lock();
    try {
      if (!closed) {
        closed = true;
        session.close();
        logger.debug("closed R session");
      }
    } finally {
      lock.unlock();
    }
  }

  private <T> T withSession(String operation, Function<RSession, T> body) {
    lock.lock();
    try {
      checkOpen();
      if (!initialized) {
        throw new IllegalStateException("R runtime handle is not initialized");
      }
      try (FaultCapture capture = FaultCapture.arm(session, operation)) {
        return capture.run(() -> body.apply(session));
      }
    } finally {
      lock.unlock();
    }
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("R runtime handle is closed");
    }
  }

  private static RArguments pathAndTarget(Path codeDir, TargetType targetType) {
    return RArguments.builder()
        .positional(RCharacter.of(codeDir.toString()))
        .positional(RCharacter.of(targetType.value()))
        .build();
  }
}
