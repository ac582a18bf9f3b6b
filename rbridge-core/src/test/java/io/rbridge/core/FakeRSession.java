package io.rbridge.core;

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

import io.rbridge.api.session.RArguments;
import io.rbridge.api.session.RFaultException;
import io.rbridge.api.session.RSession;
import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RNull;
import io.rbridge.api.values.RReference;
import io.rbridge.api.values.RValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/// An in-memory [RSession] whose R functions are Java lambdas.
///
/// Calling an unregistered function faults the way R does. A function registered with
/// [#defineFailing(String, String, String)] faults with a message, and leaves the given
/// traceback behind when capture is armed.
public class FakeRSession implements RSession {

  private final Map<String, Function<RArguments, RValue>> functions = new HashMap<>();
  private final Map<String, String> tracebacks = new HashMap<>();
  private final Map<String, RValue> globals = new HashMap<>();
  private final Set<String> symbols = new HashSet<>();
  private final List<String> sourced = new ArrayList<>();
  private final List<String> calls = new ArrayList<>();
  private final Map<String, RArguments> lastArguments = new HashMap<>();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();
  private boolean armed;
  private int armCount;
  private int disarmCount;
  private String traceback;
  private boolean closed;
  private String failingScript;

  /// @return a session which accepts `init` and loads a model named `model`
  public static FakeRSession withEntryPoints() {
    FakeRSession session = new FakeRSession();
    session.define("init", args -> RNull.INSTANCE);
    session.define("load_serialized_model", args -> RCharacter.of("model"));
    return session;
  }

  public FakeRSession define(String name, Function<RArguments, RValue> function) {
    functions.put(name, function);
    symbols.add(name);
    return this;
  }

  public FakeRSession defineFailing(String name, String message, String traceback) {
    if (traceback != null) {
      tracebacks.put(name, traceback);
    }
    return define(name, args -> {
      throw new RFaultException(message);
    });
  }

  public FakeRSession bind(String symbol) {
    symbols.add(symbol);
    return this;
  }

  public FakeRSession unbind(String symbol) {
    symbols.remove(symbol);
    functions.remove(symbol);
    return this;
  }

  public FakeRSession failSourcing(String scriptName) {
    this.failingScript = scriptName;
    return this;
  }

  @Override
  public void source(String scriptName, String scriptText) {
    checkOpen();
    if (scriptName.equals(failingScript)) {
      if (armed) {
        traceback = "Error in parse(text = script): unexpected symbol";
      }
      throw new RFaultException("unexpected symbol");
    }
    sourced.add(scriptName);
  }

  @Override
  public boolean exists(String symbol) {
    checkOpen();
    return symbols.contains(symbol);
  }

  @Override
  public RValue call(String function, RArguments arguments) {
    checkOpen();
    int current = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(current, Math::max);
    try {
      calls.add(function);
      lastArguments.put(function, arguments);
      Function<RArguments, RValue> body = functions.get(function);
      if (body == null) {
        throw new RFaultException("could not find function \"" + function + "\"");
      }
      try {
        return body.apply(arguments);
      } catch (RFaultException e) {
        if (armed) {
          traceback = tracebacks.get(function);
        }
        throw e;
      }
    } finally {
      inFlight.decrementAndGet();
    }
  }

  @Override
  public RReference callAndRetain(String symbol, String function, RArguments arguments) {
    RValue value = call(function, arguments);
    globals.put(symbol, value);
    symbols.add(symbol);
    return new RReference(symbol);
  }

  @Override
  public void armFaultCapture() {
    checkOpen();
    armed = true;
    armCount++;
    traceback = null;
  }

  @Override
  public void disarmFaultCapture() {
    armed = false;
    disarmCount++;
    traceback = null;
  }

  @Override
  public Optional<String> capturedTraceback() {
    return Optional.ofNullable(traceback);
  }

  @Override
  public void close() {
    closed = true;
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("fake session is closed");
    }
  }

  public boolean isArmed() {
    return armed;
  }

  public int armCount() {
    return armCount;
  }

  public int disarmCount() {
    return disarmCount;
  }

  public boolean isClosed() {
    return closed;
  }

  public List<String> sourced() {
    return Collections.unmodifiableList(sourced);
  }

  public List<String> calls() {
    return Collections.unmodifiableList(calls);
  }

  public RArguments lastArguments(String function) {
    return lastArguments.get(function);
  }

  public RValue retained(String symbol) {
    return globals.get(symbol);
  }

  public int maxInFlight() {
    return maxInFlight.get();
  }
}
