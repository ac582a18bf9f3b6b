package io.rbridge.rserve;

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
import io.rbridge.api.values.RNull;
import io.rbridge.api.values.RReference;
import io.rbridge.api.values.RValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rosuda.REngine.REXP;
import org.rosuda.REngine.REXPGenericVector;
import org.rosuda.REngine.REXPLogical;
import org.rosuda.REngine.REXPMismatchException;
import org.rosuda.REngine.REngineException;
import org.rosuda.REngine.Rserve.RConnection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// An [RSession] backed by one Rserve connection.
///
/// Every evaluation goes through a guard function installed when the session opens. The
/// guard turns an R error into a value of class `rbridge_fault` instead of failing the
/// request, and while capture is armed it records the call stack at the point of the error.
/// Arguments travel as one generic vector assigned to `.rbridge_args`, then spliced into the
/// call with `do.call`.
public class RserveSession implements RSession {
  private static final Logger logger = LogManager.getLogger(RserveSession.class);

  static final String FAULT_CLASS = "rbridge_fault";
  static final String ARGS_SYMBOL = ".rbridge_args";
  static final String SCRIPT_SYMBOL = ".rbridge_script";
  static final String RESULT_SYMBOL = ".rbridge_result";

  static final String GUARD_SOURCE = String.join("\n",
      ".rbridge_capture <- new.env()",
      ".rbridge_capture$armed <- FALSE",
      ".rbridge_capture$traceback <- NULL",
      ".rbridge_guard <- function(f) {",
      "  tryCatch(",
      "    withCallingHandlers(f(), error = function(e) {",
      "      if (isTRUE(.rbridge_capture$armed)) {",
      "        calls <- sys.calls()",
      "        lines <- vapply(calls, function(cl) paste(deparse(cl, nlines = 1L), collapse = ''), '')",
      "        .rbridge_capture$traceback <- paste(c(conditionMessage(e), rev(lines)), collapse = '\\n')",
      "      }",
      "    }),",
      "    error = function(e) structure(list(message = conditionMessage(e)), class = '"
          + FAULT_CLASS + "'))",
      "}",
      "invisible(TRUE)");

  private final RConnection connection;
  private boolean closed;

  /// @param connection an open connection this session takes ownership of
  public RserveSession(RConnection connection) {
    this.connection = connection;
    evalRaw(GUARD_SOURCE, "install fault guard");
  }

  @Override
  public void source(String name, String text) {
    logger.debug("sourcing {} ({} chars)", name, text.length());
    try {
      connection.assign(SCRIPT_SYMBOL, text);
    } catch (REngineException e) {
      throw new RFaultException("Rserve failed to receive script " + name + ": " + e.getMessage(), e);
    }
    guarded("function() { eval(parse(text = " + SCRIPT_SYMBOL
        + ", keep.source = FALSE), envir = globalenv()); invisible(TRUE) }");
  }

  @Override
  public boolean exists(String symbol) {
    REXP result = evalRaw("exists(" + quote(symbol) + ", envir = globalenv())", "exists");
    if (result instanceof REXPLogical logical && logical.length() > 0) {
      return logical.isTRUE()[0];
    }
    throw new RFaultException("exists(" + symbol + ") did not return a logical");
  }

  @Override
  public RValue call(String function, RArguments arguments) {
    assignArguments(arguments);
    return RexpConverter.toRValue(guarded(doCall(function)));
  }

  @Override
  public RReference callAndRetain(String symbol, String function, RArguments arguments) {
    assignArguments(arguments);
    checkFault(evalRaw("{ " + RESULT_SYMBOL + " <- .rbridge_guard(" + doCall(function) + "); "
        + "if (inherits(" + RESULT_SYMBOL + ", '" + FAULT_CLASS + "')) " + RESULT_SYMBOL + " else { "
        + "assign(" + quote(symbol) + ", " + RESULT_SYMBOL + ", envir = globalenv()); TRUE } }",
        "call"));
    return new RReference(symbol);
  }

  @Override
  public void armFaultCapture() {
    evalRaw(".rbridge_capture$traceback <- NULL; .rbridge_capture$armed <- TRUE", "arm");
  }

  @Override
  public void disarmFaultCapture() {
    evalRaw(".rbridge_capture$armed <- FALSE; .rbridge_capture$traceback <- NULL", "disarm");
  }

  @Override
  public Optional<String> capturedTraceback() {
    REXP traceback = evalRaw(".rbridge_capture$traceback", "traceback");
    if (traceback == null || traceback.isNull()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(traceback.asString());
    } catch (REXPMismatchException e) {
      throw new RFaultException("captured traceback is not a string", e);
    }
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      connection.close();
      logger.debug("closed Rserve connection");
    }
  }

  private String doCall(String function) {
    return "function() do.call(" + quote(function) + ", " + ARGS_SYMBOL + ", envir = globalenv())";
  }

  private REXP guarded(String function) {
    return checkFault(evalRaw(".rbridge_guard(" + function + ")", "call"));
  }

  private static REXP checkFault(REXP result) {
    if (result != null && result.inherits(FAULT_CLASS)) {
      throw new RFaultException(faultMessage(result));
    }
    return result;
  }

  private static String faultMessage(REXP fault) {
    try {
      REXP message = fault.asList().at("message");
      return message == null ? "unknown R error" : message.asString();
    } catch (REXPMismatchException e) {
      return "unreadable R error: " + e.getMessage();
    }
  }

  private void assignArguments(RArguments arguments) {
    List<RArguments.Argument> list = arguments.arguments();
    REXP[] contents = new REXP[list.size()];
    String[] names = new String[list.size()];
    List<String> references = new ArrayList<>();
    for (int i = 0; i < list.size(); i++) {
      RArguments.Argument argument = list.get(i);
      names[i] = argument.name();
      RValue value = argument.value();
      if (value instanceof RReference reference) {
        contents[i] = RexpConverter.toRexp(RNull.INSTANCE);
        references.add(ARGS_SYMBOL + "[" + (i + 1) + "] <- list(get(" + quote(reference.symbol())
            + ", envir = globalenv()))");
      } else {
        contents[i] = RexpConverter.toRexp(value);
      }
    }
    try {
      connection.assign(ARGS_SYMBOL,
          new REXPGenericVector(new org.rosuda.REngine.RList(contents, names)));
    } catch (REngineException e) {
      throw new RFaultException("Rserve failed to receive call arguments: " + e.getMessage(), e);
    }
    for (String reference : references) {
      evalRaw(reference, "bind reference");
    }
  }

  private REXP evalRaw(String expression, String what) {
    if (closed) {
      throw new IllegalStateException("Rserve session is closed");
    }
    try {
      return connection.eval(expression);
    } catch (REngineException e) {
      throw new RFaultException("Rserve request '" + what + "' failed: " + e.getMessage(), e);
    }
  }

  /// @param text any string
  /// @return an R string literal for it
  static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
    for (char c : text.toCharArray()) {
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
