package io.rbridge.core.predictor;

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

import io.rbridge.api.PayloadFormat;
import io.rbridge.api.TargetType;
import io.rbridge.api.errors.InvalidPredictionShapeException;
import io.rbridge.api.errors.InvalidTransformOutputException;
import io.rbridge.api.errors.MissingHookException;
import io.rbridge.api.errors.UnexpectedResultTypeException;
import io.rbridge.api.errors.UnsupportedValueTypeException;
import io.rbridge.api.frame.FeatureData;
import io.rbridge.api.frame.TabularFrame;
import io.rbridge.api.session.RArguments;
import io.rbridge.api.session.RSession;
import io.rbridge.api.session.RSessionLookup;
import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RDataFrame;
import io.rbridge.api.values.RList;
import io.rbridge.api.values.RReference;
import io.rbridge.api.values.RValue;
import io.rbridge.core.codec.SparseTriplets;
import io.rbridge.core.codec.ValueCodec;
import io.rbridge.core.runtime.EntryPoints;
import io.rbridge.core.runtime.RuntimeHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A [LanguagePredictor] backed by an R session.
///
/// The predictor owns a [RuntimeHandle] and translates each host request into a call of one
/// of the R entry points the support scripts define, converting arguments and results with
/// [ValueCodec].
///
/// ```
/// try (RPredictor predictor = RPredictor.create(PredictorParams.load(configFile))) {
///   TabularFrame predictions = predictor.predictStructured(csvBytes, "text/csv");
/// }
/// ```
public class RPredictor implements LanguagePredictor {
  private static final Logger logger = LogManager.getLogger(RPredictor.class);

  /// Column name given to a bare numeric prediction vector.
  public static final String PREDICTIONS_COLUMN = "Predictions";
  /// Column name given to a bare transformed target vector.
  public static final String TARGET_COLUMN = "target";

  private static final Set<PayloadFormat> SUPPORTED_FORMATS =
      Collections.unmodifiableSet(EnumSet.of(PayloadFormat.CSV, PayloadFormat.MTX));

  /// Lifecycle of a predictor.
  public enum State {
    UNCONFIGURED,
    CONFIGURED,
    FAILED,
    CLOSED
  }

  private final RuntimeHandle handle;
  private volatile State state = State.UNCONFIGURED;
  private PredictorParams params;
  private ClassLabels labels = ClassLabels.none();
  private RReference model;

  /// @param session the session this predictor takes ownership of
  public RPredictor(RSession session) {
    this.handle = new RuntimeHandle(session);
  }

  /// Open a session of the configured kind and configure a predictor on it.
  /// @param params the predictor parameters
  /// @return a configured predictor
  /// @throws io.rbridge.api.errors.ConfigurationException if no session can be opened or the
  ///     model directory does not provide what the target type needs
  public static RPredictor create(PredictorParams params) {
    RSession session = RSessionLookup.open(params.sessionKind(), params.sessionOptions());
    logger.info("opened {} R session", params.sessionKind());
    RPredictor predictor = new RPredictor(session);
    try {
      predictor.configure(params);
    } catch (RuntimeException e) {
      predictor.close();
      throw e;
    }
    return predictor;
  }

  @Override
  public synchronized void configure(PredictorParams params) {
    if (state != State.UNCONFIGURED) {
      throw new IllegalStateException("predictor can only be configured once, state is " + state);
    }
    TargetType targetType = params.targetType();
    try {
      handle.initialize(params.codeDir(), targetType);
      if (targetType == TargetType.UNSTRUCTURED) {
        requireHook(targetType, EntryPoints.PREDICT_UNSTRUCTURED);
        for (String hook : CustomHooks.REQUIRED_FOR_UNSTRUCTURED) {
          requireHook(targetType, hook);
        }
      }
      this.model = handle.loadModel(params.codeDir(), targetType);
      this.params = params;
      this.labels = ClassLabels.from(params);
      this.state = State.CONFIGURED;
      logger.info("configured R predictor for {} model in {}", targetType.value(),
          params.codeDir());
    } catch (RuntimeException e) {
      this.state = State.FAILED;
      throw e;
    }
  }

  private void requireHook(TargetType targetType, String hook) {
    if (!handle.hookExists(hook)) {
      throw new MissingHookException(targetType.value(), hook);
    }
  }

  @Override
  public TabularFrame predictStructured(byte[] binaryData, String mimeType) {
    checkConfigured();
    RArguments arguments = RArguments.builder()
        .positional(RCharacter.of(params.targetType().value()))
        .named(EntryPoints.ARG_BINARY_DATA, ValueCodec.toR(binaryData))
        .named(EntryPoints.ARG_MIMETYPE, ValueCodec.toR(mimeType))
        .named(EntryPoints.ARG_MODEL, model)
        .named(EntryPoints.ARG_POSITIVE_CLASS_LABEL, labels.positiveToR())
        .named(EntryPoints.ARG_NEGATIVE_CLASS_LABEL, labels.negativeToR())
        .named(EntryPoints.ARG_CLASS_LABELS, labels.labelsToR())
        .build();
    RValue result = handle.invoke(EntryPoints.OUTER_PREDICT, arguments);
    try {
      return ValueCodec.toFrame(result, PREDICTIONS_COLUMN);
    } catch (UnexpectedResultTypeException e) {
      throw logged(new InvalidPredictionShapeException("data.frame", e.getActual()));
    }
  }

  @Override
  public UnstructuredResult predictUnstructured(Object data, Map<String, String> query,
      Map<String, ?> extraParams)
  {
    checkConfigured();
    if (data != null && !(data instanceof byte[]) && !(data instanceof String)) {
      throw new UnsupportedValueTypeException("unstructured data must be byte[] or String, got "
          + data.getClass().getName());
    }
    RArguments.Builder arguments = RArguments.builder()
        .named(EntryPoints.ARG_MODEL, model)
        .named(EntryPoints.ARG_DATA, ValueCodec.toR(data));
    if (query != null) {
      arguments.named(EntryPoints.ARG_QUERY, ValueCodec.toRList(query));
    }
    if (extraParams != null) {
      extraParams.forEach((name, value) -> {
        if (value != null) {
          if (EntryPoints.ARG_MODEL.equals(name) || EntryPoints.ARG_DATA.equals(name)
              || EntryPoints.ARG_QUERY.equals(name))
          {
            throw new IllegalArgumentException("extra parameter '" + name + "' is reserved");
          }
          arguments.named(name, ValueCodec.toR(value));
        }
      });
    }
    RValue result = handle.invoke(EntryPoints.PREDICT_UNSTRUCTURED, arguments.build());
    if (result.kind() != RValue.Kind.LIST || result.length() != 2) {
      throw logged(new UnexpectedResultTypeException("list of 2 elements", describe(result)));
    }
    RList pair = (RList) result;
    return new UnstructuredResult(ValueCodec.fromR(pair.get(0)), ValueCodec.toMap(pair.get(1)));
  }

  @Override
  public TransformResult transform(byte[] binaryData, byte[] targetBinaryData, String mimeType) {
    checkConfigured();
    RArguments arguments = RArguments.builder()
        .named(EntryPoints.ARG_BINARY_DATA, ValueCodec.toR(binaryData))
        .named(EntryPoints.ARG_TARGET_BINARY_DATA, ValueCodec.toR(targetBinaryData))
        .named(EntryPoints.ARG_MIMETYPE, ValueCodec.toR(mimeType))
        .named(EntryPoints.ARG_TRANSFORMER, model)
        .build();
    RValue result = handle.invoke(EntryPoints.OUTER_TRANSFORM, arguments);
    if (result.kind() != RValue.Kind.LIST || result.length() != 2) {
      throw logged(new InvalidTransformOutputException("output", "list of 2 elements",
          describe(result)));
    }
    RList pair = (RList) result;
    RValue features = pair.get(0);
    if (features.kind() != RValue.Kind.DATA_FRAME) {
      throw logged(new InvalidTransformOutputException("features", "data.frame",
          features.typeName()));
    }
    return new TransformResult(toFeatures((RDataFrame) features), toTarget(pair.get(1)));
  }

  private static FeatureData toFeatures(RDataFrame features) {
    TabularFrame frame = ValueCodec.fromRDataFrame(features);
    if (SparseTriplets.isTripletFrame(frame)) {
      logger.debug("decoding sparse triplet transform output with {} rows", frame.rowCount());
      try {
        return SparseTriplets.decode(frame);
      } catch (InvalidTransformOutputException e) {
        throw logged(e);
      }
    }
    return frame;
  }

  private static TabularFrame toTarget(RValue target) {
    return switch (target.kind()) {
      case NULL -> null;
      case DATA_FRAME -> ValueCodec.fromRDataFrame((RDataFrame) target);
      case NUMERIC, INTEGER, CHARACTER, LOGICAL ->
          new TabularFrame(List.of(ValueCodec.toColumn(TARGET_COLUMN, target)));
      default -> throw logged(new InvalidTransformOutputException("target",
          "NULL, data.frame or atomic vector", target.typeName()));
    };
  }

  @Override
  public boolean hasReadInputDataHook() {
    checkConfigured();
    return ValueCodec.firstLogical(
        handle.invoke(EntryPoints.HAS_READ_INPUT_DATA_HOOK, RArguments.none()));
  }

  @Override
  public Set<PayloadFormat> supportedPayloadFormats() {
    return SUPPORTED_FORMATS;
  }

  /// @return the current lifecycle state
  public State state() {
    return state;
  }

  /// @return the target type, once configured
  public TargetType targetType() {
    checkConfigured();
    return params.targetType();
  }

  /// @return the class labels sent with every structured prediction
  public ClassLabels classLabels() {
    return labels;
  }

  @Override
  public synchronized void close() {
    if (state != State.CLOSED) {
      state = State.CLOSED;
      handle.close();
      logger.info("closed R predictor");
    }
  }

  private void checkConfigured() {
    State current = state;
    if (current != State.CONFIGURED) {
      throw new IllegalStateException("R predictor is not usable, state is " + current);
    }
  }

  private static <E extends RuntimeException> E logged(E e) {
    logger.error(e.getMessage());
    return e;
  }

  private static String describe(RValue value) {
    if (value.kind() == RValue.Kind.LIST) {
      return "list of " + value.length() + " elements";
    }
    return value.typeName();
  }
}
