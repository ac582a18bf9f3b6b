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
import io.rbridge.api.frame.TabularFrame;

import java.util.Map;
import java.util.Set;

/// A predictor whose model runs inside a foreign language runtime.
///
/// A predictor is configured once, then serves any number of calls, then is closed. Calls
/// block until the runtime answers.
public interface LanguagePredictor extends AutoCloseable {

  /// Start the runtime, check that the hooks the target type needs are bound, and load the
  /// model.
  /// @param params the predictor parameters
  void configure(PredictorParams params);

  /// Score a structured payload.
  /// @param binaryData the encoded input rows
  /// @param mimeType the payload MIME type, or null to let the runtime decide
  /// @return one row of predictions per input row
  TabularFrame predictStructured(byte[] binaryData, String mimeType);

  /// Score an arbitrary payload.
  /// @param data the payload, `byte[]` or `String`
  /// @param query request query parameters
  /// @param extraParams extra keyword arguments, null values are not sent
  /// @return the payload and metadata the model returned
  UnstructuredResult predictUnstructured(Object data, Map<String, String> query,
      Map<String, ?> extraParams);

  /// Run the model's transform.
  /// @param binaryData the encoded input rows
  /// @param targetBinaryData the encoded target, or null
  /// @param mimeType the payload MIME type, or null
  /// @return transformed features and target
  TransformResult transform(byte[] binaryData, byte[] targetBinaryData, String mimeType);

  /// @return true if the model author supplied their own input reader
  boolean hasReadInputDataHook();

  /// @return the payload formats this predictor can read
  Set<PayloadFormat> supportedPayloadFormats();

  @Override
  void close();
}
