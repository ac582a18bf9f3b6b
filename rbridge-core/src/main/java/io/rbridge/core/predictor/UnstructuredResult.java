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

import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// The outcome of an unstructured prediction: a payload which is bytes, text or absent, and
/// optional metadata the model attached to it.
public final class UnstructuredResult {

  private final Object payload;
  private final Map<String, Object> metadata;

  /// @param payload null, `byte[]` or `String`
  /// @param metadata the metadata map, or null if the model returned none
  public UnstructuredResult(Object payload, Map<String, Object> metadata) {
    if (payload != null && !(payload instanceof byte[]) && !(payload instanceof String)) {
      throw new IllegalArgumentException(
          "unstructured payload must be byte[], String or null, got " + payload.getClass().getName());
    }
    this.payload = payload instanceof byte[] bytes ? bytes.clone() : payload;
    this.metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /// @return the raw payload: null, `byte[]` or `String`
  public Object payload() {
    return payload instanceof byte[] bytes ? bytes.clone() : payload;
  }

  public boolean isEmpty() {
    return payload == null;
  }

  public boolean isBinary() {
    return payload instanceof byte[];
  }

  public boolean isText() {
    return payload instanceof String;
  }

  /// @return the payload bytes, if the model returned raw bytes
  public Optional<byte[]> bytes() {
    return payload instanceof byte[] bytes ? Optional.of(bytes.clone()) : Optional.empty();
  }

  /// @return the payload text, if the model returned a string
  public Optional<String> text() {
    return payload instanceof String text ? Optional.of(text) : Optional.empty();
  }

  /// @param charset the charset to encode text payloads with
  /// @return the payload as bytes, text encoded with the given charset, or empty
  public Optional<byte[]> toBytes(Charset charset) {
    if (payload instanceof String text) {
      return Optional.of(text.getBytes(charset));
    }
    return bytes();
  }

  /// @return the metadata map, if the model returned one
  public Optional<Map<String, Object>> metadata() {
    return Optional.ofNullable(metadata);
  }

  @Override
  public String toString() {
    String kind = isEmpty() ? "none" : isBinary() ? ((byte[]) payload).length + " bytes" : "text";
    return "UnstructuredResult[payload=" + kind + ", metadata=" + metadata + "]";
  }
}
