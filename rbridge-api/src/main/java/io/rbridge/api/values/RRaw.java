package io.rbridge.api.values;

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

import java.util.Arrays;

/// An R raw vector. The bytes are copied on the way in and on the way out, so neither side
/// can mutate the other's buffer.
public final class RRaw implements RValue {

  private final byte[] bytes;

  /// Create a raw vector from a copy of the given bytes.
  /// @param bytes the payload, not null
  public RRaw(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("raw vector bytes cannot be null");
    }
    this.bytes = bytes.clone();
  }

  /// @return a copy of the payload
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public Kind kind() {
    return Kind.RAW;
  }

  @Override
  public int length() {
    return bytes.length;
  }

  @Override
  public String typeName() {
    return "raw";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RRaw other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "RRaw[" + bytes.length + " bytes]";
  }
}
