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

/// A handle to a value retained inside an R session under a global symbol.
///
/// The host never holds a copy of the referenced value. Sessions resolve the symbol when a
/// reference is passed back as a call argument.
/// @param symbol the global symbol the value is bound to
public record RReference(String symbol) implements RValue {

  public RReference {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("reference symbol cannot be blank");
    }
  }

  @Override
  public Kind kind() {
    return Kind.REFERENCE;
  }

  @Override
  public int length() {
    return 1;
  }

  @Override
  public String typeName() {
    return "reference";
  }
}
