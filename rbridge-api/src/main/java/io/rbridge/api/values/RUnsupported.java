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

/// An R value of a type the bridge does not represent (closures, environments, S4 objects...).
/// Only the type name survives, for diagnostics.
/// @param typeName the R type or class name
public record RUnsupported(String typeName) implements RValue {

  @Override
  public Kind kind() {
    return Kind.UNSUPPORTED;
  }

  @Override
  public int length() {
    return 1;
  }
}
