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

/// A value living in, or destined for, an R session.
///
/// Every value carries a [Kind] which is decided once, when the value is read from the
/// session. Consumers switch over the kind instead of probing the value repeatedly.
///
/// Vector variants hold nullable elements, where `null` stands for R's `NA`.
public sealed interface RValue
    permits RNull, RRaw, RCharacter, RNumeric, RInteger, RLogical, RList, RDataFrame, RReference,
    RUnsupported
{

  /// The declared kinds of R values which the bridge understands.
  enum Kind {
    NULL,
    RAW,
    CHARACTER,
    NUMERIC,
    INTEGER,
    LOGICAL,
    LIST,
    DATA_FRAME,
    REFERENCE,
    UNSUPPORTED
  }

  /// @return the declared kind of this value
  Kind kind();

  /// @return the number of elements, as R's `length()` would report it
  int length();

  /// The R-side type name, used in diagnostics.
  /// @return a type name such as `raw`, `character` or `data.frame`
  String typeName();

  /// @return true if this value is R's `NULL`
  default boolean isNull() {
    return kind() == Kind.NULL;
  }

  /// @return true for the atomic vector kinds which can form a data frame column
  default boolean isAtomicVector() {
    return switch (kind()) {
      case CHARACTER, NUMERIC, INTEGER, LOGICAL -> true;
      default -> false;
    };
  }
}
