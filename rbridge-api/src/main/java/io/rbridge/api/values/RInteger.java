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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// An R integer vector. `null` elements are `NA_integer_`.
/// @param values the elements, in order
public record RInteger(List<Integer> values) implements RValue {

  public RInteger {
    if (values == null) {
      throw new IllegalArgumentException("integer vector values cannot be null");
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /// @param values the elements
  /// @return an integer vector without missing values
  public static RInteger of(int... values) {
    List<Integer> boxed = new ArrayList<>(values.length);
    for (int value : values) {
      boxed.add(value);
    }
    return new RInteger(boxed);
  }

  @Override
  public Kind kind() {
    return Kind.INTEGER;
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public String typeName() {
    return "integer";
  }
}
