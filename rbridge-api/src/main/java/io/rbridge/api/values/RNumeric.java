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

/// An R double vector. `null` elements are `NA_real_`; `NaN` stays `NaN`.
/// @param values the elements, in order
public record RNumeric(List<Double> values) implements RValue {

  public RNumeric {
    if (values == null) {
      throw new IllegalArgumentException("numeric vector values cannot be null");
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /// @param values the elements
  /// @return a numeric vector without missing values
  public static RNumeric of(double... values) {
    List<Double> boxed = new ArrayList<>(values.length);
    for (double value : values) {
      boxed.add(value);
    }
    return new RNumeric(boxed);
  }

  @Override
  public Kind kind() {
    return Kind.NUMERIC;
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public String typeName() {
    return "numeric";
  }
}
