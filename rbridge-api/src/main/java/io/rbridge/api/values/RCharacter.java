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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// An R character vector. `null` elements are `NA_character_`.
/// @param values the elements, in order
public record RCharacter(List<String> values) implements RValue {

  public RCharacter {
    if (values == null) {
      throw new IllegalArgumentException("character vector values cannot be null");
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /// @param values the elements
  /// @return a character vector holding exactly these elements
  public static RCharacter of(String... values) {
    return new RCharacter(Arrays.asList(values));
  }

  /// @param index element index, 0-based
  /// @return the element, or null for `NA`
  public String get(int index) {
    return values.get(index);
  }

  @Override
  public Kind kind() {
    return Kind.CHARACTER;
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public String typeName() {
    return "character";
  }
}
