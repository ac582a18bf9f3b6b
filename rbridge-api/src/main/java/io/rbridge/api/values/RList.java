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
import java.util.Objects;

/// An R generic vector (`list`), optionally named.
///
/// Names are kept positionally; an unnamed element has the empty name, which is what R
/// reports for it. A list is "named" when at least one element carries a non-empty name.
public final class RList implements RValue {

  private final List<String> names;
  private final List<RValue> values;

  /// Create a list from parallel name and value lists.
  /// @param names element names, empty strings for unnamed elements
  /// @param values element values
  public RList(List<String> names, List<RValue> values) {
    if (names == null || values == null) {
      throw new IllegalArgumentException("list names and values cannot be null");
    }
    if (names.size() != values.size()) {
      throw new IllegalArgumentException(
          "list has " + values.size() + " values but " + names.size() + " names");
    }
    List<String> normalized = new ArrayList<>(names.size());
    for (String name : names) {
      normalized.add(name == null ? "" : name);
    }
    for (RValue value : values) {
      Objects.requireNonNull(value, "list elements must be RValues, use RNull for NULL");
    }
    this.names = Collections.unmodifiableList(normalized);
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /// @param values element values
  /// @return an unnamed list
  public static RList unnamed(RValue... values) {
    List<String> names = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      names.add("");
    }
    return new RList(names, List.of(values));
  }

  /// @return a builder for named lists
  public static Builder builder() {
    return new Builder();
  }

  public RValue get(int index) {
    return values.get(index);
  }

  public String name(int index) {
    return names.get(index);
  }

  public List<String> names() {
    return names;
  }

  public List<RValue> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  /// @return true if any element has a non-empty name
  public boolean isNamed() {
    return names.stream().anyMatch(n -> !n.isEmpty());
  }

  @Override
  public Kind kind() {
    return Kind.LIST;
  }

  @Override
  public int length() {
    return values.size();
  }

  @Override
  public String typeName() {
    return "list";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RList other && names.equals(other.names) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(names, values);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RList[");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      if (!names.get(i).isEmpty()) {
        sb.append(names.get(i)).append('=');
      }
      sb.append(values.get(i));
    }
    return sb.append(']').toString();
  }

  /// Accumulates named elements in insertion order.
  public static final class Builder {
    private final List<String> names = new ArrayList<>();
    private final List<RValue> values = new ArrayList<>();

    private Builder() {
    }

    public Builder add(String name, RValue value) {
      names.add(name);
      values.add(value);
      return this;
    }

    public RList build() {
      return new RList(names, values);
    }
  }
}
