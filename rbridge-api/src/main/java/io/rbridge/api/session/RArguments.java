package io.rbridge.api.session;

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

import io.rbridge.api.values.RValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// An ordered argument list for an R function call, mixing positional and named arguments
/// the way R's `do.call` accepts them.
public final class RArguments {

  private static final RArguments NONE = new RArguments(List.of());

  private final List<Argument> arguments;

  private RArguments(List<Argument> arguments) {
    this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
  }

  /// @return an empty argument list
  public static RArguments none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Argument> arguments() {
    return arguments;
  }

  public int size() {
    return arguments.size();
  }

  /// @param name an argument name
  /// @return the value of the first argument with that name, or null if there is none
  public RValue named(String name) {
    for (Argument argument : arguments) {
      if (name.equals(argument.name())) {
        return argument.value();
      }
    }
    return null;
  }

  /// @param index index among the positional arguments only
  /// @return the positional argument value
  public RValue positional(int index) {
    int seen = 0;
    for (Argument argument : arguments) {
      if (!argument.isNamed()) {
        if (seen == index) {
          return argument.value();
        }
        seen++;
      }
    }
    throw new IndexOutOfBoundsException("no positional argument " + index + " in " + this);
  }

  /// @param name an argument name
  /// @return true if an argument with that name is present
  public boolean has(String name) {
    return named(name) != null;
  }

  @Override
  public String toString() {
    return "RArguments" + arguments;
  }

  /// One call argument. Positional arguments have an empty name.
  /// @param name the argument name, empty for positional arguments
  /// @param value the argument value
  public record Argument(String name, RValue value) {
    public Argument {
      Objects.requireNonNull(name, "argument name");
      Objects.requireNonNull(value, "argument value for '" + name + "', use RNull for NULL");
    }

    public boolean isNamed() {
      return !name.isEmpty();
    }
  }

  public static final class Builder {
    private final List<Argument> arguments = new ArrayList<>();

    private Builder() {
    }

    public Builder positional(RValue value) {
      arguments.add(new Argument("", value));
      return this;
    }

    public Builder named(String name, RValue value) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("named arguments need a non-empty name");
      }
      arguments.add(new Argument(name, value));
      return this;
    }

    public RArguments build() {
      return new RArguments(arguments);
    }
  }
}
