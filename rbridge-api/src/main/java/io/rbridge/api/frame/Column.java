package io.rbridge.api.frame;

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

/// A named, homogeneous sequence of nullable scalars.
/// @param name the column name
/// @param type the scalar type of every non-null cell
/// @param values the cells, in row order
public record Column(String name, ColumnType type, List<Object> values) {

  public Column {
    if (name == null) {
      throw new IllegalArgumentException("column name cannot be null");
    }
    if (type == null) {
      throw new IllegalArgumentException("column type cannot be null for column '" + name + "'");
    }
    if (values == null) {
      throw new IllegalArgumentException("column values cannot be null for column '" + name + "'");
    }
    for (int i = 0; i < values.size(); i++) {
      if (!type.accepts(values.get(i))) {
        throw new IllegalArgumentException("column '" + name + "' of type " + type
            + " cannot hold " + values.get(i).getClass().getSimpleName() + " at row " + i);
      }
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /// @param name the column name
  /// @param values numeric cells
  /// @return a numeric column
  public static Column numeric(String name, List<Double> values) {
    return new Column(name, ColumnType.NUMERIC, new ArrayList<>(values));
  }

  /// @param name the column name
  /// @param values string cells
  /// @return a string column
  public static Column strings(String name, List<String> values) {
    return new Column(name, ColumnType.STRING, new ArrayList<>(values));
  }

  public int size() {
    return values.size();
  }

  public Object get(int row) {
    return values.get(row);
  }

  /// @param rows the number of leading rows to keep
  /// @return a column holding only the first `rows` cells
  public Column head(int rows) {
    return new Column(name, type, values.subList(0, rows));
  }
}
