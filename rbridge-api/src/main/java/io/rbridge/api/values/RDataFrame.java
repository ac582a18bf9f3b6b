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

/// An R `data.frame`: a list of equal-length atomic vectors with column names.
public final class RDataFrame implements RValue {

  private final List<String> columnNames;
  private final List<RValue> columns;

  /// @param columnNames column names, in order
  /// @param columns atomic vectors of equal length
  public RDataFrame(List<String> columnNames, List<RValue> columns) {
    if (columnNames == null || columns == null) {
      throw new IllegalArgumentException("data frame names and columns cannot be null");
    }
    if (columnNames.size() != columns.size()) {
      throw new IllegalArgumentException(
          "data frame has " + columns.size() + " columns but " + columnNames.size() + " names");
    }
    int rows = -1;
    for (int i = 0; i < columns.size(); i++) {
      RValue column = columns.get(i);
      if (column == null || !column.isAtomicVector()) {
        throw new IllegalArgumentException("data frame column '" + columnNames.get(i)
            + "' is not an atomic vector: " + (column == null ? "null" : column.typeName()));
      }
      if (rows >= 0 && column.length() != rows) {
        throw new IllegalArgumentException("data frame column '" + columnNames.get(i)
            + "' has " + column.length() + " rows, expected " + rows);
      }
      rows = column.length();
    }
    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
  }

  public List<String> columnNames() {
    return columnNames;
  }

  public List<RValue> columns() {
    return columns;
  }

  public int columnCount() {
    return columns.size();
  }

  public int rowCount() {
    return columns.isEmpty() ? 0 : columns.get(0).length();
  }

  @Override
  public Kind kind() {
    return Kind.DATA_FRAME;
  }

  /// A data frame's length is its number of columns, as in R.
  @Override
  public int length() {
    return columns.size();
  }

  @Override
  public String typeName() {
    return "data.frame";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RDataFrame other && columnNames.equals(other.columnNames)
        && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columnNames, columns);
  }

  @Override
  public String toString() {
    return "RDataFrame" + columnNames + "[" + rowCount() + " rows]";
  }
}
