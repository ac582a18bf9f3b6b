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
import java.util.Objects;
import java.util.Optional;

/// An ordered sequence of named columns of equal length.
///
/// This is the host-side shape of structured predictions and transform outputs. Column order
/// is significant: it is preserved from R and is what sparse triplet detection looks at.
public final class TabularFrame implements FeatureData {

  private final List<Column> columns;
  private final int rowCount;

  /// Create a frame from columns of equal length. Names may repeat, as they can in an R data
  /// frame.
  /// @param columns the columns, in order
  /// @throws IllegalArgumentException if the columns differ in length
  public TabularFrame(List<Column> columns) {
    if (columns == null) {
      throw new IllegalArgumentException("frame columns cannot be null");
    }
    int rows = columns.isEmpty() ? 0 : columns.get(0).size();
    for (Column column : columns) {
      if (column.size() != rows) {
        throw new IllegalArgumentException("column '" + column.name() + "' has " + column.size()
            + " rows, but column '" + columns.get(0).name() + "' has " + rows);
      }
    }
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rowCount = rows;
  }

  /// @param columns the columns, in order
  /// @return a frame of those columns
  public static TabularFrame of(Column... columns) {
    return new TabularFrame(List.of(columns));
  }

  public List<Column> columns() {
    return columns;
  }

  public Column column(int index) {
    return columns.get(index);
  }

  /// @param name a column name
  /// @return the first column with that name
  public Optional<Column> column(String name) {
    return columns.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  /// @return column names, in frame order
  public List<String> columnNames() {
    List<String> names = new ArrayList<>(columns.size());
    for (Column column : columns) {
      names.add(column.name());
    }
    return names;
  }

  /// @param row the row index
  /// @param column the column index
  /// @return the cell value, or null for a missing value
  public Object value(int row, int column) {
    return columns.get(column).get(row);
  }

  @Override
  public int rowCount() {
    return rowCount;
  }

  @Override
  public int columnCount() {
    return columns.size();
  }

  @Override
  public boolean isSparse() {
    return false;
  }

  /// @return a frame without its final row
  /// @throws IllegalStateException if the frame has no rows
  public TabularFrame dropLastRow() {
    if (rowCount == 0) {
      throw new IllegalStateException("cannot drop the last row of an empty frame");
    }
    List<Column> trimmed = new ArrayList<>(columns.size());
    for (Column column : columns) {
      trimmed.add(column.head(rowCount - 1));
    }
    return new TabularFrame(trimmed);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TabularFrame other && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns);
  }

  @Override
  public String toString() {
    return "TabularFrame" + columnNames() + "[" + rowCount + " rows]";
  }
}
