package io.rbridge.core.codec;

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

import io.rbridge.api.errors.InvalidTransformOutputException;
import io.rbridge.api.frame.Column;
import io.rbridge.api.frame.SparseMatrix;
import io.rbridge.api.frame.TabularFrame;

import java.util.List;

/// Decodes the compact wire format R transforms use for large sparse outputs.
///
/// A triplet frame has exactly the columns `__DR__i`, `__DR__j`, `__DR__x`, in that order.
/// Every row but the last is one entry with 1-based row and column indices. The last row
/// carries the shape as `(rows, columns, unused)`.
public final class SparseTriplets {

  public static final String ROW_COLUMN = "__DR__i";
  public static final String COL_COLUMN = "__DR__j";
  public static final String VALUE_COLUMN = "__DR__x";

  /// The column names, in order, which mark a frame as triplet encoded.
  public static final List<String> MARKER_COLUMNS = List.of(ROW_COLUMN, COL_COLUMN, VALUE_COLUMN);

  private SparseTriplets() {
  }

  /// @param frame a frame
  /// @return true if the frame's column names are exactly the marker columns
  public static boolean isTripletFrame(TabularFrame frame) {
    return frame.columnNames().equals(MARKER_COLUMNS);
  }

  /// Rebuild the sparse matrix a triplet frame encodes.
  /// @param frame a triplet frame
  /// @return the sparse matrix, with 0-based indices
  /// @throws IllegalArgumentException if the frame is not a triplet frame
  /// @throws InvalidTransformOutputException if the frame lacks the shape row, holds a missing
  ///     or non-integer index, a missing value, or an index outside the encoded shape
  public static SparseMatrix decode(TabularFrame frame) {
    if (!isTripletFrame(frame)) {
      throw new IllegalArgumentException(
          "not a sparse triplet frame, columns are " + frame.columnNames());
    }
    if (frame.rowCount() == 0) {
      throw malformed("sparse triplets with a trailing shape row", "no rows");
    }
    int last = frame.rowCount() - 1;
    int rows = toIndex(frame.column(0), last);
    int columns = toIndex(frame.column(1), last);

    TabularFrame data = frame.dropLastRow();
    Column i = data.column(0);
    Column j = data.column(1);
    Column x = data.column(2);
    int entries = data.rowCount();
    int[] rowIndices = new int[entries];
    int[] columnIndices = new int[entries];
    double[] values = new double[entries];
    for (int n = 0; n < entries; n++) {
      int row = toIndex(i, n);
      int column = toIndex(j, n);
      if (row < 1 || row > rows || column < 1 || column > columns) {
        throw malformed("1-based indices within shape (" + rows + ", " + columns + ")",
            "(" + row + ", " + column + ") at row " + (n + 1));
      }
      rowIndices[n] = row - 1;
      columnIndices[n] = column - 1;
      values[n] = toValue(x, n);
    }
    return SparseMatrix.fromCoordinates(rows, columns, rowIndices, columnIndices, values);
  }

  private static int toIndex(Column column, int row) {
    Object cell = column.get(row);
    if (!(cell instanceof Number number)) {
      throw malformed("integer " + column.name(), describe(cell) + " at row " + (row + 1));
    }
    double value = number.doubleValue();
    if (value != Math.rint(value) || value < 0 || value > Integer.MAX_VALUE) {
      throw malformed("integer " + column.name(), value + " at row " + (row + 1));
    }
    return (int) value;
  }

  private static double toValue(Column column, int row) {
    Object cell = column.get(row);
    if (!(cell instanceof Number number)) {
      throw malformed("numeric " + column.name(), describe(cell) + " at row " + (row + 1));
    }
    return number.doubleValue();
  }

  private static String describe(Object cell) {
    return cell == null ? "NA" : "'" + cell + "'";
  }

  private static InvalidTransformOutputException malformed(String expected, String actual) {
    return new InvalidTransformOutputException("features", expected, actual);
  }
}
