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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/// A coordinate-format sparse matrix of doubles with a fixed shape.
///
/// Entries at the same coordinate are summed, and entries which sum to zero are not stored,
/// so [#nonZeroCount()] counts stored values only. Indices are 0-based.
public final class SparseMatrix implements FeatureData {

  private final int rows;
  private final int columns;
  private final TreeMap<Long, Double> entries;

  private SparseMatrix(int rows, int columns, TreeMap<Long, Double> entries) {
    this.rows = rows;
    this.columns = columns;
    this.entries = entries;
  }

  /// Build a matrix from parallel coordinate arrays.
  /// @param rows the number of rows
  /// @param columns the number of columns
  /// @param rowIndices 0-based row index of each entry
  /// @param columnIndices 0-based column index of each entry
  /// @param values the value of each entry
  /// @return the matrix
  /// @throws IllegalArgumentException if the arrays differ in length or an index is out of range
  public static SparseMatrix fromCoordinates(
      int rows, int columns, int[] rowIndices, int[] columnIndices, double[] values)
  {
    if (rows < 0 || columns < 0) {
      throw new IllegalArgumentException("invalid sparse shape (" + rows + ", " + columns + ")");
    }
    if (rowIndices.length != columnIndices.length || rowIndices.length != values.length) {
      throw new IllegalArgumentException("coordinate arrays differ in length: rows="
          + rowIndices.length + ", cols=" + columnIndices.length + ", values=" + values.length);
    }
    TreeMap<Long, Double> entries = new TreeMap<>();
    for (int i = 0; i < values.length; i++) {
      int r = rowIndices[i];
      int c = columnIndices[i];
      if (r < 0 || r >= rows || c < 0 || c >= columns) {
        throw new IllegalArgumentException("entry " + i + " at (" + r + ", " + c
            + ") is outside the shape (" + rows + ", " + columns + ")");
      }
      entries.merge(key(r, c, columns), values[i], Double::sum);
    }
    entries.values().removeIf(v -> v == 0.0d);
    return new SparseMatrix(rows, columns, entries);
  }

  private static long key(int row, int column, int columns) {
    return (long) row * columns + column;
  }

  /// @param row 0-based row index
  /// @param column 0-based column index
  /// @return the stored value, or 0.0 if none is stored
  public double get(int row, int column) {
    if (row < 0 || row >= rows || column < 0 || column >= columns) {
      throw new IndexOutOfBoundsException(
          "(" + row + ", " + column + ") outside shape (" + rows + ", " + columns + ")");
    }
    return entries.getOrDefault(key(row, column, columns), 0.0d);
  }

  /// @return the number of stored, non-zero values
  public int nonZeroCount() {
    return entries.size();
  }

  /// Stored values keyed by row-major linear index, `row * columnCount() + column`.
  /// @return an unmodifiable view of the stored values
  public Map<Long, Double> entries() {
    return Collections.unmodifiableMap(entries);
  }

  /// @return the row-major dense form of this matrix
  public double[][] toDense() {
    double[][] dense = new double[rows][columns];
    entries.forEach((k, v) -> dense[(int) (k / columns)][(int) (k % columns)] = v);
    return dense;
  }

  @Override
  public int rowCount() {
    return rows;
  }

  @Override
  public int columnCount() {
    return columns;
  }

  @Override
  public boolean isSparse() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SparseMatrix other && rows == other.rows && columns == other.columns
        && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rows + columns) + entries.hashCode();
  }

  @Override
  public String toString() {
    return "SparseMatrix[" + rows + "x" + columns + ", nnz=" + entries.size() + "]";
  }
}
