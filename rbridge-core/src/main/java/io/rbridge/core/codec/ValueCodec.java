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

import io.rbridge.api.errors.UnexpectedResultTypeException;
import io.rbridge.api.errors.UnsupportedValueTypeException;
import io.rbridge.api.frame.Column;
import io.rbridge.api.frame.ColumnType;
import io.rbridge.api.frame.TabularFrame;
import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RDataFrame;
import io.rbridge.api.values.RInteger;
import io.rbridge.api.values.RList;
import io.rbridge.api.values.RLogical;
import io.rbridge.api.values.RNull;
import io.rbridge.api.values.RNumeric;
import io.rbridge.api.values.RRaw;
import io.rbridge.api.values.RValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts values between their host representation and their R representation.
///
/// Host to R:
/// - `null` becomes `NULL`
/// - `byte[]` becomes a raw vector, copied byte for byte
/// - `String` becomes a one-element character vector
/// - `Map<String, ?>` with null, `byte[]` or `String` values becomes a named list
///
/// R to host is the inverse for scalars and named lists, plus the conversion of data frames
/// and bare numeric vectors into [TabularFrame]s.
///
/// The codec knows nothing about prediction modes.
public final class ValueCodec {

  private ValueCodec() {
  }

  /// Convert a host scalar, byte payload or map into its R representation.
  /// @param value null, `byte[]`, `String` or `Map<String, ?>`
  /// @return the R value
  /// @throws UnsupportedValueTypeException for any other host type
  public static RValue toR(Object value) {
    if (value == null) {
      return RNull.INSTANCE;
    }
    if (value instanceof byte[] bytes) {
      return new RRaw(bytes);
    }
    if (value instanceof String text) {
      return RCharacter.of(text);
    }
    if (value instanceof Map<?, ?> map) {
      return toRList(map);
    }
    throw new UnsupportedValueTypeException(
        "Can not convert host value of type " + value.getClass().getName() + " to R");
  }

  /// Convert a map into a named R list. Each value is converted with the scalar rules; nested
  /// maps are not allowed.
  /// @param map string keys to null, `byte[]` or `String` values
  /// @return a named list in the map's iteration order
  /// @throws UnsupportedValueTypeException if a key is not a string or a value is not convertible
  public static RList toRList(Map<?, ?> map) {
    RList.Builder builder = RList.builder();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new UnsupportedValueTypeException(
            "R list names must be strings, got " + describe(entry.getKey()));
      }
      Object value = entry.getValue();
      if (value != null && !(value instanceof byte[]) && !(value instanceof String)) {
        throw new UnsupportedValueTypeException("Can not convert value of '" + key + "' of type "
            + value.getClass().getName() + " to R, expected null, byte[] or String");
      }
      builder.add(key, toR(value));
    }
    return builder.build();
  }

  /// Convert a frame into an R data frame, column by column.
  /// @param frame the frame
  /// @return the R data frame
  public static RDataFrame toR(TabularFrame frame) {
    List<RValue> columns = new ArrayList<>(frame.columnCount());
    for (Column column : frame.columns()) {
      columns.add(toRVector(column));
    }
    return new RDataFrame(frame.columnNames(), columns);
  }

  @SuppressWarnings("unchecked")
  private static RValue toRVector(Column column) {
    List<?> values = column.values();
    return switch (column.type()) {
      case NUMERIC -> new RNumeric((List<Double>) values);
      case INTEGER -> new RInteger((List<Integer>) values);
      case STRING -> new RCharacter((List<String>) values);
      case BOOLEAN -> new RLogical((List<Boolean>) values);
    };
  }

  /// Convert an R scalar, raw vector or `NULL` into its host representation.
  /// @param value the R value
  /// @return null, a `byte[]` copy, or the single string of a length-one character vector
  /// @throws UnsupportedValueTypeException for character vectors of any other length, and for
  ///     any other kind of value
  public static Object fromR(RValue value) {
    return switch (value.kind()) {
      case NULL -> null;
      case RAW -> ((RRaw) value).bytes();
      case CHARACTER -> scalarString((RCharacter) value);
      default -> throw new UnsupportedValueTypeException(
          "Can not convert R value of type " + value.typeName()
              + " to a host value, expected NULL, raw or character");
    };
  }

  private static String scalarString(RCharacter character) {
    if (character.length() != 1) {
      throw new UnsupportedValueTypeException("Can not convert R character vector of length "
          + character.length() + " to a string, expected exactly one element");
    }
    return character.get(0);
  }

  /// Convert a named R list into a map, converting each element with [#fromR(RValue)].
  /// @param value a list or `NULL`
  /// @return a map in list order, or null for `NULL`
  /// @throws UnsupportedValueTypeException if the value is not a list, or an element is not
  ///     convertible
  public static Map<String, Object> toMap(RValue value) {
    if (value.isNull()) {
      return null;
    }
    if (value.kind() != RValue.Kind.LIST) {
      throw new UnsupportedValueTypeException(
          "Can not convert R value of type " + value.typeName() + " to a map, expected list");
    }
    RList list = (RList) value;
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < list.size(); i++) {
      map.put(list.name(i), fromR(list.get(i)));
    }
    return map;
  }

  /// Convert an R data frame or bare vector into a frame. A bare numeric or integer vector
  /// carries one value per row and no column structure, so it becomes a single column named
  /// `vectorColumn`.
  /// @param value the R value
  /// @param vectorColumn the column name used for a bare vector
  /// @return the frame
  /// @throws UnexpectedResultTypeException if the value is neither a data frame nor a numeric
  ///     vector
  public static TabularFrame toFrame(RValue value, String vectorColumn) {
    return switch (value.kind()) {
      case DATA_FRAME -> fromRDataFrame((RDataFrame) value);
      case NUMERIC, INTEGER -> new TabularFrame(List.of(toColumn(vectorColumn, value)));
      default -> throw new UnexpectedResultTypeException(
          "data.frame or numeric vector", value.typeName());
    };
  }

  /// @param frame an R data frame
  /// @return the equivalent frame, with R's column order
  public static TabularFrame fromRDataFrame(RDataFrame frame) {
    List<Column> columns = new ArrayList<>(frame.columnCount());
    for (int i = 0; i < frame.columnCount(); i++) {
      columns.add(toColumn(frame.columnNames().get(i), frame.columns().get(i)));
    }
    return new TabularFrame(columns);
  }

  /// Convert an atomic R vector into a column, keeping `NA` as null.
  /// @param name the column name
  /// @param vector a character, numeric, integer or logical vector
  /// @return the column
  public static Column toColumn(String name, RValue vector) {
    return switch (vector.kind()) {
      case NUMERIC -> new Column(name, ColumnType.NUMERIC, new ArrayList<>(((RNumeric) vector).values()));
      case INTEGER -> new Column(name, ColumnType.INTEGER, new ArrayList<>(((RInteger) vector).values()));
      case CHARACTER -> new Column(name, ColumnType.STRING, new ArrayList<>(((RCharacter) vector).values()));
      case LOGICAL -> new Column(name, ColumnType.BOOLEAN, new ArrayList<>(((RLogical) vector).values()));
      default -> throw new UnsupportedValueTypeException(
          "Can not convert R value of type " + vector.typeName() + " to column '" + name + "'");
    };
  }

  /// Read the first element of an R logical vector, as R's `isTRUE(x[1])` would.
  /// @param value the R value
  /// @return true only if the first element is `TRUE`
  /// @throws UnexpectedResultTypeException if the value is not a logical vector
  public static boolean firstLogical(RValue value) {
    if (value.kind() != RValue.Kind.LOGICAL) {
      throw new UnexpectedResultTypeException("logical", value.typeName());
    }
    List<Boolean> values = ((RLogical) value).values();
    return !values.isEmpty() && Boolean.TRUE.equals(values.get(0));
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
