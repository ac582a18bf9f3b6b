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

/// The scalar type held by a [Column]. Every type admits `null` for missing values.
public enum ColumnType {
  /// [Double] values
  NUMERIC(Double.class),
  /// [Integer] values
  INTEGER(Integer.class),
  /// [String] values
  STRING(String.class),
  /// [Boolean] values
  BOOLEAN(Boolean.class);

  private final Class<?> javaType;

  ColumnType(Class<?> javaType) {
    this.javaType = javaType;
  }

  /// @return the Java class of non-null cells of this type
  public Class<?> javaType() {
    return javaType;
  }

  /// @param value a cell value
  /// @return true if the value is null or of this column type
  public boolean accepts(Object value) {
    return value == null || javaType.isInstance(value);
  }
}
