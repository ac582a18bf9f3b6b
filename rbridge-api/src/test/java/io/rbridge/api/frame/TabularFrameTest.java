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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabularFrameTest {

  private static TabularFrame sample() {
    return TabularFrame.of(
        Column.numeric("x", List.of(1.0, 2.0, 3.0)),
        Column.strings("label", List.of("a", "b", "c")));
  }

  @Test
  void reportsShapeAndValues() {
    TabularFrame frame = sample();
    assertThat(frame.rowCount()).isEqualTo(3);
    assertThat(frame.columnCount()).isEqualTo(2);
    assertThat(frame.columnNames()).containsExactly("x", "label");
    assertThat(frame.value(1, 0)).isEqualTo(2.0);
    assertThat(frame.value(2, 1)).isEqualTo("c");
    assertThat(frame.isSparse()).isFalse();
    assertThat(frame.column("label")).isPresent();
    assertThat(frame.column("missing")).isEmpty();
  }

  @Test
  void rejectsColumnsOfDifferentLengths() {
    assertThatThrownBy(() -> TabularFrame.of(
        Column.numeric("x", List.of(1.0, 2.0)),
        Column.numeric("y", List.of(1.0))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'y'");
  }

  @Test
  void repeatedColumnNamesAreKeptInOrder() {
    TabularFrame frame = TabularFrame.of(
        Column.numeric("x", List.of(1.0)),
        Column.numeric("x", List.of(2.0)));
    assertThat(frame.columnNames()).containsExactly("x", "x");
    assertThat(frame.value(0, 1)).isEqualTo(2.0);
    assertThat(frame.column("x")).hasValueSatisfying(c -> assertThat(c.get(0)).isEqualTo(1.0));
  }

  @Test
  void dropLastRowKeepsColumnStructure() {
    TabularFrame trimmed = sample().dropLastRow();
    assertThat(trimmed.rowCount()).isEqualTo(2);
    assertThat(trimmed.columnNames()).containsExactly("x", "label");
    assertThat(trimmed.column(0).values()).containsExactly(1.0, 2.0);
  }

  @Test
  void dropLastRowOfEmptyFrameFails() {
    TabularFrame empty = TabularFrame.of(Column.numeric("x", List.of()));
    assertThatThrownBy(empty::dropLastRow).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void columnsRejectValuesOfTheWrongType() {
    assertThatThrownBy(() -> new Column("x", ColumnType.NUMERIC, List.of("not a number")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("NUMERIC");
  }

  @Test
  void columnsKeepMissingValues() {
    Column column = new Column("x", ColumnType.INTEGER, Arrays.asList(1, null, 3));
    assertThat(column.get(1)).isNull();
    assertThat(column.get(2)).isEqualTo(3);
    assertThat(column.head(2).values()).containsExactly(1, null);
  }

  @Test
  void framesWithEqualColumnsAreEqual() {
    assertThat(sample()).isEqualTo(sample());
    assertThat(sample().hashCode()).isEqualTo(sample().hashCode());
  }
}
