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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCodecTest {

  @Test
  void nullBecomesRNull() {
    assertThat(ValueCodec.toR((Object) null)).isSameAs(RNull.INSTANCE);
    assertThat(ValueCodec.fromR(RNull.INSTANCE)).isNull();
  }

  @Test
  void bytesSurviveTheRoundTripUnchanged() {
    byte[] payload = new byte[256];
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) i;
    }
    RValue raw = ValueCodec.toR(payload);
    assertThat(raw.kind()).isEqualTo(RValue.Kind.RAW);
    assertThat(raw.length()).isEqualTo(256);
    assertThat((byte[]) ValueCodec.fromR(raw)).isEqualTo(payload);
  }

  @Test
  void emptyBytesStayEmpty() {
    assertThat((byte[]) ValueCodec.fromR(ValueCodec.toR(new byte[0]))).isEmpty();
  }

  @Test
  void stringsBecomeOneElementCharacterVectors() {
    RValue text = ValueCodec.toR("héllo");
    assertThat(text).isEqualTo(RCharacter.of("héllo"));
    assertThat(ValueCodec.fromR(text)).isEqualTo("héllo");
  }

  @Test
  void characterVectorsOfOtherLengthsAreNotScalars() {
    assertThatThrownBy(() -> ValueCodec.fromR(RCharacter.of("a", "b")))
        .isInstanceOf(UnsupportedValueTypeException.class)
        .hasMessageContaining("length 2");
    assertThatThrownBy(() -> ValueCodec.fromR(RCharacter.of()))
        .isInstanceOf(UnsupportedValueTypeException.class);
  }

  @Test
  void mapsSurviveTheRoundTripInOrder() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("content_type", "text/plain");
    map.put("payload", new byte[] {7, 8});
    map.put("missing", null);

    RValue list = ValueCodec.toR(map);
    assertThat(list.kind()).isEqualTo(RValue.Kind.LIST);
    assertThat(((RList) list).names()).containsExactly("content_type", "payload", "missing");

    Map<String, Object> back = ValueCodec.toMap(list);
    assertThat(back).containsOnlyKeys("content_type", "payload", "missing");
    assertThat(back.get("content_type")).isEqualTo("text/plain");
    assertThat((byte[]) back.get("payload")).containsExactly(7, 8);
    assertThat(back.get("missing")).isNull();
  }

  @Test
  void emptyMapBecomesEmptyList() {
    RValue list = ValueCodec.toR(Map.of());
    assertThat(list.length()).isZero();
    assertThat(ValueCodec.toMap(list)).isEmpty();
    assertThat(ValueCodec.toMap(RNull.INSTANCE)).isNull();
  }

  @Test
  void unsupportedHostValuesAreRejected() {
    assertThatThrownBy(() -> ValueCodec.toR(42))
        .isInstanceOf(UnsupportedValueTypeException.class)
        .hasMessageContaining("java.lang.Integer");
    assertThatThrownBy(() -> ValueCodec.toR(Map.of("nested", Map.of())))
        .isInstanceOf(UnsupportedValueTypeException.class)
        .hasMessageContaining("'nested'");
    assertThatThrownBy(() -> ValueCodec.toR(Map.of(1, "x")))
        .isInstanceOf(UnsupportedValueTypeException.class);
  }

  @Test
  void unsupportedRValuesAreRejected() {
    assertThatThrownBy(() -> ValueCodec.fromR(RNumeric.of(1.0)))
        .isInstanceOf(UnsupportedValueTypeException.class)
        .hasMessageContaining("numeric");
    assertThatThrownBy(() -> ValueCodec.toMap(RCharacter.of("x")))
        .isInstanceOf(UnsupportedValueTypeException.class);
  }

  @Test
  void dataFramesBecomeFramesWithTypedColumns() {
    RDataFrame frame = new RDataFrame(List.of("score", "count", "label", "flag"), List.of(
        new RNumeric(Arrays.asList(0.25, null)),
        RInteger.of(3, 4),
        RCharacter.of("yes", "no"),
        RLogical.of(true, false)));

    TabularFrame converted = ValueCodec.toFrame(frame, "unused");
    assertThat(converted.columnNames()).containsExactly("score", "count", "label", "flag");
    assertThat(converted.column(0).type()).isEqualTo(ColumnType.NUMERIC);
    assertThat(converted.value(1, 0)).isNull();
    assertThat(converted.column(1).type()).isEqualTo(ColumnType.INTEGER);
    assertThat(converted.value(1, 2)).isEqualTo("no");
    assertThat(converted.value(0, 3)).isEqualTo(true);
  }

  @Test
  void bareNumericVectorBecomesNamedColumn() {
    TabularFrame frame = ValueCodec.toFrame(RNumeric.of(1.0, 2.0, 3.0), "Predictions");
    assertThat(frame.columnNames()).containsExactly("Predictions");
    assertThat(frame.column(0).values()).containsExactly(1.0, 2.0, 3.0);
  }

  @Test
  void otherValuesAreNotFrames() {
    assertThatThrownBy(() -> ValueCodec.toFrame(RList.unnamed(), "x"))
        .isInstanceOf(UnexpectedResultTypeException.class)
        .hasMessageContaining("list");
  }

  @Test
  void framesConvertToRDataFrames() {
    TabularFrame frame = TabularFrame.of(
        Column.numeric("x", List.of(1.0, 2.0)),
        Column.strings("y", List.of("a", "b")));
    RDataFrame r = ValueCodec.toR(frame);
    assertThat(r.columnNames()).containsExactly("x", "y");
    assertThat(r.columns().get(0)).isEqualTo(RNumeric.of(1.0, 2.0));
    assertThat(ValueCodec.fromRDataFrame(r)).isEqualTo(frame);
  }

  @Test
  void firstLogicalFollowsIsTrue() {
    assertThat(ValueCodec.firstLogical(RLogical.of(true, false))).isTrue();
    assertThat(ValueCodec.firstLogical(RLogical.of(false))).isFalse();
    assertThat(ValueCodec.firstLogical(new RLogical(Arrays.asList((Boolean) null)))).isFalse();
    assertThat(ValueCodec.firstLogical(RLogical.of())).isFalse();
    assertThatThrownBy(() -> ValueCodec.firstLogical(RNull.INSTANCE))
        .isInstanceOf(UnexpectedResultTypeException.class);
  }

  @Test
  void rawValuesAreNotCharacterVectors() {
    assertThat(ValueCodec.toR(new byte[] {1})).isInstanceOf(RRaw.class);
  }
}
