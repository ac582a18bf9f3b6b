package io.rbridge.core.runtime;

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

import io.rbridge.api.errors.ForeignExecutionException;
import io.rbridge.api.session.RArguments;
import io.rbridge.api.session.RFaultException;
import io.rbridge.api.values.RNumeric;
import io.rbridge.api.values.RValue;
import io.rbridge.core.FakeRSession;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FaultCaptureTest {

  @Test
  void armsOnOpenAndDisarmsOnClose() {
    FakeRSession session = new FakeRSession().define("f", args -> RNumeric.of(1.0));
    RValue result;
    try (FaultCapture capture = FaultCapture.arm(session, "f")) {
      assertThat(session.isArmed()).isTrue();
      result = capture.run(() -> session.call("f", RArguments.none()));
    }
    assertThat(result).isEqualTo(RNumeric.of(1.0));
    assertThat(session.isArmed()).isFalse();
    assertThat(session.disarmCount()).isEqualTo(1);
  }

  @Test
  void faultBecomesForeignExecutionWithTraceback() {
    FakeRSession session = new FakeRSession()
        .defineFailing("score", "object 'x' not found", "Error: object 'x' not found\n1: score()");

    ForeignExecutionException e;
    try (FaultCapture capture = FaultCapture.arm(session, "outer_predict")) {
      e = assertThrows(ForeignExecutionException.class,
          () -> capture.run(() -> session.call("score", RArguments.none())));
    }
    assertThat(e.getOperation()).isEqualTo("outer_predict");
    assertThat(e.getDiagnostic()).isEqualTo("Error: object 'x' not found\n1: score()");
    assertThat(e.getMessage()).contains("Error: object 'x' not found\n1: score()");
    assertThat(session.isArmed()).isFalse();
  }

  @Test
  void faultWithoutTracebackCarriesTheConditionMessage() {
    FakeRSession session = new FakeRSession().defineFailing("f", "boom", null);
    try (FaultCapture capture = FaultCapture.arm(session, "f")) {
      assertThatThrownBy(() -> capture.execute(() -> session.call("f", RArguments.none())))
          .isInstanceOf(ForeignExecutionException.class)
          .hasMessage("R error during 'f': boom");
    }
  }

  @Test
  void nonFaultExceptionsPassThrough() {
    FakeRSession session = new FakeRSession();
    try (FaultCapture capture = FaultCapture.arm(session, "f")) {
      assertThatThrownBy(() -> capture.run(() -> {
        throw new IllegalArgumentException("host bug");
      })).isInstanceOf(IllegalArgumentException.class);
    }
    assertThat(session.isArmed()).isFalse();
  }

  @Test
  void closeIsIdempotentAndClosedScopesRejectCalls() {
    FakeRSession session = new FakeRSession();
    FaultCapture capture = FaultCapture.arm(session, "f");
    capture.close();
    capture.close();
    assertThat(session.disarmCount()).isEqualTo(1);
    assertThatThrownBy(() -> capture.run(() -> null)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void sessionThatCanNotArmFailsAsForeignExecution() {
    FakeRSession session = new FakeRSession() {
      @Override
      public void armFaultCapture() {
        throw new RFaultException("connection reset");
      }
    };
    assertThatThrownBy(() -> FaultCapture.arm(session, "outer_transform"))
        .isInstanceOf(ForeignExecutionException.class)
        .hasMessageContaining("outer_transform")
        .hasMessageContaining("connection reset")
        .hasCauseInstanceOf(RFaultException.class);
  }

  @Test
  void unreadableTracebackKeepsTheOriginalFault() {
    FakeRSession session = new FakeRSession() {
      @Override
      public Optional<String> capturedTraceback() {
        throw new RFaultException("connection lost");
      }
    }.defineFailing("score", "model is not fitted", null);

    ForeignExecutionException e;
    try (FaultCapture capture = FaultCapture.arm(session, "outer_predict")) {
      e = assertThrows(ForeignExecutionException.class,
          () -> capture.run(() -> session.call("score", RArguments.none())));
    }
    assertThat(e.getMessage()).contains("model is not fitted");
    assertThat(e.getDiagnostic()).isNull();
    assertThat(e.getSuppressed()).hasSize(1);
    assertThat(e.getSuppressed()[0]).hasMessage("connection lost");
  }
}
