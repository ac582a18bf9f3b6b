package io.rbridge.api.session;

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

import io.rbridge.api.errors.ConfigurationException;
import io.rbridge.api.values.RCharacter;
import io.rbridge.api.values.RNull;
import io.rbridge.api.values.RReference;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RSessionLookupTest {

  @Test
  void findsRegisteredProviderByKind() {
    assertTrue(RSessionLookup.isAvailable("echo"));
    assertTrue(RSessionLookup.isAvailable("ECHO"));
    assertTrue(RSessionLookup.getAvailableKinds().contains("echo"));
    assertInstanceOf(EchoSessionProvider.class, RSessionLookup.find("echo").orElseThrow());
  }

  @Test
  void opensSessionWithOptions() {
    try (RSession session = RSessionLookup.open("echo", Map.of("greeting", "hello"))) {
      assertTrue(session.exists("greeting"));
      assertFalse(session.exists("farewell"));
    }
  }

  @Test
  void unknownKindIsAConfigurationError() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> RSessionLookup.open("missing", Map.of()));
    assertTrue(e.getMessage().contains("'missing'"));
    assertTrue(e.getMessage().contains("echo"));
  }

  @Test
  void argumentsKeepOrderAndNames() {
    RArguments arguments = RArguments.builder()
        .positional(RCharacter.of("binary"))
        .named("model", new RReference(".m"))
        .positional(RNull.INSTANCE)
        .build();
    assertEquals(3, arguments.size());
    assertTrue(arguments.has("model"));
    assertEquals(RNull.INSTANCE, arguments.positional(1));
    assertThrows(IndexOutOfBoundsException.class, () -> arguments.positional(2));
    assertThrows(IllegalArgumentException.class, () -> RArguments.builder().named("", null));
  }
}
