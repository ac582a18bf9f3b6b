package io.rbridge.rserve;

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
import io.rbridge.api.session.RSessionLookup;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RserveSessionProviderTest {

  @Test
  void isRegisteredUnderTheRserveKind() {
    assertTrue(RSessionLookup.isAvailable(RserveSessionProvider.KIND));
    assertInstanceOf(RserveSessionProvider.class,
        RSessionLookup.find(RserveSessionProvider.KIND).orElseThrow());
  }

  @Test
  void parsesPorts() {
    assertEquals(RserveSessionProvider.DEFAULT_PORT, RserveSessionProvider.port(null));
    assertEquals(RserveSessionProvider.DEFAULT_PORT, RserveSessionProvider.port(" "));
    assertEquals(6400, RserveSessionProvider.port(" 6400 "));
    assertThrows(ConfigurationException.class, () -> RserveSessionProvider.port("abc"));
    assertThrows(ConfigurationException.class, () -> RserveSessionProvider.port("70000"));
  }

  @Test
  void unreachableDaemonIsAConfigurationError() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> new RserveSessionProvider().open(Map.of("host", "127.0.0.1", "port", "1")));
    assertTrue(e.getMessage().contains("127.0.0.1:1"));
  }

  @Test
  void quotesRStringLiterals() {
    assertEquals("\"plain\"", RserveSession.quote("plain"));
    assertEquals("\"a\\\"b\\\\c\\n\"", RserveSession.quote("a\"b\\c\n"));
  }
}
