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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/// The R scripts the bridge sources into every session before calling `init`, in sourcing
/// order. They ship as classpath resources next to this class.
public enum SupportScript {
  /// helpers shared by the entry points
  COMMON("common.R"),
  /// the scoring and transform entry points
  SCORE("score.R");

  private final String resourceName;

  SupportScript(String resourceName) {
    this.resourceName = resourceName;
  }

  public String resourceName() {
    return resourceName;
  }

  /// @return the script source
  /// @throws IllegalStateException if the resource is missing from the classpath
  /// @throws UncheckedIOException if the resource cannot be read
  public String text() {
    try (InputStream in = SupportScript.class.getResourceAsStream(resourceName)) {
      if (in == null) {
        throw new IllegalStateException("R support script " + resourceName + " is not on the classpath");
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read R support script " + resourceName, e);
    }
  }
}
