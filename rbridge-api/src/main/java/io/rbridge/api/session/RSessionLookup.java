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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Discovers [RSessionProvider] implementations through [ServiceLoader] and selects them by
/// their [SessionKind] name.
///
/// ```
/// try (RSession session = RSessionLookup.open("rserve", Map.of("host", "localhost"))) {
///   ...
/// }
/// ```
public final class RSessionLookup {

  private static final ServiceLoader<RSessionProvider> serviceLoader =
      ServiceLoader.load(RSessionProvider.class);

  private RSessionLookup() {
  }

  /// Finds a provider by kind.
  /// @param kind the [SessionKind] value to match, case insensitive
  /// @return a new provider instance, or empty if none matches
  public static Optional<RSessionProvider> find(String kind) {
    return providers()
        .filter(provider -> matchesKind(provider, kind))
        .findFirst()
        .map(ServiceLoader.Provider::get);
  }

  /// Finds a provider by kind and opens a session with it.
  /// @param kind the session kind
  /// @param options provider specific options
  /// @return an open session
  /// @throws ConfigurationException if no provider of that kind is registered
  public static RSession open(String kind, Map<String, String> options) {
    RSessionProvider provider = find(kind).orElseThrow(() -> new ConfigurationException(
        "No R session provider of kind '" + kind + "'. Available: " + getAvailableKinds()));
    return provider.open(options);
  }

  /// @return the kinds of all registered providers
  public static List<String> getAvailableKinds() {
    return providers()
        .map(provider -> provider.type().getAnnotation(SessionKind.class))
        .filter(annotation -> annotation != null)
        .map(SessionKind::value)
        .collect(Collectors.toList());
  }

  /// @param kind a session kind
  /// @return true if a provider of that kind is registered
  public static boolean isAvailable(String kind) {
    return providers().anyMatch(provider -> matchesKind(provider, kind));
  }

  private static boolean matchesKind(ServiceLoader.Provider<RSessionProvider> provider, String kind) {
    SessionKind annotation = provider.type().getAnnotation(SessionKind.class);
    return annotation != null && kind != null && annotation.value().equalsIgnoreCase(kind);
  }

  private static Stream<ServiceLoader.Provider<RSessionProvider>> providers() {
    return serviceLoader.stream();
  }
}
