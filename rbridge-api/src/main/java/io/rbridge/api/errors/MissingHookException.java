package io.rbridge.api.errors;

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

/// Thrown at configuration time when a hook required by the target type is not bound in the
/// R session.
public class MissingHookException extends ConfigurationException {

  private final String hookName;
  private final String targetType;

  /// @param targetType the target type which requires the hook
  /// @param hookName the missing hook
  public MissingHookException(String targetType, String hookName) {
    super("In '" + targetType + "' mode hook '" + hookName + "' must be provided.");
    this.hookName = hookName;
    this.targetType = targetType;
  }

  /// @return the name of the missing hook
  public String getHookName() {
    return hookName;
  }

  /// @return the target type which required it
  public String getTargetType() {
    return targetType;
  }
}
