package io.rbridge.core.predictor;

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

import java.util.List;

/// Names of the hooks a model author may define in `custom.R`.
public final class CustomHooks {

  public static final String INIT = "init";
  public static final String READ_INPUT_DATA = "read_input_data";
  public static final String LOAD_MODEL = "load_model";
  public static final String TRANSFORM = "transform";
  public static final String SCORE = "score";
  public static final String SCORE_UNSTRUCTURED = "score_unstructured";
  public static final String POST_PROCESS = "post_process";

  /// Every hook name, in the order the support scripts look them up.
  public static final List<String> ALL =
      List.of(INIT, READ_INPUT_DATA, LOAD_MODEL, TRANSFORM, SCORE, SCORE_UNSTRUCTURED, POST_PROCESS);

  /// Hooks which must be bound in unstructured mode, in the order they are checked.
  public static final List<String> REQUIRED_FOR_UNSTRUCTURED = List.of(LOAD_MODEL, SCORE_UNSTRUCTURED);

  private CustomHooks() {
  }
}
