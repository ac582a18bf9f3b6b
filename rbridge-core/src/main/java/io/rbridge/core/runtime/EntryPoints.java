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

/// Names of the R functions the bridge's own support scripts define, and of the keyword
/// arguments the bridge passes to them.
public final class EntryPoints {

  public static final String INIT = "init";
  public static final String LOAD_SERIALIZED_MODEL = "load_serialized_model";
  public static final String OUTER_PREDICT = "outer_predict";
  public static final String PREDICT_UNSTRUCTURED = "predict_unstructured";
  public static final String OUTER_TRANSFORM = "outer_transform";
  public static final String HAS_READ_INPUT_DATA_HOOK = "has_read_input_data_hook";

  public static final String ARG_BINARY_DATA = "binary_data";
  public static final String ARG_MIMETYPE = "mimetype";
  public static final String ARG_MODEL = "model";
  public static final String ARG_POSITIVE_CLASS_LABEL = "positive_class_label";
  public static final String ARG_NEGATIVE_CLASS_LABEL = "negative_class_label";
  public static final String ARG_CLASS_LABELS = "class_labels";
  public static final String ARG_TARGET_BINARY_DATA = "target_binary_data";
  public static final String ARG_TRANSFORMER = "transformer";
  public static final String ARG_DATA = "data";
  public static final String ARG_QUERY = "query";

  private EntryPoints() {
  }
}
