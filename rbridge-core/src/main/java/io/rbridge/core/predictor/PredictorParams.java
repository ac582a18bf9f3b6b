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

import io.rbridge.api.TargetType;
import io.rbridge.api.errors.ConfigurationException;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Immutable predictor parameters.
///
/// Built from a map with the keys below, or from a YAML document with the same layout:
/// ```yaml
/// code_dir: /opt/model
/// target_type: binary
/// positive_class_label: "yes"
/// negative_class_label: "no"
/// session:
///   kind: rserve
///   host: localhost
///   port: 6311
/// ```
/// Session options may also be given flat, as `session.host: localhost`.
/// @param codeDir the directory holding `custom.R` and the model artifacts
/// @param targetType the target type of the model
/// @param positiveClassLabel the positive label of a binary model, or null
/// @param negativeClassLabel the negative label of a binary model, or null
/// @param classLabels the labels of a multiclass model, or null
/// @param sessionKind the [io.rbridge.api.session.SessionKind] of the session provider
/// @param sessionOptions options passed to the session provider
public record PredictorParams(
    Path codeDir,
    TargetType targetType,
    String positiveClassLabel,
    String negativeClassLabel,
    List<String> classLabels,
    String sessionKind,
    Map<String, String> sessionOptions
) {

  public static final String CODE_DIR = "code_dir";
  public static final String TARGET_TYPE = "target_type";
  public static final String POSITIVE_CLASS_LABEL = "positive_class_label";
  public static final String NEGATIVE_CLASS_LABEL = "negative_class_label";
  public static final String CLASS_LABELS = "class_labels";
  public static final String SESSION = "session";
  public static final String SESSION_KIND = "kind";
  public static final String DEFAULT_SESSION_KIND = "rserve";

  public PredictorParams {
    if (codeDir == null) {
      throw new ConfigurationException("'" + CODE_DIR + "' is required");
    }
    if (targetType == null) {
      throw new ConfigurationException("'" + TARGET_TYPE + "' is required");
    }
    if ((positiveClassLabel == null) != (negativeClassLabel == null)) {
      throw new ConfigurationException("'" + POSITIVE_CLASS_LABEL + "' and '"
          + NEGATIVE_CLASS_LABEL + "' must be provided together");
    }
    if (positiveClassLabel != null && classLabels != null) {
      throw new ConfigurationException("'" + CLASS_LABELS + "' can not be combined with '"
          + POSITIVE_CLASS_LABEL + "' and '" + NEGATIVE_CLASS_LABEL + "'");
    }
    classLabels = classLabels == null ? null : List.copyOf(classLabels);
    sessionKind = sessionKind == null ? DEFAULT_SESSION_KIND : sessionKind;
    sessionOptions = sessionOptions == null ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(sessionOptions));
  }

  /// @param codeDir the model directory
  /// @param targetType the target type
  /// @return parameters without class labels, using the default session kind
  public static PredictorParams of(Path codeDir, TargetType targetType) {
    return new PredictorParams(codeDir, targetType, null, null, null, null, null);
  }

  /// @param positive the positive class label
  /// @param negative the negative class label
  /// @return a copy of these parameters with binary class labels
  public PredictorParams withBinaryLabels(String positive, String negative) {
    return new PredictorParams(codeDir, targetType, positive, negative, null, sessionKind,
        sessionOptions);
  }

  /// @param labels the multiclass labels
  /// @return a copy of these parameters with multiclass labels
  public PredictorParams withClassLabels(List<String> labels) {
    return new PredictorParams(codeDir, targetType, null, null, labels, sessionKind,
        sessionOptions);
  }

  /// @param kind the session kind
  /// @param options the session options
  /// @return a copy of these parameters using the given session provider
  public PredictorParams withSession(String kind, Map<String, String> options) {
    return new PredictorParams(codeDir, targetType, positiveClassLabel, negativeClassLabel,
        classLabels, kind, options);
  }

  /// Build parameters from a configuration map.
  /// @param config the configuration map
  /// @return the parameters
  /// @throws ConfigurationException if a required key is missing or a value is malformed
  public static PredictorParams fromMap(Map<String, ?> config) {
    if (config == null) {
      throw new ConfigurationException("predictor configuration is empty");
    }
    Object codeDir = config.get(CODE_DIR);
    if (codeDir == null) {
      throw new ConfigurationException("'" + CODE_DIR + "' is required");
    }
    String targetName = string(config, TARGET_TYPE);
    if (targetName == null) {
      throw new ConfigurationException("'" + TARGET_TYPE + "' is required");
    }
    TargetType targetType = TargetType.fromValue(targetName).orElseThrow(
        () -> new ConfigurationException("unknown " + TARGET_TYPE + " '" + targetName + "'"));

    Map<String, String> session = sessionOptions(config);
    String kind = session.remove(SESSION_KIND);
    return new PredictorParams(
        Path.of(codeDir.toString()),
        targetType,
        string(config, POSITIVE_CLASS_LABEL),
        string(config, NEGATIVE_CLASS_LABEL),
        classLabels(config.get(CLASS_LABELS)),
        kind,
        session);
  }

  /// Load parameters from a YAML file.
  /// @param path the YAML file
  /// @return the parameters
  /// @throws ConfigurationException if the file can not be read or parsed, or is invalid
  public static PredictorParams load(Path path) {
    LoadSettings loadSettings = LoadSettings.builder().build();
    Load yaml = new Load(loadSettings);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = yaml.loadFromReader(reader);
      if (!(document instanceof Map<?, ?> map)) {
        throw new ConfigurationException(
            "predictor configuration " + path + " must be a YAML mapping");
      }
      return fromMap(stringKeys(map, path.toString()));
    } catch (IOException e) {
      throw new ConfigurationException("can not read predictor configuration " + path, e);
    } catch (YamlEngineException e) {
      throw new ConfigurationException("can not parse predictor configuration " + path, e);
    }
  }

  private static String string(Map<String, ?> config, String key) {
    Object value = config.get(key);
    return value == null ? null : value.toString();
  }

  private static List<String> classLabels(Object value) {
    if (value == null) {
      return null;
    }
    if (!(value instanceof List<?> list)) {
      throw new ConfigurationException("'" + CLASS_LABELS + "' must be a list of strings");
    }
    List<String> labels = new ArrayList<>(list.size());
    for (Object label : list) {
      if (!(label instanceof String text)) {
        throw new ConfigurationException("'" + CLASS_LABELS + "' must be a list of strings, found "
            + (label == null ? "null" : label.getClass().getSimpleName()));
      }
      labels.add(text);
    }
    return labels;
  }

  private static Map<String, String> sessionOptions(Map<String, ?> config) {
    Map<String, String> options = new LinkedHashMap<>();
    Object nested = config.get(SESSION);
    if (nested instanceof Map<?, ?> map) {
      map.forEach((k, v) -> options.put(String.valueOf(k), v == null ? null : v.toString()));
    } else if (nested != null) {
      throw new ConfigurationException("'" + SESSION + "' must be a mapping of session options");
    }
    String prefix = SESSION + ".";
    config.forEach((k, v) -> {
      if (k.startsWith(prefix) && v != null) {
        options.put(k.substring(prefix.length()), v.toString());
      }
    });
    options.values().removeIf(v -> v == null);
    return options;
  }

  private static Map<String, Object> stringKeys(Map<?, ?> map, String source) {
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((k, v) -> {
      if (!(k instanceof String key)) {
        throw new ConfigurationException("non-string key '" + k + "' in " + source);
      }
      result.put(key, v);
    });
    return result;
  }
}
