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
import io.rbridge.api.values.RCharacter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredictorParamsTest {

  @TempDir
  Path tempDir;

  @Test
  void loadsBinaryParamsFromYaml() throws IOException {
    Path config = tempDir.resolve("predictor.yaml");
    Files.writeString(config, String.join("\n",
        "code_dir: /opt/model",
        "target_type: binary",
        "positive_class_label: 'yes'",
        "negative_class_label: 'no'",
        "session:",
        "  kind: rserve",
        "  host: rhost",
        "  port: 6312",
        ""));

    PredictorParams params = PredictorParams.load(config);
    assertThat(params.codeDir()).isEqualTo(Path.of("/opt/model"));
    assertThat(params.targetType()).isEqualTo(TargetType.BINARY);
    assertThat(params.positiveClassLabel()).isEqualTo("yes");
    assertThat(params.negativeClassLabel()).isEqualTo("no");
    assertThat(params.classLabels()).isNull();
    assertThat(params.sessionKind()).isEqualTo("rserve");
    assertThat(params.sessionOptions()).containsEntry("host", "rhost").containsEntry("port", "6312")
        .doesNotContainKey("kind");
  }

  @Test
  void loadsMulticlassLabelsFromYaml() throws IOException {
    Path config = tempDir.resolve("multiclass.yaml");
    Files.writeString(config, String.join("\n",
        "code_dir: " + tempDir,
        "target_type: multiclass",
        "class_labels: [setosa, versicolor, virginica]",
        ""));

    PredictorParams params = PredictorParams.load(config);
    assertThat(params.classLabels()).containsExactly("setosa", "versicolor", "virginica");
    assertThat(ClassLabels.from(params).labelsToR())
        .isEqualTo(RCharacter.of("setosa", "versicolor", "virginica"));
    assertThat(params.sessionKind()).isEqualTo(PredictorParams.DEFAULT_SESSION_KIND);
    assertThat(params.sessionOptions()).isEmpty();
  }

  @Test
  void flatSessionOptionsAreCollected() {
    Map<String, Object> config = new HashMap<>();
    config.put("code_dir", "/opt/model");
    config.put("target_type", "regression");
    config.put("session.host", "10.0.0.5");
    config.put("session.user", "scorer");

    PredictorParams params = PredictorParams.fromMap(config);
    assertThat(params.sessionOptions()).containsOnly(
        Map.entry("host", "10.0.0.5"), Map.entry("user", "scorer"));
  }

  @Test
  void codeDirAndTargetTypeAreRequired() {
    assertThatThrownBy(() -> PredictorParams.fromMap(Map.of("target_type", "binary")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("code_dir");
    assertThatThrownBy(() -> PredictorParams.fromMap(Map.of("code_dir", "/opt/model")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("target_type");
  }

  @Test
  void unknownTargetTypeIsRejected() {
    assertThatThrownBy(() -> PredictorParams.fromMap(
        Map.of("code_dir", "/opt/model", "target_type", "clustering")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("clustering");
  }

  @Test
  void classLabelsMustBeStrings() {
    assertThatThrownBy(() -> PredictorParams.fromMap(Map.of(
        "code_dir", "/opt/model", "target_type", "multiclass", "class_labels", List.of("a", 2))))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("class_labels");
    assertThatThrownBy(() -> PredictorParams.fromMap(Map.of(
        "code_dir", "/opt/model", "target_type", "multiclass", "class_labels", "a,b")))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void binaryLabelsComeInPairs() {
    assertThatThrownBy(() -> PredictorParams.fromMap(Map.of(
        "code_dir", "/opt/model", "target_type", "binary", "positive_class_label", "yes")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("together");
  }

  @Test
  void unreadableOrMalformedFilesAreConfigurationErrors() throws IOException {
    assertThatThrownBy(() -> PredictorParams.load(tempDir.resolve("missing.yaml")))
        .isInstanceOf(ConfigurationException.class);

    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, "- a\n- b\n");
    assertThatThrownBy(() -> PredictorParams.load(list))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("mapping");

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "code_dir: [unclosed\n");
    assertThatThrownBy(() -> PredictorParams.load(broken))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("parse");
  }
}
