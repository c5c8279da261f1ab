// Copyright 2026 The Designate Webhook Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package designate.webhook.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

/** Unit tests for {@link YamlUtils}. */
class YamlUtilsTest {

  private static final String DEFAULT_YAML =
      String.join(
          "\n",
          "server:",
          "  webhookAddress: 127.0.0.1:8888",
          "  statusAddress: 0.0.0.0:8080",
          "designate:",
          "  domainFilter: [example.com]",
          "  dryRun: false");

  @SuppressWarnings("unchecked")
  private static Map<String, Object> section(String yaml, String name) {
    return (Map<String, Object>) new Yaml().<Map<String, Object>>load(yaml).get(name);
  }

  @Test
  void testMergeYaml_overridesNestedValues() {
    String merged =
        YamlUtils.mergeYaml(DEFAULT_YAML, "server:\n  webhookAddress: 0.0.0.0:9999\n");

    assertThat(section(merged, "server"))
        .containsExactly("webhookAddress", "0.0.0.0:9999", "statusAddress", "0.0.0.0:8080");
    assertThat(section(merged, "designate")).containsEntry("dryRun", false);
  }

  @Test
  void testMergeYaml_replacesListsAsAWhole() {
    String merged = YamlUtils.mergeYaml(DEFAULT_YAML, "designate:\n  domainFilter: [test.net]\n");

    assertThat(section(merged, "designate"))
        .containsEntry("domainFilter", ImmutableList.of("test.net"));
  }

  @Test
  void testMergeYaml_ignoresUnknownFields() {
    String merged = YamlUtils.mergeYaml(DEFAULT_YAML, "unknown:\n  key: value\n");

    assertThat(new Yaml().<Map<String, Object>>load(merged).keySet())
        .containsExactly("server", "designate");
  }

  @Test
  void testMergeYaml_emptyCustomYamlKeepsDefaults() {
    assertThat(section(YamlUtils.mergeYaml(DEFAULT_YAML, ""), "server"))
        .containsEntry("webhookAddress", "127.0.0.1:8888");
  }

  @Test
  void testGetConfigSettings_loadsPojo() {
    WebhookConfigSettings settings =
        YamlUtils.getConfigSettings(
            DEFAULT_YAML, "designate:\n  dryRun: true\n", WebhookConfigSettings.class);

    assertThat(settings.designate.dryRun).isTrue();
    assertThat(settings.designate.domainFilter).containsExactly("example.com");
    assertThat(settings.server.statusAddress).isEqualTo("0.0.0.0:8080");
  }

  @Test
  void testGetConfigSettings_invalidYaml_throws() {
    IllegalStateException thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                YamlUtils.getConfigSettings(
                    DEFAULT_YAML, "designate: [unclosed", WebhookConfigSettings.class));

    assertThat(thrown).hasMessageThat().contains("configuration YAML is invalid");
  }
}
