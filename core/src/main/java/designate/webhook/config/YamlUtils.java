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

import com.google.common.flogger.FluentLogger;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;

/**
 * Utility methods for dealing with YAML.
 *
 * <p>The webhook always reads {@code default-config.yaml} from its resources and optionally an
 * operator supplied file whose values override the defaults.
 */
public final class YamlUtils {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Loads the POJO of type {@code T} from merged YAML configuration files.
   *
   * @param defaultYaml content of the default YAML file
   * @param customYaml content of the custom YAML file, to override default values
   * @throws IllegalStateException if the configuration is invalid
   */
  public static <T> T getConfigSettings(String defaultYaml, String customYaml, Class<T> clazz) {
    try {
      String mergedYaml = mergeYaml(defaultYaml, customYaml);
      return new Yaml().loadAs(mergedYaml, clazz);
    } catch (RuntimeException e) {
      throw new IllegalStateException("Fatal error: webhook configuration YAML is invalid", e);
    }
  }

  /**
   * Recursively merges two YAML documents together.
   *
   * <p>Fields present in {@code customYaml} override fields at the same path in {@code
   * defaultYaml}. Fields unknown to {@code defaultYaml} are ignored. Only maps are merged
   * recursively; lists are replaced as a whole.
   */
  static String mergeYaml(String defaultYaml, String customYaml) {
    Yaml yaml = new Yaml();
    Map<String, Object> yamlMap =
        loadAsMap(yaml, defaultYaml)
            .orElseThrow(() -> new IllegalStateException("Default configuration is empty"));
    Optional<Map<String, Object>> customMap = loadAsMap(yaml, customYaml);
    if (customMap.isPresent()) {
      yamlMap = mergeMaps(yamlMap, customMap.get());
      logger.atFine().log("Merged custom configuration YAML.");
    } else {
      logger.atFine().log("No custom configuration YAML; using defaults.");
    }
    return yaml.dump(yamlMap);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mergeMaps(
      Map<String, Object> defaultMap, Map<String, Object> customMap) {
    for (String key : defaultMap.keySet()) {
      if (!customMap.containsKey(key)) {
        continue;
      }
      Object newValue;
      if (defaultMap.get(key) instanceof Map && customMap.get(key) instanceof Map) {
        newValue =
            mergeMaps(
                (Map<String, Object>) defaultMap.get(key),
                (Map<String, Object>) customMap.get(key));
      } else {
        newValue = customMap.get(key);
      }
      defaultMap.put(key, newValue);
    }
    return defaultMap;
  }

  /** Returns the map held by a YAML string, or empty if it holds no data. */
  @SuppressWarnings("unchecked")
  private static Optional<Map<String, Object>> loadAsMap(Yaml yaml, String yamlString) {
    return Optional.ofNullable((Map<String, Object>) yaml.load(yamlString));
  }

  private YamlUtils() {}
}
