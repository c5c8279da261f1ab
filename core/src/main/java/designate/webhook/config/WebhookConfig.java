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

import static com.google.common.base.Preconditions.checkArgument;
import static designate.webhook.util.CollectionUtils.nullToEmptyImmutableCopy;
import static designate.webhook.util.ResourceUtils.readResourceUtf8;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import dagger.Module;
import dagger.Provides;
import designate.webhook.client.OpenStackCredentials;
import designate.webhook.client.OpenStackTlsSettings;
import designate.webhook.endpoint.DomainFilter;
import jakarta.inject.Qualifier;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Configuration of the webhook.
 *
 * <p>Settings are read from {@code files/default-config.yaml}, merged with an optional override
 * file named by the {@code --config} flag or the {@value #CONFIG_ENV_VARIABLE} environment
 * variable.
 */
public final class WebhookConfig {

  /** Environment variable naming the override config file. */
  public static final String CONFIG_ENV_VARIABLE = "DESIGNATE_WEBHOOK_CONFIG";

  private static final String YAML_CONFIG_DEFAULT = "files/default-config.yaml";

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Retention(RUNTIME)
  @Documented
  public @interface Config {
    String value() default "";
  }

  /** Loads the default settings, overridden by the given file if present. */
  public static WebhookConfigSettings loadSettings(Optional<Path> overrideFile) {
    String defaultYaml = readResourceUtf8(WebhookConfig.class, YAML_CONFIG_DEFAULT);
    String customYaml = "";
    if (overrideFile.isPresent()) {
      try {
        customYaml = Files.readString(overrideFile.get(), StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new IllegalStateException(
            "Cannot read configuration file " + overrideFile.get(), e);
      }
    }
    return YamlUtils.getConfigSettings(defaultYaml, customYaml, WebhookConfigSettings.class);
  }

  /** Dagger module providing the configuration settings. */
  @Module
  public static final class ConfigModule {

    @Provides
    @Config("dryRun")
    static boolean provideDryRun(WebhookConfigSettings config) {
      return config.designate.dryRun;
    }

    /** Address of the external-dns webhook server, as {@code host:port}. */
    @Provides
    @Config("webhookAddress")
    static String provideWebhookAddress(WebhookConfigSettings config) {
      return config.server.webhookAddress;
    }

    /** Address of the health and metrics server, as {@code host:port}. */
    @Provides
    @Config("statusAddress")
    static String provideStatusAddress(WebhookConfigSettings config) {
      return config.server.statusAddress;
    }

    @Provides
    @Config("connectTimeout")
    static Duration provideConnectTimeout(WebhookConfigSettings config) {
      checkArgument(
          config.designate.connectTimeoutSeconds > 0, "connectTimeoutSeconds must be positive");
      return Duration.ofSeconds(config.designate.connectTimeoutSeconds);
    }

    @Provides
    @Config("readTimeout")
    static Duration provideReadTimeout(WebhookConfigSettings config) {
      checkArgument(
          config.designate.readTimeoutSeconds > 0, "readTimeoutSeconds must be positive");
      return Duration.ofSeconds(config.designate.readTimeoutSeconds);
    }

    @Provides
    @Singleton
    static DomainFilter provideDomainFilter(WebhookConfigSettings config) {
      return new DomainFilter(
          nullToEmptyImmutableCopy(config.designate.domainFilter),
          nullToEmptyImmutableCopy(config.designate.excludeDomains),
          config.designate.regexDomainFilter,
          config.designate.regexDomainExclusion);
    }

    @Provides
    @Singleton
    static OpenStackCredentials provideOpenStackCredentials(WebhookConfigSettings config) {
      return OpenStackEnvironment.resolve(config.openStack, System.getenv());
    }

    @Provides
    @Singleton
    static OpenStackTlsSettings provideOpenStackTlsSettings(WebhookConfigSettings config) {
      return OpenStackEnvironment.resolveTls(config.openStackTls, System.getenv());
    }

    private ConfigModule() {}
  }

  private WebhookConfig() {}
}
