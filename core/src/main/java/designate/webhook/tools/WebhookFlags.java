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

package designate.webhook.tools;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import designate.webhook.config.WebhookConfig;
import designate.webhook.config.WebhookConfigSettings;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** Command line flags of the webhook. Flags that are given override the YAML configuration. */
@Parameters(separators = " =")
final class WebhookFlags {

  @Parameter(
      names = "--domain-filter",
      description = "Domain to work on; may be given multiple times. Default: all zones.")
  List<String> domainFilter = new ArrayList<>();

  @Parameter(
      names = "--exclude-domains",
      description = "Domain to exclude; may be given multiple times.")
  List<String> excludeDomains = new ArrayList<>();

  @Parameter(
      names = "--regex-domain-filter",
      description = "Regular expression of the domains to work on, replacing --domain-filter.")
  @Nullable
  String regexDomainFilter;

  @Parameter(
      names = "--regex-domain-exclusion",
      description = "Regular expression of the domains to exclude.")
  @Nullable
  String regexDomainExclusion;

  @Parameter(
      names = "--dry-run",
      description = "Log the record set changes without sending them to Designate.")
  @Nullable
  Boolean dryRun;

  @Parameter(
      names = "--config",
      description =
          "YAML file overriding the default configuration. Defaults to $"
              + WebhookConfig.CONFIG_ENV_VARIABLE
              + ".")
  @Nullable
  String configFile;

  @Parameter(names = "--webhook-address", description = "Listen address of the webhook server.")
  @Nullable
  String webhookAddress;

  @Parameter(
      names = "--status-address",
      description = "Listen address of the /healthz and /metrics server.")
  @Nullable
  String statusAddress;

  @Parameter(names = {"-h", "--help"}, description = "Print this help.", help = true)
  boolean help;

  /** Returns the override config file named by the flag, or else by the environment. */
  Optional<Path> getConfigFile(Map<String, String> env) {
    if (configFile != null) {
      return Optional.of(Paths.get(configFile));
    }
    return Optional.ofNullable(env.get(WebhookConfig.CONFIG_ENV_VARIABLE))
        .filter(value -> !value.isEmpty())
        .map(Paths::get);
  }

  /** Overrides the settings with the flags that were given. */
  void applyTo(WebhookConfigSettings settings) {
    if (!domainFilter.isEmpty()) {
      settings.designate.domainFilter = domainFilter;
    }
    if (!excludeDomains.isEmpty()) {
      settings.designate.excludeDomains = excludeDomains;
    }
    if (regexDomainFilter != null) {
      settings.designate.regexDomainFilter = regexDomainFilter;
    }
    if (regexDomainExclusion != null) {
      settings.designate.regexDomainExclusion = regexDomainExclusion;
    }
    if (dryRun != null) {
      settings.designate.dryRun = dryRun;
    }
    if (webhookAddress != null) {
      settings.server.webhookAddress = webhookAddress;
    }
    if (statusAddress != null) {
      settings.server.statusAddress = statusAddress;
    }
  }
}
