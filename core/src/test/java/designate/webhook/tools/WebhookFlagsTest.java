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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableMap;
import designate.webhook.config.WebhookConfig;
import designate.webhook.config.WebhookConfigSettings;
import java.nio.file.Paths;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link WebhookFlags}. */
class WebhookFlagsTest {

  private static WebhookFlags parse(String... args) {
    WebhookFlags flags = new WebhookFlags();
    JCommander.newBuilder().addObject(flags).build().parse(args);
    return flags;
  }

  @Test
  void testApplyTo_overridesGivenFlagsOnly() {
    WebhookConfigSettings settings = WebhookConfig.loadSettings(Optional.empty());

    parse(
            "--domain-filter=example.com",
            "--domain-filter",
            "test.net",
            "--exclude-domains=internal.example.com",
            "--dry-run",
            "--webhook-address=0.0.0.0:9999")
        .applyTo(settings);

    assertThat(settings.designate.domainFilter).containsExactly("example.com", "test.net");
    assertThat(settings.designate.excludeDomains).containsExactly("internal.example.com");
    assertThat(settings.designate.dryRun).isTrue();
    assertThat(settings.server.webhookAddress).isEqualTo("0.0.0.0:9999");
    assertThat(settings.server.statusAddress).isEqualTo("0.0.0.0:8080");
    assertThat(settings.designate.regexDomainFilter).isEmpty();
  }

  @Test
  void testApplyTo_noFlagsKeepsSettings() {
    WebhookConfigSettings settings = WebhookConfig.loadSettings(Optional.empty());
    settings.designate.dryRun = true;

    parse().applyTo(settings);

    assertThat(settings.designate.dryRun).isTrue();
    assertThat(settings.designate.domainFilter).isEmpty();
  }

  @Test
  void testRegexFlags() {
    WebhookConfigSettings settings = WebhookConfig.loadSettings(Optional.empty());

    parse("--regex-domain-filter", "\\.net$", "--regex-domain-exclusion=^skip").applyTo(settings);

    assertThat(settings.designate.regexDomainFilter).isEqualTo("\\.net$");
    assertThat(settings.designate.regexDomainExclusion).isEqualTo("^skip");
  }

  @Test
  void testGetConfigFile_flagWinsOverEnvironment() {
    assertThat(
            parse("--config=/etc/webhook.yaml")
                .getConfigFile(
                    ImmutableMap.of(WebhookConfig.CONFIG_ENV_VARIABLE, "/other.yaml")))
        .hasValue(Paths.get("/etc/webhook.yaml"));
    assertThat(
            parse()
                .getConfigFile(
                    ImmutableMap.of(WebhookConfig.CONFIG_ENV_VARIABLE, "/other.yaml")))
        .hasValue(Paths.get("/other.yaml"));
    assertThat(parse().getConfigFile(ImmutableMap.of())).isEmpty();
    assertThat(parse().getConfigFile(ImmutableMap.of(WebhookConfig.CONFIG_ENV_VARIABLE, "")))
        .isEmpty();
  }

  @Test
  void testUnknownFlag_throws() {
    assertThrows(ParameterException.class, () -> parse("--no-such-flag"));
  }
}
