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

import static com.google.common.base.Strings.emptyToNull;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.collect.ImmutableMap;
import designate.webhook.client.OpenStackCredentials;
import designate.webhook.client.OpenStackTlsSettings;
import designate.webhook.config.WebhookConfigSettings.OpenStack;
import designate.webhook.config.WebhookConfigSettings.OpenStackTls;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Completes the configured Keystone credentials from the standard {@code OS_*} environment
 * variables.
 *
 * <p>Older OpenStack RC files use tenant and plain domain variables, which are accepted as
 * fallbacks for their project and user domain counterparts. TLS settings come from the {@code
 * OPENSTACK_*} variables.
 */
public final class OpenStackEnvironment {

  /** Fallback variables, keyed by the variable they stand in for. */
  static final ImmutableMap<String, String> LEGACY_VARIABLES =
      ImmutableMap.of(
          "OS_PROJECT_NAME", "OS_TENANT_NAME",
          "OS_PROJECT_ID", "OS_TENANT_ID",
          "OS_USER_DOMAIN_NAME", "OS_DOMAIN_NAME",
          "OS_USER_DOMAIN_ID", "OS_DOMAIN_ID");

  /**
   * Returns the credentials with every empty setting taken from the environment.
   *
   * @throws IllegalStateException if no Keystone auth URL is configured
   */
  public static OpenStackCredentials resolve(
      @Nullable OpenStack settings, Map<String, String> env) {
    OpenStack config = settings == null ? new OpenStack() : settings;
    String userDomainName = pick(config.userDomainName, env, "OS_USER_DOMAIN_NAME");
    String userDomainId = pick(config.userDomainId, env, "OS_USER_DOMAIN_ID");
    String projectDomainName = pick(config.projectDomainName, env, "OS_PROJECT_DOMAIN_NAME");
    String projectDomainId = pick(config.projectDomainId, env, "OS_PROJECT_DOMAIN_ID");
    if (isNullOrEmpty(projectDomainName) && isNullOrEmpty(projectDomainId)) {
      // The project lives in the user's domain unless told otherwise.
      projectDomainName = userDomainName;
      projectDomainId = userDomainId;
    }
    OpenStackCredentials credentials =
        new OpenStackCredentials(
            pick(config.authUrl, env, "OS_AUTH_URL"),
            pick(config.username, env, "OS_USERNAME"),
            pick(config.userId, env, "OS_USER_ID"),
            pick(config.password, env, "OS_PASSWORD"),
            userDomainName,
            userDomainId,
            pick(config.projectName, env, "OS_PROJECT_NAME"),
            pick(config.projectId, env, "OS_PROJECT_ID"),
            projectDomainName,
            projectDomainId,
            pick(config.applicationCredentialId, env, "OS_APPLICATION_CREDENTIAL_ID"),
            pick(config.applicationCredentialSecret, env, "OS_APPLICATION_CREDENTIAL_SECRET"),
            pick(config.regionName, env, "OS_REGION_NAME"),
            pick(config.endpointInterface, env, "OS_INTERFACE"));
    if (isNullOrEmpty(credentials.authUrl())) {
      throw new IllegalStateException(
          "No Keystone auth URL configured; set openStack.authUrl or OS_AUTH_URL");
    }
    return credentials;
  }

  /** Returns the TLS settings with every empty setting taken from the environment. */
  public static OpenStackTlsSettings resolveTls(
      @Nullable OpenStackTls settings, Map<String, String> env) {
    OpenStackTls config = settings == null ? new OpenStackTls() : settings;
    return new OpenStackTlsSettings(
        pick(config.caFile, env, "OPENSTACK_CA_FILE"),
        pick(config.certFile, env, "OPENSTACK_CERT_FILE"),
        pick(config.keyFile, env, "OPENSTACK_KEY_FILE"),
        pick(config.serverName, env, "OPENSTACK_TLS_SERVER_NAME"),
        config.insecure || "true".equalsIgnoreCase(env.get("OPENSTACK_INSECURE")));
  }

  @Nullable
  private static String pick(@Nullable String configured, Map<String, String> env, String name) {
    if (!isNullOrEmpty(configured)) {
      return configured;
    }
    String value = emptyToNull(env.get(name));
    if (value == null && LEGACY_VARIABLES.containsKey(name)) {
      value = emptyToNull(env.get(LEGACY_VARIABLES.get(name)));
    }
    return value;
  }

  private OpenStackEnvironment() {}
}
