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

package designate.webhook.client;

import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * Keystone v3 authentication settings.
 *
 * <p>Either an application credential (id and secret) or a user password with a project scope is
 * used; the application credential wins when both are set.
 */
public record OpenStackCredentials(
    String authUrl,
    String username,
    String userId,
    String password,
    String userDomainName,
    String userDomainId,
    String projectName,
    String projectId,
    String projectDomainName,
    String projectDomainId,
    String applicationCredentialId,
    String applicationCredentialSecret,
    String regionName,
    String endpointInterface) {

  /** Interface used when none is configured. */
  public static final String DEFAULT_INTERFACE = "public";

  public boolean usesApplicationCredential() {
    return !isNullOrEmpty(applicationCredentialId) && !isNullOrEmpty(applicationCredentialSecret);
  }

  public String endpointInterfaceOrDefault() {
    return isNullOrEmpty(endpointInterface) ? DEFAULT_INTERFACE : endpointInterface;
  }

  @Override
  public String toString() {
    // Secrets are never printed.
    return String.format(
        "OpenStackCredentials{authUrl=%s, user=%s, project=%s, applicationCredential=%s,"
            + " region=%s, interface=%s}",
        authUrl,
        isNullOrEmpty(username) ? userId : username,
        isNullOrEmpty(projectName) ? projectId : projectName,
        applicationCredentialId,
        regionName,
        endpointInterfaceOrDefault());
  }
}
