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

import java.util.List;

/** The POJO that the webhook YAML config files are deserialized into. */
public class WebhookConfigSettings {

  public Server server;
  public Designate designate;
  public OpenStack openStack;
  public OpenStackTls openStackTls;

  /** Listen addresses of the HTTP servers. */
  public static class Server {
    public String webhookAddress;
    public String statusAddress;
  }

  /** Reconciliation and transport settings. */
  public static class Designate {
    public List<String> domainFilter;
    public List<String> excludeDomains;
    public String regexDomainFilter;
    public String regexDomainExclusion;
    public boolean dryRun;
    public int connectTimeoutSeconds;
    public int readTimeoutSeconds;
  }

  /**
   * Keystone credentials. Empty values are taken from the standard {@code OS_*} environment
   * variables.
   */
  public static class OpenStack {
    public String authUrl;
    public String username;
    public String userId;
    public String password;
    public String userDomainName;
    public String userDomainId;
    public String projectName;
    public String projectId;
    public String projectDomainName;
    public String projectDomainId;
    public String applicationCredentialId;
    public String applicationCredentialSecret;
    public String regionName;
    public String endpointInterface;
  }

  /**
   * TLS of the OpenStack connections. Empty values are taken from the {@code OPENSTACK_*}
   * environment variables.
   */
  public static class OpenStackTls {
    public String caFile;
    public String certFile;
    public String keyFile;
    public String serverName;
    public boolean insecure;
  }
}
