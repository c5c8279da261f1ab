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

import javax.annotation.Nullable;

/**
 * TLS settings of the connections to Keystone and Designate.
 *
 * <p>Unset files leave the JDK defaults in place. A client certificate needs both the certificate
 * and the key file.
 */
public record OpenStackTlsSettings(
    @Nullable String caFile,
    @Nullable String certFile,
    @Nullable String keyFile,
    @Nullable String serverName,
    boolean insecure) {

  public static final OpenStackTlsSettings DEFAULT =
      new OpenStackTlsSettings(null, null, null, null, false);

  public boolean hasCaFile() {
    return !isNullOrEmpty(caFile);
  }

  public boolean hasClientCertificate() {
    return !isNullOrEmpty(certFile) && !isNullOrEmpty(keyFile);
  }

  public boolean hasServerName() {
    return !isNullOrEmpty(serverName);
  }
}
