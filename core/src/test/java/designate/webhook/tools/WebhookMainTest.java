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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import designate.webhook.client.DesignateException.DesignateAuthenticationException;
import designate.webhook.client.KeystoneAuthenticator;
import designate.webhook.client.KeystoneAuthenticator.KeystoneSession;
import designate.webhook.endpoint.DomainFilter;
import designate.webhook.metrics.ApiCallMetrics;
import designate.webhook.module.WebhookComponent;
import designate.webhook.provider.DesignateProvider;
import designate.webhook.server.Readiness;
import designate.webhook.server.WebhookServer;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for the startup sequence of {@link WebhookMain}. */
class WebhookMainTest {

  private final WebhookComponent component = mock(WebhookComponent.class);
  private final KeystoneAuthenticator authenticator = mock(KeystoneAuthenticator.class);
  private final ApiCallMetrics metrics = mock(ApiCallMetrics.class);
  private final DesignateProvider provider = mock(DesignateProvider.class);
  private final WebhookServer webhookServer = mock(WebhookServer.class);
  private final WebhookServer statusServer = mock(WebhookServer.class);
  private final Readiness readiness = new Readiness();

  private WebhookMain main;

  @BeforeEach
  void beforeEach() {
    when(component.keystoneAuthenticator()).thenReturn(authenticator);
    when(component.apiCallMetrics()).thenReturn(metrics);
    when(component.designateProvider()).thenReturn(provider);
    when(component.webhookServer()).thenReturn(webhookServer);
    when(component.statusServer()).thenReturn(statusServer);
    when(component.readiness()).thenReturn(readiness);
    when(provider.getDomainFilter()).thenReturn(DomainFilter.acceptAll());
    main = new WebhookMain(component);
  }

  @Test
  void testStart_connectsThenServes() throws Exception {
    when(authenticator.getSession())
        .thenReturn(new KeystoneSession("token", "https://dns.example.com/", Instant.MAX));

    assertThat(main.start()).isTrue();

    verify(statusServer).start();
    verify(metrics).setConnected(true);
    verify(webhookServer).start();
    assertThat(readiness.isReady()).isTrue();
  }

  @Test
  void testStart_authenticationFailure_stopsEverything() throws Exception {
    when(authenticator.getSession())
        .thenThrow(new DesignateAuthenticationException("Keystone rejected", 401));

    assertThat(main.start()).isFalse();

    verify(metrics).setConnected(false);
    verify(statusServer).stop();
    verify(webhookServer, never()).start();
    assertThat(readiness.isReady()).isFalse();
  }

  @Test
  void testStop_clearsReadiness() {
    readiness.setReady(true);

    main.stop();

    assertThat(readiness.isReady()).isFalse();
    verify(webhookServer).stop();
    verify(statusServer).stop();
  }
}
