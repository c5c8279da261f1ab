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

package designate.webhook.module;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import dagger.Module;
import dagger.Provides;
import designate.webhook.config.WebhookConfig.Config;
import designate.webhook.server.AdjustEndpointsAction;
import designate.webhook.server.DomainFilterAction;
import designate.webhook.server.HealthCheckAction;
import designate.webhook.server.MetricsAction;
import designate.webhook.server.RecordsAction;
import designate.webhook.server.WebhookServer;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/** Dagger module providing the webhook and status HTTP servers. */
@Module
public final class ServerModule {

  public static final String WEBHOOK_SERVER = "webhookServer";
  public static final String STATUS_SERVER = "statusServer";

  /** Gson for the external-dns wire format; only {@code @Expose}d fields are exchanged. */
  @Provides
  @Singleton
  static Gson provideGson() {
    return new GsonBuilder().excludeFieldsWithoutExposeAnnotation().create();
  }

  @Provides
  @Singleton
  @Named(WEBHOOK_SERVER)
  static WebhookServer provideWebhookServer(
      @Config("webhookAddress") String address,
      DomainFilterAction domainFilterAction,
      RecordsAction recordsAction,
      AdjustEndpointsAction adjustEndpointsAction) {
    return new WebhookServer(
        "webhook",
        WebhookServer.parseAddress(address),
        ImmutableList.of(domainFilterAction, recordsAction, adjustEndpointsAction));
  }

  @Provides
  @Singleton
  @Named(STATUS_SERVER)
  static WebhookServer provideStatusServer(
      @Config("statusAddress") String address,
      HealthCheckAction healthCheckAction,
      MetricsAction metricsAction) {
    return new WebhookServer(
        "status",
        WebhookServer.parseAddress(address),
        ImmutableList.of(healthCheckAction, metricsAction));
  }

  private ServerModule() {}
}
