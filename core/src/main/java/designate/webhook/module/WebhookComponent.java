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

import dagger.BindsInstance;
import dagger.Component;
import designate.webhook.client.KeystoneAuthenticator;
import designate.webhook.config.WebhookConfig.ConfigModule;
import designate.webhook.config.WebhookConfigSettings;
import designate.webhook.metrics.ApiCallMetrics;
import designate.webhook.provider.DesignateProvider;
import designate.webhook.server.Readiness;
import designate.webhook.server.WebhookServer;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/** Dagger component of the webhook process. */
@Singleton
@Component(modules = {ConfigModule.class, DesignateModule.class, ServerModule.class})
public interface WebhookComponent {

  DesignateProvider designateProvider();

  KeystoneAuthenticator keystoneAuthenticator();

  ApiCallMetrics apiCallMetrics();

  Readiness readiness();

  @Named(ServerModule.WEBHOOK_SERVER)
  WebhookServer webhookServer();

  @Named(ServerModule.STATUS_SERVER)
  WebhookServer statusServer();

  /** Creates the component from the loaded configuration. */
  @Component.Factory
  interface Factory {
    WebhookComponent create(@BindsInstance WebhookConfigSettings settings);
  }
}
