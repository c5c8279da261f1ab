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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import designate.webhook.client.DesignateClient;
import designate.webhook.client.DesignateHttpClient;
import designate.webhook.client.KeystoneAuthenticator;
import designate.webhook.client.OpenStackCredentials;
import designate.webhook.client.OpenStackTlsConfigurer;
import designate.webhook.client.OpenStackTlsSettings;
import designate.webhook.config.WebhookConfig.Config;
import designate.webhook.metrics.ApiCallMetrics;
import designate.webhook.metrics.InstrumentedDesignateClient;
import designate.webhook.metrics.WebhookMetrics;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import okhttp3.OkHttpClient;

/** Dagger module wiring the Designate transport. */
@Module
public abstract class DesignateModule {

  static final String DESIGNATE_HTTP_CLIENT = "designateHttpClient";

  @Binds
  abstract ApiCallMetrics bindApiCallMetrics(WebhookMetrics metrics);

  @Provides
  @Singleton
  @Named(DESIGNATE_HTTP_CLIENT)
  static OkHttpClient provideDesignateHttpClient(
      @Config("connectTimeout") Duration connectTimeout,
      @Config("readTimeout") Duration readTimeout,
      OpenStackTlsSettings tlsSettings) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder().connectTimeout(connectTimeout).readTimeout(readTimeout);
    return OpenStackTlsConfigurer.configure(builder, tlsSettings).build();
  }

  @Provides
  @Singleton
  static ObjectMapper provideObjectMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Provides
  static Clock provideClock() {
    return Clock.systemUTC();
  }

  @Provides
  @Singleton
  static KeystoneAuthenticator provideKeystoneAuthenticator(
      @Named(DESIGNATE_HTTP_CLIENT) OkHttpClient httpClient,
      ObjectMapper objectMapper,
      OpenStackCredentials credentials,
      Clock clock) {
    return new KeystoneAuthenticator(httpClient, objectMapper, credentials, clock);
  }

  /** The Designate client used by the provider, with every call recorded in the metrics. */
  @Provides
  @Singleton
  static DesignateClient provideDesignateClient(
      DesignateHttpClient httpClient, ApiCallMetrics metrics) {
    return new InstrumentedDesignateClient(httpClient, metrics);
  }
}
