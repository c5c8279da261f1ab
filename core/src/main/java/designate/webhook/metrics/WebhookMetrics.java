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

package designate.webhook.metrics;

import com.google.common.collect.ImmutableSet;
import com.google.monitoring.metrics.DistributionFitter;
import com.google.monitoring.metrics.EventMetric;
import com.google.monitoring.metrics.ExponentialFitter;
import com.google.monitoring.metrics.IncrementableMetric;
import com.google.monitoring.metrics.LabelDescriptor;
import com.google.monitoring.metrics.MetricRegistryImpl;
import com.google.monitoring.metrics.SettableMetric;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;

/** Designate API instrumentation, kept in the default metric registry. */
@Singleton
public class WebhookMetrics implements ApiCallMetrics {

  private static final ImmutableSet<LabelDescriptor> LABEL_DESCRIPTORS_FOR_CALLS =
      ImmutableSet.of(LabelDescriptor.create("method", "The Designate client method called."));

  // Allows values between 1 ms and about 17 minutes.
  private static final DistributionFitter EXPONENTIAL_FITTER =
      ExponentialFitter.create(20, 2.0, 1.0);

  private static final IncrementableMetric apiCalls =
      MetricRegistryImpl.getDefault()
          .newIncrementableMetric(
              "/designate/api_calls",
              "Count of calls to the Designate API",
              "count",
              LABEL_DESCRIPTORS_FOR_CALLS);

  private static final IncrementableMetric failedApiCalls =
      MetricRegistryImpl.getDefault()
          .newIncrementableMetric(
              "/designate/failed_api_calls",
              "Count of failed calls to the Designate API",
              "count",
              LABEL_DESCRIPTORS_FOR_CALLS);

  private static final EventMetric apiCallLatency =
      MetricRegistryImpl.getDefault()
          .newEventMetric(
              "/designate/api_call_latency",
              "Latency of calls to the Designate API",
              "milliseconds",
              LABEL_DESCRIPTORS_FOR_CALLS,
              EXPONENTIAL_FITTER);

  private static final SettableMetric<Long> connection =
      MetricRegistryImpl.getDefault()
          .newSettableMetric(
              "/designate/connection",
              "1 if the webhook is authenticated against OpenStack, 0 otherwise",
              "connected",
              ImmutableSet.of(),
              Long.class);

  @Inject
  public WebhookMetrics() {}

  @Override
  public void recordCall(String method) {
    apiCalls.increment(method);
  }

  @Override
  public void recordFailure(String method) {
    failedApiCalls.increment(method);
  }

  @Override
  public void recordLatency(String method, Duration latency) {
    apiCallLatency.record(latency.toMillis(), method);
  }

  @Override
  public void setConnected(boolean connected) {
    connection.set(connected ? 1L : 0L);
  }
}
