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

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import designate.webhook.client.DesignateClient;
import designate.webhook.client.DesignateException;
import designate.webhook.client.model.RecordSet;
import designate.webhook.client.model.RecordSetRequest;
import designate.webhook.client.model.Zone;

/** A {@link DesignateClient} that records every call in an {@link ApiCallMetrics}. */
public class InstrumentedDesignateClient implements DesignateClient {

  private final DesignateClient delegate;
  private final ApiCallMetrics metrics;
  private final Ticker ticker;

  public InstrumentedDesignateClient(DesignateClient delegate, ApiCallMetrics metrics) {
    this(delegate, metrics, Ticker.systemTicker());
  }

  InstrumentedDesignateClient(DesignateClient delegate, ApiCallMetrics metrics, Ticker ticker) {
    this.delegate = delegate;
    this.metrics = metrics;
    this.ticker = ticker;
  }

  /** A client call that may fail. */
  @FunctionalInterface
  private interface Call<T> {
    T run() throws DesignateException;
  }

  private <T> T instrument(String method, Call<T> call) throws DesignateException {
    metrics.recordCall(method);
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    try {
      return call.run();
    } catch (DesignateException e) {
      metrics.recordFailure(method);
      throw e;
    } finally {
      metrics.recordLatency(method, stopwatch.elapsed());
    }
  }

  @Override
  public void forEachZone(Handler<Zone> handler) throws DesignateException {
    instrument(
        "ForEachZone",
        () -> {
          delegate.forEachZone(handler);
          return null;
        });
  }

  @Override
  public void forEachRecordSet(String zoneId, Handler<RecordSet> handler)
      throws DesignateException {
    instrument(
        "ForEachRecordSet",
        () -> {
          delegate.forEachRecordSet(zoneId, handler);
          return null;
        });
  }

  @Override
  public String createRecordSet(String zoneId, RecordSetRequest request)
      throws DesignateException {
    return instrument("CreateRecordSet", () -> delegate.createRecordSet(zoneId, request));
  }

  @Override
  public void updateRecordSet(String zoneId, String recordSetId, RecordSetRequest request)
      throws DesignateException {
    instrument(
        "UpdateRecordSet",
        () -> {
          delegate.updateRecordSet(zoneId, recordSetId, request);
          return null;
        });
  }

  @Override
  public void deleteRecordSet(String zoneId, String recordSetId) throws DesignateException {
    instrument(
        "DeleteRecordSet",
        () -> {
          delegate.deleteRecordSet(zoneId, recordSetId);
          return null;
        });
  }
}
