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

package designate.webhook.provider;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateException;
import designate.webhook.client.DesignateException.RecordListingException;
import designate.webhook.config.WebhookConfig.Config;
import designate.webhook.endpoint.Changes;
import designate.webhook.endpoint.DomainFilter;
import designate.webhook.endpoint.Endpoint;
import designate.webhook.util.StopwatchLogger;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * The external-dns provider backed by OpenStack Designate.
 *
 * <p>No state is kept between calls: every call lists the managed zones and their record sets
 * again. Calls to {@link #applyChanges} are serialized.
 */
@Singleton
public class DesignateProvider {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ZoneIndex zoneIndex;
  private final EndpointReader endpointReader;
  private final ReconcileEngine reconcileEngine;
  private final DomainFilter domainFilter;
  private final boolean dryRun;

  @Inject
  public DesignateProvider(
      ZoneIndex zoneIndex,
      EndpointReader endpointReader,
      ReconcileEngine reconcileEngine,
      DomainFilter domainFilter,
      @Config("dryRun") boolean dryRun) {
    this.zoneIndex = zoneIndex;
    this.endpointReader = endpointReader;
    this.reconcileEngine = reconcileEngine;
    this.domainFilter = domainFilter;
    this.dryRun = dryRun;
  }

  /** Returns the current A, TXT and CNAME records of all managed zones. */
  public ImmutableList<Endpoint> records() throws DesignateException {
    return endpointReader.listEndpoints();
  }

  /** Applies a batch of changes planned by external-dns. */
  public synchronized void applyChanges(Changes changes) throws DesignateException {
    if (changes.isEmpty()) {
      logger.atFine().log("No changes to apply");
      return;
    }
    StopwatchLogger stopwatch = new StopwatchLogger("applyChanges");
    ImmutableMap<String, String> zones = zoneIndex.listManagedZones();
    stopwatch.tick("listed zones");

    ImmutableList<Endpoint> currentEndpoints;
    try {
      currentEndpoints = endpointReader.listEndpoints(zones);
    } catch (RecordListingException e) {
      throw new RecordListingException("Failed to fetch active records", e);
    }
    stopwatch.tick("listed records");

    ImmutableMap<RecordSetKey, AggregatedRecordSet> recordSets =
        RecordSetAggregator.foldChanges(changes, currentEndpoints);
    logger.atInfo().log(
        "Applying %d changes to %d record sets%s",
        changes.size(), recordSets.size(), dryRun ? " (dry-run)" : "");
    reconcileEngine.apply(recordSets.values(), zones, dryRun);
    stopwatch.tick("applied changes");
  }

  /** Returns the endpoints unchanged; Designate needs no provider-specific adjustments. */
  public List<Endpoint> adjustEndpoints(List<Endpoint> endpoints) {
    return endpoints;
  }

  public DomainFilter getDomainFilter() {
    return domainFilter;
  }

  public boolean isDryRun() {
    return dryRun;
  }
}
