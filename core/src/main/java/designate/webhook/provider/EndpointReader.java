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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateClient;
import designate.webhook.client.DesignateException;
import designate.webhook.client.DesignateException.RecordListingException;
import designate.webhook.client.model.RecordSet;
import designate.webhook.endpoint.Endpoint;
import designate.webhook.endpoint.EndpointLabels;
import designate.webhook.endpoint.RecordTypes;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.Objects;

/** Reads the A, TXT and CNAME record sets of all managed zones as endpoints. */
public class EndpointReader {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DesignateClient designateClient;
  private final ZoneIndex zoneIndex;

  @Inject
  public EndpointReader(DesignateClient designateClient, ZoneIndex zoneIndex) {
    this.designateClient = designateClient;
    this.zoneIndex = zoneIndex;
  }

  /** Lists the endpoints of every managed zone. */
  public ImmutableList<Endpoint> listEndpoints() throws DesignateException {
    return listEndpoints(zoneIndex.listManagedZones());
  }

  /**
   * Lists the endpoints of the given zones.
   *
   * <p>Every endpoint carries the zone id, the record set id and the original records of the
   * record set it was read from. Any listing failure discards the partial result.
   */
  public ImmutableList<Endpoint> listEndpoints(Map<String, String> zones)
      throws RecordListingException {
    ImmutableList.Builder<Endpoint> endpoints = new ImmutableList.Builder<>();
    for (Map.Entry<String, String> zone : zones.entrySet()) {
      try {
        designateClient.forEachRecordSet(
            zone.getKey(),
            recordSet -> {
              if (!RecordTypes.isSupported(recordSet.getType())) {
                return;
              }
              if (Strings.isNullOrEmpty(recordSet.getId())
                  || Strings.isNullOrEmpty(recordSet.getName())) {
                logger.atWarning().log("Ignoring record set without id or name: %s", recordSet);
                return;
              }
              endpoints.add(toEndpoint(zone.getKey(), recordSet));
            });
      } catch (DesignateException e) {
        throw new RecordListingException(
            String.format(
                "Failed to list record sets of zone %s (%s)", zone.getValue(), zone.getKey()),
            e);
      }
    }
    ImmutableList<Endpoint> result = endpoints.build();
    logger.atFine().log("Read %d endpoints from %d zones", result.size(), zones.size());
    return result;
  }

  private static Endpoint toEndpoint(String zoneId, RecordSet recordSet) {
    String recordSetZoneId =
        Strings.isNullOrEmpty(recordSet.getZoneId()) ? zoneId : recordSet.getZoneId();
    long ttl = recordSet.getTtl() == null ? Endpoint.TTL_NOT_CONFIGURED : recordSet.getTtl();
    ImmutableList<String> records =
        recordSet.getRecords() == null
            ? ImmutableList.of()
            : recordSet.getRecords().stream().filter(Objects::nonNull).collect(toImmutableList());
    return Endpoint.newEndpointWithTtl(recordSet.getName(), recordSet.getType(), ttl, records)
        .withLabels(
            ImmutableMap.of(
                EndpointLabels.RECORD_SET_ID, recordSet.getId(),
                EndpointLabels.ZONE_ID, recordSetZoneId,
                EndpointLabels.ORIGINAL_RECORDS, EndpointLabels.joinOriginalRecords(records)));
  }
}
