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

import static designate.webhook.util.DomainNameUtils.canonicalizeDomainName;
import static designate.webhook.util.DomainNameUtils.canonicalizeDomainNames;

import com.google.common.collect.ImmutableMap;
import designate.webhook.endpoint.Changes;
import designate.webhook.endpoint.Endpoint;
import designate.webhook.endpoint.EndpointLabels;
import designate.webhook.endpoint.RecordTypes;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a batch of endpoint changes into one {@link AggregatedRecordSet} per host name and type.
 *
 * <p>The phases are replayed in a fixed order: creates, update-olds, update-news, deletes. Every
 * record set starts from the targets Designate held when the batch was planned, so targets the
 * batch does not mention are kept. This relies on external-dns pairing each update-old with the
 * update-new of the same name and type.
 */
public final class RecordSetAggregator {

  /**
   * Returns the desired record sets, in the order their host name and type first appear in the
   * batch.
   *
   * @param currentEndpoints the endpoints just read from Designate, used to recover the identity
   *     labels of changes that lost them
   */
  public static ImmutableMap<RecordSetKey, AggregatedRecordSet> foldChanges(
      Changes changes, List<Endpoint> currentEndpoints) {
    Map<RecordSetKey, AggregatedRecordSet> recordSets = new LinkedHashMap<>();
    fold(changes.create(), true, recordSets, currentEndpoints);
    fold(changes.updateOld(), false, recordSets, currentEndpoints);
    fold(changes.updateNew(), true, recordSets, currentEndpoints);
    fold(changes.delete(), false, recordSets, currentEndpoints);
    return ImmutableMap.copyOf(recordSets);
  }

  private static void fold(
      List<Endpoint> endpoints,
      boolean wanted,
      Map<RecordSetKey, AggregatedRecordSet> recordSets,
      List<Endpoint> currentEndpoints) {
    for (Endpoint endpoint : endpoints) {
      addEndpoint(withIdentityLabels(endpoint, currentEndpoints), wanted, recordSets);
    }
  }

  private static void addEndpoint(
      Endpoint endpoint, boolean wanted, Map<RecordSetKey, AggregatedRecordSet> recordSets) {
    RecordSetKey key =
        new RecordSetKey(canonicalizeDomainName(endpoint.dnsName()), endpoint.recordType());
    AggregatedRecordSet recordSet =
        recordSets.computeIfAbsent(key, k -> new AggregatedRecordSet(k, endpoint.recordTTL()));
    recordSet.fillIdentity(
        endpoint.getLabel(EndpointLabels.ZONE_ID),
        endpoint.getLabel(EndpointLabels.RECORD_SET_ID));
    endpoint
        .getLabel(EndpointLabels.ORIGINAL_RECORDS)
        .map(EndpointLabels::splitOriginalRecords)
        .ifPresent(records -> records.forEach(recordSet::addBaseline));

    List<String> targets =
        RecordTypes.CNAME.equals(endpoint.recordType())
            ? canonicalizeDomainNames(endpoint.targets())
            : endpoint.targets();
    for (String target : targets) {
      recordSet.mark(target, wanted);
    }
  }

  /**
   * Returns the endpoint with its missing zone and record set ids copied from the current endpoint
   * with the same type and the same raw host name. The inputs are left untouched.
   */
  static Endpoint withIdentityLabels(Endpoint endpoint, List<Endpoint> currentEndpoints) {
    boolean hasZoneId = endpoint.hasLabel(EndpointLabels.ZONE_ID);
    boolean hasRecordSetId = endpoint.hasLabel(EndpointLabels.RECORD_SET_ID);
    if (hasZoneId && hasRecordSetId) {
      return endpoint;
    }
    for (Endpoint current : currentEndpoints) {
      if (current.recordType().equals(endpoint.recordType())
          && current.dnsName().equals(endpoint.dnsName())) {
        Map<String, String> recovered = new LinkedHashMap<>();
        if (!hasZoneId) {
          current.getLabel(EndpointLabels.ZONE_ID)
              .ifPresent(id -> recovered.put(EndpointLabels.ZONE_ID, id));
        }
        if (!hasRecordSetId) {
          current.getLabel(EndpointLabels.RECORD_SET_ID)
              .ifPresent(id -> recovered.put(EndpointLabels.RECORD_SET_ID, id));
        }
        return endpoint.withLabels(recovered);
      }
    }
    return endpoint;
  }

  private RecordSetAggregator() {}
}
