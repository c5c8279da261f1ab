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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The desired state of one record set, folded from all changes touching its host name and type.
 *
 * <p>Each target known for the record set is flagged as wanted or not. Only the fold in {@link
 * RecordSetAggregator} mutates an instance.
 */
public final class AggregatedRecordSet {

  private final RecordSetKey key;
  private String zoneId = "";
  private String recordSetId = "";
  private final long ttl;
  private final Map<String, Boolean> targets = new LinkedHashMap<>();

  AggregatedRecordSet(RecordSetKey key, long ttl) {
    this.key = key;
    this.ttl = ttl;
  }

  public RecordSetKey getKey() {
    return key;
  }

  public String getDnsName() {
    return key.dnsName();
  }

  public String getRecordType() {
    return key.recordType();
  }

  /** Returns the owning zone id, or an empty string if it is not known yet. */
  public String getZoneId() {
    return zoneId;
  }

  /** Returns the Designate record set id, or an empty string if the record set does not exist. */
  public String getRecordSetId() {
    return recordSetId;
  }

  public long getTtl() {
    return ttl;
  }

  public ImmutableMap<String, Boolean> getTargets() {
    return ImmutableMap.copyOf(targets);
  }

  /** Returns the wanted targets in lexicographic order. */
  public ImmutableList<String> wantedRecords() {
    return targets.entrySet().stream()
        .filter(Map.Entry::getValue)
        .map(Map.Entry::getKey)
        .sorted()
        .collect(toImmutableList());
  }

  void fillIdentity(Optional<String> zoneIdLabel, Optional<String> recordSetIdLabel) {
    if (zoneId.isEmpty()) {
      zoneId = Strings.nullToEmpty(zoneIdLabel.orElse(null));
    }
    if (recordSetId.isEmpty()) {
      recordSetId = Strings.nullToEmpty(recordSetIdLabel.orElse(null));
    }
  }

  void addBaseline(String target) {
    if (!target.isEmpty()) {
      targets.putIfAbsent(target, true);
    }
  }

  void mark(String target, boolean wanted) {
    targets.put(target, wanted);
  }

  @Override
  public String toString() {
    return String.format(
        "%s (zone=%s, recordset=%s, ttl=%d, targets=%s)", key, zoneId, recordSetId, ttl, targets);
  }
}
