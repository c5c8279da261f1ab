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

package designate.webhook.endpoint;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static designate.webhook.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.annotations.Expose;
import designate.webhook.util.DomainNameUtils;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single logical DNS fact as exchanged with external-dns: a host name, a record type, the
 * target values and a TTL, plus free-form labels.
 *
 * <p>The JSON field names match the external-dns webhook wire format.
 *
 * @param recordTTL the TTL in seconds, or {@code 0} if the zone default should be used
 */
public record Endpoint(
    @Expose String dnsName,
    @Expose List<String> targets,
    @Expose String recordType,
    @Expose String setIdentifier,
    @Expose long recordTTL,
    @Expose Map<String, String> labels,
    @Expose List<ProviderSpecificProperty> providerSpecific) {

  /** Value of a TTL that was not configured. */
  public static final long TTL_NOT_CONFIGURED = 0;

  public Endpoint {
    dnsName = Strings.nullToEmpty(dnsName);
    targets = nullToEmptyImmutableCopy(targets);
    recordType = Strings.nullToEmpty(recordType);
    setIdentifier = Strings.nullToEmpty(setIdentifier);
    labels = nullToEmptyImmutableCopy(labels);
    providerSpecific = nullToEmptyImmutableCopy(providerSpecific);
  }

  /** Creates an endpoint with the given name and targets kept exactly as supplied. */
  public static Endpoint create(
      String dnsName, String recordType, long ttl, Map<String, String> labels, String... targets) {
    return new Endpoint(
        dnsName,
        Arrays.asList(targets),
        recordType,
        "",
        ttl,
        labels,
        ImmutableList.of());
  }

  /**
   * Creates an endpoint from names as they appear in DNS, stripping the trailing dot from the
   * host name and from every target.
   */
  public static Endpoint newEndpointWithTtl(
      String dnsName, String recordType, long ttl, List<String> targets) {
    return new Endpoint(
        DomainNameUtils.stripTrailingDot(dnsName),
        targets.stream().map(DomainNameUtils::stripTrailingDot).collect(toImmutableList()),
        recordType,
        "",
        ttl,
        ImmutableMap.of(),
        ImmutableList.of());
  }

  /** Returns the value of the given label, if set. */
  public Optional<String> getLabel(String key) {
    return Optional.ofNullable(labels.get(key));
  }

  public boolean hasLabel(String key) {
    return labels.containsKey(key);
  }

  public boolean isTtlConfigured() {
    return recordTTL > TTL_NOT_CONFIGURED;
  }

  /** Returns a copy of this endpoint with the given labels added or replaced. */
  public Endpoint withLabels(Map<String, String> newLabels) {
    Map<String, String> merged = new LinkedHashMap<>(labels);
    merged.putAll(newLabels);
    return new Endpoint(
        dnsName, targets, recordType, setIdentifier, recordTTL, merged, providerSpecific);
  }

  @Override
  public String toString() {
    return String.format("%s %d IN %s %s %s", dnsName, recordTTL, recordType, targets, labels);
  }

  /** A provider-specific key/value attached to an endpoint by external-dns. */
  public record ProviderSpecificProperty(@Expose String name, @Expose String value) {}
}
