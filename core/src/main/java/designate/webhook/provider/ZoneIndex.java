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

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateClient;
import designate.webhook.client.DesignateException;
import designate.webhook.client.DesignateException.ZoneListingException;
import designate.webhook.client.model.Zone;
import designate.webhook.endpoint.DomainFilter;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;

/** Lists the Designate zones the webhook is allowed to manage. */
public class ZoneIndex {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String PRIMARY_ZONE_TYPE = "PRIMARY";
  static final String ACTIVE_ZONE_STATUS = "ACTIVE";

  private final DesignateClient designateClient;
  private final DomainFilter domainFilter;

  @Inject
  public ZoneIndex(DesignateClient designateClient, DomainFilter domainFilter) {
    this.designateClient = designateClient;
    this.domainFilter = domainFilter;
  }

  /**
   * Returns the managed zones, keyed by zone id, with their canonical names as values.
   *
   * <p>Secondary zones, zones that are not active and zones rejected by the domain filter are left
   * out.
   */
  public ImmutableMap<String, String> listManagedZones() throws ZoneListingException {
    Map<String, String> zones = new LinkedHashMap<>();
    try {
      designateClient.forEachZone(
          zone -> {
            if (Strings.isNullOrEmpty(zone.getId())) {
              logger.atWarning().log("Ignoring zone without id: %s", zone);
              return;
            }
            String name = canonicalizeDomainName(Strings.nullToEmpty(zone.getName()));
            if (!isEligible(zone, name)) {
              logger.atFine().log("Ignoring zone %s", zone);
            } else if (zones.putIfAbsent(zone.getId(), name) != null) {
              logger.atWarning().log("Ignoring repeated zone %s", zone);
            }
          });
    } catch (DesignateException e) {
      throw new ZoneListingException("Failed to list Designate zones", e);
    }
    return ImmutableMap.copyOf(zones);
  }

  private boolean isEligible(Zone zone, String canonicalName) {
    String type = Strings.nullToEmpty(zone.getType());
    return (type.isEmpty() || Ascii.equalsIgnoreCase(type, PRIMARY_ZONE_TYPE))
        && ACTIVE_ZONE_STATUS.equals(zone.getStatus())
        && domainFilter.matches(canonicalName);
  }
}
