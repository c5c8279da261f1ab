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

import java.util.Map;
import java.util.Optional;

/** Selects the zone owning a host name. */
public final class ZoneMatcher {

  /**
   * Returns the id of the zone with the longest name that is a suffix of the host name.
   *
   * <p>Both the host name and the zone names must be canonical. The suffix has to start at a label
   * boundary, so {@code first-test.example.com.} belongs to {@code example.com.} and never to
   * {@code test.example.com.}.
   */
  public static Optional<String> matchZone(String canonicalHostname, Map<String, String> zones) {
    String bestZoneId = null;
    int bestLength = 0;
    for (Map.Entry<String, String> zone : zones.entrySet()) {
      String zoneName = zone.getValue();
      if (zoneName.length() > bestLength && isSuffix(canonicalHostname, zoneName)) {
        bestZoneId = zone.getKey();
        bestLength = zoneName.length();
      }
    }
    return Optional.ofNullable(bestZoneId);
  }

  private static boolean isSuffix(String hostname, String zoneName) {
    if (!hostname.endsWith(zoneName)) {
      return false;
    }
    int boundary = hostname.length() - zoneName.length();
    return boundary == 0 || hostname.charAt(boundary - 1) == '.';
  }

  private ZoneMatcher() {}
}
