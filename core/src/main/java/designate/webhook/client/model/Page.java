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

package designate.webhook.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** One page of a Designate collection listing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Page {
  @JsonProperty("zones")
  private List<Zone> zones = new ArrayList<>();

  @JsonProperty("recordsets")
  private List<RecordSet> recordSets = new ArrayList<>();

  @JsonProperty("links")
  private Links links = new Links();

  public List<Zone> getZones() {
    return zones;
  }

  public void setZones(List<Zone> zones) {
    this.zones = zones;
  }

  public List<RecordSet> getRecordSets() {
    return recordSets;
  }

  public void setRecordSets(List<RecordSet> recordSets) {
    this.recordSets = recordSets;
  }

  public Links getLinks() {
    return links;
  }

  public void setLinks(Links links) {
    this.links = links;
  }

  /** The URL of the next page, absent on the last page. */
  public Optional<String> getNextPage() {
    return links == null ? Optional.empty() : Optional.ofNullable(links.next);
  }

  /** Navigation links of a page. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Links {
    @JsonProperty("self")
    public String self;

    @JsonProperty("next")
    public String next;
  }
}
