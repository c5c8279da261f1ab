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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Body of a record set create or update request.
 *
 * <p>Name and type are only sent on create. A TTL of zero is never sent, so that Designate applies
 * the zone default on create and keeps the current value on update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordSetRequest {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("type")
  private final String type;

  @JsonProperty("records")
  private final ImmutableList<String> records;

  @JsonProperty("ttl")
  private final Integer ttl;

  private RecordSetRequest(
      @Nullable String name, @Nullable String type, List<String> records, long ttl) {
    this.name = name;
    this.type = type;
    this.records = ImmutableList.copyOf(records);
    this.ttl = ttl > 0 ? Math.toIntExact(ttl) : null;
  }

  public static RecordSetRequest forCreate(
      String name, String type, List<String> records, long ttl) {
    return new RecordSetRequest(name, type, records, ttl);
  }

  public static RecordSetRequest forUpdate(List<String> records, long ttl) {
    return new RecordSetRequest(null, null, records, ttl);
  }

  @Nullable
  public String getName() {
    return name;
  }

  @Nullable
  public String getType() {
    return type;
  }

  public ImmutableList<String> getRecords() {
    return records;
  }

  @Nullable
  public Integer getTtl() {
    return ttl;
  }

  @Override
  public String toString() {
    return String.format(
        "RecordSetRequest{name=%s, type=%s, records=%s, ttl=%s}", name, type, records, ttl);
  }
}
