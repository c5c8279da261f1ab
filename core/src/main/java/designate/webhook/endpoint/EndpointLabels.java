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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Labels carrying the Designate identity of an endpoint. */
public final class EndpointLabels {

  /** Id of the Designate zone owning the record set. */
  public static final String ZONE_ID = "designate-zone-id";

  /** Id of the Designate record set; absent if the record set does not exist yet. */
  public static final String RECORD_SET_ID = "designate-recordset-id";

  /** Targets of the record set as last read from Designate, joined by a NUL character. */
  public static final String ORIGINAL_RECORDS = "designate-original-records";

  public static final char ORIGINAL_RECORDS_SEPARATOR = '\0';

  private static final Joiner JOINER = Joiner.on(ORIGINAL_RECORDS_SEPARATOR);
  private static final Splitter SPLITTER =
      Splitter.on(ORIGINAL_RECORDS_SEPARATOR).omitEmptyStrings();

  public static String joinOriginalRecords(Iterable<String> records) {
    return JOINER.join(records);
  }

  public static ImmutableList<String> splitOriginalRecords(String joined) {
    return ImmutableList.copyOf(SPLITTER.split(joined));
  }

  private EndpointLabels() {}
}
