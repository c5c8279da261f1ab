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

import com.google.common.collect.ImmutableSet;

/** DNS record types understood by the webhook. */
public final class RecordTypes {

  public static final String A = "A";
  public static final String TXT = "TXT";
  public static final String CNAME = "CNAME";

  /** Record types that are read and written; all others are invisible to the webhook. */
  public static final ImmutableSet<String> SUPPORTED = ImmutableSet.of(A, TXT, CNAME);

  public static boolean isSupported(String recordType) {
    return SUPPORTED.contains(recordType);
  }

  private RecordTypes() {}
}
