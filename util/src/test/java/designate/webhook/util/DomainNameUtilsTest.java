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

package designate.webhook.util;

import static com.google.common.truth.Truth.assertThat;
import static designate.webhook.util.DomainNameUtils.canonicalizeDomainName;
import static designate.webhook.util.DomainNameUtils.canonicalizeDomainNames;
import static designate.webhook.util.DomainNameUtils.stripTrailingDot;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainNameUtils}. */
class DomainNameUtilsTest {

  @Test
  void testCanonicalize_appendsTrailingDot() {
    assertThat(canonicalizeDomainName("www.example.com")).isEqualTo("www.example.com.");
  }

  @Test
  void testCanonicalize_keepsExistingTrailingDot() {
    assertThat(canonicalizeDomainName("www.example.com.")).isEqualTo("www.example.com.");
  }

  @Test
  void testCanonicalize_lowerCases() {
    assertThat(canonicalizeDomainName("WWW.Example.COM")).isEqualTo("www.example.com.");
  }

  @Test
  void testCanonicalizeList_handlesMixedInput() {
    assertThat(canonicalizeDomainNames(ImmutableList.of("sql.test.net", "Db.Test.Net.")))
        .containsExactly("sql.test.net.", "db.test.net.")
        .inOrder();
  }

  @Test
  void testStripTrailingDot() {
    assertThat(stripTrailingDot("example.com.")).isEqualTo("example.com");
    assertThat(stripTrailingDot("example.com")).isEqualTo("example.com");
    assertThat(stripTrailingDot("")).isEmpty();
  }
}
