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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainFilter}. */
class DomainFilterTest {

  @Test
  void testAcceptAll() {
    DomainFilter filter = DomainFilter.acceptAll();

    assertThat(filter.isConfigured()).isFalse();
    assertThat(filter.matches("example.com.")).isTrue();
    assertThat(filter.matches("anything")).isTrue();
  }

  @Test
  void testPlainFilter_acceptsDomainAndSubdomains() {
    DomainFilter filter = DomainFilter.of(ImmutableList.of("Example.com."));

    assertThat(filter.getInclude()).containsExactly("example.com");
    assertThat(filter.matches("example.com.")).isTrue();
    assertThat(filter.matches("www.EXAMPLE.com")).isTrue();
    assertThat(filter.matches("badexample.com")).isFalse();
    assertThat(filter.matches("example.org.")).isFalse();
  }

  @Test
  void testLeadingDotFilter_acceptsOnlySubdomains() {
    DomainFilter filter = DomainFilter.of(ImmutableList.of(".example.com"));

    assertThat(filter.matches("www.example.com.")).isTrue();
    assertThat(filter.matches("example.com.")).isFalse();
  }

  @Test
  void testExclusionWins() {
    DomainFilter filter =
        new DomainFilter(
            ImmutableList.of("example.com"), ImmutableList.of("internal.example.com"), "", "");

    assertThat(filter.matches("www.example.com.")).isTrue();
    assertThat(filter.matches("internal.example.com.")).isFalse();
    assertThat(filter.matches("db.internal.example.com.")).isFalse();
  }

  @Test
  void testExclusionOnly() {
    DomainFilter filter =
        new DomainFilter(ImmutableList.of(), ImmutableList.of("test.net"), null, null);

    assertThat(filter.isConfigured()).isTrue();
    assertThat(filter.matches("example.com.")).isTrue();
    assertThat(filter.matches("test.net.")).isFalse();
  }

  @Test
  void testRegexReplacesPlainLists() {
    DomainFilter filter =
        new DomainFilter(
            ImmutableList.of("example.com"), ImmutableList.of(), "\\.net$", "^skip\\.");

    assertThat(filter.matches("example.com.")).isFalse();
    assertThat(filter.matches("test.net.")).isTrue();
    assertThat(filter.matches("skip.test.net.")).isFalse();
  }

  @Test
  void testInvalidRegex_throws() {
    assertThrows(
        PatternSyntaxException.class,
        () -> new DomainFilter(ImmutableList.of(), ImmutableList.of(), "(", ""));
  }

  @Test
  void testJson_exposesFilterFields() {
    Gson gson = new GsonBuilder().excludeFieldsWithoutExposeAnnotation().create();

    String json =
        gson.toJson(
            new DomainFilter(
                ImmutableList.of("example.com"), ImmutableList.of("test.net"), "", ""));

    assertThat(json)
        .isEqualTo(
            "{\"include\":[\"example.com\"],\"exclude\":[\"test.net\"],"
                + "\"regexInclude\":\"\",\"regexExclude\":\"\"}");
  }
}
