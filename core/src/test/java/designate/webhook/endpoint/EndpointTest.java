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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link Endpoint} and {@link Changes}. */
class EndpointTest {

  private final Gson gson = new GsonBuilder().excludeFieldsWithoutExposeAnnotation().create();

  @Test
  void testNewEndpointWithTtl_stripsTrailingDots() {
    Endpoint endpoint =
        Endpoint.newEndpointWithTtl(
            "db.test.net.", RecordTypes.CNAME, 60, ImmutableList.of("sql.test.net.", "plain"));

    assertThat(endpoint.dnsName()).isEqualTo("db.test.net");
    assertThat(endpoint.targets()).containsExactly("sql.test.net", "plain").inOrder();
    assertThat(endpoint.recordTTL()).isEqualTo(60L);
    assertThat(endpoint.labels()).isEmpty();
  }

  @Test
  void testWithLabels_returnsCopy() {
    Endpoint endpoint =
        Endpoint.create("www.example.com", RecordTypes.A, 0, ImmutableMap.of("a", "1"), "1.2.3.4");

    Endpoint labeled = endpoint.withLabels(ImmutableMap.of("a", "2", "b", "3"));

    assertThat(labeled.labels()).containsExactly("a", "2", "b", "3");
    assertThat(endpoint.labels()).containsExactly("a", "1");
    assertThat(labeled.getLabel("b")).hasValue("3");
    assertThat(labeled.getLabel("c")).isEmpty();
    assertThat(labeled.hasLabel("a")).isTrue();
  }

  @Test
  void testIsTtlConfigured() {
    assertThat(Endpoint.create("a", RecordTypes.A, 0, ImmutableMap.of()).isTtlConfigured())
        .isFalse();
    assertThat(Endpoint.create("a", RecordTypes.A, 300, ImmutableMap.of()).isTtlConfigured())
        .isTrue();
  }

  @Test
  void testJson_parsesExternalDnsEndpoint() {
    List<Endpoint> endpoints =
        gson.fromJson(
            "[{\"dnsName\":\"www.example.com\",\"targets\":[\"1.2.3.4\"],\"recordType\":\"A\","
                + "\"recordTTL\":300,\"labels\":{\"owner\":\"default\"},"
                + "\"providerSpecific\":[{\"name\":\"alias\",\"value\":\"false\"}]},"
                + "{\"dnsName\":\"bare.example.com\",\"recordType\":\"TXT\"}]",
            new TypeToken<List<Endpoint>>() {}.getType());

    assertThat(endpoints).hasSize(2);
    Endpoint full = endpoints.get(0);
    assertThat(full.dnsName()).isEqualTo("www.example.com");
    assertThat(full.targets()).containsExactly("1.2.3.4");
    assertThat(full.recordTTL()).isEqualTo(300L);
    assertThat(full.labels()).containsExactly("owner", "default");
    assertThat(full.providerSpecific())
        .containsExactly(new Endpoint.ProviderSpecificProperty("alias", "false"));
    Endpoint bare = endpoints.get(1);
    assertThat(bare.targets()).isEmpty();
    assertThat(bare.labels()).isEmpty();
    assertThat(bare.setIdentifier()).isEmpty();
    assertThat(bare.recordTTL()).isEqualTo(0L);
  }

  @Test
  void testJson_parsesChangesAndDefaultsMissingPhases() {
    Changes changes =
        gson.fromJson(
            "{\"Create\":[{\"dnsName\":\"a.example.com\",\"targets\":[\"1.1.1.1\"],"
                + "\"recordType\":\"A\"}],\"UpdateOld\":null,"
                + "\"Delete\":[{\"dnsName\":\"b.example.com\",\"targets\":[\"2.2.2.2\"],"
                + "\"recordType\":\"A\"}]}",
            Changes.class);

    assertThat(changes.create()).hasSize(1);
    assertThat(changes.create().get(0).dnsName()).isEqualTo("a.example.com");
    assertThat(changes.updateOld()).isEmpty();
    assertThat(changes.updateNew()).isEmpty();
    assertThat(changes.delete()).hasSize(1);
    assertThat(changes.size()).isEqualTo(2);
    assertThat(changes.isEmpty()).isFalse();
  }

  @Test
  void testJson_writesExternalDnsFieldNames() {
    Endpoint endpoint =
        Endpoint.create("www.example.com", RecordTypes.A, 60, ImmutableMap.of(), "1.2.3.4");

    assertThat(gson.toJson(endpoint))
        .isEqualTo(
            "{\"dnsName\":\"www.example.com\",\"targets\":[\"1.2.3.4\"],\"recordType\":\"A\","
                + "\"setIdentifier\":\"\",\"recordTTL\":60,\"labels\":{},"
                + "\"providerSpecific\":[]}");
  }

  @Test
  void testOriginalRecordsLabel_roundTripsTargets() {
    String joined = EndpointLabels.joinOriginalRecords(ImmutableList.of("10.0.0.1", "10.0.0.2"));

    assertThat(joined).isEqualTo("10.0.0.1\u000010.0.0.2");
    assertThat(EndpointLabels.splitOriginalRecords(joined))
        .containsExactly("10.0.0.1", "10.0.0.2")
        .inOrder();
    assertThat(EndpointLabels.splitOriginalRecords("")).isEmpty();
  }
}
