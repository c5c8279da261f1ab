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

package designate.webhook.client;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import designate.webhook.client.DesignateException.DesignateAuthenticationException;
import designate.webhook.client.KeystoneAuthenticator.KeystoneSession;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Unit tests for {@link KeystoneAuthenticator}. */
class KeystoneAuthenticatorTest {

  private static final String AUTH_URL = "https://keystone.example.com:5000/v3";
  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private static final String CATALOG_RESPONSE =
      "{\"token\":{\"expires_at\":\"2026-01-01T01:00:00.000000Z\",\"catalog\":["
          + "{\"type\":\"identity\",\"endpoints\":[{\"interface\":\"public\","
          + "\"region_id\":\"RegionOne\",\"url\":\"https://keystone.example.com:5000\"}]},"
          + "{\"type\":\"dns\",\"endpoints\":["
          + "{\"interface\":\"internal\",\"region_id\":\"RegionOne\","
          + "\"url\":\"http://designate.internal:9001/\"},"
          + "{\"interface\":\"public\",\"region_id\":\"RegionTwo\","
          + "\"url\":\"https://two.example.com:9001/\"},"
          + "{\"interface\":\"public\",\"region\":\"RegionOne\","
          + "\"url\":\"https://one.example.com:9001/\"}]}]}}";

  private final ObjectMapper objectMapper = new ObjectMapper();

  private OkHttpClient mockHttpClient;
  private Call mockCall;
  private Clock clock;

  @BeforeEach
  void setUp() {
    mockHttpClient = mock(OkHttpClient.class);
    mockCall = mock(Call.class);
    clock = mock(Clock.class);
    when(mockHttpClient.newCall(any(Request.class))).thenReturn(mockCall);
    when(clock.instant()).thenReturn(NOW);
  }

  private static OpenStackCredentials passwordCredentials(String region, String endpointInterface) {
    return new OpenStackCredentials(
        AUTH_URL,
        "admin",
        "",
        "secret",
        "Default",
        "",
        "dns-project",
        "",
        "Default",
        "",
        "",
        "",
        region,
        endpointInterface);
  }

  private KeystoneAuthenticator authenticator(OpenStackCredentials credentials) {
    return new KeystoneAuthenticator(mockHttpClient, objectMapper, credentials, clock);
  }

  @Test
  void testConstructor_throwsOnInvalidUrl() {
    OpenStackCredentials credentials =
        new OpenStackCredentials(
            "ht tp://bad-url", "", "", "", "", "", "", "", "", "", "", "", "", "");

    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> authenticator(credentials));

    assertThat(thrown).hasMessageThat().contains("Invalid Keystone auth URL configuration");
  }

  @Test
  void testAuthenticate_sendsPasswordScopedToProject() throws Exception {
    when(mockCall.execute()).thenReturn(createResponse(201, "tok", CATALOG_RESPONSE));

    KeystoneSession session = authenticator(passwordCredentials("", "")).authenticate();

    assertThat(session.token()).isEqualTo("tok");
    assertThat(session.expiresAt()).isEqualTo(Instant.parse("2026-01-01T01:00:00Z"));
    ArgumentCaptor<Request> request = ArgumentCaptor.forClass(Request.class);
    verify(mockHttpClient).newCall(request.capture());
    assertThat(request.getValue().url().toString())
        .isEqualTo("https://keystone.example.com:5000/v3/auth/tokens");
    JsonNode auth = objectMapper.readTree(bodyOf(request.getValue())).path("auth");
    assertThat(auth.path("identity").path("methods").get(0).asText()).isEqualTo("password");
    JsonNode user = auth.path("identity").path("password").path("user");
    assertThat(user.path("name").asText()).isEqualTo("admin");
    assertThat(user.path("password").asText()).isEqualTo("secret");
    assertThat(user.path("domain").path("name").asText()).isEqualTo("Default");
    JsonNode project = auth.path("scope").path("project");
    assertThat(project.path("name").asText()).isEqualTo("dns-project");
    assertThat(project.path("domain").path("name").asText()).isEqualTo("Default");
  }

  @Test
  void testAuthenticate_sendsApplicationCredentialWithoutScope() throws Exception {
    when(mockCall.execute()).thenReturn(createResponse(201, "tok", CATALOG_RESPONSE));
    OpenStackCredentials credentials =
        new OpenStackCredentials(
            AUTH_URL, "admin", "", "secret", "", "", "", "", "", "", "app-id", "app-secret", "",
            "");

    authenticator(credentials).authenticate();

    ArgumentCaptor<Request> request = ArgumentCaptor.forClass(Request.class);
    verify(mockHttpClient).newCall(request.capture());
    JsonNode auth = objectMapper.readTree(bodyOf(request.getValue())).path("auth");
    assertThat(auth.path("identity").path("methods").get(0).asText())
        .isEqualTo("application_credential");
    assertThat(auth.path("identity").path("application_credential").path("id").asText())
        .isEqualTo("app-id");
    assertThat(auth.path("identity").has("password")).isFalse();
    assertThat(auth.has("scope")).isFalse();
  }

  @Test
  void testAuthenticate_selectsEndpointByInterfaceAndRegion() throws Exception {
    when(mockCall.execute())
        .thenAnswer(invocation -> createResponse(201, "tok", CATALOG_RESPONSE));

    assertThat(authenticator(passwordCredentials("", "")).authenticate().dnsEndpoint())
        .isEqualTo("https://two.example.com:9001/");
    assertThat(authenticator(passwordCredentials("RegionOne", "")).authenticate().dnsEndpoint())
        .isEqualTo("https://one.example.com:9001/");
    assertThat(
            authenticator(passwordCredentials("RegionOne", "internal"))
                .authenticate()
                .dnsEndpoint())
        .isEqualTo("http://designate.internal:9001/");
  }

  @Test
  void testAuthenticate_throwsWithoutDnsEndpoint() throws Exception {
    when(mockCall.execute()).thenReturn(createResponse(201, "tok", CATALOG_RESPONSE));

    DesignateException thrown =
        assertThrows(
            DesignateException.class,
            () -> authenticator(passwordCredentials("RegionThree", "")).authenticate());

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo(
            "No public endpoint for service type dns found in the Keystone catalog"
                + " (region: RegionThree)");
  }

  @Test
  void testAuthenticate_throwsOn401() throws Exception {
    when(mockCall.execute()).thenReturn(createResponse(401, null, "{}"));

    DesignateAuthenticationException thrown =
        assertThrows(
            DesignateAuthenticationException.class,
            () -> authenticator(passwordCredentials("", "")).authenticate());

    assertThat(thrown).hasMessageThat().contains("rejected");
    assertThat(thrown.getHttpStatus().getAsInt()).isEqualTo(401);
  }

  @Test
  void testAuthenticate_throwsWithoutSubjectToken() throws Exception {
    when(mockCall.execute()).thenReturn(createResponse(201, null, CATALOG_RESPONSE));

    DesignateAuthenticationException thrown =
        assertThrows(
            DesignateAuthenticationException.class,
            () -> authenticator(passwordCredentials("", "")).authenticate());

    assertThat(thrown).hasMessageThat().contains("X-Subject-Token");
  }

  @Test
  void testAuthenticate_wrapsIoException() throws Exception {
    when(mockCall.execute()).thenThrow(new IOException("Network error"));

    DesignateAuthenticationException thrown =
        assertThrows(
            DesignateAuthenticationException.class,
            () -> authenticator(passwordCredentials("", "")).authenticate());

    assertThat(thrown).hasMessageThat().isEqualTo("Error during Keystone authentication");
    assertThat(thrown).hasCauseThat().isInstanceOf(IOException.class);
  }

  @Test
  void testAuthenticate_unparseableExpiryIsShortLived() throws Exception {
    when(mockCall.execute())
        .thenReturn(
            createResponse(
                201,
                "tok",
                "{\"token\":{\"expires_at\":\"soon\",\"catalog\":[{\"type\":\"dns\","
                    + "\"endpoints\":[{\"interface\":\"public\",\"url\":\"https://d/\"}]}]}}"));

    KeystoneSession session = authenticator(passwordCredentials("", "")).authenticate();

    assertThat(session.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
  }

  @Test
  void testGetSession_cachesUntilShortlyBeforeExpiry() throws Exception {
    when(mockCall.execute())
        .thenAnswer(invocation -> createResponse(201, "tok", CATALOG_RESPONSE));
    KeystoneAuthenticator authenticator = authenticator(passwordCredentials("", ""));

    authenticator.getSession();
    when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(58)));
    authenticator.getSession();
    verify(mockHttpClient, times(1)).newCall(any(Request.class));

    when(clock.instant()).thenReturn(NOW.plus(Duration.ofMinutes(59)));
    authenticator.getSession();
    verify(mockHttpClient, times(2)).newCall(any(Request.class));
  }

  @Test
  void testInvalidate_forcesNewToken() throws Exception {
    when(mockCall.execute())
        .thenAnswer(invocation -> createResponse(201, "tok", CATALOG_RESPONSE));
    KeystoneAuthenticator authenticator = authenticator(passwordCredentials("", ""));

    authenticator.getSession();
    authenticator.invalidate();
    authenticator.getSession();

    verify(mockHttpClient, times(2)).newCall(any(Request.class));
  }

  private static String bodyOf(Request request) throws IOException {
    Buffer buffer = new Buffer();
    request.body().writeTo(buffer);
    return buffer.readUtf8();
  }

  private Response createResponse(int code, String subjectToken, String bodyContent) {
    Response.Builder builder =
        new Response.Builder()
            .request(new Request.Builder().url("http://localhost/").build())
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message("Msg")
            .body(ResponseBody.create(bodyContent, MediaType.parse("application/json")));
    if (subjectToken != null) {
      builder.header("X-Subject-Token", subjectToken);
    }
    return builder.build();
  }
}
