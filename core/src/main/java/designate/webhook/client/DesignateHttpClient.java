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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Throwables;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateException.DesignateAuthenticationException;
import designate.webhook.client.KeystoneAuthenticator.KeystoneSession;
import designate.webhook.client.model.Page;
import designate.webhook.client.model.RecordSet;
import designate.webhook.client.model.RecordSetRequest;
import designate.webhook.client.model.Zone;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** {@link DesignateClient} speaking the Designate v2 REST API over OkHttp. */
public class DesignateHttpClient implements DesignateClient {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String AUTH_TOKEN_HEADER = "X-Auth-Token";
  private static final String API_VERSION = "v2";
  private static final MediaType JSON = MediaType.parse("application/json");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final KeystoneAuthenticator authenticator;

  @Inject
  public DesignateHttpClient(
      @Named("designateHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      KeystoneAuthenticator authenticator) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.authenticator = authenticator;
  }

  @Override
  public void forEachZone(Handler<Zone> handler) throws DesignateException {
    Optional<HttpUrl> next = Optional.of(apiUrl("zones"));
    while (next.isPresent()) {
      Page page = readPage(next.get());
      for (Zone zone : page.getZones()) {
        handler.handle(zone);
      }
      next = page.getNextPage().map(HttpUrl::get);
    }
  }

  @Override
  public void forEachRecordSet(String zoneId, Handler<RecordSet> handler)
      throws DesignateException {
    Optional<HttpUrl> next = Optional.of(apiUrl("zones", zoneId, "recordsets"));
    while (next.isPresent()) {
      Page page = readPage(next.get());
      for (RecordSet recordSet : page.getRecordSets()) {
        handler.handle(recordSet);
      }
      next = page.getNextPage().map(HttpUrl::get);
    }
  }

  @Override
  public String createRecordSet(String zoneId, RecordSetRequest request)
      throws DesignateException {
    String body =
        execute("POST", apiUrl("zones", zoneId, "recordsets"), toJsonBody(request));
    try {
      JsonNode created = objectMapper.readTree(body);
      String id = created.path("id").asText("");
      if (id.isEmpty()) {
        throw new DesignateException("Designate returned no id for the created record set");
      }
      return id;
    } catch (IOException e) {
      Throwables.throwIfInstanceOf(e, DesignateException.class);
      throw new DesignateException("Unparseable record set creation response", e);
    }
  }

  @Override
  public void updateRecordSet(String zoneId, String recordSetId, RecordSetRequest request)
      throws DesignateException {
    execute("PUT", apiUrl("zones", zoneId, "recordsets", recordSetId), toJsonBody(request));
  }

  @Override
  public void deleteRecordSet(String zoneId, String recordSetId) throws DesignateException {
    execute("DELETE", apiUrl("zones", zoneId, "recordsets", recordSetId), null);
  }

  private Page readPage(HttpUrl url) throws DesignateException {
    String body = execute("GET", url, null);
    try {
      return objectMapper.readValue(body, Page.class);
    } catch (IOException e) {
      throw new DesignateException("Unparseable Designate listing from " + url, e);
    }
  }

  private RequestBody toJsonBody(RecordSetRequest request) throws DesignateException {
    try {
      return RequestBody.create(objectMapper.writeValueAsString(request), JSON);
    } catch (IOException e) {
      throw new DesignateException("Cannot serialize " + request, e);
    }
  }

  /** Builds a URL below the versioned Designate endpoint found in the Keystone catalog. */
  private HttpUrl apiUrl(String... pathSegments) throws DesignateException {
    HttpUrl endpoint = HttpUrl.parse(authenticator.getSession().dnsEndpoint());
    if (endpoint == null) {
      throw new DesignateException(
          "Invalid Designate endpoint in the service catalog: "
              + authenticator.getSession().dnsEndpoint());
    }
    HttpUrl.Builder builder = endpoint.newBuilder();
    if (!endpoint.pathSegments().contains(API_VERSION)) {
      builder.addPathSegment(API_VERSION);
    }
    for (String segment : pathSegments) {
      builder.addPathSegment(segment);
    }
    return builder.build();
  }

  private String execute(String method, HttpUrl url, RequestBody body)
      throws DesignateException {
    return execute(method, url, body, true);
  }

  /**
   * Sends one request. A rejected token is dropped and, if {@code reauthenticate} is set, the
   * request is sent once more with a freshly issued one.
   */
  private String execute(String method, HttpUrl url, RequestBody body, boolean reauthenticate)
      throws DesignateException {
    KeystoneSession session = authenticator.getSession();
    Request request =
        new Request.Builder()
            .url(url)
            .header(AUTH_TOKEN_HEADER, session.token())
            .header("Accept", "application/json")
            .method(method, body)
            .build();
    logger.atFine().log("%s %s", method, url);
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String text = responseBody == null ? "" : responseBody.string();
      if (response.code() == HttpURLConnection.HTTP_UNAUTHORIZED) {
        authenticator.invalidate();
        if (reauthenticate) {
          logger.atInfo().log(
              "Designate rejected the auth token for %s %s, re-authenticating", method, url);
          return execute(method, url, body, false);
        }
        throw new DesignateAuthenticationException(
            String.format("Designate rejected the auth token for %s %s", method, url),
            response.code());
      }
      if (!response.isSuccessful()) {
        throw new DesignateException(
            String.format(
                "Designate request %s %s failed (%d): %s",
                method, url, response.code(), text),
            response.code(),
            null);
      }
      return text;
    } catch (IOException e) {
      Throwables.throwIfInstanceOf(e, DesignateException.class);
      throw new DesignateException(String.format("Error during %s request to %s", method, url), e);
    }
  }
}
