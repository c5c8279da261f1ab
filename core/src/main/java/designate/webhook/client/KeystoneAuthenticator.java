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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.flogger.FluentLogger;
import designate.webhook.client.DesignateException.DesignateAuthenticationException;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Obtains Keystone v3 tokens and locates the Designate endpoint in the service catalog.
 *
 * <p>The token is cached and transparently re-issued shortly before it expires, or after Designate
 * reported it as invalid.
 */
public class KeystoneAuthenticator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String TOKENS_PATH = "auth/tokens";
  private static final String SUBJECT_TOKEN_HEADER = "X-Subject-Token";
  private static final String DNS_SERVICE_TYPE = "dns";
  private static final MediaType JSON = MediaType.parse("application/json");
  private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(1);

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final OpenStackCredentials credentials;
  private final Clock clock;

  @Nullable private KeystoneSession session;

  public KeystoneAuthenticator(
      OkHttpClient httpClient,
      ObjectMapper objectMapper,
      OpenStackCredentials credentials,
      Clock clock) {
    checkArgument(
        !isNullOrEmpty(credentials.authUrl()) && HttpUrl.parse(credentials.authUrl()) != null,
        "Invalid Keystone auth URL configuration: %s",
        credentials.authUrl());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.credentials = credentials;
    this.clock = clock;
  }

  /** An issued token and the Designate endpoint found in its catalog. */
  public record KeystoneSession(String token, String dnsEndpoint, Instant expiresAt) {}

  /** Returns a valid session, authenticating first if there is none or it is about to expire. */
  public synchronized KeystoneSession getSession() throws DesignateException {
    if (session == null || !clock.instant().plus(EXPIRY_MARGIN).isBefore(session.expiresAt())) {
      session = authenticate();
    }
    return session;
  }

  /** Drops the cached token so that the next call re-authenticates. */
  public synchronized void invalidate() {
    session = null;
  }

  @VisibleForTesting
  KeystoneSession authenticate() throws DesignateException {
    HttpUrl url =
        HttpUrl.get(credentials.authUrl()).newBuilder().addPathSegments(TOKENS_PATH).build();
    logger.atInfo().log("Authenticating at OpenStack Keystone %s", url);
    Request request =
        new Request.Builder()
            .url(url)
            .post(RequestBody.create(buildAuthRequest().toString(), JSON))
            .build();
    try (Response response = httpClient.newCall(request).execute()) {
      String body = Objects.requireNonNull(response.body()).string();
      if (response.code() == HttpURLConnection.HTTP_UNAUTHORIZED) {
        throw new DesignateAuthenticationException(
            "Keystone rejected the configured credentials", response.code());
      }
      if (!response.isSuccessful()) {
        throw new DesignateException(
            String.format("Keystone authentication failed (%d): %s", response.code(), body),
            response.code(),
            null);
      }
      String token = response.header(SUBJECT_TOKEN_HEADER);
      if (isNullOrEmpty(token)) {
        throw new DesignateAuthenticationException(
            "Keystone response carries no " + SUBJECT_TOKEN_HEADER + " header", response.code());
      }
      JsonNode tokenNode = objectMapper.readTree(body).path("token");
      KeystoneSession newSession =
          new KeystoneSession(token, findDnsEndpoint(tokenNode), parseExpiry(tokenNode));
      logger.atInfo().log("Found OpenStack Designate service at %s", newSession.dnsEndpoint());
      return newSession;
    } catch (IOException | RuntimeException e) {
      Throwables.throwIfInstanceOf(e, DesignateException.class);
      throw new DesignateAuthenticationException("Error during Keystone authentication", e);
    }
  }

  private ObjectNode buildAuthRequest() {
    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode auth = root.putObject("auth");
    ObjectNode identity = auth.putObject("identity");
    if (credentials.usesApplicationCredential()) {
      identity.putArray("methods").add("application_credential");
      identity
          .putObject("application_credential")
          .put("id", credentials.applicationCredentialId())
          .put("secret", credentials.applicationCredentialSecret());
      // Application credentials carry their own project scope.
      return root;
    }
    identity.putArray("methods").add("password");
    ObjectNode user = identity.putObject("password").putObject("user");
    if (!isNullOrEmpty(credentials.userId())) {
      user.put("id", credentials.userId());
    } else {
      user.put("name", credentials.username());
      putDomain(user, credentials.userDomainName(), credentials.userDomainId());
    }
    user.put("password", credentials.password());

    ObjectNode project = auth.putObject("scope").putObject("project");
    if (!isNullOrEmpty(credentials.projectId())) {
      project.put("id", credentials.projectId());
    } else {
      project.put("name", credentials.projectName());
      putDomain(project, credentials.projectDomainName(), credentials.projectDomainId());
    }
    return root;
  }

  private static void putDomain(ObjectNode parent, String domainName, String domainId) {
    if (!isNullOrEmpty(domainId)) {
      parent.putObject("domain").put("id", domainId);
    } else if (!isNullOrEmpty(domainName)) {
      parent.putObject("domain").put("name", domainName);
    }
  }

  private String findDnsEndpoint(JsonNode tokenNode) throws DesignateException {
    String wantedInterface = credentials.endpointInterfaceOrDefault();
    String wantedRegion = credentials.regionName();
    for (JsonNode service : tokenNode.path("catalog")) {
      if (!DNS_SERVICE_TYPE.equals(service.path("type").asText())) {
        continue;
      }
      for (JsonNode endpoint : service.path("endpoints")) {
        if (!wantedInterface.equals(endpoint.path("interface").asText())) {
          continue;
        }
        if (!isNullOrEmpty(wantedRegion)
            && !wantedRegion.equals(endpoint.path("region_id").asText())
            && !wantedRegion.equals(endpoint.path("region").asText())) {
          continue;
        }
        return endpoint.path("url").asText();
      }
    }
    throw new DesignateException(
        String.format(
            "No %s endpoint for service type %s found in the Keystone catalog (region: %s)",
            wantedInterface, DNS_SERVICE_TYPE, isNullOrEmpty(wantedRegion) ? "any" : wantedRegion));
  }

  private Instant parseExpiry(JsonNode tokenNode) {
    String expiresAt = tokenNode.path("expires_at").asText("");
    try {
      return Instant.parse(expiresAt);
    } catch (DateTimeParseException e) {
      // Without a parseable expiry the token is only trusted for a short while.
      logger.atWarning().log("Unparseable Keystone token expiry '%s'", expiresAt);
      return clock.instant().plus(EXPIRY_MARGIN.multipliedBy(5));
    }
  }
}
