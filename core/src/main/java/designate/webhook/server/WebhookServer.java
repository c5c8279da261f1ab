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

package designate.webhook.server;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.HostAndPort;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A small HTTP server dispatching requests to {@link WebhookAction}s by exact path.
 *
 * <p>Unknown paths are answered with {@code 404}.
 */
public class WebhookServer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final int WORKER_THREADS = 4;
  private static final int STOP_DELAY_SECONDS = 1;

  private final String name;
  private final InetSocketAddress address;
  private final ImmutableMap<String, WebhookAction> actions;

  @Nullable private HttpServer server;
  @Nullable private ExecutorService executor;

  public WebhookServer(String name, InetSocketAddress address, Iterable<WebhookAction> actions) {
    this.name = name;
    this.address = address;
    this.actions =
        ImmutableList.copyOf(actions).stream()
            .collect(toImmutableMap(WebhookAction::path, Function.identity()));
  }

  /** Parses a {@code host:port} listen address. */
  public static InetSocketAddress parseAddress(String hostAndPort) {
    HostAndPort parsed = HostAndPort.fromString(hostAndPort);
    return new InetSocketAddress(parsed.getHost(), parsed.getPort());
  }

  public synchronized void start() throws IOException {
    checkState(server == null, "%s server already started", name);
    executor =
        Executors.newFixedThreadPool(
            WORKER_THREADS,
            new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
    server = HttpServer.create(address, 0);
    server.createContext("/", this::handle);
    server.setExecutor(executor);
    server.start();
    logger.atInfo().log("Started %s server on %s", name, getAddress());
  }

  public synchronized void stop() {
    if (server == null) {
      return;
    }
    server.stop(STOP_DELAY_SECONDS);
    executor.shutdownNow();
    server = null;
    executor = null;
    logger.atInfo().log("Stopped %s server", name);
  }

  public synchronized boolean isStarted() {
    return server != null;
  }

  /** Returns the bound address, which differs from the configured one for port 0. */
  public synchronized InetSocketAddress getAddress() {
    return server == null ? address : server.getAddress();
  }

  /** Routes a request to the action bound to its path. */
  WebhookResponse dispatch(WebhookRequest request) {
    WebhookAction action = actions.get(request.path());
    if (action == null) {
      return WebhookResponse.text(HttpURLConnection.HTTP_NOT_FOUND, "Not found: " + request.path());
    }
    try {
      return action.handle(request);
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Unexpected failure handling %s", request.path());
      return WebhookResponse.internalError("Internal error: " + e.getMessage());
    }
  }

  private void handle(HttpExchange exchange) throws IOException {
    try {
      WebhookRequest request =
          new WebhookRequest(
              exchange.getRequestMethod(),
              exchange.getRequestURI().getPath(),
              exchange.getRequestBody().readAllBytes());
      WebhookResponse response = dispatch(request);
      logger.atFine().log(
          "%s %s %s -> %d", name, request.method(), request.path(), response.status());
      exchange
          .getResponseHeaders()
          .set(WebhookResponse.CONTENT_TYPE_HEADER, response.contentType());
      byte[] payload = response.payload().getBytes(StandardCharsets.UTF_8);
      if (response.status() == HttpURLConnection.HTTP_NO_CONTENT || payload.length == 0) {
        exchange.sendResponseHeaders(response.status(), -1);
        return;
      }
      exchange.sendResponseHeaders(response.status(), payload.length);
      try (OutputStream body = exchange.getResponseBody()) {
        body.write(payload);
      }
    } finally {
      exchange.close();
    }
  }
}
