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

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import designate.webhook.endpoint.Endpoint;
import designate.webhook.provider.DesignateProvider;
import jakarta.inject.Inject;
import java.lang.reflect.Type;
import java.util.List;

/** Lets the provider adjust the endpoints external-dns is about to plan with. */
public class AdjustEndpointsAction implements WebhookAction {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String PATH = "/adjustendpoints";

  private static final Type ENDPOINT_LIST_TYPE = new TypeToken<List<Endpoint>>() {}.getType();

  private final DesignateProvider provider;
  private final Gson gson;

  @Inject
  public AdjustEndpointsAction(DesignateProvider provider, Gson gson) {
    this.provider = provider;
    this.gson = gson;
  }

  @Override
  public String path() {
    return PATH;
  }

  @Override
  public WebhookResponse handle(WebhookRequest request) {
    if (!request.isMethod("POST")) {
      return WebhookResponse.methodNotAllowed(request.method());
    }
    List<Endpoint> endpoints;
    try {
      endpoints = gson.fromJson(request.bodyAsString(), ENDPOINT_LIST_TYPE);
    } catch (JsonParseException e) {
      logger.atWarning().withCause(e).log("Malformed endpoints");
      return WebhookResponse.badRequest("Malformed endpoints: " + e.getMessage());
    }
    if (endpoints == null) {
      return WebhookResponse.badRequest("Missing endpoints");
    }
    return WebhookResponse.json(gson.toJson(provider.adjustEndpoints(endpoints)));
  }
}
