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
import designate.webhook.client.DesignateException;
import designate.webhook.endpoint.Changes;
import designate.webhook.provider.DesignateProvider;
import jakarta.inject.Inject;

/** Lists the current records ({@code GET}) or applies a batch of changes ({@code POST}). */
public class RecordsAction implements WebhookAction {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String PATH = "/records";

  private final DesignateProvider provider;
  private final Gson gson;

  @Inject
  public RecordsAction(DesignateProvider provider, Gson gson) {
    this.provider = provider;
    this.gson = gson;
  }

  @Override
  public String path() {
    return PATH;
  }

  @Override
  public WebhookResponse handle(WebhookRequest request) {
    if (request.isMethod("GET")) {
      return getRecords();
    }
    if (request.isMethod("POST")) {
      return applyChanges(request);
    }
    return WebhookResponse.methodNotAllowed(request.method());
  }

  private WebhookResponse getRecords() {
    try {
      return WebhookResponse.json(gson.toJson(provider.records()));
    } catch (DesignateException e) {
      logger.atSevere().withCause(e).log("Failed to list records");
      return WebhookResponse.internalError(e.getMessage());
    }
  }

  private WebhookResponse applyChanges(WebhookRequest request) {
    Changes changes;
    try {
      changes = gson.fromJson(request.bodyAsString(), Changes.class);
    } catch (JsonParseException e) {
      logger.atWarning().withCause(e).log("Malformed changes");
      return WebhookResponse.badRequest("Malformed changes: " + e.getMessage());
    }
    if (changes == null) {
      return WebhookResponse.badRequest("Missing changes");
    }
    try {
      provider.applyChanges(changes);
      return WebhookResponse.noContent();
    } catch (DesignateException e) {
      logger.atSevere().withCause(e).log("Failed to apply changes");
      return WebhookResponse.internalError(e.getMessage());
    }
  }
}
