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

import com.google.gson.Gson;
import designate.webhook.provider.DesignateProvider;
import jakarta.inject.Inject;

/** Negotiation call of external-dns: returns the domain filter of the provider. */
public class DomainFilterAction implements WebhookAction {

  public static final String PATH = "/";

  private final DesignateProvider provider;
  private final Gson gson;

  @Inject
  public DomainFilterAction(DesignateProvider provider, Gson gson) {
    this.provider = provider;
    this.gson = gson;
  }

  @Override
  public String path() {
    return PATH;
  }

  @Override
  public WebhookResponse handle(WebhookRequest request) {
    if (!request.isMethod("GET")) {
      return WebhookResponse.methodNotAllowed(request.method());
    }
    return WebhookResponse.json(gson.toJson(provider.getDomainFilter()));
  }
}
