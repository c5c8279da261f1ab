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

import designate.webhook.metrics.MetricsTextRenderer;
import jakarta.inject.Inject;
import java.net.HttpURLConnection;

/** Dumps the registered metrics as plain text. */
public class MetricsAction implements WebhookAction {

  public static final String PATH = "/metrics";

  private final MetricsTextRenderer renderer;

  @Inject
  public MetricsAction(MetricsTextRenderer renderer) {
    this.renderer = renderer;
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
    return WebhookResponse.text(HttpURLConnection.HTTP_OK, renderer.render());
  }
}
