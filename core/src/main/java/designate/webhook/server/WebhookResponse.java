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

import com.google.common.net.HttpHeaders;
import com.google.common.net.MediaType;
import java.net.HttpURLConnection;

/**
 * An HTTP response produced by a {@link WebhookAction}.
 *
 * <p>A status of {@code 204} carries no body.
 */
public record WebhookResponse(int status, String contentType, String payload) {

  /** Media type of the external-dns webhook protocol. */
  public static final String WEBHOOK_MEDIA_TYPE =
      "application/external.dns.webhook+json;version=1";

  static final String CONTENT_TYPE_HEADER = HttpHeaders.CONTENT_TYPE;

  public static WebhookResponse json(String payload) {
    return new WebhookResponse(HttpURLConnection.HTTP_OK, WEBHOOK_MEDIA_TYPE, payload);
  }

  public static WebhookResponse text(int status, String payload) {
    return new WebhookResponse(status, MediaType.PLAIN_TEXT_UTF_8.toString(), payload);
  }

  public static WebhookResponse noContent() {
    return new WebhookResponse(HttpURLConnection.HTTP_NO_CONTENT, WEBHOOK_MEDIA_TYPE, "");
  }

  public static WebhookResponse badRequest(String message) {
    return text(HttpURLConnection.HTTP_BAD_REQUEST, message);
  }

  public static WebhookResponse methodNotAllowed(String method) {
    return text(HttpURLConnection.HTTP_BAD_METHOD, "Method not allowed: " + method);
  }

  public static WebhookResponse internalError(String message) {
    return text(HttpURLConnection.HTTP_INTERNAL_ERROR, message);
  }
}
