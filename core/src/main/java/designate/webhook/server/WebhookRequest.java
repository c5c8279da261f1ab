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

import com.google.common.base.Ascii;
import java.nio.charset.StandardCharsets;

/** An HTTP request as seen by a {@link WebhookAction}. */
public record WebhookRequest(String method, String path, byte[] body) {

  public static WebhookRequest get(String path) {
    return new WebhookRequest("GET", path, new byte[0]);
  }

  public static WebhookRequest post(String path, String body) {
    return new WebhookRequest("POST", path, body.getBytes(StandardCharsets.UTF_8));
  }

  public boolean isMethod(String expected) {
    return Ascii.equalsIgnoreCase(method, expected);
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
