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

package designate.webhook.metrics;

import java.time.Duration;

/** Records the calls made to the Designate API. */
public interface ApiCallMetrics {

  /** Records one call of the given client method. */
  void recordCall(String method);

  /** Records one failed call of the given client method. */
  void recordFailure(String method);

  /** Records how long one call of the given client method took. */
  void recordLatency(String method, Duration latency);

  /** Records whether the webhook could authenticate against OpenStack. */
  void setConnected(boolean connected);
}
