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

package designate.webhook.util;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StopwatchLogger}. */
class StopwatchLoggerTest {

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker fakeTicker =
      new Ticker() {
        @Override
        public long read() {
          return nanos.get();
        }
      };

  @Test
  void testTick_measuresEachPhaseSeparately() {
    StopwatchLogger stopwatchLogger =
        new StopwatchLogger("reconcile", Duration.ofMillis(400), fakeTicker);

    nanos.addAndGet(Duration.ofMillis(50).toNanos());
    assertThat(stopwatchLogger.tick("list zones")).isEqualTo(Duration.ofMillis(50));

    nanos.addAndGet(Duration.ofSeconds(2).toNanos());
    assertThat(stopwatchLogger.tick("list records")).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  void testTick_noElapsedTime() {
    StopwatchLogger stopwatchLogger =
        new StopwatchLogger("reconcile", Duration.ofMillis(400), fakeTicker);

    assertThat(stopwatchLogger.tick("nothing")).isEqualTo(Duration.ZERO);
  }
}
