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

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import java.time.Duration;

/**
 * Logs the phases of a long-running operation, but only those that took longer than a threshold.
 *
 * <p>Each call to {@link #tick} measures the time elapsed since the previous tick (or since
 * construction) and restarts the measurement.
 */
public final class StopwatchLogger {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Duration DEFAULT_THRESHOLD = Duration.ofMillis(400);

  private final String operation;
  private final Duration threshold;
  private final Stopwatch stopwatch;

  public StopwatchLogger(String operation) {
    this(operation, DEFAULT_THRESHOLD, Ticker.systemTicker());
  }

  public StopwatchLogger(String operation, Duration threshold, Ticker ticker) {
    this.operation = operation;
    this.threshold = threshold;
    this.stopwatch = Stopwatch.createStarted(ticker);
  }

  /**
   * Ends the current phase and returns its duration, logging it if it exceeded the threshold.
   */
  public Duration tick(String phase) {
    Duration elapsed = stopwatch.elapsed();
    if (elapsed.compareTo(threshold) > 0) {
      logger.atInfo().log("%s: %s (took %d ms)", operation, phase, elapsed.toMillis());
    }
    stopwatch.reset().start();
    return elapsed;
  }
}
