// Copyright 2026 The DomainSync Authors. All Rights Reserved.
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

package dev.domainsync.util;

import com.google.common.flogger.FluentLogger;
import java.time.Duration;

/**
 * A helper class to log only if the time elapsed between calls is more than a specified threshold.
 *
 * <p>Not thread safe; use one instance per unit of work.
 */
public final class StopwatchLogger {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Duration DEFAULT_THRESHOLD = Duration.ofMillis(400);

  private final long thresholdNanos;
  private long lastTickNanos;

  public StopwatchLogger() {
    this(DEFAULT_THRESHOLD);
  }

  public StopwatchLogger(Duration threshold) {
    this.thresholdNanos = threshold.toNanos();
    this.lastTickNanos = System.nanoTime();
  }

  /**
   * Logs the message if the threshold was exceeded since the previous tick.
   *
   * @return whether the message was logged
   */
  public boolean tick(String message) {
    long currentNanos = System.nanoTime();
    long elapsedNanos = currentNanos - lastTickNanos;
    this.lastTickNanos = currentNanos;

    // Only log if the elapsed time is over the threshold.
    if (elapsedNanos > thresholdNanos) {
      logger.atInfo().log("%s (took %d ms)", message, Duration.ofNanos(elapsedNanos).toMillis());
      return true;
    }
    return false;
  }
}
