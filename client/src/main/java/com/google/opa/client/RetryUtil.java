/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.opa.client;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a condition at a fixed interval until it holds or a total duration elapses. The condition
 * is checked on the calling thread and must be safe to check repeatedly.
 *
 * <p>The wait cannot be aborted from outside; interrupting the thread only sets its interrupt flag
 * once this returns. Callers that need cancellation should not use this.
 */
public class RetryUtil {

  private static final Logger logger = LoggerFactory.getLogger(RetryUtil.class);

  private RetryUtil() {}

  /**
   * @param duration the total time to keep trying.
   * @param interval the pause between two attempts.
   * @param condition returns true once the awaited condition holds; called immediately first.
   * @throws TimeoutException if {@code duration} elapsed without a successful attempt.
   */
  public static void retryUntilSuccessful(
      Duration duration, Duration interval, BooleanSupplier condition) throws TimeoutException {
    Preconditions.checkArgument(!duration.isNegative(), "duration must not be negative");
    Preconditions.checkArgument(
        !interval.isNegative() && !interval.isZero(), "interval must be positive");
    Stopwatch stopwatch = Stopwatch.createStarted();
    if (condition.getAsBoolean()) {
      return;
    }
    int attempts = 1;
    while (true) {
      Duration remaining = duration.minus(stopwatch.elapsed());
      if (remaining.compareTo(interval) < 0) {
        // The next attempt would fall after the deadline.
        Uninterruptibles.sleepUninterruptibly(remaining.isNegative() ? Duration.ZERO : remaining);
        logger.warn("Giving up after {} attempts in {}", attempts, stopwatch);
        throw new TimeoutException("Retry timeout exceeded");
      }
      Uninterruptibles.sleepUninterruptibly(interval);
      attempts++;
      if (condition.getAsBoolean()) {
        logger.debug("Condition held after {} attempts", attempts);
        return;
      }
    }
  }
}
