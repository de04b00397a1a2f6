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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.LongMath;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/** Wrapper that does retry with bounded exponential backoff. */
public class Retrier {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Sleeper sleeper;
  private final int attempts;
  private final Duration baseDelay;
  private final int backoffFactor;

  public Retrier(Sleeper sleeper, int attempts, Duration baseDelay, int backoffFactor) {
    checkArgument(attempts > 0, "Number of attempts must be positive");
    checkArgument(!baseDelay.isNegative(), "Base delay must not be negative");
    checkArgument(backoffFactor >= 1, "Backoff factor must be at least 1");
    this.sleeper = checkNotNull(sleeper, "sleeper");
    this.attempts = attempts;
    this.baseDelay = baseDelay;
    this.backoffFactor = backoffFactor;
  }

  public int getAttempts() {
    return attempts;
  }

  /**
   * Retries a unit of work in the face of transient errors.
   *
   * <p>Retrying is done a fixed number of times, with exponential backoff, if the exception that is
   * thrown is deemed retryable by the predicate. If the error is not considered retryable, or if
   * the thread is interrupted, or if the allowable number of attempts has been exhausted, the
   * original exception is propagated through to the caller. Checked exceptions are wrapped in a
   * {@link RuntimeException}.
   *
   * @return <V> the value returned by the {@link Callable}.
   */
  public final <V> V callWithRetry(Callable<V> callable, Predicate<Throwable> isRetryable) {
    try {
      return callWithRetryUnwrapped(callable, isRetryable);
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new RuntimeException(e);
    }
  }

  /**
   * Retries a unit of work in the face of transient errors, propagating checked exceptions of the
   * given type as-is.
   *
   * <p>This is the variant to use when the unit of work declares a checked exception that the
   * caller wants to handle (e.g. an {@link java.io.IOException} subclass from an API client).
   */
  public final <V, E extends Exception> V callWithRetry(
      Callable<V> callable, Predicate<Throwable> isRetryable, Class<E> declaredType) throws E {
    try {
      return callWithRetryUnwrapped(callable, isRetryable);
    } catch (Exception e) {
      Throwables.throwIfInstanceOf(e, declaredType);
      Throwables.throwIfUnchecked(e);
      throw new RuntimeException(e);
    }
  }

  /**
   * Retries a unit of work in the face of transient errors.
   *
   * <p>Retrying is done a fixed number of times, with exponential backoff, if the exception that is
   * thrown is on an allowlist of retryable errors.
   */
  @SafeVarargs
  public final <V> V callWithRetry(
      Callable<V> callable,
      Class<? extends Throwable> retryableError,
      Class<? extends Throwable>... moreRetryableErrors) {
    ImmutableSet<Class<? extends Throwable>> retryables =
        new ImmutableSet.Builder<Class<? extends Throwable>>()
            .add(retryableError)
            .add(moreRetryableErrors)
            .build();
    return callWithRetry(
        callable, e -> retryables.stream().anyMatch(supertype -> supertype.isInstance(e)));
  }

  /** Returns how long to wait after the given number of consecutive failures. */
  Duration backoffAfter(int failures) {
    return baseDelay.multipliedBy(LongMath.pow(backoffFactor, failures - 1));
  }

  private <V> V callWithRetryUnwrapped(Callable<V> callable, Predicate<Throwable> isRetryable)
      throws Exception {
    int failures = 0;
    while (true) {
      try {
        return callable.call();
      } catch (Exception e) {
        if (++failures >= attempts || !isRetryable.test(e)) {
          throw e;
        }
        Duration delay = backoffAfter(failures);
        logger.atInfo().withCause(e).log(
            "Retrying transient error, attempt %d of %d, next try in %d ms.",
            failures, attempts, delay.toMillis());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e2) {
          // Since we're not rethrowing InterruptedException, set the interrupt state on the thread
          // so the next blocking operation will know to abort the thread.
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }
}
