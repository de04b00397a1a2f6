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

package dev.domainsync.batch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import dev.domainsync.registry.DomainTarget;
import dev.domainsync.util.StopwatchLogger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs a unit of work for every domain of a batch on a bounded worker pool.
 *
 * <p>One domain's failure never stops the others: an exception escaping a unit is turned into that
 * domain's failed result. When the run exceeds its timeout no new domain is started, domains
 * already in flight are given a grace period to finish, and whatever is left is reported as not
 * processed. Running units are never interrupted.
 */
public class DomainBatchRunner {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final Duration IN_FLIGHT_GRACE = Duration.ofMinutes(1);

  private final ExecutorService executor;
  private final Duration runTimeout;
  private final Duration slowDomainThreshold;

  public DomainBatchRunner(
      ExecutorService executor, Duration runTimeout, Duration slowDomainThreshold) {
    this.executor = executor;
    this.runTimeout = runTimeout;
    this.slowDomainThreshold = slowDomainThreshold;
  }

  /**
   * Processes every target and collects the results in target order.
   *
   * @param jobName used in log messages
   * @param unit the per-domain work
   * @param onError builds the failed result for a domain whose unit threw
   * @param outcomeOf classifies a result for the summary
   */
  public <R> BatchReport<R> run(
      String jobName,
      ImmutableList<DomainTarget> targets,
      Function<DomainTarget, R> unit,
      BiFunction<DomainTarget, Exception, R> onError,
      Function<? super R, DomainOutcome> outcomeOf) {
    logger.atInfo().log("Starting %s of %d domain(s).", jobName, targets.size());
    AtomicBoolean cancelled = new AtomicBoolean(false);
    Map<DomainTarget, CompletableFuture<Optional<R>>> futures = new LinkedHashMap<>();
    for (DomainTarget target : targets) {
      futures.put(
          target,
          CompletableFuture.supplyAsync(
              () -> runUnit(jobName, target, unit, onError, cancelled), executor));
    }

    CompletableFuture<Void> all =
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]));
    if (!awaitAll(all, runTimeout)) {
      logger.atWarning().log(
          "%s exceeded its timeout of %s; no further domains will be started.",
          jobName, runTimeout);
      cancelled.set(true);
      awaitAll(all, IN_FLIGHT_GRACE);
    }

    ImmutableList.Builder<R> results = new ImmutableList.Builder<>();
    ImmutableList.Builder<String> abandoned = new ImmutableList.Builder<>();
    futures.forEach(
        (target, future) -> {
          Optional<R> result = future.getNow(Optional.empty());
          if (result.isPresent()) {
            results.add(result.get());
          } else {
            abandoned.add(target.fqdn());
          }
        });

    BatchReport<R> report = BatchReport.create(results.build(), abandoned.build(), outcomeOf);
    logger.atInfo().log("Finished %s: %s.", jobName, report.summary());
    return report;
  }

  private <R> Optional<R> runUnit(
      String jobName,
      DomainTarget target,
      Function<DomainTarget, R> unit,
      BiFunction<DomainTarget, Exception, R> onError,
      AtomicBoolean cancelled) {
    if (cancelled.get()) {
      return Optional.empty();
    }
    StopwatchLogger stopwatch = new StopwatchLogger(slowDomainThreshold);
    try {
      return Optional.of(unit.apply(target));
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("%s of %s failed.", jobName, target.fqdn());
      return Optional.of(onError.apply(target, e));
    } finally {
      stopwatch.tick(String.format("%s of %s", jobName, target.fqdn()));
    }
  }

  /** Waits for all domains to finish, returning false if they didn't within the timeout. */
  private static boolean awaitAll(CompletableFuture<Void> all, Duration timeout) {
    try {
      all.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      // runUnit catches everything a unit throws, so only an Error gets here.
      throw new IllegalStateException("Domain worker died", e.getCause());
    }
  }
}
