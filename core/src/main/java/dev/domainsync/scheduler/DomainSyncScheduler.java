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

package dev.domainsync.scheduler;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.reconcile.ReconcileService;
import dev.domainsync.util.Clock;
import dev.domainsync.verify.VerificationService;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.GuardedBy;

/**
 * Runs reconciliation and verification on their own cadences.
 *
 * <p>Each job has its own single-thread executor, so a slow verification never delays
 * reconciliation and vice versa. A run is scheduled a fixed delay after the previous one ends.
 */
@Singleton
public class DomainSyncScheduler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableMap<JobType, ScheduledJob> jobs;
  private final ImmutableMap<JobType, Duration> intervals;
  private final Duration initialDelay;

  @GuardedBy("this")
  private final List<ScheduledExecutorService> executors = new ArrayList<>();

  @Inject
  public DomainSyncScheduler(
      ReconcileService reconcileService,
      VerificationService verificationService,
      Clock clock,
      @Config("reconcileInterval") Duration reconcileInterval,
      @Config("verifyInterval") Duration verifyInterval,
      @Config("scheduleInitialDelay") Duration initialDelay) {
    this(
        ImmutableMap.of(
            JobType.RECONCILE,
            new ScheduledJob(
                JobType.RECONCILE,
                () -> reconcileService.reconcile(Optional.empty()).summary(),
                clock),
            JobType.VERIFY,
            new ScheduledJob(
                JobType.VERIFY,
                () -> verificationService.verify(Optional.empty()).summary(),
                clock)),
        ImmutableMap.of(JobType.RECONCILE, reconcileInterval, JobType.VERIFY, verifyInterval),
        initialDelay);
  }

  DomainSyncScheduler(
      ImmutableMap<JobType, ScheduledJob> jobs,
      ImmutableMap<JobType, Duration> intervals,
      Duration initialDelay) {
    this.jobs = jobs;
    this.intervals = intervals;
    this.initialDelay = initialDelay;
  }

  /** Runs a job now on the calling thread, unless it is already running. */
  public Optional<JobRun> runNow(JobType type) {
    return jobs.get(type).trigger();
  }

  public ScheduledJob getJob(JobType type) {
    return jobs.get(type);
  }

  /** Starts the periodic schedule. */
  public synchronized void start() {
    checkState(executors.isEmpty(), "Scheduler already started");
    for (ScheduledJob job : jobs.values()) {
      Duration interval = intervals.get(job.getType());
      ScheduledExecutorService executor =
          Executors.newSingleThreadScheduledExecutor(
              new ThreadFactoryBuilder()
                  .setNameFormat("scheduler-" + Ascii.toLowerCase(job.getType().name()) + "-%d")
                  .build());
      executor.scheduleWithFixedDelay(
          job::trigger, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
      executors.add(executor);
      logger.atInfo().log("Scheduled %s every %s.", job.getType(), interval);
    }
  }

  /** Stops the schedule, letting runs in progress finish. */
  public synchronized void stop() throws InterruptedException {
    for (ScheduledExecutorService executor : executors) {
      executor.shutdown();
    }
    for (ScheduledExecutorService executor : executors) {
      if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
        logger.atWarning().log("A scheduled job did not finish within a minute of shutdown.");
      }
    }
    executors.clear();
  }
}
