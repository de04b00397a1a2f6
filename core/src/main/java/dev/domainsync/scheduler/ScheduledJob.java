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

import com.google.common.flogger.FluentLogger;
import dev.domainsync.batch.BatchSummary;
import dev.domainsync.util.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A periodic job that never overlaps itself.
 *
 * <p>Triggers from the schedule and from operators go through {@link #trigger}. Only the caller
 * that moves the job from {@code IDLE} to {@code RUNNING} does the work; any trigger arriving
 * while it runs is coalesced into the running one.
 */
@ThreadSafe
public class ScheduledJob {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final JobType type;
  private final Supplier<BatchSummary> work;
  private final Clock clock;
  private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
  private final AtomicReference<Optional<JobRun>> lastRun =
      new AtomicReference<>(Optional.empty());

  public ScheduledJob(JobType type, Supplier<BatchSummary> work, Clock clock) {
    this.type = type;
    this.work = work;
    this.clock = clock;
  }

  /**
   * Runs the job on the calling thread unless it is already running.
   *
   * @return the completed run, or empty if the trigger was coalesced
   */
  public Optional<JobRun> trigger() {
    if (!state.compareAndSet(JobState.IDLE, JobState.RUNNING)) {
      logger.atInfo().log("%s is already running; trigger coalesced.", type);
      return Optional.empty();
    }
    Instant started = clock.nowUtc();
    logger.atInfo().log("%s started.", type);
    BatchSummary summary = null;
    String error = null;
    JobState finalState;
    try {
      summary = work.get();
      finalState = summary.isSuccess() ? JobState.SUCCEEDED : JobState.FAILED;
    } catch (RuntimeException e) {
      // Anything escaping here would cancel all later scheduled runs.
      logger.atSevere().withCause(e).log("%s died.", type);
      error = e.toString();
      finalState = JobState.FAILED;
    }
    state.set(finalState);
    Instant finished = clock.nowUtc();
    JobRun run =
        new JobRun(
            type,
            finalState,
            started,
            finished,
            Optional.ofNullable(summary),
            Optional.ofNullable(error));
    lastRun.set(Optional.of(run));
    logger.atInfo().log(
        "%s %s in %s%s.",
        type,
        finalState,
        Duration.between(started, finished),
        summary == null ? "" : ": " + summary);
    state.set(JobState.IDLE);
    return Optional.of(run);
  }

  public JobType getType() {
    return type;
  }

  public JobState getState() {
    return state.get();
  }

  public Optional<JobRun> getLastRun() {
    return lastRun.get();
  }
}
