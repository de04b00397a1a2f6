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

import static com.google.common.truth.Truth.assertThat;

import dev.domainsync.batch.BatchSummary;
import dev.domainsync.testing.FakeClock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ScheduledJob}. */
class ScheduledJobTest {

  private final FakeClock clock = new FakeClock();

  @Test
  void testTrigger_success() {
    ScheduledJob job =
        new ScheduledJob(
            JobType.VERIFY,
            () -> {
              clock.advanceBy(Duration.ofSeconds(5));
              return new BatchSummary(3, 1, 0, 0);
            },
            clock);

    JobRun run = job.trigger().get();

    assertThat(run.state()).isEqualTo(JobState.SUCCEEDED);
    assertThat(run.summary()).hasValue(new BatchSummary(3, 1, 0, 0));
    assertThat(Duration.between(run.started(), run.finished())).isEqualTo(Duration.ofSeconds(5));
    assertThat(job.getState()).isEqualTo(JobState.IDLE);
    assertThat(job.getLastRun()).hasValue(run);
  }

  @Test
  void testTrigger_failedDomains_failTheRun() {
    ScheduledJob job =
        new ScheduledJob(JobType.RECONCILE, () -> new BatchSummary(3, 0, 1, 0), clock);

    assertThat(job.trigger().get().state()).isEqualTo(JobState.FAILED);
  }

  @Test
  void testTrigger_exceptionIsRecorded() {
    ScheduledJob job =
        new ScheduledJob(
            JobType.RECONCILE,
            () -> {
              throw new IllegalStateException("registry unreadable");
            },
            clock);

    JobRun run = job.trigger().get();

    assertThat(run.state()).isEqualTo(JobState.FAILED);
    assertThat(run.summary()).isEmpty();
    assertThat(run.error().get()).contains("registry unreadable");
    assertThat(job.getState()).isEqualTo(JobState.IDLE);
    // The job can run again afterwards.
    assertThat(job.trigger()).isPresent();
  }

  @Test
  void testTrigger_whileRunning_isCoalesced() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger runs = new AtomicInteger();
    ScheduledJob job =
        new ScheduledJob(
            JobType.VERIFY,
            () -> {
              runs.incrementAndGet();
              started.countDown();
              try {
                release.await(30, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return new BatchSummary(1, 0, 0, 0);
            },
            clock);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<Optional<JobRun>> first = executor.submit(job::trigger);
      assertThat(started.await(30, TimeUnit.SECONDS)).isTrue();
      assertThat(job.getState()).isEqualTo(JobState.RUNNING);

      assertThat(job.trigger()).isEmpty();

      release.countDown();
      assertThat(first.get(30, TimeUnit.SECONDS)).isPresent();
    } finally {
      executor.shutdownNow();
    }
    assertThat(runs.get()).isEqualTo(1);
  }
}
