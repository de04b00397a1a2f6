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

package dev.domainsync.tools;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import dev.domainsync.scheduler.DomainSyncScheduler;
import dev.domainsync.scheduler.JobRun;
import dev.domainsync.scheduler.JobState;
import dev.domainsync.scheduler.JobType;
import jakarta.inject.Inject;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Command to run reconciliation and verification periodically until the process is stopped.
 *
 * <p>With {@code --once}, each job runs a single time on the calling thread and the command exits.
 */
@Parameters(
    separators = " =",
    commandDescription = "Run reconciliation and verification on their configured schedules")
final class ScheduleCommand implements Command {

  @Parameter(
      names = {"--run_now", "--run-now"},
      description = "Run both jobs immediately, before the first scheduled run")
  private boolean runNow;

  @Parameter(names = "--once", description = "Run each job once and exit instead of scheduling")
  private boolean once;

  @Inject DomainSyncScheduler scheduler;

  private int exitCode = DomainSyncCli.EXIT_SUCCESS;

  @Override
  public void run() throws Exception {
    if (runNow || once) {
      for (JobType type : JobType.values()) {
        report(type, scheduler.runNow(type));
      }
    }
    if (once) {
      return;
    }
    CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    scheduler.stop();
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  } finally {
                    stopped.countDown();
                  }
                },
                "scheduler-shutdown"));
    scheduler.start();
    System.out.println("Scheduler started. Press Ctrl-C to stop.");
    stopped.await();
  }

  private void report(JobType type, Optional<JobRun> run) {
    if (run.isEmpty()) {
      System.out.printf("%s: already running%n", type);
      return;
    }
    JobRun jobRun = run.get();
    System.out.printf(
        "%s: %s (%s)%n",
        type,
        jobRun.state(),
        jobRun.summary().map(Object::toString).orElse(jobRun.error().orElse("")));
    if (jobRun.state() != JobState.SUCCEEDED) {
      exitCode = DomainSyncCli.EXIT_FAILURE;
    }
  }

  int getExitCode() {
    return exitCode;
  }
}
