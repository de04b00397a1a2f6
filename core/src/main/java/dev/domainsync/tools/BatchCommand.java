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

import dev.domainsync.batch.BatchSummary;

/**
 * A command that processes domains and whose exit code reflects how they fared.
 *
 * <p>The command fails if any domain failed or was left unprocessed. Domains that are merely
 * pending don't count as failures.
 */
public abstract class BatchCommand implements Command {

  private int exitCode = DomainSyncCli.EXIT_SUCCESS;

  @Override
  public final void run() throws Exception {
    BatchSummary summary = runBatch();
    System.out.printf("Summary: %s%n", summary);
    exitCode = summary.isSuccess() ? DomainSyncCli.EXIT_SUCCESS : DomainSyncCli.EXIT_FAILURE;
  }

  /** Processes the domains, printing one line per domain, and returns the counts. */
  protected abstract BatchSummary runBatch() throws Exception;

  int getExitCode() {
    return exitCode;
  }
}
