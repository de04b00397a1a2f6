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

package dev.domainsync.reconcile;

import com.google.common.collect.ImmutableList;
import dev.domainsync.batch.BatchReport;
import dev.domainsync.batch.DomainBatchRunner;
import dev.domainsync.batch.DomainOutcome;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.registry.DomainTarget;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.Optional;

/** Reconciles every hostname of the registry, or one of them. */
public class ReconcileService {

  static final String JOB_NAME = "Reconciliation";

  private final DesiredStateRegistry registry;
  private final Reconciler reconciler;
  private final DomainBatchRunner batchRunner;

  @Inject
  public ReconcileService(
      DesiredStateRegistry registry,
      Reconciler reconciler,
      @Named("reconcileRunner") DomainBatchRunner batchRunner) {
    this.registry = registry;
    this.reconciler = reconciler;
    this.batchRunner = batchRunner;
  }

  /**
   * Reconciles the selected hostnames concurrently.
   *
   * @param fqdnFilter restricts the run to one hostname of the registry
   * @throws IllegalArgumentException if the filter names a hostname not in the registry
   */
  public BatchReport<ReconcileResult> reconcile(Optional<String> fqdnFilter) {
    ImmutableList<DomainTarget> targets = registry.select(fqdnFilter);
    reconciler.checkConfigured();
    return batchRunner.run(
        JOB_NAME,
        targets,
        target -> reconciler.reconcile(target),
        (target, e) -> ReconcileResult.failure(target.fqdn(), ImmutableList.of(), e.toString()),
        result -> result.isSuccess() ? DomainOutcome.SUCCEEDED : DomainOutcome.FAILED);
  }
}
