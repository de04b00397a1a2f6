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

package dev.domainsync.verify;

import com.google.common.collect.ImmutableList;
import dev.domainsync.batch.BatchReport;
import dev.domainsync.batch.DomainBatchRunner;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.registry.DomainTarget;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.Optional;

/** Verifies every hostname of the registry, or one of them. */
public class VerificationService {

  static final String JOB_NAME = "Verification";

  private final DesiredStateRegistry registry;
  private final Verifier verifier;
  private final DomainBatchRunner batchRunner;

  @Inject
  public VerificationService(
      DesiredStateRegistry registry,
      Verifier verifier,
      @Named("verifyRunner") DomainBatchRunner batchRunner) {
    this.registry = registry;
    this.verifier = verifier;
    this.batchRunner = batchRunner;
  }

  /**
   * Verifies the selected hostnames concurrently and logs a result for each.
   *
   * @throws IllegalArgumentException if the filter names a hostname not in the registry
   */
  public BatchReport<VerificationResult> verify(Optional<String> fqdnFilter) {
    ImmutableList<DomainTarget> targets = registry.select(fqdnFilter);
    verifier.checkConfigured();
    return batchRunner.run(
        JOB_NAME,
        targets,
        target -> VerificationResult.of(verifier.verify(target)),
        (target, e) -> VerificationResult.failure(target.fqdn(), e.toString()),
        VerificationResult::outcome);
  }
}
