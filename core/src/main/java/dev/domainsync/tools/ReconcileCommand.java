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
import com.google.common.base.Joiner;
import dev.domainsync.batch.BatchReport;
import dev.domainsync.batch.BatchSummary;
import dev.domainsync.reconcile.ReconcileResult;
import dev.domainsync.reconcile.ReconcileService;
import jakarta.inject.Inject;
import java.util.Optional;
import javax.annotation.Nullable;

/** Command to bring registrar DNS records in line with the registry. */
@Parameters(
    separators = " =",
    commandDescription = "Reconcile DNS records at the registrar with the domain registry")
final class ReconcileCommand extends BatchCommand {

  @Nullable
  @Parameter(names = "--domain", description = "Only reconcile this hostname, e.g. www.example.com")
  private String domain;

  @Inject ReconcileService reconcileService;

  @Override
  protected BatchSummary runBatch() {
    BatchReport<ReconcileResult> report = reconcileService.reconcile(Optional.ofNullable(domain));
    for (ReconcileResult result : report.results()) {
      if (result.isSuccess()) {
        System.out.printf(
            "%s: OK (%s)%n",
            result.fqdn(),
            result.changed() ? Joiner.on(", ").join(result.actions()) : "no changes");
      } else {
        System.out.printf("%s: FAILED (%s)%n", result.fqdn(), result.error().get());
      }
    }
    report.abandoned().forEach(fqdn -> System.out.printf("%s: NOT PROCESSED%n", fqdn));
    return report.summary();
  }
}
