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
import dev.domainsync.batch.BatchReport;
import dev.domainsync.batch.BatchSummary;
import dev.domainsync.verify.VerificationLogEntry;
import dev.domainsync.verify.VerificationResult;
import dev.domainsync.verify.VerificationService;
import jakarta.inject.Inject;
import java.util.Optional;
import javax.annotation.Nullable;

/** Command to probe the registry's hostnames and log their state. */
@Parameters(
    separators = " =",
    commandDescription = "Check DNS, ownership and HTTPS for each hostname and log the results")
final class VerifyCommand extends BatchCommand {

  @Nullable
  @Parameter(names = "--domain", description = "Only verify this hostname, e.g. www.example.com")
  private String domain;

  @Inject VerificationService verificationService;

  @Override
  protected BatchSummary runBatch() {
    BatchReport<VerificationResult> report =
        verificationService.verify(Optional.ofNullable(domain));
    for (VerificationResult result : report.results()) {
      if (result.entry().isPresent()) {
        System.out.println(describe(result.entry().get()));
      } else {
        System.out.printf("%s: ERROR (%s)%n", result.fqdn(), result.error().get());
      }
    }
    report.abandoned().forEach(fqdn -> System.out.printf("%s: NOT PROCESSED%n", fqdn));
    return report.summary();
  }

  static String describe(VerificationLogEntry entry) {
    return String.format(
        "%s: %s (dns=%s, txt=%s, https=%s)",
        entry.domain(),
        entry.overallState(),
        entry.dns().resolved() ? "ok" : "pending",
        entry.txt().present() ? "ok" : "missing",
        entry.http().statusCode() != null ? entry.http().statusCode() : "unreachable");
  }
}
