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
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.registry.DomainTarget;
import dev.domainsync.verify.DomainState;
import dev.domainsync.verify.VerificationLog;
import dev.domainsync.verify.VerificationLogEntry;
import jakarta.inject.Inject;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Command to show the last verified state of each hostname.
 *
 * <p>Reads only the verification log; no provider is contacted.
 */
@Parameters(separators = " =", commandDescription = "Show the last verified state of each hostname")
final class StatusCommand implements Command {

  @Nullable
  @Parameter(
      names = "--domain",
      description = "Show the full verification history of this hostname instead")
  private String domain;

  @Inject DesiredStateRegistry registry;
  @Inject VerificationLog verificationLog;

  @Override
  public void run() {
    if (domain != null) {
      DomainTarget target = registry.select(Optional.of(domain)).get(0);
      for (VerificationLogEntry entry : verificationLog.history(target.fqdn())) {
        System.out.printf("%s %s%n", entry.timestamp(), VerifyCommand.describe(entry));
      }
      return;
    }
    for (DomainTarget target : registry.targets()) {
      Optional<VerificationLogEntry> latest = verificationLog.latest(target.fqdn());
      System.out.printf(
          "%-40s %-22s %-20s %s%n",
          target.fqdn(),
          latest.map(VerificationLogEntry::overallState).orElse(DomainState.UNCONFIGURED),
          target.hostingSite(),
          latest.map(e -> "checked " + e.timestamp()).orElse("never checked"));
    }
  }
}
