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
import dev.domainsync.batch.BatchSummary;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.reconcile.ReconcileResult;
import dev.domainsync.reconcile.Reconciler;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.registry.DomainTarget;
import jakarta.inject.Inject;
import java.util.Optional;

/**
 * Command to record an ownership token handed out by the hosting provider and publish it.
 *
 * <p>The hostname is fully reconciled with the new token, so its binding record is fixed too.
 */
@Parameters(
    separators = " =",
    commandDescription = "Store an ownership token for a hostname and publish its TXT record")
final class AddVerificationCommand extends BatchCommand {

  @Parameter(
      names = "--domain",
      description = "Hostname the token belongs to, e.g. asoos.2100.cool",
      required = true)
  private String domain;

  @Parameter(
      names = "--token",
      description = "The ownership token, with or without its prefix",
      required = true)
  private String token;

  @Inject DesiredStateRegistry registry;
  @Inject Reconciler reconciler;

  @Inject
  @Config("verificationPrefix")
  String verificationPrefix;

  @Override
  protected BatchSummary runBatch() {
    DomainTarget target = registry.select(Optional.of(domain)).get(0);
    String bareToken =
        token.startsWith(verificationPrefix) ? token.substring(verificationPrefix.length()) : token;
    ReconcileResult result = reconciler.reconcile(target, Optional.of(bareToken));
    if (result.isSuccess()) {
      System.out.printf(
          "%s: OK (%s)%n",
          result.fqdn(),
          result.changed() ? Joiner.on(", ").join(result.actions()) : "no changes");
      return new BatchSummary(1, 0, 0, 0);
    }
    System.out.printf("%s: FAILED (%s)%n", result.fqdn(), result.error().get());
    return new BatchSummary(0, 0, 1, 0);
  }
}
