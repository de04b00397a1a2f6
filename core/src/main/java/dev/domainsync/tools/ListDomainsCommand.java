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

import com.beust.jcommander.Parameters;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.domainsync.provider.registrar.RegistrarClient;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.util.DomainNameUtils;
import jakarta.inject.Inject;

/** Command to compare the registrar account's active domains with the registry. */
@Parameters(
    separators = " =",
    commandDescription =
        "List active domains in the registrar account and whether they are managed")
final class ListDomainsCommand implements Command {

  @Inject RegistrarClient registrarClient;
  @Inject DesiredStateRegistry registry;

  @Override
  public void run() throws Exception {
    ImmutableList<String> accountDomains = registrarClient.listActiveDomains();
    ImmutableSet<String> managed = registry.rootDomains();
    ImmutableSet.Builder<String> seen = new ImmutableSet.Builder<>();
    for (String domain : accountDomains) {
      String canonical = DomainNameUtils.canonicalizeHostname(domain);
      seen.add(canonical);
      System.out.printf(
          "%-40s %s%n", canonical, managed.contains(canonical) ? "managed" : "unmanaged");
    }
    ImmutableSet<String> inAccount = seen.build();
    for (String root : managed) {
      if (!inAccount.contains(root)) {
        System.out.printf("%-40s %s%n", root, "in registry but not an active account domain");
      }
    }
  }
}
