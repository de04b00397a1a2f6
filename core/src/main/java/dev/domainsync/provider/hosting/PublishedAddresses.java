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

package dev.domainsync.provider.hosting;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.domainsync.config.ConfigurationException;
import dev.domainsync.config.DomainSyncConfig.Config;
import jakarta.inject.Inject;

/**
 * The IP addresses the hosting provider publishes for its sites.
 *
 * <p>Reconciliation writes the primary address. Verification accepts any published address.
 */
public class PublishedAddresses {

  private final ImmutableList<String> defaultIps;
  private final ImmutableMap<String, ImmutableList<String>> siteIps;

  @Inject
  public PublishedAddresses(
      @Config("hostingDefaultIps") ImmutableList<String> defaultIps,
      @Config("hostingSiteIpsMap") ImmutableMap<String, ImmutableList<String>> siteIps) {
    if (defaultIps.isEmpty()) {
      throw new ConfigurationException("hosting.defaultIps must list at least one address");
    }
    this.defaultIps = defaultIps;
    this.siteIps = siteIps;
  }

  /** Returns every address that counts as correct for the given site. */
  public ImmutableList<String> addressesFor(String hostingSite) {
    ImmutableList<String> override = siteIps.get(hostingSite);
    return override == null || override.isEmpty() ? defaultIps : override;
  }

  /** Returns the address written as the A record for the given site. */
  public String primaryAddressFor(String hostingSite) {
    ImmutableList<String> addresses = addressesFor(hostingSite);
    checkState(!addresses.isEmpty(), "No published address for hosting site %s", hostingSite);
    return addresses.get(0);
  }
}
