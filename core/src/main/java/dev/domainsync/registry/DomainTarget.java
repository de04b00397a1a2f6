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

package dev.domainsync.registry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import dev.domainsync.util.DomainNameUtils;
import javax.annotation.Nullable;

/**
 * One hostname the registry says should exist, and the hosting site it should serve.
 *
 * @param rootDomain the registrable domain the records live under, e.g. {@code 2100.cool}
 * @param recordName the label under the root, {@code @} for the apex
 * @param hostingSite the hosting site ID that should serve this hostname
 * @param binding whether the hostname is bound by address or by alias
 * @param cnameTarget the alias target, set only for {@link BindingStrategy#CNAME}
 */
public record DomainTarget(
    String rootDomain,
    String recordName,
    String hostingSite,
    BindingStrategy binding,
    @Nullable String cnameTarget) {

  public DomainTarget {
    checkNotNull(rootDomain, "rootDomain");
    checkNotNull(recordName, "recordName");
    checkNotNull(hostingSite, "hostingSite");
    checkNotNull(binding, "binding");
    checkArgument(
        (binding == BindingStrategy.CNAME) == (cnameTarget != null),
        "cnameTarget must be set exactly when binding is CNAME");
  }

  /** Creates an address-bound target, the usual case. */
  public static DomainTarget create(String rootDomain, String recordName, String hostingSite) {
    return new DomainTarget(
        rootDomain, DomainNameUtils.toRecordName(recordName), hostingSite, BindingStrategy.A_RECORD,
        null);
  }

  /** Returns the fully qualified hostname, e.g. {@code asoos.2100.cool}. */
  public String fqdn() {
    return DomainNameUtils.toFqdn(rootDomain, recordName);
  }

  public boolean isApex() {
    return DomainNameUtils.isApex(recordName);
  }
}
