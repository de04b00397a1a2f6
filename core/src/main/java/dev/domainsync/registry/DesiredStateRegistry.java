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
import static dev.domainsync.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.domainsync.config.ConfigurationException;
import dev.domainsync.config.DomainSyncConfigSettings.DomainEntry;
import dev.domainsync.config.DomainSyncConfigSettings.SubdomainEntry;
import dev.domainsync.util.DomainNameUtils;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The desired-state registry: every (root domain, subdomain) pair that should exist and the hosting
 * site that should serve it.
 *
 * <p>This is the single source of truth for reconciliation and verification. Instances are
 * immutable and validated on construction, so a registry that exists is well-formed.
 */
@Immutable
public final class DesiredStateRegistry {

  /** Keyed by fully qualified hostname, in insertion order. */
  private final ImmutableMap<String, DomainTarget> targets;

  private DesiredStateRegistry(ImmutableMap<String, DomainTarget> targets) {
    this.targets = targets;
  }

  /** Returns all targets in registry order. */
  public ImmutableList<DomainTarget> targets() {
    return targets.values().asList();
  }

  /** Returns the target for a fully qualified hostname, if the registry has one. */
  public Optional<DomainTarget> lookup(String fqdn) {
    return Optional.ofNullable(targets.get(DomainNameUtils.canonicalizeHostname(fqdn)));
  }

  /** Returns the distinct root domains, in registry order. */
  public ImmutableSet<String> rootDomains() {
    return targets.values().stream()
        .map(DomainTarget::rootDomain)
        .collect(ImmutableSet.toImmutableSet());
  }

  /**
   * Returns the targets to process: all of them, or only the one named by the filter.
   *
   * @throws IllegalArgumentException if the filter names a hostname the registry doesn't have
   */
  public ImmutableList<DomainTarget> select(Optional<String> fqdnFilter) {
    if (fqdnFilter.isEmpty()) {
      return targets();
    }
    Optional<DomainTarget> target = lookup(fqdnFilter.get());
    checkArgument(target.isPresent(), "Hostname %s is not in the registry", fqdnFilter.get());
    return ImmutableList.of(target.get());
  }

  public int size() {
    return targets.size();
  }

  /**
   * Builds a registry from the {@code domains} section of the configuration.
   *
   * @throws ConfigurationException if any entry is malformed
   */
  public static DesiredStateRegistry fromConfig(@Nullable List<DomainEntry> domains) {
    Builder builder = new Builder();
    try {
      for (DomainEntry domain : nullToEmptyImmutableCopy(domains)) {
        checkArgument(domain != null, "Empty domain entry");
        for (SubdomainEntry subdomain : nullToEmptyImmutableCopy(domain.subdomains)) {
          checkArgument(subdomain != null, "Empty subdomain entry under %s", domain.rootDomain);
          builder.add(
              domain.rootDomain,
              subdomain.name,
              subdomain.hostingSite,
              parseBinding(subdomain.binding),
              subdomain.cnameTarget);
        }
      }
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid domain registry: " + e.getMessage(), e);
    }
  }

  private static BindingStrategy parseBinding(@Nullable String binding) {
    if (Strings.isNullOrEmpty(binding)) {
      return BindingStrategy.A_RECORD;
    }
    try {
      return BindingStrategy.valueOf(Ascii.toUpperCase(binding));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(String.format("Unknown binding '%s'", binding), e);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link DesiredStateRegistry}. */
  public static final class Builder {

    private final Map<String, DomainTarget> targets = new LinkedHashMap<>();

    private Builder() {}

    /** Adds an address-bound target. */
    public Builder add(String rootDomain, String subdomain, String hostingSite) {
      return add(rootDomain, subdomain, hostingSite, BindingStrategy.A_RECORD, null);
    }

    /**
     * Adds a target.
     *
     * @throws IllegalArgumentException if the names are invalid, the site is missing, or the same
     *     (root domain, subdomain) pair was already added
     */
    public Builder add(
        String rootDomain,
        @Nullable String subdomain,
        String hostingSite,
        BindingStrategy binding,
        @Nullable String cnameTarget) {
      String root = DomainNameUtils.checkValidDomainName(rootDomain);
      String recordName = DomainNameUtils.toRecordName(subdomain);
      checkArgument(
          !Strings.isNullOrEmpty(hostingSite), "Missing hosting site for %s under %s",
          recordName, root);
      if (binding == BindingStrategy.CNAME) {
        checkArgument(
            !DomainNameUtils.isApex(recordName), "The apex of %s cannot be bound by CNAME", root);
        checkArgument(
            !Strings.isNullOrEmpty(cnameTarget), "Missing cnameTarget for %s under %s",
            recordName, root);
        cnameTarget = DomainNameUtils.checkValidDomainName(cnameTarget);
      } else {
        cnameTarget = null;
      }
      DomainTarget target = new DomainTarget(root, recordName, hostingSite, binding, cnameTarget);
      String fqdn = DomainNameUtils.checkValidDomainName(target.fqdn());
      checkArgument(
          !targets.containsKey(fqdn), "Duplicate entry for %s under %s", recordName, root);
      targets.put(fqdn, target);
      return this;
    }

    public DesiredStateRegistry build() {
      return new DesiredStateRegistry(ImmutableMap.copyOf(targets));
    }
  }
}
