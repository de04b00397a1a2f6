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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.provider.ProviderException;
import dev.domainsync.provider.hosting.AttachResult;
import dev.domainsync.provider.hosting.HostingClient;
import dev.domainsync.provider.hosting.PublishedAddresses;
import dev.domainsync.provider.registrar.DnsRecord;
import dev.domainsync.provider.registrar.RecordType;
import dev.domainsync.provider.registrar.RegistrarClient;
import dev.domainsync.registry.BindingStrategy;
import dev.domainsync.registry.DomainTarget;
import dev.domainsync.token.VerificationTokenStore;
import dev.domainsync.token.VerificationTokenStore.KnownToken;
import dev.domainsync.util.DomainNameUtils;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Brings the registrar's records for one hostname in line with the registry.
 *
 * <p>For each target, in order:
 *
 * <ol>
 *   <li>Delete the record set of the conflicting type, if one exists. A hostname never carries
 *       both a CNAME and A records.
 *   <li>Write the binding record (the hosting site's primary address, or the alias target) unless
 *       the registrar already has exactly that.
 *   <li>If an ownership token is known, write it as a TXT record unless it is already there. TXT
 *       records that don't carry the ownership prefix are kept.
 * </ol>
 *
 * <p>Every write is preceded by a read, so a second run against unchanged state issues no writes.
 * A failed step stops the target; the steps already done stay done and the next run picks up
 * where this one left off.
 */
public class Reconciler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RegistrarClient registrarClient;
  private final HostingClient hostingClient;
  private final VerificationTokenStore tokenStore;
  private final PublishedAddresses publishedAddresses;
  private final String verificationPrefix;
  private final int ttl;
  private final boolean attachCustomDomains;

  @Inject
  public Reconciler(
      RegistrarClient registrarClient,
      HostingClient hostingClient,
      VerificationTokenStore tokenStore,
      PublishedAddresses publishedAddresses,
      @Config("verificationPrefix") String verificationPrefix,
      @Config("registrarDefaultTtl") int ttl,
      @Config("attachCustomDomains") boolean attachCustomDomains) {
    this.registrarClient = registrarClient;
    this.hostingClient = hostingClient;
    this.tokenStore = tokenStore;
    this.publishedAddresses = publishedAddresses;
    this.verificationPrefix = verificationPrefix;
    this.ttl = ttl;
    this.attachCustomDomains = attachCustomDomains;
  }

  /** Fails fast if a credential needed by this run is missing. */
  public void checkConfigured() {
    if (attachCustomDomains) {
      hostingClient.checkConfigured();
    }
  }

  public ReconcileResult reconcile(DomainTarget target) {
    return reconcile(target, Optional.empty());
  }

  /**
   * Reconciles one target.
   *
   * @param suppliedToken an ownership token given by the operator, which replaces any stored one
   */
  public ReconcileResult reconcile(DomainTarget target, Optional<String> suppliedToken) {
    String fqdn = target.fqdn();
    ImmutableList.Builder<String> actions = new ImmutableList.Builder<>();
    try {
      clearConflictingRecords(target, actions);
      writeBindingRecord(target, actions);
      Optional<String> token = resolveToken(target, suppliedToken, actions);
      if (token.isPresent() && target.binding() == BindingStrategy.CNAME) {
        // A CNAME can't share its name with any other record.
        logger.atWarning().log(
            "%s is bound by CNAME; ownership TXT record not written beside it.", fqdn);
      } else if (token.isPresent()) {
        writeVerificationRecord(target, token.get(), actions);
      } else {
        logger.atInfo().log("No ownership token known for %s; TXT record left alone.", fqdn);
      }
      ImmutableList<String> done = actions.build();
      logger.atInfo().log(
          "Reconciled %s: %s.", fqdn, done.isEmpty() ? "already up to date" : done);
      return ReconcileResult.success(fqdn, done);
    } catch (ProviderException e) {
      logger.atWarning().withCause(e).log("Failed to reconcile %s.", fqdn);
      return ReconcileResult.failure(fqdn, actions.build(), e.getMessage());
    }
  }

  private void clearConflictingRecords(DomainTarget target, ImmutableList.Builder<String> actions)
      throws ProviderException {
    RecordType conflictingType = target.binding().conflictingType();
    ImmutableList<DnsRecord> conflicting =
        registrarClient.getRecords(target.rootDomain(), target.recordName(), conflictingType);
    if (conflicting.isEmpty()) {
      return;
    }
    registrarClient.deleteRecords(target.rootDomain(), target.recordName(), conflictingType);
    actions.add(
        String.format("deleted %s %s", conflictingType, dataOf(conflictingType, conflicting)));
  }

  private void writeBindingRecord(DomainTarget target, ImmutableList.Builder<String> actions)
      throws ProviderException {
    RecordType type = target.binding().recordType();
    String desired =
        target.binding() == BindingStrategy.CNAME
            ? target.cnameTarget()
            : publishedAddresses.primaryAddressFor(target.hostingSite());
    ImmutableList<DnsRecord> existing =
        registrarClient.getRecords(target.rootDomain(), target.recordName(), type);
    if (dataOf(type, existing).equals(ImmutableSet.of(normalize(type, desired)))) {
      return;
    }
    registrarClient.putRecords(
        target.rootDomain(), target.recordName(), type, ImmutableList.of(record(desired)));
    actions.add(String.format("set %s %s", type, desired));
  }

  private Optional<String> resolveToken(
      DomainTarget target, Optional<String> suppliedToken, ImmutableList.Builder<String> actions)
      throws ProviderException {
    String fqdn = target.fqdn();
    if (suppliedToken.isPresent()) {
      tokenStore.putToken(fqdn, suppliedToken.get());
      return suppliedToken;
    }
    Optional<KnownToken> known = tokenStore.get(fqdn);
    if (known.isPresent() && (known.get().token() != null || known.get().verified())) {
      return known.get().tokenValue();
    }
    if (!attachCustomDomains) {
      return Optional.empty();
    }
    AttachResult result = hostingClient.attachCustomDomain(target.hostingSite(), fqdn);
    switch (result.status()) {
      case TOKEN_ISSUED:
        tokenStore.putToken(fqdn, result.token().get());
        actions.add(String.format("attached to site %s", target.hostingSite()));
        return result.token();
      case ALREADY_VERIFIED:
        tokenStore.markVerified(fqdn);
        return Optional.empty();
      case TOKEN_PENDING:
      default:
        logger.atInfo().log("Hosting provider has not issued a token for %s yet.", fqdn);
        return Optional.empty();
    }
  }

  private void writeVerificationRecord(
      DomainTarget target, String token, ImmutableList.Builder<String> actions)
      throws ProviderException {
    String desiredValue = verificationPrefix + token;
    ImmutableList<DnsRecord> existing =
        registrarClient.getRecords(target.rootDomain(), target.recordName(), RecordType.TXT);
    ImmutableSet<String> ownershipValues =
        existing.stream()
            .map(DnsRecord::getData)
            .filter(this::isOwnershipValue)
            .collect(toImmutableSet());
    if (ownershipValues.equals(ImmutableSet.of(desiredValue))) {
      return;
    }
    ImmutableList<DnsRecord> desired =
        new ImmutableList.Builder<DnsRecord>()
            .addAll(
                existing.stream()
                    .filter(r -> !isOwnershipValue(r.getData()))
                    .map(r -> record(r.getData(), r.getTtl()))
                    .collect(toImmutableList()))
            .add(record(desiredValue))
            .build();
    registrarClient.putRecords(target.rootDomain(), target.recordName(), RecordType.TXT, desired);
    actions.add(String.format("set TXT %s", desiredValue));
  }

  private boolean isOwnershipValue(String data) {
    return data != null && data.startsWith(verificationPrefix);
  }

  private DnsRecord record(String data) {
    return DnsRecord.create(data, ttl);
  }

  private DnsRecord record(String data, Integer existingTtl) {
    return DnsRecord.create(data, existingTtl == null ? ttl : existingTtl);
  }

  private static ImmutableSet<String> dataOf(RecordType type, List<DnsRecord> records) {
    return records.stream()
        .map(DnsRecord::getData)
        .filter(Objects::nonNull)
        .map(data -> normalize(type, data))
        .collect(toImmutableSet());
  }

  /** Alias targets compare without case or trailing dot. */
  private static String normalize(RecordType type, String data) {
    return type == RecordType.CNAME
        ? DomainNameUtils.canonicalizeHostname(data)
        : data;
  }
}
