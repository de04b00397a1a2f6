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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.provider.ProviderException;
import dev.domainsync.provider.hosting.HostingClient;
import dev.domainsync.provider.hosting.HostingDomainStatus;
import dev.domainsync.provider.hosting.PublishedAddresses;
import dev.domainsync.registry.DomainTarget;
import dev.domainsync.token.VerificationTokenStore;
import dev.domainsync.token.VerificationTokenStore.KnownToken;
import dev.domainsync.util.Clock;
import dev.domainsync.verify.VerificationLogEntry.DnsCheck;
import dev.domainsync.verify.VerificationLogEntry.HostingCheck;
import dev.domainsync.verify.VerificationLogEntry.HttpCheck;
import dev.domainsync.verify.VerificationLogEntry.TxtCheck;
import jakarta.inject.Inject;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Probes one hostname, classifies it and appends the result to the verification log.
 *
 * <p>Probe failures are results, not errors: an unreachable hostname is simply not live yet.
 */
public class Verifier {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DnsResolver dnsResolver;
  private final HttpsProber httpsProber;
  private final PublishedAddresses publishedAddresses;
  private final VerificationTokenStore tokenStore;
  private final HostingClient hostingClient;
  private final VerificationLog verificationLog;
  private final Clock clock;
  private final String verificationPrefix;
  private final boolean queryDomainStatus;

  @Inject
  public Verifier(
      DnsResolver dnsResolver,
      HttpsProber httpsProber,
      PublishedAddresses publishedAddresses,
      VerificationTokenStore tokenStore,
      HostingClient hostingClient,
      VerificationLog verificationLog,
      Clock clock,
      @Config("verificationPrefix") String verificationPrefix,
      @Config("queryDomainStatus") boolean queryDomainStatus) {
    this.dnsResolver = dnsResolver;
    this.httpsProber = httpsProber;
    this.publishedAddresses = publishedAddresses;
    this.tokenStore = tokenStore;
    this.hostingClient = hostingClient;
    this.verificationLog = verificationLog;
    this.clock = clock;
    this.verificationPrefix = verificationPrefix;
    this.queryDomainStatus = queryDomainStatus;
  }

  /** Fails fast if a credential needed by this run is missing. */
  public void checkConfigured() {
    if (queryDomainStatus) {
      hostingClient.checkConfigured();
    }
  }

  public VerificationLogEntry verify(DomainTarget target) {
    String fqdn = target.fqdn();
    DnsCheck dns = checkDns(fqdn, publishedAddresses.addressesFor(target.hostingSite()));
    TxtCheck txt = checkTxt(fqdn);
    HttpCheck http = httpsProber.probe(fqdn);
    HostingCheck hosting = queryDomainStatus ? checkHosting(target) : null;
    Optional<DomainState> previous = verificationLog.latest(fqdn).map(e -> e.overallState());
    DomainState state =
        DomainStateClassifier.classify(dns.resolved(), txt.present(), http.reachable(), previous);
    VerificationLogEntry entry =
        new VerificationLogEntry(fqdn, clock.nowUtc(), dns, txt, http, hosting, state);
    verificationLog.append(entry);
    if (previous.isPresent() && previous.get() != state) {
      logger.atInfo().log("%s changed from %s to %s.", fqdn, previous.get(), state);
    } else {
      logger.atFine().log("%s is %s.", fqdn, state);
    }
    return entry;
  }

  private DnsCheck checkDns(String fqdn, ImmutableList<String> expected) {
    DnsLookupResult result = dnsResolver.lookupAddresses(fqdn);
    boolean resolved = result.values().stream().anyMatch(expected::contains);
    return new DnsCheck(resolved, result.values(), expected, result.error().orElse(null));
  }

  /**
   * Looks for the ownership record. If a token is on record, that exact value must be published;
   * otherwise any value with the ownership prefix will do.
   */
  private TxtCheck checkTxt(String fqdn) {
    DnsLookupResult result = dnsResolver.lookupTxt(fqdn);
    ImmutableList<String> ownershipValues =
        result.values().stream()
            .filter(v -> v.startsWith(verificationPrefix))
            .collect(toImmutableList());
    Optional<String> knownToken = tokenStore.get(fqdn).flatMap(KnownToken::tokenValue);
    boolean present =
        knownToken.isPresent()
            ? ownershipValues.contains(verificationPrefix + knownToken.get())
            : !ownershipValues.isEmpty();
    return new TxtCheck(present, ownershipValues, result.error().orElse(null));
  }

  @Nullable
  private HostingCheck checkHosting(DomainTarget target) {
    try {
      HostingDomainStatus status =
          hostingClient.getDomainStatus(target.hostingSite(), target.fqdn());
      if (status.verified()) {
        tokenStore.markVerified(target.fqdn());
      }
      return new HostingCheck(status.verified(), status.sslState());
    } catch (ProviderException e) {
      logger.atWarning().withCause(e).log(
          "Could not get hosting status of %s; recording without it.", target.fqdn());
      return null;
    }
  }
}
