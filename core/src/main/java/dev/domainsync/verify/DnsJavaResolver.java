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
import dev.domainsync.config.ConfigurationException;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.util.Retrier;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.function.Function;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

/**
 * {@link DnsResolver} that queries recursive resolvers with dnsjava.
 *
 * <p>Lookups bypass the dnsjava cache so that each verification round sees what is published now.
 * A lookup that fails with a temporary error is retried.
 */
public class DnsJavaResolver implements DnsResolver {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Resolver resolver;
  private final Retrier retrier;

  @Inject
  public DnsJavaResolver(
      @Config("resolverAddresses") ImmutableList<String> resolverAddresses,
      @Config("probeTimeout") Duration timeout,
      @Named("providerRetrier") Retrier retrier) {
    this.resolver = createResolver(resolverAddresses, timeout);
    this.retrier = retrier;
  }

  private static Resolver createResolver(ImmutableList<String> addresses, Duration timeout) {
    ExtendedResolver resolver;
    try {
      resolver =
          addresses.isEmpty()
              ? new ExtendedResolver()
              : new ExtendedResolver(addresses.toArray(new String[0]));
    } catch (UnknownHostException e) {
      throw new ConfigurationException("Invalid resolver address: " + e.getMessage(), e);
    }
    resolver.setTimeout(timeout);
    return resolver;
  }

  @Override
  public DnsLookupResult lookupAddresses(String fqdn) {
    return lookup(fqdn, Type.A, r -> ((ARecord) r).getAddress().getHostAddress());
  }

  @Override
  public DnsLookupResult lookupTxt(String fqdn) {
    return lookup(fqdn, Type.TXT, r -> String.join("", ((TXTRecord) r).getStrings()));
  }

  private DnsLookupResult lookup(String fqdn, int type, Function<Record, String> extractor) {
    Name name;
    try {
      name = Name.fromString(fqdn, Name.root);
    } catch (TextParseException e) {
      return DnsLookupResult.failed("Invalid hostname: " + e.getMessage());
    }
    try {
      return retrier.callWithRetry(
          () -> lookupOnce(name, type, extractor), TemporaryLookupFailure.class);
    } catch (TemporaryLookupFailure e) {
      logger.atInfo().log("%s lookup of %s failed: %s", Type.string(type), fqdn, e.getMessage());
      return DnsLookupResult.failed(e.getMessage());
    }
  }

  private DnsLookupResult lookupOnce(Name name, int type, Function<Record, String> extractor) {
    Lookup lookup = new Lookup(name, type);
    lookup.setResolver(resolver);
    lookup.setCache(null);
    Record[] records = lookup.run();
    switch (lookup.getResult()) {
      case Lookup.SUCCESSFUL:
        return DnsLookupResult.of(
            Arrays.stream(records)
                .filter(r -> r.getType() == type)
                .map(extractor)
                .collect(toImmutableList()));
      case Lookup.HOST_NOT_FOUND:
      case Lookup.TYPE_NOT_FOUND:
        return DnsLookupResult.of(ImmutableList.of());
      case Lookup.TRY_AGAIN:
        throw new TemporaryLookupFailure(lookup.getErrorString());
      default:
        return DnsLookupResult.failed(lookup.getErrorString());
    }
  }

  /** A lookup failure that may go away on retry, e.g. a resolver timeout. */
  private static class TemporaryLookupFailure extends RuntimeException {
    TemporaryLookupFailure(String message) {
      super(message);
    }
  }
}
