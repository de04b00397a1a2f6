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

import static dev.domainsync.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.gson.annotations.Expose;
import java.util.List;
import javax.annotation.Nullable;

/** Data models for the hosting provider's custom domain API. */
public final class HostingModels {

  private HostingModels() {}

  /** Ownership state reported once the provider has confirmed the TXT token. */
  public static final String OWNERSHIP_ACTIVE = "OWNERSHIP_ACTIVE";

  /** Certificate state once the TLS certificate is issued and serving. */
  public static final String CERT_ACTIVE = "CERT_ACTIVE";

  /** A hostname attached to a hosting site. */
  public record CustomDomain(
      @Expose String name,
      @Expose @Nullable String ownershipState,
      @Expose @Nullable String hostState,
      @Expose @Nullable Cert cert,
      @Expose @Nullable RequiredDnsUpdates requiredDnsUpdates) {

    public boolean isOwnershipActive() {
      return OWNERSHIP_ACTIVE.equals(ownershipState);
    }
  }

  /** The TLS certificate the provider manages for a custom domain. */
  public record Cert(@Expose @Nullable String type, @Expose @Nullable String state) {}

  /** DNS changes the provider still needs to see before it can serve the hostname. */
  public record RequiredDnsUpdates(
      @Expose @Nullable String checkTime, @Expose List<DnsRecordSet> desired) {

    public RequiredDnsUpdates {
      desired = nullToEmptyImmutableCopy(desired);
    }
  }

  /** A set of records for one name. */
  public record DnsRecordSet(@Expose String domainName, @Expose List<DnsRecordEntry> records) {

    public DnsRecordSet {
      records = nullToEmptyImmutableCopy(records);
    }
  }

  /** A single record the provider wants added or removed. */
  public record DnsRecordEntry(
      @Expose String domainName,
      @Expose String type,
      @Expose String rdata,
      @Expose @Nullable String requiredAction) {}

  /** Error envelope returned with unsuccessful responses. */
  public record ErrorResponse(@Expose @Nullable ErrorBody error) {}

  /** Details of an unsuccessful call. */
  public record ErrorBody(
      @Expose int code, @Expose @Nullable String message, @Expose @Nullable String status) {}
}
