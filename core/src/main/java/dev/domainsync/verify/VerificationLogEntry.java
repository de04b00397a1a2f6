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

import static dev.domainsync.util.CollectionUtils.nullToEmptyImmutableCopy;

import com.google.gson.annotations.Expose;
import dev.domainsync.provider.hosting.SslState;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

/**
 * One line of the verification log: the probe results for a hostname at one point in time and the
 * state derived from them.
 */
public record VerificationLogEntry(
    @Expose String domain,
    @Expose Instant timestamp,
    @Expose DnsCheck dns,
    @Expose TxtCheck txt,
    @Expose HttpCheck http,
    @Expose @Nullable HostingCheck hosting,
    @Expose DomainState overallState) {

  /**
   * Result of resolving the hostname.
   *
   * @param resolved whether any resolved address is one the hosting site publishes
   */
  public record DnsCheck(
      @Expose boolean resolved,
      @Expose List<String> addresses,
      @Expose List<String> expected,
      @Expose @Nullable String error) {

    public DnsCheck {
      addresses = nullToEmptyImmutableCopy(addresses);
      expected = nullToEmptyImmutableCopy(expected);
    }
  }

  /**
   * Result of looking for the ownership TXT record.
   *
   * @param values the ownership values found, without unrelated TXT records
   */
  public record TxtCheck(
      @Expose boolean present, @Expose List<String> values, @Expose @Nullable String error) {

    public TxtCheck {
      values = nullToEmptyImmutableCopy(values);
    }
  }

  /** Result of requesting the site over HTTPS. */
  public record HttpCheck(
      @Expose boolean reachable,
      @Expose @Nullable Integer statusCode,
      @Expose @Nullable String error) {}

  /** What the hosting provider itself reports, when asked. */
  public record HostingCheck(@Expose boolean verified, @Expose SslState sslState) {}
}
