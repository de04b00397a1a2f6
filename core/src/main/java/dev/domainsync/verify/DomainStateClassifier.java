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

import java.util.Optional;

/**
 * Derives a hostname's state from one round of probe results and its previous state.
 *
 * <p>A hostname that has never been live moves forward through DNS, ownership and HTTPS in that
 * order. Once it has been live, the ownership record is no longer required, and losing DNS or
 * HTTPS makes it {@link DomainState#DEGRADED} until both work again.
 */
public final class DomainStateClassifier {

  public static DomainState classify(
      boolean dnsResolved,
      boolean ownershipRecordPresent,
      boolean httpsReachable,
      Optional<DomainState> previous) {
    boolean wasLive =
        previous.isPresent()
            && (previous.get() == DomainState.LIVE || previous.get() == DomainState.DEGRADED);
    if (wasLive) {
      return dnsResolved && httpsReachable ? DomainState.LIVE : DomainState.DEGRADED;
    }
    if (!dnsResolved) {
      return DomainState.DNS_PENDING;
    }
    if (!ownershipRecordPresent) {
      return DomainState.VERIFICATION_PENDING;
    }
    if (!httpsReachable) {
      return DomainState.SSL_PENDING;
    }
    return DomainState.LIVE;
  }

  private DomainStateClassifier() {}
}
