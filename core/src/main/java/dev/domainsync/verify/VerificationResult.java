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

import dev.domainsync.batch.DomainOutcome;
import java.util.Optional;

/**
 * Outcome of verifying one hostname: a log entry, or the error that kept one from being written.
 */
public record VerificationResult(
    String fqdn, Optional<VerificationLogEntry> entry, Optional<String> error) {

  public static VerificationResult of(VerificationLogEntry entry) {
    return new VerificationResult(entry.domain(), Optional.of(entry), Optional.empty());
  }

  public static VerificationResult failure(String fqdn, String error) {
    return new VerificationResult(fqdn, Optional.empty(), Optional.of(error));
  }

  /** Live hostnames succeeded, pending ones are pending, and degraded ones have failed. */
  public DomainOutcome outcome() {
    if (entry.isEmpty()) {
      return DomainOutcome.FAILED;
    }
    DomainState state = entry.get().overallState();
    if (state == DomainState.LIVE) {
      return DomainOutcome.SUCCEEDED;
    }
    return state.isPending() ? DomainOutcome.PENDING : DomainOutcome.FAILED;
  }
}
