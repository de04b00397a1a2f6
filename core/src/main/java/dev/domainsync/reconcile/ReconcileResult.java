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

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Outcome of reconciling one hostname.
 *
 * @param fqdn the hostname
 * @param changed whether any write was issued
 * @param actions human-readable descriptions of the writes issued, in order
 * @param error why reconciliation stopped early, if it did
 */
public record ReconcileResult(
    String fqdn, boolean changed, ImmutableList<String> actions, Optional<String> error) {

  public static ReconcileResult success(String fqdn, ImmutableList<String> actions) {
    return new ReconcileResult(fqdn, !actions.isEmpty(), actions, Optional.empty());
  }

  public static ReconcileResult failure(
      String fqdn, ImmutableList<String> actionsBeforeFailure, String error) {
    return new ReconcileResult(
        fqdn, !actionsBeforeFailure.isEmpty(), actionsBeforeFailure, Optional.of(error));
  }

  public boolean isSuccess() {
    return error.isEmpty();
  }
}
