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

package dev.domainsync.batch;

/**
 * Counts of domain outcomes in one batch run.
 *
 * @param abandoned domains never processed because the run timed out
 */
public record BatchSummary(int succeeded, int pending, int failed, int abandoned) {

  /** Returns whether no domain failed or was left unprocessed. Pending domains are fine. */
  public boolean isSuccess() {
    return failed == 0 && abandoned == 0;
  }

  public int total() {
    return succeeded + pending + failed + abandoned;
  }

  @Override
  public String toString() {
    return String.format(
        "%d succeeded, %d pending, %d failed, %d not processed",
        succeeded, pending, failed, abandoned);
  }
}
