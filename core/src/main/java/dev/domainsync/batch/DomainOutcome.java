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

/** How one domain fared in a batch run, for exit codes and summaries. */
public enum DomainOutcome {
  SUCCEEDED,
  /** Nothing is wrong yet, but the domain isn't done either, e.g. waiting on DNS propagation. */
  PENDING,
  FAILED
}
