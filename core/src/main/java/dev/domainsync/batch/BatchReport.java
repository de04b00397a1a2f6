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

import com.google.common.collect.ImmutableList;
import java.util.function.Function;

/**
 * Results of one batch run, in registry order.
 *
 * @param results one result per domain that was processed
 * @param abandoned hostnames left unprocessed when the run timed out
 */
public record BatchReport<R>(
    ImmutableList<R> results, ImmutableList<String> abandoned, BatchSummary summary) {

  static <R> BatchReport<R> create(
      ImmutableList<R> results,
      ImmutableList<String> abandoned,
      Function<? super R, DomainOutcome> outcomeOf) {
    int succeeded = 0;
    int pending = 0;
    int failed = 0;
    for (R result : results) {
      switch (outcomeOf.apply(result)) {
        case SUCCEEDED -> succeeded++;
        case PENDING -> pending++;
        case FAILED -> failed++;
      }
    }
    return new BatchReport<>(
        results, abandoned, new BatchSummary(succeeded, pending, failed, abandoned.size()));
  }
}
