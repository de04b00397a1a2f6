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

package dev.domainsync.scheduler;

import dev.domainsync.batch.BatchSummary;
import java.time.Instant;
import java.util.Optional;

/**
 * One completed run of a periodic job.
 *
 * @param state {@link JobState#SUCCEEDED} or {@link JobState#FAILED}
 * @param summary the domain counts, absent if the run died before producing them
 * @param error what killed the run, if something did
 */
public record JobRun(
    JobType type,
    JobState state,
    Instant started,
    Instant finished,
    Optional<BatchSummary> summary,
    Optional<String> error) {}
