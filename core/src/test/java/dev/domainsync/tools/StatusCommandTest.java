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

package dev.domainsync.tools;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import dev.domainsync.module.JsonModule;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.verify.DomainState;
import dev.domainsync.verify.VerificationLog;
import dev.domainsync.verify.VerificationLogEntry;
import dev.domainsync.verify.VerificationLogEntry.DnsCheck;
import dev.domainsync.verify.VerificationLogEntry.HttpCheck;
import dev.domainsync.verify.VerificationLogEntry.TxtCheck;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StatusCommand}. */
class StatusCommandTest extends CommandTestCase<StatusCommand> {

  private VerificationLog verificationLog;

  @BeforeEach
  void beforeEach() {
    verificationLog =
        new VerificationLog(tmpDir.resolve("verification-log.jsonl"), JsonModule.provideGson());
    command.registry =
        DesiredStateRegistry.builder()
            .add("2100.cool", "asoos", "2100-cool")
            .add("2100.cool", "vision", "2100-cool")
            .build();
    command.verificationLog = verificationLog;
  }

  @Test
  void testLatestStates() throws Exception {
    verificationLog.append(
        entry("asoos.2100.cool", "2026-03-01T12:00:00Z", DomainState.DNS_PENDING));
    verificationLog.append(entry("asoos.2100.cool", "2026-03-01T13:00:00Z", DomainState.LIVE));

    runCommand();

    List<String> lines = getStdoutAsLines();
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0)).startsWith("asoos.2100.cool");
    assertThat(lines.get(0)).contains("LIVE");
    assertThat(lines.get(0)).contains("checked 2026-03-01T13:00:00Z");
    assertThat(lines.get(1)).startsWith("vision.2100.cool");
    assertThat(lines.get(1)).contains("UNCONFIGURED");
    assertThat(lines.get(1)).contains("never checked");
  }

  @Test
  void testHistory() throws Exception {
    verificationLog.append(
        entry("asoos.2100.cool", "2026-03-01T12:00:00Z", DomainState.DNS_PENDING));
    verificationLog.append(entry("vision.2100.cool", "2026-03-01T12:00:00Z", DomainState.LIVE));
    verificationLog.append(
        entry("asoos.2100.cool", "2026-03-01T13:00:00Z", DomainState.SSL_PENDING));

    runCommand("--domain", "asoos.2100.cool");

    List<String> lines = getStdoutAsLines();
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0)).startsWith("2026-03-01T12:00:00Z asoos.2100.cool: DNS_PENDING");
    assertThat(lines.get(1)).startsWith("2026-03-01T13:00:00Z asoos.2100.cool: SSL_PENDING");
  }

  private static VerificationLogEntry entry(String fqdn, String timestamp, DomainState state) {
    return new VerificationLogEntry(
        fqdn,
        Instant.parse(timestamp),
        new DnsCheck(false, ImmutableList.of(), ImmutableList.of(), null),
        new TxtCheck(false, ImmutableList.of(), null),
        new HttpCheck(false, null, null),
        null,
        state);
  }
}
