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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import dev.domainsync.module.JsonModule;
import dev.domainsync.provider.hosting.SslState;
import dev.domainsync.verify.VerificationLogEntry.DnsCheck;
import dev.domainsync.verify.VerificationLogEntry.HostingCheck;
import dev.domainsync.verify.VerificationLogEntry.HttpCheck;
import dev.domainsync.verify.VerificationLogEntry.TxtCheck;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link VerificationLog}. */
class VerificationLogTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  @TempDir Path tempDir;

  private Path file;
  private VerificationLog log;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("logs/verification-log.jsonl");
    log = newLog();
  }

  @Test
  void testEmptyLog() {
    assertThat(log.latest("asoos.2100.cool")).isEmpty();
    assertThat(log.history("asoos.2100.cool")).isEmpty();
  }

  @Test
  void testAppend_roundTripsThroughFile() throws Exception {
    VerificationLogEntry entry =
        new VerificationLogEntry(
            "asoos.2100.cool",
            T0,
            new DnsCheck(
                true,
                ImmutableList.of("199.36.158.100"),
                ImmutableList.of("199.36.158.100"),
                null),
            new TxtCheck(true, ImmutableList.of("firebase=tok"), null),
            new HttpCheck(true, 200, null),
            new HostingCheck(true, SslState.ACTIVE),
            DomainState.LIVE);

    log.append(entry);

    assertThat(Files.readAllLines(file, UTF_8)).hasSize(1);
    assertThat(newLog().latest("asoos.2100.cool")).hasValue(entry);
  }

  @Test
  void testLatestAndHistory() {
    log.append(entry("asoos.2100.cool", T0, DomainState.DNS_PENDING));
    log.append(entry("vision.2100.cool", T0, DomainState.LIVE));
    log.append(entry("asoos.2100.cool", T0.plusSeconds(60), DomainState.SSL_PENDING));

    VerificationLog reread = newLog();
    assertThat(reread.latest("ASOOS.2100.cool").get().overallState())
        .isEqualTo(DomainState.SSL_PENDING);
    assertThat(reread.latestByDomain().keySet())
        .containsExactly("asoos.2100.cool", "vision.2100.cool");
    assertThat(reread.history("asoos.2100.cool").stream().map(VerificationLogEntry::overallState))
        .containsExactly(DomainState.DNS_PENDING, DomainState.SSL_PENDING)
        .inOrder();
  }

  @Test
  void testMalformedAndPartialLines_areSkipped() throws Exception {
    log.append(entry("asoos.2100.cool", T0, DomainState.LIVE));
    Files.writeString(file, "not json\n{\"domain\":\"vision.2", UTF_8, StandardOpenOption.APPEND);

    VerificationLog reread = newLog();
    assertThat(reread.latestByDomain().keySet()).containsExactly("asoos.2100.cool");

    reread.append(entry("vision.2100.cool", T0, DomainState.DNS_PENDING));

    VerificationLog third = newLog();
    assertThat(third.latest("vision.2100.cool").get().overallState())
        .isEqualTo(DomainState.DNS_PENDING);
    assertThat(third.latest("asoos.2100.cool").get().overallState()).isEqualTo(DomainState.LIVE);
  }

  @Test
  void testConcurrentAppends_neverInterleave() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        String domain = "host" + (i % 10) + ".2100.cool";
        futures.add(executor.submit(() -> log.append(entry(domain, T0, DomainState.LIVE))));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      MoreExecutors.shutdownAndAwaitTermination(executor, 30, TimeUnit.SECONDS);
    }

    assertThat(Files.readAllLines(file, UTF_8)).hasSize(200);
    VerificationLog reread = newLog();
    assertThat(reread.latestByDomain()).hasSize(10);
    assertThat(reread.history("host3.2100.cool")).hasSize(20);
  }

  private VerificationLog newLog() {
    return new VerificationLog(file, JsonModule.provideGson());
  }

  static VerificationLogEntry entry(String domain, Instant timestamp, DomainState state) {
    return new VerificationLogEntry(
        domain,
        timestamp,
        new DnsCheck(false, ImmutableList.of(), ImmutableList.of("199.36.158.100"), null),
        new TxtCheck(false, ImmutableList.of(), null),
        new HttpCheck(false, null, "java.net.UnknownHostException"),
        null,
        state);
  }
}
