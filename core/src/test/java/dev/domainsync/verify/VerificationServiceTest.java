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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import dev.domainsync.batch.BatchReport;
import dev.domainsync.batch.BatchSummary;
import dev.domainsync.batch.DomainBatchRunner;
import dev.domainsync.batch.DomainOutcome;
import dev.domainsync.config.ConfigurationException;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.registry.DomainTarget;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link VerificationService}. */
class VerificationServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final DesiredStateRegistry registry =
      DesiredStateRegistry.builder()
          .add("2100.cool", "asoos", "2100-cool")
          .add("2100.cool", "vision", "2100-cool")
          .add("coaching2100.com", "@", "coaching2100-com")
          .add("coaching2100.com", "www", "coaching2100-com")
          .build();
  private final Verifier verifier = mock(Verifier.class);
  private final VerificationService service =
      new VerificationService(
          registry,
          verifier,
          new DomainBatchRunner(
              MoreExecutors.newDirectExecutorService(),
              Duration.ofMinutes(1),
              Duration.ofMinutes(1)));

  @Test
  void testVerify_classifiesOutcomes() {
    stubState("asoos.2100.cool", DomainState.LIVE);
    stubState("vision.2100.cool", DomainState.SSL_PENDING);
    stubState("coaching2100.com", DomainState.DEGRADED);
    when(verifier.verify(registry.lookup("www.coaching2100.com").get()))
        .thenThrow(new IllegalStateException("disk full"));

    BatchReport<VerificationResult> report = service.verify(Optional.empty());

    assertThat(report.summary()).isEqualTo(new BatchSummary(1, 1, 2, 0));
    VerificationResult failed = report.results().get(3);
    assertThat(failed.fqdn()).isEqualTo("www.coaching2100.com");
    assertThat(failed.entry()).isEmpty();
    assertThat(failed.error().get()).contains("disk full");
    assertThat(failed.outcome()).isEqualTo(DomainOutcome.FAILED);
  }

  @Test
  void testVerify_singleHostname() {
    stubState("vision.2100.cool", DomainState.LIVE);

    BatchReport<VerificationResult> report = service.verify(Optional.of("vision.2100.cool"));

    assertThat(report.results()).hasSize(1);
    assertThat(report.summary().isSuccess()).isTrue();
  }

  @Test
  void testVerify_unknownHostname_throwsBeforeProbing() {
    assertThrows(
        IllegalArgumentException.class, () -> service.verify(Optional.of("other.2100.cool")));
    verify(verifier, never()).verify(any());
  }

  @Test
  void testVerify_missingCredential_throwsBeforeProbing() {
    doThrow(new ConfigurationException("HOSTING_ACCESS_TOKEN"))
        .when(verifier)
        .checkConfigured();

    assertThrows(ConfigurationException.class, () -> service.verify(Optional.empty()));
    verify(verifier, never()).verify(any());
  }

  private void stubState(String fqdn, DomainState state) {
    DomainTarget target = registry.lookup(fqdn).get();
    when(verifier.verify(target))
        .thenReturn(VerificationLogTest.entry(fqdn, NOW, state));
  }
}
