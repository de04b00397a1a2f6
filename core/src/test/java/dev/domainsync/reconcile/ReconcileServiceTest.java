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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.Mockito.mock;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import dev.domainsync.batch.BatchReport;
import dev.domainsync.batch.BatchSummary;
import dev.domainsync.batch.DomainBatchRunner;
import dev.domainsync.module.JsonModule;
import dev.domainsync.provider.ProviderException;
import dev.domainsync.provider.hosting.HostingClient;
import dev.domainsync.provider.hosting.PublishedAddresses;
import dev.domainsync.provider.registrar.RecordType;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.testing.FakeClock;
import dev.domainsync.testing.FakeRegistrarClient;
import dev.domainsync.token.VerificationTokenStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link ReconcileService}. */
class ReconcileServiceTest {

  @TempDir Path tempDir;

  private final FakeRegistrarClient registrar = new FakeRegistrarClient();
  private final DesiredStateRegistry registry =
      DesiredStateRegistry.builder()
          .add("2100.cool", "asoos", "2100-cool")
          .add("2100.cool", "vision", "2100-cool")
          .add("coaching2100.com", "@", "coaching2100-com")
          .add("coaching2100.com", "www", "coaching2100-com")
          .build();
  private ReconcileService service;

  @BeforeEach
  void setUp() {
    Reconciler reconciler =
        new Reconciler(
            registrar,
            mock(HostingClient.class),
            new VerificationTokenStore(
                tempDir.resolve("tokens.json"), JsonModule.provideGson(), new FakeClock()),
            new PublishedAddresses(ImmutableList.of("199.36.158.100"), ImmutableMap.of()),
            "firebase=",
            3600,
            false);
    service =
        new ReconcileService(
            registry,
            reconciler,
            new DomainBatchRunner(
                MoreExecutors.newDirectExecutorService(),
                Duration.ofMinutes(1),
                Duration.ofMinutes(1)));
  }

  @Test
  void testReconcile_allHostnames() {
    BatchReport<ReconcileResult> report = service.reconcile(Optional.empty());

    assertThat(report.summary()).isEqualTo(new BatchSummary(4, 0, 0, 0));
    assertThat(registrar.getWrites())
        .containsExactly(
            "PUT 2100.cool/asoos/A",
            "PUT 2100.cool/vision/A",
            "PUT coaching2100.com/@/A",
            "PUT coaching2100.com/www/A");
  }

  @Test
  void testReconcile_oneHostnameFails_othersStillReconciled() {
    registrar.failOn(
        "2100.cool",
        "vision",
        RecordType.CNAME,
        ProviderException.forStatus("Registrar GET", 403, "forbidden"));

    BatchReport<ReconcileResult> report = service.reconcile(Optional.empty());

    assertThat(report.summary()).isEqualTo(new BatchSummary(3, 0, 1, 0));
    assertThat(report.results().get(1).isSuccess()).isFalse();
    assertThat(registrar.getWrites()).hasSize(3);
  }

  @Test
  void testReconcile_singleHostname() {
    BatchReport<ReconcileResult> report = service.reconcile(Optional.of("coaching2100.com"));

    assertThat(report.results()).hasSize(1);
    assertThat(registrar.getWrites()).containsExactly("PUT coaching2100.com/@/A");
  }
}
