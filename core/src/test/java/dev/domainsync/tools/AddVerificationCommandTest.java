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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.domainsync.module.JsonModule;
import dev.domainsync.provider.hosting.HostingClient;
import dev.domainsync.provider.hosting.PublishedAddresses;
import dev.domainsync.provider.registrar.DnsRecord;
import dev.domainsync.provider.registrar.RecordType;
import dev.domainsync.reconcile.Reconciler;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.testing.FakeClock;
import dev.domainsync.testing.FakeRegistrarClient;
import dev.domainsync.token.VerificationTokenStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link AddVerificationCommand}. */
class AddVerificationCommandTest extends CommandTestCase<AddVerificationCommand> {

  private final FakeRegistrarClient registrar = new FakeRegistrarClient();
  private VerificationTokenStore tokenStore;

  @BeforeEach
  void beforeEach() {
    tokenStore =
        new VerificationTokenStore(
            tmpDir.resolve("tokens.json"), JsonModule.provideGson(), new FakeClock());
    command.registry =
        DesiredStateRegistry.builder().add("2100.cool", "asoos", "2100-cool").build();
    command.reconciler =
        new Reconciler(
            registrar,
            mock(HostingClient.class),
            tokenStore,
            new PublishedAddresses(ImmutableList.of("199.36.158.100"), ImmutableMap.of()),
            "firebase=",
            3600,
            false);
    command.verificationPrefix = "firebase=";
  }

  @Test
  void testBareToken() throws Exception {
    runCommand("--domain", "asoos.2100.cool", "--token", "tok-123");

    assertThat(registrar.recordsOf("2100.cool", "asoos", RecordType.TXT))
        .containsExactly(DnsRecord.create("firebase=tok-123", 3600));
    assertThat(tokenStore.get("asoos.2100.cool").get().tokenValue()).hasValue("tok-123");
    assertInStdout("asoos.2100.cool: OK (set A 199.36.158.100, set TXT firebase=tok-123)");
    assertThat(command.getExitCode()).isEqualTo(DomainSyncCli.EXIT_SUCCESS);
  }

  @Test
  void testPrefixedToken_isStrippedOnce() throws Exception {
    runCommand("--domain", "asoos.2100.cool", "--token", "firebase=tok-123");

    assertThat(tokenStore.get("asoos.2100.cool").get().tokenValue()).hasValue("tok-123");
    assertThat(registrar.recordsOf("2100.cool", "asoos", RecordType.TXT))
        .containsExactly(DnsRecord.create("firebase=tok-123", 3600));
  }

  @Test
  void testMissingToken_isUsageError() {
    assertThrows(ParameterException.class, () -> runCommand("--domain", "asoos.2100.cool"));
  }

  @Test
  void testUnknownDomain_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> runCommand("--domain", "www.2100.cool", "--token", "tok"));
  }
}
