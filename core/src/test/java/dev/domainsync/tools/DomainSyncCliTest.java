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

import dev.domainsync.config.ConfigurationException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainSyncCli}. */
class DomainSyncCliTest extends CommandTestCase<DomainSyncCliTest.NoOpCommand> {

  /** Placeholder; the CLI instantiates its own commands. */
  static final class NoOpCommand implements Command {
    @Override
    public void run() {}
  }

  private final DomainSyncCli cli =
      new DomainSyncCli(
          "domainsync",
          DomainSyncTool.COMMAND_MAP,
          () -> {
            throw new ConfigurationException(
                "Required environment variable REGISTRAR_API_KEY is not set");
          });

  @Test
  void testListCommands() throws Exception {
    assertThat(cli.run(new String[] {"-c"})).isEqualTo(DomainSyncCli.EXIT_SUCCESS);
    assertThat(getStdoutAsLines())
        .containsExactly(
            "add_verification", "list_domains", "reconcile", "schedule", "status", "verify")
        .inOrder();
  }

  @Test
  void testNoCommand_isUsageError() throws Exception {
    assertThat(cli.run(new String[] {})).isEqualTo(DomainSyncCli.EXIT_CONFIGURATION_ERROR);
    assertInStdout("The list of available subcommands is:");
  }

  @Test
  void testUnknownCommand_isUsageError() throws Exception {
    assertThat(cli.run(new String[] {"frobnicate"}))
        .isEqualTo(DomainSyncCli.EXIT_CONFIGURATION_ERROR);
  }

  @Test
  void testMissingRequiredParameter_isUsageError() throws Exception {
    assertThat(cli.run(new String[] {"add_verification", "--domain", "asoos.2100.cool"}))
        .isEqualTo(DomainSyncCli.EXIT_CONFIGURATION_ERROR);
    assertInStderr("--token");
    assertInStdout("--domain");
  }

  @Test
  void testConfigurationError_isReportedWithExitCode() throws Exception {
    assertThat(cli.run(new String[] {"reconcile"}))
        .isEqualTo(DomainSyncCli.EXIT_CONFIGURATION_ERROR);
    assertInStderr("Error: Required environment variable REGISTRAR_API_KEY is not set");
  }
}
