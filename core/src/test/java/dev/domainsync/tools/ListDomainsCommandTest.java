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

import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.testing.FakeRegistrarClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ListDomainsCommand}. */
class ListDomainsCommandTest extends CommandTestCase<ListDomainsCommand> {

  @BeforeEach
  void beforeEach() {
    command.registrarClient =
        new FakeRegistrarClient().withActiveDomains("2100.cool", "Parked.Example");
    command.registry =
        DesiredStateRegistry.builder()
            .add("2100.cool", "asoos", "2100-cool")
            .add("coaching2100.com", "@", "coaching2100-com")
            .build();
  }

  @Test
  void testListDomains() throws Exception {
    runCommand();

    assertInStdout(
        "2100.cool",
        "managed",
        "parked.example",
        "unmanaged",
        "coaching2100.com",
        "in registry but not an active account domain");
    assertNotInStdout("Parked.Example");
  }
}
