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

package dev.domainsync.util;

import static com.google.common.truth.Truth.assertThat;
import static dev.domainsync.util.DomainNameUtils.canonicalizeHostname;
import static dev.domainsync.util.DomainNameUtils.checkValidDomainName;
import static dev.domainsync.util.DomainNameUtils.toFqdn;
import static dev.domainsync.util.DomainNameUtils.toRecordName;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Unit tests for {@link DomainNameUtils}. */
class DomainNameUtilsTest {

  @Test
  void testCanonicalizeHostname() {
    assertThat(canonicalizeHostname("ASOOS.2100.Cool.")).isEqualTo("asoos.2100.cool");
    assertThat(canonicalizeHostname(" www.example.com ")).isEqualTo("www.example.com");
  }

  @Test
  void testToRecordName_emptyIsApex() {
    assertThat(toRecordName("")).isEqualTo("@");
    assertThat(toRecordName(null)).isEqualTo("@");
    assertThat(toRecordName("WWW")).isEqualTo("www");
  }

  @Test
  void testToFqdn() {
    assertThat(toFqdn("2100.cool", "asoos")).isEqualTo("asoos.2100.cool");
    assertThat(toFqdn("coaching2100.com", "@")).isEqualTo("coaching2100.com");
    assertThat(toFqdn("coaching2100.com", "")).isEqualTo("coaching2100.com");
  }

  @Test
  void testCheckValidDomainName() {
    assertThat(checkValidDomainName("2100.cool.")).isEqualTo("2100.cool");
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> checkValidDomainName("bad..name"));
    assertThat(thrown).hasMessageThat().contains("Invalid domain name");
  }
}
