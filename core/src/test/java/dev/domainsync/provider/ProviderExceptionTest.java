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

package dev.domainsync.provider;

import static com.google.common.truth.Truth.assertThat;

import dev.domainsync.provider.ProviderException.AuthorizationException;
import dev.domainsync.provider.ProviderException.PermanentProviderException;
import dev.domainsync.provider.ProviderException.RateLimitedException;
import dev.domainsync.provider.ProviderException.TransientProviderException;
import java.io.IOException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ProviderException}. */
class ProviderExceptionTest {

  @Test
  void testForStatus_rateLimited() {
    ProviderException e = ProviderException.forStatus("GET /x", 429, "slow down");
    assertThat(e).isInstanceOf(RateLimitedException.class);
    assertThat(e.isTransient()).isTrue();
    assertThat(e.getStatusCode().getAsInt()).isEqualTo(429);
    assertThat(e.getResponseBody()).hasValue("slow down");
  }

  @Test
  void testForStatus_serverError_isTransient() {
    ProviderException e = ProviderException.forStatus("GET /x", 503, "");
    assertThat(e).isInstanceOf(TransientProviderException.class);
    assertThat(ProviderException.isRetryable(e)).isTrue();
    assertThat(e).hasMessageThat().isEqualTo("GET /x failed with HTTP 503: ");
  }

  @Test
  void testForStatus_unauthorized_isPermanent() {
    ProviderException e = ProviderException.forStatus("PUT /x", 401, "bad key");
    assertThat(e).isInstanceOf(AuthorizationException.class);
    assertThat(ProviderException.isRetryable(e)).isFalse();
  }

  @Test
  void testForStatus_otherClientError_isPermanent() {
    ProviderException e = ProviderException.forStatus("PUT /x", 422, "invalid record");
    assertThat(e).isInstanceOf(PermanentProviderException.class);
    assertThat(e).isNotInstanceOf(AuthorizationException.class);
    assertThat(e.isTransient()).isFalse();
  }

  @Test
  void testIsRetryable_otherExceptions() {
    assertThat(ProviderException.isRetryable(new IOException("boom"))).isFalse();
    assertThat(ProviderException.isRetryable(new IllegalStateException())).isFalse();
    assertThat(
            ProviderException.isRetryable(
                new TransientProviderException("network", new IOException("reset"))))
        .isTrue();
  }
}
