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

package dev.domainsync.config;

import static com.google.common.base.Preconditions.checkNotNull;

/** API key and secret for the DNS registrar, read from the environment. */
public record RegistrarCredentials(String apiKey, String apiSecret) {

  public RegistrarCredentials {
    checkNotNull(apiKey, "apiKey");
    checkNotNull(apiSecret, "apiSecret");
  }

  /** Returns the value of the {@code Authorization} header the registrar expects. */
  public String authorizationHeader() {
    return String.format("sso-key %s:%s", apiKey, apiSecret);
  }

  @Override
  public String toString() {
    return "RegistrarCredentials{apiKey=<redacted>, apiSecret=<redacted>}";
  }
}
