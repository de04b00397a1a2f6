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

package dev.domainsync.provider.hosting;

import javax.annotation.Nullable;

/** Provisioning state of the TLS certificate for a custom domain. */
public enum SslState {
  ACTIVE,
  PENDING,
  UNKNOWN;

  static SslState fromCertState(@Nullable String certState) {
    if (certState == null) {
      return UNKNOWN;
    }
    return HostingModels.CERT_ACTIVE.equals(certState) ? ACTIVE : PENDING;
  }
}
