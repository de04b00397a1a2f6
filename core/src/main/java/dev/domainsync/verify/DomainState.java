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

/** Where a hostname stands on its way to being served by its hosting site. */
public enum DomainState {
  /** Never verified. */
  UNCONFIGURED,
  /** The hostname doesn't resolve to a published hosting address yet. */
  DNS_PENDING,
  /** Addresses are right but the ownership TXT record isn't visible yet. */
  VERIFICATION_PENDING,
  /** DNS and ownership are in place but HTTPS isn't serving yet. */
  SSL_PENDING,
  /** Resolves correctly, ownership is proven and HTTPS answers. */
  LIVE,
  /** Was live, but DNS or HTTPS has since stopped working. */
  DEGRADED;

  public boolean isPending() {
    return this == DNS_PENDING || this == VERIFICATION_PENDING || this == SSL_PENDING;
  }
}
