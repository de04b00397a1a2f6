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

import java.util.Optional;

/** Outcome of attaching a hostname to a hosting site. */
public record AttachResult(Status status, Optional<String> token) {

  /** What the provider said. */
  public enum Status {
    /** The provider issued an ownership token to publish. */
    TOKEN_ISSUED,
    /** The hostname was already attached and its ownership confirmed. */
    ALREADY_VERIFIED,
    /** The hostname is attached but the provider hasn't issued a token yet. */
    TOKEN_PENDING
  }

  public static AttachResult tokenIssued(String token) {
    return new AttachResult(Status.TOKEN_ISSUED, Optional.of(token));
  }

  public static AttachResult alreadyVerified() {
    return new AttachResult(Status.ALREADY_VERIFIED, Optional.empty());
  }

  public static AttachResult tokenPending() {
    return new AttachResult(Status.TOKEN_PENDING, Optional.empty());
  }
}
