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

import java.io.Serializable;
import java.time.Instant;
import javax.annotation.concurrent.ThreadSafe;

/**
 * A clock that tells the current time in UTC.
 *
 * <p>Inject this instead of calling {@link Instant#now()} so that tests can control time.
 */
@ThreadSafe
public interface Clock extends Serializable {

  /** Returns current instant. */
  Instant nowUtc();
}
