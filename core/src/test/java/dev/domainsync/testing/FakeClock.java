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

package dev.domainsync.testing;

import dev.domainsync.util.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.concurrent.ThreadSafe;

/** A mock clock for testing purposes that supports telling, setting, and advancing the time. */
@ThreadSafe
public final class FakeClock implements Clock {

  private static final long serialVersionUID = 1L;

  private final AtomicReference<Instant> currentTime;

  /** Creates a FakeClock that starts at 2026-01-01T00:00:00Z. */
  public FakeClock() {
    this(Instant.parse("2026-01-01T00:00:00Z"));
  }

  public FakeClock(Instant startTime) {
    currentTime = new AtomicReference<>(startTime);
  }

  @Override
  public Instant nowUtc() {
    return currentTime.get();
  }

  public void advanceBy(Duration duration) {
    currentTime.updateAndGet(now -> now.plus(duration));
  }

  public void setTo(Instant time) {
    currentTime.set(time);
  }
}
