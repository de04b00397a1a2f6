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

package dev.domainsync.module;

import dagger.Binds;
import dagger.Module;
import dev.domainsync.util.Clock;
import dev.domainsync.util.Sleeper;
import dev.domainsync.util.SystemClock;
import dev.domainsync.util.SystemSleeper;
import jakarta.inject.Singleton;

/** Dagger module binding the system implementations of the util interfaces. */
@Module
public abstract class UtilsModule {

  @Binds
  @Singleton
  abstract Clock provideClock(SystemClock clock);

  @Binds
  @Singleton
  abstract Sleeper provideSleeper(SystemSleeper sleeper);
}
