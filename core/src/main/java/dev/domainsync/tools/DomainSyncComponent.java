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

import dagger.Component;
import dev.domainsync.batch.BatchModule;
import dev.domainsync.config.CredentialModule;
import dev.domainsync.config.DomainSyncConfig.ConfigModule;
import dev.domainsync.module.JsonModule;
import dev.domainsync.module.UtilsModule;
import dev.domainsync.provider.ProviderModule;
import dev.domainsync.verify.VerifyModule;
import jakarta.inject.Singleton;

/** Dagger component for the command-line tool. */
@Singleton
@Component(
    modules = {
      BatchModule.class,
      ConfigModule.class,
      CredentialModule.class,
      JsonModule.class,
      ProviderModule.class,
      UtilsModule.class,
      VerifyModule.class,
    })
interface DomainSyncComponent {
  void inject(AddVerificationCommand command);

  void inject(ListDomainsCommand command);

  void inject(ReconcileCommand command);

  void inject(ScheduleCommand command);

  void inject(StatusCommand command);

  void inject(VerifyCommand command);
}
