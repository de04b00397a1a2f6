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

package dev.domainsync.batch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dagger.Module;
import dagger.Provides;
import dev.domainsync.config.DomainSyncConfig.Config;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Dagger module for the worker pools that process domains concurrently.
 *
 * <p>Reconciliation and verification each get their own pool and runner, so hung probes in one
 * job never leave the other job's domains queued behind them.
 */
@Module
public final class BatchModule {

  /**
   * Provides the pool for reconciliation units.
   *
   * <p>Bounded so that a large registry doesn't open more concurrent provider sessions than the
   * rate limiter can usefully feed.
   */
  @Provides
  @Singleton
  @Named("reconcileExecutor")
  static ExecutorService provideReconcileExecutor(@Config("workerCount") int workerCount) {
    return newWorkerPool("reconcile-worker-%d", workerCount);
  }

  @Provides
  @Singleton
  @Named("verifyExecutor")
  static ExecutorService provideVerifyExecutor(@Config("workerCount") int workerCount) {
    return newWorkerPool("verify-worker-%d", workerCount);
  }

  @Provides
  @Singleton
  @Named("reconcileRunner")
  static DomainBatchRunner provideReconcileRunner(
      @Named("reconcileExecutor") ExecutorService executor,
      @Config("runTimeout") Duration runTimeout,
      @Config("slowDomainThreshold") Duration slowDomainThreshold) {
    return new DomainBatchRunner(executor, runTimeout, slowDomainThreshold);
  }

  @Provides
  @Singleton
  @Named("verifyRunner")
  static DomainBatchRunner provideVerifyRunner(
      @Named("verifyExecutor") ExecutorService executor,
      @Config("runTimeout") Duration runTimeout,
      @Config("slowDomainThreshold") Duration slowDomainThreshold) {
    return new DomainBatchRunner(executor, runTimeout, slowDomainThreshold);
  }

  /** Threads are daemons so a finished command can exit. */
  private static ExecutorService newWorkerPool(String nameFormat, int workerCount) {
    return Executors.newFixedThreadPool(
        workerCount, new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build());
  }

  private BatchModule() {}
}
