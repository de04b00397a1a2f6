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

import com.google.common.util.concurrent.RateLimiter;
import dagger.Module;
import dagger.Provides;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.util.Retrier;
import dev.domainsync.util.Sleeper;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import okhttp3.OkHttpClient;

/** Dagger module for the HTTP clients, rate limiter and retry policy used to reach providers. */
@Module
public final class ProviderModule {

  /** Shared connection pool and dispatcher that every provider-specific client derives from. */
  @Provides
  @Singleton
  static OkHttpClient provideBaseHttpClient() {
    return new OkHttpClient.Builder()
        .connectTimeout(Duration.ofSeconds(10))
        .readTimeout(Duration.ofSeconds(30))
        .build();
  }

  @Provides
  @Singleton
  @Named("registrarHttpClient")
  static OkHttpClient provideRegistrarHttpClient(OkHttpClient baseClient) {
    return baseClient.newBuilder().followRedirects(false).build();
  }

  @Provides
  @Singleton
  @Named("hostingHttpClient")
  static OkHttpClient provideHostingHttpClient(OkHttpClient baseClient) {
    return baseClient.newBuilder().followRedirects(false).build();
  }

  /** Client for reachability probes, which follow redirects and give up after the timeout. */
  @Provides
  @Singleton
  @Named("probeHttpClient")
  static OkHttpClient provideProbeHttpClient(
      OkHttpClient baseClient, @Config("probeTimeout") Duration probeTimeout) {
    return baseClient
        .newBuilder()
        .followRedirects(true)
        .followSslRedirects(true)
        .retryOnConnectionFailure(false)
        .callTimeout(probeTimeout)
        .build();
  }

  /** One limiter per process, so concurrent workers together stay under the registrar's quota. */
  @Provides
  @Singleton
  @Named("registrarRateLimiter")
  static RateLimiter provideRegistrarRateLimiter(@Config("registrarMaxQps") double maxQps) {
    return RateLimiter.create(maxQps);
  }

  @Provides
  @Named("providerRetrier")
  static Retrier provideProviderRetrier(
      Sleeper sleeper,
      @Config("retryAttempts") int attempts,
      @Config("retryBaseDelay") Duration baseDelay,
      @Config("retryBackoffFactor") int backoffFactor) {
    return new Retrier(sleeper, attempts, baseDelay, backoffFactor);
  }

  private ProviderModule() {}
}
