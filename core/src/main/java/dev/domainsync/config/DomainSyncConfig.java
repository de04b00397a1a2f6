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

import static com.google.common.base.Suppliers.memoize;
import static com.google.common.collect.ImmutableMap.toImmutableMap;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Resources;
import dagger.Module;
import dagger.Provides;
import dev.domainsync.registry.DesiredStateRegistry;
import dev.domainsync.util.CollectionUtils;
import jakarta.inject.Qualifier;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Central clearing-house for all configuration.
 *
 * <p>Settings come from the bundled {@code default-config.yaml} merged with the operator's YAML
 * file. The operator's file is named by the {@value #CONFIG_PATH_PROPERTY} system property, which
 * the command line sets from its {@code --config} flag, or else by the {@value #CONFIG_PATH_ENV}
 * environment variable. Credentials are never read from YAML; see {@link CredentialModule}.
 */
public final class DomainSyncConfig {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String CONFIG_PATH_PROPERTY = "domainsync.config";
  public static final String CONFIG_PATH_ENV = "DOMAINSYNC_CONFIG";

  private static final String DEFAULT_CONFIG_RESOURCE = "files/default-config.yaml";

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Retention(RUNTIME)
  @Documented
  public @interface Config {
    String value() default "";
  }

  /** Returns the bundled default configuration. */
  static String readDefaultYaml() {
    try {
      return Resources.toString(
          Resources.getResource(DomainSyncConfig.class, DEFAULT_CONFIG_RESOURCE), UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Loads settings from the defaults merged with the given operator YAML. */
  @VisibleForTesting
  public static DomainSyncConfigSettings loadSettings(String customYaml) {
    return YamlUtils.getConfigSettings(
        readDefaultYaml(), customYaml, DomainSyncConfigSettings.class);
  }

  /** Returns the operator's configuration file location, if one was given. */
  static Optional<Path> getConfigPath() {
    String path = System.getProperty(CONFIG_PATH_PROPERTY);
    if (Strings.isNullOrEmpty(path)) {
      path = System.getenv(CONFIG_PATH_ENV);
    }
    return Optional.ofNullable(Strings.emptyToNull(path)).map(Paths::get);
  }

  static DomainSyncConfigSettings getConfigSettings() {
    Optional<Path> configPath = getConfigPath();
    String customYaml = "";
    if (configPath.isPresent()) {
      try {
        customYaml = Files.readString(configPath.get(), UTF_8);
      } catch (IOException e) {
        throw new ConfigurationException(
            String.format("Cannot read configuration file %s", configPath.get()), e);
      }
      logger.atInfo().log("Loading configuration from %s.", configPath.get());
    }
    return loadSettings(customYaml);
  }

  public static final Supplier<DomainSyncConfigSettings> CONFIG_SETTINGS =
      memoize(DomainSyncConfig::getConfigSettings);

  /** Dagger module for providing configuration settings. */
  @Module
  public static final class ConfigModule {

    @Provides
    static DomainSyncConfigSettings provideConfigSettings() {
      return CONFIG_SETTINGS.get();
    }

    /**
     * The desired-state registry: the single source of truth for which hostnames should exist.
     *
     * <p>Validated once per process. A malformed registry is fatal before any domain is touched.
     */
    @Provides
    @Singleton
    static DesiredStateRegistry provideDesiredStateRegistry(DomainSyncConfigSettings config) {
      return DesiredStateRegistry.fromConfig(config.domains);
    }

    @Provides
    @Config("registrarBaseUrl")
    public static String provideRegistrarBaseUrl(DomainSyncConfigSettings config) {
      return config.registrar.baseUrl;
    }

    /** Maximum rate of registrar API calls, shared across all workers. */
    @Provides
    @Config("registrarMaxQps")
    public static double provideRegistrarMaxQps(DomainSyncConfigSettings config) {
      return config.registrar.maxQps;
    }

    @Provides
    @Config("registrarDefaultTtl")
    public static int provideRegistrarDefaultTtl(DomainSyncConfigSettings config) {
      return config.registrar.defaultTtl;
    }

    @Provides
    @Config("hostingBaseUrl")
    public static String provideHostingBaseUrl(DomainSyncConfigSettings config) {
      return config.hosting.baseUrl;
    }

    /** IP addresses the hosting provider publishes for every site without an override. */
    @Provides
    @Config("hostingDefaultIps")
    public static ImmutableList<String> provideHostingDefaultIps(DomainSyncConfigSettings config) {
      return CollectionUtils.nullToEmptyImmutableCopy(config.hosting.defaultIps);
    }

    /** Per-site overrides of the published IP addresses. */
    @Provides
    @Config("hostingSiteIpsMap")
    public static ImmutableMap<String, ImmutableList<String>> provideHostingSiteIpsMap(
        DomainSyncConfigSettings config) {
      return CollectionUtils.nullToEmptyImmutableCopy(config.hosting.siteIpsMap).entrySet().stream()
          .collect(
              toImmutableMap(
                  Map.Entry::getKey, e -> CollectionUtils.nullToEmptyImmutableCopy(e.getValue())));
    }

    /** Prefix of the TXT record value that carries the ownership token, e.g. "firebase=". */
    @Provides
    @Config("verificationPrefix")
    public static String provideVerificationPrefix(DomainSyncConfigSettings config) {
      return config.hosting.verificationPrefix;
    }

    /** Whether reconciliation may attach a hostname to its site to obtain a token. */
    @Provides
    @Config("attachCustomDomains")
    public static boolean provideAttachCustomDomains(DomainSyncConfigSettings config) {
      return config.hosting.attachCustomDomains;
    }

    @Provides
    @Config("queryDomainStatus")
    public static boolean provideQueryDomainStatus(DomainSyncConfigSettings config) {
      return config.hosting.queryDomainStatus;
    }

    @Provides
    @Config("retryAttempts")
    public static int provideRetryAttempts(DomainSyncConfigSettings config) {
      return config.retry.attempts;
    }

    @Provides
    @Config("retryBaseDelay")
    public static Duration provideRetryBaseDelay(DomainSyncConfigSettings config) {
      return Duration.ofMillis(config.retry.baseDelayMillis);
    }

    @Provides
    @Config("retryBackoffFactor")
    public static int provideRetryBackoffFactor(DomainSyncConfigSettings config) {
      return config.retry.backoffFactor;
    }

    /** Per-probe timeout for DNS and HTTPS checks. */
    @Provides
    @Config("probeTimeout")
    public static Duration provideProbeTimeout(DomainSyncConfigSettings config) {
      return Duration.ofSeconds(config.verification.probeTimeoutSeconds);
    }

    /** Recursive resolvers to query; empty means the system's resolvers. */
    @Provides
    @Config("resolverAddresses")
    public static ImmutableList<String> provideResolverAddresses(DomainSyncConfigSettings config) {
      return CollectionUtils.nullToEmptyImmutableCopy(config.verification.resolverAddresses);
    }

    @Provides
    @Config("workerCount")
    public static int provideWorkerCount(DomainSyncConfigSettings config) {
      return config.runner.workerCount;
    }

    /** Wall-clock limit of one batch run over the registry. */
    @Provides
    @Config("runTimeout")
    public static Duration provideRunTimeout(DomainSyncConfigSettings config) {
      return Duration.ofSeconds(config.runner.runTimeoutSeconds);
    }

    @Provides
    @Config("slowDomainThreshold")
    public static Duration provideSlowDomainThreshold(DomainSyncConfigSettings config) {
      return Duration.ofMillis(config.runner.slowDomainThresholdMillis);
    }

    @Provides
    @Config("reconcileInterval")
    public static Duration provideReconcileInterval(DomainSyncConfigSettings config) {
      return Duration.ofMinutes(config.schedule.reconcileIntervalMinutes);
    }

    @Provides
    @Config("verifyInterval")
    public static Duration provideVerifyInterval(DomainSyncConfigSettings config) {
      return Duration.ofMinutes(config.schedule.verifyIntervalMinutes);
    }

    @Provides
    @Config("scheduleInitialDelay")
    public static Duration provideScheduleInitialDelay(DomainSyncConfigSettings config) {
      return Duration.ofSeconds(config.schedule.initialDelaySeconds);
    }

    @Provides
    @Config("verificationLogFile")
    public static Path provideVerificationLogFile(DomainSyncConfigSettings config) {
      return Paths.get(config.storage.verificationLogFile);
    }

    @Provides
    @Config("tokenStoreFile")
    public static Path provideTokenStoreFile(DomainSyncConfigSettings config) {
      return Paths.get(config.storage.tokenStoreFile);
    }

    private ConfigModule() {}
  }

  private DomainSyncConfig() {}
}
