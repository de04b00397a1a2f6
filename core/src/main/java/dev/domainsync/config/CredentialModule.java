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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import dagger.Module;
import dagger.Provides;
import dev.domainsync.config.DomainSyncConfig.Config;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Dagger module that provides provider credentials from the process environment.
 *
 * <p>Credentials are resolved when the first client that needs them is constructed, which happens
 * before any domain is processed. A missing variable is a {@link ConfigurationException}.
 */
@Module
public final class CredentialModule {

  public static final String REGISTRAR_API_KEY = "REGISTRAR_API_KEY";
  public static final String REGISTRAR_API_SECRET = "REGISTRAR_API_SECRET";
  public static final String HOSTING_ACCESS_TOKEN = "HOSTING_ACCESS_TOKEN";

  @Provides
  @Named("environment")
  static ImmutableMap<String, String> provideEnvironment() {
    return ImmutableMap.copyOf(System.getenv());
  }

  @Provides
  @Singleton
  static RegistrarCredentials provideRegistrarCredentials(
      @Named("environment") ImmutableMap<String, String> environment) {
    return new RegistrarCredentials(
        requireVariable(environment, REGISTRAR_API_KEY),
        requireVariable(environment, REGISTRAR_API_SECRET));
  }

  @Provides
  @Config("hostingAccessToken")
  static String provideHostingAccessToken(
      @Named("environment") ImmutableMap<String, String> environment) {
    return requireVariable(environment, HOSTING_ACCESS_TOKEN);
  }

  static String requireVariable(ImmutableMap<String, String> environment, String name) {
    String value = environment.get(name);
    if (Strings.isNullOrEmpty(value)) {
      throw new ConfigurationException(
          String.format("Required environment variable %s is not set", name));
    }
    return value;
  }

  private CredentialModule() {}
}
