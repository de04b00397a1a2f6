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

package dev.domainsync.token;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.Expose;
import com.google.gson.reflect.TypeToken;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.util.Clock;
import dev.domainsync.util.DomainNameUtils;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Ownership tokens known for each hostname, persisted as a JSON file.
 *
 * <p>Tokens arrive from the operator or from the hosting provider when a hostname is attached.
 * Each change rewrites the whole file through a temporary file and an atomic rename, so a crash
 * leaves either the old or the new contents.
 */
@Singleton
@ThreadSafe
public class VerificationTokenStore {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Type STORE_TYPE = new TypeToken<Map<String, KnownToken>>() {}.getType();

  /** What is known about one hostname's ownership token. */
  public record KnownToken(
      @Expose @Nullable String token, @Expose boolean verified, @Expose Instant updated) {

    public Optional<String> tokenValue() {
      return Optional.ofNullable(token);
    }
  }

  private final Path file;
  private final Gson gson;
  private final Clock clock;

  @GuardedBy("this")
  @Nullable
  private TreeMap<String, KnownToken> tokens;

  @Inject
  public VerificationTokenStore(@Config("tokenStoreFile") Path file, Gson gson, Clock clock) {
    this.file = file;
    this.gson = gson;
    this.clock = clock;
  }

  public synchronized Optional<KnownToken> get(String fqdn) {
    return Optional.ofNullable(load().get(key(fqdn)));
  }

  /**
   * Records the token for a hostname.
   *
   * <p>A new token clears the verified flag. Storing the token already on record is a no-op.
   *
   * @return whether anything changed
   */
  public synchronized boolean putToken(String fqdn, String token) {
    String key = key(fqdn);
    KnownToken existing = load().get(key);
    if (existing != null && token.equals(existing.token())) {
      return false;
    }
    tokens.put(key, new KnownToken(token, false, clock.nowUtc()));
    persist();
    logger.atInfo().log("Stored ownership token for %s.", key);
    return true;
  }

  /**
   * Records that the hosting provider has confirmed ownership of a hostname.
   *
   * @return whether anything changed
   */
  public synchronized boolean markVerified(String fqdn) {
    String key = key(fqdn);
    KnownToken existing = load().get(key);
    if (existing != null && existing.verified()) {
      return false;
    }
    tokens.put(
        key, new KnownToken(existing == null ? null : existing.token(), true, clock.nowUtc()));
    persist();
    logger.atInfo().log("Recorded confirmed ownership of %s.", key);
    return true;
  }

  public synchronized ImmutableMap<String, KnownToken> all() {
    return ImmutableMap.copyOf(load());
  }

  private static String key(String fqdn) {
    return DomainNameUtils.canonicalizeHostname(fqdn);
  }

  @GuardedBy("this")
  private TreeMap<String, KnownToken> load() {
    if (tokens != null) {
      return tokens;
    }
    tokens = new TreeMap<>();
    if (!Files.exists(file)) {
      return tokens;
    }
    try {
      Map<String, KnownToken> stored = gson.fromJson(Files.readString(file, UTF_8), STORE_TYPE);
      if (stored != null) {
        tokens.putAll(stored);
      }
    } catch (IOException e) {
      tokens = null;
      throw new UncheckedIOException("Failed to read token store " + file, e);
    } catch (JsonParseException e) {
      tokens = null;
      throw new IllegalStateException("Token store " + file + " is corrupt", e);
    }
    return tokens;
  }

  @GuardedBy("this")
  private void persist() {
    try {
      Path parent = file.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      Files.writeString(temp, gson.toJson(tokens, STORE_TYPE), UTF_8);
      Files.move(
          temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write token store " + file, e);
    }
  }
}
