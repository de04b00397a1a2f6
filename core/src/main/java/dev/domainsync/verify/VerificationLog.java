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

package dev.domainsync.verify;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import dev.domainsync.config.DomainSyncConfig.Config;
import dev.domainsync.util.DomainNameUtils;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Append-only history of verification results, one JSON object per line.
 *
 * <p>Lines are never rewritten. All appends in a process go through this singleton and are
 * serialized, so concurrent verifications never interleave within a line. Each line is written
 * with a single call; a line cut short by a crash is skipped when the log is read back.
 *
 * <p>The latest entry per hostname is kept in memory, rebuilt from the file on first use.
 */
@Singleton
@ThreadSafe
public class VerificationLog {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Path file;
  private final Gson gson;

  @GuardedBy("this")
  @Nullable
  private TreeMap<String, VerificationLogEntry> latest;

  /** Whether the file ends in a partial line that the next append must terminate first. */
  @GuardedBy("this")
  private boolean needsLineBreak;

  @Inject
  public VerificationLog(@Config("verificationLogFile") Path file, Gson gson) {
    this.file = file;
    this.gson = gson;
  }

  /** Appends one entry to the log. */
  public synchronized void append(VerificationLogEntry entry) {
    TreeMap<String, VerificationLogEntry> index = load();
    String line = (needsLineBreak ? "\n" : "") + gson.toJson(entry) + "\n";
    try {
      Path parent = file.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Files.writeString(
          file,
          line,
          UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.WRITE,
          StandardOpenOption.APPEND);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to append to verification log " + file, e);
    }
    needsLineBreak = false;
    index.put(entry.domain(), entry);
  }

  /** Returns the most recent entry for a hostname. */
  public synchronized Optional<VerificationLogEntry> latest(String fqdn) {
    return Optional.ofNullable(load().get(DomainNameUtils.canonicalizeHostname(fqdn)));
  }

  /** Returns the most recent entry of every hostname in the log. */
  public synchronized ImmutableMap<String, VerificationLogEntry> latestByDomain() {
    return ImmutableMap.copyOf(load());
  }

  /** Returns every entry for a hostname, oldest first. */
  public synchronized ImmutableList<VerificationLogEntry> history(String fqdn) {
    String domain = DomainNameUtils.canonicalizeHostname(fqdn);
    return readEntries().stream()
        .filter(e -> e.domain().equals(domain))
        .collect(ImmutableList.toImmutableList());
  }

  @GuardedBy("this")
  private TreeMap<String, VerificationLogEntry> load() {
    if (latest == null) {
      TreeMap<String, VerificationLogEntry> index = new TreeMap<>();
      for (VerificationLogEntry entry : readEntries()) {
        index.put(entry.domain(), entry);
      }
      latest = index;
    }
    return latest;
  }

  @GuardedBy("this")
  private ImmutableList<VerificationLogEntry> readEntries() {
    if (!Files.exists(file)) {
      return ImmutableList.of();
    }
    String content;
    try {
      content = Files.readString(file, UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read verification log " + file, e);
    }
    needsLineBreak = !content.isEmpty() && !content.endsWith("\n");
    ImmutableList.Builder<VerificationLogEntry> entries = new ImmutableList.Builder<>();
    ImmutableList<String> lines = content.lines().collect(ImmutableList.toImmutableList());
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (Strings.isNullOrEmpty(line.trim())) {
        continue;
      }
      try {
        VerificationLogEntry entry = gson.fromJson(line, VerificationLogEntry.class);
        if (entry != null && entry.domain() != null && entry.overallState() != null) {
          entries.add(entry);
        }
      } catch (JsonParseException e) {
        logger.atWarning().log("Skipping malformed line %d of %s.", i + 1, file);
      }
    }
    return entries.build();
  }
}
