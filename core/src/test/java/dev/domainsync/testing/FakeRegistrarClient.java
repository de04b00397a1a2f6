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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.RateLimiter;
import dev.domainsync.config.RegistrarCredentials;
import dev.domainsync.module.JsonModule;
import dev.domainsync.provider.ProviderException;
import dev.domainsync.provider.registrar.DnsRecord;
import dev.domainsync.provider.registrar.RecordType;
import dev.domainsync.provider.registrar.RegistrarClient;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.OkHttpClient;

/**
 * In-memory registrar that keeps record sets in a map and logs every write.
 *
 * <p>A failure can be armed for the next call on a given record set.
 */
public class FakeRegistrarClient extends RegistrarClient {

  private final Map<String, ImmutableList<DnsRecord>> recordSets = new HashMap<>();
  private final List<String> writes = new ArrayList<>();
  private final Map<String, ProviderException> failures = new HashMap<>();
  private ImmutableList<String> activeDomains = ImmutableList.of();

  public FakeRegistrarClient() {
    super(
        new OkHttpClient(),
        JsonModule.provideObjectMapper(),
        "https://registrar.invalid",
        new RegistrarCredentials("key", "secret"),
        RateLimiter.create(1000),
        TestRetriers.create());
  }

  /** Seeds a record set, as if it already existed at the registrar. */
  public FakeRegistrarClient withRecords(
      String rootDomain, String recordName, RecordType type, DnsRecord... records) {
    recordSets.put(key(rootDomain, recordName, type), ImmutableList.copyOf(records));
    return this;
  }

  public FakeRegistrarClient withActiveDomains(String... domains) {
    activeDomains = ImmutableList.copyOf(domains);
    return this;
  }

  /** Makes every call on the given record set fail with the exception. */
  public void failOn(String rootDomain, String recordName, RecordType type, ProviderException e) {
    failures.put(key(rootDomain, recordName, type), e);
  }

  @Override
  public synchronized ImmutableList<DnsRecord> getRecords(
      String rootDomain, String recordName, RecordType type) throws ProviderException {
    checkFailure(rootDomain, recordName, type);
    return recordSets.getOrDefault(key(rootDomain, recordName, type), ImmutableList.of());
  }

  @Override
  public synchronized void putRecords(
      String rootDomain, String recordName, RecordType type, List<DnsRecord> records)
      throws ProviderException {
    checkFailure(rootDomain, recordName, type);
    String key = key(rootDomain, recordName, type);
    if (records.isEmpty()) {
      recordSets.remove(key);
      writes.add("DELETE " + key);
    } else {
      recordSets.put(key, ImmutableList.copyOf(records));
      writes.add("PUT " + key);
    }
  }

  @Override
  public ImmutableList<String> listActiveDomains() {
    return activeDomains;
  }

  /** Returns the current contents of a record set. */
  public synchronized ImmutableList<DnsRecord> recordsOf(
      String rootDomain, String recordName, RecordType type) {
    return recordSets.getOrDefault(key(rootDomain, recordName, type), ImmutableList.of());
  }

  /** Returns every write so far, e.g. {@code PUT 2100.cool/asoos/A}. */
  public synchronized ImmutableList<String> getWrites() {
    return ImmutableList.copyOf(writes);
  }

  public synchronized void clearWrites() {
    writes.clear();
  }

  private void checkFailure(String rootDomain, String recordName, RecordType type)
      throws ProviderException {
    Optional<ProviderException> failure =
        Optional.ofNullable(failures.get(key(rootDomain, recordName, type)));
    if (failure.isPresent()) {
      throw failure.get();
    }
  }

  private static String key(String rootDomain, String recordName, RecordType type) {
    return rootDomain + "/" + recordName + "/" + type;
  }
}
