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

import java.util.List;
import java.util.Map;

/** The POJO that DomainSync YAML config files are deserialized into. */
public class DomainSyncConfigSettings {

  public Registrar registrar;
  public Hosting hosting;
  public Retry retry;
  public Verification verification;
  public Runner runner;
  public Schedule schedule;
  public Storage storage;
  public List<DomainEntry> domains;

  /** Configuration options for the DNS registrar API. */
  public static class Registrar {
    public String baseUrl;
    public double maxQps;
    public int defaultTtl;
  }

  /** Configuration options for the static hosting provider. */
  public static class Hosting {
    public String baseUrl;
    public List<String> defaultIps;
    public Map<String, List<String>> siteIpsMap;
    public String verificationPrefix;
    public boolean attachCustomDomains;
    public boolean queryDomainStatus;
  }

  /** Retry policy for transient provider failures. */
  public static class Retry {
    public int attempts;
    public long baseDelayMillis;
    public int backoffFactor;
  }

  /** Configuration options for the verification probes. */
  public static class Verification {
    public int probeTimeoutSeconds;
    public List<String> resolverAddresses;
  }

  /** Configuration options for batch runs over the registry. */
  public static class Runner {
    public int workerCount;
    public int runTimeoutSeconds;
    public long slowDomainThresholdMillis;
  }

  /** Cadences of the periodic jobs. */
  public static class Schedule {
    public int reconcileIntervalMinutes;
    public int verifyIntervalMinutes;
    public int initialDelaySeconds;
  }

  /** Locations of persisted state. */
  public static class Storage {
    public String verificationLogFile;
    public String tokenStoreFile;
  }

  /** One root domain of the desired-state registry. */
  public static class DomainEntry {
    public String rootDomain;
    public List<SubdomainEntry> subdomains;
  }

  /** One subdomain binding under a root domain. */
  public static class SubdomainEntry {
    public String name;
    public String hostingSite;
    public String binding;
    public String cnameTarget;
  }
}
