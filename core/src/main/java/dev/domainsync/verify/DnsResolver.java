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

/** Looks up what the public DNS currently serves for a hostname. */
public interface DnsResolver {

  /** Returns the IPv4 addresses the hostname resolves to, following aliases. */
  DnsLookupResult lookupAddresses(String fqdn);

  /** Returns the TXT record values at the hostname, each with its strings concatenated. */
  DnsLookupResult lookupTxt(String fqdn);
}
