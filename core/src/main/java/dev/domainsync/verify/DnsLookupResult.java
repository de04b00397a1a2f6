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

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Values returned by one DNS lookup.
 *
 * <p>A name or type that doesn't exist yields no values and no error. An error means the lookup
 * itself failed and says nothing about what is published.
 */
public record DnsLookupResult(ImmutableList<String> values, Optional<String> error) {

  public static DnsLookupResult of(ImmutableList<String> values) {
    return new DnsLookupResult(values, Optional.empty());
  }

  public static DnsLookupResult failed(String error) {
    return new DnsLookupResult(ImmutableList.of(), Optional.of(error));
  }
}
