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

package dev.domainsync.registry;

import dev.domainsync.provider.registrar.RecordType;

/**
 * How a hostname is bound to its hosting site.
 *
 * <p>A hostname carries either address records or an alias record, never both. Each strategy names
 * the record type it writes and the one it must clear first.
 */
public enum BindingStrategy {
  A_RECORD(RecordType.A, RecordType.CNAME),
  CNAME(RecordType.CNAME, RecordType.A);

  private final RecordType recordType;
  private final RecordType conflictingType;

  BindingStrategy(RecordType recordType, RecordType conflictingType) {
    this.recordType = recordType;
    this.conflictingType = conflictingType;
  }

  public RecordType recordType() {
    return recordType;
  }

  public RecordType conflictingType() {
    return conflictingType;
  }
}
