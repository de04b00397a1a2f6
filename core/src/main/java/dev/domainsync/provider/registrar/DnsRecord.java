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

package dev.domainsync.provider.registrar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import java.util.Objects;

/**
 * One DNS record as the registrar API represents it.
 *
 * <p>The name and type are read from responses but never sent: writes address a record set by
 * name and type in the URL, and the body carries only data and TTL.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DnsRecord {

  @JsonProperty(value = "name", access = JsonProperty.Access.WRITE_ONLY)
  private String name;

  @JsonProperty(value = "type", access = JsonProperty.Access.WRITE_ONLY)
  private RecordType type;

  @JsonProperty("data")
  private String data;

  @JsonProperty("ttl")
  private Integer ttl;

  public static DnsRecord create(String data, int ttl) {
    DnsRecord record = new DnsRecord();
    record.setData(data);
    record.setTtl(ttl);
    return record;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public RecordType getType() {
    return type;
  }

  public void setType(RecordType type) {
    this.type = type;
  }

  public String getData() {
    return data;
  }

  public void setData(String data) {
    this.data = data;
  }

  public Integer getTtl() {
    return ttl;
  }

  public void setTtl(Integer ttl) {
    this.ttl = ttl;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DnsRecord)) {
      return false;
    }
    DnsRecord that = (DnsRecord) o;
    return Objects.equals(data, that.data) && Objects.equals(ttl, that.ttl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(data, ttl);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("name", name)
        .add("type", type)
        .add("data", data)
        .add("ttl", ttl)
        .toString();
  }
}
