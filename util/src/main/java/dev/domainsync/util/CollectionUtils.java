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

package dev.domainsync.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Convenience methods for working with collections. */
public final class CollectionUtils {

  /** Defensive copy helper for {@link List}, turning null into an empty list. */
  public static <V> ImmutableList<V> nullToEmptyImmutableCopy(@Nullable List<V> data) {
    return data == null ? ImmutableList.of() : ImmutableList.copyOf(data);
  }

  /** Defensive copy helper for {@link Map}, turning null into an empty map. */
  public static <K, V> ImmutableMap<K, V> nullToEmptyImmutableCopy(@Nullable Map<K, V> data) {
    return data == null ? ImmutableMap.of() : ImmutableMap.copyOf(data);
  }

  private CollectionUtils() {}
}
