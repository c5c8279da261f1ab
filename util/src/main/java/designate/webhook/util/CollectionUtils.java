// Copyright 2026 The Designate Webhook Authors. All Rights Reserved.
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

package designate.webhook.util;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Null-tolerant collection helpers for values deserialized from JSON or YAML.
 *
 * <p>Null elements, and map entries with a null key or value, are dropped from the copies.
 */
public final class CollectionUtils {

  /** Returns an immutable copy of the list, or an empty list if it is null. */
  public static <T> ImmutableList<T> nullToEmptyImmutableCopy(@Nullable List<T> list) {
    return list == null
        ? ImmutableList.of()
        : list.stream().filter(Objects::nonNull).collect(toImmutableList());
  }

  /** Returns an immutable copy of the map, or an empty map if it is null. */
  public static <K, V> ImmutableMap<K, V> nullToEmptyImmutableCopy(@Nullable Map<K, V> map) {
    return map == null
        ? ImmutableMap.of()
        : map.entrySet().stream()
            .filter(entry -> entry.getKey() != null && entry.getValue() != null)
            .collect(toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  private CollectionUtils() {}
}
