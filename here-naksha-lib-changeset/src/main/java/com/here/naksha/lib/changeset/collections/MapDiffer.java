/*
 * Copyright (C) 2017-2023 HERE Europe B.V.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * License-Filename: LICENSE
 */
package com.here.naksha.lib.changeset.collections;

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_0_0;

import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.strategy.ArbitraryDiff;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;

/**
 * Diffs two maps of any kind. The key union is enumerated as the keys of the source followed by the keys of the target the source does
 * not contain, so the order within each bucket follows the iteration order of the inputs. Key equality is always the one of the maps
 * themselves, a sorted map compares keys by its ordering, an {@link IdentityHashMap} by identity.
 *
 * <p>Whether the values of common keys are diffed recursively or by equality is decided by the value strategy given at construction.
 * With a {@link com.here.naksha.lib.changeset.strategy.SimpleDiff} the modifications carry leaf results, with a collection differ, for
 * example another {@link MapDiffer}, they carry nested changesets.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 * @param <D> the result type of the value strategy.
 */
@AvailableSince(v1_0_0)
public class MapDiffer<K, V, D extends HasChanges> extends AbstractMapDiffer<K, V, D, Map<K, V>> {

  public MapDiffer(@NotNull ArbitraryDiff<V, D> valueDiff) {
    this(valueDiff, DiffOptions.DEFAULT);
  }

  public MapDiffer(@NotNull ArbitraryDiff<V, D> valueDiff, @NotNull DiffOptions options) {
    super(valueDiff, options);
  }

  @Override
  protected @NotNull Map<K, V> snapshot(@NotNull Map<K, V> map) {
    if (map instanceof SortedMap) {
      return Collections.unmodifiableSortedMap(new TreeMap<>((SortedMap<K, V>) map));
    }
    if (map instanceof IdentityHashMap) {
      return Collections.unmodifiableMap(new IdentityHashMap<>(map));
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }

  @Override
  protected void partition(@NotNull Map<K, V> source, @NotNull Map<K, V> target, @NotNull Buckets<K, V, D> buckets) {
    for (final Map.Entry<K, V> entry : source.entrySet()) {
      final K key = entry.getKey();
      final boolean inTarget = target.containsKey(key);
      classify(key, true, entry.getValue(), inTarget, inTarget ? target.get(key) : null, source, target, buckets);
    }
    for (final Map.Entry<K, V> entry : target.entrySet()) {
      final K key = entry.getKey();
      if (!source.containsKey(key)) {
        classify(key, false, null, true, entry.getValue(), source, target, buckets);
      }
    }
  }

  @Override
  public String toString() {
    return "MapDiffer{" + valueDiff() + '}';
  }
}
