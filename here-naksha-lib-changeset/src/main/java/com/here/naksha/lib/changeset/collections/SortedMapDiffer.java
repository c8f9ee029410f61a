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

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_1_0;

import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.strategy.ArbitraryDiff;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Diffs two sorted maps with a single merged walk over both key sequences, no auxiliary key set is needed. All buckets of the resulting
 * changeset are in key order. Both maps must be ordered the same way, that means they must have equal comparators or both use the natural
 * ordering.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 * @param <D> the result type of the value strategy.
 */
@AvailableSince(v1_1_0)
public class SortedMapDiffer<K, V, D extends HasChanges> extends AbstractMapDiffer<K, V, D, SortedMap<K, V>> {

  public SortedMapDiffer(@NotNull ArbitraryDiff<V, D> valueDiff) {
    this(valueDiff, DiffOptions.DEFAULT);
  }

  public SortedMapDiffer(@NotNull ArbitraryDiff<V, D> valueDiff, @NotNull DiffOptions options) {
    super(valueDiff, options);
  }

  @Override
  protected @NotNull SortedMap<K, V> snapshot(@NotNull SortedMap<K, V> map) {
    return Collections.unmodifiableSortedMap(new TreeMap<>(map));
  }

  @Override
  protected void partition(
      @NotNull SortedMap<K, V> source, @NotNull SortedMap<K, V> target, @NotNull Buckets<K, V, D> buckets) {
    final Comparator<? super K> comparator = source.comparator();
    if (!Objects.equals(comparator, target.comparator())) {
      throw new IllegalArgumentException("Source and target map are not ordered the same way");
    }
    final Iterator<Entry<K, V>> sourceIt = source.entrySet().iterator();
    final Iterator<Entry<K, V>> targetIt = target.entrySet().iterator();
    Entry<K, V> s = next(sourceIt);
    Entry<K, V> t = next(targetIt);
    while (s != null || t != null) {
      final int c;
      if (s == null) {
        c = 1;
      } else if (t == null) {
        c = -1;
      } else {
        c = compare(comparator, s.getKey(), t.getKey());
      }
      if (c < 0) {
        assert s != null;
        classify(s.getKey(), true, s.getValue(), false, null, source, target, buckets);
        s = next(sourceIt);
      } else if (c > 0) {
        assert t != null;
        classify(t.getKey(), false, null, true, t.getValue(), source, target, buckets);
        t = next(targetIt);
      } else {
        assert s != null && t != null;
        classify(s.getKey(), true, s.getValue(), true, t.getValue(), source, target, buckets);
        s = next(sourceIt);
        t = next(targetIt);
      }
    }
  }

  private static <K, V> @Nullable Entry<K, V> next(@NotNull Iterator<Entry<K, V>> it) {
    return it.hasNext() ? it.next() : null;
  }

  @SuppressWarnings("unchecked")
  private static <K> int compare(@Nullable Comparator<? super K> comparator, K a, K b) {
    if (comparator != null) {
      return comparator.compare(a, b);
    }
    return ((Comparable<? super K>) a).compareTo(b);
  }

  @Override
  public String toString() {
    return "SortedMapDiffer{" + valueDiff() + '}';
  }
}
