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
package com.here.naksha.lib.changeset;

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_0_0;
import static com.here.naksha.lib.changeset.ChangesetVersion.v1_1_0;

import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modification;
import com.here.naksha.lib.changeset.changeset.Changeset;
import com.here.naksha.lib.changeset.changeset.SetChangeset;
import com.here.naksha.lib.changeset.collections.MapDiffer;
import com.here.naksha.lib.changeset.collections.SetDiffer;
import com.here.naksha.lib.changeset.collections.SortedMapDiffer;
import com.here.naksha.lib.changeset.strategy.ArbitraryDiff;
import com.here.naksha.lib.changeset.strategy.RecursiveDiff;
import com.here.naksha.lib.changeset.strategy.SimpleDiff;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;

/**
 * The entry points of the library and the common strategy presets. The strategy is always chosen by the caller; the same map type can be
 * diffed with {@link #mapsSimply()} at one place and with {@link #mapsArbitrarily(ArbitraryDiff)} at another.
 *
 * <pre>{@code
 * // Values compared by equality.
 * Changeset<String, Set<Integer>, Modification<Set<Integer>>> a = Differs.diffWith(source, target);
 * // Values diffed as sets.
 * Changeset<String, Set<Integer>, SetChangeset<Integer>> b = Differs.diffWith(source, target, Differs.sets());
 * }</pre>
 */
@AvailableSince(v1_0_0)
public final class Differs {

  private Differs() {}

  /**
   * Returns the leaf strategy comparing values with {@link Object#equals(Object)}.
   *
   * @param <V> the value type.
   * @return the leaf strategy.
   */
  public static <V> @NotNull SimpleDiff<V> simple() {
    return SimpleDiff.strict();
  }

  /**
   * Returns the leaf strategy comparing numbers by their numeric value.
   *
   * @param <V> the value type.
   * @return the lenient leaf strategy.
   */
  @AvailableSince(v1_1_0)
  public static <V> @NotNull SimpleDiff<V> lenientSimple() {
    return SimpleDiff.lenient();
  }

  public static <T> @NotNull SetDiffer<T> sets() {
    return new SetDiffer<>();
  }

  /**
   * Returns a map differ comparing the values of common keys by equality.
   *
   * @param <K> the key type.
   * @param <V> the value type.
   * @return the map differ.
   */
  public static <K, V> @NotNull MapDiffer<K, V, Modification<V>> mapsSimply() {
    return new MapDiffer<>(SimpleDiff.<V>strict());
  }

  /**
   * Returns a map differ diffing the values of common keys with the given strategy.
   *
   * @param valueDiff the value strategy.
   * @param <K>       the key type.
   * @param <V>       the value type.
   * @param <D>       the result type of the value strategy.
   * @return the map differ.
   */
  public static <K, V, D extends HasChanges> @NotNull MapDiffer<K, V, D> mapsArbitrarily(
      @NotNull ArbitraryDiff<V, D> valueDiff) {
    return new MapDiffer<>(valueDiff);
  }

  @AvailableSince(v1_1_0)
  public static <K, V> @NotNull SortedMapDiffer<K, V, Modification<V>> sortedMapsSimply() {
    return new SortedMapDiffer<>(SimpleDiff.<V>strict());
  }

  @AvailableSince(v1_1_0)
  public static <K, V, D extends HasChanges> @NotNull SortedMapDiffer<K, V, D> sortedMapsArbitrarily(
      @NotNull ArbitraryDiff<V, D> valueDiff) {
    return new SortedMapDiffer<>(valueDiff);
  }

  /**
   * Returns the recursive strategy for values whose structure is only known at runtime.
   *
   * @return the recursive strategy.
   */
  public static @NotNull RecursiveDiff recursive() {
    return new RecursiveDiff();
  }

  /**
   * Diffs two sets.
   *
   * @param source the source set.
   * @param target the target set.
   * @param <T>    the element type.
   * @return the changeset.
   */
  public static <T> @NotNull SetChangeset<T> diffWith(@NotNull Set<T> source, @NotNull Set<T> target) {
    return new SetDiffer<T>().diffWith(source, target);
  }

  /**
   * Diffs two maps, comparing the values of common keys by equality.
   *
   * @param source the source map.
   * @param target the target map.
   * @param <K>    the key type.
   * @param <V>    the value type.
   * @return the changeset.
   */
  public static <K, V> @NotNull Changeset<K, V, Modification<V>> diffWith(
      @NotNull Map<K, V> source, @NotNull Map<K, V> target) {
    return Differs.<K, V>mapsSimply().diffWith(source, target);
  }

  /**
   * Diffs two maps, diffing the values of common keys with the given strategy.
   *
   * @param source    the source map.
   * @param target    the target map.
   * @param valueDiff the value strategy.
   * @param <K>       the key type.
   * @param <V>       the value type.
   * @param <D>       the result type of the value strategy.
   * @return the changeset.
   */
  public static <K, V, D extends HasChanges> @NotNull Changeset<K, V, D> diffWith(
      @NotNull Map<K, V> source, @NotNull Map<K, V> target, @NotNull ArbitraryDiff<V, D> valueDiff) {
    return new MapDiffer<K, V, D>(valueDiff).diffWith(source, target);
  }

  /**
   * Diffs two maps with the given options, diffing the values of common keys with the given strategy.
   *
   * @param source    the source map.
   * @param target    the target map.
   * @param valueDiff the value strategy.
   * @param options   the options.
   * @param <K>       the key type.
   * @param <V>       the value type.
   * @param <D>       the result type of the value strategy.
   * @return the changeset.
   */
  @AvailableSince(v1_1_0)
  public static <K, V, D extends HasChanges> @NotNull Changeset<K, V, D> diffWith(
      @NotNull Map<K, V> source,
      @NotNull Map<K, V> target,
      @NotNull ArbitraryDiff<V, D> valueDiff,
      @NotNull DiffOptions options) {
    return new MapDiffer<K, V, D>(valueDiff, options).diffWith(source, target);
  }
}
