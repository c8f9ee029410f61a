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

import com.here.naksha.lib.changeset.CopyMode;
import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.IgnoreKey;
import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modify;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.changeset.Changeset;
import com.here.naksha.lib.changeset.strategy.ArbitraryDiff;
import com.here.naksha.lib.changeset.strategy.Scope;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The common part of the map differs. Every key of the key union of source and target is classified exactly once: keys only in the target
 * become additions, keys only in the source become removals, and the values of keys in both are compared with the value strategy. A
 * modification is only recorded when the value strategy reports changes. How the key union is enumerated is up to the implementation.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 * @param <D> the result type of the value strategy.
 * @param <M> the map type.
 */
public abstract class AbstractMapDiffer<K, V, D extends HasChanges, M extends Map<K, V>>
    implements ArbitraryDiff<M, Changeset<K, V, D>> {

  private static final Logger log = LoggerFactory.getLogger(AbstractMapDiffer.class);

  protected AbstractMapDiffer(@NotNull ArbitraryDiff<V, D> valueDiff, @NotNull DiffOptions options) {
    this.valueDiff = Objects.requireNonNull(valueDiff, "valueDiff");
    this.options = Objects.requireNonNull(options, "options");
  }

  private final @NotNull ArbitraryDiff<V, D> valueDiff;
  private final @NotNull DiffOptions options;

  /**
   * Returns the strategy used to compare the values of keys present in source and target.
   *
   * @return the value strategy.
   */
  public @NotNull ArbitraryDiff<V, D> valueDiff() {
    return valueDiff;
  }

  public @NotNull DiffOptions options() {
    return options;
  }

  @Override
  public @NotNull Scope scope() {
    return valueDiff.scope() == Scope.SIMPLE ? Scope.MAP_VALUES_SIMPLY : Scope.MAP_VALUES_ARBITRARILY;
  }

  @Override
  public @NotNull Class<? extends HasChanges> changeType() {
    return Changeset.class;
  }

  @Override
  public final @NotNull Changeset<K, V, D> diffWith(M source, M target) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    if (options.copyMode() == CopyMode.SNAPSHOT) {
      source = snapshot(source);
      target = snapshot(target);
    }
    final Buckets<K, V, D> buckets = new Buckets<>(source.size() + target.size());
    partition(source, target, buckets);
    log.atDebug()
        .setMessage("Diffed {} source and {} target keys: {} added, {} removed, {} modified, {} unchanged, {} ignored")
        .addArgument(source.size())
        .addArgument(target.size())
        .addArgument(buckets.added.size())
        .addArgument(buckets.removed.size())
        .addArgument(buckets.modified.size())
        .addArgument(buckets.unchanged)
        .addArgument(buckets.ignored)
        .log();
    return buckets.toChangeset();
  }

  /**
   * Returns a shallow, read-only copy of the given map, used with {@link CopyMode#SNAPSHOT}.
   *
   * @param map the map to copy.
   * @return the copy.
   */
  protected abstract @NotNull M snapshot(@NotNull M map);

  /**
   * Enumerates the key union of source and target and invokes {@link #classify} for every key exactly once.
   *
   * @param source  the source map.
   * @param target  the target map.
   * @param buckets the buckets to fill.
   */
  protected abstract void partition(@NotNull M source, @NotNull M target, @NotNull Buckets<K, V, D> buckets);

  /**
   * Classifies a single key of the key union.
   *
   * @param key         the key.
   * @param inSource    if the source contains the key.
   * @param sourceValue the source value, if the source contains the key.
   * @param inTarget    if the target contains the key.
   * @param targetValue the target value, if the target contains the key.
   * @param source      the source map.
   * @param target      the target map.
   * @param buckets     the buckets to fill.
   * @throws IllegalStateException if the key is neither in source nor in target.
   */
  protected final void classify(
      K key,
      boolean inSource,
      @Nullable V sourceValue,
      boolean inTarget,
      @Nullable V targetValue,
      @NotNull M source,
      @NotNull M target,
      @NotNull Buckets<K, V, D> buckets) {
    final IgnoreKey ignoreKey = options.ignoreKey();
    if (ignoreKey != null && ignoreKey.ignore(key, source, target)) {
      buckets.ignored++;
      return;
    }
    if (inSource && inTarget) {
      final D diff = valueDiff.diffWith(sourceValue, targetValue);
      if (valueDiff.hasChanges(diff)) {
        buckets.modified.add(new Modify<>(key, diff));
      } else {
        buckets.unchanged++;
      }
    } else if (inTarget) {
      buckets.added.add(new Add<>(key, targetValue));
    } else if (inSource) {
      buckets.removed.add(new Remove<>(key, sourceValue));
    } else {
      log.atError()
          .setMessage("Key {} of the key union is neither in source nor in target")
          .addArgument(key)
          .log();
      throw new IllegalStateException("Key " + key + " of the key union is neither in source nor in target");
    }
  }

  /**
   * The three result buckets of a single diff.
   */
  protected static final class Buckets<K, V, D extends HasChanges> {

    Buckets(int expectedKeys) {
      added = new ArrayList<>(expectedKeys);
      removed = new ArrayList<>(expectedKeys);
      modified = new ArrayList<>(expectedKeys);
    }

    final @NotNull ArrayList<Add<K, V>> added;
    final @NotNull ArrayList<Remove<K, V>> removed;
    final @NotNull ArrayList<Modify<K, D>> modified;
    int unchanged;
    int ignored;

    @NotNull
    Changeset<K, V, D> toChangeset() {
      added.trimToSize();
      removed.trimToSize();
      modified.trimToSize();
      return new Changeset<>(added, removed, modified);
    }
  }
}
