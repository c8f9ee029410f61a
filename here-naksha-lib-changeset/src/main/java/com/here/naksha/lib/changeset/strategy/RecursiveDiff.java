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
package com.here.naksha.lib.changeset.strategy;

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_0_0;

import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.collections.MapDiffer;
import com.here.naksha.lib.changeset.collections.SetDiffer;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;

/**
 * The recursive strategy for values whose structure is only known at runtime. Two maps are diffed key by key, using this strategy again
 * for the values, two sets are diffed by membership, everything else, including a map compared with a set, bottoms out in a
 * {@link SimpleDiff}. The result is therefore either a nested changeset or a leaf modification.
 */
@AvailableSince(v1_0_0)
public final class RecursiveDiff implements ArbitraryDiff<Object, HasChanges> {

  public RecursiveDiff() {
    this(DiffOptions.DEFAULT);
  }

  public RecursiveDiff(@NotNull DiffOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.simple = SimpleDiff.of(options);
    this.sets = new SetDiffer<>(options);
    this.maps = new MapDiffer<>(this, options);
  }

  private final @NotNull DiffOptions options;
  private final @NotNull SimpleDiff<Object> simple;
  private final @NotNull SetDiffer<Object> sets;
  private final @NotNull MapDiffer<Object, Object, HasChanges> maps;

  public @NotNull DiffOptions options() {
    return options;
  }

  @SuppressWarnings("unchecked")
  @Override
  public @NotNull HasChanges diffWith(Object source, Object target) {
    if (source instanceof Map && target instanceof Map) {
      return maps.diffWith((Map<Object, Object>) source, (Map<Object, Object>) target);
    }
    if (source instanceof Set && target instanceof Set) {
      return sets.diffWith((Set<Object>) source, (Set<Object>) target);
    }
    return simple.diffWith(source, target);
  }

  @Override
  public @NotNull Scope scope() {
    return Scope.ARBITRARY;
  }

  @Override
  public @NotNull Class<? extends HasChanges> changeType() {
    return HasChanges.class;
  }

  @Override
  public String toString() {
    return "RecursiveDiff";
  }
}
