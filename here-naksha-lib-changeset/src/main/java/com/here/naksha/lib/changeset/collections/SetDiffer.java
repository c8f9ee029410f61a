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

import com.here.naksha.lib.changeset.CopyMode;
import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.changeset.SetChangeset;
import com.here.naksha.lib.changeset.strategy.ArbitraryDiff;
import com.here.naksha.lib.changeset.strategy.Scope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diffs two sets. The additions are the elements of the target missing in the source, the removals the elements of the source missing in
 * the target, both in the iteration order of their set. Membership is tested with the {@link Set#contains(Object)} of the sets, so a hash
 * set compares by {@code equals}, a sorted set by its ordering. Ignored keys of the {@link DiffOptions} do not apply to sets.
 *
 * @param <T> the element type.
 */
@AvailableSince(v1_0_0)
public class SetDiffer<T> implements ArbitraryDiff<Set<T>, SetChangeset<T>> {

  private static final Logger log = LoggerFactory.getLogger(SetDiffer.class);

  public SetDiffer() {
    this(DiffOptions.DEFAULT);
  }

  public SetDiffer(@NotNull DiffOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  private final @NotNull DiffOptions options;

  @Override
  public @NotNull SetChangeset<T> diffWith(Set<T> source, Set<T> target) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    if (options.copyMode() == CopyMode.SNAPSHOT) {
      source = snapshot(source);
      target = snapshot(target);
    }
    final List<Add<T, T>> added = new ArrayList<>();
    for (final T element : target) {
      if (!source.contains(element)) {
        added.add(new Add<>(element, element));
      }
    }
    final List<Remove<T, T>> removed = new ArrayList<>();
    for (final T element : source) {
      if (!target.contains(element)) {
        removed.add(new Remove<>(element, element));
      }
    }
    log.atDebug()
        .setMessage("Diffed {} source and {} target elements: {} added, {} removed")
        .addArgument(source.size())
        .addArgument(target.size())
        .addArgument(added.size())
        .addArgument(removed.size())
        .log();
    return new SetChangeset<>(added, removed);
  }

  /** Membership of the copy follows the rules of {@link CopyMode#SNAPSHOT}. */
  private static <T> @NotNull Set<T> snapshot(@NotNull Set<T> set) {
    if (set instanceof SortedSet) {
      return Collections.unmodifiableSortedSet(new TreeSet<>((SortedSet<T>) set));
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(set));
  }

  @Override
  public @NotNull Scope scope() {
    return Scope.ARBITRARY;
  }

  @Override
  public @NotNull Class<? extends HasChanges> changeType() {
    return SetChangeset.class;
  }

  @Override
  public String toString() {
    return "SetDiffer";
  }
}
