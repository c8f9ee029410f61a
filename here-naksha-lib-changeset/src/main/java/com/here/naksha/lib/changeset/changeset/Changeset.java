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
package com.here.naksha.lib.changeset.changeset;

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_0_0;

import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modify;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.iterators.Additions;
import com.here.naksha.lib.changeset.iterators.Changes;
import com.here.naksha.lib.changeset.iterators.Modifications;
import com.here.naksha.lib.changeset.iterators.PureChanges;
import com.here.naksha.lib.changeset.iterators.Removals;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;

/**
 * The result of diffing two collections: the additions, removals and modifications that turn the source into the target. The three
 * buckets are computed once by the differ and never modified afterwards. Every accessor returns a new iterator, so a changeset can be
 * consumed any number of times.
 *
 * <p>The changes reference the keys and values of the compared collections, nothing is copied. A changeset must therefore not be used
 * after the source or target collection, or one of their values, was modified.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 * @param <D> the type of the value comparison result carried by modifications.
 */
@AvailableSince(v1_0_0)
public class Changeset<K, V, D extends HasChanges> implements HasChanges {

  /**
   * Creates a new changeset above the given buckets. The lists are wrapped, not copied, the caller must not modify them afterwards.
   *
   * @param added    the additions.
   * @param removed  the removals.
   * @param modified the modifications.
   */
  public Changeset(
      @NotNull List<Add<K, V>> added, @NotNull List<Remove<K, V>> removed, @NotNull List<Modify<K, D>> modified) {
    this.added = Collections.unmodifiableList(added);
    this.removed = Collections.unmodifiableList(removed);
    this.modified = Collections.unmodifiableList(modified);
  }

  private final @NotNull List<Add<K, V>> added;
  private final @NotNull List<Remove<K, V>> removed;
  private final @NotNull List<Modify<K, D>> modified;

  /**
   * Tests whether source and target were equal.
   *
   * @return {@code true} if there are no additions, removals or modifications.
   */
  public boolean isEmpty() {
    return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
  }

  @Override
  public boolean hasChanges() {
    return !isEmpty();
  }

  public int additionCount() {
    return added.size();
  }

  public int removalCount() {
    return removed.size();
  }

  public int modificationCount() {
    return modified.size();
  }

  /**
   * Returns the values to add to the source.
   *
   * @return a new iterator above the additions.
   */
  public @NotNull Additions<K, V> additions() {
    return new Additions<>(added.iterator());
  }

  /**
   * Returns the values to remove from the source.
   *
   * @return a new iterator above the removals.
   */
  public @NotNull Removals<K, V> removals() {
    return new Removals<>(removed.iterator());
  }

  /**
   * Returns the values to modify in the source.
   *
   * @return a new iterator above the modifications.
   */
  public @NotNull Modifications<K, D> modifications() {
    return new Modifications<>(modified.iterator());
  }

  /**
   * Returns the additions followed by the removals, without modifications.
   *
   * @return a new iterator above all pure changes.
   */
  public @NotNull PureChanges<K, V> pureChanges() {
    return new PureChanges<>(additions(), removals());
  }

  /**
   * Returns all changes, first the additions, then the removals and last the modifications.
   *
   * @return a new iterator above all changes.
   */
  public @NotNull Changes<K, V, D> changes() {
    return new Changes<>(additions(), removals(), modifications());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Changeset)) {
      return false;
    }
    final Changeset<?, ?, ?> that = (Changeset<?, ?, ?>) o;
    return added.equals(that.added) && removed.equals(that.removed) && modified.equals(that.modified);
  }

  @Override
  public int hashCode() {
    int result = added.hashCode();
    result = 31 * result + removed.hashCode();
    result = 31 * result + modified.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("added", added)
        .append("removed", removed)
        .append("modified", modified)
        .toString();
  }
}
