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
package com.here.naksha.lib.changeset.change;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single difference between source and target collection, either an {@link Add}, a {@link Remove} or a {@link Modify}.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 * @param <D> the type of the value comparison result carried by modifications.
 */
public final class Change<K, V, D extends HasChanges> {

  public static <K, V, D extends HasChanges> @NotNull Change<K, V, D> of(@NotNull Add<K, V> add) {
    return new Change<>(add, null, null);
  }

  public static <K, V, D extends HasChanges> @NotNull Change<K, V, D> of(@NotNull Remove<K, V> remove) {
    return new Change<>(null, remove, null);
  }

  public static <K, V, D extends HasChanges> @NotNull Change<K, V, D> of(@NotNull Modify<K, D> modify) {
    return new Change<>(null, null, modify);
  }

  /**
   * Widens the given pure change.
   *
   * @param pureChange the addition or removal.
   * @param <K>        the key type.
   * @param <V>        the value type.
   * @param <D>        the modification type of the resulting change.
   * @return the change.
   */
  public static <K, V, D extends HasChanges> @NotNull Change<K, V, D> of(@NotNull PureChange<K, V> pureChange) {
    return pureChange.isAdd() ? of(pureChange.asAdd()) : of(pureChange.asRemove());
  }

  private Change(@Nullable Add<K, V> add, @Nullable Remove<K, V> remove, @Nullable Modify<K, D> modify) {
    this.add = add;
    this.remove = remove;
    this.modify = modify;
  }

  private final @Nullable Add<K, V> add;
  private final @Nullable Remove<K, V> remove;
  private final @Nullable Modify<K, D> modify;

  public @NotNull ChangeKind kind() {
    if (add != null) {
      return ChangeKind.ADD;
    }
    if (remove != null) {
      return ChangeKind.REMOVE;
    }
    return ChangeKind.MODIFY;
  }

  public K key() {
    if (add != null) {
      return add.key();
    }
    if (remove != null) {
      return remove.key();
    }
    assert modify != null;
    return modify.key();
  }

  public boolean isAdd() {
    return add != null;
  }

  public boolean isRemove() {
    return remove != null;
  }

  public boolean isModify() {
    return modify != null;
  }

  /**
   * Returns the wrapped addition.
   *
   * @return the addition.
   * @throws IllegalStateException if this change is no addition.
   */
  public @NotNull Add<K, V> asAdd() {
    if (add == null) {
      throw new IllegalStateException("The change is no addition, but " + kind());
    }
    return add;
  }

  /**
   * Returns the wrapped removal.
   *
   * @return the removal.
   * @throws IllegalStateException if this change is no removal.
   */
  public @NotNull Remove<K, V> asRemove() {
    if (remove == null) {
      throw new IllegalStateException("The change is no removal, but " + kind());
    }
    return remove;
  }

  /**
   * Returns the wrapped modification.
   *
   * @return the modification.
   * @throws IllegalStateException if this change is no modification.
   */
  public @NotNull Modify<K, D> asModify() {
    if (modify == null) {
      throw new IllegalStateException("The change is no modification, but " + kind());
    }
    return modify;
  }

  private @NotNull Object change() {
    if (add != null) {
      return add;
    }
    if (remove != null) {
      return remove;
    }
    assert modify != null;
    return modify;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Change)) {
      return false;
    }
    return change().equals(((Change<?, ?, ?>) o).change());
  }

  @Override
  public int hashCode() {
    return change().hashCode();
  }

  @Override
  public String toString() {
    return change().toString();
  }
}
