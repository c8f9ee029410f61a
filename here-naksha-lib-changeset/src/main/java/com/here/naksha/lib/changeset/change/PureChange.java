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

import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Either an {@link Add} or a {@link Remove}, the presence changes of a changeset.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 */
public final class PureChange<K, V> {

  /**
   * Wraps the given addition.
   *
   * @param add the addition.
   * @param <K> the key type.
   * @param <V> the value type.
   * @return the pure change.
   */
  public static <K, V> @NotNull PureChange<K, V> of(@NotNull Add<K, V> add) {
    return new PureChange<>(add, null);
  }

  /**
   * Wraps the given removal.
   *
   * @param remove the removal.
   * @param <K>    the key type.
   * @param <V>    the value type.
   * @return the pure change.
   */
  public static <K, V> @NotNull PureChange<K, V> of(@NotNull Remove<K, V> remove) {
    return new PureChange<>(null, remove);
  }

  private PureChange(@Nullable Add<K, V> add, @Nullable Remove<K, V> remove) {
    assert (add == null) != (remove == null);
    this.add = add;
    this.remove = remove;
  }

  private final @Nullable Add<K, V> add;
  private final @Nullable Remove<K, V> remove;

  private @NotNull PrimitiveChange<K, V> change() {
    return add != null ? add : Objects.requireNonNull(remove);
  }

  public @NotNull ChangeKind kind() {
    return change().kind();
  }

  public K key() {
    return change().key();
  }

  public V value() {
    return change().value();
  }

  public boolean isAdd() {
    return add != null;
  }

  public boolean isRemove() {
    return remove != null;
  }

  /**
   * Returns the wrapped addition.
   *
   * @return the addition.
   * @throws IllegalStateException if this is a removal.
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
   * @throws IllegalStateException if this is an addition.
   */
  public @NotNull Remove<K, V> asRemove() {
    if (remove == null) {
      throw new IllegalStateException("The change is no removal, but " + kind());
    }
    return remove;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PureChange)) {
      return false;
    }
    return change().equals(((PureChange<?, ?>) o).change());
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
