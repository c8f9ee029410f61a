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
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * A key present in source and target, whose values differ. The modification is either a leaf {@link Modification} or, when the value is
 * itself a collection diffed recursively, a nested changeset.
 *
 * @param <K> the key type.
 * @param <D> the type of the value comparison result.
 */
public final class Modify<K, D extends HasChanges> {

  private final K key;
  private final @NotNull D modification;

  /**
   * Creates a new modification. Must only be created for results that {@link HasChanges#hasChanges() have changes}.
   *
   * @param key          the key of the modified value.
   * @param modification the comparison result of source and target value.
   */
  public Modify(K key, @NotNull D modification) {
    assert modification.hasChanges() : "Modify created for an unchanged value at key " + key;
    this.key = key;
    this.modification = modification;
  }

  public K key() {
    return key;
  }

  public @NotNull D modification() {
    return modification;
  }

  public @NotNull ChangeKind kind() {
    return ChangeKind.MODIFY;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Modify<?, ?> that = (Modify<?, ?>) o;
    return Objects.equals(key, that.key) && modification.equals(that.modification);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, modification);
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("key", key)
        .append("modification", modification)
        .toString();
  }
}
