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
 * The common base of the two pure changes, a value that exists at a key on only one side.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 */
public abstract class PrimitiveChange<K, V> {

  private final K key;
  private final V value;

  PrimitiveChange(K key, V value) {
    this.key = key;
    this.value = value;
  }

  /**
   * Returns the key at which the value is added or removed.
   *
   * @return the key.
   */
  public K key() {
    return key;
  }

  /**
   * Returns the value being added or removed.
   *
   * @return the value.
   */
  public V value() {
    return value;
  }

  /**
   * Returns the kind of this change.
   *
   * @return either {@link ChangeKind#ADD} or {@link ChangeKind#REMOVE}.
   */
  public abstract @NotNull ChangeKind kind();

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PrimitiveChange<?, ?> that = (PrimitiveChange<?, ?>) o;
    return Objects.equals(key, that.key) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), key, value);
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this).append("key", key).append("value", value).toString();
  }
}
