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

/**
 * A value present in the source, but absent in the target.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 */
public final class Remove<K, V> extends PrimitiveChange<K, V> {

  /**
   * Creates a new removal.
   *
   * @param key   the key from which to remove the value.
   * @param value the value to remove.
   */
  public Remove(K key, V value) {
    super(key, value);
  }

  @Override
  public @NotNull ChangeKind kind() {
    return ChangeKind.REMOVE;
  }
}
