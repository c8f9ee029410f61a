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
package com.here.naksha.lib.changeset.iterators;

import com.here.naksha.lib.changeset.change.PureChange;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.NotNull;

/**
 * All additions followed by all removals.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 */
public final class PureChanges<K, V> implements Iterator<PureChange<K, V>> {

  public PureChanges(@NotNull Additions<K, V> additions, @NotNull Removals<K, V> removals) {
    this.additions = additions;
    this.removals = removals;
  }

  private final @NotNull Additions<K, V> additions;
  private final @NotNull Removals<K, V> removals;

  @Override
  public boolean hasNext() {
    return additions.hasNext() || removals.hasNext();
  }

  @Override
  public @NotNull PureChange<K, V> next() {
    if (additions.hasNext()) {
      return PureChange.of(additions.next());
    }
    if (removals.hasNext()) {
      return PureChange.of(removals.next());
    }
    throw new NoSuchElementException();
  }
}
