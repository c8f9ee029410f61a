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

import com.here.naksha.lib.changeset.change.Change;
import com.here.naksha.lib.changeset.change.HasChanges;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.NotNull;

/**
 * All changes in fixed order: first all additions, then all removals, then all modifications.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 * @param <D> the type of the value comparison result.
 */
public final class Changes<K, V, D extends HasChanges> implements Iterator<Change<K, V, D>> {

  public Changes(
      @NotNull Additions<K, V> additions,
      @NotNull Removals<K, V> removals,
      @NotNull Modifications<K, D> modifications) {
    this.pureChanges = new PureChanges<>(additions, removals);
    this.modifications = modifications;
  }

  private final @NotNull PureChanges<K, V> pureChanges;
  private final @NotNull Modifications<K, D> modifications;

  @Override
  public boolean hasNext() {
    return pureChanges.hasNext() || modifications.hasNext();
  }

  @Override
  public @NotNull Change<K, V, D> next() {
    if (pureChanges.hasNext()) {
      return Change.of(pureChanges.next());
    }
    if (modifications.hasNext()) {
      return Change.of(modifications.next());
    }
    throw new NoSuchElementException();
  }
}
