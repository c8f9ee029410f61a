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

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An iterator that releases its delegate as soon as the delegate is exhausted. From then on {@link #hasNext()} always returns
 * {@code false} and {@link #next()} always throws {@link NoSuchElementException}, even if the delegate would produce more elements.
 * Removal is not supported.
 *
 * @param <T> the element type.
 */
public class ExhaustionStableIterator<T> implements Iterator<T> {

  /**
   * Creates a new iterator above the given delegate.
   *
   * @param it the delegate.
   */
  public ExhaustionStableIterator(@NotNull Iterator<? extends T> it) {
    this.it = it;
  }

  private @Nullable Iterator<? extends T> it;

  /**
   * Tests if this iterator is exhausted.
   *
   * @return {@code true} if the delegate reported its end and was released.
   */
  public boolean isExhausted() {
    return it == null;
  }

  @Override
  public boolean hasNext() {
    final Iterator<? extends T> it = this.it;
    if (it == null) {
      return false;
    }
    if (it.hasNext()) {
      return true;
    }
    this.it = null;
    return false;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    assert it != null;
    return it.next();
  }
}
