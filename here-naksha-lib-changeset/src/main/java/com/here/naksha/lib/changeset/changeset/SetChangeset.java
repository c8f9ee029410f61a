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

import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.NoModification;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.iterators.Modifications;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.NotNull;

/**
 * The changeset of two sets. An element is either present or not, therefore key and value of every change are the element itself and
 * there are never modifications.
 *
 * @param <T> the element type.
 */
public final class SetChangeset<T> extends Changeset<T, T, NoModification> {

  public SetChangeset(@NotNull List<Add<T, T>> added, @NotNull List<Remove<T, T>> removed) {
    super(added, removed, Collections.emptyList());
  }

  /**
   * Sets can't be modified, only added to or removed from.
   *
   * @return always an empty iterator.
   */
  @Override
  public @NotNull Modifications<T, NoModification> modifications() {
    return Modifications.none();
  }
}
