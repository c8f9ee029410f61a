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

import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modify;
import java.util.Collections;
import java.util.Iterator;
import org.jetbrains.annotations.NotNull;

/**
 * The modifications needed to turn the source into the target.
 *
 * @param <K> the key type.
 * @param <D> the type of the value comparison result.
 */
public final class Modifications<K, D extends HasChanges> extends ExhaustionStableIterator<Modify<K, D>> {

  /**
   * Returns modifications that are empty by construction, for collections that can not be modified.
   *
   * @param <K> the key type.
   * @param <D> the type of the value comparison result.
   * @return an exhausted iterator.
   */
  public static <K, D extends HasChanges> @NotNull Modifications<K, D> none() {
    return new Modifications<>(Collections.emptyIterator());
  }

  public Modifications(@NotNull Iterator<Modify<K, D>> it) {
    super(it);
  }
}
