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
package com.here.naksha.lib.changeset.strategy;

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_0_0;

import com.here.naksha.lib.changeset.change.HasChanges;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;

/**
 * A strategy to compare two values. Implementations must be side effect free and must not modify the compared values.
 *
 * @param <V> the type of the compared values.
 * @param <D> the type of the comparison result.
 */
@AvailableSince(v1_0_0)
public interface ArbitraryDiff<V, D extends HasChanges> extends Diff<V, D> {

  /**
   * Compares the source with the target value.
   *
   * @param source the source value.
   * @param target the target value.
   * @return the comparison result.
   */
  @NotNull
  D diffWith(V source, V target);

  /**
   * Tests whether the given comparison result has changes.
   *
   * @param change the result of {@link #diffWith(Object, Object)}.
   * @return {@code true} if the compared values differ.
   */
  default boolean hasChanges(@NotNull D change) {
    return change.hasChanges();
  }
}
