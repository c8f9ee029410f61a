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

import com.here.naksha.lib.changeset.change.Remove;
import java.util.Iterator;
import org.jetbrains.annotations.NotNull;

/**
 * The removals needed to turn the source into the target.
 *
 * @param <K> the key type.
 * @param <V> the value type.
 */
public final class Removals<K, V> extends ExhaustionStableIterator<Remove<K, V>> {

  public Removals(@NotNull Iterator<Remove<K, V>> it) {
    super(it);
  }
}
