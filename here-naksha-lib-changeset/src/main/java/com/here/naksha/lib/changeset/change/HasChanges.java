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

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_0_0;

import org.jetbrains.annotations.ApiStatus.AvailableSince;

/**
 * Implemented by every result of a value comparison, so that the collection differs can decide whether the compared pair needs a
 * {@link Modify} entry.
 */
@AvailableSince(v1_0_0)
@FunctionalInterface
public interface HasChanges {

  /**
   * Tests whether this result represents an actual difference.
   *
   * @return {@code true} if source and target differ; {@code false} if they are equal.
   */
  boolean hasChanges();
}
