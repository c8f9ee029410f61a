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
package com.here.naksha.lib.changeset;

/**
 * The releases of the changeset library, used to tag the public API with
 * {@link org.jetbrains.annotations.ApiStatus.AvailableSince AvailableSince}.
 */
public final class ChangesetVersion {

  /**
   * The first release, maps and sets with simple and recursive value strategies.
   */
  public static final String v1_0_0 = "1.0.0";

  /**
   * Sorted map walk, strategy registry, ignored keys and the printer.
   */
  public static final String v1_1_0 = "1.1.0";

  private ChangesetVersion() {}
}
