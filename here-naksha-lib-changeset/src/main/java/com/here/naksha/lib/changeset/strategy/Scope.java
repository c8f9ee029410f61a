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

/**
 * Selects which comparison a strategy performs and therefore which kind of result it produces. The same collection type may be diffed
 * with different scopes at different call sites.
 */
public enum Scope {
  /** Leaf comparison by equality, never recursing into the values. */
  SIMPLE,

  /** Recursive comparison, values that are collections are diffed structurally. */
  ARBITRARY,

  /** A map diff, that diffs the values of common keys recursively. */
  MAP_VALUES_ARBITRARILY,

  /** A map diff, that compares the values of common keys by equality. */
  MAP_VALUES_SIMPLY
}
