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

/** How a differ treats the collections it compares. */
public enum CopyMode {
  /**
   * The differ works directly on the given collections and the changeset references their keys and values. The caller must not modify
   * the collections while the diff runs or while the changeset is in use.
   */
  BORROW,

  /**
   * The differ takes a shallow copy of both collections before comparing them, so that the partitioning does not depend on the caller
   * keeping the collections unchanged. The keys and values are still shared with the caller, they are not cloned.
   *
   * <p>Sorted maps and sets are copied into a {@link java.util.TreeMap} or {@link java.util.TreeSet} with the same comparator, an
   * {@link java.util.IdentityHashMap} into another one. Every other map is copied into a {@link java.util.LinkedHashMap}, every other set
   * into a {@link java.util.LinkedHashSet}, so membership of the copy follows {@link Object#equals(Object)}. Collections with another
   * notion of equality, for example a set created by {@link java.util.Collections#newSetFromMap(java.util.Map)} above an identity map,
   * must be diffed with {@link #BORROW}.
   */
  SNAPSHOT
}
