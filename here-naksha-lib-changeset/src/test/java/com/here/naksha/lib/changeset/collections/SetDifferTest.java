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
package com.here.naksha.lib.changeset.collections;

import static com.here.naksha.lib.changeset.common.TestUtil.linkedSet;
import static com.here.naksha.lib.changeset.common.TestUtil.toList;
import static org.junit.jupiter.api.Assertions.*;

import com.here.naksha.lib.changeset.CopyMode;
import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.changeset.SetChangeset;
import com.here.naksha.lib.changeset.strategy.Scope;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class SetDifferTest {

  @Test
  void test_basics() {
    final SetDiffer<Integer> differ = new SetDiffer<>();
    final SetChangeset<Integer> changeset = differ.diffWith(linkedSet(1, 2, 3), linkedSet(2, 3, 4));

    assertEquals(List.of(new Add<>(4, 4)), toList(changeset.additions()));
    assertEquals(List.of(new Remove<>(1, 1)), toList(changeset.removals()));
    assertEquals(0, changeset.modificationCount());
    assertFalse(changeset.modifications().hasNext());
    assertEquals(2, toList(changeset.changes()).size());
  }

  @Test
  void test_equalSets() {
    final Set<String> set = linkedSet("a", "b");
    final SetChangeset<String> changeset = new SetDiffer<String>().diffWith(set, linkedSet("b", "a"));
    assertTrue(changeset.isEmpty());
    assertFalse(changeset.hasChanges());
  }

  @Test
  void test_sortedOrder() {
    final SetChangeset<Integer> changeset =
        new SetDiffer<Integer>().diffWith(new TreeSet<>(List.of(5, 1, 3, 9)), new TreeSet<>(List.of(8, 9, 2)));
    assertEquals(List.of(new Add<>(2, 2), new Add<>(8, 8)), toList(changeset.additions()));
    assertEquals(List.of(new Remove<>(1, 1), new Remove<>(3, 3), new Remove<>(5, 5)), toList(changeset.removals()));
  }

  @Test
  void test_snapshot() {
    final SetDiffer<Integer> differ = new SetDiffer<>(DiffOptions.DEFAULT.withCopyMode(CopyMode.SNAPSHOT));
    final Set<Integer> source = new TreeSet<>(List.of(1, 2, 3));
    final SetChangeset<Integer> changeset = differ.diffWith(source, linkedSet(2, 3, 4));
    assertEquals(new SetDiffer<Integer>().diffWith(linkedSet(1, 2, 3), linkedSet(2, 3, 4)), changeset);
    assertEquals(3, source.size());
  }

  @Test
  void test_duality() {
    final SetDiffer<Integer> differ = new SetDiffer<>();
    final Set<Integer> a = linkedSet(1, 2, 3, 5);
    final Set<Integer> b = linkedSet(2, 3, 4, 6);
    final SetChangeset<Integer> forward = differ.diffWith(a, b);
    final SetChangeset<Integer> backward = differ.diffWith(b, a);

    final List<Add<Integer, Integer>> added = toList(forward.additions());
    final List<Remove<Integer, Integer>> removed = toList(backward.removals());
    assertEquals(added.size(), removed.size());
    for (int i = 0; i < added.size(); i++) {
      assertEquals(added.get(i).key(), removed.get(i).key());
      assertEquals(added.get(i).value(), removed.get(i).value());
    }
    assertEquals(toList(forward.removals()).size(), toList(backward.additions()).size());
    assertEquals(List.of(new Remove<>(1, 1), new Remove<>(5, 5)), toList(forward.removals()));
    assertEquals(List.of(new Add<>(1, 1), new Add<>(5, 5)), toList(backward.additions()));
  }

  @Test
  void test_identitySet() {
    final String first = new String("x");
    final String second = new String("x");
    final Set<String> source = Collections.newSetFromMap(new IdentityHashMap<>());
    source.add(first);
    final Set<String> target = Collections.newSetFromMap(new IdentityHashMap<>());
    target.add(second);

    final SetChangeset<String> changeset = new SetDiffer<String>().diffWith(source, target);
    assertSame(second, changeset.additions().next().value());
    assertSame(first, changeset.removals().next().value());

    // A snapshot copies into an equals based set.
    final SetChangeset<String> snapshot =
        new SetDiffer<String>(DiffOptions.DEFAULT.withCopyMode(CopyMode.SNAPSHOT)).diffWith(source, target);
    assertTrue(snapshot.isEmpty());
  }

  @Test
  void test_shape() {
    final SetDiffer<Integer> differ = new SetDiffer<>();
    assertEquals(Scope.ARBITRARY, differ.scope());
    assertEquals(SetChangeset.class, differ.changeType());
  }
}
