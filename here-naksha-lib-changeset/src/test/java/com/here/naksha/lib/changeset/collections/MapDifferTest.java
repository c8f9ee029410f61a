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

import static com.here.naksha.lib.changeset.common.TestUtil.linkedMap;
import static com.here.naksha.lib.changeset.common.TestUtil.linkedSet;
import static com.here.naksha.lib.changeset.common.TestUtil.toList;
import static org.junit.jupiter.api.Assertions.*;

import com.here.naksha.lib.changeset.CopyMode;
import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.Differs;
import com.here.naksha.lib.changeset.IgnoreKey;
import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.Modification;
import com.here.naksha.lib.changeset.change.Modify;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.changeset.Changeset;
import com.here.naksha.lib.changeset.changeset.SetChangeset;
import com.here.naksha.lib.changeset.strategy.SimpleDiff;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MapDifferTest {

  private static Map<Integer, Set<Integer>> source() {
    return linkedMap(1, linkedSet(1, 2, 3), 2, linkedSet(1, 2, 3), 3, linkedSet(1, 2, 3));
  }

  private static Map<Integer, Set<Integer>> target() {
    return linkedMap(1, linkedSet(1, 2, 3), 2, linkedSet(1, 3), 4, linkedSet(1, 2, 3));
  }

  @Test
  void test_leafValues() {
    final MapDiffer<Integer, Set<Integer>, Modification<Set<Integer>>> differ = Differs.mapsSimply();
    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> changeset =
        differ.diffWith(source(), target());

    assertEquals(List.of(new Add<>(4, linkedSet(1, 2, 3))), toList(changeset.additions()));
    assertEquals(List.of(new Remove<>(3, linkedSet(1, 2, 3))), toList(changeset.removals()));
    assertEquals(
        List.of(new Modify<>(2, Modification.different(linkedSet(1, 2, 3), linkedSet(1, 3)))),
        toList(changeset.modifications()));
  }

  @Test
  void test_setValues() {
    final SetDiffer<Integer> sets = Differs.sets();
    final Changeset<Integer, Set<Integer>, SetChangeset<Integer>> changeset =
        Differs.diffWith(source(), target(), sets);

    assertEquals(1, changeset.additionCount());
    assertEquals(1, changeset.removalCount());
    final List<Modify<Integer, SetChangeset<Integer>>> modified = toList(changeset.modifications());
    assertEquals(1, modified.size());
    assertEquals(2, modified.get(0).key());
    final SetChangeset<Integer> nested = modified.get(0).modification();
    assertEquals(0, nested.additionCount());
    assertEquals(List.of(new Remove<>(2, 2)), toList(nested.removals()));
  }

  @Test
  void test_reflexive() {
    final Map<Integer, Set<Integer>> source = source();
    assertTrue(Differs.diffWith(source, source).isEmpty());
    assertTrue(Differs.diffWith(source(), source()).isEmpty());
    assertFalse(Differs.diffWith(source(), source()).hasChanges());
    assertTrue(Differs.diffWith(source(), source(), Differs.<Integer>sets()).isEmpty());
    assertTrue(Differs.diffWith(new HashMap<String, String>(), new HashMap<>()).isEmpty());
  }

  @Test
  void test_emptySides() {
    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> allAdded =
        Differs.diffWith(new HashMap<>(), source());
    assertEquals(3, allAdded.additionCount());
    assertEquals(0, allAdded.removalCount());
    assertEquals(0, allAdded.modificationCount());

    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> allRemoved =
        Differs.diffWith(source(), new HashMap<>());
    assertEquals(0, allRemoved.additionCount());
    assertEquals(3, allRemoved.removalCount());
  }

  @Test
  void test_duality() {
    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> forward =
        Differs.diffWith(source(), target());
    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> backward =
        Differs.diffWith(target(), source());

    final List<Add<Integer, Set<Integer>>> added = toList(forward.additions());
    final List<Remove<Integer, Set<Integer>>> removed = toList(backward.removals());
    assertEquals(added.size(), removed.size());
    for (int i = 0; i < added.size(); i++) {
      assertEquals(added.get(i).key(), removed.get(i).key());
      assertEquals(added.get(i).value(), removed.get(i).value());
    }
    assertEquals(forward.modificationCount(), backward.modificationCount());
  }

  @ParameterizedTest
  @ValueSource(longs = {1L, 7L, 42L, 4711L, 20231019L})
  void test_partition(long seed) {
    final Random random = new Random(seed);
    final Map<Integer, Integer> source = new HashMap<>();
    final Map<Integer, Integer> target = new HashMap<>();
    for (int key = 0; key < 64; key++) {
      if (random.nextBoolean()) {
        source.put(key, random.nextInt(3));
      }
      if (random.nextBoolean()) {
        target.put(key, random.nextInt(3));
      }
    }
    final Changeset<Integer, Integer, Modification<Integer>> changeset = Differs.diffWith(source, target);

    final Set<Integer> seen = new HashSet<>();
    for (final Add<Integer, Integer> add : toList(changeset.additions())) {
      assertTrue(seen.add(add.key()));
      assertFalse(source.containsKey(add.key()));
      assertEquals(target.get(add.key()), add.value());
    }
    for (final Remove<Integer, Integer> remove : toList(changeset.removals())) {
      assertTrue(seen.add(remove.key()));
      assertFalse(target.containsKey(remove.key()));
      assertEquals(source.get(remove.key()), remove.value());
    }
    for (final Modify<Integer, Modification<Integer>> modify : toList(changeset.modifications())) {
      assertTrue(seen.add(modify.key()));
      assertTrue(modify.modification().hasChanges());
      assertNotEquals(source.get(modify.key()), target.get(modify.key()));
    }
    for (final Integer key : source.keySet()) {
      if (target.containsKey(key) && source.get(key).equals(target.get(key))) {
        assertFalse(seen.contains(key));
      } else {
        assertTrue(seen.contains(key));
      }
    }
    for (final Integer key : target.keySet()) {
      if (!source.containsKey(key)) {
        assertTrue(seen.contains(key));
      }
    }
  }

  @Test
  void test_nullValues() {
    final Map<String, Integer> source = linkedMap("a", null, "b", null, "c", 1);
    final Map<String, Integer> target = linkedMap("a", 1, "c", 1, "d", null);
    final Changeset<String, Integer, Modification<Integer>> changeset = Differs.diffWith(source, target);

    assertEquals(List.of(new Add<>("d", null)), toList(changeset.additions()));
    assertEquals(List.of(new Remove<>("b", null)), toList(changeset.removals()));
    assertEquals(
        List.of(new Modify<>("a", Modification.different(null, 1))), toList(changeset.modifications()));
    assertTrue(Differs.diffWith(linkedMap("a", null), linkedMap("a", null)).isEmpty());
  }

  @Test
  void test_borrowsValues() {
    final Map<Integer, Set<Integer>> target = target();
    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> changeset =
        Differs.diffWith(source(), target);
    assertSame(target.get(4), changeset.additions().next().value());
  }

  @Test
  void test_snapshot() {
    final DiffOptions options = DiffOptions.DEFAULT.withCopyMode(CopyMode.SNAPSHOT);
    final Map<Integer, Set<Integer>> source = source();
    final Map<Integer, Set<Integer>> target = target();
    final Changeset<Integer, Set<Integer>, Modification<Set<Integer>>> snapshot =
        Differs.diffWith(source, target, SimpleDiff.strict(), options);
    assertEquals(Differs.diffWith(source(), target()), snapshot);
    assertEquals(source(), source);
    assertEquals(target(), target);
    // Keys and values are still shared.
    assertSame(target.get(4), snapshot.additions().next().value());
  }

  @Test
  void test_ignoreKeys() {
    final Map<String, Object> source = linkedMap("id", "a", "name", "x", "updatedAt", 1L);
    final Map<String, Object> target = linkedMap("id", "a", "name", "x", "updatedAt", 2L, "createdAt", 0L);
    final Changeset<String, Object, Modification<Object>> strict = Differs.diffWith(source, target);
    assertEquals(1, strict.additionCount());
    assertEquals(1, strict.modificationCount());

    final DiffOptions options = DiffOptions.DEFAULT.withIgnoreKey(IgnoreKey.keys("updatedAt", "createdAt"));
    final MapDiffer<String, Object, Modification<Object>> differ = new MapDiffer<>(SimpleDiff.strict(), options);
    assertTrue(differ.diffWith(source, target).isEmpty());

    final DiffOptions onlyTarget =
        DiffOptions.DEFAULT.withIgnoreKey((key, sourceMap, targetMap) -> !sourceMap.containsKey(key));
    final Changeset<String, Object, Modification<Object>> changeset =
        new MapDiffer<String, Object, Modification<Object>>(SimpleDiff.strict(), onlyTarget).diffWith(source, target);
    assertEquals(0, changeset.additionCount());
    assertEquals(1, changeset.modificationCount());
  }

  @Test
  void test_lenientNumbers() {
    final Map<String, Object> source = linkedMap("a", 1, "b", 2.5d, "c", 3);
    final Map<String, Object> target = linkedMap("a", 1L, "b", 2.5f, "c", 3.0d);
    assertEquals(3, Differs.diffWith(source, target).modificationCount());

    final DiffOptions options = DiffOptions.DEFAULT.withLenientNumbers(true);
    final Changeset<String, Object, Modification<Object>> lenient =
        Differs.diffWith(source, target, SimpleDiff.of(options), options);
    assertTrue(lenient.isEmpty());
    assertEquals(
        1, Differs.diffWith(source, linkedMap("a", 2L, "b", 2.5d, "c", 3), Differs.lenientSimple()).modificationCount());
  }

  @Test
  void test_caseInsensitiveKeys() {
    final Map<String, Integer> source = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    source.put("B", 1);
    source.put("c", 3);
    final Map<String, Integer> target = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    target.put("b", 2);
    target.put("C", 3);
    target.put("d", 4);

    final Changeset<String, Integer, Modification<Integer>> changeset = Differs.diffWith(source, target);
    assertEquals(List.of(new Add<>("d", 4)), toList(changeset.additions()));
    assertEquals(0, changeset.removalCount());
    assertEquals(List.of(new Modify<>("B", Modification.different(1, 2))), toList(changeset.modifications()));

    final DiffOptions options = DiffOptions.DEFAULT.withCopyMode(CopyMode.SNAPSHOT);
    assertEquals(changeset, Differs.diffWith(source, target, SimpleDiff.strict(), options));
  }

  @Test
  void test_identityKeys() {
    final String first = new String("k");
    final String second = new String("k");
    final Map<String, Integer> source = new IdentityHashMap<>();
    source.put(first, 1);
    final Map<String, Integer> target = new IdentityHashMap<>();
    target.put(first, 2);
    target.put(second, 3);

    final Changeset<String, Integer, Modification<Integer>> changeset = Differs.diffWith(source, target);
    assertEquals(1, changeset.additionCount());
    assertSame(second, changeset.additions().next().key());
    assertEquals(0, changeset.removalCount());
    assertEquals(1, changeset.modificationCount());
    assertSame(first, changeset.modifications().next().key());

    final DiffOptions options = DiffOptions.DEFAULT.withCopyMode(CopyMode.SNAPSHOT);
    final Changeset<String, Integer, Modification<Integer>> snapshot =
        Differs.diffWith(source, target, SimpleDiff.strict(), options);
    assertEquals(1, snapshot.additionCount());
    assertEquals(1, snapshot.modificationCount());
  }

  @Test
  void test_nullInput() {
    final MapDiffer<String, String, Modification<String>> differ = Differs.mapsSimply();
    assertThrows(NullPointerException.class, () -> differ.diffWith(null, new HashMap<>()));
    assertThrows(NullPointerException.class, () -> differ.diffWith(new HashMap<>(), null));
  }
}
