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

import static com.here.naksha.lib.changeset.common.TestUtil.linkedMap;
import static org.junit.jupiter.api.Assertions.*;

import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modification;
import com.here.naksha.lib.changeset.changeset.Changeset;
import com.here.naksha.lib.changeset.collections.MapDiffer;
import com.here.naksha.lib.changeset.collections.SetDiffer;
import com.here.naksha.lib.changeset.collections.SortedMapDiffer;
import com.here.naksha.lib.changeset.exceptions.UnsupportedStrategyException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

@SuppressWarnings("rawtypes")
class DiffRegistryTest {

  private final DiffRegistry registry = DiffRegistry.defaults();

  @Test
  void test_defaults() {
    assertInstanceOf(SimpleDiff.class, registry.resolve(Integer.class, Scope.SIMPLE));
    assertInstanceOf(SimpleDiff.class, registry.resolve(HashMap.class, Scope.SIMPLE));
    assertInstanceOf(RecursiveDiff.class, registry.resolve(String.class, Scope.ARBITRARY));
    assertInstanceOf(SetDiffer.class, registry.resolve(HashSet.class, Scope.ARBITRARY));
    assertInstanceOf(SetDiffer.class, registry.resolve(TreeSet.class, Scope.ARBITRARY));
    assertInstanceOf(MapDiffer.class, registry.resolve(LinkedHashMap.class, Scope.ARBITRARY));
    assertInstanceOf(MapDiffer.class, registry.resolve(HashMap.class, Scope.MAP_VALUES_SIMPLY));
    assertInstanceOf(MapDiffer.class, registry.resolve(Map.class, Scope.MAP_VALUES_ARBITRARILY));
  }

  @Test
  void test_mostSpecificType() {
    assertInstanceOf(SortedMapDiffer.class, registry.resolve(TreeMap.class, Scope.MAP_VALUES_SIMPLY));
    assertInstanceOf(SortedMapDiffer.class, registry.resolve(TreeMap.class, Scope.MAP_VALUES_ARBITRARILY));
    // Sorted maps have no own ARBITRARY entry, the one of Map applies.
    assertInstanceOf(MapDiffer.class, registry.resolve(TreeMap.class, Scope.ARBITRARY));
  }

  @Test
  void test_unsupported() {
    assertFalse(registry.supports(Integer.class, Scope.MAP_VALUES_SIMPLY));
    assertFalse(registry.supports(HashSet.class, Scope.MAP_VALUES_ARBITRARILY));
    assertTrue(registry.supports(HashSet.class, Scope.ARBITRARY));

    final UnsupportedStrategyException e = assertThrows(
        UnsupportedStrategyException.class, () -> registry.resolve(Integer.class, Scope.MAP_VALUES_SIMPLY));
    assertEquals(Integer.class, e.valueType());
    assertEquals(Scope.MAP_VALUES_SIMPLY, e.scope());
    assertTrue(e.getMessage().contains("MAP_VALUES_SIMPLY"));
    assertTrue(e.getMessage().contains("java.lang.Integer"));

    final DiffRegistry empty = DiffRegistry.builder().build();
    assertThrows(UnsupportedStrategyException.class, () -> empty.resolve(String.class, Scope.SIMPLE));
  }

  @Test
  void test_diff() {
    final Map<String, Integer> source = linkedMap("a", 1, "b", 2);
    final Map<String, Integer> target = linkedMap("b", 3);
    final HasChanges result = registry.diff(Map.class, Scope.MAP_VALUES_SIMPLY, source, target);
    assertInstanceOf(Changeset.class, result);
    final Changeset<?, ?, ?> changeset = (Changeset<?, ?, ?>) result;
    assertEquals(1, changeset.removalCount());
    assertEquals(1, changeset.modificationCount());

    final HasChanges leaf = registry.diff(Object.class, Scope.SIMPLE, "x", "y");
    assertEquals(Modification.different("x", "y"), leaf);
  }

  @Test
  void test_register() {
    final DiffRegistry.Builder builder = DiffRegistry.builder().register(Object.class, SimpleDiff.strict());
    final DiffRegistry strict = builder.build();
    builder.register(Object.class, SimpleDiff.lenient());
    final DiffRegistry lenient = builder.build();

    assertSame(SimpleDiff.strict(), strict.resolve(Object.class, Scope.SIMPLE));
    assertSame(SimpleDiff.lenient(), lenient.resolve(Object.class, Scope.SIMPLE));
    assertFalse(lenient.diff(Object.class, Scope.SIMPLE, 1, 1L).hasChanges());
  }

  @Test
  void test_registerUnderScope() {
    final SetDiffer<Object> sets = new SetDiffer<>();
    final DiffRegistry custom = DiffRegistry.builder().register(Set.class, Scope.SIMPLE, sets).build();
    assertSame(sets, custom.resolve(HashSet.class, Scope.SIMPLE));
    assertFalse(custom.supports(HashSet.class, Scope.ARBITRARY));
  }
}
