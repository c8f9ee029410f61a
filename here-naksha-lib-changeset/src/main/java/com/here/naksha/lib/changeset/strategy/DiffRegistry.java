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

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_1_0;

import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.collections.MapDiffer;
import com.here.naksha.lib.changeset.collections.SetDiffer;
import com.here.naksha.lib.changeset.collections.SortedMapDiffer;
import com.here.naksha.lib.changeset.exceptions.UnsupportedStrategyException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the strategy to use for a value type and scope at runtime. A strategy registered for a type is found for all its subtypes.
 * The most specific registration wins; between unrelated types, like two interfaces, the one registered first. A registration for
 * {@link Object} is the last resort. The registry is immutable and thread safe.
 */
@AvailableSince(v1_1_0)
public final class DiffRegistry {

  private static final Logger log = LoggerFactory.getLogger(DiffRegistry.class);

  /**
   * Returns a registry with the default strategies and default options.
   *
   * @return the default registry.
   */
  public static @NotNull DiffRegistry defaults() {
    return defaults(DiffOptions.DEFAULT);
  }

  /**
   * Returns a registry with the default strategies:
   *
   * <ul>
   *   <li>{@link Scope#SIMPLE} and {@link Scope#ARBITRARY} for every type.
   *   <li>{@link Scope#ARBITRARY} for sets and maps, diffing them structurally.
   *   <li>{@link Scope#MAP_VALUES_ARBITRARILY} and {@link Scope#MAP_VALUES_SIMPLY} for maps and sorted maps.
   * </ul>
   *
   * @param options the options to create the strategies with.
   * @return the registry.
   */
  public static @NotNull DiffRegistry defaults(@NotNull DiffOptions options) {
    final RecursiveDiff recursive = new RecursiveDiff(options);
    final SimpleDiff<Object> simple = SimpleDiff.of(options);
    final MapDiffer<Object, Object, HasChanges> mapsArbitrarily = new MapDiffer<>(recursive, options);
    return builder()
        .register(Object.class, simple)
        .register(Object.class, recursive)
        .register(Set.class, new SetDiffer<>(options))
        .register(Map.class, Scope.ARBITRARY, mapsArbitrarily)
        .register(Map.class, mapsArbitrarily)
        .register(Map.class, new MapDiffer<>(simple, options))
        .register(SortedMap.class, new SortedMapDiffer<>(recursive, options))
        .register(SortedMap.class, new SortedMapDiffer<>(simple, options))
        .build();
  }

  public static @NotNull Builder builder() {
    return new Builder();
  }

  private DiffRegistry(@NotNull Map<Class<?>, EnumMap<Scope, ArbitraryDiff<?, ?>>> strategies) {
    this.strategies = strategies;
  }

  private final @NotNull Map<Class<?>, EnumMap<Scope, ArbitraryDiff<?, ?>>> strategies;

  /**
   * Tests whether a strategy is defined for the given type and scope.
   *
   * @param valueType the value type.
   * @param scope     the scope.
   * @return {@code true} if {@link #resolve(Class, Scope)} would succeed.
   */
  public boolean supports(@NotNull Class<?> valueType, @NotNull Scope scope) {
    return lookup(valueType, scope) != null;
  }

  /**
   * Returns the strategy for the given value type and scope.
   *
   * @param valueType the value type.
   * @param scope     the scope.
   * @param <V>       the value type.
   * @return the strategy.
   * @throws UnsupportedStrategyException if no strategy is defined for the type and scope.
   */
  @SuppressWarnings("unchecked")
  public <V> @NotNull ArbitraryDiff<V, HasChanges> resolve(@NotNull Class<V> valueType, @NotNull Scope scope)
      throws UnsupportedStrategyException {
    Objects.requireNonNull(valueType, "valueType");
    Objects.requireNonNull(scope, "scope");
    final ArbitraryDiff<?, ?> diff = lookup(valueType, scope);
    if (diff == null) {
      log.atWarn()
          .setMessage("No diff strategy with scope {} for {}")
          .addArgument(scope)
          .addArgument(valueType.getName())
          .log();
      throw new UnsupportedStrategyException(valueType, scope);
    }
    log.atTrace()
        .setMessage("Resolved {} for {} with scope {}")
        .addArgument(diff)
        .addArgument(valueType.getName())
        .addArgument(scope)
        .log();
    return (ArbitraryDiff<V, HasChanges>) diff;
  }

  /**
   * Resolves the strategy for the given type and scope and compares the two values.
   *
   * @param valueType the value type.
   * @param scope     the scope.
   * @param source    the source value.
   * @param target    the target value.
   * @param <V>       the value type.
   * @return the comparison result.
   * @throws UnsupportedStrategyException if no strategy is defined for the type and scope.
   */
  public <V> @NotNull HasChanges diff(@NotNull Class<V> valueType, @NotNull Scope scope, V source, V target)
      throws UnsupportedStrategyException {
    return resolve(valueType, scope).diffWith(source, target);
  }

  private @Nullable ArbitraryDiff<?, ?> lookup(@NotNull Class<?> valueType, @NotNull Scope scope) {
    Class<?> bestType = null;
    ArbitraryDiff<?, ?> best = null;
    for (final Map.Entry<Class<?>, EnumMap<Scope, ArbitraryDiff<?, ?>>> entry : strategies.entrySet()) {
      final Class<?> type = entry.getKey();
      if (type == Object.class || !type.isAssignableFrom(valueType)) {
        continue;
      }
      final ArbitraryDiff<?, ?> diff = entry.getValue().get(scope);
      if (diff == null) {
        continue;
      }
      if (bestType == null || (bestType != type && bestType.isAssignableFrom(type))) {
        bestType = type;
        best = diff;
      }
    }
    if (best != null) {
      return best;
    }
    final EnumMap<Scope, ArbitraryDiff<?, ?>> fallback = strategies.get(Object.class);
    return fallback != null ? fallback.get(scope) : null;
  }

  /** Collects the strategies of a new registry. */
  public static final class Builder {

    private Builder() {}

    private final @NotNull Map<Class<?>, EnumMap<Scope, ArbitraryDiff<?, ?>>> strategies = new LinkedHashMap<>();

    /**
     * Registers the given strategy for the given type with the scope reported by the strategy.
     *
     * @param valueType the value type.
     * @param diff      the strategy.
     * @return this.
     */
    public @NotNull Builder register(@NotNull Class<?> valueType, @NotNull ArbitraryDiff<?, ?> diff) {
      return register(valueType, diff.scope(), diff);
    }

    /**
     * Registers the given strategy for the given type and scope, replacing any previous registration.
     *
     * @param valueType the value type.
     * @param scope     the scope.
     * @param diff      the strategy.
     * @return this.
     */
    public @NotNull Builder register(
        @NotNull Class<?> valueType, @NotNull Scope scope, @NotNull ArbitraryDiff<?, ?> diff) {
      Objects.requireNonNull(valueType, "valueType");
      Objects.requireNonNull(scope, "scope");
      Objects.requireNonNull(diff, "diff");
      final ArbitraryDiff<?, ?> previous =
          strategies.computeIfAbsent(valueType, k -> new EnumMap<>(Scope.class)).put(scope, diff);
      if (previous != null) {
        log.atDebug()
            .setMessage("Replaced {} for {} with scope {} by {}")
            .addArgument(previous)
            .addArgument(valueType.getName())
            .addArgument(scope)
            .addArgument(diff)
            .log();
      }
      return this;
    }

    public @NotNull DiffRegistry build() {
      final Map<Class<?>, EnumMap<Scope, ArbitraryDiff<?, ?>>> copy = new LinkedHashMap<>();
      for (final Map.Entry<Class<?>, EnumMap<Scope, ArbitraryDiff<?, ?>>> entry : strategies.entrySet()) {
        copy.put(entry.getKey(), new EnumMap<>(entry.getValue()));
      }
      return new DiffRegistry(copy);
    }
  }
}
