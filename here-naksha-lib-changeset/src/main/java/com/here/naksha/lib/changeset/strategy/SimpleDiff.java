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

import com.here.naksha.lib.changeset.DiffOptions;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modification;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The leaf comparison, two values are either {@link Modification.Equal equal} or {@link Modification.Different different}. The values
 * are never decomposed, even if they are collections.
 *
 * @param <V> the type of the compared values.
 */
@AvailableSince(v1_0_0)
public final class SimpleDiff<V> implements ArbitraryDiff<V, Modification<V>> {

  private static final SimpleDiff<?> STRICT = new SimpleDiff<>(false);
  private static final SimpleDiff<?> LENIENT = new SimpleDiff<>(true);

  /**
   * Returns the strategy, that compares values using {@link Object#equals(Object)}.
   *
   * @param <V> the value type.
   * @return the strict strategy.
   */
  @SuppressWarnings("unchecked")
  public static <V> @NotNull SimpleDiff<V> strict() {
    return (SimpleDiff<V>) STRICT;
  }

  /**
   * Returns the strategy, that compares numbers by their numeric value, so that {@code 1}, {@code 1L} and {@code 1.0d} are equal.
   *
   * @param <V> the value type.
   * @return the lenient strategy.
   */
  @SuppressWarnings("unchecked")
  public static <V> @NotNull SimpleDiff<V> lenient() {
    return (SimpleDiff<V>) LENIENT;
  }

  /**
   * Returns the strategy configured by the given options.
   *
   * @param options the options.
   * @param <V>     the value type.
   * @return either the strict or the lenient strategy.
   */
  public static <V> @NotNull SimpleDiff<V> of(@NotNull DiffOptions options) {
    return options.lenientNumbers() ? lenient() : strict();
  }

  private SimpleDiff(boolean lenientNumbers) {
    this.lenientNumbers = lenientNumbers;
  }

  private final boolean lenientNumbers;

  public boolean isLenient() {
    return lenientNumbers;
  }

  @Override
  public @NotNull Modification<V> diffWith(V source, V target) {
    return isEqual(source, target) ? Modification.equal(source) : Modification.different(source, target);
  }

  /**
   * Tests whether the two values are equal.
   *
   * @param source the source value.
   * @param target the target value.
   * @return {@code true} if they are equal; {@code false} otherwise.
   */
  public boolean isEqual(@Nullable Object source, @Nullable Object target) {
    if (source == target) {
      return true;
    }
    if (source == null || target == null) {
      return false;
    }
    if (lenientNumbers && source instanceof Number && target instanceof Number) {
      return isEqualNumber((Number) source, (Number) target);
    }
    return source.equals(target);
  }

  /**
   * Compares two numbers by their numeric value. Integral numbers up to {@link Long} are compared as longs, {@link BigInteger} and
   * {@link BigDecimal} exactly and all other combinations as doubles, where {@code NaN} equals {@code NaN}. Other number types are only
   * equal to numbers they are {@link Object#equals(Object) equal} to.
   */
  private static boolean isEqualNumber(@NotNull Number source, @NotNull Number target) {
    if (!isKnown(source) || !isKnown(target)) {
      return source.equals(target);
    }
    if (isIntegral(source) && isIntegral(target)) {
      return source.longValue() == target.longValue();
    }
    if (isBig(source) || isBig(target)) {
      if (!isFinite(source) || !isFinite(target)) {
        return false;
      }
      return toBigDecimal(source).compareTo(toBigDecimal(target)) == 0;
    }
    final double a = source.doubleValue();
    final double b = target.doubleValue();
    return a == b || (Double.isNaN(a) && Double.isNaN(b));
  }

  private static boolean isKnown(@NotNull Number n) {
    return isIntegral(n) || n instanceof Double || n instanceof Float || isBig(n);
  }

  private static boolean isIntegral(@NotNull Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }

  private static boolean isBig(@NotNull Number n) {
    return n instanceof BigDecimal || n instanceof BigInteger;
  }

  private static boolean isFinite(@NotNull Number n) {
    return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
  }

  private static @NotNull BigDecimal toBigDecimal(@NotNull Number n) {
    if (n instanceof BigDecimal) {
      return (BigDecimal) n;
    }
    if (n instanceof BigInteger) {
      return new BigDecimal((BigInteger) n);
    }
    if (isIntegral(n)) {
      return BigDecimal.valueOf(n.longValue());
    }
    return new BigDecimal(n.toString());
  }

  @Override
  public @NotNull Scope scope() {
    return Scope.SIMPLE;
  }

  @Override
  public @NotNull Class<? extends HasChanges> changeType() {
    return Modification.class;
  }

  @Override
  public String toString() {
    return lenientNumbers ? "SimpleDiff{lenient}" : "SimpleDiff{strict}";
  }
}
