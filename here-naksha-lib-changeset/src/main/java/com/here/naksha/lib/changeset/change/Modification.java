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

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * The result of a leaf comparison: either {@link Equal} or {@link Different}. Both variants reference the compared values, they are not
 * copied.
 *
 * @param <V> the type of the compared values.
 */
public abstract class Modification<V> implements HasChanges {

  /**
   * Returns the result for two equal values.
   *
   * @param value the source value.
   * @param <V>   the value type.
   * @return the equal result.
   */
  public static <V> @NotNull Modification<V> equal(V value) {
    return new Equal<>(value);
  }

  /**
   * Returns the result for two different values.
   *
   * @param source the source value.
   * @param target the target value.
   * @param <V>    the value type.
   * @return the different result.
   */
  public static <V> @NotNull Modification<V> different(V source, V target) {
    return new Different<>(source, target);
  }

  private Modification() {}

  /** Source and target are equal. */
  public static final class Equal<V> extends Modification<V> {

    private final V value;

    Equal(V value) {
      this.value = value;
    }

    public V value() {
      return value;
    }

    @Override
    public boolean hasChanges() {
      return false;
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Equal && Objects.equals(value, ((Equal<?>) o).value));
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public String toString() {
      return "Equal{" + value + '}';
    }
  }

  /** Source and target differ. */
  public static final class Different<V> extends Modification<V> {

    private final V source;
    private final V target;

    Different(V source, V target) {
      this.source = source;
      this.target = target;
    }

    public V source() {
      return source;
    }

    public V target() {
      return target;
    }

    @Override
    public boolean hasChanges() {
      return true;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Different)) {
        return false;
      }
      Different<?> that = (Different<?>) o;
      return Objects.equals(source, that.source) && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
      return Objects.hash(source, target);
    }

    @Override
    public String toString() {
      return "Different{" + source + " -> " + target + '}';
    }
  }
}
