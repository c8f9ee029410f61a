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

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_1_0;

import java.util.Objects;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The immutable configuration of the differs. Use {@link #DEFAULT} and the {@code with} methods to create modified copies.
 */
@AvailableSince(v1_1_0)
public final class DiffOptions {

  /**
   * Borrow the collections, compare all keys and compare numbers strictly.
   */
  public static final DiffOptions DEFAULT = new DiffOptions(CopyMode.BORROW, null, false);

  private DiffOptions(@NotNull CopyMode copyMode, @Nullable IgnoreKey ignoreKey, boolean lenientNumbers) {
    this.copyMode = copyMode;
    this.ignoreKey = ignoreKey;
    this.lenientNumbers = lenientNumbers;
  }

  private final @NotNull CopyMode copyMode;
  private final @Nullable IgnoreKey ignoreKey;
  private final boolean lenientNumbers;

  public @NotNull CopyMode copyMode() {
    return copyMode;
  }

  /**
   * Returns the test for map keys to ignore.
   *
   * @return the test; {@code null} if no key is ignored.
   */
  public @Nullable IgnoreKey ignoreKey() {
    return ignoreKey;
  }

  /**
   * Tests whether the leaf comparison treats numbers with the same numeric value as equal, even when their types differ.
   *
   * @return {@code true} if numbers are compared by value.
   */
  public boolean lenientNumbers() {
    return lenientNumbers;
  }

  public @NotNull DiffOptions withCopyMode(@NotNull CopyMode copyMode) {
    return new DiffOptions(Objects.requireNonNull(copyMode), ignoreKey, lenientNumbers);
  }

  public @NotNull DiffOptions withIgnoreKey(@Nullable IgnoreKey ignoreKey) {
    return new DiffOptions(copyMode, ignoreKey, lenientNumbers);
  }

  public @NotNull DiffOptions withLenientNumbers(boolean lenientNumbers) {
    return new DiffOptions(copyMode, ignoreKey, lenientNumbers);
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this)
        .append("copyMode", copyMode)
        .append("ignoreKey", ignoreKey != null)
        .append("lenientNumbers", lenientNumbers)
        .toString();
  }
}
