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
package com.here.naksha.lib.changeset.exceptions;

import com.here.naksha.lib.changeset.strategy.Scope;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a diff strategy is requested for a value type and scope, for which no strategy is defined. This is a configuration error,
 * it is raised when resolving the strategy, before any value is compared.
 */
public class UnsupportedStrategyException extends RuntimeException {

  /**
   * Creates a new exception.
   *
   * @param valueType the value type for which a strategy was requested.
   * @param scope     the requested scope.
   */
  public UnsupportedStrategyException(@NotNull Class<?> valueType, @NotNull Scope scope) {
    super("No diff strategy with scope " + scope + " defined for " + valueType.getName());
    this.valueType = valueType;
    this.scope = scope;
  }

  private final @NotNull Class<?> valueType;
  private final @NotNull Scope scope;

  public @NotNull Class<?> valueType() {
    return valueType;
  }

  public @NotNull Scope scope() {
    return scope;
  }
}
