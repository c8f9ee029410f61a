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
package com.here.naksha.lib.changeset.report;

import static com.here.naksha.lib.changeset.ChangesetVersion.v1_1_0;

import com.here.naksha.lib.changeset.change.Add;
import com.here.naksha.lib.changeset.change.Change;
import com.here.naksha.lib.changeset.change.HasChanges;
import com.here.naksha.lib.changeset.change.Modification;
import com.here.naksha.lib.changeset.change.Modify;
import com.here.naksha.lib.changeset.change.Remove;
import com.here.naksha.lib.changeset.changeset.Changeset;
import com.here.naksha.lib.changeset.iterators.Changes;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.ApiStatus.AvailableSince;
import org.jetbrains.annotations.NotNull;

/**
 * Renders a changeset as human readable lines, in the order of {@link Changeset#changes()}:
 *
 * <pre>
 * + key: value
 * - key: value
 * ~ key: source -&gt; target
 * ~ key:
 *     + nestedKey: value
 * </pre>
 *
 * <p>Modifications carrying a nested changeset are followed by the lines of the nested changeset, indented one level deeper.
 */
@AvailableSince(v1_1_0)
public class ChangesetPrinter {

  public ChangesetPrinter() {
    this(2);
  }

  /**
   * Creates a printer.
   *
   * @param indent the number of spaces per nesting level.
   */
  public ChangesetPrinter(int indent) {
    if (indent < 0) {
      throw new IllegalArgumentException("indent must not be negative, but was " + indent);
    }
    this.indent = indent;
  }

  private final int indent;

  /**
   * Renders the given changeset.
   *
   * @param changeset the changeset to render.
   * @return the rendered text, one line per change, each terminated by a line break.
   */
  public @NotNull String print(@NotNull Changeset<?, ?, ?> changeset) {
    final StringBuilder sb = new StringBuilder();
    for (final String line : lines(changeset)) {
      sb.append(line).append('\n');
    }
    return sb.toString();
  }

  /**
   * Renders the given changeset into lines.
   *
   * @param changeset the changeset to render.
   * @return the lines.
   */
  public @NotNull List<@NotNull String> lines(@NotNull Changeset<?, ?, ?> changeset) {
    final List<String> lines = new ArrayList<>();
    render(changeset, 0, lines);
    return lines;
  }

  private <K, V, D extends HasChanges> void render(
      @NotNull Changeset<K, V, D> changeset, int depth, @NotNull List<String> lines) {
    final String prefix = StringUtils.repeat(' ', depth * indent);
    final Changes<K, V, D> changes = changeset.changes();
    while (changes.hasNext()) {
      final Change<K, V, D> change = changes.next();
      if (change.isAdd()) {
        final Add<K, V> add = change.asAdd();
        lines.add(prefix + "+ " + add.key() + ": " + add.value());
      } else if (change.isRemove()) {
        final Remove<K, V> remove = change.asRemove();
        lines.add(prefix + "- " + remove.key() + ": " + remove.value());
      } else {
        final Modify<K, D> modify = change.asModify();
        final D modification = modify.modification();
        if (modification instanceof Changeset) {
          lines.add(prefix + "~ " + modify.key() + ":");
          render((Changeset<?, ?, ?>) modification, depth + 1, lines);
        } else if (modification instanceof Modification.Different) {
          final Modification.Different<?> different = (Modification.Different<?>) modification;
          lines.add(prefix + "~ " + modify.key() + ": " + different.source() + " -> " + different.target());
        } else {
          lines.add(prefix + "~ " + modify.key() + ": " + modification);
        }
      }
    }
  }
}
