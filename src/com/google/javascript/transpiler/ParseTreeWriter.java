/*
 * Copyright 2026 The Closure Compiler Authors.
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
 */

package com.google.javascript.transpiler;

import com.google.common.base.Strings;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import org.jspecify.annotations.Nullable;

/**
 * Renders a parse tree for diagnostics, one tree per line and indented by depth, in the manner of
 * {@code Node.toStringTree}.
 *
 * <p>With line numbers on, each line starts with a gutter holding the 1-based source line of the
 * tree, blank when the tree has no location. The lines of the highlighted subtree are marked with
 * {@code >>>}.
 */
public final class ParseTreeWriter {
  private static final String INDENT = "    ";
  private static final String HIGHLIGHT = ">>> ";
  private static final int GUTTER_WIDTH = 5;

  private final @Nullable ParseTree highlighted;
  private final boolean showLineNumbers;
  private final StringBuilder sb = new StringBuilder();

  private ParseTreeWriter(@Nullable ParseTree highlighted, boolean showLineNumbers) {
    this.highlighted = highlighted;
    this.showLineNumbers = showLineNumbers;
  }

  public static String write(ParseTree tree) {
    return write(tree, null, false);
  }

  public static String write(
      ParseTree tree, @Nullable ParseTree highlighted, boolean showLineNumbers) {
    ParseTreeWriter writer = new ParseTreeWriter(highlighted, showLineNumbers);
    writer.writeTree(tree, 0, false);
    return writer.sb.toString();
  }

  private void writeTree(ParseTree tree, int level, boolean inHighlight) {
    boolean highlight = inHighlight || tree == highlighted;
    if (showLineNumbers) {
      String line = tree.location == null ? "" : String.valueOf(tree.location.start.line + 1);
      sb.append(Strings.padStart(line, GUTTER_WIDTH - 1, ' ')).append(' ');
    }
    if (highlighted != null) {
      sb.append(highlight ? HIGHLIGHT : Strings.repeat(" ", HIGHLIGHT.length()));
    }
    sb.append(Strings.repeat(INDENT, level)).append(tree).append('\n');
    for (ParseTree child : tree.children()) {
      writeTree(child, level + 1, highlight);
    }
  }
}
