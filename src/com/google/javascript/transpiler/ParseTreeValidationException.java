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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.transpiler.parsing.trees.ParseTree;

/**
 * Thrown when {@link ParseTreeValidator} finds a malformed tree. This always means a compiler pass
 * has a bug; it is not a user error and compilation of the source unit must stop.
 */
public final class ParseTreeValidationException extends IllegalStateException {
  private final String validationMessage;
  private final ParseTree offendingTree;
  private final String location;
  private final String treeDump;

  ParseTreeValidationException(
      String validationMessage, ParseTree offendingTree, String location, String treeDump) {
    super(
        "Parse tree validation failure '"
            + validationMessage
            + "' at "
            + location
            + ":\n\n"
            + treeDump
            + "\n");
    this.validationMessage = checkNotNull(validationMessage);
    this.offendingTree = checkNotNull(offendingTree);
    this.location = checkNotNull(location);
    this.treeDump = checkNotNull(treeDump);
  }

  /** The rule that was violated, without location or tree. */
  public String getValidationMessage() {
    return validationMessage;
  }

  /** The subtree breaking the rule, or the validated root when none was identified. */
  public ParseTree getOffendingTree() {
    return offendingTree;
  }

  /** The start of the offending tree, or "(unknown)". */
  public String getLocation() {
    return location;
  }

  /** The validated tree rendered with the offending subtree highlighted. */
  public String getTreeDump() {
    return treeDump;
  }
}
