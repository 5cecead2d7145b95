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

import com.google.common.base.MoreObjects;

/** Options for a {@link PassRunner}. */
public class TranspilerOptions {

  /** When to validate the tree structure. */
  public static enum DevMode {
    /** Don't do any extra checks. */
    OFF,

    /** Before the first pass */
    START,

    /** Before the first pass and after the last one. */
    START_AND_END,

    /** After every pass */
    EVERY_PASS
  }

  private DevMode devMode = DevMode.OFF;

  public DevMode getDevMode() {
    return devMode;
  }

  public void setDevMode(DevMode devMode) {
    this.devMode = checkNotNull(devMode);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("devMode", devMode).toString();
  }
}
