/*
 * Copyright 2023 The Closure Compiler Authors.
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

package com.google.javascript.tsast;

/** Declaration modifiers, in the order they are printed. */
public enum Modifier {
  EXPORT("export", false),
  DEFAULT("default", false),
  DECLARE("declare", true),
  PUBLIC("public", true),
  PRIVATE("private", true),
  PROTECTED("protected", true),
  STATIC("static", false),
  ABSTRACT("abstract", true),
  OVERRIDE("override", true),
  READONLY("readonly", true),
  /** {@code const enum}. */
  CONST("const", true),
  ASYNC("async", false);

  private final String keyword;
  private final boolean typeScriptOnly;

  Modifier(String keyword, boolean typeScriptOnly) {
    this.keyword = keyword;
    this.typeScriptOnly = typeScriptOnly;
  }

  public String getKeyword() {
    return keyword;
  }

  /** Whether the modifier has no meaning in the target dialect and is always removed. */
  public boolean isTypeScriptOnly() {
    return typeScriptOnly;
  }

  /** Whether this modifier turns a constructor parameter into a parameter property. */
  public boolean isParameterPropertyModifier() {
    return this == PUBLIC || this == PRIVATE || this == PROTECTED || this == READONLY
        || this == OVERRIDE;
  }
}
