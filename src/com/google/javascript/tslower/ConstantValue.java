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

package com.google.javascript.tslower;

import com.google.auto.value.AutoValue;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Node;
import org.jspecify.annotations.Nullable;

/** The compile-time value of an enum member: a string or a number. */
@AutoValue
public abstract class ConstantValue {

  public static ConstantValue ofString(String value) {
    return new AutoValue_ConstantValue(value, 0);
  }

  public static ConstantValue ofNumber(double value) {
    return new AutoValue_ConstantValue(null, value);
  }

  public abstract @Nullable String stringValue();

  public abstract double numberValue();

  public boolean isString() {
    return stringValue() != null;
  }

  /** Returns a literal expression for this value. Negative numbers become a negation. */
  Node toLiteral() {
    if (isString()) {
      return IR.string(stringValue());
    }
    double value = numberValue();
    if (value < 0 || (value == 0 && 1 / value < 0)) {
      return IR.neg(IR.number(-value));
    }
    return IR.number(value);
  }
}
