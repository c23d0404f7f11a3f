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

/** The syntactic role a node is printed in. Substitutions depend on it. */
public enum EmitHint {
  /** An expression, including identifier references. */
  EXPRESSION,
  /** A declared name or a property name. */
  IDENTIFIER_NAME,
  /** Anything else: statements, class elements, object literal members. */
  UNSPECIFIED
}
