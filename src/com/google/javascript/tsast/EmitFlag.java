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

/** Hints attached by lowering for the printer and later passes. */
public enum EmitFlag {
  /** The printer notifies the substitution hooks before and after printing this node. */
  ADVISE_ON_EMIT_NODE,
  /** A name that refers to the local binding of a declaration. Never substituted. */
  LOCAL_NAME,
  /** A name that refers to the binding inside a class or closure body. Never substituted. */
  INTERNAL_NAME,
  /** A name that later module passes rewrite into an export reference. */
  EXPORT_NAME,
  /** A name created by lowering rather than written by the user. Never substituted. */
  GENERATED_NAME,
  /** Do not print comments attached to this node. */
  NO_COMMENTS,
  /** The class is wrapped in a closure; printed with a {@code @class} annotation. */
  TYPE_SCRIPT_CLASS_WRAPPER
}
