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

/** How the type checker classifies the type named by a type reference. */
public enum TypeReferenceSerializationKind {
  /** The reference could not be resolved, or resolves to something without a runtime value. */
  UNKNOWN,
  /** A class-like type whose name is also a value with a construct signature. */
  TYPE_WITH_CONSTRUCT_SIGNATURE_AND_VALUE,
  /** void, undefined, null or never. */
  VOID_NULLABLE_OR_NEVER,
  BIGINT_LIKE,
  BOOLEAN,
  NUMBER_LIKE,
  STRING_LIKE,
  ARRAY_LIKE,
  ES_SYMBOL,
  TYPE_WITH_CALL_SIGNATURE,
  PROMISE,
  /** Any other object type. */
  OBJECT
}
