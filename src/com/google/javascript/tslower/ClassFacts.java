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

import java.util.EnumSet;
import java.util.Set;

/** What lowering a class declaration has to take care of. Computed once per class. */
enum ClassFacts {
  HAS_STATIC_INITIALIZED_PROPERTIES,
  HAS_CONSTRUCTOR_DECORATORS,
  HAS_MEMBER_DECORATORS,
  IS_EXPORT_OF_NAMESPACE,
  IS_NAMED_EXTERNAL_EXPORT,
  IS_DEFAULT_EXTERNAL_EXPORT,
  /** The class extends something other than {@code null}. */
  IS_DERIVED_CLASS,
  USE_IMMEDIATELY_INVOKED_FUNCTION_EXPRESSION;

  static boolean hasAnyDecorators(Set<ClassFacts> facts) {
    return facts.contains(HAS_CONSTRUCTOR_DECORATORS) || facts.contains(HAS_MEMBER_DECORATORS);
  }

  /** Whether an anonymous class must be given a name so lowered code can refer to it. */
  static boolean needsName(Set<ClassFacts> facts) {
    return facts.contains(HAS_STATIC_INITIALIZED_PROPERTIES)
        || facts.contains(HAS_MEMBER_DECORATORS);
  }

  /** Whether the class is wrapped in a closure when the output language lacks class fields. */
  static boolean mayNeedImmediatelyInvokedFunctionExpression(Set<ClassFacts> facts) {
    return hasAnyDecorators(facts) || facts.contains(HAS_STATIC_INITIALIZED_PROPERTIES);
  }

  static EnumSet<ClassFacts> none() {
    return EnumSet.noneOf(ClassFacts.class);
  }
}
