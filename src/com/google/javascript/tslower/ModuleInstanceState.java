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

import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;

/** Whether a namespace declaration produces a runtime value. */
enum ModuleInstanceState {
  /** Only types: nothing is emitted. */
  NON_INSTANTIATED,
  /** Has values. */
  INSTANTIATED,
  /** Has no values other than const enums. */
  CONST_ENUM_ONLY;

  /** Whether the namespace is emitted under the given const enum policy. */
  static boolean isInstantiatedModule(Node namespace, boolean preserveConstEnums) {
    ModuleInstanceState state = of(namespace);
    return state == INSTANTIATED || (preserveConstEnums && state == CONST_ENUM_ONLY);
  }

  static ModuleInstanceState of(Node node) {
    switch (node.getToken()) {
      case INTERFACE:
      case TYPE_ALIAS:
      case NAMESPACE_EXPORT_DECLARATION:
        return NON_INSTANTIATED;
      case ENUM:
        return node.hasModifier(Modifier.CONST) ? CONST_ENUM_ONLY : INSTANTIATED;
      case IMPORT:
      case IMPORT_EQUALS:
        if (!NodeUtil.isExported(node)) {
          return NON_INSTANTIATED;
        }
        return INSTANTIATED;
      case EXPORT:
        return ofExportDeclaration(node);
      case NAMESPACE:
        {
          if (NodeUtil.isAmbient(node)) {
            return NON_INSTANTIATED;
          }
          Node body = node.getOptionalChild(1);
          return body == null ? INSTANTIATED : of(body);
        }
      case MODULE_BLOCK:
        {
          ModuleInstanceState state = NON_INSTANTIATED;
          for (Node statement : node.getChildren()) {
            switch (of(statement)) {
              case NON_INSTANTIATED:
                break;
              case CONST_ENUM_ONLY:
                state = CONST_ENUM_ONLY;
                break;
              case INSTANTIATED:
                return INSTANTIATED;
            }
          }
          return state;
        }
      default:
        return NodeUtil.isAmbient(node) ? NON_INSTANTIATED : INSTANTIATED;
    }
  }

  /** {@code export { a, b };} without a module specifier produces no value of its own. */
  private static ModuleInstanceState ofExportDeclaration(Node export) {
    if (export.hasFlag(Node.Flag.TYPE_ONLY)) {
      return NON_INSTANTIATED;
    }
    Node clause = export.getFirstChild();
    Node moduleSpecifier = export.getSecondChild();
    if (moduleSpecifier.isEmpty() && clause.getToken() == Token.NAMED_EXPORTS) {
      return NON_INSTANTIATED;
    }
    return INSTANTIATED;
  }
}
