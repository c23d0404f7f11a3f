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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Node;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Generates names that do not collide with any identifier of one file.
 *
 * <p>Names are deterministic: the same file lowered twice gets the same names.
 */
final class NameGenerator {
  private final Set<String> usedNames = new HashSet<>();
  private final Map<Integer, String> generatedNamesByNode = new HashMap<>();
  private int tempCount = 0;

  NameGenerator(Node script) {
    collectIdentifiers(script, usedNames);
  }

  /** Returns {@code base_1}, {@code base_2}, ..., whichever is free first. */
  Node createUniqueName(String base) {
    return generatedName(makeUniqueName(base));
  }

  /** Returns the next free temporary name: {@code _a}, {@code _b}, ... */
  Node createTempVariable() {
    String name;
    do {
      name = tempName(tempCount++);
    } while (usedNames.contains(name));
    usedNames.add(name);
    return generatedName(name);
  }

  /**
   * Returns the name lowering uses for a declaration. Asking twice for the same declaration
   * yields the same text.
   *
   * <p>A namespace or enum keeps its own name unless its body declares a binding with that
   * name. An anonymous class is named after {@code default}. Anything else gets a temporary.
   */
  Node getGeneratedNameForNode(Node node) {
    Node original = node.getOriginalNode();
    String name = generatedNamesByNode.get(original.getId());
    if (name == null) {
      name = generateNameForNode(original);
      generatedNamesByNode.put(original.getId(), name);
    }
    return generatedName(name);
  }

  private String generateNameForNode(Node node) {
    switch (node.getToken()) {
      case NAMESPACE:
      case ENUM:
        {
          Node declaredName = node.getFirstChild();
          checkArgument(declaredName.isName(), declaredName);
          String base = declaredName.getString();
          Set<String> locals = new HashSet<>();
          collectDeclaredNames(node.getSecondChild(), locals);
          return locals.contains(base) ? makeUniqueName(base) : base;
        }
      case CLASS:
      case CLASS_EXPR:
        return makeUniqueName("default");
      default:
        return createTempVariable().getString();
    }
  }

  private String makeUniqueName(String base) {
    for (int i = 1; ; i++) {
      String candidate = base + "_" + i;
      if (usedNames.add(candidate)) {
        return candidate;
      }
    }
  }

  private static String tempName(int count) {
    if (count < 26) {
      return "_" + (char) ('a' + count);
    }
    return "_" + (count - 26);
  }

  private static Node generatedName(String name) {
    return IR.name(name).withEmitFlag(EmitFlag.GENERATED_NAME);
  }

  private static void collectIdentifiers(Node n, Set<String> names) {
    switch (n.getToken()) {
      case NAME:
      case GETPROP:
      case STRING_KEY:
      case SHORTHAND_PROPERTY:
      case PRIVATE_NAME:
        names.add(n.getString());
        break;
      default:
        break;
    }
    for (Node child : n.getChildren()) {
      collectIdentifiers(child, names);
    }
  }

  /** Collects the names bound by declarations anywhere inside {@code n}. */
  private static void collectDeclaredNames(Node n, Set<String> names) {
    switch (n.getToken()) {
      case VAR:
      case LET:
      case CONST:
        for (Node binding : n.getChildren()) {
          names.add(binding.getString());
        }
        break;
      case FUNCTION:
      case CLASS:
      case ENUM:
      case NAMESPACE:
      case IMPORT_EQUALS:
        if (n.getFirstChild().isName()) {
          names.add(n.getFirstChild().getString());
        }
        break;
      case PARAM:
        if (n.getFirstChild().isName()) {
          names.add(n.getFirstChild().getString());
        }
        break;
      case IMPORT_SPEC:
        names.add(n.getSecondChild().getString());
        break;
      case ENUM_MEMBER:
        if (n.getFirstChild().isStringKey()) {
          names.add(n.getFirstChild().getString());
        }
        break;
      default:
        break;
    }
    for (Node child : n.getChildren()) {
      collectDeclaredNames(child, names);
    }
  }
}
