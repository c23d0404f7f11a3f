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

import com.google.common.collect.ImmutableMap;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The print-time replacements of one lowered file, computed ahead of printing.
 *
 * <p>The table is built by walking the lowered tree in print order and asking {@link
 * SubstitutionHooks} about every node a printer would offer it, with the same emit notifications
 * and hints. A printer then only has to {@link #lookup} each node it is about to print.
 */
public final class SubstitutionTable {
  private final ImmutableMap<Integer, Node> replacements;

  private SubstitutionTable(ImmutableMap<Integer, Node> replacements) {
    this.replacements = replacements;
  }

  static SubstitutionTable build(
      Node root, SubstitutionRegistry registry, SubstitutionHooks hooks) {
    Builder builder = new Builder(registry, hooks);
    builder.emit(EmitHint.UNSPECIFIED, root);
    return new SubstitutionTable(ImmutableMap.copyOf(builder.replacements));
  }

  /** Returns the node to print instead of the node with the given id, if any. */
  public Optional<Node> lookup(int nodeId) {
    return Optional.ofNullable(replacements.get(nodeId));
  }

  public boolean isEmpty() {
    return replacements.isEmpty();
  }

  public int size() {
    return replacements.size();
  }

  private static final class Builder {
    private final SubstitutionRegistry registry;
    private final SubstitutionHooks hooks;
    private final Map<Integer, Node> replacements = new LinkedHashMap<>();

    Builder(SubstitutionRegistry registry, SubstitutionHooks hooks) {
      this.registry = registry;
      this.hooks = hooks;
    }

    void emit(EmitHint hint, Node node) {
      if (registry.isEmitNotificationEnabled(node)) {
        hooks.onEmitNode(hint, node, this::emitWithSubstitution);
      } else {
        emitWithSubstitution(hint, node);
      }
    }

    private void emitWithSubstitution(EmitHint hint, Node node) {
      Node printed = node;
      if (registry.isSubstitutionEnabled(node)) {
        Node substitute = hooks.onSubstituteNode(hint, node);
        if (substitute != node) {
          replacements.put(node.getId(), substitute);
          printed = substitute;
        }
      }
      for (int i = 0; i < printed.getChildCount(); i++) {
        emit(hintForChild(printed, i), printed.getChildAtIndex(i));
      }
    }
  }

  /** Returns the role the i-th child of {@code parent} is printed in. */
  static EmitHint hintForChild(Node parent, int index) {
    Node child = parent.getChildAtIndex(index);
    if (child.isName() && isBindingPosition(parent, index)) {
      return EmitHint.IDENTIFIER_NAME;
    }
    return IR.mayBeExpression(child) ? EmitHint.EXPRESSION : EmitHint.UNSPECIFIED;
  }

  private static boolean isBindingPosition(Node parent, int index) {
    switch (parent.getToken()) {
      case VAR:
      case LET:
      case CONST:
      case IMPORT_SPEC:
      case EXPORT_SPEC:
      case NAMESPACE_IMPORT:
      case NAMESPACE_EXPORT:
        return true;
      case FUNCTION:
      case CLASS:
      case CLASS_EXPR:
      case PARAM:
      case CATCH:
      case ENUM:
      case NAMESPACE:
      case IMPORT_EQUALS:
      case IMPORT_CLAUSE:
        return index == 0;
      default:
        return false;
    }
  }
}
