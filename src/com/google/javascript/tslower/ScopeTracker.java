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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Tracks the lexical scope, the class name scope and the namespace containers the visitor is
 * inside of.
 *
 * <p>Within one lexical scope it remembers the first declaration of each name, so that a later
 * enum or namespace with the same name merges into the earlier one instead of declaring the name
 * again.
 */
final class ScopeTracker {

  /** The state attached to one traversal of a scope-introducing node. */
  static final class ScopeFrame {
    private final @Nullable Node scope;
    private final @Nullable Node nameScope;
    // Created on the first recorded declaration.
    private @Nullable Map<String, Node> firstDeclarationsOfName;

    private ScopeFrame(
        @Nullable Node scope,
        @Nullable Node nameScope,
        @Nullable Map<String, Node> firstDeclarationsOfName) {
      this.scope = scope;
      this.nameScope = nameScope;
      this.firstDeclarationsOfName = firstDeclarationsOfName;
    }
  }

  /** A namespace or enum whose closure body is being lowered. */
  @AutoValue
  abstract static class NamespaceContainerBinding {
    static NamespaceContainerBinding create(Node declaration, Node localName) {
      checkState(declaration.isNamespace() || declaration.isEnum(), declaration);
      return new AutoValue_ScopeTracker_NamespaceContainerBinding(declaration, localName);
    }

    /** The NAMESPACE or ENUM being lowered. */
    abstract Node declaration();

    /** The closure parameter through which members are reached from inside the body. */
    abstract Node localName();
  }

  /** A snapshot taken before visiting a node and restored afterwards. */
  @AutoValue
  abstract static class SavedState {
    abstract ScopeFrame frame();

    abstract boolean classHasParameterProperties();
  }

  private ScopeFrame current = new ScopeFrame(null, null, null);
  private boolean currentClassHasParameterProperties = false;
  private final Deque<NamespaceContainerBinding> containers = new ArrayDeque<>();

  SavedState save() {
    return new AutoValue_ScopeTracker_SavedState(current, currentClassHasParameterProperties);
  }

  /**
   * Restores a snapshot. Declarations recorded while the lexical scope stayed the same are
   * kept; those recorded in a nested scope are discarded with it.
   */
  void restore(SavedState saved) {
    ScopeFrame savedFrame = saved.frame();
    if (current.scope == savedFrame.scope) {
      current =
          new ScopeFrame(savedFrame.scope, savedFrame.nameScope, current.firstDeclarationsOfName);
    } else {
      current = savedFrame;
    }
    currentClassHasParameterProperties = saved.classHasParameterProperties();
  }

  /** Updates the tracked scopes for a node about to be visited. */
  void onBeforeVisitNode(Node node) {
    switch (node.getToken()) {
      case SCRIPT:
      case CASE_BLOCK:
      case MODULE_BLOCK:
      case BLOCK:
        current = new ScopeFrame(node.getOriginalNode(), null, null);
        break;
      case CLASS:
      case FUNCTION:
        {
          if (node.hasModifier(Modifier.DECLARE)) {
            break;
          }
          String name = declaredNameInScope(node);
          if (name.isEmpty()) {
            checkState(
                node.getToken() == Token.CLASS || node.hasModifier(Modifier.DEFAULT),
                "Anonymous function declaration that is not a default export");
          } else {
            recordEmittedDeclarationInScope(node);
          }
          if (node.getToken() == Token.CLASS) {
            current =
                new ScopeFrame(
                    current.scope, node.getOriginalNode(), current.firstDeclarationsOfName);
          }
          break;
        }
      default:
        break;
    }
  }

  /** Records the node as the first declaration of its name unless an earlier one exists. */
  void recordEmittedDeclarationInScope(Node node) {
    if (current.firstDeclarationsOfName == null) {
      current.firstDeclarationsOfName = new HashMap<>();
    }
    current.firstDeclarationsOfName.putIfAbsent(
        declaredNameInScope(node), node.getOriginalNode());
  }

  /** Whether this is the first declaration of its name emitted in the current scope. */
  boolean isFirstEmittedDeclarationInScope(Node node) {
    if (current.firstDeclarationsOfName == null) {
      return true;
    }
    return current.firstDeclarationsOfName.get(declaredNameInScope(node))
        == node.getOriginalNode();
  }

  boolean isAtSourceFileScope() {
    return current.scope != null && current.scope.isScript();
  }

  /** The innermost class declaration, used to resolve type names in metadata. */
  @Nullable Node getCurrentNameScope() {
    return current.nameScope;
  }

  /** The scope in which a type name should be resolved. */
  @Nullable Node getCurrentTypeScope() {
    return current.nameScope != null ? current.nameScope : current.scope;
  }

  boolean currentClassHasParameterProperties() {
    return currentClassHasParameterProperties;
  }

  void setCurrentClassHasParameterProperties(boolean value) {
    currentClassHasParameterProperties = value;
  }

  /**
   * Starts a fresh merge scope for a namespace body and returns the map it replaces, to be
   * handed back to {@link #endNamespaceMergeScope}.
   */
  @Nullable Map<String, Node> startNamespaceMergeScope() {
    Map<String, Node> saved = current.firstDeclarationsOfName;
    current.firstDeclarationsOfName = null;
    return saved;
  }

  void endNamespaceMergeScope(@Nullable Map<String, Node> saved) {
    current.firstDeclarationsOfName = saved;
  }

  void pushContainer(NamespaceContainerBinding binding) {
    containers.push(checkNotNull(binding));
  }

  void popContainer(Node declaration) {
    NamespaceContainerBinding top = containers.pop();
    checkState(
        top.declaration() == declaration.getOriginalNode(),
        "Unbalanced namespace container stack");
  }

  int getContainerDepth() {
    return containers.size();
  }

  /** The innermost namespace being lowered, or null at the top level of a file. */
  @Nullable Node getCurrentNamespace() {
    for (NamespaceContainerBinding binding : containers) {
      if (binding.declaration().isNamespace()) {
        return binding.declaration();
      }
    }
    return null;
  }

  /** The local name of the innermost namespace or enum being lowered. */
  @Nullable Node getCurrentContainerName() {
    NamespaceContainerBinding top = containers.peek();
    return top == null ? null : top.localName();
  }

  private static String declaredNameInScope(Node node) {
    Node name = node.getFirstChild();
    return name.isName() ? name.getString() : "";
  }
}
