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

import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.SubstitutionRegistry.SubstitutionKind;
import java.util.EnumSet;
import org.jspecify.annotations.Nullable;

/**
 * The printer-facing hooks of one lowered file.
 *
 * <p>A printer calls {@link #onEmitNode} around every node the registry asks to be notified
 * about, and {@link #onSubstituteNode} for every node whose kind has substitution enabled. The
 * substitutions that apply to a node depend on which lowered namespace or enum closure it is
 * printed inside.
 */
public final class SubstitutionHooks {

  /** Prints a node. */
  public interface EmitCallback {
    void emit(EmitHint hint, Node node);
  }

  private final SubstitutionRegistry registry;
  private final CompilerOptions options;
  private final LoweringOracle oracle;
  private final ClassAliasMap classAliases;
  private final NameGenerator nameGenerator;

  // The substitutions that apply to the subtree being printed.
  private EnumSet<SubstitutionKind> applicableSubstitutions =
      EnumSet.noneOf(SubstitutionKind.class);

  SubstitutionHooks(
      SubstitutionRegistry registry,
      CompilerOptions options,
      LoweringOracle oracle,
      ClassAliasMap classAliases,
      NameGenerator nameGenerator) {
    this.registry = registry;
    this.options = options;
    this.oracle = oracle;
    this.classAliases = classAliases;
    this.nameGenerator = nameGenerator;
  }

  /**
   * Prints {@code node} through {@code emitCallback}. While a lowered namespace or enum closure is
   * printed, qualification of the names it exports applies.
   */
  public void onEmitNode(EmitHint hint, Node node, EmitCallback emitCallback) {
    EnumSet<SubstitutionKind> savedApplicableSubstitutions = applicableSubstitutions.clone();
    Node original = node.getOriginalNode();
    if (original != node && original.isNamespace()) {
      applicableSubstitutions.add(SubstitutionKind.NAMESPACE_EXPORTS);
    }
    if (original != node && original.isEnum()) {
      applicableSubstitutions.add(SubstitutionKind.NON_QUALIFIED_ENUM_MEMBERS);
    }
    try {
      emitCallback.emit(hint, node);
    } finally {
      applicableSubstitutions = savedApplicableSubstitutions;
    }
  }

  /** Returns the node to print in place of {@code node}; {@code node} itself if none. */
  public Node onSubstituteNode(EmitHint hint, Node node) {
    if (hint == EmitHint.EXPRESSION) {
      return substituteExpression(node);
    } else if (node.getToken() == Token.SHORTHAND_PROPERTY) {
      return substituteShorthandProperty(node);
    }
    return node;
  }

  private Node substituteExpression(Node node) {
    switch (node.getToken()) {
      case NAME:
        return substituteExpressionIdentifier(node);
      case GETPROP:
      case GETELEM:
        return substituteConstantValue(node);
      default:
        return node;
    }
  }

  private Node substituteExpressionIdentifier(Node node) {
    Node substitute = trySubstituteClassAlias(node);
    if (substitute == null) {
      substitute = trySubstituteNamespaceExportedName(node, node.getString());
    }
    return substitute != null ? substitute : node;
  }

  /** {@code {x}} becomes {@code {x: ns.x}} when {@code x} is exported from a namespace. */
  private Node substituteShorthandProperty(Node node) {
    if (!registry.isEnabled(SubstitutionKind.NAMESPACE_EXPORTS)) {
      return node;
    }
    String name = node.getString();
    Node exportedName = trySubstituteNamespaceExportedName(node, name);
    if (exportedName == null) {
      return node;
    }
    return Node.builder(Token.PROPERTY_ASSIGNMENT)
        .addChild(IR.stringKey(name))
        .addChild(exportedName)
        .setOriginal(node)
        .build();
  }

  private @Nullable Node trySubstituteClassAlias(Node node) {
    if (!registry.isEnabled(SubstitutionKind.CLASS_ALIASES)) {
      return null;
    }
    Node reference = node.getOriginalNode();
    if (!oracle.isConstructorReferenceInClass(reference)) {
      return null;
    }
    Node declaration = oracle.getReferencedValueDeclaration(reference);
    if (declaration == null) {
      return null;
    }
    Node alias = classAliases.get(declaration);
    if (alias == null) {
      return null;
    }
    return alias.toBuilder().setLeadingComment(null).setOriginal(node).build();
  }

  private @Nullable Node trySubstituteNamespaceExportedName(Node node, String name) {
    if (!isAnyApplicable(SubstitutionKind.NAMESPACE_EXPORTS)
        && !isAnyApplicable(SubstitutionKind.NON_QUALIFIED_ENUM_MEMBERS)) {
      return null;
    }
    if (node.hasEmitFlag(EmitFlag.GENERATED_NAME) || node.hasEmitFlag(EmitFlag.LOCAL_NAME)) {
      return null;
    }
    Node container = oracle.getReferencedExportContainer(node.getOriginalNode());
    if (container == null || container.isScript()) {
      return null;
    }
    boolean qualify =
        (isAnyApplicable(SubstitutionKind.NAMESPACE_EXPORTS) && container.isNamespace())
            || (isAnyApplicable(SubstitutionKind.NON_QUALIFIED_ENUM_MEMBERS) && container.isEnum());
    if (!qualify) {
      return null;
    }
    return IR.getprop(nameGenerator.getGeneratedNameForNode(container), name)
        .toBuilder()
        .setOriginal(node)
        .build();
  }

  /** Replaces a read of a const enum member with its value. */
  private Node substituteConstantValue(Node node) {
    if (options.isIsolatedModules()) {
      return node;
    }
    ConstantValue value = oracle.getConstantValue(node.getOriginalNode());
    if (value == null) {
      return node;
    }
    Node.Builder substitute = value.toLiteral().toBuilder().setOriginal(node);
    if (!options.shouldRemoveComments()) {
      String propertyName = propertyNameOfAccess(node);
      if (propertyName != null) {
        substitute.setTrailingComment(" " + propertyName + " ");
      }
    }
    return substitute.build();
  }

  private static @Nullable String propertyNameOfAccess(Node node) {
    if (node.isGetProp()) {
      return node.getString();
    }
    return NodeUtil.getSourceText(node.getSecondChild());
  }

  private boolean isAnyApplicable(SubstitutionKind kind) {
    return registry.isEnabled(kind) && applicableSubstitutions.contains(kind);
  }
}
