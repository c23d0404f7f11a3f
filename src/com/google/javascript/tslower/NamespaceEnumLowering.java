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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.ScopeTracker.NamespaceContainerBinding;
import com.google.javascript.tslower.SubstitutionRegistry.SubstitutionKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Lowers namespaces and enums to a closure invoked with the object that holds their members.
 *
 * <pre>
 * namespace N { export const x = 1; }
 * </pre>
 *
 * becomes
 *
 * <pre>
 * var N;
 * (function (N) {
 *   N.x = 1;
 * })(N || (N = {}));
 * </pre>
 *
 * A second declaration of the same name in the same scope merges into the first: it reuses the
 * binding instead of declaring it again.
 */
final class NamespaceEnumLowering {
  private static final Logger logger = Logger.getLogger(NamespaceEnumLowering.class.getName());

  private final LoweringContext context;
  private final TreeVisitor visitor;
  private final CompilerOptions options;
  private final ScopeTracker scopes;

  NamespaceEnumLowering(LoweringContext context, TreeVisitor visitor) {
    this.context = context;
    this.visitor = visitor;
    this.options = context.getOptions();
    this.scopes = context.getScopes();
  }

  ImmutableList<Node> visitEnumDeclaration(Node node) {
    checkState(node.isEnum(), node);
    if (node.hasModifier(Modifier.CONST) && !options.shouldPreserveConstEnums()) {
      return ImmutableList.of(IR.notEmitted(node));
    }
    List<Node> statements = new ArrayList<>();
    boolean varAdded = addVarForEnumOrModuleDeclaration(statements, node);
    Node parameterName = context.getNameGenerator().getGeneratedNameForNode(node);
    Node containerName = context.getNameGenerator().getGeneratedNameForNode(node);
    statements.add(
        createClosureStatement(
            node, parameterName, transformEnumBody(node, containerName), varAdded));
    statements.add(IR.endOfDeclarationMarker(node));
    return ImmutableList.copyOf(statements);
  }

  ImmutableList<Node> visitNamespaceDeclaration(Node node) {
    checkState(node.isNamespace(), node);
    if (!ModuleInstanceState.isInstantiatedModule(node, options.shouldPreserveConstEnums())) {
      return ImmutableList.of(IR.notEmitted(node));
    }
    checkState(
        node.getFirstChild().isName(), "A namespace should have an identifier name: %s", node);
    context.enableSubstitution(SubstitutionKind.NAMESPACE_EXPORTS);
    logger.fine("Lowering namespace " + node.getFirstChild().getString());

    List<Node> statements = new ArrayList<>();
    boolean varAdded = addVarForEnumOrModuleDeclaration(statements, node);
    Node parameterName = context.getNameGenerator().getGeneratedNameForNode(node);
    Node containerName = context.getNameGenerator().getGeneratedNameForNode(node);
    statements.add(
        createClosureStatement(
            node, parameterName, transformModuleBody(node, containerName), varAdded));
    statements.add(IR.endOfDeclarationMarker(node));
    return ImmutableList.copyOf(statements);
  }

  /**
   * Adds {@code var N;}, or {@code let N;} below the top level, for the first declaration of a
   * name in the current scope. Later declarations get a merge marker instead. Returns whether the
   * variable was declared.
   */
  private boolean addVarForEnumOrModuleDeclaration(List<Node> statements, Node node) {
    Token declarationType = scopes.isAtSourceFileScope() ? Token.VAR : Token.LET;
    Node statement =
        IR.declaration(declarationType, context.getLocalName(node), null)
            .toBuilder()
            .setModifiers(visitor.visitModifiers(node))
            .setOriginal(node)
            .build();

    scopes.recordEmittedDeclarationInScope(node);
    if (scopes.isFirstEmittedDeclarationInScope(node)) {
      statements.add(statement.toBuilder().setLeadingComment(node.getLeadingComment()).build());
      return true;
    }
    statements.add(
        IR.mergeDeclarationMarker(statement, node)
            .toBuilder()
            .addEmitFlag(EmitFlag.NO_COMMENTS)
            .setOriginal(node)
            .build());
    return false;
  }

  /** {@code (function (N) { body })(N || (N = {}));} */
  private Node createClosureStatement(Node node, Node parameterName, Node body, boolean varAdded) {
    Node exportName = getExportName(node);
    //  x || (x = {})
    Node moduleArg = IR.or(exportName, IR.assign(exportName.cloneTree(), IR.objectlit()));
    if (hasNamespaceQualifiedExportName(node)) {
      //  x = (ns.x || (ns.x = {}))
      moduleArg = IR.assign(context.getLocalName(node), moduleArg);
    }
    Node closure = IR.functionExpr(IR.paramList(IR.param(parameterName)), body);
    return IR.exprResult(IR.call(IR.paren(closure), moduleArg))
        .toBuilder()
        .setOriginal(node)
        .setLeadingComment(varAdded ? null : node.getLeadingComment())
        .addEmitFlag(EmitFlag.ADVISE_ON_EMIT_NODE)
        .build();
  }

  /**
   * The expression through which the enclosing scope publishes the declaration: {@code ns.N}
   * inside a namespace, {@code exports.N} for a module export that later becomes a CommonJS style
   * export, the flagged export name for an ES module export, and the local name otherwise.
   */
  private Node getExportName(Node node) {
    if (!NodeUtil.isExported(node)) {
      return context.getLocalName(node);
    }
    Node containerName = scopes.getCurrentContainerName();
    if (containerName == null && hasNamespaceQualifiedExportName(node)) {
      return IR.getprop(IR.name("exports"), node.getFirstChild().getString());
    }
    return context.getExternalModuleOrNamespaceExportName(containerName, node);
  }

  /**
   * Whether the declaration is published under a qualified name, so that its local binding must
   * be assigned from it.
   */
  private boolean hasNamespaceQualifiedExportName(Node node) {
    return visitor.isExportOfNamespace(node)
        || (visitor.isExternalModuleExport(node)
            && !options.getModule().isEsModule()
            && options.getModule() != CompilerOptions.ModuleKind.SYSTEM);
  }

  // Namespaces.

  private Node transformModuleBody(Node node, Node namespaceLocalName) {
    scopes.pushContainer(
        NamespaceContainerBinding.create(node.getOriginalNode(), namespaceLocalName));
    Map<String, Node> savedFirstDeclarations = scopes.startNamespaceMergeScope();
    context.startLexicalEnvironment();

    List<Node> statements = new ArrayList<>();
    Node body = node.getSecondChild();
    if (body.getToken() == Token.MODULE_BLOCK) {
      statements.addAll(visitor.visitModuleBlock(body));
    } else if (body.isNamespace()) {
      statements.addAll(visitNamespaceDeclaration(body));
    }

    ImmutableList<Node> merged =
        LoweringContext.mergeLexicalEnvironment(statements, context.endLexicalEnvironment());
    scopes.endNamespaceMergeScope(savedFirstDeclarations);
    scopes.popContainer(node);

    Node block = IR.block(merged);
    // Only the namespace that holds the statements keeps their comments.
    if (body.getToken() != Token.MODULE_BLOCK) {
      block = block.withEmitFlag(EmitFlag.NO_COMMENTS);
    }
    return block;
  }

  // Enums.

  private Node transformEnumBody(Node node, Node localName) {
    scopes.pushContainer(NamespaceContainerBinding.create(node.getOriginalNode(), localName));
    context.startLexicalEnvironment();
    List<Node> statements = new ArrayList<>();
    for (Node member : node.getSecondChild().getChildren()) {
      statements.add(transformEnumMember(member, localName));
    }
    ImmutableList<Node> merged =
        LoweringContext.mergeLexicalEnvironment(statements, context.endLexicalEnvironment());
    scopes.popContainer(node);
    return IR.block(merged);
  }

  /**
   * {@code E[E["A"] = 0] = "A";}, or {@code E["B"] = "b";} for a member with a string value,
   * which has no reverse mapping.
   */
  private Node transformEnumMember(Node member, Node containerName) {
    checkState(member.getToken() == Token.ENUM_MEMBER, member);
    Node name = visitor.getExpressionForPropertyName(member, false);
    Node valueExpression = transformEnumMemberDeclarationValue(member);
    Node innerAssignment =
        IR.assign(IR.getelem(containerName.cloneTree(), name), valueExpression);
    Node outerAssignment =
        valueExpression.isString()
            ? innerAssignment
            : IR.assign(IR.getelem(containerName.cloneTree(), innerAssignment), name.cloneTree());
    return IR.exprResult(outerAssignment).toBuilder().setOriginal(member).build();
  }

  /**
   * The constant value of the member when it is known, else its initializer evaluated in the
   * closure, where references to sibling members have to be qualified at print time.
   */
  private Node transformEnumMemberDeclarationValue(Node member) {
    ConstantValue value = context.getOracle().getConstantValue(member.getOriginalNode());
    if (value != null) {
      return value.toLiteral();
    }
    context.enableSubstitution(SubstitutionKind.NON_QUALIFIED_ENUM_MEMBERS);
    Node initializer = member.getOptionalChild(1);
    return initializer != null ? visitor.visitNode(initializer) : IR.voidZero();
  }
}
