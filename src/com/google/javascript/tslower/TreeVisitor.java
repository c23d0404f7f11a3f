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
import com.google.common.collect.ImmutableSet;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.ScopeTracker.SavedState;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Walks one file and dispatches every node that carries TypeScript syntax to the code that
 * lowers it.
 *
 * <p>Each visit returns the nodes that replace the visited one: none when it is removed, several
 * when it expands to multiple statements. Subtrees without TypeScript syntax are returned as they
 * are.
 */
final class TreeVisitor {
  private final LoweringContext context;
  private final CompilerOptions options;
  private final ScopeTracker scopes;
  private final ClassLowering classLowering;
  private final NamespaceEnumLowering namespaceEnumLowering;
  private final ImportExportElision importExportElision;

  TreeVisitor(LoweringContext context) {
    this.context = context;
    this.options = context.getOptions();
    this.scopes = context.getScopes();
    this.classLowering = new ClassLowering(context, this);
    this.namespaceEnumLowering = new NamespaceEnumLowering(context, this);
    this.importExportElision = new ImportExportElision(context, this);
  }

  /** Lowers a whole file. Returns {@code script} itself when nothing had to change. */
  Node visitSourceFile(Node script) {
    checkState(script.isScript(), script);
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(script);
    context.startLexicalEnvironment();
    try {
      List<Node> statements = new ArrayList<>();
      if (needsStrictPrologue(script)) {
        statements.add(IR.exprResult(IR.string("use strict")));
      }
      for (Node statement : script.getChildren()) {
        statements.addAll(visitSourceElement(statement));
      }
      ImmutableList<Node> merged =
          LoweringContext.mergeLexicalEnvironment(statements, context.endLexicalEnvironment());
      return updateChildren(script, merged);
    } finally {
      scopes.restore(saved);
    }
  }

  private boolean needsStrictPrologue(Node script) {
    if (!options.isAlwaysStrict()
        || (context.isExternalModule() && options.getModule().isEsModule())) {
      return false;
    }
    for (Node statement : script.getChildren()) {
      if (!NodeUtil.isPrologueDirective(statement)) {
        break;
      }
      if (statement.getFirstChild().getString().equals("use strict")) {
        return false;
      }
    }
    return true;
  }

  // Visitors.

  /** Visits a node with the general visitor, tracking the scopes it opens. */
  ImmutableList<Node> visit(Node node) {
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(node);
    try {
      return visitorWorker(node);
    } finally {
      scopes.restore(saved);
    }
  }

  ImmutableList<Node> visitorWorker(Node node) {
    if (!node.containsTypeScript()) {
      return ImmutableList.of(node);
    }
    return visitTypeScript(node);
  }

  /** Visits a top level statement, where imports and exports may be elided. */
  private ImmutableList<Node> visitSourceElement(Node node) {
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(node);
    try {
      switch (node.getToken()) {
        case IMPORT:
        case IMPORT_EQUALS:
        case EXPORT_ASSIGNMENT:
        case EXPORT:
          return visitElidableStatement(node);
        default:
          return visitorWorker(node);
      }
    } finally {
      scopes.restore(saved);
    }
  }

  private ImmutableList<Node> visitElidableStatement(Node node) {
    if (node.getOriginal() != null) {
      // Produced by an earlier transformation; nothing to elide.
      return node.containsTypeScript()
          ? ImmutableList.of(visitEachChild(node))
          : ImmutableList.of(node);
    }
    switch (node.getToken()) {
      case IMPORT:
        return importExportElision.visitImportDeclaration(node);
      case IMPORT_EQUALS:
        return importExportElision.visitImportEqualsDeclaration(node);
      case EXPORT_ASSIGNMENT:
        return importExportElision.visitExportAssignment(node);
      case EXPORT:
        return importExportElision.visitExportDeclaration(node);
      default:
        throw new IllegalStateException("Unhandled elidable statement: " + node);
    }
  }

  /** Visits the statements of a namespace body. */
  ImmutableList<Node> visitModuleBlock(Node block) {
    checkState(block.getToken() == Token.MODULE_BLOCK, block);
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(block);
    try {
      ImmutableList.Builder<Node> statements = ImmutableList.builder();
      for (Node statement : block.getChildren()) {
        statements.addAll(visitNamespaceElement(statement));
      }
      return statements.build();
    } finally {
      scopes.restore(saved);
    }
  }

  private ImmutableList<Node> visitNamespaceElement(Node node) {
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(node);
    try {
      if (node.getToken() == Token.EXPORT
          || node.getToken() == Token.IMPORT
          || node.getToken() == Token.IMPORT_CLAUSE
          || (node.getToken() == Token.IMPORT_EQUALS
              && node.getSecondChild().getToken() == Token.EXTERNAL_MODULE_REFERENCE)) {
        // Module syntax is not allowed inside a namespace.
        return ImmutableList.of();
      }
      if (node.containsTypeScript() || NodeUtil.isExported(node)) {
        return visitTypeScript(node);
      }
      return ImmutableList.of(node);
    } finally {
      scopes.restore(saved);
    }
  }

  /** Visits one member of a class body. */
  ImmutableList<Node> visitClassElement(Node member) {
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(member);
    try {
      return classLowering.visitClassElementWorker(member);
    } finally {
      scopes.restore(saved);
    }
  }

  /**
   * Drops the modifiers that only exist in TypeScript. Inside a namespace, {@code export} and
   * {@code default} go too, since members are published through the namespace object.
   */
  ImmutableSet<Modifier> visitModifiers(Node node) {
    EnumSet<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    for (Modifier modifier : node.getModifiers()) {
      if (modifier.isTypeScriptOnly()) {
        continue;
      }
      if ((modifier == Modifier.EXPORT || modifier == Modifier.DEFAULT)
          && scopes.getCurrentNamespace() != null) {
        continue;
      }
      modifiers.add(modifier);
    }
    return ImmutableSet.copyOf(modifiers);
  }

  // Dispatch.

  private ImmutableList<Node> visitTypeScript(Node node) {
    if (IR.mayBeStatement(node) && node.hasModifier(Modifier.DECLARE)) {
      // declare var x: number;
      return ImmutableList.of(IR.notEmitted(node));
    }
    return switch (node.getToken()) {
      case TYPE_REFERENCE,
          ARRAY_TYPE,
          TUPLE_TYPE,
          FUNCTION_TYPE,
          CONSTRUCTOR_TYPE,
          UNION_TYPE,
          INTERSECTION_TYPE,
          PARENTHESIZED_TYPE,
          LITERAL_TYPE,
          ANY_TYPE,
          UNKNOWN_TYPE,
          BOOLEAN_TYPE,
          STRING_TYPE,
          NUMBER_TYPE,
          BIGINT_TYPE,
          SYMBOL_TYPE,
          OBJECT_TYPE,
          VOID_TYPE,
          UNDEFINED_TYPE,
          NEVER_TYPE,
          THIS_TYPE,
          TYPE_PREDICATE,
          TYPE_LITERAL,
          TYPE_QUERY,
          CONDITIONAL_TYPE,
          TYPE_OPERATOR,
          INDEXED_ACCESS_TYPE,
          MAPPED_TYPE,
          IMPORT_TYPE,
          TYPE_PARAMETER,
          INDEX_SIGNATURE,
          DECORATOR,
          NAMESPACE_EXPORT_DECLARATION -> ImmutableList.of();
      case TYPE_ALIAS, INTERFACE -> ImmutableList.of(IR.notEmitted(node));
      case MEMBER_FIELD_DEF -> classLowering.visitPropertyDeclaration(node);
      case CONSTRUCTOR -> classLowering.visitConstructor(node);
      case CLASS -> classLowering.visitClassDeclaration(node);
      case CLASS_EXPR -> ImmutableList.of(classLowering.visitClassExpression(node));
      case MEMBER_FUNCTION_DEF -> classLowering.visitMethodDeclaration(node);
      case GETTER_DEF, SETTER_DEF -> classLowering.visitAccessor(node);
      case FUNCTION -> visitFunctionDeclaration(node);
      case FUNCTION_EXPR -> visitFunctionExpression(node);
      case ARROW_FUNCTION -> ImmutableList.of(visitArrowFunction(node));
      case PARAM -> visitParameter(node);
      case PAREN -> ImmutableList.of(visitParenthesizedExpression(node));
      case CAST, NON_NULL ->
          ImmutableList.of(IR.partiallyEmitted(visitNode(node.getFirstChild()), node));
      case ENUM -> namespaceEnumLowering.visitEnumDeclaration(node);
      case NAMESPACE -> namespaceEnumLowering.visitNamespaceDeclaration(node);
      case VAR, LET, CONST -> visitVariableStatement(node);
      case IMPORT_EQUALS -> importExportElision.visitImportEqualsDeclaration(node);
      case STATIC_BLOCK -> ImmutableList.of(visitStaticBlock(node));
      case SCRIPT,
          BLOCK,
          MODULE_BLOCK,
          EMPTY,
          EXPR_RESULT,
          RETURN,
          IF,
          WHILE,
          DO,
          FOR,
          FOR_IN,
          FOR_OF,
          SWITCH,
          CASE_BLOCK,
          CASE,
          DEFAULT_CASE,
          THROW,
          TRY,
          CATCH,
          LABEL,
          BREAK,
          CONTINUE,
          DEBUGGER,
          PARAM_LIST,
          CLASS_MEMBERS,
          SEMICOLON_CLASS_ELEMENT,
          STRING_KEY,
          COMPUTED_PROP,
          PRIVATE_NAME,
          NAME,
          NUMBER,
          STRINGLIT,
          BIGINT,
          REGEXP,
          TRUE,
          FALSE,
          NULL,
          THIS,
          SUPER,
          TEMPLATELIT,
          TEMPLATELIT_STRING,
          TAGGED_TEMPLATE,
          ARRAYLIT,
          OBJECTLIT,
          PROPERTY_ASSIGNMENT,
          SHORTHAND_PROPERTY,
          SPREAD,
          GETPROP,
          GETELEM,
          CALL,
          NEW,
          HOOK,
          COMMA,
          ASSIGN,
          ASSIGN_ADD,
          ASSIGN_SUB,
          OR,
          AND,
          COALESCE,
          EQ,
          NE,
          SHEQ,
          SHNE,
          LT,
          LE,
          GT,
          GE,
          ADD,
          SUB,
          MUL,
          DIV,
          MOD,
          BITOR,
          BITAND,
          INSTANCEOF,
          IN,
          NOT,
          NEG,
          POS,
          BITNOT,
          TYPEOF,
          VOID,
          DELPROP,
          AWAIT,
          INC,
          DEC,
          YIELD,
          IMPORT,
          IMPORT_CLAUSE,
          NAMED_IMPORTS,
          IMPORT_SPEC,
          NAMESPACE_IMPORT,
          EXTERNAL_MODULE_REFERENCE,
          EXPORT,
          NAMED_EXPORTS,
          EXPORT_SPEC,
          NAMESPACE_EXPORT,
          EXPORT_ASSIGNMENT,
          ENUM_MEMBERS,
          ENUM_MEMBER,
          NOT_EMITTED,
          PARTIALLY_EMITTED,
          OMITTED,
          END_OF_DECLARATION_MARKER,
          MERGE_DECLARATION_MARKER -> ImmutableList.of(visitEachChild(node));
    };
  }

  // Functions.

  private ImmutableList<Node> visitFunctionDeclaration(Node node) {
    if (NodeUtil.getFunctionBody(node) == null) {
      // An overload signature.
      return ImmutableList.of(IR.notEmitted(node));
    }
    Node updated = visitFunction(node);
    if (isExportOfNamespace(node)) {
      updated = updated.toBuilder().setModifiers(visitModifiers(node)).build();
      return ImmutableList.of(updated, createExportMemberAssignment(node));
    }
    return ImmutableList.of(updated);
  }

  private ImmutableList<Node> visitFunctionExpression(Node node) {
    Node function = node.getFirstChild();
    if (NodeUtil.getFunctionBody(function) == null) {
      return ImmutableList.of(IR.omitted());
    }
    return ImmutableList.of(
        node.toBuilder().clearTypeScriptSyntax().setChild(0, visitFunction(function)).build());
  }

  /** Lowers the signature and body of a FUNCTION, keeping its name. */
  Node visitFunction(Node function) {
    checkState(function.isFunction(), function);
    if (!function.containsTypeScript()) {
      return function;
    }
    Node params = visitParameterList(function.getSecondChild());
    Node body = visitFunctionBody(function.getChildAtIndex(2));
    return function
        .toBuilder()
        .clearTypeScriptSyntax()
        .setModifiers(visitModifiers(function))
        .setChild(1, params)
        .setChild(2, body)
        .build();
  }

  private Node visitArrowFunction(Node node) {
    Node params = visitParameterList(node.getFirstChild());
    Node body = node.getSecondChild();
    Node newBody =
        body.getToken() == Token.BLOCK ? visitFunctionBody(body) : visitConciseBody(body);
    return node.toBuilder()
        .clearTypeScriptSyntax()
        .setModifiers(visitModifiers(node))
        .setChild(0, params)
        .setChild(1, newBody)
        .build();
  }

  /** {@code () => expr} becomes {@code () => { var _a; return expr; }} if it hoists names. */
  private Node visitConciseBody(Node expression) {
    Node visited = visitNode(expression);
    ImmutableList<Node> declarations = context.endLexicalEnvironment();
    if (declarations.isEmpty()) {
      return visited;
    }
    return IR.block(
        LoweringContext.mergeLexicalEnvironment(
            ImmutableList.of(IR.returnNode(visited)), declarations));
  }

  /**
   * Visits the parameters of a function and opens the lexical environment that the matching
   * {@link #visitFunctionBody} closes.
   */
  Node visitParameterList(Node params) {
    checkState(params.getToken() == Token.PARAM_LIST, params);
    context.startLexicalEnvironment();
    if (!params.containsTypeScript()) {
      return params;
    }
    return visitChildren(params).build();
  }

  /**
   * Visits a function body as a scope of its own and closes the lexical environment of its
   * parameters.
   */
  Node visitFunctionBody(Node body) {
    if (body.isEmpty()) {
      return endFunctionBody(body, ImmutableList.of());
    }
    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(body);
    try {
      return endFunctionBody(body, visitStatements(body.getChildren()));
    } finally {
      scopes.restore(saved);
    }
  }

  /** Closes the lexical environment of a function, merging what was hoisted into its body. */
  Node endFunctionBody(Node body, List<Node> statements) {
    ImmutableList<Node> merged =
        LoweringContext.mergeLexicalEnvironment(statements, context.endLexicalEnvironment());
    if (body.isEmpty()) {
      return IR.block(merged);
    }
    return updateChildren(body, merged);
  }

  ImmutableList<Node> visitStatements(List<Node> statements) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node statement : statements) {
      result.addAll(visit(statement));
    }
    return result.build();
  }

  private ImmutableList<Node> visitParameter(Node node) {
    if (NodeUtil.isThisParameter(node)) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        visitChildren(node).clearTypeScriptSyntax().setModifiers(ImmutableSet.of()).build());
  }

  private Node visitStaticBlock(Node node) {
    context.startLexicalEnvironment();
    return node.toBuilder().setChild(0, visitFunctionBody(node.getFirstChild())).build();
  }

  // Expressions.

  /** {@code (x as T)} keeps the link to the parentheses so that the printer can keep them. */
  private Node visitParenthesizedExpression(Node node) {
    Node inner = node.getFirstChild();
    while (inner.getToken() == Token.PAREN || inner.getToken() == Token.PARTIALLY_EMITTED) {
      inner = inner.getFirstChild();
    }
    if (inner.getToken() == Token.CAST) {
      return IR.partiallyEmitted(visitNode(node.getFirstChild()), node);
    }
    return visitEachChild(node);
  }

  /**
   * Returns the expression that names a class member or enum member at runtime. A computed name
   * that is not a literal is replaced by the temporary it was stored in when {@code
   * generateNameForComputedPropertyName} is set.
   */
  Node getExpressionForPropertyName(Node member, boolean generateNameForComputedPropertyName) {
    Node name = member.getFirstChild();
    switch (name.getToken()) {
      case PRIVATE_NAME:
        return IR.string("");
      case COMPUTED_PROP:
        {
          Node expression = name.getFirstChild();
          Node inner = NodeUtil.skipOuterExpressions(expression);
          if (generateNameForComputedPropertyName
              && !NodeUtil.isSimpleInlineableExpression(inner)) {
            return context.getNameGenerator().getGeneratedNameForNode(name);
          }
          return visitNode(expression);
        }
      case STRING_KEY:
      case NAME:
        return IR.string(name.getString());
      default:
        return name.cloneTree();
    }
  }

  // Variable statements.

  /**
   * Inside a namespace, {@code export var a = 1, b;} becomes {@code ns.a = 1;}. The binding
   * itself lives on the namespace object.
   */
  private ImmutableList<Node> visitVariableStatement(Node node) {
    if (!isExportOfNamespace(node)) {
      return ImmutableList.of(visitEachChild(node));
    }
    Node containerName = scopes.getCurrentContainerName();
    Node expression = null;
    for (Node name : node.getChildren()) {
      checkState(name.isName(), "Destructuring is not supported: %s", name);
      Node initializer = name.getOptionalChild(0);
      if (initializer == null) {
        continue;
      }
      Node assignment =
          IR.assign(
              LoweringContext.getNamespaceMemberName(containerName, IR.name(name.getString())),
              visitNode(initializer));
      expression = expression == null ? assignment : IR.comma(expression, assignment);
    }
    if (expression == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(IR.exprResult(expression).toBuilder().setOriginal(node).build());
  }

  // Exports.

  boolean isExportOfNamespace(Node node) {
    return scopes.getCurrentNamespace() != null && NodeUtil.isExported(node);
  }

  boolean isExternalModuleExport(Node node) {
    return scopes.getCurrentNamespace() == null && NodeUtil.isExported(node);
  }

  boolean isNamedExternalModuleExport(Node node) {
    return isExternalModuleExport(node) && !node.hasModifier(Modifier.DEFAULT);
  }

  boolean isDefaultExternalModuleExport(Node node) {
    return isExternalModuleExport(node) && node.hasModifier(Modifier.DEFAULT);
  }

  /** {@code ns.x = x;} */
  Node createExportMemberAssignment(Node declaration) {
    Node exportName =
        context.getExternalModuleOrNamespaceExportName(
            scopes.getCurrentContainerName(), declaration);
    return IR.exprResult(IR.assign(exportName, context.getLocalName(declaration)))
        .toBuilder()
        .setOriginal(declaration)
        .build();
  }

  // Children.

  /** Visits an expression or other node that must be replaced by exactly one node. */
  Node visitNode(Node node) {
    return toSingleNode(visit(node));
  }

  /** Visits the children of a node and drops the TypeScript syntax attached to the node itself. */
  Node visitEachChild(Node node) {
    if (!node.containsTypeScript()) {
      return node;
    }
    return visitChildren(node).clearTypeScriptSyntax().setModifiers(visitModifiers(node)).build();
  }

  private Node.Builder visitChildren(Node node) {
    boolean flatten = isListParent(node);
    List<Node> children = new ArrayList<>();
    for (Node child : node.getChildren()) {
      ImmutableList<Node> visited = visit(child);
      if (flatten) {
        children.addAll(visited);
      } else {
        children.add(toSingleNode(visited));
      }
    }
    return node.toBuilder().setChildren(children);
  }

  private static Node toSingleNode(ImmutableList<Node> nodes) {
    switch (nodes.size()) {
      case 0:
        return IR.empty();
      case 1:
        return nodes.get(0);
      default:
        return IR.block(nodes);
    }
  }

  /** Parents whose children are a list that a visit may shrink or grow. */
  private static boolean isListParent(Node node) {
    switch (node.getToken()) {
      case SCRIPT:
      case BLOCK:
      case MODULE_BLOCK:
      case CASE:
      case DEFAULT_CASE:
      case CLASS_MEMBERS:
      case PARAM_LIST:
        return true;
      default:
        return false;
    }
  }

  /** Returns {@code node} when the children did not change, else a copy with the new ones. */
  private static Node updateChildren(Node node, List<Node> children) {
    if (children.equals(node.getChildren())) {
      return node;
    }
    return node.withChildren(children);
  }
}
