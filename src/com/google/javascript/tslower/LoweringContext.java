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
import com.google.common.collect.Sets;
import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.SubstitutionRegistry.SubstitutionKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Everything the lowering of one file shares between its parts: configuration, the oracle, the
 * scope tracker, generated names, hoisted variables and requested helpers.
 */
final class LoweringContext {
  private final CompilerOptions options;
  private final LoweringOracle oracle;
  private final SubstitutionRegistry registry;
  private final NameGenerator nameGenerator;
  private final ScopeTracker scopes = new ScopeTracker();
  private final ClassAliasMap classAliases = new ClassAliasMap();
  private final Deque<List<Node>> lexicalEnvironments = new ArrayDeque<>();
  private final EnumSet<EmitHelper> requestedHelpers = EnumSet.noneOf(EmitHelper.class);
  private final Node script;

  LoweringContext(
      CompilerOptions options, LoweringOracle oracle, SubstitutionRegistry registry, Node script) {
    this.options = options;
    this.oracle = oracle;
    this.registry = registry;
    this.script = script;
    this.nameGenerator = new NameGenerator(script);
  }

  CompilerOptions getOptions() {
    return options;
  }

  LoweringOracle getOracle() {
    return oracle;
  }

  ScopeTracker getScopes() {
    return scopes;
  }

  ClassAliasMap getClassAliases() {
    return classAliases;
  }

  NameGenerator getNameGenerator() {
    return nameGenerator;
  }

  boolean isExternalModule() {
    return script.hasFlag(Node.Flag.EXTERNAL_MODULE);
  }

  void enableSubstitution(SubstitutionKind kind) {
    registry.enable(kind);
  }

  SubstitutionHooks createSubstitutionHooks() {
    return new SubstitutionHooks(registry, options, oracle, classAliases, nameGenerator);
  }

  // Names of declarations.

  /**
   * The name a declaration is referred to by from the code lowering emits next to it. Namespace
   * export qualification never applies to it.
   */
  Node getLocalName(Node declaration) {
    return getName(declaration).toBuilder().addEmitFlag(EmitFlag.LOCAL_NAME).build();
  }

  /** The local name as seen from inside the declaration itself, e.g. inside a class wrapper. */
  Node getInternalName(Node declaration) {
    return getName(declaration)
        .toBuilder()
        .addEmitFlag(EmitFlag.LOCAL_NAME)
        .addEmitFlag(EmitFlag.INTERNAL_NAME)
        .build();
  }

  /** The declared name without any emit flags, or a generated one for an anonymous class. */
  Node getDeclarationName(Node declaration) {
    return getName(declaration);
  }

  /**
   * The name under which an exported declaration is published: {@code ns.x} inside a namespace,
   * otherwise the name flagged for the module format pass.
   */
  Node getExternalModuleOrNamespaceExportName(@Nullable Node namespace, Node declaration) {
    if (namespace != null && NodeUtil.isExported(declaration)) {
      return getNamespaceMemberName(namespace, getName(declaration));
    }
    return getName(declaration).toBuilder().addEmitFlag(EmitFlag.EXPORT_NAME).build();
  }

  /** {@code ns.name} */
  static Node getNamespaceMemberName(Node namespace, Node name) {
    checkState(name.isName(), name);
    return IR.getprop(namespace.cloneTree(), name.getString());
  }

  private Node getName(Node declaration) {
    Node name = declaration.getOptionalChild(0);
    if (name != null && name.isName() && !name.getString().isEmpty()) {
      return name.cloneTree();
    }
    return nameGenerator.getGeneratedNameForNode(declaration);
  }

  // Lexical environments.

  void startLexicalEnvironment() {
    lexicalEnvironments.push(new ArrayList<>());
  }

  /** Declares a variable at the top of the innermost function, closure or file. */
  void hoistVariableDeclaration(Node name) {
    checkState(!lexicalEnvironments.isEmpty(), "No lexical environment to hoist %s into", name);
    checkState(name.isName(), name);
    lexicalEnvironments.peek().add(name.cloneTree());
  }

  /** Ends the innermost environment, returning a {@code var} statement for what was hoisted. */
  ImmutableList<Node> endLexicalEnvironment() {
    List<Node> names = lexicalEnvironments.pop();
    if (names.isEmpty()) {
      return ImmutableList.of();
    }
    return ImmutableList.of(IR.declarationList(Token.VAR, names));
  }

  /** Inserts hoisted declarations after the leading prologue directives of a statement list. */
  static ImmutableList<Node> mergeLexicalEnvironment(
      List<Node> statements, List<Node> declarations) {
    if (declarations.isEmpty()) {
      return ImmutableList.copyOf(statements);
    }
    int prologueEnd = 0;
    while (prologueEnd < statements.size()
        && NodeUtil.isPrologueDirective(statements.get(prologueEnd))) {
      prologueEnd++;
    }
    return ImmutableList.<Node>builder()
        .addAll(statements.subList(0, prologueEnd))
        .addAll(declarations)
        .addAll(statements.subList(prologueEnd, statements.size()))
        .build();
  }

  // Helpers.

  ImmutableSet<EmitHelper> getRequestedHelpers() {
    return Sets.immutableEnumSet(requestedHelpers);
  }

  /** {@code __decorate([decorators], target, memberName, descriptor)} */
  Node createDecorateHelper(
      List<Node> decoratorExpressions,
      Node target,
      @Nullable Node memberName,
      @Nullable Node descriptor) {
    List<Node> args = new ArrayList<>();
    args.add(IR.arraylit(decoratorExpressions));
    args.add(target);
    if (memberName != null) {
      args.add(memberName);
      if (descriptor != null) {
        args.add(descriptor);
      }
    }
    return callHelper(EmitHelper.DECORATE, args);
  }

  /** {@code __param(index, decorator)} */
  Node createParamHelper(Node expression, int parameterOffset) {
    return callHelper(EmitHelper.PARAM, ImmutableList.of(IR.number(parameterOffset), expression));
  }

  /** {@code __metadata("design:...", value)} */
  Node createMetadataHelper(String metadataKey, Node metadataValue) {
    checkState(metadataKey.startsWith("design:"), metadataKey);
    return callHelper(EmitHelper.METADATA, ImmutableList.of(IR.string(metadataKey), metadataValue));
  }

  private Node callHelper(EmitHelper helper, List<Node> args) {
    requestedHelpers.add(helper);
    Node callee = IR.name(helper.getFunctionName()).withEmitFlag(EmitFlag.GENERATED_NAME);
    return IR.call(callee, args);
  }
}
