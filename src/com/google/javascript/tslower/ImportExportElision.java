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
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Removes the imports and exports that have no runtime value.
 *
 * <p>A binding survives when the oracle reports it as referenced as a value. Type-only forms are
 * always removed. An import whose bindings were all removed is dropped as well, unless the
 * {@code importsNotUsedAsValues} policy keeps it for its side effects.
 */
final class ImportExportElision {
  private final LoweringContext context;
  private final TreeVisitor visitor;
  private final CompilerOptions options;
  private final LoweringOracle oracle;

  ImportExportElision(LoweringContext context, TreeVisitor visitor) {
    this.context = context;
    this.visitor = visitor;
    this.options = context.getOptions();
    this.oracle = context.getOracle();
  }

  // Imports.

  ImmutableList<Node> visitImportDeclaration(Node node) {
    checkState(node.getToken() == Token.IMPORT, node);
    Node clause = node.getFirstChild();
    if (clause.isEmpty()) {
      // import "foo";
      return ImmutableList.of(node);
    }
    if (clause.hasFlag(Node.Flag.TYPE_ONLY)) {
      return ImmutableList.of();
    }
    Node importClause = visitImportClause(clause);
    if (importClause == null && !options.getImportsNotUsedAsValues().keepsUnusedImports()) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        node.toBuilder().setChild(0, importClause == null ? IR.empty() : importClause).build());
  }

  /** Removes the default binding or the named bindings that are not needed; null if both go. */
  private @Nullable Node visitImportClause(Node clause) {
    Node name = clause.getFirstChild();
    if (!name.isEmpty() && !shouldEmitAliasDeclaration(clause)) {
      name = IR.empty();
    }
    Node namedBindings = clause.getSecondChild();
    if (!namedBindings.isEmpty()) {
      Node visited = visitNamedImportBindings(namedBindings);
      namedBindings = visited == null ? IR.empty() : visited;
    }
    if (name.isEmpty() && namedBindings.isEmpty()) {
      return null;
    }
    return clause.toBuilder().setChild(0, name).setChild(1, namedBindings).build();
  }

  private @Nullable Node visitNamedImportBindings(Node bindings) {
    if (bindings.getToken() == Token.NAMESPACE_IMPORT) {
      return shouldEmitAliasDeclaration(bindings) ? bindings : null;
    }
    boolean allowEmpty =
        options.shouldPreserveValueImports()
            && options.getImportsNotUsedAsValues().keepsUnusedImports();
    List<Node> elements = new ArrayList<>();
    for (Node specifier : bindings.getChildren()) {
      if (!specifier.hasFlag(Node.Flag.TYPE_ONLY) && shouldEmitAliasDeclaration(specifier)) {
        elements.add(specifier);
      }
    }
    if (elements.isEmpty() && !allowEmpty) {
      return null;
    }
    return elements.size() == bindings.getChildCount() ? bindings : bindings.withChildren(elements);
  }

  // Exports.

  /** {@code export default x} and {@code export = x} stay only when {@code x} is a value. */
  ImmutableList<Node> visitExportAssignment(Node node) {
    checkState(node.getToken() == Token.EXPORT_ASSIGNMENT, node);
    if (!oracle.isValueAliasDeclaration(node.getOriginalNode())) {
      return ImmutableList.of();
    }
    return ImmutableList.of(visitor.visitEachChild(node));
  }

  ImmutableList<Node> visitExportDeclaration(Node node) {
    checkState(node.getToken() == Token.EXPORT, node);
    if (node.hasFlag(Node.Flag.TYPE_ONLY)) {
      return ImmutableList.of();
    }
    Node clause = node.getFirstChild();
    Node moduleSpecifier = node.getSecondChild();
    if (clause.isEmpty() || clause.getToken() == Token.NAMESPACE_EXPORT) {
      // export * from "m"; and export * as ns from "m"; are kept for their side effects.
      return ImmutableList.of(node);
    }
    boolean allowEmpty =
        !moduleSpecifier.isEmpty() && options.getImportsNotUsedAsValues().keepsUnusedImports();
    List<Node> elements = new ArrayList<>();
    for (Node specifier : clause.getChildren()) {
      if (!specifier.hasFlag(Node.Flag.TYPE_ONLY)
          && oracle.isValueAliasDeclaration(specifier.getOriginalNode())) {
        elements.add(specifier);
      }
    }
    if (elements.isEmpty() && !allowEmpty) {
      return ImmutableList.of();
    }
    if (elements.size() == clause.getChildCount()) {
      return ImmutableList.of(node);
    }
    return ImmutableList.of(node.toBuilder().setChild(0, clause.withChildren(elements)).build());
  }

  // Import-equals declarations.

  ImmutableList<Node> visitImportEqualsDeclaration(Node node) {
    checkState(node.getToken() == Token.IMPORT_EQUALS, node);
    if (node.hasFlag(Node.Flag.TYPE_ONLY)) {
      return ImmutableList.of();
    }

    Node moduleReference = node.getSecondChild();
    if (moduleReference.getToken() == Token.EXTERNAL_MODULE_REFERENCE) {
      boolean isReferenced = shouldEmitAliasDeclaration(node);
      if (!isReferenced
          && options.getImportsNotUsedAsValues()
              == CompilerOptions.ImportsNotUsedAsValues.PRESERVE) {
        // import "mod";
        return ImmutableList.of(
            IR.importSideEffect(moduleReference.getFirstChild())
                .toBuilder()
                .setOriginal(node)
                .build());
      }
      return isReferenced ? ImmutableList.of(visitor.visitEachChild(node)) : ImmutableList.of();
    }

    if (!shouldEmitImportEqualsDeclaration(node)) {
      return ImmutableList.of();
    }

    Node value = moduleReference.cloneTree().toBuilder().addEmitFlag(EmitFlag.NO_COMMENTS).build();
    Node name = node.getFirstChild();
    if (visitor.isNamedExternalModuleExport(node) || !visitor.isExportOfNamespace(node)) {
      //  export var x = A.B;
      //  var x = A.B;
      return ImmutableList.of(
          IR.var(name, value)
              .toBuilder()
              .setModifiers(visitor.visitModifiers(node))
              .setOriginal(node)
              .setLeadingComment(node.getLeadingComment())
              .build());
    }
    //  ns.x = A.B;
    Node containerName = context.getScopes().getCurrentContainerName();
    return ImmutableList.of(
        IR.exprResult(IR.assign(LoweringContext.getNamespaceMemberName(containerName, name), value))
            .toBuilder()
            .setOriginal(node)
            .build());
  }

  /**
   * A global script keeps {@code import x = A.B} when the entity name is a top level value, even
   * when {@code x} itself is never referenced.
   */
  private boolean shouldEmitImportEqualsDeclaration(Node node) {
    return shouldEmitAliasDeclaration(node)
        || (!context.isExternalModule()
            && oracle.isTopLevelValueImportEqualsWithEntityName(node.getOriginalNode()));
  }

  private boolean shouldEmitAliasDeclaration(Node node) {
    Node original = node.getOriginalNode();
    return options.shouldPreserveValueImports()
        ? oracle.isValueAliasDeclaration(original)
        : oracle.isReferencedAliasDeclaration(original);
  }
}
