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

import com.google.javascript.tsast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Answers the semantic questions lowering needs from the type checker.
 *
 * <p>Every query receives a node of the tree that was checked, i.e. the result of {@link
 * Node#getOriginalNode()}. Implementations must be safe to call repeatedly and must not change
 * their answers during a compilation.
 */
public interface LoweringOracle {

  /**
   * Returns the compile-time value of an enum member declaration, or of a property access that
   * reads a const enum member. Null if the value is not a constant.
   */
  @Nullable ConstantValue getConstantValue(Node node);

  /**
   * Whether an import or export binding (default import, namespace import, import specifier,
   * import-equals declaration, export specifier) is referenced as a value somewhere in the file.
   */
  boolean isReferencedAliasDeclaration(Node node);

  /**
   * Whether an import or export binding, or an export assignment, refers to something that has a
   * runtime value.
   */
  boolean isValueAliasDeclaration(Node node);

  /** Whether an import-equals declaration in a global script aliases a value by entity name. */
  boolean isTopLevelValueImportEqualsWithEntityName(Node node);

  /**
   * Returns the declaration whose exports contain the binding this identifier refers to: a
   * NAMESPACE, an ENUM or a SCRIPT. Null if the identifier does not refer to an export.
   */
  @Nullable Node getReferencedExportContainer(Node identifier);

  /** Whether the body of the class declaration refers to the class by name. */
  boolean hasConstructorReferenceInClass(Node classNode);

  /** Whether this identifier refers to an enclosing class from inside that class's body. */
  boolean isConstructorReferenceInClass(Node identifier);

  /** Returns the declaration this identifier refers to, if it has one. */
  @Nullable Node getReferencedValueDeclaration(Node identifier);

  /**
   * Classifies the type named by {@code typeName} (a NAME or a GETPROP chain) as seen from
   * {@code scope}.
   */
  TypeReferenceSerializationKind getTypeReferenceSerializationKind(
      Node typeName, @Nullable Node scope);
}
