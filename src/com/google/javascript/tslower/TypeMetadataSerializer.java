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

import com.google.common.collect.ImmutableList;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.CompilerOptions.LanguageMode;
import com.google.javascript.tslower.NodeUtil.AllAccessorDeclarations;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Converts type annotations into expressions that evaluate to a runtime constructor, for the
 * {@code design:*} decorator metadata.
 *
 * <p>Types are serialized in the following fashion:
 *
 * <ul>
 *   <li>Void types point to "undefined" ({@code void 0}).
 *   <li>Function and constructor types point to the global {@code Function} constructor.
 *   <li>Array and tuple types point to the global {@code Array} constructor.
 *   <li>Type predicates and booleans point to the global {@code Boolean} constructor.
 *   <li>String literal types and strings point to the global {@code String} constructor.
 *   <li>Enum and number types point to the global {@code Number} constructor.
 *   <li>Symbol and bigint types point to their constructors, guarded on older targets.
 *   <li>Type references to classes point to the constructor of the class.
 *   <li>Anything else points to the global {@code Object} constructor.
 * </ul>
 *
 * Serialization never fails for a type it cannot resolve; it falls back to a runtime check or to
 * {@code Object}.
 */
final class TypeMetadataSerializer {
  private final LoweringContext context;
  private final CompilerOptions options;

  /** Whether the type being serialized is a branch of a conditional type. */
  private boolean inConditionalTypeBranch = false;

  TypeMetadataSerializer(LoweringContext context) {
    this.context = context;
    this.options = context.getOptions();
  }

  /** The value of {@code design:type}. */
  Node serializeTypeOfNode(Node node, @Nullable Node container) {
    switch (node.getToken()) {
      case MEMBER_FIELD_DEF:
      case PARAM:
        return serializeTypeNode(node.getDeclaredType());
      case GETTER_DEF:
      case SETTER_DEF:
        return serializeTypeNode(getAccessorTypeNode(node, container));
      case CLASS:
      case CLASS_EXPR:
      case MEMBER_FUNCTION_DEF:
        return IR.name("Function");
      default:
        return IR.voidZero();
    }
  }

  /** The value of {@code design:paramtypes}: an array with one entry per parameter. */
  Node serializeParameterTypesOfNode(Node node, @Nullable Node container) {
    Node valueDeclaration = null;
    if (node.isClass()) {
      Node constructor = NodeUtil.getFirstConstructorWithBody(node);
      valueDeclaration = constructor == null ? null : NodeUtil.getMemberFunction(constructor);
    } else if (isFunctionLike(node)) {
      Node function = NodeUtil.getMemberFunction(node);
      if (NodeUtil.getFunctionBody(function) != null) {
        valueDeclaration = node;
      }
    }

    List<Node> expressions = new ArrayList<>();
    if (valueDeclaration != null) {
      List<Node> parameters = getParametersOfDecoratedDeclaration(valueDeclaration, container);
      for (int i = 0; i < parameters.size(); i++) {
        Node parameter = parameters.get(i);
        if (i == 0 && NodeUtil.isThisParameter(parameter)) {
          continue;
        }
        if (parameter.hasFlag(Node.Flag.REST)) {
          expressions.add(
              serializeTypeNode(getRestParameterElementType(parameter.getDeclaredType())));
        } else {
          expressions.add(serializeTypeOfNode(parameter, container));
        }
      }
    }
    return IR.arraylit(expressions);
  }

  /** The value of {@code design:returntype}. */
  Node serializeReturnTypeOfNode(Node node) {
    if (isFunctionLike(node)) {
      Node function = NodeUtil.getMemberFunction(node);
      if (function.getDeclaredType() != null) {
        return serializeTypeNode(function.getDeclaredType());
      }
      if (isAsyncFunction(node, function)) {
        return IR.name("Promise");
      }
    }
    return IR.voidZero();
  }

  /**
   * Serializes one type annotation. A missing annotation serializes to {@code Object}, as an
   * untyped declaration may hold any value.
   */
  Node serializeTypeNode(@Nullable Node type) {
    if (type == null) {
      return IR.name("Object");
    }
    switch (type.getToken()) {
      case VOID_TYPE:
      case UNDEFINED_TYPE:
      case NEVER_TYPE:
        return IR.voidZero();
      case PARENTHESIZED_TYPE:
        return serializeTypeNode(type.getFirstChild());
      case FUNCTION_TYPE:
      case CONSTRUCTOR_TYPE:
        return IR.name("Function");
      case ARRAY_TYPE:
      case TUPLE_TYPE:
        return IR.name("Array");
      case TYPE_PREDICATE:
      case BOOLEAN_TYPE:
        return IR.name("Boolean");
      case STRING_TYPE:
        return IR.name("String");
      case OBJECT_TYPE:
        return IR.name("Object");
      case LITERAL_TYPE:
        return serializeLiteralType(type.getFirstChild());
      case NUMBER_TYPE:
        return IR.name("Number");
      case BIGINT_TYPE:
        return getGlobalBigIntNameWithFallback();
      case SYMBOL_TYPE:
        return getGlobalSymbolName();
      case TYPE_REFERENCE:
        return serializeTypeReferenceNode(type);
      case INTERSECTION_TYPE:
      case UNION_TYPE:
        return serializeTypeList(type.getChildren());
      case CONDITIONAL_TYPE:
        {
          boolean saved = inConditionalTypeBranch;
          inConditionalTypeBranch = true;
          try {
            return serializeTypeList(
                ImmutableList.of(type.getChildAtIndex(2), type.getChildAtIndex(3)));
          } finally {
            inConditionalTypeBranch = saved;
          }
        }
      case TYPE_OPERATOR:
        if (type.getString().equals("readonly")) {
          return serializeTypeNode(type.getFirstChild());
        }
        return IR.name("Object");
      case TYPE_QUERY:
      case INDEXED_ACCESS_TYPE:
      case MAPPED_TYPE:
      case TYPE_LITERAL:
      case ANY_TYPE:
      case UNKNOWN_TYPE:
      case THIS_TYPE:
      case IMPORT_TYPE:
      case TYPE_PARAMETER:
        return IR.name("Object");
      default:
        throw new IllegalStateException("Not a type: " + type);
    }
  }

  private Node serializeLiteralType(Node literal) {
    switch (literal.getToken()) {
      case STRINGLIT:
      case TEMPLATELIT:
        return IR.name("String");
      case NEG:
      case NUMBER:
        return IR.name("Number");
      case BIGINT:
        return getGlobalBigIntNameWithFallback();
      case TRUE:
      case FALSE:
        return IR.name("Boolean");
      case NULL:
        return IR.voidZero();
      default:
        throw new IllegalStateException("Unexpected literal type: " + literal);
    }
  }

  /**
   * Serializes the members of a union, intersection or conditional type. The members must all
   * serialize to the same global name, otherwise the result is {@code Object}. {@code never}, and
   * {@code null} and {@code undefined} unless null checks are strict, take no part.
   */
  private Node serializeTypeList(List<Node> types) {
    Node serializedUnion = null;
    for (Node typeNode : types) {
      while (typeNode.getToken() == Token.PARENTHESIZED_TYPE) {
        typeNode = typeNode.getFirstChild();
      }
      if (typeNode.getToken() == Token.NEVER_TYPE) {
        continue;
      }
      if (!options.isStrictNullChecks()
          && (isNullLiteralType(typeNode) || typeNode.getToken() == Token.UNDEFINED_TYPE)) {
        continue;
      }
      Node serializedIndividual = serializeTypeNode(typeNode);
      if (serializedIndividual.matchesName("Object")) {
        return serializedIndividual;
      } else if (serializedUnion != null) {
        if (!serializedUnion.isName()
            || !serializedIndividual.isName()
            || !serializedUnion.getString().equals(serializedIndividual.getString())) {
          return IR.name("Object");
        }
      } else {
        serializedUnion = serializedIndividual;
      }
    }
    return serializedUnion != null ? serializedUnion : IR.voidZero();
  }

  private Node serializeTypeReferenceNode(Node type) {
    Node typeName = type.getFirstChild();
    TypeReferenceSerializationKind kind =
        context
            .getOracle()
            .getTypeReferenceSerializationKind(typeName, context.getScopes().getCurrentTypeScope());
    switch (kind) {
      case UNKNOWN:
        {
          // Behaves like any or unknown in a conditional type.
          if (inConditionalTypeBranch) {
            return IR.name("Object");
          }
          Node serialized = serializeEntityNameAsExpressionFallback(typeName);
          Node temp = createTempVariable();
          return IR.hook(
              createTypeCheck(IR.assign(temp.cloneTree(), serialized), "function"),
              temp,
              IR.name("Object"));
        }
      case TYPE_WITH_CONSTRUCT_SIGNATURE_AND_VALUE:
        return serializeEntityNameAsExpression(typeName);
      case VOID_NULLABLE_OR_NEVER:
        return IR.voidZero();
      case BIGINT_LIKE:
        return getGlobalBigIntNameWithFallback();
      case BOOLEAN:
        return IR.name("Boolean");
      case NUMBER_LIKE:
        return IR.name("Number");
      case STRING_LIKE:
        return IR.name("String");
      case ARRAY_LIKE:
        return IR.name("Array");
      case ES_SYMBOL:
        return getGlobalSymbolName();
      case TYPE_WITH_CALL_SIGNATURE:
        return IR.name("Function");
      case PROMISE:
        return IR.name("Promise");
      case OBJECT:
        return IR.name("Object");
    }
    throw new AssertionError(kind);
  }

  /**
   * Serializes an entity name that may not exist at runtime without letting the access throw.
   *
   * <ul>
   *   <li>{@code A} becomes {@code typeof A !== "undefined" && A}
   *   <li>{@code A.B} becomes {@code typeof A !== "undefined" && A.B}
   *   <li>{@code A.B.C} becomes {@code typeof A !== "undefined" && (_a = A.B) !== void 0 && _a.C}
   * </ul>
   */
  private Node serializeEntityNameAsExpressionFallback(Node name) {
    if (name.isName()) {
      return createCheckedValue(
          serializeEntityNameAsExpression(name), serializeEntityNameAsExpression(name));
    }
    Node left = name.getFirstChild();
    if (left.isName()) {
      return createCheckedValue(
          serializeEntityNameAsExpression(left), serializeEntityNameAsExpression(name));
    }
    Node leftFallback = serializeEntityNameAsExpressionFallback(left);
    Node temp = createTempVariable();
    return IR.and(
        IR.and(
            leftFallback.getFirstChild(),
            IR.shne(IR.assign(temp.cloneTree(), leftFallback.getSecondChild()), IR.voidZero())),
        IR.getprop(temp, name.getString()));
  }

  /** A copy of the entity name, read as a value. */
  private static Node serializeEntityNameAsExpression(Node name) {
    if (name.isName()) {
      return IR.name(name.getString());
    }
    return IR.getprop(serializeEntityNameAsExpression(name.getFirstChild()), name.getString());
  }

  /** {@code typeof left !== "undefined" && right} */
  private static Node createCheckedValue(Node left, Node right) {
    return IR.and(IR.shne(IR.typeof(left), IR.string("undefined")), right);
  }

  /** {@code typeof value === "tag"} */
  private static Node createTypeCheck(Node value, String tag) {
    return IR.sheq(IR.typeof(value), IR.string(tag));
  }

  private Node createTempVariable() {
    Node temp = context.getNameGenerator().createTempVariable();
    context.hoistVariableDeclaration(temp);
    return temp;
  }

  private Node getGlobalSymbolName() {
    return options.getLanguageOut().isBelow(LanguageMode.ECMASCRIPT_2015)
        ? getGlobalConstructorWithFallback("Symbol")
        : IR.name("Symbol");
  }

  private Node getGlobalBigIntNameWithFallback() {
    return options.getLanguageOut().isBelow(LanguageMode.ECMASCRIPT_NEXT)
        ? getGlobalConstructorWithFallback("BigInt")
        : IR.name("BigInt");
  }

  /** {@code typeof Name === "function" ? Name : Object} */
  private static Node getGlobalConstructorWithFallback(String name) {
    return IR.hook(createTypeCheck(IR.name(name), "function"), IR.name(name), IR.name("Object"));
  }

  /** The type of the set accessor's parameter, else the get accessor's return type. */
  private static @Nullable Node getAccessorTypeNode(Node accessor, @Nullable Node container) {
    if (container == null) {
      return accessor.getToken() == Token.GETTER_DEF
          ? NodeUtil.getMemberFunction(accessor).getDeclaredType()
          : getSetAccessorTypeAnnotationNode(accessor);
    }
    AllAccessorDeclarations accessors =
        NodeUtil.getAllAccessorDeclarations(NodeUtil.getMembers(container), accessor);
    Node type = null;
    if (accessors.setAccessor() != null) {
      type = getSetAccessorTypeAnnotationNode(accessors.setAccessor());
    }
    if (type == null && accessors.getAccessor() != null) {
      type = NodeUtil.getMemberFunction(accessors.getAccessor()).getDeclaredType();
    }
    return type;
  }

  private static @Nullable Node getSetAccessorTypeAnnotationNode(Node setAccessor) {
    List<Node> parameters =
        NodeUtil.withoutThisParameter(
            NodeUtil.getParameters(NodeUtil.getMemberFunction(setAccessor)));
    return parameters.isEmpty() ? null : parameters.get(0).getDeclaredType();
  }

  /** A getter reports the parameters of its setter. */
  private static List<Node> getParametersOfDecoratedDeclaration(
      Node declaration, @Nullable Node container) {
    if (container != null && declaration.getToken() == Token.GETTER_DEF) {
      Node setAccessor =
          NodeUtil.getAllAccessorDeclarations(NodeUtil.getMembers(container), declaration)
              .setAccessor();
      if (setAccessor != null) {
        return NodeUtil.getParameters(NodeUtil.getMemberFunction(setAccessor));
      }
    }
    if (declaration.isFunction()) {
      return NodeUtil.getParameters(declaration);
    }
    return NodeUtil.getParameters(NodeUtil.getMemberFunction(declaration));
  }

  /** {@code T} of {@code ...x: T[]} or {@code ...x: Array<T>}. */
  private static @Nullable Node getRestParameterElementType(@Nullable Node type) {
    if (type == null) {
      return null;
    }
    if (type.getToken() == Token.ARRAY_TYPE) {
      return type.getFirstChild();
    }
    if (type.getToken() == Token.TYPE_REFERENCE && type.getChildCount() == 2) {
      return type.getSecondChild();
    }
    return null;
  }

  private static boolean isNullLiteralType(Node type) {
    return type.getToken() == Token.LITERAL_TYPE && type.getFirstChild().getToken() == Token.NULL;
  }

  private static boolean isFunctionLike(Node node) {
    switch (node.getToken()) {
      case CONSTRUCTOR:
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        return true;
      default:
        return false;
    }
  }

  private static boolean isAsyncFunction(Node member, Node function) {
    return NodeUtil.getFunctionBody(function) != null
        && !function.hasFlag(Node.Flag.GENERATOR)
        && (member.hasModifier(Modifier.ASYNC) || function.hasModifier(Modifier.ASYNC));
  }
}
