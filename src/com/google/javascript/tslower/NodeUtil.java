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
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** The getter and setter of one accessor property, and whichever of them comes first. */
  @AutoValue
  abstract static class AllAccessorDeclarations {
    abstract Node firstAccessor();

    abstract @Nullable Node getAccessor();

    abstract @Nullable Node setAccessor();
  }

  /** Whether the statement is a directive such as {@code "use strict";}. */
  static boolean isPrologueDirective(Node statement) {
    return statement.isExprResult() && statement.getFirstChild().isString();
  }

  /** Whether the statement is {@code super(...);}. */
  static boolean isSuperCallStatement(Node statement) {
    return statement.isExprResult()
        && statement.getFirstChild().isCall()
        && statement.getFirstChild().getFirstChild().getToken() == Token.SUPER;
  }

  /** Whether the statement is declared with {@code declare}. */
  static boolean isAmbient(Node node) {
    return node.hasModifier(Modifier.DECLARE);
  }

  static boolean isExported(Node node) {
    return node.hasModifier(Modifier.EXPORT);
  }

  static boolean isDefaultExport(Node node) {
    return node.hasModifier(Modifier.EXPORT) && node.hasModifier(Modifier.DEFAULT);
  }

  static boolean isStatic(Node member) {
    return member.hasModifier(Modifier.STATIC);
  }

  // Classes.

  /** The name of a class, or null if it is anonymous. */
  static @Nullable Node getClassName(Node classNode) {
    checkArgument(classNode.isClass(), classNode);
    return classNode.getOptionalChild(0);
  }

  static ImmutableList<Node> getMembers(Node classNode) {
    checkArgument(classNode.isClass(), classNode);
    return classNode.getChildAtIndex(2).getChildren();
  }

  /** The FUNCTION of a constructor, method or accessor. */
  static Node getMemberFunction(Node member) {
    switch (member.getToken()) {
      case CONSTRUCTOR:
        return member.getFirstChild();
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        return member.getSecondChild();
      default:
        throw new IllegalStateException("Not a function-like member: " + member);
    }
  }

  /** The key of a named class element or enum member. */
  static Node getMemberKey(Node member) {
    checkArgument(member.getToken() != Token.CONSTRUCTOR, member);
    return member.getFirstChild();
  }

  static @Nullable Node getFirstConstructorWithBody(Node classNode) {
    for (Node member : getMembers(classNode)) {
      if (member.getToken() == Token.CONSTRUCTOR
          && getFunctionBody(member.getFirstChild()) != null) {
        return member;
      }
    }
    return null;
  }

  // Functions.

  static ImmutableList<Node> getParameters(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getSecondChild().getChildren();
  }

  /** The body of a function, or null for a declaration without one. */
  static @Nullable Node getFunctionBody(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getOptionalChild(2);
  }

  static boolean isThisParameter(Node param) {
    return param.getToken() == Token.PARAM && param.getFirstChild().matchesName("this");
  }

  /** Whether the parameter is a constructor parameter that also declares a property. */
  static boolean isParameterPropertyDeclaration(Node param) {
    if (param.getToken() != Token.PARAM || !param.getFirstChild().isName()) {
      return false;
    }
    for (Modifier modifier : param.getModifiers()) {
      if (modifier.isParameterPropertyModifier()) {
        return true;
      }
    }
    return false;
  }

  /** Returns the parameters without a leading {@code this} parameter. */
  static List<Node> withoutThisParameter(List<Node> params) {
    if (!params.isEmpty() && isThisParameter(params.get(0))) {
      return params.subList(1, params.size());
    }
    return params;
  }

  /** Finds the accessor pair that {@code accessor} belongs to. */
  static AllAccessorDeclarations getAllAccessorDeclarations(List<Node> members, Node accessor) {
    checkArgument(
        accessor.getToken() == Token.GETTER_DEF || accessor.getToken() == Token.SETTER_DEF,
        accessor);
    String name = getStaticPropertyName(getMemberKey(accessor));
    Node first = null;
    Node getter = null;
    Node setter = null;
    if (name == null) {
      first = accessor;
      if (accessor.getToken() == Token.GETTER_DEF) {
        getter = accessor;
      } else {
        setter = accessor;
      }
    } else {
      for (Node member : members) {
        if ((member.getToken() == Token.GETTER_DEF || member.getToken() == Token.SETTER_DEF)
            && isStatic(member) == isStatic(accessor)
            && name.equals(getStaticPropertyName(getMemberKey(member)))) {
          if (first == null) {
            first = member;
          }
          if (member.getToken() == Token.GETTER_DEF && getter == null) {
            getter = member;
          } else if (member.getToken() == Token.SETTER_DEF && setter == null) {
            setter = member;
          }
        }
      }
    }
    checkState(first != null, "Accessor not found among its class members");
    return new AutoValue_NodeUtil_AllAccessorDeclarations(first, getter, setter);
  }

  /** The name of a property key when it is known statically, or null. */
  static @Nullable String getStaticPropertyName(Node key) {
    switch (key.getToken()) {
      case STRING_KEY:
      case STRINGLIT:
        return key.getString();
      case NUMBER:
        return numberToString(key.getDouble());
      case PRIVATE_NAME:
        return "#" + key.getString();
      case COMPUTED_PROP:
        {
          Node expr = key.getFirstChild();
          if (expr.isString()) {
            return expr.getString();
          } else if (expr.isNumber()) {
            return numberToString(expr.getDouble());
          }
          return null;
        }
      default:
        return null;
    }
  }

  /**
   * Whether the expression may be copied into a second location without changing behavior or
   * cost: literals, and well known symbols such as {@code Symbol.iterator}.
   */
  static boolean isSimpleInlineableExpression(Node expr) {
    switch (expr.getToken()) {
      case STRINGLIT:
      case NUMBER:
      case BIGINT:
      case TRUE:
      case FALSE:
      case NULL:
        return true;
      case GETPROP:
        return expr.getFirstChild().matchesName("Symbol");
      default:
        return false;
    }
  }

  /** Skips parentheses, type assertions and partially emitted wrappers. */
  static Node skipOuterExpressions(Node expr) {
    while (expr.getToken() == Token.PAREN
        || expr.getToken() == Token.CAST
        || expr.getToken() == Token.NON_NULL
        || expr.getToken() == Token.PARTIALLY_EMITTED) {
      expr = expr.getFirstChild();
    }
    return expr;
  }

  /** Whether the expression is an identifier or a property access chain ending in one. */
  static boolean isEntityNameExpression(Node expr) {
    if (expr.isName()) {
      return true;
    }
    return expr.isGetProp() && isEntityNameExpression(expr.getFirstChild());
  }

  /**
   * Returns a literal or entity name as it reads in source, or null for any other expression.
   */
  static @Nullable String getSourceText(Node expr) {
    switch (expr.getToken()) {
      case STRINGLIT:
        return "\"" + expr.getString() + "\"";
      case NUMBER:
        return numberToString(expr.getDouble());
      case NAME:
        return expr.getString();
      case GETPROP:
        {
          String target = getSourceText(expr.getFirstChild());
          return target == null ? null : target + "." + expr.getString();
        }
      case NEG:
        {
          String operand = getSourceText(expr.getFirstChild());
          return operand == null ? null : "-" + operand;
        }
      case PAREN:
        {
          String inner = getSourceText(expr.getFirstChild());
          return inner == null ? null : "(" + inner + ")";
        }
      default:
        return null;
    }
  }

  /** Returns the number formatted the way JavaScript prints it. */
  public static String numberToString(double d) {
    if (d == (long) d && !Double.isInfinite(d)) {
      long l = (long) d;
      if (l == 0 && 1 / d < 0) {
        return "-0";
      }
      return Long.toString(l);
    }
    if (Double.isNaN(d)) {
      return "NaN";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    return Double.toString(d);
  }
}
