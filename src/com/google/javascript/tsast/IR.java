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

package com.google.javascript.tsast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {
  private IR() {}

  public static Node empty() {
    return Node.builder(Token.EMPTY).build();
  }

  public static Node script(Node... statements) {
    return script(ImmutableList.copyOf(statements));
  }

  public static Node script(List<Node> statements) {
    return Node.builder(Token.SCRIPT).addChildren(statements).build();
  }

  /** A script that is an ES module, i.e. one that has imports or exports. */
  public static Node module(Node... statements) {
    return Node.builder(Token.SCRIPT)
        .addChildren(ImmutableList.copyOf(statements))
        .addFlag(Node.Flag.EXTERNAL_MODULE)
        .build();
  }

  public static Node block(Node... statements) {
    return block(ImmutableList.copyOf(statements));
  }

  public static Node block(List<Node> statements) {
    for (Node statement : statements) {
      checkState(mayBeStatement(statement), "Unexpected block child: %s", statement);
    }
    return Node.builder(Token.BLOCK).addChildren(statements).build();
  }

  public static Node moduleBlock(Node... statements) {
    return Node.builder(Token.MODULE_BLOCK).addChildren(ImmutableList.copyOf(statements)).build();
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.EXPR_RESULT).addChild(expr).build();
  }

  public static Node var(Node name, @Nullable Node value) {
    return declaration(Token.VAR, name, value);
  }

  public static Node var(Node name) {
    return declaration(Token.VAR, name, null);
  }

  public static Node let(Node name, @Nullable Node value) {
    return declaration(Token.LET, name, value);
  }

  public static Node constNode(Node name, Node value) {
    return declaration(Token.CONST, name, value);
  }

  public static Node declaration(Token type, Node name, @Nullable Node value) {
    checkArgument(type == Token.VAR || type == Token.LET || type == Token.CONST, type);
    checkArgument(name.isName() && !name.hasChildren(), name);
    Node binding =
        value == null
            ? name
            : name.toBuilder().setOriginal(name.getOriginal()).addChild(value).build();
    return Node.builder(type).addChild(binding).build();
  }

  /** A declaration list statement binding several names, none of them initialized. */
  public static Node declarationList(Token type, List<Node> names) {
    checkArgument(!names.isEmpty());
    return Node.builder(type).addChildren(names).build();
  }

  public static Node returnNode() {
    return Node.builder(Token.RETURN).addChild(empty()).build();
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.RETURN).addChild(expr).build();
  }

  public static Node throwNode(Node expr) {
    return Node.builder(Token.THROW).addChild(expr).build();
  }

  public static Node ifNode(Node cond, Node then) {
    return Node.builder(Token.IF).addChild(cond).addChild(then).addChild(empty()).build();
  }

  public static Node function(Node name, Node params, Node body) {
    checkArgument(name.isName(), name);
    checkArgument(params.getToken() == Token.PARAM_LIST, params);
    checkArgument(body.getToken() == Token.BLOCK || body.isEmpty(), body);
    return Node.builder(Token.FUNCTION).addChild(name).addChild(params).addChild(body).build();
  }

  /** A function expression wrapping an anonymous function. */
  public static Node functionExpr(Node params, Node body) {
    return Node.builder(Token.FUNCTION_EXPR).addChild(function(name(""), params, body)).build();
  }

  public static Node functionExpr(Node function) {
    checkArgument(function.isFunction(), function);
    return Node.builder(Token.FUNCTION_EXPR).addChild(function).build();
  }

  public static Node arrowFunction(Node params, Node body) {
    checkArgument(params.getToken() == Token.PARAM_LIST, params);
    return Node.builder(Token.ARROW_FUNCTION).addChild(params).addChild(body).build();
  }

  public static Node paramList(Node... params) {
    return paramList(ImmutableList.copyOf(params));
  }

  public static Node paramList(List<Node> params) {
    for (Node param : params) {
      checkArgument(param.getToken() == Token.PARAM, param);
    }
    return Node.builder(Token.PARAM_LIST).addChildren(params).build();
  }

  public static Node param(String name) {
    return Node.builder(Token.PARAM).addChild(name(name)).build();
  }

  public static Node param(Node name) {
    return Node.builder(Token.PARAM).addChild(name).build();
  }

  public static Node classNode(Node name, Node superClass, Node members) {
    checkArgument(name.isName() || name.isEmpty(), name);
    checkArgument(members.getToken() == Token.CLASS_MEMBERS, members);
    return Node.builder(Token.CLASS)
        .addChild(name)
        .addChild(superClass)
        .addChild(members)
        .build();
  }

  public static Node classExpr(Node name, Node superClass, Node members) {
    checkArgument(name.isName() || name.isEmpty(), name);
    checkArgument(members.getToken() == Token.CLASS_MEMBERS, members);
    return Node.builder(Token.CLASS_EXPR)
        .addChild(name)
        .addChild(superClass)
        .addChild(members)
        .build();
  }

  public static Node classMembers(Node... members) {
    return classMembers(ImmutableList.copyOf(members));
  }

  public static Node classMembers(List<Node> members) {
    return Node.builder(Token.CLASS_MEMBERS).addChildren(members).build();
  }

  public static Node constructor(Node params, Node body) {
    return Node.builder(Token.CONSTRUCTOR).addChild(function(name(""), params, body)).build();
  }

  public static Node memberFunctionDef(String name, Node function) {
    return classElement(Token.MEMBER_FUNCTION_DEF, stringKey(name), function);
  }

  public static Node getterDef(String name, Node function) {
    return classElement(Token.GETTER_DEF, stringKey(name), function);
  }

  public static Node setterDef(String name, Node function) {
    return classElement(Token.SETTER_DEF, stringKey(name), function);
  }

  public static Node classElement(Token type, Node key, Node function) {
    checkArgument(
        type == Token.MEMBER_FUNCTION_DEF || type == Token.GETTER_DEF || type == Token.SETTER_DEF,
        type);
    checkArgument(isPropertyKey(key), key);
    checkArgument(function.isFunction(), function);
    return Node.builder(type).addChild(key).addChild(function).build();
  }

  public static Node memberFieldDef(String name, @Nullable Node value) {
    return memberFieldDef(stringKey(name), value);
  }

  public static Node memberFieldDef(Node key, @Nullable Node value) {
    checkArgument(isPropertyKey(key), key);
    Node.Builder b = Node.builder(Token.MEMBER_FIELD_DEF).addChild(key);
    if (value != null) {
      b.addChild(value);
    }
    return b.build();
  }

  public static Node staticBlock(Node block) {
    return Node.builder(Token.STATIC_BLOCK).addChild(block).build();
  }

  public static Node decorator(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.DECORATOR).addChild(expr).build();
  }

  public static Node stringKey(String name) {
    return Node.builder(Token.STRING_KEY).setString(name).build();
  }

  public static Node computedProp(Node expr) {
    return Node.builder(Token.COMPUTED_PROP).addChild(expr).build();
  }

  public static Node privateName(String name) {
    return Node.builder(Token.PRIVATE_NAME).setString(name).build();
  }

  public static Node enumNode(Node name, Node... members) {
    checkArgument(name.isName(), name);
    Node body =
        Node.builder(Token.ENUM_MEMBERS).addChildren(ImmutableList.copyOf(members)).build();
    return Node.builder(Token.ENUM).addChild(name).addChild(body).build();
  }

  public static Node enumMember(String name, @Nullable Node value) {
    return enumMember(stringKey(name), value);
  }

  public static Node enumMember(Node key, @Nullable Node value) {
    Node.Builder b = Node.builder(Token.ENUM_MEMBER).addChild(key);
    if (value != null) {
      b.addChild(value);
    }
    return b.build();
  }

  /**
   * A namespace declaration. A dotted name such as {@code A.B.C} produces nested declarations,
   * the inner ones implicitly exported.
   */
  public static Node namespace(String dottedName, Node body) {
    List<String> parts = Splitter.on('.').splitToList(dottedName);
    Node result = body;
    for (int i = parts.size() - 1; i >= 0; i--) {
      Node.Builder b = Node.builder(Token.NAMESPACE).addChild(name(parts.get(i))).addChild(result);
      if (i > 0) {
        b.addModifier(Modifier.EXPORT).addFlag(Node.Flag.NESTED_NAMESPACE);
      }
      result = b.build();
    }
    return result;
  }

  public static Node interfaceNode(String name) {
    return Node.builder(Token.INTERFACE).setString(name).build();
  }

  public static Node typeAlias(String name, Node type) {
    return Node.builder(Token.TYPE_ALIAS).setString(name).setDeclaredType(type).build();
  }

  // Imports and exports.

  public static Node importNode(Node clause, String module) {
    return Node.builder(Token.IMPORT).addChild(clause).addChild(string(module)).build();
  }

  public static Node importClause(Node defaultBinding, Node namedBindings) {
    return Node.builder(Token.IMPORT_CLAUSE)
        .addChild(defaultBinding)
        .addChild(namedBindings)
        .build();
  }

  public static Node namedImports(Node... specs) {
    return Node.builder(Token.NAMED_IMPORTS).addChildren(ImmutableList.copyOf(specs)).build();
  }

  public static Node importSpec(String name) {
    return importSpec(name, name);
  }

  public static Node importSpec(String imported, String local) {
    return Node.builder(Token.IMPORT_SPEC).addChild(name(imported)).addChild(name(local)).build();
  }

  public static Node namespaceImport(String name) {
    return Node.builder(Token.NAMESPACE_IMPORT).addChild(name(name)).build();
  }

  public static Node importEquals(String name, Node reference) {
    return Node.builder(Token.IMPORT_EQUALS).addChild(name(name)).addChild(reference).build();
  }

  public static Node externalModuleReference(String module) {
    return Node.builder(Token.EXTERNAL_MODULE_REFERENCE).addChild(string(module)).build();
  }

  /** {@code import "module";} */
  public static Node importSideEffect(Node moduleSpecifier) {
    return Node.builder(Token.IMPORT).addChild(empty()).addChild(moduleSpecifier).build();
  }

  public static Node export(Node clause, Node moduleSpecifier) {
    return Node.builder(Token.EXPORT).addChild(clause).addChild(moduleSpecifier).build();
  }

  public static Node namedExports(Node... specs) {
    return namedExports(ImmutableList.copyOf(specs));
  }

  public static Node namedExports(List<Node> specs) {
    return Node.builder(Token.NAMED_EXPORTS).addChildren(specs).build();
  }

  public static Node exportSpec(String name) {
    return exportSpec(name, name);
  }

  public static Node exportSpec(String local, String exported) {
    return Node.builder(Token.EXPORT_SPEC).addChild(name(local)).addChild(name(exported)).build();
  }

  /** {@code export default expr;} */
  public static Node exportDefault(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return Node.builder(Token.EXPORT_ASSIGNMENT).addChild(expr).build();
  }

  /** {@code export = expr;} */
  public static Node exportEquals(Node expr) {
    return Node.builder(Token.EXPORT_ASSIGNMENT)
        .addChild(expr)
        .addFlag(Node.Flag.EXPORT_EQUALS)
        .build();
  }

  // Expressions.

  public static Node name(String name) {
    return Node.builder(Token.NAME).setString(name).build();
  }

  public static Node string(String s) {
    return Node.builder(Token.STRINGLIT).setString(s).build();
  }

  public static Node number(double d) {
    return Node.builder(Token.NUMBER).setDouble(d).build();
  }

  public static Node bigint(String digits) {
    return Node.builder(Token.BIGINT).setString(digits).build();
  }

  public static Node trueNode() {
    return Node.builder(Token.TRUE).build();
  }

  public static Node falseNode() {
    return Node.builder(Token.FALSE).build();
  }

  public static Node nullNode() {
    return Node.builder(Token.NULL).build();
  }

  public static Node thisNode() {
    return Node.builder(Token.THIS).build();
  }

  public static Node superNode() {
    return Node.builder(Token.SUPER).build();
  }

  /** {@code void 0} */
  public static Node voidZero() {
    return Node.builder(Token.VOID).addChild(number(0)).build();
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target), target);
    return Node.builder(Token.GETPROP).addChild(target).setString(prop).build();
  }

  /** Builds a property access chain: {@code getprop(a, "b", "c")} is {@code a.b.c}. */
  public static Node getprop(Node target, String prop, String... moreProps) {
    Node result = getprop(target, prop);
    for (String p : moreProps) {
      result = getprop(result, p);
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(elem), elem);
    return Node.builder(Token.GETELEM).addChild(target).addChild(elem).build();
  }

  public static Node call(Node target, Node... args) {
    return call(target, ImmutableList.copyOf(args));
  }

  public static Node call(Node target, List<Node> args) {
    checkState(mayBeExpression(target), target);
    return Node.builder(Token.CALL).addChild(target).addChildren(args).build();
  }

  public static Node newNode(Node target, Node... args) {
    return Node.builder(Token.NEW).addChild(target).addChildren(ImmutableList.copyOf(args)).build();
  }

  public static Node arraylit(Node... elements) {
    return arraylit(ImmutableList.copyOf(elements));
  }

  public static Node arraylit(List<Node> elements) {
    return Node.builder(Token.ARRAYLIT).addChildren(elements).build();
  }

  public static Node objectlit(Node... props) {
    return Node.builder(Token.OBJECTLIT).addChildren(ImmutableList.copyOf(props)).build();
  }

  public static Node propertyAssignment(Node key, Node value) {
    return Node.builder(Token.PROPERTY_ASSIGNMENT).addChild(key).addChild(value).build();
  }

  public static Node shorthandProperty(String name) {
    return Node.builder(Token.SHORTHAND_PROPERTY).setString(name).build();
  }

  public static Node paren(Node expr) {
    return Node.builder(Token.PAREN).addChild(expr).build();
  }

  public static Node hook(Node cond, Node then, Node elseNode) {
    return Node.builder(Token.HOOK).addChild(cond).addChild(then).addChild(elseNode).build();
  }

  public static Node assign(Node target, Node expr) {
    return binaryOp(Token.ASSIGN, target, expr);
  }

  public static Node comma(Node expr1, Node expr2) {
    return binaryOp(Token.COMMA, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node sheq(Node expr1, Node expr2) {
    return binaryOp(Token.SHEQ, expr1, expr2);
  }

  public static Node shne(Node expr1, Node expr2) {
    return binaryOp(Token.SHNE, expr1, expr2);
  }

  public static Node binaryOp(Token op, Node expr1, Node expr2) {
    checkArgument(op.isBinaryOperator(), op);
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return Node.builder(op).addChild(expr1).addChild(expr2).build();
  }

  public static Node typeof(Node expr) {
    return unaryOp(Token.TYPEOF, expr);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node neg(Node expr) {
    return unaryOp(Token.NEG, expr);
  }

  public static Node unaryOp(Token op, Node expr) {
    checkArgument(op.isUnaryOperator(), op);
    checkState(mayBeExpression(expr), expr);
    return Node.builder(op).addChild(expr).build();
  }

  /** A type assertion {@code expr as type}. */
  public static Node cast(Node expr, Node type) {
    return Node.builder(Token.CAST).addChild(expr).setDeclaredType(type).build();
  }

  public static Node nonNull(Node expr) {
    return Node.builder(Token.NON_NULL).addChild(expr).build();
  }

  // Types.

  /** A reference to a named type. {@code A.B} produces a qualified reference. */
  public static Node typeReference(String dottedName, Node... typeArguments) {
    List<String> parts = Splitter.on('.').splitToList(dottedName);
    Node entity = name(parts.get(0));
    for (int i = 1; i < parts.size(); i++) {
      entity = getprop(entity, parts.get(i));
    }
    return Node.builder(Token.TYPE_REFERENCE)
        .addChild(entity)
        .addChildren(ImmutableList.copyOf(typeArguments))
        .build();
  }

  public static Node simpleType(Token type) {
    checkArgument(type.isTypeNode(), type);
    return Node.builder(type).build();
  }

  public static Node compositeType(Token type, Node... types) {
    checkArgument(type.isTypeNode(), type);
    return Node.builder(type).addChildren(ImmutableList.copyOf(types)).build();
  }

  public static Node literalType(Node literal) {
    return Node.builder(Token.LITERAL_TYPE).addChild(literal).build();
  }

  public static Node typeOperator(String operator, Node type) {
    return Node.builder(Token.TYPE_OPERATOR).setString(operator).addChild(type).build();
  }

  public static Node typeParameter(String name) {
    return Node.builder(Token.TYPE_PARAMETER).setString(name).build();
  }

  // Synthesized placeholders.

  /** A statement that prints nothing but keeps the link to what it replaced. */
  public static Node notEmitted(Node original) {
    return Node.builder(Token.NOT_EMITTED)
        .setOriginal(original)
        .setLeadingComment(original.getLeadingComment())
        .build();
  }

  public static Node partiallyEmitted(Node expr, @Nullable Node original) {
    return Node.builder(Token.PARTIALLY_EMITTED).addChild(expr).setOriginal(original).build();
  }

  public static Node omitted() {
    return Node.builder(Token.OMITTED).build();
  }

  public static Node endOfDeclarationMarker(Node original) {
    return Node.builder(Token.END_OF_DECLARATION_MARKER).setOriginal(original).build();
  }

  public static Node mergeDeclarationMarker(Node statement, Node original) {
    return Node.builder(Token.MERGE_DECLARATION_MARKER)
        .addChild(statement)
        .setOriginal(original)
        .build();
  }

  static boolean isPropertyKey(Node n) {
    switch (n.getToken()) {
      case STRING_KEY:
      case STRINGLIT:
      case NUMBER:
      case COMPUTED_PROP:
      case PRIVATE_NAME:
        return true;
      default:
        return false;
    }
  }

  /** It isn't possible to always determine if a detached node is an expression. */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case NUMBER:
      case STRINGLIT:
      case BIGINT:
      case REGEXP:
      case TRUE:
      case FALSE:
      case NULL:
      case THIS:
      case SUPER:
      case TEMPLATELIT:
      case TAGGED_TEMPLATE:
      case ARRAYLIT:
      case OBJECTLIT:
      case SPREAD:
      case FUNCTION_EXPR:
      case ARROW_FUNCTION:
      case CLASS_EXPR:
      case GETPROP:
      case GETELEM:
      case CALL:
      case NEW:
      case HOOK:
      case PAREN:
      case YIELD:
      case CAST:
      case NON_NULL:
      case PARTIALLY_EMITTED:
      case OMITTED:
        return true;
      default:
        return n.getToken().isBinaryOperator() || n.getToken().isUnaryOperator();
    }
  }

  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case EXPR_RESULT:
      case VAR:
      case LET:
      case CONST:
      case FUNCTION:
      case CLASS:
      case RETURN:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case SWITCH:
      case THROW:
      case TRY:
      case LABEL:
      case BREAK:
      case CONTINUE:
      case DEBUGGER:
      case BLOCK:
      case IMPORT:
      case IMPORT_EQUALS:
      case EXPORT:
      case EXPORT_ASSIGNMENT:
      case NAMESPACE_EXPORT_DECLARATION:
      case INTERFACE:
      case TYPE_ALIAS:
      case ENUM:
      case NAMESPACE:
      case NOT_EMITTED:
      case END_OF_DECLARATION_MARKER:
      case MERGE_DECLARATION_MARKER:
        return true;
      default:
        return false;
    }
  }
}
