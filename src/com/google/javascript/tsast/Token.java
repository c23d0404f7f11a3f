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

/**
 * The closed set of syntax node kinds.
 *
 * <p>The expected children of each kind are listed next to it. {@code EMPTY} fills a position
 * that is syntactically absent.
 */
public enum Token {
  // Top level and statements.
  /** Statements... Flags: {@code EXTERNAL_MODULE}, {@code DECLARATION_FILE}. */
  SCRIPT,
  /** Statements... */
  BLOCK,
  /** The body of a namespace. Statements... */
  MODULE_BLOCK,
  EMPTY,
  /** [expr] */
  EXPR_RESULT,
  /** NAME... each NAME has an optional initializer child. */
  VAR,
  LET,
  CONST,
  /** [NAME (string may be empty), PARAM_LIST, BLOCK | EMPTY] */
  FUNCTION,
  /** [NAME | EMPTY, superclass | EMPTY, CLASS_MEMBERS] */
  CLASS,
  /** [expr | EMPTY] */
  RETURN,
  /** [cond, then, else | EMPTY] */
  IF,
  /** [cond, body] */
  WHILE,
  /** [body, cond] */
  DO,
  /** [init | EMPTY, cond | EMPTY, incr | EMPTY, body] */
  FOR,
  /** [lhs, obj, body] */
  FOR_IN,
  /** [lhs, iterable, body] */
  FOR_OF,
  /** [expr, CASE_BLOCK] */
  SWITCH,
  /** CASE | DEFAULT_CASE... */
  CASE_BLOCK,
  /** [expr, statements...] */
  CASE,
  /** statements... */
  DEFAULT_CASE,
  /** [expr] */
  THROW,
  /** [BLOCK, CATCH | EMPTY, BLOCK | EMPTY] */
  TRY,
  /** [NAME | EMPTY, BLOCK] */
  CATCH,
  /** String is the label. [statement] */
  LABEL,
  /** String is the optional label. */
  BREAK,
  CONTINUE,
  DEBUGGER,

  // Functions and classes.
  /** PARAM... */
  PARAM_LIST,
  /** [NAME, default value?] Flags: {@code REST}, {@code OPTIONAL}. */
  PARAM,
  /** Class elements... */
  CLASS_MEMBERS,
  /** [FUNCTION] */
  CONSTRUCTOR,
  /** [key, FUNCTION] */
  MEMBER_FUNCTION_DEF,
  /** [key, FUNCTION] */
  GETTER_DEF,
  /** [key, FUNCTION] */
  SETTER_DEF,
  /** [key, initializer?] Flags: {@code OPTIONAL}, {@code DEFINITE}. */
  MEMBER_FIELD_DEF,
  /** [BLOCK] */
  STATIC_BLOCK,
  /** A type-only class element. */
  INDEX_SIGNATURE,
  /** A stray {@code ;} inside a class body. */
  SEMICOLON_CLASS_ELEMENT,
  /** [expr] */
  DECORATOR,

  // Property keys.
  /** String is the identifier text. Never substituted. */
  STRING_KEY,
  /** [expr] */
  COMPUTED_PROP,
  /** String is the name without the leading {@code #}. */
  PRIVATE_NAME,

  // Expressions.
  /** String is the identifier. */
  NAME,
  /** Number payload. */
  NUMBER,
  /** String payload. */
  STRINGLIT,
  /** String payload holds the digits. */
  BIGINT,
  /** String payload holds the full literal. */
  REGEXP,
  TRUE,
  FALSE,
  NULL,
  THIS,
  SUPER,
  /** Alternating TEMPLATELIT_STRING and expressions, starting and ending with a string. */
  TEMPLATELIT,
  TEMPLATELIT_STRING,
  /** [tag, TEMPLATELIT] */
  TAGGED_TEMPLATE,
  /** Elements... OMITTED marks a hole. */
  ARRAYLIT,
  /** PROPERTY_ASSIGNMENT | SHORTHAND_PROPERTY | SPREAD | MEMBER_FUNCTION_DEF | accessors... */
  OBJECTLIT,
  /** [key, value] */
  PROPERTY_ASSIGNMENT,
  /** String is the name. */
  SHORTHAND_PROPERTY,
  /** [expr] */
  SPREAD,
  /** [FUNCTION] a function in expression position. */
  FUNCTION_EXPR,
  /** [PARAM_LIST, BLOCK | expr] */
  ARROW_FUNCTION,
  /** [NAME | EMPTY, superclass | EMPTY, CLASS_MEMBERS] */
  CLASS_EXPR,
  /** [object] String is the property name. */
  GETPROP,
  /** [object, index] */
  GETELEM,
  /** [callee, args...] */
  CALL,
  /** [callee, args...] */
  NEW,
  /** [cond, then, else] */
  HOOK,
  /** [expr] */
  PAREN,

  // Binary operators.
  COMMA(","),
  ASSIGN("="),
  ASSIGN_ADD("+="),
  ASSIGN_SUB("-="),
  OR("||"),
  AND("&&"),
  COALESCE("??"),
  EQ("=="),
  NE("!="),
  SHEQ("==="),
  SHNE("!=="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  BITOR("|"),
  BITAND("&"),
  INSTANCEOF("instanceof"),
  IN("in"),

  // Unary operators.
  NOT("!"),
  NEG("-"),
  POS("+"),
  BITNOT("~"),
  TYPEOF("typeof"),
  VOID("void"),
  DELPROP("delete"),
  AWAIT("await"),
  /** [target] Flag {@code POSTFIX} for {@code x++}. */
  INC("++"),
  DEC("--"),
  /** [expr | EMPTY] */
  YIELD,

  // TypeScript-only expressions.
  /**
   * [expr] A type assertion ({@code x as T}, {@code <T>x}) or {@code x satisfies T}; the declared
   * type is the asserted type.
   */
  CAST,
  /** [expr] {@code expr!} */
  NON_NULL,

  // Modules.
  /** [IMPORT_CLAUSE | EMPTY, STRINGLIT] */
  IMPORT,
  /** [NAME | EMPTY, NAMED_IMPORTS | NAMESPACE_IMPORT | EMPTY] Flag {@code TYPE_ONLY}. */
  IMPORT_CLAUSE,
  /** IMPORT_SPEC... */
  NAMED_IMPORTS,
  /** [NAME imported, NAME local] Flag {@code TYPE_ONLY}. */
  IMPORT_SPEC,
  /** [NAME] */
  NAMESPACE_IMPORT,
  /** [NAME, entity name | EXTERNAL_MODULE_REFERENCE] Flag {@code TYPE_ONLY}. */
  IMPORT_EQUALS,
  /** [STRINGLIT] */
  EXTERNAL_MODULE_REFERENCE,
  /** [NAMED_EXPORTS | NAMESPACE_EXPORT | EMPTY, STRINGLIT | EMPTY] Flag {@code TYPE_ONLY}. */
  EXPORT,
  /** EXPORT_SPEC... */
  NAMED_EXPORTS,
  /** [NAME local, NAME exported] Flag {@code TYPE_ONLY}. */
  EXPORT_SPEC,
  /** [NAME] */
  NAMESPACE_EXPORT,
  /** [expr] {@code export default expr}, or {@code export = expr} with flag EXPORT_EQUALS. */
  EXPORT_ASSIGNMENT,
  /** {@code export as namespace X;} String is the name. */
  NAMESPACE_EXPORT_DECLARATION,

  // TypeScript-only declarations.
  /** String is the name. */
  INTERFACE,
  /** String is the name. */
  TYPE_ALIAS,
  /** [NAME, ENUM_MEMBERS] */
  ENUM,
  /** ENUM_MEMBER... */
  ENUM_MEMBERS,
  /** [key, initializer?] */
  ENUM_MEMBER,
  /** [NAME | STRINGLIT, MODULE_BLOCK | NAMESPACE | EMPTY] */
  NAMESPACE,

  // Types. These only ever appear as type annotations, never as children of value code.
  /** [entity name, type arguments...] The entity name is a NAME or a GETPROP chain. */
  TYPE_REFERENCE,
  /** [element type] */
  ARRAY_TYPE,
  /** Element types... */
  TUPLE_TYPE,
  FUNCTION_TYPE,
  CONSTRUCTOR_TYPE,
  /** Member types... */
  UNION_TYPE,
  INTERSECTION_TYPE,
  /** [type] */
  PARENTHESIZED_TYPE,
  /** [STRINGLIT | NUMBER | NEG | BIGINT | TRUE | FALSE | NULL | TEMPLATELIT] */
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
  /** [check, extends, true branch, false branch] */
  CONDITIONAL_TYPE,
  /** [type] String is the operator: {@code keyof}, {@code unique} or {@code readonly}. */
  TYPE_OPERATOR,
  INDEXED_ACCESS_TYPE,
  MAPPED_TYPE,
  IMPORT_TYPE,
  /** String is the name. */
  TYPE_PARAMETER,

  // Synthesized by lowering.
  /** A removed statement. Keeps the original link and leading comments. */
  NOT_EMITTED,
  /** [expr] An expression whose enclosing syntax was removed. */
  PARTIALLY_EMITTED,
  /** An omitted expression. */
  OMITTED,
  /** Marks the end of a declaration that was expanded into several statements. */
  END_OF_DECLARATION_MARKER,
  /** [statement] Marks a declaration that merges into an earlier one of the same name. */
  MERGE_DECLARATION_MARKER;

  private final String operator;

  Token() {
    this.operator = null;
  }

  Token(String operator) {
    this.operator = operator;
  }

  /** Returns the source text of an operator token, or null for non-operators. */
  public String getOperator() {
    return operator;
  }

  public boolean isTypeNode() {
    return ordinal() >= TYPE_REFERENCE.ordinal() && ordinal() <= TYPE_PARAMETER.ordinal();
  }

  public boolean isBinaryOperator() {
    return ordinal() >= COMMA.ordinal() && ordinal() <= IN.ordinal();
  }

  public boolean isUnaryOperator() {
    return ordinal() >= NOT.ordinal() && ordinal() <= DEC.ordinal();
  }

  public boolean isAssignment() {
    return this == ASSIGN || this == ASSIGN_ADD || this == ASSIGN_SUB;
  }
}
