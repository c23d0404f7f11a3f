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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;

/**
 * An immutable syntax tree node.
 *
 * <p>Rewrites never mutate a node; they build a replacement with {@link #toBuilder()}, which
 * records the rewritten node as the {@linkplain #getOriginal() original} of the new one. Every
 * node gets a process-unique id that side tables use as a key.
 */
public final class Node {

  /** Boolean syntax properties. */
  public enum Flag {
    /** SCRIPT: the file is an ES module. */
    EXTERNAL_MODULE,
    /** SCRIPT: a declaration file; nothing in it is emitted. */
    DECLARATION_FILE,
    /** PARAM: {@code ...x}. */
    REST,
    /** PARAM, MEMBER_FIELD_DEF: {@code x?}. */
    OPTIONAL,
    /** MEMBER_FIELD_DEF, NAME in a declaration: {@code x!}. */
    DEFINITE,
    /** Imports, exports and their specifiers: {@code import type}. */
    TYPE_ONLY,
    /** EXPORT_ASSIGNMENT: {@code export = x}. */
    EXPORT_EQUALS,
    /** INC, DEC: {@code x++}. */
    POSTFIX,
    /** FUNCTION: {@code function*}. */
    GENERATOR,
    /** NAMESPACE: the inner part of a dotted name such as {@code B} in {@code A.B}. */
    NESTED_NAMESPACE
  }

  private static final AtomicInteger nextId = new AtomicInteger();

  private final int id;
  private final Token token;
  private final ImmutableList<Node> children;
  private final @Nullable String string;
  private final double number;
  private final ImmutableSet<Modifier> modifiers;
  private final ImmutableList<Node> decorators;
  private final @Nullable Node declaredType;
  private final ImmutableList<Node> typeParameters;
  private final ImmutableList<Node> typeArguments;
  private final ImmutableList<Node> implementedTypes;
  private final ImmutableSet<Flag> flags;
  private final ImmutableSet<EmitFlag> emitFlags;
  private final @Nullable Node original;
  private final @Nullable String leadingComment;
  private final @Nullable String trailingComment;
  private final boolean containsTypeScript;

  private Node(Builder b) {
    this.id = nextId.incrementAndGet();
    this.token = b.token;
    this.children = ImmutableList.copyOf(b.children);
    this.string = b.string;
    this.number = b.number;
    this.modifiers = Sets.immutableEnumSet(b.modifiers);
    this.decorators = ImmutableList.copyOf(b.decorators);
    this.declaredType = b.declaredType;
    this.typeParameters = ImmutableList.copyOf(b.typeParameters);
    this.typeArguments = ImmutableList.copyOf(b.typeArguments);
    this.implementedTypes = ImmutableList.copyOf(b.implementedTypes);
    this.flags = Sets.immutableEnumSet(b.flags);
    this.emitFlags = Sets.immutableEnumSet(b.emitFlags);
    this.original = b.original;
    this.leadingComment = b.leadingComment;
    this.trailingComment = b.trailingComment;
    this.containsTypeScript = computeContainsTypeScript();
  }

  public static Builder builder(Token token) {
    return new Builder(checkNotNull(token));
  }

  /** Returns a builder initialized from this node whose result records this node as original. */
  public Builder toBuilder() {
    Builder b = new Builder(token);
    b.children.addAll(children);
    b.string = string;
    b.number = number;
    b.modifiers.addAll(modifiers);
    b.decorators.addAll(decorators);
    b.declaredType = declaredType;
    b.typeParameters.addAll(typeParameters);
    b.typeArguments.addAll(typeArguments);
    b.implementedTypes.addAll(implementedTypes);
    b.flags.addAll(flags);
    b.emitFlags.addAll(emitFlags);
    b.original = this;
    b.leadingComment = leadingComment;
    b.trailingComment = trailingComment;
    return b;
  }

  /** Returns a copy of this node with the given children. */
  public Node withChildren(List<Node> newChildren) {
    return toBuilder().setChildren(newChildren).build();
  }

  /** Returns a copy of this node with the given emit flag added. */
  public Node withEmitFlag(EmitFlag flag) {
    return toBuilder().addEmitFlag(flag).build();
  }

  /**
   * Returns a deep copy of this subtree. Every copied node gets a fresh id and points at the node
   * it was copied from.
   */
  public Node cloneTree() {
    Builder b = toBuilder();
    b.children.clear();
    for (Node child : children) {
      b.children.add(child.cloneTree());
    }
    return b.build();
  }

  public int getId() {
    return id;
  }

  public Token getToken() {
    return token;
  }

  public ImmutableList<Node> getChildren() {
    return children;
  }

  public int getChildCount() {
    return children.size();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public Node getFirstChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(0);
  }

  public Node getSecondChild() {
    checkState(children.size() > 1, "%s has fewer than two children", token);
    return children.get(1);
  }

  public Node getLastChild() {
    checkState(!children.isEmpty(), "%s has no children", token);
    return children.get(children.size() - 1);
  }

  /** Returns the child at {@code i}, or null when it is absent or an EMPTY placeholder. */
  public @Nullable Node getOptionalChild(int i) {
    if (i >= children.size()) {
      return null;
    }
    Node child = children.get(i);
    return child.isEmpty() ? null : child;
  }

  public String getString() {
    checkState(string != null, "%s has no string payload", token);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number", token);
    return number;
  }

  public ImmutableSet<Modifier> getModifiers() {
    return modifiers;
  }

  public boolean hasModifier(Modifier modifier) {
    return modifiers.contains(modifier);
  }

  public ImmutableList<Node> getDecorators() {
    return decorators;
  }

  /** The type annotation, or for functions the return type annotation. */
  public @Nullable Node getDeclaredType() {
    return declaredType;
  }

  public ImmutableList<Node> getTypeParameters() {
    return typeParameters;
  }

  public ImmutableList<Node> getTypeArguments() {
    return typeArguments;
  }

  /** The types of a class {@code implements} clause. */
  public ImmutableList<Node> getImplementedTypes() {
    return implementedTypes;
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  public ImmutableSet<EmitFlag> getEmitFlags() {
    return emitFlags;
  }

  public boolean hasEmitFlag(EmitFlag flag) {
    return emitFlags.contains(flag);
  }

  /** The node this one was rewritten or copied from, if any. */
  public @Nullable Node getOriginal() {
    return original;
  }

  /** Follows the original links back to the node that came from the parser. */
  public Node getOriginalNode() {
    Node n = this;
    while (n.original != null) {
      n = n.original;
    }
    return n;
  }

  public @Nullable String getLeadingComment() {
    return leadingComment;
  }

  public @Nullable String getTrailingComment() {
    return trailingComment;
  }

  /** Whether this subtree contains any syntax that lowering has to rewrite. */
  public boolean containsTypeScript() {
    return containsTypeScript;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public boolean isString() {
    return token == Token.STRINGLIT;
  }

  public boolean isNumber() {
    return token == Token.NUMBER;
  }

  public boolean isScript() {
    return token == Token.SCRIPT;
  }

  public boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public boolean isClass() {
    return token == Token.CLASS || token == Token.CLASS_EXPR;
  }

  public boolean isNamespace() {
    return token == Token.NAMESPACE;
  }

  public boolean isEnum() {
    return token == Token.ENUM;
  }

  public boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public boolean isCall() {
    return token == Token.CALL;
  }

  public boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public boolean isComputedProp() {
    return token == Token.COMPUTED_PROP;
  }

  public boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public boolean isVariableStatement() {
    return token == Token.VAR || token == Token.LET || token == Token.CONST;
  }

  /** Whether this is a NAME with the given text. */
  public boolean matchesName(String name) {
    return token == Token.NAME && name.equals(string);
  }

  private boolean computeContainsTypeScript() {
    if (isTypeScriptSyntax()) {
      return true;
    }
    for (Node child : children) {
      if (child.containsTypeScript) {
        return true;
      }
    }
    return false;
  }

  private boolean isTypeScriptSyntax() {
    if (token.isTypeNode()) {
      return true;
    }
    switch (token) {
      case CAST:
      case NON_NULL:
      case INTERFACE:
      case TYPE_ALIAS:
      case ENUM:
      case NAMESPACE:
      case IMPORT_EQUALS:
      case INDEX_SIGNATURE:
      case NAMESPACE_EXPORT_DECLARATION:
      case DECORATOR:
        return true;
      case EXPORT_ASSIGNMENT:
        if (hasFlag(Flag.EXPORT_EQUALS)) {
          return true;
        }
        break;
      case FUNCTION:
        if (children.size() == 3 && children.get(2).isEmpty()) {
          return true;
        }
        break;
      case PARAM:
        if (!children.isEmpty() && children.get(0).matchesName("this")) {
          return true;
        }
        break;
      default:
        break;
    }
    if (declaredType != null
        || !decorators.isEmpty()
        || !typeParameters.isEmpty()
        || !typeArguments.isEmpty()
        || !implementedTypes.isEmpty()
        || flags.contains(Flag.OPTIONAL)
        || flags.contains(Flag.DEFINITE)
        || flags.contains(Flag.TYPE_ONLY)) {
      return true;
    }
    for (Modifier modifier : modifiers) {
      if (modifier.isTypeScriptOnly()) {
        return true;
      }
    }
    return false;
  }

  /** Returns a parenthesized dump of this subtree, for debugging and test failure messages. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int indent) {
    for (int i = 0; i < indent; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child : children) {
      child.appendStringTree(sb, indent + 1);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.toString());
    if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    } else if (string != null) {
      sb.append(' ').append(string);
    }
    if (!modifiers.isEmpty()) {
      sb.append(' ').append(modifiers);
    }
    if (!flags.isEmpty()) {
      sb.append(' ').append(flags);
    }
    return sb.toString();
  }

  /** Builder for {@link Node}. */
  public static final class Builder {
    private final Token token;
    private final List<Node> children = new ArrayList<>();
    private @Nullable String string;
    private double number;
    private final EnumSet<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
    private final List<Node> decorators = new ArrayList<>();
    private @Nullable Node declaredType;
    private final List<Node> typeParameters = new ArrayList<>();
    private final List<Node> typeArguments = new ArrayList<>();
    private final List<Node> implementedTypes = new ArrayList<>();
    private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);
    private final EnumSet<EmitFlag> emitFlags = EnumSet.noneOf(EmitFlag.class);
    private @Nullable Node original;
    private @Nullable String leadingComment;
    private @Nullable String trailingComment;

    private Builder(Token token) {
      this.token = token;
    }

    @CanIgnoreReturnValue
    public Builder addChild(Node child) {
      children.add(checkNotNull(child));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addChildren(Collection<Node> newChildren) {
      for (Node child : newChildren) {
        addChild(child);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setChildren(Collection<Node> newChildren) {
      children.clear();
      return addChildren(newChildren);
    }

    @CanIgnoreReturnValue
    public Builder setChild(int index, Node child) {
      children.set(index, checkNotNull(child));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setString(@Nullable String string) {
      this.string = string;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDouble(double number) {
      checkArgument(token == Token.NUMBER, token);
      this.number = number;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addModifier(Modifier modifier) {
      modifiers.add(modifier);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setModifiers(Collection<Modifier> newModifiers) {
      modifiers.clear();
      modifiers.addAll(newModifiers);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addDecorator(Node decorator) {
      checkArgument(decorator.getToken() == Token.DECORATOR, decorator);
      decorators.add(decorator);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDecorators(Collection<Node> newDecorators) {
      decorators.clear();
      for (Node decorator : newDecorators) {
        addDecorator(decorator);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDeclaredType(@Nullable Node type) {
      checkArgument(type == null || type.getToken().isTypeNode(), type);
      this.declaredType = type;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTypeParameters(Collection<Node> params) {
      typeParameters.clear();
      typeParameters.addAll(params);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTypeArguments(Collection<Node> args) {
      typeArguments.clear();
      typeArguments.addAll(args);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setImplementedTypes(Collection<Node> types) {
      implementedTypes.clear();
      implementedTypes.addAll(types);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addFlag(Flag flag) {
      flags.add(flag);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder removeFlag(Flag flag) {
      flags.remove(flag);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addEmitFlag(EmitFlag flag) {
      emitFlags.add(flag);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOriginal(@Nullable Node original) {
      this.original = original;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLeadingComment(@Nullable String comment) {
      this.leadingComment = comment;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTrailingComment(@Nullable String comment) {
      this.trailingComment = comment;
      return this;
    }

    /** Removes every annotation that only exists in the source dialect. */
    @CanIgnoreReturnValue
    public Builder clearTypeScriptSyntax() {
      declaredType = null;
      typeParameters.clear();
      typeArguments.clear();
      implementedTypes.clear();
      decorators.clear();
      flags.remove(Flag.OPTIONAL);
      flags.remove(Flag.DEFINITE);
      modifiers.removeIf(Modifier::isTypeScriptOnly);
      return this;
    }

    public Node build() {
      return new Node(this);
    }
  }
}
