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
import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.CompilerOptions.LanguageMode;
import com.google.javascript.tslower.NodeUtil.AllAccessorDeclarations;
import com.google.javascript.tslower.ScopeTracker.SavedState;
import com.google.javascript.tslower.SubstitutionRegistry.SubstitutionKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lowers class declarations, class expressions and their members.
 *
 * <p>Type syntax is removed, constructor parameter properties become field declarations plus
 * assignments in the constructor, and decorators become calls to the {@code __decorate} helper
 * emitted after the class:
 *
 * <pre>
 * &#64;sealed class C { &#64;log m() {} }
 * </pre>
 *
 * becomes
 *
 * <pre>
 * let C = class C { m() {} };
 * __decorate([log], C.prototype, "m", null);
 * C = __decorate([sealed], C);
 * </pre>
 */
final class ClassLowering {
  private static final Logger logger = Logger.getLogger(ClassLowering.class.getName());

  private final LoweringContext context;
  private final TreeVisitor visitor;
  private final CompilerOptions options;
  private final ScopeTracker scopes;
  private final TypeMetadataSerializer metadataSerializer;

  ClassLowering(LoweringContext context, TreeVisitor visitor) {
    this.context = context;
    this.visitor = visitor;
    this.options = context.getOptions();
    this.scopes = context.getScopes();
    this.metadataSerializer = new TypeMetadataSerializer(context);
  }

  /** Lowers a CLASS statement to one or more statements. */
  ImmutableList<Node> visitClassDeclaration(Node node) {
    checkState(node.getToken() == Token.CLASS, node);
    if (!hasTypeScriptClassSyntax(node) && !visitor.isExportOfNamespace(node)) {
      return ImmutableList.of(visitor.visitEachChild(node));
    }

    EnumSet<ClassFacts> facts = getClassFacts(node);
    logger.fine("Lowering class " + NodeUtil.getClassName(node) + " " + facts);
    boolean useIife = facts.contains(ClassFacts.USE_IMMEDIATELY_INVOKED_FUNCTION_EXPRESSION);
    if (useIife) {
      context.startLexicalEnvironment();
    }

    Node name = NodeUtil.getClassName(node);
    if (name == null && ClassFacts.needsName(facts)) {
      checkState(NodeUtil.isDefaultExport(node), "Anonymous class declaration needs a name");
      name = context.getNameGenerator().getGeneratedNameForNode(node);
    }

    Node classStatement =
        facts.contains(ClassFacts.HAS_CONSTRUCTOR_DECORATORS)
            ? createClassDeclarationHeadWithDecorators(node, name)
            : createClassDeclarationHeadWithoutDecorators(node, name, facts);

    List<Node> statements = new ArrayList<>();
    statements.add(classStatement);
    // Instance members first, then static members, then the class itself.
    addClassElementDecorationStatements(statements, node, /* isStatic= */ false);
    addClassElementDecorationStatements(statements, node, /* isStatic= */ true);
    addConstructorDecorationStatement(statements, node);

    if (useIife) {
      Node returnValue =
          IR.partiallyEmitted(context.getInternalName(node), null)
              .withEmitFlag(EmitFlag.NO_COMMENTS);
      statements.add(IR.returnNode(returnValue).withEmitFlag(EmitFlag.NO_COMMENTS));
      ImmutableList<Node> body =
          LoweringContext.mergeLexicalEnvironment(statements, context.endLexicalEnvironment());
      Node iife =
          IR.call(IR.paren(IR.arrowFunction(IR.paramList(), IR.block(body))))
              .withEmitFlag(EmitFlag.TYPE_SCRIPT_CLASS_WRAPPER);
      Node varStatement =
          IR.let(context.getLocalName(node), iife)
              .toBuilder()
              .setOriginal(node)
              .setLeadingComment(node.getLeadingComment())
              .build();
      statements = new ArrayList<>();
      statements.add(varStatement);
    }

    if (facts.contains(ClassFacts.IS_EXPORT_OF_NAMESPACE)) {
      statements.add(visitor.createExportMemberAssignment(node));
    } else if (useIife || facts.contains(ClassFacts.HAS_CONSTRUCTOR_DECORATORS)) {
      if (facts.contains(ClassFacts.IS_DEFAULT_EXTERNAL_EXPORT)) {
        statements.add(IR.exportDefault(context.getLocalName(node)));
      } else if (facts.contains(ClassFacts.IS_NAMED_EXTERNAL_EXPORT)) {
        String localName = context.getLocalName(node).getString();
        statements.add(IR.export(IR.namedExports(IR.exportSpec(localName)), IR.empty()));
      }
    }

    if (statements.size() > 1) {
      statements.add(IR.endOfDeclarationMarker(node));
    }
    return ImmutableList.copyOf(statements);
  }

  /** Lowers a CLASS_EXPR. Decorators are not allowed on class expressions. */
  Node visitClassExpression(Node node) {
    checkState(node.getToken() == Token.CLASS_EXPR, node);
    if (!hasTypeScriptClassSyntax(node)) {
      return visitor.visitEachChild(node);
    }
    return node.toBuilder()
        .clearTypeScriptSyntax()
        .setModifiers(ImmutableSet.of())
        .setChild(1, visitHeritage(node))
        .setChild(2, transformClassMembers(node))
        .build();
  }

  EnumSet<ClassFacts> getClassFacts(Node node) {
    EnumSet<ClassFacts> facts = ClassFacts.none();
    if (!getStaticInitializedProperties(node).isEmpty()) {
      facts.add(ClassFacts.HAS_STATIC_INITIALIZED_PROPERTIES);
    }
    Node superClass = node.getOptionalChild(1);
    if (superClass != null
        && NodeUtil.skipOuterExpressions(superClass).getToken() != Token.NULL) {
      facts.add(ClassFacts.IS_DERIVED_CLASS);
    }
    if (classOrConstructorParameterIsDecorated(node)) {
      facts.add(ClassFacts.HAS_CONSTRUCTOR_DECORATORS);
    }
    if (childIsDecorated(node)) {
      facts.add(ClassFacts.HAS_MEMBER_DECORATORS);
    }
    if (visitor.isExportOfNamespace(node)) {
      facts.add(ClassFacts.IS_EXPORT_OF_NAMESPACE);
    } else if (visitor.isDefaultExternalModuleExport(node)) {
      facts.add(ClassFacts.IS_DEFAULT_EXTERNAL_EXPORT);
    } else if (visitor.isNamedExternalModuleExport(node)) {
      facts.add(ClassFacts.IS_NAMED_EXTERNAL_EXPORT);
    }
    if (options.getLanguageOut().isAtMost(LanguageMode.ECMASCRIPT5)
        && ClassFacts.mayNeedImmediatelyInvokedFunctionExpression(facts)) {
      facts.add(ClassFacts.USE_IMMEDIATELY_INVOKED_FUNCTION_EXPRESSION);
    }
    return facts;
  }

  /** {@code class C extends B { ... }}, keeping the modifiers unless the class is wrapped. */
  private Node createClassDeclarationHeadWithoutDecorators(
      Node node, @Nullable Node name, EnumSet<ClassFacts> facts) {
    boolean useIife = facts.contains(ClassFacts.USE_IMMEDIATELY_INVOKED_FUNCTION_EXPRESSION);
    return node.toBuilder()
        .clearTypeScriptSyntax()
        .setModifiers(useIife ? ImmutableSet.of() : visitor.visitModifiers(node))
        .setChild(0, name == null ? IR.empty() : name)
        .setChild(1, visitHeritage(node))
        .setChild(2, transformClassMembers(node))
        .build();
  }

  /**
   * {@code let C = [C_1 =] class C extends B { ... };}
   *
   * <p>The class becomes a class expression so that the constructor decorators can rebind the
   * name, and so that a self reference inside the body can be redirected to an alias.
   */
  private Node createClassDeclarationHeadWithDecorators(Node node, @Nullable Node name) {
    Node classAlias = getClassAliasIfNeeded(node);
    Node declName =
        options.getLanguageOut().isAtMost(LanguageMode.ECMASCRIPT_2015)
            ? context.getInternalName(node)
            : context.getLocalName(node);
    Node classExpression =
        Node.builder(Token.CLASS_EXPR)
            .addChild(name == null ? IR.empty() : name)
            .addChild(visitHeritage(node))
            .addChild(transformClassMembers(node))
            .setOriginal(node)
            .build();
    Node value = classAlias != null ? IR.assign(classAlias, classExpression) : classExpression;
    return IR.let(declName, value)
        .toBuilder()
        .setOriginal(node)
        .setLeadingComment(node.getLeadingComment())
        .build();
  }

  private @Nullable Node getClassAliasIfNeeded(Node node) {
    if (!context.getOracle().hasConstructorReferenceInClass(node.getOriginalNode())) {
      return null;
    }
    context.enableSubstitution(SubstitutionKind.CLASS_ALIASES);
    Node name = NodeUtil.getClassName(node);
    Node classAlias =
        context
            .getNameGenerator()
            .createUniqueName(
                name != null && !name.hasEmitFlag(EmitFlag.GENERATED_NAME)
                    ? name.getString()
                    : "default");
    context.getClassAliases().put(node, classAlias);
    context.hoistVariableDeclaration(classAlias);
    return classAlias;
  }

  private Node visitHeritage(Node node) {
    Node superClass = node.getSecondChild();
    return superClass.isEmpty() ? superClass : visitor.visitNode(superClass);
  }

  /**
   * Lowers the members of a class, preceded by a field declaration for each parameter property
   * of the constructor.
   */
  private Node transformClassMembers(Node node) {
    List<Node> members = new ArrayList<>();
    Node constructor = NodeUtil.getFirstConstructorWithBody(node);
    boolean hasParameterProperties = false;
    if (constructor != null) {
      for (Node parameter : NodeUtil.getParameters(NodeUtil.getMemberFunction(constructor))) {
        if (NodeUtil.isParameterPropertyDeclaration(parameter)) {
          hasParameterProperties = true;
          members.add(
              IR.memberFieldDef(parameter.getFirstChild().getString(), null)
                  .toBuilder()
                  .setOriginal(parameter)
                  .build());
        }
      }
    }
    scopes.setCurrentClassHasParameterProperties(hasParameterProperties);
    for (Node member : NodeUtil.getMembers(node)) {
      members.addAll(visitor.visitClassElement(member));
    }
    return node.getChildAtIndex(2).withChildren(members);
  }

  // Class members.

  /** Dispatches one class member; anything outside the closed set of member kinds is a bug. */
  ImmutableList<Node> visitClassElementWorker(Node member) {
    switch (member.getToken()) {
      case CONSTRUCTOR:
        return visitConstructor(member);
      case MEMBER_FIELD_DEF:
        return visitPropertyDeclaration(member);
      case INDEX_SIGNATURE:
      case GETTER_DEF:
      case SETTER_DEF:
      case MEMBER_FUNCTION_DEF:
      case STATIC_BLOCK:
        return visitor.visitorWorker(member);
      case SEMICOLON_CLASS_ELEMENT:
        return ImmutableList.of(member);
      default:
        throw new IllegalStateException("Unexpected class member: " + member);
    }
  }

  ImmutableList<Node> visitConstructor(Node member) {
    Node function = NodeUtil.getMemberFunction(member);
    Node body = NodeUtil.getFunctionBody(function);
    if (body == null) {
      return ImmutableList.of();
    }
    Node params = visitor.visitParameterList(function.getSecondChild());
    Node newBody = transformConstructorBody(body, function);
    Node newFunction =
        function
            .toBuilder()
            .clearTypeScriptSyntax()
            .setChild(1, params)
            .setChild(2, newBody)
            .build();
    return ImmutableList.of(
        member
            .toBuilder()
            .clearTypeScriptSyntax()
            .setModifiers(ImmutableSet.of())
            .setChild(0, newFunction)
            .build());
  }

  /**
   * Adds {@code this.x = x;} for every parameter property, after the directive prologue and the
   * initial {@code super(...)} call.
   */
  private Node transformConstructorBody(Node body, Node constructor) {
    List<Node> parametersWithPropertyAssignments = new ArrayList<>();
    for (Node parameter : NodeUtil.getParameters(constructor)) {
      if (NodeUtil.isParameterPropertyDeclaration(parameter)) {
        parametersWithPropertyAssignments.add(parameter);
      }
    }
    if (parametersWithPropertyAssignments.isEmpty()) {
      return visitor.visitFunctionBody(body);
    }

    SavedState saved = scopes.save();
    scopes.onBeforeVisitNode(body);
    try {
      List<Node> statements = new ArrayList<>();
      ImmutableList<Node> bodyStatements = body.getChildren();
      int indexOfFirstStatement =
          addPrologueDirectivesAndInitialSuperCall(bodyStatements, statements);
      for (Node parameter : parametersWithPropertyAssignments) {
        statements.add(transformParameterWithPropertyAssignment(parameter));
      }
      statements.addAll(
          visitor.visitStatements(
              bodyStatements.subList(indexOfFirstStatement, bodyStatements.size())));
      return visitor.endFunctionBody(body, statements);
    } finally {
      scopes.restore(saved);
    }
  }

  /**
   * Copies the prologue directives, then everything up to and including the first super call.
   * Returns the index of the first statement not copied.
   */
  private int addPrologueDirectivesAndInitialSuperCall(List<Node> statements, List<Node> result) {
    int index = 0;
    while (index < statements.size() && NodeUtil.isPrologueDirective(statements.get(index))) {
      result.add(statements.get(index));
      index++;
    }
    for (int i = index; i < statements.size(); i++) {
      if (NodeUtil.isSuperCallStatement(statements.get(i))) {
        result.addAll(visitor.visitStatements(statements.subList(index, i + 1)));
        return i + 1;
      }
    }
    return index;
  }

  /** {@code this.x = x;} */
  private static Node transformParameterWithPropertyAssignment(Node parameter) {
    String name = parameter.getFirstChild().getString();
    Node localName = IR.name(name).withEmitFlag(EmitFlag.NO_COMMENTS);
    return IR.exprResult(IR.assign(IR.getprop(IR.thisNode(), name), localName))
        .toBuilder()
        .setOriginal(parameter)
        .build();
  }

  ImmutableList<Node> visitPropertyDeclaration(Node member) {
    if (member.hasModifier(Modifier.DECLARE) || member.hasModifier(Modifier.ABSTRACT)) {
      return ImmutableList.of();
    }
    Node.Builder updated =
        member
            .toBuilder()
            .clearTypeScriptSyntax()
            .setModifiers(visitor.visitModifiers(member))
            .setChild(0, visitPropertyNameOfClassElement(member));
    Node initializer = member.getOptionalChild(1);
    if (initializer != null) {
      updated.setChild(1, visitor.visitNode(initializer));
    }
    return ImmutableList.of(updated.build());
  }

  ImmutableList<Node> visitMethodDeclaration(Node member) {
    Node function = NodeUtil.getMemberFunction(member);
    if (NodeUtil.getFunctionBody(function) == null) {
      return ImmutableList.of();
    }
    return ImmutableList.of(visitFunctionLikeMember(member));
  }

  ImmutableList<Node> visitAccessor(Node member) {
    Node function = NodeUtil.getMemberFunction(member);
    if (NodeUtil.getFunctionBody(function) == null && member.hasModifier(Modifier.ABSTRACT)) {
      return ImmutableList.of();
    }
    return ImmutableList.of(visitFunctionLikeMember(member));
  }

  private Node visitFunctionLikeMember(Node member) {
    return member
        .toBuilder()
        .clearTypeScriptSyntax()
        .setModifiers(visitor.visitModifiers(member))
        .setChild(0, visitPropertyNameOfClassElement(member))
        .setChild(1, visitor.visitFunction(NodeUtil.getMemberFunction(member)))
        .build();
  }

  /**
   * Visits the key of a class member. A computed key whose value is needed twice, by a decorator
   * call or by an initializer moved into the constructor, is stored in a temporary:
   * {@code [_a = expr]}.
   */
  private Node visitPropertyNameOfClassElement(Node member) {
    Node key = NodeUtil.getMemberKey(member);
    if (key.isComputedProp()
        && ((!NodeUtil.isStatic(member) && scopes.currentClassHasParameterProperties())
            || !member.getDecorators().isEmpty())) {
      Node expression = visitor.visitNode(key.getFirstChild());
      Node innerExpression = expression;
      while (innerExpression.getToken() == Token.PARTIALLY_EMITTED) {
        innerExpression = innerExpression.getFirstChild();
      }
      if (!NodeUtil.isSimpleInlineableExpression(innerExpression)) {
        Node generatedName = context.getNameGenerator().getGeneratedNameForNode(key);
        context.hoistVariableDeclaration(generatedName);
        return key.toBuilder().setChild(0, IR.assign(generatedName, expression)).build();
      }
    }
    return visitor.visitNode(key);
  }

  // Decorators.

  private boolean hasTypeScriptClassSyntax(Node node) {
    if (!node.getDecorators().isEmpty()
        || !node.getTypeParameters().isEmpty()
        || !node.getImplementedTypes().isEmpty()) {
      return true;
    }
    Node superClass = node.getSecondChild();
    if (!superClass.isEmpty() && !superClass.getTypeArguments().isEmpty()) {
      return true;
    }
    for (Node member : NodeUtil.getMembers(node)) {
      if (isTypeScriptClassElement(member)) {
        return true;
      }
    }
    return false;
  }

  /** Whether the member is written with syntax that only lowering can remove. */
  private static boolean isTypeScriptClassElement(Node member) {
    switch (member.getToken()) {
      case INDEX_SIGNATURE:
      case MEMBER_FIELD_DEF:
        return true;
      case CONSTRUCTOR:
        for (Node parameter : NodeUtil.getParameters(NodeUtil.getMemberFunction(member))) {
          if (NodeUtil.isParameterPropertyDeclaration(parameter)
              || !parameter.getDecorators().isEmpty()) {
            return true;
          }
        }
        return false;
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        if (!member.getDecorators().isEmpty()
            || NodeUtil.getFunctionBody(NodeUtil.getMemberFunction(member)) == null
            || nodeOrChildIsDecorated(member)) {
          return true;
        }
        break;
      default:
        break;
    }
    for (Modifier modifier : member.getModifiers()) {
      if (modifier.isTypeScriptOnly()) {
        return true;
      }
    }
    return false;
  }

  private static ImmutableList<Node> getStaticInitializedProperties(Node node) {
    ImmutableList.Builder<Node> properties = ImmutableList.builder();
    for (Node member : NodeUtil.getMembers(node)) {
      if (member.getToken() == Token.MEMBER_FIELD_DEF
          && NodeUtil.isStatic(member)
          && member.getChildCount() > 1) {
        properties.add(member);
      }
    }
    return properties.build();
  }

  private static boolean classOrConstructorParameterIsDecorated(Node node) {
    if (!node.getDecorators().isEmpty()) {
      return true;
    }
    Node constructor = NodeUtil.getFirstConstructorWithBody(node);
    return constructor != null && nodeOrChildIsDecorated(constructor);
  }

  private static boolean childIsDecorated(Node node) {
    for (Node member : NodeUtil.getMembers(node)) {
      if (nodeOrChildIsDecorated(member)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether a class member or one of its parameters carries a decorator that takes effect.
   * Decorators of members without a body are ignored.
   */
  private static boolean nodeOrChildIsDecorated(Node member) {
    switch (member.getToken()) {
      case MEMBER_FIELD_DEF:
        return !member.getDecorators().isEmpty();
      case CONSTRUCTOR:
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        {
          Node function = NodeUtil.getMemberFunction(member);
          if (NodeUtil.getFunctionBody(function) == null) {
            return false;
          }
          if (member.getToken() != Token.CONSTRUCTOR && !member.getDecorators().isEmpty()) {
            return true;
          }
          if (member.getToken() == Token.GETTER_DEF) {
            return false;
          }
          for (Node parameter : NodeUtil.getParameters(function)) {
            if (!parameter.getDecorators().isEmpty()) {
              return true;
            }
          }
          return false;
        }
      default:
        return false;
    }
  }

  private void addClassElementDecorationStatements(
      List<Node> statements, Node node, boolean isStatic) {
    for (Node member : NodeUtil.getMembers(node)) {
      if (!nodeOrChildIsDecorated(member) || NodeUtil.isStatic(member) != isStatic) {
        continue;
      }
      Node expression = generateClassElementDecorationExpression(node, member);
      if (expression != null) {
        statements.add(IR.exprResult(expression));
      }
    }
  }

  /** {@code __decorate([dec], C.prototype, "m", null)} */
  private @Nullable Node generateClassElementDecorationExpression(Node node, Node member) {
    AllDecorators allDecorators = getAllDecoratorsOfClassElement(node, member);
    if (allDecorators == null) {
      return null;
    }
    List<Node> decoratorExpressions =
        transformAllDecoratorsOfDeclaration(member, node, allDecorators);
    Node prefix = getClassMemberPrefix(node, member);
    Node memberName =
        visitor.getExpressionForPropertyName(
            member, /* generateNameForComputedPropertyName= */ !NodeUtil.isAmbient(member));
    Node descriptor = null;
    if (options.getLanguageOut() != LanguageMode.ECMASCRIPT3) {
      descriptor = member.getToken() == Token.MEMBER_FIELD_DEF ? IR.voidZero() : IR.nullNode();
    }
    return context
        .createDecorateHelper(decoratorExpressions, prefix, memberName, descriptor)
        .withEmitFlag(EmitFlag.NO_COMMENTS);
  }

  private void addConstructorDecorationStatement(List<Node> statements, Node node) {
    Node expression = generateConstructorDecorationExpression(node);
    if (expression != null) {
      statements.add(IR.exprResult(expression).toBuilder().setOriginal(node).build());
    }
  }

  /** {@code C = [C_1 =] __decorate([dec], C)} */
  private @Nullable Node generateConstructorDecorationExpression(Node node) {
    AllDecorators allDecorators = getAllDecoratorsOfConstructor(node);
    if (allDecorators == null) {
      return null;
    }
    List<Node> decoratorExpressions =
        transformAllDecoratorsOfDeclaration(node, node, allDecorators);
    Node classAlias = context.getClassAliases().get(node);
    boolean useInternalName = options.getLanguageOut().isAtMost(LanguageMode.ECMASCRIPT_2015);
    Node target = useInternalName ? context.getInternalName(node) : context.getLocalName(node);
    Node decorate = context.createDecorateHelper(decoratorExpressions, target, null, null);
    Node value = classAlias != null ? IR.assign(classAlias.cloneTree(), decorate) : decorate;
    Node localName = useInternalName ? context.getInternalName(node) : context.getLocalName(node);
    return IR.assign(localName, value).withEmitFlag(EmitFlag.NO_COMMENTS);
  }

  private @Nullable AllDecorators getAllDecoratorsOfConstructor(Node node) {
    ImmutableList<Node> decorators = node.getDecorators();
    Node constructor = NodeUtil.getFirstConstructorWithBody(node);
    List<@Nullable ImmutableList<Node>> parameters =
        getDecoratorsOfParameters(
            constructor == null ? null : NodeUtil.getMemberFunction(constructor));
    if (decorators.isEmpty() && parameters == null) {
      return null;
    }
    return AllDecorators.create(decorators, parameters);
  }

  private @Nullable AllDecorators getAllDecoratorsOfClassElement(Node node, Node member) {
    switch (member.getToken()) {
      case GETTER_DEF:
      case SETTER_DEF:
        return getAllDecoratorsOfAccessors(node, member);
      case MEMBER_FUNCTION_DEF:
        return getAllDecoratorsOfMethod(member);
      case MEMBER_FIELD_DEF:
        return member.getDecorators().isEmpty()
            ? null
            : AllDecorators.create(member.getDecorators(), null);
      default:
        return null;
    }
  }

  /**
   * The decorators of an accessor pair are written on whichever accessor comes first and has
   * any; they are emitted once, for that accessor. Parameter decorators come from the setter.
   */
  private @Nullable AllDecorators getAllDecoratorsOfAccessors(Node node, Node accessor) {
    if (NodeUtil.getFunctionBody(NodeUtil.getMemberFunction(accessor)) == null) {
      return null;
    }
    AllAccessorDeclarations accessors =
        NodeUtil.getAllAccessorDeclarations(NodeUtil.getMembers(node), accessor);
    Node firstAccessor = accessors.firstAccessor();
    Node secondAccessor =
        firstAccessor == accessors.getAccessor()
            ? accessors.setAccessor()
            : accessors.getAccessor();
    Node firstAccessorWithDecorators = null;
    if (!firstAccessor.getDecorators().isEmpty()) {
      firstAccessorWithDecorators = firstAccessor;
    } else if (secondAccessor != null && !secondAccessor.getDecorators().isEmpty()) {
      firstAccessorWithDecorators = secondAccessor;
    }
    if (firstAccessorWithDecorators == null || accessor != firstAccessorWithDecorators) {
      return null;
    }
    Node setAccessor = accessors.setAccessor();
    return AllDecorators.create(
        firstAccessorWithDecorators.getDecorators(),
        getDecoratorsOfParameters(
            setAccessor == null ? null : NodeUtil.getMemberFunction(setAccessor)));
  }

  private @Nullable AllDecorators getAllDecoratorsOfMethod(Node method) {
    Node function = NodeUtil.getMemberFunction(method);
    if (NodeUtil.getFunctionBody(function) == null) {
      return null;
    }
    List<@Nullable ImmutableList<Node>> parameters = getDecoratorsOfParameters(function);
    if (method.getDecorators().isEmpty() && parameters == null) {
      return null;
    }
    return AllDecorators.create(method.getDecorators(), parameters);
  }

  /**
   * Returns the decorators of each parameter after a leading {@code this}, or null if no
   * parameter is decorated. Entries before the first decorated parameter are null too.
   */
  private static @Nullable List<@Nullable ImmutableList<Node>> getDecoratorsOfParameters(
      @Nullable Node function) {
    if (function == null) {
      return null;
    }
    List<Node> parameters = NodeUtil.withoutThisParameter(NodeUtil.getParameters(function));
    List<@Nullable ImmutableList<Node>> decorators = null;
    for (int i = 0; i < parameters.size(); i++) {
      ImmutableList<Node> parameterDecorators = parameters.get(i).getDecorators();
      if (decorators == null && parameterDecorators.isEmpty()) {
        continue;
      }
      if (decorators == null) {
        decorators = new ArrayList<>();
        for (int j = 0; j < parameters.size(); j++) {
          decorators.add(null);
        }
      }
      decorators.set(i, parameterDecorators.isEmpty() ? null : parameterDecorators);
    }
    return decorators;
  }

  /**
   * The arguments of a decorate call: the decorators of the declaration, the parameter
   * decorators wrapped in {@code __param}, and the design-time metadata when enabled.
   */
  private List<Node> transformAllDecoratorsOfDeclaration(
      Node node, Node container, AllDecorators allDecorators) {
    List<Node> decoratorExpressions = new ArrayList<>();
    for (Node decorator : allDecorators.decorators()) {
      decoratorExpressions.add(transformDecorator(decorator));
    }
    List<@Nullable ImmutableList<Node>> parameters = allDecorators.parameters();
    for (int parameterOffset = 0; parameterOffset < parameters.size(); parameterOffset++) {
      ImmutableList<Node> decorators = parameters.get(parameterOffset);
      if (decorators == null) {
        continue;
      }
      for (Node decorator : decorators) {
        decoratorExpressions.add(
            context
                .createParamHelper(transformDecorator(decorator), parameterOffset)
                .withEmitFlag(EmitFlag.NO_COMMENTS));
      }
    }
    addTypeMetadata(node, container, decoratorExpressions);
    return decoratorExpressions;
  }

  private Node transformDecorator(Node decorator) {
    checkState(decorator.getToken() == Token.DECORATOR, decorator);
    return visitor.visitNode(decorator.getFirstChild());
  }

  private void addTypeMetadata(Node node, Node container, List<Node> decoratorExpressions) {
    if (!options.shouldEmitDecoratorMetadata()) {
      return;
    }
    if (shouldAddTypeMetadata(node)) {
      decoratorExpressions.add(
          context.createMetadataHelper(
              "design:type", metadataSerializer.serializeTypeOfNode(node, container)));
    }
    if (shouldAddParamTypesMetadata(node)) {
      decoratorExpressions.add(
          context.createMetadataHelper(
              "design:paramtypes",
              metadataSerializer.serializeParameterTypesOfNode(node, container)));
    }
    if (shouldAddReturnTypeMetadata(node)) {
      decoratorExpressions.add(
          context.createMetadataHelper(
              "design:returntype", metadataSerializer.serializeReturnTypeOfNode(node)));
    }
  }

  private static boolean shouldAddTypeMetadata(Node node) {
    switch (node.getToken()) {
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
      case MEMBER_FIELD_DEF:
        return true;
      default:
        return false;
    }
  }

  private static boolean shouldAddReturnTypeMetadata(Node node) {
    return node.getToken() == Token.MEMBER_FUNCTION_DEF;
  }

  private static boolean shouldAddParamTypesMetadata(Node node) {
    switch (node.getToken()) {
      case CLASS:
      case CLASS_EXPR:
        return NodeUtil.getFirstConstructorWithBody(node) != null;
      case MEMBER_FUNCTION_DEF:
      case GETTER_DEF:
      case SETTER_DEF:
        return true;
      default:
        return false;
    }
  }

  /** {@code C} for a static member, {@code C.prototype} otherwise. */
  private Node getClassMemberPrefix(Node node, Node member) {
    Node declarationName = context.getDeclarationName(node);
    return NodeUtil.isStatic(member)
        ? declarationName
        : IR.getprop(declarationName, "prototype");
  }
}
