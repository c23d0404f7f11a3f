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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.CompilerOptions.LanguageMode;
import java.util.EnumSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ClassLoweringTest extends LoweringTestCase {

  @Test
  public void testParameterProperties() {
    Node ctor =
        constructor(
            IR.paramList(withModifiers(IR.param("x"), Modifier.PUBLIC), IR.param("y")),
            exprResult(call("foo")));
    test(IR.script(classDecl("C", ctor)), "class C{x;constructor(x,y){this.x=x;foo();}}");
  }

  @Test
  public void testParameterPropertiesAfterPrologueAndSuperCall() {
    Node ctor =
        constructor(
            IR.paramList(withModifiers(IR.param("x"), Modifier.PRIVATE, Modifier.READONLY)),
            exprResult(IR.string("use strict")),
            exprResult(IR.call(IR.superNode())),
            exprResult(call("bar")));
    Node derived = IR.classNode(IR.name("D"), IR.name("B"), IR.classMembers(ctor));
    test(
        IR.script(derived),
        "class D extends B{x;constructor(x){\"use strict\";super();this.x=x;bar();}}");
  }

  @Test
  public void testFields() {
    Node typed = withType(IR.memberFieldDef("x", IR.number(1)), type(Token.NUMBER_TYPE));
    Node ambient = withModifiers(IR.memberFieldDef("y", null), Modifier.DECLARE);
    Node abstractField = withModifiers(IR.memberFieldDef("z", null), Modifier.ABSTRACT);
    Node staticField = withModifiers(IR.memberFieldDef("s", IR.number(2)), Modifier.STATIC);
    Node computed =
        withType(IR.memberFieldDef(IR.computedProp(call("k")), null), type(Token.NUMBER_TYPE));
    test(
        IR.script(classDecl("C", typed, ambient, abstractField, staticField, computed)),
        "class C{x=1;static s=2;[k()];}");
  }

  @Test
  public void testMembersWithoutBodiesAreRemoved() {
    Node overload =
        IR.memberFunctionDef(
            "m",
            IR.function(
                IR.name(""), IR.paramList(param("x", type(Token.NUMBER_TYPE))), IR.empty()));
    Node implementation = method("m", IR.paramList());
    Node abstractMethod =
        withModifiers(
            IR.memberFunctionDef("n", IR.function(IR.name(""), IR.paramList(), IR.empty())),
            Modifier.ABSTRACT);
    Node indexSignature = Node.builder(Token.INDEX_SIGNATURE).build();
    Node classNode =
        withModifiers(
            classDecl("C", overload, implementation, abstractMethod, indexSignature),
            Modifier.ABSTRACT);
    test(IR.script(classNode), "class C{m(){}}");
  }

  @Test
  public void testAccessibilityModifiersAreRemoved() {
    Node m = withModifiers(method("m", IR.paramList()), Modifier.PRIVATE, Modifier.STATIC);
    Node g =
        withModifiers(
            IR.getterDef("g", IR.function(IR.name(""), IR.paramList(), IR.block())),
            Modifier.PROTECTED);
    test(IR.script(classDecl("C", m, g)), "class C{static m(){}get g(){}}");
  }

  @Test
  public void testImplementsClauseIsRemoved() {
    Node classNode =
        parsed(
            classDecl("C", method("m", IR.paramList()))
                .toBuilder()
                .setImplementedTypes(ImmutableList.of(typeRef("I"))));
    test(IR.script(classNode), "class C{m(){}}");
  }

  @Test
  public void testMemberDecorators() {
    Node m = withDecorators(method("m", IR.paramList()), decorator("dec"));
    Node x = withDecorators(IR.memberFieldDef("x", null), decorator("dec2"));
    LoweringResult result = lower(IR.script(classDecl("C", m, x)));
    assertThat(CodePrinter.print(result.root()))
        .isEqualTo(
            "class C{m(){}x;}"
                + "__decorate([dec],C.prototype,\"m\",null);"
                + "__decorate([dec2],C.prototype,\"x\",void 0);");
    assertThat(result.emitHelpers()).containsExactly(EmitHelper.DECORATE);
  }

  @Test
  public void testInstanceMemberDecorationsComeBeforeStaticOnes() {
    Node s =
        withDecorators(
            withModifiers(method("s", IR.paramList()), Modifier.STATIC), decorator("a"));
    Node m = withDecorators(method("m", IR.paramList()), decorator("b"));
    test(
        IR.script(classDecl("C", s, m)),
        "class C{static s(){}m(){}}"
            + "__decorate([b],C.prototype,\"m\",null);"
            + "__decorate([a],C,\"s\",null);");
  }

  @Test
  public void testMemberDecorationsComeBeforeConstructorDecoration() {
    Node y =
        withDecorators(
            withModifiers(IR.memberFieldDef("y", null), Modifier.STATIC), decorator("s"));
    Node m = withDecorators(method("m", IR.paramList()), decorator("i"));
    Node classNode = withDecorators(classDecl("C", y, m), decorator("k"));
    test(
        IR.script(classNode),
        "let C=class C{static y;m(){}};"
            + "__decorate([i],C.prototype,\"m\",null);"
            + "__decorate([s],C,\"y\",void 0);"
            + "C=__decorate([k],C);");
  }

  @Test
  public void testDecoratedPrivateMethodHasEmptyName() {
    Node member =
        withDecorators(
            IR.classElement(
                Token.MEMBER_FUNCTION_DEF,
                IR.privateName("m"),
                IR.function(IR.name(""), IR.paramList(), IR.block())),
            decorator("dec"));
    test(
        IR.script(classDecl("C", member)),
        "class C{#m(){}}__decorate([dec],C.prototype,\"\",null);");
  }

  @Test
  public void testAccessorPairIsDecoratedOnce() {
    Node getter =
        withDecorators(
            IR.getterDef(
                "x",
                IR.function(IR.name(""), IR.paramList(), IR.block(IR.returnNode(IR.number(1))))),
            decorator("dec"));
    Node setter =
        IR.setterDef("x", IR.function(IR.name(""), IR.paramList(IR.param("v")), IR.block()));
    test(
        IR.script(classDecl("C", getter, setter)),
        "class C{get x(){return 1;}set x(v){}}__decorate([dec],C.prototype,\"x\",null);");
  }

  @Test
  public void testDecoratedComputedKeyIsStoredInTemporary() {
    Node member =
        withDecorators(
            IR.classElement(
                Token.MEMBER_FUNCTION_DEF,
                IR.computedProp(call("k")),
                IR.function(IR.name(""), IR.paramList(), IR.block())),
            decorator("dec"));
    test(
        IR.script(classDecl("C", member)),
        "var _a;class C{[_a=k()](){}}__decorate([dec],C.prototype,_a,null);");
  }

  @Test
  public void testClassDecorator() {
    test(
        IR.script(withDecorators(classDecl("C"), decorator("dec"))),
        "let C=class C{};C=__decorate([dec],C);");
  }

  @Test
  public void testDecoratedDefaultExport() {
    Node classNode =
        withModifiers(
            withDecorators(classDecl("C"), decorator("dec")), Modifier.EXPORT, Modifier.DEFAULT);
    test(IR.module(classNode), "let C=class C{};C=__decorate([dec],C);export default C;");
  }

  @Test
  public void testDecoratedNamedExport() {
    Node classNode =
        withModifiers(withDecorators(classDecl("C"), decorator("dec")), Modifier.EXPORT);
    test(IR.module(classNode), "let C=class C{};C=__decorate([dec],C);export {C};");
  }

  @Test
  public void testDecoratedClassReferringToItself() {
    Node reference = IR.name("C");
    Node make =
        withModifiers(
            method("make", IR.paramList(), IR.returnNode(IR.newNode(reference))),
            Modifier.STATIC);
    Node classNode = withDecorators(classDecl("C", make), decorator("dec"));
    oracle.addConstructorReference(classNode, reference);
    test(
        IR.script(classNode),
        "var C_1;let C=C_1=class C{static make(){return new C_1();}};"
            + "C=C_1=__decorate([dec],C);");
  }

  @Test
  public void testConstructorParameterDecorator() {
    Node ctor = constructor(IR.paramList(withDecorators(IR.param("x"), decorator("inject"))));
    test(
        IR.script(withDecorators(classDecl("C", ctor), decorator("dec"))),
        "let C=class C{constructor(x){}};C=__decorate([dec,__param(0,inject)],C);");
  }

  @Test
  public void testMethodParameterDecorator() {
    Node m = method("m", IR.paramList(withDecorators(IR.param("x"), decorator("d"))));
    LoweringResult result = lower(IR.script(classDecl("C", m)));
    assertThat(CodePrinter.print(result.root()))
        .isEqualTo("class C{m(x){}}__decorate([__param(0,d)],C.prototype,\"m\",null);");
    assertThat(result.emitHelpers()).containsExactly(EmitHelper.DECORATE, EmitHelper.PARAM);
  }

  @Test
  public void testFieldTypeMetadata() {
    options.setEmitDecoratorMetadata(true);
    Node x =
        withDecorators(
            withType(IR.memberFieldDef("x", null), type(Token.STRING_TYPE)), decorator("dec"));
    LoweringResult result = lower(IR.script(classDecl("C", x)));
    assertThat(CodePrinter.print(result.root()))
        .isEqualTo(
            "class C{x;}"
                + "__decorate([dec,__metadata(\"design:type\",String)],C.prototype,\"x\",void 0);");
    assertThat(result.emitHelpers()).containsExactly(EmitHelper.DECORATE, EmitHelper.METADATA);
  }

  @Test
  public void testMethodMetadata() {
    options.setEmitDecoratorMetadata(true);
    oracle.setTypeKind(
        "Foo", TypeReferenceSerializationKind.TYPE_WITH_CONSTRUCT_SIGNATURE_AND_VALUE);
    Node function =
        withType(
            IR.function(
                IR.name(""),
                IR.paramList(param("a", type(Token.NUMBER_TYPE)), param("b", typeRef("Foo"))),
                IR.block()),
            type(Token.BOOLEAN_TYPE));
    Node m = withDecorators(IR.memberFunctionDef("m", function), decorator("dec"));
    test(
        IR.script(classDecl("C", m)),
        "class C{m(a,b){}}"
            + "__decorate([dec,__metadata(\"design:type\",Function),"
            + "__metadata(\"design:paramtypes\",[Number,Foo]),"
            + "__metadata(\"design:returntype\",Boolean)],C.prototype,\"m\",null);");
  }

  @Test
  public void testClassWrappedForOldLanguageOut() {
    options.setLanguageOut(LanguageMode.ECMASCRIPT5);
    Node field = withModifiers(IR.memberFieldDef("x", IR.number(1)), Modifier.STATIC);
    test(
        IR.script(withDecorators(classDecl("C", field), decorator("dec"))),
        "let C=(()=>{let C=class C{static x=1;};C=__decorate([dec],C);return C;})();");
  }

  @Test
  public void testClassExpression() {
    Node expression =
        IR.classExpr(
            IR.empty(),
            IR.empty(),
            IR.classMembers(withType(IR.memberFieldDef("x", null), type(Token.ANY_TYPE))));
    test(IR.script(IR.let(IR.name("K"), expression)), "let K=class{x;};");
  }

  private EnumSet<ClassFacts> getClassFacts(Node classNode) {
    LoweringContext context = new LoweringContext(options, oracle, registry, IR.script());
    return new ClassLowering(context, new TreeVisitor(context)).getClassFacts(classNode);
  }

  @Test
  public void testDerivedClassFact() {
    Node derived = IR.classNode(IR.name("C"), IR.name("B"), IR.classMembers());
    Node extendsNull = IR.classNode(IR.name("C"), IR.nullNode(), IR.classMembers());
    Node extendsParenthesizedNull =
        IR.classNode(IR.name("C"), IR.paren(IR.nullNode()), IR.classMembers());

    assertThat(getClassFacts(derived)).contains(ClassFacts.IS_DERIVED_CLASS);
    assertThat(getClassFacts(classDecl("C"))).doesNotContain(ClassFacts.IS_DERIVED_CLASS);
    assertThat(getClassFacts(extendsNull)).doesNotContain(ClassFacts.IS_DERIVED_CLASS);
    assertThat(getClassFacts(extendsParenthesizedNull))
        .doesNotContain(ClassFacts.IS_DERIVED_CLASS);
  }

  @Test
  public void testDecoratorFacts() {
    Node m = withDecorators(method("m", IR.paramList()), decorator("i"));
    Node classNode = withDecorators(classDecl("C", m), decorator("k"));

    assertThat(getClassFacts(classNode))
        .containsExactly(ClassFacts.HAS_CONSTRUCTOR_DECORATORS, ClassFacts.HAS_MEMBER_DECORATORS);

    options.setLanguageOut(LanguageMode.ECMASCRIPT5);
    assertThat(getClassFacts(classNode))
        .contains(ClassFacts.USE_IMMEDIATELY_INVOKED_FUNCTION_EXPRESSION);
  }
}
