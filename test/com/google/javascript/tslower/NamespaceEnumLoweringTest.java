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

import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.CompilerOptions.ModuleKind;
import com.google.javascript.tslower.SubstitutionRegistry.SubstitutionKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NamespaceEnumLoweringTest extends LoweringTestCase {

  /** {@code enum E { A = 0, B = "b", C = 5 }} with the values the checker computed. */
  private Node createEnum() {
    Node a = IR.enumMember("A", null);
    Node b = IR.enumMember("B", IR.string("b"));
    Node c = IR.enumMember("C", IR.number(5));
    oracle.setConstantValue(a, ConstantValue.ofNumber(0));
    oracle.setConstantValue(b, ConstantValue.ofString("b"));
    oracle.setConstantValue(c, ConstantValue.ofNumber(5));
    return IR.enumNode(IR.name("E"), a, b, c);
  }

  @Test
  public void testEnum() {
    test(
        IR.script(createEnum()),
        "var E;(function(E){E[E[\"A\"]=0]=\"A\";E[\"B\"]=\"b\";E[E[\"C\"]=5]=\"C\";})"
            + "(E||(E={}));");
  }

  @Test
  public void testNegativeEnumValue() {
    Node a = IR.enumMember("A", IR.neg(IR.number(1)));
    oracle.setConstantValue(a, ConstantValue.ofNumber(-1));
    test(
        IR.script(IR.enumNode(IR.name("E"), a)),
        "var E;(function(E){E[E[\"A\"]=-1]=\"A\";})(E||(E={}));");
  }

  @Test
  public void testComputedEnumMemberRefersToSibling() {
    Node a = IR.enumMember("A", IR.number(1));
    Node reference = IR.name("A");
    Node b = IR.enumMember("B", call("f", reference));
    oracle.setConstantValue(a, ConstantValue.ofNumber(1));
    Node enumNode = IR.enumNode(IR.name("E"), a, b);
    oracle.setExportContainer(reference, enumNode);
    test(
        IR.script(enumNode),
        "var E;(function(E){E[E[\"A\"]=1]=\"A\";E[E[\"B\"]=f(E.A)]=\"B\";})(E||(E={}));");
    assertThat(registry.isEnabled(SubstitutionKind.NON_QUALIFIED_ENUM_MEMBERS)).isTrue();
  }

  @Test
  public void testConstEnumIsRemoved() {
    Node enumNode = withModifiers(createEnum(), Modifier.CONST);
    LoweringResult result = lower(IR.script(enumNode, exprResult(call("f"))));
    assertThat(result.root().getFirstChild().getToken()).isEqualTo(Token.NOT_EMITTED);
    assertThat(CodePrinter.print(result.root())).isEqualTo("f();");
  }

  @Test
  public void testConstEnumIsPreserved() {
    options.setPreserveConstEnums(true);
    test(
        IR.script(withModifiers(createEnum(), Modifier.CONST)),
        "var E;(function(E){E[E[\"A\"]=0]=\"A\";E[\"B\"]=\"b\";E[E[\"C\"]=5]=\"C\";})"
            + "(E||(E={}));");
  }

  @Test
  public void testNamespace() {
    Node namespace =
        IR.namespace(
            "N",
            IR.moduleBlock(
                withModifiers(function("f", IR.paramList()), Modifier.EXPORT),
                withModifiers(IR.var(IR.name("a"), IR.number(1)), Modifier.EXPORT),
                exprResult(call("g"))));
    test(IR.script(namespace), "var N;(function(N){function f(){}N.f=f;N.a=1;g();})(N||(N={}));");
    assertThat(registry.isEnabled(SubstitutionKind.NAMESPACE_EXPORTS)).isTrue();
  }

  @Test
  public void testReferenceToNamespaceExportIsQualified() {
    Node reference = IR.name("a");
    Node namespace =
        IR.namespace(
            "N",
            IR.moduleBlock(
                withModifiers(IR.var(IR.name("a"), IR.number(1)), Modifier.EXPORT),
                exprResult(call("f", reference))));
    oracle.setExportContainer(reference, namespace);
    test(IR.script(namespace), "var N;(function(N){N.a=1;f(N.a);})(N||(N={}));");
  }

  @Test
  public void testUninitializedNamespaceExportIsDropped() {
    Node namespace =
        IR.namespace(
            "N",
            IR.moduleBlock(
                withModifiers(IR.var(IR.name("a")), Modifier.EXPORT), exprResult(call("g"))));
    test(IR.script(namespace), "var N;(function(N){g();})(N||(N={}));");
  }

  @Test
  public void testExportedClassInNamespace() {
    Node namespace =
        IR.namespace("N", IR.moduleBlock(withModifiers(classDecl("C"), Modifier.EXPORT)));
    test(IR.script(namespace), "var N;(function(N){class C{}N.C=C;})(N||(N={}));");
  }

  @Test
  public void testNestedEnumUsesLet() {
    Node a = IR.enumMember("A", null);
    oracle.setConstantValue(a, ConstantValue.ofNumber(0));
    Node enumNode = withModifiers(IR.enumNode(IR.name("E"), a), Modifier.EXPORT);
    test(
        IR.script(IR.namespace("N", IR.moduleBlock(enumNode))),
        "var N;(function(N){let E;(function(E){E[E[\"A\"]=0]=\"A\";})(E=N.E||(N.E={}));})"
            + "(N||(N={}));");
  }

  @Test
  public void testDottedNamespace() {
    test(
        IR.script(IR.namespace("A.B", IR.moduleBlock(exprResult(call("g"))))),
        "var A;(function(A){var B;(function(B){g();})(B=A.B||(A.B={}));})(A||(A={}));");
  }

  @Test
  public void testNamespaceWithOnlyTypesIsRemoved() {
    Node namespace = IR.namespace("N", IR.moduleBlock(IR.interfaceNode("I")));
    LoweringResult result = lower(IR.script(namespace, exprResult(call("f"))));
    assertThat(result.root().getFirstChild().getToken()).isEqualTo(Token.NOT_EMITTED);
    assertThat(CodePrinter.print(result.root())).isEqualTo("f();");
  }

  @Test
  public void testAmbientNamespaceIsRemoved() {
    Node namespace =
        withModifiers(
            IR.namespace("N", IR.moduleBlock(exprResult(call("g")))), Modifier.DECLARE);
    test(IR.script(namespace, exprResult(call("f"))), "f();");
  }

  @Test
  public void testSecondDeclarationMerges() {
    Node first = IR.namespace("N", IR.moduleBlock(exprResult(call("a"))));
    Node second = IR.namespace("N", IR.moduleBlock(exprResult(call("b"))));
    LoweringResult result = lower(IR.script(first, second));
    assertThat(CodePrinter.print(result.root()))
        .isEqualTo("var N;(function(N){a();})(N||(N={}));(function(N){b();})(N||(N={}));");

    Node marker = result.root().getChildAtIndex(3);
    assertThat(marker.getToken()).isEqualTo(Token.MERGE_DECLARATION_MARKER);
    assertThat(marker.getOriginal()).isSameInstanceAs(second);
    assertThat(marker.hasEmitFlag(EmitFlag.NO_COMMENTS)).isTrue();
  }

  /** {@code enum E { name = value }} */
  private Node createSingleMemberEnum(String name, double value) {
    Node member = IR.enumMember(name, IR.number(value));
    oracle.setConstantValue(member, ConstantValue.ofNumber(value));
    return IR.enumNode(IR.name("E"), member);
  }

  @Test
  public void testEnumInFunctionDoesNotMergeWithOuterEnum() {
    Node outer = createSingleMemberEnum("A", 0);
    Node f = function("f", IR.paramList(), createSingleMemberEnum("B", 1));
    test(
        IR.script(outer, f),
        "var E;(function(E){E[E[\"A\"]=0]=\"A\";})(E||(E={}));"
            + "function f(){let E;(function(E){E[E[\"B\"]=1]=\"B\";})(E||(E={}));}");
  }

  @Test
  public void testOuterEnumAfterFunctionIsStillDeclared() {
    Node f = function("f", IR.paramList(), createSingleMemberEnum("B", 1));
    Node outer = createSingleMemberEnum("A", 0);
    test(
        IR.script(f, outer),
        "function f(){let E;(function(E){E[E[\"B\"]=1]=\"B\";})(E||(E={}));}"
            + "var E;(function(E){E[E[\"A\"]=0]=\"A\";})(E||(E={}));");
  }

  @Test
  public void testEnumInConstructorWithParameterProperties() {
    Node outer = createSingleMemberEnum("A", 0);
    Node constructor =
        constructor(
            IR.paramList(withModifiers(IR.param("x"), Modifier.PUBLIC)),
            createSingleMemberEnum("B", 1));
    test(
        IR.script(outer, classDecl("C", constructor)),
        "var E;(function(E){E[E[\"A\"]=0]=\"A\";})(E||(E={}));"
            + "class C{x;constructor(x){this.x=x;"
            + "let E;(function(E){E[E[\"B\"]=1]=\"B\";})(E||(E={}));}}");
  }

  @Test
  public void testEnumInStaticBlock() {
    Node outer = createSingleMemberEnum("A", 0);
    Node block = IR.staticBlock(IR.block(createSingleMemberEnum("B", 1)));
    test(
        IR.script(outer, classDecl("C", block)),
        "var E;(function(E){E[E[\"A\"]=0]=\"A\";})(E||(E={}));"
            + "class C{static{let E;(function(E){E[E[\"B\"]=1]=\"B\";})(E||(E={}));}}");
  }

  @Test
  public void testBodyDeclaringTheNamespaceNameGetsUniqueParameter() {
    Node namespace =
        IR.namespace(
            "N",
            IR.moduleBlock(
                IR.var(IR.name("N"), IR.number(1)),
                withModifiers(IR.var(IR.name("x"), IR.number(2)), Modifier.EXPORT)));
    test(IR.script(namespace), "var N;(function(N_1){var N=1;N_1.x=2;})(N||(N={}));");
  }

  @Test
  public void testExportedNamespaceInEsModule() {
    Node namespace =
        withModifiers(IR.namespace("N", IR.moduleBlock(exprResult(call("g")))), Modifier.EXPORT);
    test(IR.module(namespace), "export var N;(function(N){g();})(N||(N={}));");
  }

  @Test
  public void testExportedNamespaceInCommonJsModule() {
    options.setModule(ModuleKind.COMMONJS);
    Node namespace =
        withModifiers(IR.namespace("N", IR.moduleBlock(exprResult(call("g")))), Modifier.EXPORT);
    test(
        IR.module(namespace),
        "export var N;(function(N){g();})(N=exports.N||(exports.N={}));");
  }
}
