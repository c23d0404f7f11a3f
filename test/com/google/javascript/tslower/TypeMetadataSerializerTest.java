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

import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import com.google.javascript.tslower.CompilerOptions.LanguageMode;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypeMetadataSerializerTest extends LoweringTestCase {
  private LoweringContext context;

  private TypeMetadataSerializer createSerializer() {
    context = new LoweringContext(options, oracle, registry, IR.script());
    context.startLexicalEnvironment();
    return new TypeMetadataSerializer(context);
  }

  private String serialize(@Nullable Node type) {
    return CodePrinter.print(createSerializer().serializeTypeNode(type));
  }

  private String hoisted() {
    return CodePrinter.print(IR.script(context.endLexicalEnvironment()));
  }

  @Test
  public void testMissingAnnotation() {
    assertThat(serialize(null)).isEqualTo("Object");
  }

  @Test
  public void testPrimitives() {
    assertThat(serialize(type(Token.STRING_TYPE))).isEqualTo("String");
    assertThat(serialize(type(Token.NUMBER_TYPE))).isEqualTo("Number");
    assertThat(serialize(type(Token.BOOLEAN_TYPE))).isEqualTo("Boolean");
    assertThat(serialize(type(Token.VOID_TYPE))).isEqualTo("void 0");
    assertThat(serialize(type(Token.NEVER_TYPE))).isEqualTo("void 0");
    assertThat(serialize(type(Token.ANY_TYPE))).isEqualTo("Object");
    assertThat(serialize(type(Token.FUNCTION_TYPE))).isEqualTo("Function");
    assertThat(serialize(IR.compositeType(Token.ARRAY_TYPE, type(Token.STRING_TYPE))))
        .isEqualTo("Array");
  }

  @Test
  public void testLiteralTypes() {
    assertThat(serialize(IR.literalType(IR.string("a")))).isEqualTo("String");
    assertThat(serialize(IR.literalType(IR.number(1)))).isEqualTo("Number");
    assertThat(serialize(IR.literalType(IR.trueNode()))).isEqualTo("Boolean");
  }

  @Test
  public void testParenthesizedAndReadonly() {
    assertThat(serialize(IR.compositeType(Token.PARENTHESIZED_TYPE, type(Token.STRING_TYPE))))
        .isEqualTo("String");
    Node readonlyArray =
        IR.typeOperator("readonly", IR.compositeType(Token.ARRAY_TYPE, type(Token.STRING_TYPE)));
    assertThat(serialize(readonlyArray)).isEqualTo("Array");
    assertThat(serialize(IR.typeOperator("keyof", typeRef("T")))).isEqualTo("Object");
  }

  @Test
  public void testUnionOfSameName() {
    Node union =
        IR.compositeType(Token.UNION_TYPE, type(Token.STRING_TYPE), IR.literalType(IR.string("a")));
    assertThat(serialize(union)).isEqualTo("String");
  }

  @Test
  public void testUnionOfDifferentNames() {
    Node union =
        IR.compositeType(Token.UNION_TYPE, type(Token.STRING_TYPE), type(Token.NUMBER_TYPE));
    assertThat(serialize(union)).isEqualTo("Object");
  }

  @Test
  public void testNullableUnion() {
    Node union =
        IR.compositeType(
            Token.UNION_TYPE,
            type(Token.STRING_TYPE),
            IR.literalType(IR.nullNode()),
            type(Token.UNDEFINED_TYPE));
    assertThat(serialize(union)).isEqualTo("String");

    options.setStrictNullChecks(true);
    assertThat(serialize(union)).isEqualTo("Object");
  }

  @Test
  public void testUnionOfOnlyNullAndUndefined() {
    Node union =
        IR.compositeType(
            Token.UNION_TYPE, IR.literalType(IR.nullNode()), type(Token.UNDEFINED_TYPE));
    assertThat(serialize(union)).isEqualTo("void 0");
  }

  @Test
  public void testConditionalType() {
    Node conditional =
        IR.compositeType(
            Token.CONDITIONAL_TYPE,
            typeRef("T"),
            type(Token.STRING_TYPE),
            type(Token.STRING_TYPE),
            IR.literalType(IR.string("b")));
    assertThat(serialize(conditional)).isEqualTo("String");
  }

  @Test
  public void testUnknownReferenceInConditionalTypeIsObject() {
    Node conditional =
        IR.compositeType(
            Token.CONDITIONAL_TYPE,
            typeRef("T"),
            type(Token.STRING_TYPE),
            typeRef("Foo"),
            typeRef("Foo"));
    assertThat(serialize(conditional)).isEqualTo("Object");
    assertThat(hoisted()).isEmpty();
  }

  @Test
  public void testBigIntAndSymbol() {
    assertThat(serialize(type(Token.BIGINT_TYPE)))
        .isEqualTo("typeof BigInt===\"function\"?BigInt:Object");
    assertThat(serialize(type(Token.SYMBOL_TYPE))).isEqualTo("Symbol");

    options.setLanguageOut(LanguageMode.ECMASCRIPT5);
    assertThat(serialize(type(Token.SYMBOL_TYPE)))
        .isEqualTo("typeof Symbol===\"function\"?Symbol:Object");

    options.setLanguageOut(LanguageMode.ECMASCRIPT_NEXT);
    assertThat(serialize(type(Token.BIGINT_TYPE))).isEqualTo("BigInt");
  }

  @Test
  public void testUnknownReference() {
    assertThat(serialize(typeRef("Foo")))
        .isEqualTo("typeof (_a=typeof Foo!==\"undefined\"&&Foo)===\"function\"?_a:Object");
    assertThat(hoisted()).isEqualTo("var _a;");
  }

  @Test
  public void testUnknownQualifiedReference() {
    assertThat(serialize(typeRef("A.B")))
        .isEqualTo("typeof (_a=typeof A!==\"undefined\"&&A.B)===\"function\"?_a:Object");
  }

  @Test
  public void testUnknownDeeplyQualifiedReference() {
    assertThat(serialize(typeRef("A.B.C")))
        .isEqualTo(
            "typeof (_b=typeof A!==\"undefined\"&&(_a=A.B)!==void 0&&_a.C)===\"function\""
                + "?_b:Object");
    assertThat(hoisted()).isEqualTo("var _a,_b;");
  }

  @Test
  public void testKnownReferences() {
    oracle
        .setTypeKind("A.B", TypeReferenceSerializationKind.TYPE_WITH_CONSTRUCT_SIGNATURE_AND_VALUE)
        .setTypeKind("N", TypeReferenceSerializationKind.NUMBER_LIKE)
        .setTypeKind("P", TypeReferenceSerializationKind.PROMISE)
        .setTypeKind("V", TypeReferenceSerializationKind.VOID_NULLABLE_OR_NEVER)
        .setTypeKind("F", TypeReferenceSerializationKind.TYPE_WITH_CALL_SIGNATURE);
    assertThat(serialize(typeRef("A.B"))).isEqualTo("A.B");
    assertThat(serialize(typeRef("N"))).isEqualTo("Number");
    assertThat(serialize(typeRef("P"))).isEqualTo("Promise");
    assertThat(serialize(typeRef("V"))).isEqualTo("void 0");
    assertThat(serialize(typeRef("F"))).isEqualTo("Function");
  }

  @Test
  public void testParameterTypes() {
    Node rest =
        withFlag(
            param("rest", IR.compositeType(Token.ARRAY_TYPE, type(Token.NUMBER_TYPE))),
            Node.Flag.REST);
    Node m =
        method(
            "m",
            IR.paramList(
                param("this", typeRef("X")),
                param("a", type(Token.STRING_TYPE)),
                IR.param("b"),
                rest));
    Node container = classDecl("C", m);
    assertThat(CodePrinter.print(createSerializer().serializeParameterTypesOfNode(m, container)))
        .isEqualTo("[String,Object,Number]");
  }

  @Test
  public void testConstructorParameterTypesOfClass() {
    Node ctor = constructor(IR.paramList(param("a", type(Token.STRING_TYPE)), IR.param("b")));
    Node classNode = classDecl("C", ctor);
    assertThat(
            CodePrinter.print(createSerializer().serializeParameterTypesOfNode(classNode, null)))
        .isEqualTo("[String,Object]");
  }

  @Test
  public void testAccessorTypePrefersSetter() {
    Node getterFunction = IR.function(IR.name(""), IR.paramList(), IR.block());
    Node getter = IR.getterDef("x", withType(getterFunction, type(Token.NUMBER_TYPE)));
    Node setterParams = IR.paramList(param("v", type(Token.STRING_TYPE)));
    Node setter = IR.setterDef("x", IR.function(IR.name(""), setterParams, IR.block()));
    TypeMetadataSerializer serializer = createSerializer();
    Node container = classDecl("C", getter, setter);
    assertThat(CodePrinter.print(serializer.serializeTypeOfNode(getter, container)))
        .isEqualTo("String");
    assertThat(CodePrinter.print(serializer.serializeTypeOfNode(getter, classDecl("C", getter))))
        .isEqualTo("Number");
  }

  @Test
  public void testReturnTypes() {
    TypeMetadataSerializer serializer = createSerializer();
    Node typed =
        IR.memberFunctionDef(
            "m",
            withType(
                IR.function(IR.name(""), IR.paramList(), IR.block()), type(Token.BOOLEAN_TYPE)));
    Node async = withModifiers(method("m", IR.paramList()), Modifier.ASYNC);
    Node untyped = method("m", IR.paramList());
    assertThat(CodePrinter.print(serializer.serializeReturnTypeOfNode(typed)))
        .isEqualTo("Boolean");
    assertThat(CodePrinter.print(serializer.serializeReturnTypeOfNode(async)))
        .isEqualTo("Promise");
    assertThat(CodePrinter.print(serializer.serializeReturnTypeOfNode(untyped)))
        .isEqualTo("void 0");
  }
}
