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
import static org.junit.Assert.assertThrows;

import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tslower.SubstitutionRegistry.SubstitutionKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SubstitutionTableTest extends LoweringTestCase {

  @Test
  public void testConstEnumReferenceIsInlined() {
    Node access = IR.getprop(IR.name("E"), "A");
    oracle.setConstantValue(access, ConstantValue.ofNumber(1));
    test(IR.script(exprResult(call("f", access))), "f(1/* A */);");
  }

  @Test
  public void testElementAccessIsInlined() {
    Node access = IR.getelem(IR.name("E"), IR.string("A"));
    oracle.setConstantValue(access, ConstantValue.ofString("a"));
    test(IR.script(exprResult(call("f", access))), "f(\"a\"/* \"A\" */);");
  }

  @Test
  public void testElementAccessWithEntityNameIndexKeepsIndexInComment() {
    Node access = IR.getelem(IR.name("E"), IR.getprop(IR.name("K"), "a"));
    oracle.setConstantValue(access, ConstantValue.ofNumber(1));
    test(IR.script(exprResult(call("f", access))), "f(1/* K.a */);");
  }

  @Test
  public void testElementAccessWithNumericIndexKeepsIndexInComment() {
    Node access = IR.getelem(IR.name("E"), IR.number(0));
    oracle.setConstantValue(access, ConstantValue.ofString("x"));
    test(IR.script(exprResult(call("f", access))), "f(\"x\"/* 0 */);");
  }

  @Test
  public void testNegativeValueIsInlined() {
    Node access = IR.getprop(IR.name("E"), "A");
    oracle.setConstantValue(access, ConstantValue.ofNumber(-2));
    test(IR.script(exprResult(call("f", access))), "f(-2/* A */);");
  }

  @Test
  public void testInlinedValueWithoutComment() {
    options.setRemoveComments(true);
    Node access = IR.getprop(IR.name("E"), "A");
    oracle.setConstantValue(access, ConstantValue.ofNumber(1));
    test(IR.script(exprResult(call("f", access))), "f(1);");
  }

  @Test
  public void testNoInliningWithIsolatedModules() {
    options.setIsolatedModules(true);
    Node access = IR.getprop(IR.name("E"), "A");
    oracle.setConstantValue(access, ConstantValue.ofNumber(1));
    test(IR.script(exprResult(call("f", access))), "f(E.A);");
  }

  @Test
  public void testTableIsEmptyWithoutSubstitutions() {
    LoweringResult result = lower(IR.script(exprResult(call("f", IR.getprop(IR.name("a"), "b")))));
    SubstitutionTable table = result.buildSubstitutionTable();
    assertThat(table.isEmpty()).isTrue();
    assertThat(table.lookup(result.root().getId()).isPresent()).isFalse();
  }

  @Test
  public void testLookupFindsReplacement() {
    Node access = IR.getprop(IR.name("E"), "A");
    oracle.setConstantValue(access, ConstantValue.ofNumber(3));
    SubstitutionTable table =
        lower(IR.script(exprResult(call("f", access)))).buildSubstitutionTable();
    assertThat(table.size()).isEqualTo(1);
    Node replacement = table.lookup(access.getId()).get();
    assertThat(replacement.getDouble()).isEqualTo(3.0);
    assertThat(replacement.getOriginal()).isSameInstanceAs(access);
  }

  @Test
  public void testBindingNamesAreNotSubstituted() {
    Node binding = IR.name("a");
    Node reference = IR.name("a");
    Node namespace =
        IR.namespace(
            "N",
            IR.moduleBlock(IR.let(binding, IR.number(1)), exprResult(call("f", reference))));
    oracle.setExportContainer(binding, namespace).setExportContainer(reference, namespace);
    test(IR.script(namespace), "var N;(function(N){let a=1;f(N.a);})(N||(N={}));");
  }

  @Test
  public void testQualificationOnlyAppliesInsideTheNamespace() {
    Node inside = IR.name("a");
    Node outside = IR.name("a");
    Node namespace =
        IR.namespace(
            "N",
            IR.moduleBlock(
                withModifiers(IR.var(IR.name("a"), IR.number(1)), Modifier.EXPORT),
                exprResult(call("f", inside))));
    oracle.setExportContainer(inside, namespace).setExportContainer(outside, namespace);
    test(
        IR.script(namespace, exprResult(call("g", outside))),
        "var N;(function(N){N.a=1;f(N.a);})(N||(N={}));g(a);");
  }

  @Test
  public void testFrozenRegistryRejectsNewKinds() {
    registry.enable(SubstitutionKind.CLASS_ALIASES);
    registry.freeze();
    assertThat(registry.isFrozen()).isTrue();
    registry.enable(SubstitutionKind.CLASS_ALIASES);
    assertThrows(
        IllegalStateException.class, () -> registry.enable(SubstitutionKind.NAMESPACE_EXPORTS));
    assertThat(registry.getEnabledSubstitutions()).containsExactly(SubstitutionKind.CLASS_ALIASES);
  }

  @Test
  public void testRegistryIsSharedBetweenFiles() {
    lower(IR.script(IR.namespace("N", IR.moduleBlock(exprResult(call("g"))))));
    Node reference = IR.name("x");
    LoweringResult second = lower(IR.script(exprResult(call("f", reference))));
    assertThat(registry.isSubstitutionEnabled(reference)).isTrue();
    assertThat(second.buildSubstitutionTable().isEmpty()).isTrue();
  }
}
