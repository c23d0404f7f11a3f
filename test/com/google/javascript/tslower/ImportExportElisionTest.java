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

import com.google.javascript.tsast.IR;
import com.google.javascript.tsast.Modifier;
import com.google.javascript.tsast.Node;
import com.google.javascript.tslower.CompilerOptions.ImportsNotUsedAsValues;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ImportExportElisionTest extends LoweringTestCase {

  @Test
  public void testUnreferencedBindingsAreRemoved() {
    Node b = IR.importSpec("b");
    Node clause =
        IR.importClause(IR.name("a"), IR.namedImports(b, IR.importSpec("c", "d")));
    oracle.addReferencedAlias(clause).addReferencedAlias(b);
    test(IR.module(IR.importNode(clause, "m")), "import a,{b} from \"m\";");
  }

  @Test
  public void testRenamedBindingIsKept() {
    Node spec = IR.importSpec("c", "d");
    oracle.addReferencedAlias(spec);
    test(
        IR.module(IR.importNode(IR.importClause(IR.empty(), IR.namedImports(spec)), "m")),
        "import {c as d} from \"m\";");
  }

  @Test
  public void testUnusedImportIsRemoved() {
    Node clause = IR.importClause(IR.name("a"), IR.namedImports(IR.importSpec("b")));
    test(IR.module(IR.importNode(clause, "m"), exprResult(call("f"))), "f();");
  }

  @Test
  public void testUnusedImportIsKeptForSideEffects() {
    options.setImportsNotUsedAsValues(ImportsNotUsedAsValues.PRESERVE);
    Node clause = IR.importClause(IR.name("a"), IR.namedImports(IR.importSpec("b")));
    test(IR.module(IR.importNode(clause, "m")), "import \"m\";");
  }

  @Test
  public void testTypeOnlyImportIsRemoved() {
    options.setImportsNotUsedAsValues(ImportsNotUsedAsValues.PRESERVE);
    Node clause = withFlag(IR.importClause(IR.name("T"), IR.empty()), Node.Flag.TYPE_ONLY);
    oracle.addReferencedAlias(clause);
    test(IR.module(IR.importNode(clause, "m"), exprResult(call("f"))), "f();");
  }

  @Test
  public void testTypeOnlySpecifierIsRemoved() {
    Node value = IR.importSpec("v");
    Node type = withFlag(IR.importSpec("T"), Node.Flag.TYPE_ONLY);
    oracle.addReferencedAlias(value).addReferencedAlias(type);
    test(
        IR.module(IR.importNode(IR.importClause(IR.empty(), IR.namedImports(value, type)), "m")),
        "import {v} from \"m\";");
  }

  @Test
  public void testNamespaceImport() {
    Node namespaceImport = IR.namespaceImport("ns");
    oracle.addReferencedAlias(namespaceImport);
    test(
        IR.module(IR.importNode(IR.importClause(IR.empty(), namespaceImport), "m")),
        "import * as ns from \"m\";");
  }

  @Test
  public void testPreservedValueImportKeepsUnreferencedValues() {
    options.setPreserveValueImports(true);
    Node value = IR.importSpec("v");
    oracle.addValueAlias(value);
    test(
        IR.module(
            IR.importNode(
                IR.importClause(IR.empty(), IR.namedImports(value, IR.importSpec("T"))), "m")),
        "import {v} from \"m\";");
  }

  @Test
  public void testSideEffectImportIsKept() {
    testSame(IR.module(IR.importSideEffect(IR.string("m"))));
  }

  @Test
  public void testExportSpecifiers() {
    Node a = IR.exportSpec("a");
    Node b = IR.exportSpec("b", "c");
    Node type = withFlag(IR.exportSpec("T"), Node.Flag.TYPE_ONLY);
    oracle.addValueAlias(a).addValueAlias(type);
    test(IR.module(IR.export(IR.namedExports(a, b, type), IR.empty())), "export {a};");
  }

  @Test
  public void testExportOfTypesOnlyIsRemoved() {
    Node export = IR.export(IR.namedExports(IR.exportSpec("T")), IR.string("m"));
    test(IR.module(export, exprResult(call("f"))), "f();");
  }

  @Test
  public void testEmptyReexportIsKeptForSideEffects() {
    options.setImportsNotUsedAsValues(ImportsNotUsedAsValues.PRESERVE);
    Node export = IR.export(IR.namedExports(IR.exportSpec("T")), IR.string("m"));
    test(IR.module(export), "export {} from \"m\";");
  }

  @Test
  public void testExportStarIsKept() {
    testSame(IR.module(IR.export(IR.empty(), IR.string("m"))));
  }

  @Test
  public void testTypeOnlyExportIsRemoved() {
    Node spec = IR.exportSpec("a");
    oracle.addValueAlias(spec);
    Node export = withFlag(IR.export(IR.namedExports(spec), IR.empty()), Node.Flag.TYPE_ONLY);
    test(IR.module(export, exprResult(call("f"))), "f();");
  }

  @Test
  public void testExportAssignment() {
    Node export = IR.exportEquals(IR.name("x"));
    oracle.addValueAlias(export);
    test(IR.module(export), "export=x;");
  }

  @Test
  public void testExportDefaultOfTypeIsRemoved() {
    test(IR.module(IR.exportDefault(IR.name("T")), exprResult(call("f"))), "f();");
  }

  @Test
  public void testImportRequire() {
    Node importEquals = IR.importEquals("fs", IR.externalModuleReference("fs"));
    oracle.addReferencedAlias(importEquals);
    test(IR.module(importEquals), "import fs=require(\"fs\");");
  }

  @Test
  public void testUnusedImportRequire() {
    Node importEquals = IR.importEquals("fs", IR.externalModuleReference("fs"));
    test(IR.module(importEquals, exprResult(call("f"))), "f();");
  }

  @Test
  public void testUnusedImportRequireIsKeptForSideEffects() {
    options.setImportsNotUsedAsValues(ImportsNotUsedAsValues.PRESERVE);
    Node importEquals = IR.importEquals("fs", IR.externalModuleReference("fs"));
    test(IR.module(importEquals), "import \"fs\";");
  }

  @Test
  public void testImportAlias() {
    Node importEquals = IR.importEquals("x", IR.getprop(IR.name("A"), "B"));
    oracle.addReferencedAlias(importEquals);
    test(IR.module(importEquals), "var x=A.B;");
  }

  @Test
  public void testExportedImportAlias() {
    Node importEquals =
        withModifiers(IR.importEquals("x", IR.getprop(IR.name("A"), "B")), Modifier.EXPORT);
    oracle.addReferencedAlias(importEquals);
    test(IR.module(importEquals), "export var x=A.B;");
  }

  @Test
  public void testUnreferencedImportAliasOfGlobalValueInScript() {
    Node importEquals = IR.importEquals("x", IR.getprop(IR.name("A"), "B"));
    oracle.addTopLevelValueImportEquals(importEquals);
    test(IR.script(importEquals), "var x=A.B;");
  }

  @Test
  public void testUnreferencedImportAliasInModule() {
    Node importEquals = IR.importEquals("x", IR.getprop(IR.name("A"), "B"));
    oracle.addTopLevelValueImportEquals(importEquals);
    test(IR.module(importEquals, exprResult(call("f"))), "f();");
  }

  @Test
  public void testExportedImportAliasInNamespace() {
    Node importEquals =
        withModifiers(IR.importEquals("x", IR.getprop(IR.name("A"), "B")), Modifier.EXPORT);
    oracle.addReferencedAlias(importEquals);
    test(
        IR.script(IR.namespace("N", IR.moduleBlock(importEquals))),
        "var N;(function(N){N.x=A.B;})(N||(N={}));");
  }
}
