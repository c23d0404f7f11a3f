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

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;

/** Compiler options that affect how TypeScript syntax is lowered. */
public class CompilerOptions implements Serializable {

  /** The output language level. */
  public enum LanguageMode {
    /** 90's JavaScript */
    ECMASCRIPT3,

    /** Traditional JavaScript */
    ECMASCRIPT5,

    /** ECMAScript standard approved in 2015. Adds classes, let, const and symbols. */
    ECMASCRIPT_2015,

    /** ECMAScript standard approved in 2016. */
    ECMASCRIPT_2016,

    /** ECMAScript standard approved in 2017. */
    ECMASCRIPT_2017,

    /** ECMAScript standard approved in 2018. */
    ECMASCRIPT_2018,

    /** ECMAScript standard approved in 2019. */
    ECMASCRIPT_2019,

    /** ECMAScript standard approved in 2020. Adds bigint. */
    ECMASCRIPT_2020,

    /** ECMAScript standard approved in 2021. */
    ECMASCRIPT_2021,

    /** ECMAScript standard approved in 2022. */
    ECMASCRIPT_2022,

    /** ECMAScript features from the upcoming standard. */
    ECMASCRIPT_NEXT;

    /** Whether this level is at most {@code other}. */
    public boolean isAtMost(LanguageMode other) {
      return compareTo(other) <= 0;
    }

    /** Whether this level is strictly below {@code other}. */
    public boolean isBelow(LanguageMode other) {
      return compareTo(other) < 0;
    }
  }

  /** The module format that later passes produce. */
  public enum ModuleKind {
    NONE,
    COMMONJS,
    AMD,
    UMD,
    SYSTEM,
    ES2015,
    ES2020,
    ES2022,
    ESNEXT;

    /** Whether exports stay as ES module syntax in the output. */
    public boolean isEsModule() {
      switch (this) {
        case ES2015:
        case ES2020:
        case ES2022:
        case ESNEXT:
          return true;
        default:
          return false;
      }
    }
  }

  /** What happens to an import that is never used as a value. */
  public enum ImportsNotUsedAsValues {
    /** Drop the import. */
    REMOVE,
    /** Keep the import for its side effects. */
    PRESERVE,
    /** Keep the import; the checker reports an error for it. */
    ERROR;

    boolean keepsUnusedImports() {
      return this == PRESERVE || this == ERROR;
    }
  }

  private static final long serialVersionUID = 1L;

  private LanguageMode languageOut = LanguageMode.ECMASCRIPT_2015;
  private ModuleKind module = ModuleKind.ES2015;
  private ImportsNotUsedAsValues importsNotUsedAsValues = ImportsNotUsedAsValues.REMOVE;

  /** Emit {@code __metadata} calls describing the declared types of decorated members. */
  private boolean emitDecoratorMetadata = false;

  private boolean preserveConstEnums = false;

  /** Each file is lowered without knowledge of the others; const enums are not inlined. */
  private boolean isolatedModules = false;

  private boolean strictNullChecks = false;
  private boolean alwaysStrict = false;
  private boolean removeComments = false;

  /** Keep imports whose bindings are values even when they are never referenced. */
  private boolean preserveValueImports = false;

  public LanguageMode getLanguageOut() {
    return languageOut;
  }

  public void setLanguageOut(LanguageMode languageOut) {
    this.languageOut = checkNotNull(languageOut);
  }

  public ModuleKind getModule() {
    return module;
  }

  public void setModule(ModuleKind module) {
    this.module = checkNotNull(module);
  }

  public ImportsNotUsedAsValues getImportsNotUsedAsValues() {
    return importsNotUsedAsValues;
  }

  public void setImportsNotUsedAsValues(ImportsNotUsedAsValues importsNotUsedAsValues) {
    this.importsNotUsedAsValues = checkNotNull(importsNotUsedAsValues);
  }

  public boolean shouldEmitDecoratorMetadata() {
    return emitDecoratorMetadata;
  }

  public void setEmitDecoratorMetadata(boolean emitDecoratorMetadata) {
    this.emitDecoratorMetadata = emitDecoratorMetadata;
  }

  public void setPreserveConstEnums(boolean preserveConstEnums) {
    this.preserveConstEnums = preserveConstEnums;
  }

  /** Const enums are kept as objects when asked to, or when files are lowered in isolation. */
  public boolean shouldPreserveConstEnums() {
    return preserveConstEnums || isolatedModules;
  }

  public boolean isIsolatedModules() {
    return isolatedModules;
  }

  public void setIsolatedModules(boolean isolatedModules) {
    this.isolatedModules = isolatedModules;
  }

  public boolean isStrictNullChecks() {
    return strictNullChecks;
  }

  public void setStrictNullChecks(boolean strictNullChecks) {
    this.strictNullChecks = strictNullChecks;
  }

  public boolean isAlwaysStrict() {
    return alwaysStrict;
  }

  public void setAlwaysStrict(boolean alwaysStrict) {
    this.alwaysStrict = alwaysStrict;
  }

  public boolean shouldRemoveComments() {
    return removeComments;
  }

  public void setRemoveComments(boolean removeComments) {
    this.removeComments = removeComments;
  }

  public boolean shouldPreserveValueImports() {
    return preserveValueImports;
  }

  public void setPreserveValueImports(boolean preserveValueImports) {
    this.preserveValueImports = preserveValueImports;
  }
}
