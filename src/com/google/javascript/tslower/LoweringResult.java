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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.tsast.Node;

/** The lowered tree of one file and what a printer needs to print it. */
@AutoValue
public abstract class LoweringResult {
  static LoweringResult create(
      Node root,
      ImmutableSet<EmitHelper> emitHelpers,
      SubstitutionRegistry registry,
      SubstitutionHooks substitutionHooks) {
    return new AutoValue_LoweringResult(root, emitHelpers, registry, substitutionHooks);
  }

  /** The lowered SCRIPT; the input itself when it had nothing to lower. */
  public abstract Node root();

  /** The runtime helpers the lowered code calls. */
  public abstract ImmutableSet<EmitHelper> emitHelpers();

  abstract SubstitutionRegistry registry();

  public abstract SubstitutionHooks substitutionHooks();

  /**
   * Computes the print-time replacements of this file. Substitutions are enabled for the whole
   * compilation, so call this once every file has been lowered.
   */
  public SubstitutionTable buildSubstitutionTable() {
    return SubstitutionTable.build(root(), registry(), substitutionHooks());
  }
}
