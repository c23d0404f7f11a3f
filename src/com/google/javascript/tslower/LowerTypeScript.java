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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.tsast.Node;
import java.util.logging.Logger;

/**
 * Rewrites a type-checked TypeScript syntax tree into a plain JavaScript syntax tree.
 *
 * <p>Type annotations, interfaces, type aliases, ambient declarations and overload signatures
 * disappear. Parameter properties, decorators, enums and namespaces are expanded to the
 * JavaScript they stand for, and imports or exports that only name types are removed. Module
 * syntax that remains is left to a later pass.
 *
 * <p>One instance lowers any number of files of one compilation, one at a time. All files share
 * the given {@link SubstitutionRegistry}.
 */
public final class LowerTypeScript {
  private static final Logger logger = Logger.getLogger(LowerTypeScript.class.getName());

  private final CompilerOptions options;
  private final LoweringOracle oracle;
  private final SubstitutionRegistry registry;

  public LowerTypeScript(
      CompilerOptions options, LoweringOracle oracle, SubstitutionRegistry registry) {
    this.options = checkNotNull(options);
    this.oracle = checkNotNull(oracle);
    this.registry = checkNotNull(registry);
  }

  /** Lowers one SCRIPT. */
  public LoweringResult lower(Node script) {
    checkArgument(script.isScript(), "Expected a SCRIPT: %s", script);
    LoweringContext context = new LoweringContext(options, oracle, registry, script);
    if (script.hasFlag(Node.Flag.DECLARATION_FILE)) {
      return LoweringResult.create(
          script, context.getRequestedHelpers(), registry, context.createSubstitutionHooks());
    }
    logger.fine("Lowering " + describe(script));
    Node root;
    try {
      root = new TreeVisitor(context).visitSourceFile(script);
    } catch (RuntimeException e) {
      throw new RuntimeException(
          "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n"
              + e.getMessage()
              + "\n  while lowering "
              + describe(script),
          e);
    }
    return LoweringResult.create(
        root, context.getRequestedHelpers(), registry, context.createSubstitutionHooks());
  }

  private static String describe(Node script) {
    String fileName = script.getStringOrNull();
    return fileName != null ? fileName : "<anonymous script #" + script.getId() + ">";
  }
}
