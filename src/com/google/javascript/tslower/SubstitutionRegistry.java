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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.javascript.tsast.EmitFlag;
import com.google.javascript.tsast.Node;
import com.google.javascript.tsast.Token;
import java.util.EnumSet;
import java.util.logging.Logger;

/**
 * Records which print-time substitutions lowering has asked for.
 *
 * <p>One registry is shared by every file of a compilation. Kinds are enabled lazily, the first
 * time lowering produces a construct that needs them, and stay enabled. Once {@link #freeze()}
 * has been called the registry is read-only and may be shared between printer threads.
 */
public final class SubstitutionRegistry {

  /** Groups of substitutions that are enabled together. */
  public enum SubstitutionKind {
    /** References to a decorated class from inside its body use the class alias. */
    CLASS_ALIASES,
    /** References to names exported from a namespace are qualified with the namespace. */
    NAMESPACE_EXPORTS,
    /** References to sibling members inside an enum body are qualified with the enum. */
    NON_QUALIFIED_ENUM_MEMBERS
  }

  private static final Logger logger = Logger.getLogger(SubstitutionRegistry.class.getName());

  private final EnumSet<SubstitutionKind> enabledSubstitutions =
      EnumSet.noneOf(SubstitutionKind.class);
  private final EnumSet<Token> substitutedTokens = EnumSet.of(Token.GETPROP, Token.GETELEM);
  private final EnumSet<Token> emitNotificationTokens = EnumSet.of(Token.SCRIPT);
  private boolean frozen = false;

  /** Enables a group of substitutions. Enabling twice is a no-op. */
  public void enable(SubstitutionKind kind) {
    if (enabledSubstitutions.contains(kind)) {
      return;
    }
    checkState(!frozen, "Cannot enable %s after the registry was frozen", kind);
    logger.fine("Enabling substitution of " + kind);
    enabledSubstitutions.add(kind);
    switch (kind) {
      case CLASS_ALIASES:
        substitutedTokens.add(Token.NAME);
        break;
      case NAMESPACE_EXPORTS:
        substitutedTokens.add(Token.NAME);
        substitutedTokens.add(Token.SHORTHAND_PROPERTY);
        emitNotificationTokens.add(Token.NAMESPACE);
        break;
      case NON_QUALIFIED_ENUM_MEMBERS:
        substitutedTokens.add(Token.NAME);
        emitNotificationTokens.add(Token.ENUM);
        break;
    }
  }

  public boolean isEnabled(SubstitutionKind kind) {
    return enabledSubstitutions.contains(kind);
  }

  public ImmutableSet<SubstitutionKind> getEnabledSubstitutions() {
    return Sets.immutableEnumSet(enabledSubstitutions);
  }

  /** Whether the printer should offer nodes of this kind to the substitution hook. */
  public boolean isSubstitutionEnabled(Node node) {
    return substitutedTokens.contains(node.getToken());
  }

  /** Whether the printer should notify the hooks before and after printing this node. */
  public boolean isEmitNotificationEnabled(Node node) {
    return emitNotificationTokens.contains(node.getToken())
        || node.hasEmitFlag(EmitFlag.ADVISE_ON_EMIT_NODE);
  }

  /** Makes the registry read-only. */
  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }
}
