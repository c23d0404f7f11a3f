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

import com.google.javascript.tsast.Node;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Maps a class declaration to the alias that self-references inside its body are rewritten to.
 *
 * <p>An alias exists only for a class that refers to itself and is rebound by its constructor
 * decorators.
 */
final class ClassAliasMap {
  private final Map<Integer, Node> aliasesByClassId = new HashMap<>();

  void put(Node classNode, Node alias) {
    Node original = classNode.getOriginalNode();
    checkState(original.isClass(), original);
    checkState(
        aliasesByClassId.put(original.getId(), alias) == null,
        "Class aliased twice: %s",
        original);
  }

  /** Returns the alias of a class declaration, or null if it has none. */
  @Nullable Node get(Node classNode) {
    return aliasesByClassId.get(classNode.getOriginalNode().getId());
  }

  boolean isEmpty() {
    return aliasesByClassId.isEmpty();
  }
}
