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
import com.google.common.collect.ImmutableList;
import com.google.javascript.tsast.Node;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The decorators that apply to one declaration: those written on the declaration and, for
 * function-like declarations, those written on each parameter.
 */
@AutoValue
abstract class AllDecorators {

  static AllDecorators create(
      ImmutableList<Node> decorators, @Nullable List<@Nullable ImmutableList<Node>> parameters) {
    return new AutoValue_AllDecorators(
        decorators,
        parameters == null
            ? ImmutableList.of()
            : Collections.unmodifiableList(parameters));
  }

  /** The DECORATOR nodes of the declaration itself. */
  abstract ImmutableList<Node> decorators();

  /**
   * The DECORATOR nodes of each parameter, indexed by position after any {@code this} parameter.
   * An entry is null when that parameter has none. Empty when no parameter is decorated.
   */
  abstract List<@Nullable ImmutableList<Node>> parameters();
}
