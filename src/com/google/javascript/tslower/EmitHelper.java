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

/**
 * Runtime helper functions that lowered code calls. A printer or bundler is expected to provide
 * a definition for each helper a lowered file requests.
 */
public enum EmitHelper {
  /** {@code __decorate(decorators, target, key, desc)} applies decorators right to left. */
  DECORATE("__decorate"),
  /** {@code __param(index, decorator)} adapts a parameter decorator. */
  PARAM("__param"),
  /** {@code __metadata(key, value)} records design-time type metadata. */
  METADATA("__metadata");

  private final String functionName;

  EmitHelper(String functionName) {
    this.functionName = functionName;
  }

  public String getFunctionName() {
    return functionName;
  }
}
