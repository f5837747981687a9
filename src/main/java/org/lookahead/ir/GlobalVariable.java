/*
 * Copyright 2025 The Lookahead Authors
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

package org.lookahead.ir;

import org.jspecify.annotations.Nullable;

/** A module-level variable; as an operand it is a pointer to the variable's storage. */
public final class GlobalVariable extends Value {
  public final Type valueType;
  public final @Nullable Constant initializer;
  public final boolean isConstant;
  public final int alignment;

  GlobalVariable(
      String name,
      Type valueType,
      @Nullable Constant initializer,
      boolean isConstant,
      int alignment) {
    super(Type.PTR, name);
    this.valueType = valueType;
    this.initializer = initializer;
    this.isConstant = isConstant;
    this.alignment = alignment;
  }

  @Override
  public String asOperand() {
    return "@" + name();
  }
}
