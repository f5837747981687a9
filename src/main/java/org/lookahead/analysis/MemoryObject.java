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

package org.lookahead.analysis;

import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Argument;
import org.lookahead.ir.Function;
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.Value;

/**
 * An object that a Pointer-Base value may point into: a global, a function, or an allocation
 * (stack or heap) made by an instruction in a specific context. Globals and functions have no
 * context.
 */
public record MemoryObject(Value value, @Nullable Context context) {

  public static MemoryObject global(Value value) {
    if (!(value instanceof GlobalVariable || value instanceof Function)) {
      throw new IllegalArgumentException("Not a global: " + value);
    }
    return new MemoryObject(value, null);
  }

  /**
   * True if this object is distinct from every other identified object: globals, stack
   * allocations, results of calls returning fresh memory, and no-alias arguments.
   */
  public boolean isIdentified() {
    return value instanceof GlobalVariable
        || value instanceof Function
        || isStackAllocation()
        || isHeapAllocation()
        || (value instanceof Argument arg && arg.isNoAlias());
  }

  public boolean isStackAllocation() {
    return value instanceof Instruction inst && inst.opcode == Opcode.ALLOCA;
  }

  /** True if this object was returned by a call to a function that returns fresh memory. */
  public boolean isHeapAllocation() {
    if (value instanceof Instruction inst) {
      Function callee = inst.calledFunction();
      return callee != null && callee.returnsNoAlias();
    }
    return false;
  }

  @Override
  public String toString() {
    return context == null ? value.asOperand() : value.asOperand() + "#" + context.index;
  }
}
