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

import java.util.Arrays;
import java.util.List;
import org.lookahead.ir.Argument;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Value;

/**
 * The variadic arguments of one inlined call, laid out the way the x86-64 calling convention
 * passes them: the first six integer or pointer arguments (fixed parameters included) in general
 * registers, the first eight floating-point arguments in vector registers, and the rest on the
 * stack. The register save area has a slot of 8 bytes for each general register followed by a
 * slot of 16 bytes for each vector register.
 */
final class VarArgFrame {
  static final int GENERAL_REGISTERS = 6;
  static final int VECTOR_REGISTERS = 8;
  static final int SLOT_SIZE = 8;

  /** The first register-area slot used by vector registers; each uses two slots. */
  static final int FIRST_VECTOR_SLOT = GENERAL_REGISTERS;

  private static final int NUM_SLOTS = GENERAL_REGISTERS + 2 * VECTOR_REGISTERS;

  private final InlineAttempt frame;

  /** The variadic arguments at the call site, in order. */
  private final List<Value> arguments;

  /** Indexed by general register; the variadic argument passed in it, or -1. */
  private final int[] inGeneralRegister = new int[GENERAL_REGISTERS];

  /** Indexed by vector register; the variadic argument passed in it, or -1. */
  private final int[] inVectorRegister = new int[VECTOR_REGISTERS];

  /** For each variadic argument, true if it is passed on the stack. */
  private final boolean[] spilled;

  VarArgFrame(InlineAttempt frame) {
    this.frame = frame;
    Arrays.fill(inGeneralRegister, -1);
    Arrays.fill(inVectorRegister, -1);
    Instruction call = frame.callSite;
    int numFixed = frame.function.arguments().size();
    this.arguments =
        (call == null) ? List.of() : call.operands().subList(numFixed, call.numOperands());
    this.spilled = new boolean[arguments.size()];
    int general = 0;
    int vector = 0;
    for (Argument arg : frame.function.arguments()) {
      if (arg.type().isFloatingPoint()) {
        vector++;
      } else {
        general++;
      }
    }
    for (int i = 0; i < arguments.size(); i++) {
      if (arguments.get(i).type().isFloatingPoint()) {
        if (vector < VECTOR_REGISTERS) {
          inVectorRegister[vector++] = i;
        } else {
          spilled[i] = true;
        }
      } else if (general < GENERAL_REGISTERS) {
        inGeneralRegister[general++] = i;
      } else {
        spilled[i] = true;
      }
    }
  }

  int numArguments() {
    return arguments.size();
  }

  /** The actual argument passed as variadic argument {@code position}. */
  Value argument(int position) {
    return arguments.get(position);
  }

  /** The context in which the call site's operands are evaluated. */
  Context callerContext() {
    return frame.parent();
  }

  /**
   * Returns the variadic argument whose register is saved at the given byte offset in the register
   * save area, or -1 if the offset is not the start of a slot holding a variadic argument.
   */
  int argumentAtRegisterOffset(long offset) {
    if (offset < 0 || offset % SLOT_SIZE != 0 || offset / SLOT_SIZE >= NUM_SLOTS) {
      return -1;
    }
    int slot = (int) (offset / SLOT_SIZE);
    if (slot < FIRST_VECTOR_SLOT) {
      return inGeneralRegister[slot];
    } else if ((slot - FIRST_VECTOR_SLOT) % 2 != 0) {
      // The upper half of a vector register
      return -1;
    }
    return inVectorRegister[(slot - FIRST_VECTOR_SLOT) / 2];
  }

  /** Returns the first variadic argument passed on the stack, or -1 if there is none. */
  int firstSpilled() {
    return nextSpilledAfter(-1);
  }

  /** Returns the next variadic argument after {@code position} passed on the stack, or -1. */
  int nextSpilledAfter(int position) {
    for (int i = position + 1; i < spilled.length; i++) {
      if (spilled[i]) {
        return i;
      }
    }
    return -1;
  }
}
