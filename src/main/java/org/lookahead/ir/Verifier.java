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

import org.lookahead.ir.Type.IntType;

/** Checks the structural and type rules that the analysis relies on. */
final class Verifier {

  private Verifier() {}

  static void verify(Function function) {
    for (Block block : function.blocks) {
      if (block.instructions.isEmpty()) {
        throw new MalformedIrException(null, "Block %s is empty", block);
      }
      boolean seenNonPhi = false;
      for (int i = 0; i < block.instructions.size(); i++) {
        Instruction inst = block.instructions.get(i);
        boolean last = (i == block.instructions.size() - 1);
        if (inst.isTerminator() != last) {
          throw new MalformedIrException(
              inst, last ? "Block does not end with a terminator" : "Terminator is not last");
        }
        if (inst.opcode == Opcode.PHI) {
          if (seenNonPhi) {
            throw new MalformedIrException(inst, "PHI after non-PHI");
          }
        } else {
          seenNonPhi = true;
        }
        verifyInstruction(inst);
      }
    }
  }

  private static void verifyInstruction(Instruction inst) {
    int expected = inst.opcode.numOperands;
    if (expected >= 0 && inst.numOperands() != expected) {
      throw new MalformedIrException(
          inst, "Expected %s operands, got %s", expected, inst.numOperands());
    }
    for (Value v : inst.operands()) {
      Function owner =
          (v instanceof Instruction def)
              ? def.function()
              : (v instanceof Argument arg) ? arg.function : null;
      if (owner != null && owner != inst.function()) {
        throw new MalformedIrException(inst, "Operand %s belongs to %s", v, owner);
      }
    }
    switch (inst.opcode) {
      case LOAD -> requirePointer(inst, inst.operand(0));
      case STORE -> requirePointer(inst, inst.operand(1));
      case GEP -> {
        if (inst.numOperands() < 2) {
          throw new MalformedIrException(inst, "GEP needs an index");
        }
        requirePointer(inst, inst.operand(0));
        for (int i = 1; i < inst.numOperands(); i++) {
          requireInteger(inst, inst.operand(i));
        }
      }
      case MEMSET -> {
        requirePointer(inst, inst.operand(0));
        requireInteger(inst, inst.operand(1));
        requireInteger(inst, inst.operand(2));
      }
      case MEMCPY -> {
        requirePointer(inst, inst.operand(0));
        requirePointer(inst, inst.operand(1));
        requireInteger(inst, inst.operand(2));
      }
      case ADD, SUB, MUL, UDIV, SDIV, UREM, SREM, AND, OR, XOR, SHL, LSHR, ASHR -> {
        requireInteger(inst, inst.operand(0));
        requireSameType(inst, inst.operand(0), inst.operand(1));
      }
      case ICMP -> {
        Type t = inst.operand(0).type();
        if (!(t.isInteger() || t.isPointer())) {
          throw new MalformedIrException(inst, "Cannot compare %s", t);
        }
        requireSameType(inst, inst.operand(0), inst.operand(1));
      }
      case TRUNC, ZEXT, SEXT -> {
        requireInteger(inst, inst.operand(0));
        int from = ((IntType) inst.operand(0).type()).bits;
        if (!(inst.type() instanceof IntType to)
            || (inst.opcode == Opcode.TRUNC ? to.bits >= from : to.bits <= from)) {
          throw new MalformedIrException(inst, "Bad %s to %s", inst.opcode, inst.type());
        }
      }
      case PTRTOINT -> {
        requirePointer(inst, inst.operand(0));
        if (!inst.type().isInteger()) {
          throw new MalformedIrException(inst, "ptrtoint must produce an integer");
        }
      }
      case INTTOPTR -> {
        requireInteger(inst, inst.operand(0));
        if (!inst.type().isPointer()) {
          throw new MalformedIrException(inst, "inttoptr must produce a pointer");
        }
      }
      case SELECT -> {
        requireBoolean(inst, inst.operand(0));
        requireSameType(inst, inst.operand(1), inst.operand(2));
      }
      case PHI -> {
        for (Value v : inst.operands()) {
          if (!v.type().equals(inst.type())) {
            throw new MalformedIrException(inst, "Incoming %s has type %s", v, v.type());
          }
        }
      }
      case CALL -> verifyCall(inst);
      case COND_BR -> requireBoolean(inst, inst.operand(0));
      case SWITCH -> {
        requireInteger(inst, inst.operand(0));
        for (Constant.Int c : inst.caseValues()) {
          requireSameType(inst, inst.operand(0), c);
        }
      }
      case RET -> {
        Type expectedType = inst.function().returnType;
        if (expectedType.isVoid()
            ? inst.numOperands() != 0
            : (inst.numOperands() != 1 || !inst.operand(0).type().equals(expectedType))) {
          throw new MalformedIrException(inst, "Return does not match %s", expectedType);
        }
      }
      default -> {}
    }
  }

  private static void verifyCall(Instruction inst) {
    if (!inst.callee().type().isPointer()) {
      throw new MalformedIrException(inst, "Callee is not a pointer");
    }
    Function f = inst.calledFunction();
    if (f == null) {
      return;
    }
    int numParams = f.arguments().size();
    if (f.isVarArg ? inst.numOperands() < numParams : inst.numOperands() != numParams) {
      throw new MalformedIrException(
          inst, "%s expects %s arguments, got %s", f, numParams, inst.numOperands());
    }
    for (int i = 0; i < numParams; i++) {
      requireSameType(inst, inst.operand(i), f.argument(i));
    }
    if (!inst.type().equals(f.returnType)) {
      throw new MalformedIrException(inst, "%s returns %s", f, f.returnType);
    }
  }

  private static void requirePointer(Instruction inst, Value v) {
    if (!v.type().isPointer()) {
      throw new MalformedIrException(inst, "%s is not a pointer", v);
    }
  }

  private static void requireInteger(Instruction inst, Value v) {
    if (!v.type().isInteger()) {
      throw new MalformedIrException(inst, "%s is not an integer", v);
    }
  }

  private static void requireBoolean(Instruction inst, Value v) {
    if (!v.type().equals(Type.I1)) {
      throw new MalformedIrException(inst, "%s is not an i1", v);
    }
  }

  private static void requireSameType(Instruction inst, Value a, Value b) {
    if (!a.type().equals(b.type())) {
      throw new MalformedIrException(inst, "Type mismatch: %s and %s", a.type(), b.type());
    }
  }
}
