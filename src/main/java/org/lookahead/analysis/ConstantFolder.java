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

import java.math.BigInteger;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Type;
import org.lookahead.ir.Type.IntType;

/**
 * The last Folder tried for every opcode. If any operand is neither a Scalar nor UNKNOWN the
 * result is OVERDEF; otherwise if any operand is UNKNOWN the result is UNKNOWN; otherwise the
 * instruction is evaluated on constants, and the result is OVERDEF if that is not possible (e.g.
 * division by zero).
 */
final class ConstantFolder implements Folder {
  static final ConstantFolder INSTANCE = new ConstantFolder();

  private ConstantFolder() {}

  @Override
  public LatticeValue fold(Instruction inst, LatticeValue[] ops, Phase phase) {
    Constant[] constants = new Constant[ops.length];
    boolean sawUnknown = false;
    for (int i = 0; i < ops.length; i++) {
      Constant c = ops[i].constant();
      if (c != null) {
        constants[i] = c;
      } else if (ops[i].isUnknown()) {
        sawUnknown = true;
      } else {
        return LatticeValue.OVERDEF;
      }
    }
    if (sawUnknown) {
      return LatticeValue.UNKNOWN;
    }
    Constant result = fold(inst, constants);
    return (result == null) ? LatticeValue.OVERDEF : LatticeValue.scalar(result);
  }

  /** Evaluates {@code inst} with the given constant operands, or returns null if it cannot. */
  static @Nullable Constant fold(Instruction inst, Constant[] ops) {
    Type resultType = inst.type();
    switch (inst.opcode) {
      case ADD, SUB, MUL, UDIV, SDIV, UREM, SREM, AND, OR, XOR, SHL, LSHR, ASHR:
        if (ops[0] instanceof Constant.Int a && ops[1] instanceof Constant.Int b) {
          BigInteger r = binary(inst, a, b);
          return (r == null) ? null : Constant.of(a.intType(), r);
        }
        return null;
      case ICMP:
        if (ops[0] instanceof Constant.Int a && ops[1] instanceof Constant.Int b) {
          return Constant.of(inst.predicate().test(a, b));
        } else if (ops[0] instanceof Constant.Null && ops[1] instanceof Constant.Null) {
          return Constant.of(inst.predicate().test(0));
        }
        return null;
      case TRUNC, ZEXT:
        return Constant.of((IntType) resultType, ((Constant.Int) ops[0]).unsignedValue());
      case SEXT:
        return Constant.of((IntType) resultType, ((Constant.Int) ops[0]).signedValue());
      case BITCAST:
        return ops[0].type().equals(resultType) ? ops[0] : null;
      case PTRTOINT:
        return ops[0].isZero() ? Constant.zero(resultType) : null;
      case INTTOPTR:
        return ops[0].isZero() ? Constant.NULL : null;
      case SELECT:
        return ops[0].isZero() ? ops[2] : ops[1];
      default:
        return null;
    }
  }

  private static @Nullable BigInteger binary(Instruction inst, Constant.Int a, Constant.Int b) {
    int width = a.width();
    BigInteger ua = a.unsignedValue();
    BigInteger ub = b.unsignedValue();
    switch (inst.opcode) {
      case ADD:
        return ua.add(ub);
      case SUB:
        return ua.subtract(ub);
      case MUL:
        return ua.multiply(ub);
      case UDIV:
        return b.isZero() ? null : ua.divide(ub);
      case UREM:
        return b.isZero() ? null : ua.mod(ub);
      case SDIV:
        // Division by zero and MIN / -1 are undefined
        if (b.isZero() || (a.isMinSigned() && b.isAllOnes())) {
          return null;
        }
        return a.signedValue().divide(b.signedValue());
      case SREM:
        if (b.isZero() || (a.isMinSigned() && b.isAllOnes())) {
          return null;
        }
        return a.signedValue().remainder(b.signedValue());
      case AND:
        return ua.and(ub);
      case OR:
        return ua.or(ub);
      case XOR:
        return ua.xor(ub);
      case SHL:
      case LSHR:
      case ASHR:
        if (ub.compareTo(BigInteger.valueOf(width)) >= 0) {
          return null;
        }
        int shift = ub.intValue();
        return switch (inst.opcode) {
          case SHL -> ua.shiftLeft(shift);
          case LSHR -> ua.shiftRight(shift);
          default -> a.signedValue().shiftRight(shift);
        };
      default:
        throw new AssertionError(inst.opcode);
    }
  }
}
