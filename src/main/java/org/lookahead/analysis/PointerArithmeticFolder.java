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
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Type;

/**
 * Integer arithmetic on pointers that have been cast to integers:
 *
 * <ul>
 *   <li>adding or subtracting an integer moves the pointer within its object;
 *   <li>subtracting two pointers into the same object gives the difference of their offsets;
 *   <li>masking a pointer with a constant smaller than its object's alignment gives the masked
 *       offset.
 * </ul>
 */
final class PointerArithmeticFolder implements Folder {
  private final AnalysisOptions options;

  PointerArithmeticFolder(AnalysisOptions options) {
    this.options = options;
  }

  @Override
  public @Nullable LatticeValue fold(Instruction inst, LatticeValue[] ops, Phase phase) {
    if (!(inst.type() instanceof Type.IntType resultType)) {
      return null;
    }
    PointerTarget left = target(ops[0]);
    PointerTarget right = target(ops[1]);
    if (left == null && right == null) {
      return null;
    }
    switch (inst.opcode) {
      case ADD:
        if (left == null || right == null) {
          return offsetBy(left != null ? left : right, left != null ? ops[1] : ops[0], 1, phase);
        }
        return null;
      case SUB:
        if (right == null) {
          return offsetBy(left, ops[1], -1, phase);
        } else if (left != null
            && left.object().equals(right.object())
            && left.hasKnownOffset()
            && right.hasKnownOffset()) {
          return LatticeValue.scalar(Constant.of(resultType, left.offset() - right.offset()));
        }
        return null;
      case AND:
        if (right == null
            && left.hasKnownOffset()
            && left.offset() >= 0
            && ops[1].constant() instanceof Constant.Int mask
            && BigInteger.valueOf(alignment(left.object())).compareTo(mask.unsignedValue()) > 0) {
          return LatticeValue.scalar(
              Constant.of(resultType, mask.unsignedValue().and(BigInteger.valueOf(left.offset()))));
        }
        return null;
      default:
        return null;
    }
  }

  private static LatticeValue offsetBy(
      PointerTarget target, LatticeValue delta, int sign, Phase phase) {
    if (delta.constant() instanceof Constant.Int k && k.width() <= 64) {
      return LatticeValue.pointer(target.plus(sign * k.longValue(), true));
    } else if (delta.isUnknown() && phase == Phase.OPTIMISTIC) {
      return LatticeValue.UNKNOWN;
    }
    return LatticeValue.pointer(target.plus(0, false));
  }

  /** The known alignment of the start of an object, in bytes. */
  private int alignment(MemoryObject object) {
    if (object.value() instanceof GlobalVariable g) {
      return g.alignment;
    } else if (object.isStackAllocation()) {
      return ((Instruction) object.value()).alignment();
    } else if (object.isHeapAllocation()) {
      return options.mallocAlignment;
    }
    return 1;
  }

  private static @Nullable PointerTarget target(LatticeValue v) {
    return (v instanceof LatticeValue.PointerBase pb) ? pb.single() : null;
  }
}
