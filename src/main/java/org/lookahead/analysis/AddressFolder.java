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

import org.lookahead.ir.Constant;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.MalformedIrException;
import org.lookahead.ir.Type;
import org.lookahead.ir.TypeLayout;

/**
 * Evaluates GEP instructions. A GEP on a Pointer-Base adds the byte offset computed from its
 * indices (or makes the offset indeterminate if an index is not constant). A GEP on a
 * variadic-frame pointer with a single byte index moves between argument slots.
 */
final class AddressFolder implements Folder {
  private final TypeLayout layout;

  AddressFolder(TypeLayout layout) {
    this.layout = layout;
  }

  @Override
  public LatticeValue fold(Instruction inst, LatticeValue[] ops, Phase phase) {
    LatticeValue base = ops[0];
    if (base instanceof LatticeValue.PointerBase pb) {
      return offsetFrom(pb.single(), inst, ops, phase);
    } else if (base instanceof LatticeValue.VarArg va) {
      return stepVarArg(va.slot, inst, ops);
    }
    return base.isUnknown() ? LatticeValue.UNKNOWN : LatticeValue.OVERDEF;
  }

  private LatticeValue offsetFrom(
      PointerTarget target, Instruction inst, LatticeValue[] ops, Phase phase) {
    Type current = inst.sourceElementType();
    long offset = 0;
    for (int i = 1; i < ops.length; i++) {
      if (!(ops[i].constant() instanceof Constant.Int index) || index.width() > 64) {
        if (ops[i].isUnknown() && phase == Phase.OPTIMISTIC) {
          return LatticeValue.UNKNOWN;
        }
        return LatticeValue.pointer(target.plus(0, false));
      }
      long n = index.longValue();
      if (i == 1) {
        offset += n * layout.allocSize(current);
      } else if (current instanceof Type.StructType struct) {
        offset += layout.fieldOffset(struct, (int) n);
        current = struct.fields.get((int) n);
      } else if (current instanceof Type.ArrayType array) {
        current = array.element;
        offset += n * layout.allocSize(current);
      } else {
        throw new MalformedIrException(inst, "Cannot index into %s", current);
      }
    }
    return LatticeValue.pointer(target.plus(offset, true));
  }

  private LatticeValue stepVarArg(VarArgSlot slot, Instruction inst, LatticeValue[] ops) {
    if (ops.length != 2) {
      return LatticeValue.OVERDEF;
    }
    LatticeValue index = ops[1];
    if (index.isUnknown()) {
      return LatticeValue.UNKNOWN;
    }
    if (!(index.constant() instanceof Constant.Int k) || k.width() > 64) {
      return LatticeValue.OVERDEF;
    }
    long bytes = k.longValue() * layout.allocSize(inst.sourceElementType());
    VarArgFrame frame = slot.frame().varArgFrame();
    int next;
    if (slot.kind() == VarArgSlot.Kind.REGISTER_AREA) {
      next = frame.argumentAtRegisterOffset(bytes);
    } else if (bytes == 0) {
      return LatticeValue.varArg(slot);
    } else if (bytes == VarArgFrame.SLOT_SIZE) {
      next = frame.nextSpilledAfter(slot.position());
    } else {
      next = -1;
    }
    return (next < 0)
        ? LatticeValue.OVERDEF
        : LatticeValue.varArg(VarArgSlot.argument(slot.frame(), next));
  }
}
