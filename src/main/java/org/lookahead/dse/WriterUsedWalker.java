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

package org.lookahead.dse;

import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.LatticeValue;
import org.lookahead.analysis.MemoryObject;
import org.lookahead.analysis.PointerTarget;
import org.lookahead.analysis.ResourceModel;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Function;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.TypeLayout;
import org.lookahead.ir.Value;

/**
 * Decides whether anything may observe the bytes written by one writer (a store, a block set or
 * copy, a resolved resource read, or an allocation). Each path tracks which of the written bytes
 * have since been overwritten; a path ends without observing the write when they all have, or when
 * the written object's lifetime ends.
 */
final class WriterUsedWalker extends ForwardWalker<ByteCoverage> {
  private final AliasQuery alias;
  private final ResourceModel resources;
  private final TypeLayout layout;
  private final Set<InstructionRef> deadWriters;

  /** The bytes written. */
  private final Location target;

  /** The object written, if it is known. */
  private final @Nullable MemoryObject targetObject;

  /** The offset of the write in {@link #targetObject}, or INDETERMINATE. */
  private final long targetOffset;

  WriterUsedWalker(
      AliasQuery alias,
      ResourceModel resources,
      TypeLayout layout,
      Set<InstructionRef> deadWriters,
      Location target) {
    this.alias = alias;
    this.resources = resources;
    this.layout = layout;
    this.deadWriters = deadWriters;
    this.target = target;
    PointerTarget base = resolve(target.context(), target.pointer());
    this.targetObject = (base == null) ? null : base.object();
    this.targetOffset = (base == null) ? PointerTarget.INDETERMINATE : base.offset();
  }

  /** Returns true if the write may be observed. */
  boolean isUsed(InstructionRef writer) {
    return !walkFrom(writer.context(), writer.inst(), new ByteCoverage(target.size()));
  }

  @Override
  protected Step visit(Context c, Instruction inst, ByteCoverage covered) {
    if (isLifetimeEnd(c, inst)) {
      return Step.STOP_PATH;
    }
    switch (inst.opcode) {
      case STORE:
        if (inst.isVolatile() && mayAlias(c, inst.operand(1), Location.UNKNOWN_SIZE)) {
          return Step.STOP_WALK;
        }
        return write(c, inst.operand(1), layout.storeSize(inst.accessType()), covered);
      case MEMSET:
        return write(c, inst.operand(0), constantSize(c, inst.operand(2)), covered);
      case MEMCPY:
        {
          long size = constantSize(c, inst.operand(2));
          if (!deadWriters.contains(new InstructionRef(inst, c))) {
            // A block copy that is not dead reads its source
            Location source = new Location(inst.operand(1), c, size);
            if (alias.alias(source, target) != AliasResult.NO_ALIAS
                && !isCovered(source, covered)) {
              return Step.STOP_WALK;
            }
          }
          return write(c, inst.operand(0), size, covered);
        }
      case LOAD:
        {
          Location loaded =
              new Location(inst.operand(0), c, layout.storeSize(inst.accessType()));
          if (alias.alias(loaded, target) == AliasResult.NO_ALIAS) {
            return Step.CONTINUE;
          }
          return (!inst.isVolatile() && isCovered(loaded, covered))
              ? Step.CONTINUE
              : Step.STOP_WALK;
        }
      case CALL:
        return visitCall(c, inst, covered);
      default:
        return Step.CONTINUE;
    }
  }

  private Step visitCall(Context c, Instruction call, ByteCoverage covered) {
    ResourceModel.ResolvedRead read = resources.resolvedRead(call, c);
    if (read != null) {
      return write(c, read.buffer(), read.size(), covered);
    } else if (call.calledFunction() == null) {
      return Step.STOP_WALK;
    }
    boolean reads = alias.modRef(call, c, target).isRef();
    if (c.activeInlineAttempt(call) != null) {
      return reads ? Step.ENTER_CALL : Step.CONTINUE;
    }
    return reads ? Step.STOP_WALK : Step.CONTINUE;
  }

  /** Records the target bytes overwritten by a write of {@code size} bytes at {@code ptr}. */
  private Step write(Context c, Value ptr, long size, ByteCoverage covered) {
    if (size == Location.UNKNOWN_SIZE || !target.hasKnownSize()) {
      // Only the end of the object's lifetime can make a write of unknown size dead
      return Step.CONTINUE;
    }
    Location written = new Location(ptr, c, size);
    switch (alias.alias(written, target)) {
      case MUST_ALIAS:
        covered.cover(0, target.hasKnownSize() ? Math.min(size, target.size()) : size);
        break;
      case MAY_ALIAS:
        PointerTarget w = resolve(c, ptr);
        if (w != null && sameKnownObject(w)) {
          covered.cover(w.offset() - targetOffset, w.offset() + size - targetOffset);
        }
        break;
      default:
        break;
    }
    return covered.isComplete() ? Step.STOP_PATH : Step.CONTINUE;
  }

  /** True if every byte of {@code read} that lies within the target has been overwritten. */
  private boolean isCovered(Location read, ByteCoverage covered) {
    if (!read.hasKnownSize()) {
      return false;
    }
    PointerTarget r = resolve(read.context(), read.pointer());
    if (r == null || !sameKnownObject(r)) {
      return false;
    }
    long from = Math.max(r.offset() - targetOffset, 0);
    long to = r.offset() + read.size() - targetOffset;
    if (target.hasKnownSize()) {
      to = Math.min(to, target.size());
    }
    return covered.isCovered(from, to);
  }

  private boolean sameKnownObject(PointerTarget t) {
    return t.object().equals(targetObject)
        && t.hasKnownOffset()
        && targetOffset != PointerTarget.INDETERMINATE;
  }

  private boolean mayAlias(Context c, Value ptr, long size) {
    return alias.alias(new Location(ptr, c, size), target) != AliasResult.NO_ALIAS;
  }

  /**
   * True if {@code inst} ends the lifetime of the written object: a return from the function
   * instance that allocated it on the stack, or a deallocation of the heap object.
   */
  private boolean isLifetimeEnd(Context c, Instruction inst) {
    if (targetObject == null) {
      return false;
    } else if (targetObject.isStackAllocation()) {
      return inst.opcode == Opcode.RET
          && c.functionRoot() == targetObject.context().functionRoot();
    } else if (targetObject.isHeapAllocation() && inst.opcode == Opcode.CALL) {
      Function callee = inst.calledFunction();
      if (callee != null && callee.deallocates() && inst.numOperands() > 0) {
        PointerTarget freed = resolve(c, inst.operand(0));
        return freed != null && freed.object().equals(targetObject);
      }
    }
    return false;
  }

  /** Returns the single target of a pointer, or null if it does not have exactly one. */
  private static @Nullable PointerTarget resolve(Context c, Value ptr) {
    LatticeValue v = c.operandValue(ptr);
    return (v instanceof LatticeValue.PointerBase pb) ? pb.single() : null;
  }

  /** The value of a length operand, or UNKNOWN_SIZE if it is not a non-negative constant. */
  static long constantSize(Context c, Value length) {
    if (c.operandValue(length).constant() instanceof Constant.Int n
        && n.width() <= 64
        && n.longValue() >= 0) {
      return n.longValue();
    }
    return Location.UNKNOWN_SIZE;
  }

  @Override
  protected ByteCoverage copy(ByteCoverage state) {
    return state.copy();
  }

  @Override
  protected boolean subsumes(ByteCoverage earlier, ByteCoverage later) {
    return later.containsAll(earlier);
  }
}
