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

import org.jspecify.annotations.Nullable;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.LatticeValue;
import org.lookahead.analysis.PointerTarget;
import org.lookahead.ir.Function;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Value;

/**
 * Answers alias questions using the lattice values computed for each location's context: two
 * Pointer-Base values alias only if some pair of their targets overlaps. Questions the lattice
 * cannot answer are passed to a fallback.
 */
public final class HypotheticalAliasQuery implements AliasQuery {
  private final AliasQuery fallback;

  public HypotheticalAliasQuery(AliasQuery fallback) {
    this.fallback = fallback;
  }

  public HypotheticalAliasQuery() {
    this(AliasQuery.CONSERVATIVE);
  }

  @Override
  public AliasResult alias(Location a, Location b) {
    LatticeValue va = a.context().operandValue(a.pointer());
    LatticeValue vb = b.context().operandValue(b.pointer());
    if (!(va instanceof LatticeValue.PointerBase pa && vb instanceof LatticeValue.PointerBase pb)) {
      return fallback.alias(a, b);
    }
    boolean allDisjoint = true;
    AliasResult last = AliasResult.MAY_ALIAS;
    for (PointerTarget ta : pa.targets) {
      for (PointerTarget tb : pb.targets) {
        AliasResult r = aliasTargets(ta, a.size(), tb, b.size());
        if (r == null) {
          return fallback.alias(a, b);
        }
        allDisjoint &= (r == AliasResult.NO_ALIAS);
        last = r;
      }
    }
    if (allDisjoint) {
      return AliasResult.NO_ALIAS;
    } else if (pa.targets.size() == 1 && pb.targets.size() == 1) {
      return last;
    }
    return AliasResult.MAY_ALIAS;
  }

  /**
   * Compares two targets; returns null if the lattice cannot tell (different objects, at least one
   * of which is not identified).
   */
  private static @Nullable AliasResult aliasTargets(
      PointerTarget ta, long sizeA, PointerTarget tb, long sizeB) {
    if (!ta.object().equals(tb.object())) {
      return (ta.object().isIdentified() && tb.object().isIdentified())
          ? AliasResult.NO_ALIAS
          : null;
    } else if (!ta.hasKnownOffset() || !tb.hasKnownOffset()) {
      return AliasResult.MAY_ALIAS;
    }
    long oa = ta.offset();
    long ob = tb.offset();
    if (oa == ob && sizeA == sizeB && sizeA != Location.UNKNOWN_SIZE) {
      return AliasResult.MUST_ALIAS;
    } else if ((sizeA != Location.UNKNOWN_SIZE && oa + sizeA <= ob)
        || (sizeB != Location.UNKNOWN_SIZE && ob + sizeB <= oa)) {
      return AliasResult.NO_ALIAS;
    }
    return AliasResult.MAY_ALIAS;
  }

  @Override
  public ModRef modRef(Instruction call, Context context, Location location) {
    Function callee = call.calledFunction();
    if (callee == null) {
      return fallback.modRef(call, context, location);
    }
    switch (callee.memoryEffects()) {
      case NONE:
        return ModRef.NO_MOD_REF;
      case READ_ONLY:
        return ModRef.REF;
      case ARG_MEM_ONLY:
        for (Value arg : call.operands()) {
          if (arg.type().isPointer()
              && alias(new Location(arg, context, Location.UNKNOWN_SIZE), location)
                  != AliasResult.NO_ALIAS) {
            return ModRef.MOD_REF;
          }
        }
        return ModRef.NO_MOD_REF;
      default:
        return fallback.modRef(call, context, location);
    }
  }
}
