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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.lookahead.ir.Block;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Function;
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Loop;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.TypeLayout;
import org.lookahead.ir.Value;

/**
 * Computes the lattice value of one instruction in one context from the current values of its
 * operands. Evaluation never changes any state; the Solver decides what to do with the result.
 *
 * <p>PHI, SELECT, CALL, LOAD, ALLOCA and the variadic-frame instructions have their own rules.
 * Every other instruction is evaluated once for each combination of its operands' members (so a
 * Pointer-Base with several targets is evaluated one target at a time) by trying the {@link
 * Folder}s registered for its opcode, and the results are joined.
 */
final class Evaluator {
  private final LatticeValue.Joiner joiner;
  private final ResourceModel resources;
  private final int maxCombinations;
  private final Map<Opcode, ImmutableList<Folder>> folders = new EnumMap<>(Opcode.class);

  Evaluator(AnalysisOptions options, TypeLayout layout, ResourceModel resources) {
    this.joiner = new LatticeValue.Joiner(options.maxPointerTargets);
    this.resources = resources;
    this.maxCombinations = options.maxPointerTargets * options.maxPointerTargets;
    ImmutableList<Folder> casts =
        ImmutableList.of(new CastFolder(layout), ConstantFolder.INSTANCE);
    for (Opcode op : Opcode.values()) {
      if (op.isCast()) {
        folders.put(op, casts);
      }
    }
    folders.put(
        Opcode.ICMP,
        ImmutableList.of(
            ComparisonFolders.RESOURCE,
            ComparisonFolders.POINTER,
            ComparisonFolders.EXTREMAL,
            ConstantFolder.INSTANCE));
    folders.put(Opcode.GEP, ImmutableList.of(new AddressFolder(layout)));
    PointerArithmeticFolder pointerArithmetic = new PointerArithmeticFolder(options);
    ImmutableList<Folder> addSub = ImmutableList.of(pointerArithmetic, ConstantFolder.INSTANCE);
    folders.put(Opcode.ADD, addSub);
    folders.put(Opcode.SUB, addSub);
    folders.put(
        Opcode.AND,
        ImmutableList.of(
            pointerArithmetic, BitwiseIdentityFolder.INSTANCE, ConstantFolder.INSTANCE));
    folders.put(
        Opcode.OR, ImmutableList.of(BitwiseIdentityFolder.INSTANCE, ConstantFolder.INSTANCE));
  }

  LatticeValue.Joiner joiner() {
    return joiner;
  }

  /** Returns the value of {@code inst} in {@code context}, given the current operand values. */
  LatticeValue evaluate(Context context, Instruction inst, Phase phase) {
    Preconditions.checkArgument(inst.hasValue() && context.covers(inst.block));
    return switch (inst.opcode) {
      case ALLOCA -> LatticeValue.pointer(new MemoryObject(inst, context), 0);
      case PHI -> evaluatePhi(context, inst, phase);
      case SELECT -> evaluateSelect(context, inst, phase);
      case CALL -> evaluateCall(context, inst, phase);
      case LOAD -> evaluateLoad(context, inst);
      case VA_REG_AREA -> evaluateVarArgArea(context.functionRoot(), true);
      case VA_OVERFLOW_AREA -> evaluateVarArgArea(context.functionRoot(), false);
      default -> evaluateByFolding(context, inst, phase);
    };
  }

  /**
   * Combines the values that may flow into one instruction. In the optimistic phase UNKNOWN inputs
   * are ignored (they may never arrive); once finalizing, any UNKNOWN input makes the result
   * OVERDEF.
   */
  LatticeValue merge(Iterable<LatticeValue> values, Phase phase) {
    LatticeValue result = LatticeValue.UNKNOWN;
    for (LatticeValue v : values) {
      if (v.isUnknown()) {
        if (phase == Phase.FINALIZING) {
          return LatticeValue.OVERDEF;
        }
        continue;
      }
      result = joiner.join(result, v);
      if (result.isOverdef()) {
        break;
      }
    }
    return result;
  }

  private LatticeValue evaluatePhi(Context context, Instruction phi, Phase phase) {
    if (context instanceof PeelIteration iteration && phi.block == iteration.entryBlock()) {
      // A header PHI takes its value from the preheader in the first iteration, and from the
      // previous iteration's latch in each later one.
      Loop loop = iteration.loop();
      if (iteration.iteration == 0) {
        return context.operandValue(incomingFor(phi, loop.preheader()));
      }
      return iteration.previous().operandValue(incomingFor(phi, loop.latch()));
    }
    List<LatticeValue> incoming = new ArrayList<>();
    for (int i = 0; i < phi.numIncoming(); i++) {
      collectIncoming(context, phi.incomingValue(i), phi.incomingBlock(i), phi.block, incoming);
    }
    return merge(incoming, phase);
  }

  private static Value incomingFor(Instruction phi, Block pred) {
    Value v = phi.incomingValueFor(pred);
    Preconditions.checkState(v != null, "%s has no value for %s", phi, pred);
    return v;
  }

  /**
   * Adds the values of {@code v} that flow along the edge {@code pred -> block}. If the edge leaves
   * a loop that has a complete, enabled set of peel iterations, each iteration in which the edge is
   * live contributes its own value instead of the generic one.
   */
  private static void collectIncoming(
      Context context, Value v, Block pred, Block block, List<LatticeValue> out) {
    ArrayDeque<Context> work = new ArrayDeque<>();
    work.push(context);
    while (!work.isEmpty()) {
      Context c = work.pop();
      if (!c.isEdgeLive(pred, block)) {
        continue;
      }
      Loop child = c.childLoopContaining(pred);
      if (child != null && !child.contains(block)) {
        PeelAttempt pa = c.peelAttempt(child);
        if (pa != null && pa.isEnabled() && pa.isTerminated()) {
          pa.iterations().forEach(work::push);
          continue;
        }
      }
      out.add(c.operandValue(v));
    }
  }

  private LatticeValue evaluateSelect(Context context, Instruction inst, Phase phase) {
    LatticeValue cond = context.operandValue(inst.operand(0));
    if (cond.constant() instanceof Constant.Int c) {
      return context.operandValue(inst.operand(c.isZero() ? 2 : 1));
    }
    return merge(
        List.of(context.operandValue(inst.operand(1)), context.operandValue(inst.operand(2))),
        phase);
  }

  private LatticeValue evaluateCall(Context context, Instruction call, Phase phase) {
    InlineAttempt callee = context.activeInlineAttempt(call);
    if (callee != null) {
      List<LatticeValue> returned = new ArrayList<>();
      for (Block block : callee.function.blocks()) {
        Instruction term = block.terminator();
        if (term.opcode == Opcode.RET && callee.isBlockLive(block)) {
          returned.add(callee.operandValue(term.operand(0)));
        }
      }
      return merge(returned, phase);
    }
    Function f = call.calledFunction();
    if (f != null && f.returnsNoAlias()) {
      return LatticeValue.pointer(new MemoryObject(call, context), 0);
    } else if (resources.isSuccessfulOpen(call, context)) {
      return LatticeValue.resource(new ResourceHandle(call, context));
    }
    return LatticeValue.OVERDEF;
  }

  private LatticeValue evaluateLoad(Context context, Instruction load) {
    if (load.isVolatile()) {
      return LatticeValue.OVERDEF;
    }
    LatticeValue ptr = context.operandValue(load.operand(0));
    if (ptr.isUnknown()) {
      return LatticeValue.UNKNOWN;
    } else if (ptr instanceof LatticeValue.PointerBase pb) {
      LatticeValue result = LatticeValue.UNKNOWN;
      for (PointerTarget target : pb.targets) {
        LatticeValue v = loadConstant(target, load);
        result = joiner.join(result, v);
        if (result.isOverdef()) {
          break;
        }
      }
      return result;
    } else if (ptr instanceof LatticeValue.VarArg va) {
      return loadVarArg(va.slot, load);
    }
    return LatticeValue.OVERDEF;
  }

  /** Loads from the start of a constant global read the global's initializer. */
  private static LatticeValue loadConstant(PointerTarget target, Instruction load) {
    if (target.offset() == 0
        && target.object().value() instanceof GlobalVariable g
        && g.isConstant
        && g.initializer != null
        && g.initializer.type().equals(load.type())) {
      return LatticeValue.scalar(g.initializer);
    }
    return LatticeValue.OVERDEF;
  }

  /** Loads through a variadic-frame pointer read the actual argument at the call site. */
  private static LatticeValue loadVarArg(VarArgSlot slot, Instruction load) {
    VarArgFrame frame = slot.frame().varArgFrame();
    int position =
        (slot.kind() == VarArgSlot.Kind.REGISTER_AREA)
            ? frame.argumentAtRegisterOffset(0)
            : slot.position();
    if (position < 0 || position >= frame.numArguments()) {
      return LatticeValue.OVERDEF;
    }
    Value actual = frame.argument(position);
    if (!actual.type().equals(load.type())) {
      return LatticeValue.OVERDEF;
    }
    return frame.callerContext().operandValue(actual);
  }

  private static LatticeValue evaluateVarArgArea(InlineAttempt frame, boolean registerArea) {
    if (frame.callSite == null) {
      return LatticeValue.OVERDEF;
    } else if (registerArea) {
      return LatticeValue.varArg(VarArgSlot.registerArea(frame));
    }
    int first = frame.varArgFrame().firstSpilled();
    return (first < 0)
        ? LatticeValue.OVERDEF
        : LatticeValue.varArg(VarArgSlot.argument(frame, first));
  }

  private LatticeValue evaluateByFolding(Context context, Instruction inst, Phase phase) {
    int n = inst.numOperands();
    List<ImmutableList<LatticeValue>> members = new ArrayList<>(n);
    long combinations = 1;
    for (Value operand : inst.operands()) {
      ImmutableList<LatticeValue> m = context.operandValue(operand).members();
      members.add(m);
      combinations *= m.size();
    }
    if (combinations > maxCombinations) {
      return LatticeValue.OVERDEF;
    }
    ImmutableList<Folder> chain =
        folders.getOrDefault(inst.opcode, ImmutableList.of(ConstantFolder.INSTANCE));
    LatticeValue[] ops = new LatticeValue[n];
    int[] cursor = new int[n];
    LatticeValue result = LatticeValue.UNKNOWN;
    boolean sawUnknown = false;
    while (true) {
      for (int i = 0; i < n; i++) {
        ops[i] = members.get(i).get(cursor[i]);
      }
      LatticeValue v = fold(chain, inst, ops, phase);
      if (v.isUnknown()) {
        sawUnknown = true;
      } else {
        result = joiner.join(result, v);
        if (result.isOverdef()) {
          return result;
        }
      }
      // Advance to the next combination
      int i = n - 1;
      while (i >= 0 && ++cursor[i] == members.get(i).size()) {
        cursor[i--] = 0;
      }
      if (i < 0) {
        break;
      }
    }
    return sawUnknown ? LatticeValue.UNKNOWN : result;
  }

  private static LatticeValue fold(
      ImmutableList<Folder> chain, Instruction inst, LatticeValue[] ops, Phase phase) {
    for (Folder folder : chain) {
      LatticeValue v = folder.fold(inst, ops, phase);
      if (v != null) {
        return v;
      }
    }
    throw new AssertionError("No folder applied to " + inst.describe());
  }
}
