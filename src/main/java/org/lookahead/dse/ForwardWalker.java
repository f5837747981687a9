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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.InlineAttempt;
import org.lookahead.analysis.PeelAttempt;
import org.lookahead.analysis.PeelIteration;
import org.lookahead.ir.Block;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Loop;
import org.lookahead.ir.Opcode;

/**
 * Walks forward through the hypothetical execution graph from an instruction, following every
 * live path. Each path carries its own state of type {@code S}, which is copied where paths
 * diverge. The walk moves
 *
 * <ul>
 *   <li>into the inline attempt of a call, when {@link #visit} asks for it;
 *   <li>from a return back to the caller, just after the call site;
 *   <li>into the first iteration of a loop whose peel attempt is enabled and terminated;
 *   <li>from each iteration to the next, and out of a loop to the enclosing context.
 * </ul>
 *
 * <p>A block reached again in the same context with a state that {@link #subsumes} the state of an
 * earlier visit is not walked again.
 */
public abstract class ForwardWalker<S> {

  /** What to do after visiting an instruction. */
  public enum Step {
    CONTINUE,
    /** Walk the callee of this call (if it has an enabled inline attempt); otherwise CONTINUE. */
    ENTER_CALL,
    /** This path is finished; other paths continue. */
    STOP_PATH,
    /** The whole walk is finished. */
    STOP_WALK
  }

  private record Position<S>(Context context, Block block, int index, S state) {}

  private record VisitKey(Context context, Block block) {}

  private final ArrayDeque<Position<S>> work = new ArrayDeque<>();
  private final Map<VisitKey, List<S>> visits = new HashMap<>();
  private final Set<Context> traversed = new LinkedHashSet<>();

  /** Called for each instruction on each path, including terminators. May update {@code state}. */
  protected abstract Step visit(Context context, Instruction inst, S state);

  protected abstract S copy(S state);

  /**
   * True if walking a block with state {@code later} cannot find anything that walking it with
   * {@code earlier} did not.
   */
  protected abstract boolean subsumes(S earlier, S later);

  /** Called when a path returns from the root of the tree. */
  protected Step reachedProgramExit(S state) {
    return Step.STOP_WALK;
  }

  /**
   * Walks every path that starts just after {@code start} in {@code context}. Returns false if the
   * walk was ended by {@link Step#STOP_WALK}, true if every path ended some other way.
   */
  public final boolean walkFrom(Context context, Instruction start, S initial) {
    work.clear();
    visits.clear();
    traversed.clear();
    work.push(new Position<>(context, start.block, start.block.indexOf(start) + 1, initial));
    while (!work.isEmpty()) {
      if (!walk(work.pop())) {
        work.clear();
        return false;
      }
    }
    return true;
  }

  /** The contexts in which the last walk visited at least one instruction. */
  public final ImmutableSet<Context> traversedContexts() {
    return ImmutableSet.copyOf(traversed);
  }

  /** Walks the rest of one block; returns false if the whole walk should stop. */
  private boolean walk(Position<S> p) {
    Context c = p.context();
    S state = p.state();
    List<Instruction> instructions = p.block().instructions();
    for (int i = p.index(); i < instructions.size(); i++) {
      Instruction inst = instructions.get(i);
      traversed.add(c);
      Step step = visit(c, inst, state);
      if (step == Step.STOP_WALK) {
        return false;
      } else if (step == Step.STOP_PATH) {
        return true;
      } else if (step == Step.ENTER_CALL && inst.opcode == Opcode.CALL) {
        InlineAttempt callee = c.activeInlineAttempt(inst);
        if (callee != null) {
          enter(callee, null, callee.entryBlock(), state);
          return true;
        }
      }
      if (inst.isTerminator()) {
        return leave(c, p.block(), inst, state);
      }
    }
    return true;
  }

  private boolean leave(Context c, Block block, Instruction term, S state) {
    if (term.opcode == Opcode.RET) {
      InlineAttempt root = c.functionRoot();
      Instruction call = root.callSite;
      if (call == null) {
        return reachedProgramExit(state) != Step.STOP_WALK;
      }
      Context caller = Objects.requireNonNull(root.parent());
      work.push(new Position<>(caller, call.block, call.block.indexOf(call) + 1, state));
      return true;
    }
    List<Block> live = new ArrayList<>();
    for (Block succ : term.successors()) {
      if (!live.contains(succ) && c.isEdgeLive(block, succ)) {
        live.add(succ);
      }
    }
    for (int i = 0; i < live.size(); i++) {
      // The last successor can reuse the state
      S s = (i == live.size() - 1) ? state : copy(state);
      follow(c, block, live.get(i), s);
    }
    return true;
  }

  /** Finds the context in which the edge {@code from -> to} arrives, and walks from there. */
  private void follow(Context c, Block from, Block to, S state) {
    Context target;
    if (c instanceof PeelIteration it && to == it.entryBlock()) {
      // The back edge: continue with the next iteration if there is one, or generically
      PeelIteration next = it.next();
      target = (next != null) ? next : Objects.requireNonNull(it.parent());
    } else if (!c.covers(to)) {
      target = c.contextFor(to);
    } else {
      target = c;
    }
    enter(target, from, to, state);
  }

  private void enter(Context target, @Nullable Block from, Block to, S state) {
    Loop child = target.childLoopContaining(to);
    if (child != null && child.header == to && (from == null || !child.contains(from))) {
      PeelAttempt pa = target.expandingAttempt(to);
      if (pa != null) {
        target = pa.iterations().get(0);
      }
    }
    if (!target.isBlockLive(to)) {
      return;
    }
    List<S> seen = visits.computeIfAbsent(new VisitKey(target, to), k -> new ArrayList<>());
    for (S earlier : seen) {
      if (subsumes(earlier, state)) {
        return;
      }
    }
    seen.add(copy(state));
    work.push(new Position<>(target, to, 0, state));
  }
}
