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

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Argument;
import org.lookahead.ir.Block;
import org.lookahead.ir.Edge;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Opcode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a fixed point of lattice values and block liveness over every context of a ContextTree,
 * in two phases:
 *
 * <ul>
 *   <li>In the OPTIMISTIC phase, UNKNOWN operands are assumed to take whatever value is most
 *       convenient: branches on UNKNOWN conditions take no edge, merges ignore UNKNOWN inputs, and
 *       each peel attempt's optimistic edge is assumed not taken.
 *   <li>In the FINALIZING phase those assumptions are withdrawn, and the propagation continues
 *       until no UNKNOWN value remains in a live block.
 * </ul>
 *
 * <p>A value is always replaced by its join with the newly computed value, so values only move up
 * the lattice and the Solver terminates. Instructions are processed in order of (context index,
 * position in reverse postorder), which tends to evaluate definitions before their uses.
 *
 * <p>Each run starts from scratch, so a Solver may be run again after contexts have been created,
 * enabled or disabled.
 */
public final class Solver {
  private static final Logger logger = LoggerFactory.getLogger(Solver.class);

  /** Notified of every value change; used by tests. */
  @VisibleForTesting
  interface Listener {
    void valueChanged(
        Context context, Instruction inst, LatticeValue before, LatticeValue after, Phase phase);
  }

  private record Entry(Context context, Instruction inst) {}

  private static final Comparator<Entry> ENTRY_ORDER =
      Comparator.<Entry>comparingInt(e -> e.context.index).thenComparingInt(e -> e.inst.order());

  private final ContextTree tree;
  private final Evaluator evaluator;
  private final PriorityQueue<Entry> queue = new PriorityQueue<>(ENTRY_ORDER);
  private Phase phase = Phase.OPTIMISTIC;
  private @Nullable Listener listener;
  private int evaluations;

  public Solver(ContextTree tree, ResourceModel resources) {
    this.tree = tree;
    this.evaluator =
        new Evaluator(tree.options, tree.root().function.module.layout, resources);
  }

  @VisibleForTesting
  void setListener(@Nullable Listener listener) {
    this.listener = listener;
  }

  /** The number of instruction evaluations done by the last run. */
  public int evaluations() {
    return evaluations;
  }

  /**
   * Computes values and liveness for every context, then marks dead each context that is not
   * reachable.
   */
  public void run() {
    evaluations = 0;
    runOptimistic();
    finalizeValues();
    for (Context c : tree.preorder()) {
      if (!c.isDead() && !c.isBlockLive(c.entryBlock())) {
        c.markUnreachable();
      }
    }
    logger.debug("Solved {} contexts with {} evaluations", tree.size(), evaluations);
  }

  /** Discards previous results and propagates under optimistic assumptions. */
  void runOptimistic() {
    setPhase(Phase.OPTIMISTIC);
    tree.contexts().forEach(Context::reset);
    refreshAll();
    drain();
  }

  /** Withdraws the optimistic assumptions and propagates until no live value is UNKNOWN. */
  void finalizeValues() {
    setPhase(Phase.FINALIZING);
    refreshAll();
    for (Context c : tree.preorder()) {
      forEachLiveInstruction(
          c,
          inst -> {
            if (inst.hasValue() && c.value(inst).isUnknown()) {
              enqueue(c, inst);
            }
          });
    }
    drain();
    // Anything still UNKNOWN depends only on other UNKNOWN values (e.g. a PHI that only feeds
    // itself); there is nothing more to learn about it.
    boolean forced = true;
    while (forced) {
      forced = false;
      for (Context c : tree.preorder()) {
        for (Block block : c.liveBlocks()) {
          for (Instruction inst : block.instructions()) {
            if (inst.hasValue() && c.value(inst).isUnknown()) {
              update(c, inst, LatticeValue.OVERDEF);
              forced = true;
            }
          }
        }
      }
      drain();
    }
  }

  private void setPhase(Phase phase) {
    this.phase = phase;
    tree.phase = phase;
    logger.debug("Starting {} phase", phase);
  }

  /** Recomputes the liveness of every context, parents before children. */
  private void refreshAll() {
    for (Context c : tree.preorder()) {
      if (c.recomputeLiveness()) {
        livenessChanged(c);
      }
    }
  }

  private void drain() {
    Entry e;
    while ((e = queue.poll()) != null) {
      Context c = e.context;
      Instruction inst = e.inst;
      c.queued[inst.id] = false;
      if (!c.isBlockLive(inst.block)) {
        continue;
      }
      evaluations++;
      switch (inst.opcode) {
        case COND_BR, SWITCH -> branchConditionChanged(c, inst);
        case RET -> returnValueChanged(c);
        case CALL -> argumentsChanged(c, inst);
        default -> {}
      }
      if (!inst.hasValue()) {
        continue;
      }
      LatticeValue before = c.value(inst);
      if (before.isOverdef()) {
        continue;
      }
      LatticeValue after = evaluator.evaluate(c, inst, phase);
      if (phase == Phase.FINALIZING && after.isUnknown()) {
        after = LatticeValue.OVERDEF;
      }
      update(c, inst, evaluator.joiner().join(before, after));
    }
  }

  private void update(Context c, Instruction inst, LatticeValue value) {
    LatticeValue before = c.value(inst);
    if (value.equals(before)) {
      return;
    }
    c.setValue(inst, value);
    logger.trace("{} in {}: {} -> {}", inst.asOperand(), c, before, value);
    if (listener != null) {
      listener.valueChanged(c, inst, before, value, phase);
    }
    enqueueInInstance(c.functionRoot(), inst.users());
  }

  /** Enqueues each instruction in every context of the instance that evaluates it. */
  private void enqueueInInstance(InlineAttempt root, Iterable<Instruction> instructions) {
    for (Context c : root.instance()) {
      for (Instruction inst : instructions) {
        if (c.covers(inst.block)) {
          enqueue(c, inst);
        }
      }
    }
  }

  private void enqueue(Context c, Instruction inst) {
    if (!c.queued[inst.id] && !c.isDead()) {
      c.queued[inst.id] = true;
      queue.add(new Entry(c, inst));
    }
  }

  private void enqueuePhis(Context c, Block block) {
    for (Instruction inst : block.instructions()) {
      if (inst.opcode != Opcode.PHI) {
        break;
      }
      enqueue(c, inst);
    }
  }

  private void forEachLiveInstruction(Context c, Consumer<Instruction> action) {
    for (Block block : c.liveBlocks()) {
      block.instructions().forEach(action);
    }
  }

  /**
   * A branch condition may have changed, so the live blocks of this context and of the contexts
   * whose entry depends on them may have changed, as may the PHIs in successor blocks.
   */
  private void branchConditionChanged(Context start, Instruction term) {
    ArrayDeque<Context> work = new ArrayDeque<>();
    work.add(start);
    while (!work.isEmpty()) {
      Context c = work.poll();
      boolean changed = c.recomputeLiveness();
      if (changed) {
        livenessChanged(c);
      }
      if (changed || c == start) {
        work.addAll(c.children());
        if (c instanceof PeelIteration it && it.next() != null) {
          work.add(it.next());
        }
      }
    }
    for (Block succ : term.successors()) {
      if (start.covers(succ)) {
        enqueuePhis(start, succ);
      }
    }
    enqueueExitReaders(start);
  }

  /** Everything evaluated in {@code c}, and everything outside it that reads its liveness. */
  private void livenessChanged(Context c) {
    logger.trace("Liveness of {} changed: {}", c, c.liveBlocks());
    forEachLiveInstruction(c, inst -> enqueue(c, inst));
    if (c instanceof InlineAttempt ia && ia.callSite != null) {
      enqueue(ia.parent, ia.callSite);
    }
    enqueueExitReaders(c);
  }

  /** Enqueues the PHIs outside a peel iteration that may read values along its loop's exits. */
  private void enqueueExitReaders(Context c) {
    if (c instanceof PeelIteration it) {
      for (Edge exit : it.loop().exitEdges()) {
        enqueuePhis(it.contextFor(exit.to()), exit.to());
      }
    }
  }

  /** The value returned by an inline attempt may have changed. */
  private void returnValueChanged(Context c) {
    InlineAttempt root = c.functionRoot();
    if (root.callSite != null) {
      enqueue(root.parent, root.callSite);
    }
  }

  /** The values of a call's arguments may have changed. */
  private void argumentsChanged(Context c, Instruction call) {
    InlineAttempt callee = c.activeInlineAttempt(call);
    if (callee == null) {
      return;
    }
    for (Argument arg : callee.function.arguments()) {
      enqueueInInstance(callee, arg.users());
    }
    if (callee.function.isVarArg) {
      // Loads through the variadic frame read the call's operands directly
      for (Context c2 : callee.instance()) {
        forEachLiveInstruction(
            c2,
            inst -> {
              if (inst.opcode == Opcode.LOAD) {
                enqueue(c2, inst);
              }
            });
      }
    }
  }
}
