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
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Argument;
import org.lookahead.ir.Block;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Function;
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Loop;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A hypothetical execution context: either an {@link InlineAttempt} (the body of a function as if
 * inlined at one call site) or a {@link PeelIteration} (one iteration of a loop as if peeled).
 *
 * <p>Each context <i>covers</i> a set of blocks: an InlineAttempt covers every block of its
 * function, a PeelIteration covers the blocks of its loop. Loops nested within a context's scope
 * are evaluated generically (one value per instruction for all iterations), and may additionally
 * be peeled by a child {@link PeelAttempt}.
 *
 * <p>A context holds the lattice value of each instruction it covers and the set of blocks that
 * are executable in it; both are computed by a {@link Solver}.
 */
public abstract class Context {
  private static final Logger logger = LoggerFactory.getLogger(Context.class);

  public final ContextTree tree;

  /** This context's position in {@code tree}; never changes. */
  public final int index;

  public final Function function;

  /** The loop whose iteration this is, or null for an InlineAttempt. */
  public final @Nullable Loop scope;

  final @Nullable Context parent;

  private boolean enabled = true;

  /** Set by {@link #markDead}; kept across Solver runs. */
  private boolean killed;

  /** Set when a Solver run finds the context unreachable; cleared by {@link #reset}. */
  private boolean unreachable;

  private final Map<Instruction, InlineAttempt> inlineAttempts = new LinkedHashMap<>();
  private final Map<Loop, PeelAttempt> peelAttempts = new LinkedHashMap<>();

  /** Indexed by {@link Instruction#id}; null entries are UNKNOWN. */
  private final LatticeValue[] values;

  /** Used by the Solver to avoid queueing an instruction twice. */
  final boolean[] queued;

  private BitSet liveBlocks = new BitSet();

  Context(ContextTree tree, @Nullable Context parent, Function function, @Nullable Loop scope) {
    Preconditions.checkArgument(function.isFinished(), "%s has no body", function);
    this.tree = tree;
    this.parent = parent;
    this.function = function;
    this.scope = scope;
    this.values = new LatticeValue[function.numInstructions()];
    this.queued = new boolean[function.numInstructions()];
    this.index = tree.register(this);
  }

  /** The enclosing context, or null if this is the root. */
  public @Nullable Context parent() {
    return parent;
  }

  /** The InlineAttempt for the function instance this context belongs to. */
  public abstract InlineAttempt functionRoot();

  /** The first block executed in this context. */
  public abstract Block entryBlock();

  /** A short description, e.g. {@code f @ %call} or {@code loop %header iteration 2}. */
  public abstract String shortHeader();

  /** True if instructions in {@code block} are evaluated in this context. */
  public boolean covers(Block block) {
    return block.function == function && (scope == null || scope.contains(block));
  }

  /**
   * Returns the loop nested immediately in this context's scope that contains {@code block}, or
   * null if block is not in such a loop.
   */
  public @Nullable Loop childLoopContaining(Block block) {
    Preconditions.checkArgument(covers(block));
    Loop result = null;
    for (Loop loop = block.loop(); loop != null && loop != scope; loop = loop.nestedIn()) {
      result = loop;
    }
    return result;
  }

  // Tree structure

  /** Returns the inline attempt for {@code call}, creating it if necessary. */
  public InlineAttempt getOrCreateInlineAttempt(Instruction call) {
    Preconditions.checkArgument(call.opcode == Opcode.CALL, "not a call: %s", call);
    Preconditions.checkArgument(covers(call.block), "%s is not in %s", call, this);
    Function callee = call.calledFunction();
    Preconditions.checkArgument(
        callee != null && !callee.isDeclaration(), "cannot inline %s", call.describe());
    InlineAttempt result = inlineAttempts.get(call);
    if (result == null) {
      result = new InlineAttempt(tree, this, call, callee);
      inlineAttempts.put(call, result);
      logger.debug("Created inline attempt {} for {}", result.index, result.shortHeader());
    }
    return result;
  }

  /** Returns the existing inline attempt for {@code call}, or null. */
  public @Nullable InlineAttempt inlineAttempt(Instruction call) {
    return inlineAttempts.get(call);
  }

  /**
   * Returns the existing inline attempt for {@code call} if it is enabled and not dead; only such
   * an attempt models the call.
   */
  public @Nullable InlineAttempt activeInlineAttempt(Instruction call) {
    InlineAttempt result = inlineAttempts.get(call);
    return (result != null && result.isEnabled() && !result.isDead()) ? result : null;
  }

  /** Returns the peel attempt for {@code loop}, creating it if necessary. */
  public PeelAttempt getOrCreatePeelAttempt(Loop loop) {
    Preconditions.checkArgument(
        loop.function() == function && loop.nestedIn() == scope,
        "%s is not immediately nested in %s",
        loop,
        this);
    Preconditions.checkArgument(
        loop.isSimplified(), "%s has no preheader or several latches", loop);
    PeelAttempt result = peelAttempts.get(loop);
    if (result == null) {
      result = new PeelAttempt(this, loop);
      peelAttempts.put(loop, result);
      logger.debug("Created peel attempt for {} in {}", loop, shortHeader());
    }
    return result;
  }

  /** Returns the existing peel attempt for {@code loop}, or null. */
  public @Nullable PeelAttempt peelAttempt(Loop loop) {
    return peelAttempts.get(loop);
  }

  public Collection<InlineAttempt> inlineAttempts() {
    return Collections.unmodifiableCollection(inlineAttempts.values());
  }

  public Collection<PeelAttempt> peelAttempts() {
    return Collections.unmodifiableCollection(peelAttempts.values());
  }

  /** The contexts directly below this one: inline attempts, then the iterations of each loop. */
  public ImmutableList<Context> children() {
    ImmutableList.Builder<Context> builder = ImmutableList.builder();
    builder.addAll(inlineAttempts.values());
    for (PeelAttempt pa : peelAttempts.values()) {
      builder.addAll(pa.iterations());
    }
    return builder.build();
  }

  /**
   * Returns the enabled peel attempt whose iterations replace the generic evaluation of the loop
   * containing {@code block}, or null if {@code block} is evaluated only generically here.
   */
  public @Nullable PeelAttempt expandingAttempt(Block block) {
    Loop child = childLoopContaining(block);
    if (child == null) {
      return null;
    }
    PeelAttempt pa = peelAttempts.get(child);
    return (pa != null && pa.isEnabled() && pa.isTerminated()) ? pa : null;
  }

  // Flags

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Includes or excludes this context from consideration. A disabled inline attempt is treated as
   * if it had not been created; its subtree is excluded from reported counts. Does not change
   * whether the context is dead.
   */
  public void setEnabled(boolean enabled) {
    Preconditions.checkState(enabled || canDisable(), "%s cannot be disabled", shortHeader());
    this.enabled = enabled;
  }

  public boolean canDisable() {
    return parent != null;
  }

  /** True if this context and every context and peel attempt above it are enabled. */
  public boolean isEffectivelyEnabled() {
    for (Context c = this; c != null; c = c.parent) {
      if (!c.enabled || (c instanceof PeelIteration it && !it.attempt.isEnabled())) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if this context was marked dead, or if the last Solver run found that it cannot be
   * reached.
   */
  public boolean isDead() {
    return killed || unreachable;
  }

  /** Marks this context and all of its descendants dead, for this and every later run. */
  public void markDead() {
    markSubtree(true);
  }

  /** Marks this context and all of its descendants unreachable until the next run. */
  void markUnreachable() {
    markSubtree(false);
  }

  private void markSubtree(boolean permanently) {
    ArrayDeque<Context> work = new ArrayDeque<>();
    work.push(this);
    while (!work.isEmpty()) {
      Context c = work.pop();
      if (!c.isDead()) {
        logger.debug("Context {} is dead", c.shortHeader());
      }
      if (permanently) {
        c.killed = true;
      } else {
        c.unreachable = true;
      }
      c.liveBlocks = new BitSet();
      c.children().forEach(work::push);
    }
  }

  // Values

  /** The lattice value of {@code inst} in this context; UNKNOWN if it has not been computed. */
  public LatticeValue value(Instruction inst) {
    Preconditions.checkArgument(inst.function() == function);
    LatticeValue v = values[inst.id];
    return v == null ? LatticeValue.UNKNOWN : v;
  }

  void setValue(Instruction inst, LatticeValue value) {
    values[inst.id] = value;
  }

  /**
   * Discards all computed values and liveness, and forgets whether the previous run found this
   * context unreachable; called at the start of each Solver run.
   */
  void reset() {
    Arrays.fill(values, null);
    Arrays.fill(queued, false);
    liveBlocks = new BitSet();
    unreachable = false;
  }

  /**
   * Returns the context whose value for {@code def} is seen by instructions in this context: the
   * nearest context (starting with this one) whose scope contains the defining block.
   */
  public Context ownerOf(Instruction def) {
    Preconditions.checkArgument(def.function() == function);
    Context c = this;
    while (!c.covers(def.block)) {
      c = c.parent;
    }
    return c;
  }

  /**
   * Returns the context that covers {@code block}, starting with this one and moving out through
   * enclosing peel iterations of the same function.
   */
  public Context contextFor(Block block) {
    return ownerOf(block.instructions().get(0));
  }

  /** Returns the lattice value of an operand as seen from this context. */
  public LatticeValue operandValue(Value operand) {
    Context c = this;
    Value v = operand;
    // Arguments are replaced by the corresponding actual argument in the caller, as many times as
    // necessary.
    while (v instanceof Argument arg) {
      InlineAttempt root = c.functionRoot();
      if (root.callSite == null) {
        return LatticeValue.OVERDEF;
      }
      v = root.callSite.operand(arg.index);
      c = root.parent;
    }
    if (v instanceof Constant constant) {
      return LatticeValue.scalar(constant);
    } else if (v instanceof GlobalVariable || v instanceof Function) {
      return LatticeValue.pointer(MemoryObject.global(v), 0);
    } else if (v instanceof Instruction def) {
      return c.ownerOf(def).value(def);
    }
    throw new AssertionError("Unexpected operand " + v);
  }

  // Liveness

  /** True if {@code block} may be executed in this context. */
  public boolean isBlockLive(Block block) {
    return covers(block) && liveBlocks.get(block.index);
  }

  /** True if control may flow from {@code from} (which must be covered) to {@code to}. */
  public boolean isEdgeLive(Block from, Block to) {
    return liveBlocks.get(from.index) && terminatorAllows(from, to, tree.phase);
  }

  /** True if control may enter this context. */
  abstract boolean isEntryLive();

  /** True if the edge is assumed not taken during the optimistic phase. */
  boolean isAssumedNotTaken(Block from, Block to) {
    return false;
  }

  /**
   * Recomputes the executable blocks from the entry state and the current branch conditions.
   * Returns true if they changed.
   */
  boolean recomputeLiveness() {
    BitSet live = new BitSet();
    if (!isDead() && isEntryLive()) {
      Block entry = entryBlock();
      for (Block block : function.reversePostorder()) {
        if (!covers(block)) {
          continue;
        } else if (block == entry) {
          live.set(block.index);
          continue;
        }
        // Reverse postorder ensures that predecessors other than latches have been visited.
        for (Block pred : block.predecessors()) {
          if (covers(pred) && live.get(pred.index) && terminatorAllows(pred, block, tree.phase)) {
            live.set(block.index);
            break;
          }
        }
      }
    }
    boolean changed = !live.equals(liveBlocks);
    liveBlocks = live;
    return changed;
  }

  private boolean terminatorAllows(Block from, Block to, Phase phase) {
    if (phase == Phase.OPTIMISTIC && isAssumedNotTaken(from, to)) {
      return false;
    }
    Instruction term = from.terminator();
    List<Block> succs = term.successors();
    switch (term.opcode) {
      case BR:
        return true;
      case COND_BR:
        {
          LatticeValue cond = operandValue(term.operand(0));
          if (cond.isUnknown()) {
            return phase == Phase.FINALIZING;
          } else if (cond.constant() instanceof Constant.Int c) {
            return succs.get(c.isZero() ? 1 : 0) == to;
          }
          return true;
        }
      case SWITCH:
        {
          LatticeValue cond = operandValue(term.operand(0));
          if (cond.isUnknown()) {
            return phase == Phase.FINALIZING;
          } else if (cond.constant() instanceof Constant.Int c) {
            int i = term.caseValues().indexOf(c);
            return succs.get(i + 1) == to;
          }
          return true;
        }
      default:
        return false;
    }
  }

  /** The blocks currently live in this context, in reverse postorder. */
  public List<Block> liveBlocks() {
    List<Block> result = new ArrayList<>();
    for (Block block : function.reversePostorder()) {
      if (liveBlocks.get(block.index)) {
        result.add(block);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return shortHeader() + "#" + index;
  }
}
