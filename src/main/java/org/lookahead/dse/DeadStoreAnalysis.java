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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.ContextTree;
import org.lookahead.analysis.ResourceModel;
import org.lookahead.ir.Function;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.TypeLayout;
import org.lookahead.ir.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds writers whose effects are never observed in the hypothetical execution described by a
 * solved ContextTree. Block copies are tried first, latest first, since a dead copy no longer reads
 * its source; then stores, block sets and resolved resource reads; then allocations.
 */
public final class DeadStoreAnalysis {
  private static final Logger logger = LoggerFactory.getLogger(DeadStoreAnalysis.class);

  /** The outcome of one run. */
  public record Result(
      ImmutableSet<InstructionRef> deadWriters,
      ImmutableMap<InstructionRef, ImmutableSet<Context>> traversedContexts) {

    public boolean isDead(Instruction inst, Context context) {
      return deadWriters.contains(new InstructionRef(inst, context));
    }

    /** The dead writers whose walk passed through {@code context}. */
    public ImmutableList<InstructionRef> writersTraversing(Context context) {
      return traversedContexts.entrySet().stream()
          .filter(e -> e.getValue().contains(context))
          .map(Map.Entry::getKey)
          .collect(ImmutableList.toImmutableList());
    }
  }

  private final ContextTree tree;
  private final AliasQuery alias;
  private final ResourceModel resources;
  private final TypeLayout layout;

  private final Set<InstructionRef> deadWriters = new LinkedHashSet<>();
  private final Map<InstructionRef, ImmutableSet<Context>> traversed = new LinkedHashMap<>();
  private int candidates;

  public DeadStoreAnalysis(ContextTree tree, AliasQuery alias, ResourceModel resources) {
    this.tree = tree;
    this.alias = alias;
    this.resources = resources;
    this.layout = tree.root().function.module.layout;
  }

  /** Runs the analysis; the tree must have been solved. */
  public Result run() {
    deadWriters.clear();
    traversed.clear();
    candidates = 0;
    ImmutableList<InstructionRef> order = ProgramOrder.of(tree);
    for (InstructionRef ref : order.reverse()) {
      Instruction inst = ref.inst();
      if (inst.opcode == Opcode.MEMCPY) {
        long size = WriterUsedWalker.constantSize(ref.context(), inst.operand(2));
        tryKill(ref, inst.operand(0), size);
      }
    }
    for (InstructionRef ref : order) {
      Instruction inst = ref.inst();
      switch (inst.opcode) {
        case STORE -> {
          if (!inst.isVolatile()) {
            tryKill(ref, inst.operand(1), layout.storeSize(inst.accessType()));
          }
        }
        case MEMSET ->
            tryKill(
                ref,
                inst.operand(0),
                WriterUsedWalker.constantSize(ref.context(), inst.operand(2)));
        case CALL -> {
          ResourceModel.ResolvedRead read = resources.resolvedRead(inst, ref.context());
          if (read != null) {
            tryKill(ref, read.buffer(), read.size());
          }
        }
        default -> {}
      }
    }
    for (InstructionRef ref : order) {
      if (isAllocation(ref.inst())) {
        tryKill(ref, ref.inst(), Location.UNKNOWN_SIZE);
      }
    }
    logger.info("{} of {} writers are dead", deadWriters.size(), candidates);
    return new Result(ImmutableSet.copyOf(deadWriters), ImmutableMap.copyOf(traversed));
  }

  private void tryKill(InstructionRef writer, Value ptr, long size) {
    candidates++;
    Location target = new Location(ptr, writer.context(), size);
    WriterUsedWalker walker = new WriterUsedWalker(alias, resources, layout, deadWriters, target);
    if (walker.isUsed(writer)) {
      logger.debug("{} is used", writer);
      return;
    }
    logger.debug("{} is dead", writer);
    deadWriters.add(writer);
    traversed.put(writer, walker.traversedContexts());
  }

  private static boolean isAllocation(Instruction inst) {
    return switch (inst.opcode) {
      case ALLOCA -> true;
      case CALL -> {
        Function callee = inst.calledFunction();
        yield callee != null && callee.returnsNoAlias();
      }
      default -> false;
    };
  }
}
