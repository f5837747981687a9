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

package org.lookahead.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.ContextTree;
import org.lookahead.analysis.InlineAttempt;
import org.lookahead.analysis.LatticeValue;
import org.lookahead.analysis.PeelAttempt;
import org.lookahead.analysis.PeelIteration;
import org.lookahead.dse.DeadStoreAnalysis;
import org.lookahead.ir.Block;
import org.lookahead.ir.Instruction;

/**
 * Summarizes a solved ContextTree: how many instructions each context evaluates and how many of
 * them would be eliminated (unreachable, constant, resolved branches, inlined calls, and dead
 * writers). Also renders the tree as indented text or as a Graphviz DOT graph.
 */
public final class AnalysisReport {
  private final ContextTree tree;
  private final ImmutableMap<Context, ContextReport> reports;

  private AnalysisReport(ContextTree tree, ImmutableMap<Context, ContextReport> reports) {
    this.tree = tree;
    this.reports = reports;
  }

  public static AnalysisReport build(ContextTree tree, DeadStoreAnalysis.Result deadStores) {
    ImmutableMap.Builder<Context, ContextReport> builder = ImmutableMap.builder();
    for (Context c : tree.preorder()) {
      builder.put(c, count(c, deadStores));
    }
    return new AnalysisReport(tree, builder.buildOrThrow());
  }

  private static ContextReport count(Context c, DeadStoreAnalysis.Result deadStores) {
    int total = 0;
    int eliminated = 0;
    for (Block block : c.function.blocks()) {
      if (!c.covers(block) || c.expandingAttempt(block) != null) {
        continue;
      }
      boolean live = c.isBlockLive(block);
      for (Instruction inst : block.instructions()) {
        total++;
        if (!live || isEliminated(c, inst, deadStores)) {
          eliminated++;
        }
      }
    }
    return new ContextReport(c, total, eliminated);
  }

  private static boolean isEliminated(
      Context c, Instruction inst, DeadStoreAnalysis.Result deadStores) {
    if (inst.hasValue() && c.value(inst) instanceof LatticeValue.Scalar) {
      return true;
    }
    return switch (inst.opcode) {
      case CALL -> c.activeInlineAttempt(inst) != null || deadStores.isDead(inst, c);
      case COND_BR, SWITCH -> c.operandValue(inst.operand(0)) instanceof LatticeValue.Scalar;
      case STORE, MEMSET, MEMCPY, ALLOCA -> deadStores.isDead(inst, c);
      default -> false;
    };
  }

  public ContextReport forContext(Context c) {
    ContextReport result = reports.get(c);
    if (result == null) {
      throw new IllegalArgumentException("No report for " + c);
    }
    return result;
  }

  /** The reports for every context, in pre-order. */
  public ImmutableList<ContextReport> contexts() {
    return reports.values().asList();
  }

  /** The total instruction count over all effectively enabled, live contexts. */
  public int totalInstructions() {
    return enabledReports().stream().mapToInt(ContextReport::total).sum();
  }

  /** The eliminated instruction count over all effectively enabled, live contexts. */
  public int eliminatedInstructions() {
    return enabledReports().stream().mapToInt(ContextReport::eliminated).sum();
  }

  private List<ContextReport> enabledReports() {
    return reports.values().stream()
        .filter(r -> r.context().isEffectivelyEnabled() && !r.context().isDead())
        .toList();
  }

  /** Renders a lattice value. */
  public static String render(LatticeValue value) {
    return value.toString();
  }

  /** A context or peel attempt to be listed at the given depth. */
  private record Item(Object node, int depth) {}

  /**
   * Returns an indented listing of the tree: one line per context (with its counts) and per peel
   * attempt.
   */
  public String dumpText() {
    StringBuilder sb = new StringBuilder();
    ArrayDeque<Item> work = new ArrayDeque<>();
    work.push(new Item(tree.root(), 0));
    while (!work.isEmpty()) {
      Item item = work.pop();
      int depth = item.depth();
      if (item.node() instanceof PeelAttempt pa) {
        indent(sb, depth)
            .append(pa.shortHeader())
            .append(": ")
            .append(pa.numIterations())
            .append(pa.numIterations() == 1 ? " iteration" : " iterations")
            .append(pa.isTerminated() ? ", terminated" : "")
            .append(pa.isEnabled() ? "" : " [disabled]")
            .append('\n');
        continue;
      }
      Context c = (Context) item.node();
      ContextReport r = forContext(c);
      indent(sb, depth)
          .append(c.shortHeader())
          .append(" #")
          .append(c.index)
          .append(": ")
          .append(r.eliminated())
          .append('/')
          .append(r.total())
          .append(" eliminated");
      appendFlags(sb, c);
      sb.append('\n');
      List<Item> children = new ArrayList<>();
      for (InlineAttempt ia : c.inlineAttempts()) {
        children.add(new Item(ia, depth + 1));
      }
      for (PeelAttempt pa : c.peelAttempts()) {
        children.add(new Item(pa, depth + 1));
        for (PeelIteration it : pa.iterations()) {
          children.add(new Item(it, depth + 2));
        }
      }
      // Push in reverse so that children are listed in order
      for (int i = children.size() - 1; i >= 0; i--) {
        work.push(children.get(i));
      }
    }
    return sb.toString();
  }

  /** Returns the value of each live instruction with a result in {@code c}, one per line. */
  public static String dumpValues(Context c) {
    StringBuilder sb = new StringBuilder();
    for (Block block : c.liveBlocks()) {
      if (c.expandingAttempt(block) != null) {
        continue;
      }
      sb.append(block.asOperand()).append(":\n");
      for (Instruction inst : block.instructions()) {
        if (inst.hasValue()) {
          sb.append("  ").append(inst.asOperand()).append(" = ").append(render(c.value(inst)));
          sb.append('\n');
        }
      }
    }
    return sb.toString();
  }

  /** Returns a Graphviz graph with a node for each context and an edge to each child. */
  public String dumpDot() {
    StringBuilder sb = new StringBuilder("digraph contexts {\n  node [shape=box];\n");
    for (ContextReport r : reports.values()) {
      Context c = r.context();
      sb.append("  n")
          .append(c.index)
          .append(" [label=\"")
          .append(escape(c.shortHeader()))
          .append("\\n")
          .append(r.eliminated())
          .append('/')
          .append(r.total())
          .append('"');
      if (c.isDead()) {
        sb.append(", color=gray");
      }
      if (!c.isEffectivelyEnabled()) {
        sb.append(", style=dashed");
      }
      sb.append("];\n");
      for (Context child : c.children()) {
        sb.append("  n").append(c.index).append(" -> n").append(child.index).append(";\n");
      }
    }
    return sb.append("}\n").toString();
  }

  private static StringBuilder indent(StringBuilder sb, int depth) {
    return sb.append("  ".repeat(depth));
  }

  private static void appendFlags(StringBuilder sb, Context c) {
    if (!c.isEnabled()) {
      sb.append(" [disabled]");
    }
    if (c.isDead()) {
      sb.append(" [dead]");
    }
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
