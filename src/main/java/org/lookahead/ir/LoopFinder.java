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

package org.lookahead.ir;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Computes reverse postorder, dominators and natural loops for a function whose blocks and
 * predecessors are complete. Irreducible control flow is rejected.
 */
final class LoopFinder {
  private final Function function;
  private final ImmutableList<Block> rpo;

  /** Indexed by block index; -1 for unreachable blocks and the entry. */
  private final int[] idom;

  LoopFinder(Function function) {
    this.function = function;
    this.rpo = computeReversePostorder();
    for (int i = 0; i < rpo.size(); i++) {
      rpo.get(i).setOrder(i);
    }
    this.idom = computeDominators();
  }

  ImmutableList<Block> reversePostorder() {
    return rpo;
  }

  private ImmutableList<Block> computeReversePostorder() {
    int n = function.blocks.size();
    BitSet visited = new BitSet(n);
    List<Block> postorder = new ArrayList<>();
    // Each stack entry is a block and the index of the next successor to visit.
    ArrayDeque<int[]> stack = new ArrayDeque<>();
    Block entry = function.entry();
    visited.set(entry.index);
    stack.push(new int[] {entry.index, 0});
    while (!stack.isEmpty()) {
      int[] top = stack.peek();
      Block block = function.blocks.get(top[0]);
      List<Block> succs = block.successors();
      if (top[1] < succs.size()) {
        Block succ = succs.get(top[1]++);
        if (!visited.get(succ.index)) {
          visited.set(succ.index);
          stack.push(new int[] {succ.index, 0});
        }
      } else {
        stack.pop();
        postorder.add(block);
      }
    }
    return ImmutableList.copyOf(postorder).reverse();
  }

  /** The iterative algorithm of Cooper, Harvey and Kennedy. */
  private int[] computeDominators() {
    int n = function.blocks.size();
    int[] result = new int[n];
    Arrays.fill(result, -1);
    Block entry = rpo.get(0);
    result[entry.index] = entry.index;
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = 1; i < rpo.size(); i++) {
        Block block = rpo.get(i);
        int newIdom = -1;
        for (Block pred : block.predecessors()) {
          if (result[pred.index] < 0) {
            continue;
          }
          newIdom = (newIdom < 0) ? pred.index : intersect(result, pred.index, newIdom);
        }
        if (newIdom != result[block.index]) {
          result[block.index] = newIdom;
          changed = true;
        }
      }
    }
    result[entry.index] = -1;
    return result;
  }

  private int intersect(int[] doms, int a, int b) {
    while (a != b) {
      while (order(a) > order(b)) {
        a = doms[a];
      }
      while (order(b) > order(a)) {
        b = doms[b];
      }
    }
    return a;
  }

  private int order(int blockIndex) {
    return function.blocks.get(blockIndex).order();
  }

  boolean dominates(Block a, Block b) {
    if (a.order() < 0 || b.order() < 0) {
      return false;
    }
    for (int i = b.index; i >= 0; i = idom[i]) {
      if (i == a.index) {
        return true;
      }
    }
    return false;
  }

  ImmutableList<Loop> findLoops() {
    // Collect the body and latches of each loop, keyed by header
    List<Block> headers = new ArrayList<>();
    List<BitSet> bodies = new ArrayList<>();
    List<List<Block>> latches = new ArrayList<>();
    for (Block block : rpo) {
      for (Block succ : block.successors()) {
        if (succ.order() <= block.order()) {
          if (!dominates(succ, block)) {
            throw new MalformedIrException(
                block.terminator(), "Irreducible control flow into %s", succ);
          }
          int i = headers.indexOf(succ);
          if (i < 0) {
            i = headers.size();
            headers.add(succ);
            bodies.add(new BitSet());
            latches.add(new ArrayList<>());
          }
          if (!latches.get(i).contains(block)) {
            latches.get(i).add(block);
          }
          addBody(succ, block, bodies.get(i));
        }
      }
    }
    // Outer loops have strictly larger bodies than the loops nested in them.
    List<Integer> sorted = new ArrayList<>();
    for (int i = 0; i < headers.size(); i++) {
      sorted.add(i);
    }
    sorted.sort(
        Comparator.<Integer>comparingInt(i -> -bodies.get(i).cardinality())
            .thenComparingInt(i -> headers.get(i).order()));
    List<Loop> loops = new ArrayList<>();
    for (int i : sorted) {
      Block header = headers.get(i);
      BitSet body = bodies.get(i);
      Loop nestedIn = null;
      for (Loop candidate : loops) {
        if (candidate.contains(header)) {
          nestedIn = candidate;
        }
      }
      Loop loop =
          new Loop(
              loops.size(),
              header,
              nestedIn,
              body,
              ImmutableList.copyOf(latches.get(i)),
              findPreheader(header, body),
              findExits(body));
      if (nestedIn != null) {
        nestedIn.children.add(loop);
      }
      loops.add(loop);
    }
    // Since outer loops come first, the last loop containing a block is the innermost one.
    for (Loop loop : loops) {
      for (Block block : function.blocks) {
        if (loop.contains(block)) {
          block.setLoop(loop);
        }
      }
    }
    return ImmutableList.copyOf(loops);
  }

  private void addBody(Block header, Block latch, BitSet body) {
    body.set(header.index);
    ArrayDeque<Block> work = new ArrayDeque<>();
    if (!body.get(latch.index)) {
      body.set(latch.index);
      work.add(latch);
    }
    while (!work.isEmpty()) {
      Block block = work.poll();
      for (Block pred : block.predecessors()) {
        if (pred.order() >= 0 && !body.get(pred.index)) {
          body.set(pred.index);
          work.add(pred);
        }
      }
    }
  }

  private static @Nullable Block findPreheader(Block header, BitSet body) {
    Block result = null;
    for (Block pred : header.predecessors()) {
      if (pred.order() < 0 || body.get(pred.index)) {
        continue;
      } else if (result != null) {
        return null;
      }
      result = pred;
    }
    return (result != null && result.successors().size() == 1) ? result : null;
  }

  private ImmutableList<Edge> findExits(BitSet body) {
    ImmutableList.Builder<Edge> exits = ImmutableList.builder();
    for (Block block : rpo) {
      if (body.get(block.index)) {
        for (Block succ : block.successors()) {
          if (!body.get(succ.index)) {
            exits.add(new Edge(block, succ));
          }
        }
      }
    }
    return exits.build();
  }
}
