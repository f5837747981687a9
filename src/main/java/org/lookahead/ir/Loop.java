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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A natural loop: a header block that dominates every block of the loop, and one or more back
 * edges from blocks in the loop to the header. Loops with the same header are merged.
 */
public final class Loop {
  /** This loop's position in {@code function().loops()}; outer loops precede inner ones. */
  public final int index;

  public final Block header;

  /** The loop that this loop is immediately nested in, or null if this is a top-level loop. */
  private final @Nullable Loop nestedIn;

  private final BitSet blocks;
  private final ImmutableList<Block> latches;
  private final @Nullable Block preheader;
  private final ImmutableList<Edge> exitEdges;
  final List<Loop> children = new ArrayList<>();

  Loop(
      int index,
      Block header,
      @Nullable Loop nestedIn,
      BitSet blocks,
      ImmutableList<Block> latches,
      @Nullable Block preheader,
      ImmutableList<Edge> exitEdges) {
    this.index = index;
    this.header = header;
    this.nestedIn = nestedIn;
    this.blocks = blocks;
    this.latches = latches;
    this.preheader = preheader;
    this.exitEdges = exitEdges;
  }

  public Function function() {
    return header.function;
  }

  public @Nullable Loop nestedIn() {
    return nestedIn;
  }

  /** The loops immediately nested in this one. */
  public List<Loop> children() {
    return Collections.unmodifiableList(children);
  }

  /** 1 for a top-level loop, 2 for a loop nested in a top-level loop, etc. */
  public int depth() {
    return nestedIn == null ? 1 : nestedIn.depth() + 1;
  }

  public boolean contains(Block block) {
    return block.function == header.function && blocks.get(block.index);
  }

  /** True if {@code other} is this loop or is nested (directly or indirectly) within it. */
  public boolean contains(Loop other) {
    for (Loop loop = other; loop != null; loop = loop.nestedIn) {
      if (loop == this) {
        return true;
      }
    }
    return false;
  }

  /** The blocks with a back edge to the header. */
  public ImmutableList<Block> latches() {
    return latches;
  }

  /** The unique latch, or null if there is more than one. */
  public @Nullable Block latch() {
    return latches.size() == 1 ? latches.get(0) : null;
  }

  /**
   * The unique block outside the loop that branches to the header, if it has no other successors;
   * null otherwise.
   */
  public @Nullable Block preheader() {
    return preheader;
  }

  /** True if this loop has a preheader and a single latch, as required for peeling. */
  public boolean isSimplified() {
    return preheader != null && latch() != null;
  }

  /** The edges from blocks in this loop to blocks outside it. */
  public ImmutableList<Edge> exitEdges() {
    return exitEdges;
  }

  public int numBlocks() {
    return blocks.cardinality();
  }

  @Override
  public String toString() {
    return "loop " + header.name;
  }
}
