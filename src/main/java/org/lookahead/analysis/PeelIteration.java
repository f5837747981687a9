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

import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Block;
import org.lookahead.ir.Edge;
import org.lookahead.ir.Loop;

/** One hypothetical iteration of a loop. */
public final class PeelIteration extends Context {

  public enum Status {
    /** Not yet analyzed, or not reachable. */
    UNKNOWN,
    /** Control may continue to the next iteration. */
    NONFINAL,
    /** Control cannot continue to the next iteration. */
    FINAL
  }

  public final PeelAttempt attempt;

  /** 0 for the first iteration. */
  public final int iteration;

  PeelIteration(PeelAttempt attempt, int iteration) {
    super(attempt.parent.tree, attempt.parent, attempt.parent.function, attempt.loop);
    this.attempt = attempt;
    this.iteration = iteration;
    functionRoot().addToInstance(this);
  }

  public Loop loop() {
    return attempt.loop;
  }

  @Override
  public InlineAttempt functionRoot() {
    return parent.functionRoot();
  }

  @Override
  public Block entryBlock() {
    return attempt.loop.header;
  }

  /** The iteration before this one, or null if this is the first. */
  public @Nullable PeelIteration previous() {
    return iteration == 0 ? null : attempt.getIteration(iteration - 1);
  }

  /** The iteration after this one, or null if it has not been created. */
  public @Nullable PeelIteration next() {
    return attempt.getIteration(iteration + 1);
  }

  @Override
  boolean isEntryLive() {
    Loop loop = attempt.loop;
    if (iteration == 0) {
      return parent.isEdgeLive(loop.preheader(), loop.header);
    }
    return previous().isEdgeLive(loop.latch(), loop.header);
  }

  @Override
  boolean isAssumedNotTaken(Block from, Block to) {
    Edge edge = attempt.optimisticEdge;
    return edge != null && edge.from() == from && edge.to() == to;
  }

  public Status status() {
    if (!isBlockLive(entryBlock())) {
      return Status.UNKNOWN;
    }
    return isEdgeLive(attempt.loop.latch(), attempt.loop.header) ? Status.NONFINAL : Status.FINAL;
  }

  /** True if no edge leaving the loop is live in this iteration. */
  public boolean allExitEdgesDead() {
    for (Edge exit : attempt.loop.exitEdges()) {
      if (isEdgeLive(exit.from(), exit.to())) {
        return false;
      }
    }
    return true;
  }

  /**
   * True if this is a final iteration and no other iteration can leave the loop: either there is
   * no optimistic edge, or every earlier iteration has all of its exits dead.
   */
  public boolean isOnlyExitingIteration() {
    if (status() != Status.FINAL) {
      return false;
    }
    return attempt.optimisticEdge == null || attempt.noIterationExitsBefore(iteration);
  }

  @Override
  public String shortHeader() {
    return attempt.shortHeader() + " iteration " + iteration;
  }
}
