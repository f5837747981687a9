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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Block;
import org.lookahead.ir.Edge;
import org.lookahead.ir.Loop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All of the hypothetical iterations of one loop within one context. Iterations are created on
 * demand, in order.
 */
public final class PeelAttempt {
  private static final Logger logger = LoggerFactory.getLogger(PeelAttempt.class);

  public final Context parent;
  public final Loop loop;

  /**
   * An edge in the loop that is assumed not to be taken during the optimistic phase, or null if
   * there is none.
   */
  public final @Nullable Edge optimisticEdge;

  /** No more than this many iterations will be created. */
  public final int maxIterations;

  private final List<PeelIteration> iterations = new ArrayList<>();
  private boolean enabled = true;

  PeelAttempt(Context parent, Loop loop) {
    this.parent = parent;
    this.loop = loop;
    this.optimisticEdge = parent.tree.options.optimisticEdge(loop);
    this.maxIterations = parent.tree.options.maxIterations(loop);
  }

  public List<PeelIteration> iterations() {
    return Collections.unmodifiableList(iterations);
  }

  public int numIterations() {
    return iterations.size();
  }

  /** Returns the iteration with the given index, or null if it has not been created. */
  public @Nullable PeelIteration getIteration(int i) {
    Preconditions.checkArgument(i >= 0);
    return i < iterations.size() ? iterations.get(i) : null;
  }

  /**
   * Returns the iteration with the given index, creating it if {@code i} is the number of existing
   * iterations. Returns null if {@code i} is beyond the iteration cap.
   */
  public @Nullable PeelIteration getOrCreateIteration(int i) {
    Preconditions.checkArgument(
        i <= iterations.size(), "iteration %s requested before iteration %s", i, iterations.size());
    if (i < iterations.size()) {
      return iterations.get(i);
    } else if (i >= maxIterations) {
      logger.debug("{}: iteration cap {} reached", this, maxIterations);
      return null;
    }
    PeelIteration result = new PeelIteration(this, i);
    iterations.add(result);
    return result;
  }

  /** Creates the next iteration, or returns null if the iteration cap has been reached. */
  public @Nullable PeelIteration nextIteration() {
    return getOrCreateIteration(iterations.size());
  }

  /**
   * True if the last iteration created does not continue around the loop, so that the iterations
   * account for every way of leaving the loop.
   */
  public boolean isTerminated() {
    if (iterations.isEmpty()) {
      return false;
    }
    PeelIteration last = iterations.get(iterations.size() - 1);
    return !last.isEdgeLive(loop.latch(), loop.header);
  }

  public boolean isEnabled() {
    return enabled;
  }

  /** Includes or excludes the iterations from consideration; see {@link Context#setEnabled}. */
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /** True if every iteration before {@code end} has all of its loop exits dead. */
  boolean noIterationExitsBefore(int end) {
    for (int i = 0; i < end; i++) {
      if (!iterations.get(i).allExitEdgesDead()) {
        return false;
      }
    }
    return true;
  }

  public String shortHeader() {
    Block header = loop.header;
    return "loop " + header.asOperand() + " in " + header.function.name();
  }

  @Override
  public String toString() {
    return shortHeader();
  }
}
