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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.lookahead.ir.Function;

/**
 * The arena that owns every Context of one analysis. Contexts are numbered in creation order and
 * never removed; each has a direct reference to its parent, and its children are reachable
 * through {@link Context#children}.
 */
public final class ContextTree {
  public final AnalysisOptions options;
  private final List<Context> contexts = new ArrayList<>();
  private final InlineAttempt root;

  /** The phase of the most recent (or current) Solver run; determines branch liveness. */
  Phase phase = Phase.OPTIMISTIC;

  public ContextTree(Function rootFunction, AnalysisOptions options) {
    this.options = options;
    this.root = new InlineAttempt(this, null, null, rootFunction);
  }

  public ContextTree(Function rootFunction) {
    this(rootFunction, AnalysisOptions.DEFAULTS);
  }

  int register(Context context) {
    contexts.add(context);
    return contexts.size() - 1;
  }

  public InlineAttempt root() {
    return root;
  }

  public Context context(int index) {
    return contexts.get(index);
  }

  public int size() {
    return contexts.size();
  }

  /** All contexts, in creation order. */
  public List<Context> contexts() {
    return Collections.unmodifiableList(contexts);
  }

  /** All contexts in pre-order: each context precedes its children. */
  public ImmutableList<Context> preorder() {
    ImmutableList.Builder<Context> result = ImmutableList.builder();
    ArrayDeque<Context> work = new ArrayDeque<>();
    work.push(root);
    while (!work.isEmpty()) {
      Context c = work.pop();
      result.add(c);
      ImmutableList<Context> children = c.children();
      // Push in reverse so that the first child is visited first
      for (int i = children.size() - 1; i >= 0; i--) {
        work.push(children.get(i));
      }
    }
    return result.build();
  }

  public Phase phase() {
    return phase;
  }
}
