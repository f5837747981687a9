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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Block;
import org.lookahead.ir.Function;
import org.lookahead.ir.Instruction;

/**
 * The body of a function as if it had been inlined at one call site. The root of a ContextTree is
 * an InlineAttempt with no call site, whose arguments are unknown.
 */
public final class InlineAttempt extends Context {
  /** The call being inlined, or null for the root. */
  public final @Nullable Instruction callSite;

  /** This context followed by every PeelIteration of the same function instance. */
  private final List<Context> instance = new ArrayList<>();

  private @Nullable VarArgFrame varArgFrame;

  InlineAttempt(
      ContextTree tree, @Nullable Context parent, @Nullable Instruction callSite, Function f) {
    super(tree, parent, f, null);
    this.callSite = callSite;
    instance.add(this);
  }

  @Override
  public InlineAttempt functionRoot() {
    return this;
  }

  @Override
  public Block entryBlock() {
    return function.entry();
  }

  /**
   * The contexts that evaluate instructions of this function instance: this InlineAttempt and all
   * PeelIterations nested in it (but not in further InlineAttempts).
   */
  public List<Context> instance() {
    return Collections.unmodifiableList(instance);
  }

  void addToInstance(PeelIteration iteration) {
    instance.add(iteration);
  }

  @Override
  boolean isEntryLive() {
    return callSite == null || parent.isBlockLive(callSite.block);
  }

  /** Describes the variadic arguments at the call site; only valid for a variadic callee. */
  VarArgFrame varArgFrame() {
    if (varArgFrame == null) {
      varArgFrame = new VarArgFrame(this);
    }
    return varArgFrame;
  }

  @Override
  public String shortHeader() {
    return callSite == null
        ? function.name()
        : function.name() + " @ " + callSite.asOperand() + " in " + callSite.function().name();
  }
}
