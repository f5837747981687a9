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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A basic block: a sequence of instructions ending in a single terminator. */
public final class Block {
  public final Function function;
  public final String name;

  /** Unique within the function; blocks are numbered in the order they were created. */
  public final int index;

  final List<Instruction> instructions = new ArrayList<>();

  private ImmutableList<Block> predecessors;
  private @Nullable Loop loop;
  private int order = -1;

  Block(Function function, String name, int index) {
    this.function = function;
    this.name = name;
    this.index = index;
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  public Instruction terminator() {
    Preconditions.checkState(
        !instructions.isEmpty() && instructions.get(instructions.size() - 1).isTerminator(),
        "block %s has no terminator",
        name);
    return instructions.get(instructions.size() - 1);
  }

  public ImmutableList<Block> successors() {
    return terminator().successors();
  }

  public ImmutableList<Block> predecessors() {
    return predecessors;
  }

  /** The innermost loop containing this block, or null if it is not in any loop. */
  public @Nullable Loop loop() {
    return loop;
  }

  /** The position of this block in reverse postorder, or -1 if it is unreachable. */
  public int order() {
    return order;
  }

  /** The position of an instruction within this block. */
  public int indexOf(Instruction inst) {
    Preconditions.checkArgument(inst.block == this);
    return instructions.indexOf(inst);
  }

  void setPredecessors(ImmutableList<Block> predecessors) {
    this.predecessors = predecessors;
  }

  void setLoop(@Nullable Loop loop) {
    this.loop = loop;
  }

  void setOrder(int order) {
    this.order = order;
  }

  public String asOperand() {
    return "%" + name;
  }

  @Override
  public String toString() {
    return function.name() + ":" + name;
  }
}
