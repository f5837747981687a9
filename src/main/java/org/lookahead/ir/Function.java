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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A function is either a declaration (no blocks; only its attributes are known) or a definition,
 * built with a {@link FunctionBuilder}. As an operand a function is a pointer to its code.
 */
public final class Function extends Value {

  /** What the function may do to memory visible to its caller. */
  public enum MemoryEffects {
    NONE,
    READ_ONLY,
    /** May read and write only memory reachable from its pointer arguments. */
    ARG_MEM_ONLY,
    ANY
  }

  public final Module module;
  public final Type returnType;
  public final boolean isVarArg;
  private final ImmutableList<Argument> arguments;

  private MemoryEffects memoryEffects = MemoryEffects.ANY;
  private boolean returnsNoAlias;
  private boolean deallocates;

  final List<Block> blocks = new ArrayList<>();
  final List<Instruction> instructions = new ArrayList<>();
  private boolean finished;
  private ImmutableList<Block> reversePostorder;
  private ImmutableList<Loop> loops;

  Function(Module module, String name, Type returnType, List<Type> params, boolean isVarArg) {
    super(Type.PTR, name);
    this.module = module;
    this.returnType = returnType;
    this.isVarArg = isVarArg;
    ImmutableList.Builder<Argument> builder = ImmutableList.builder();
    for (int i = 0; i < params.size(); i++) {
      builder.add(new Argument(this, i, params.get(i), "arg" + i));
    }
    this.arguments = builder.build();
  }

  @Override
  public String asOperand() {
    return "@" + name();
  }

  public ImmutableList<Argument> arguments() {
    return arguments;
  }

  public Argument argument(int i) {
    return arguments.get(i);
  }

  /** True if this function has no body. */
  public boolean isDeclaration() {
    return blocks.isEmpty();
  }

  public boolean isFinished() {
    return finished;
  }

  public MemoryEffects memoryEffects() {
    return memoryEffects;
  }

  @CanIgnoreReturnValue
  public Function setMemoryEffects(MemoryEffects memoryEffects) {
    this.memoryEffects = memoryEffects;
    return this;
  }

  /** True if each call returns a pointer to fresh memory that does not alias anything else. */
  public boolean returnsNoAlias() {
    return returnsNoAlias;
  }

  @CanIgnoreReturnValue
  public Function setReturnsNoAlias(boolean returnsNoAlias) {
    this.returnsNoAlias = returnsNoAlias;
    return this;
  }

  /** True if this function releases the heap object its first argument points to. */
  public boolean deallocates() {
    return deallocates;
  }

  @CanIgnoreReturnValue
  public Function setDeallocates(boolean deallocates) {
    this.deallocates = deallocates;
    return this;
  }

  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public Block entry() {
    Preconditions.checkState(!blocks.isEmpty(), "%s is a declaration", name());
    return blocks.get(0);
  }

  public int numBlocks() {
    return blocks.size();
  }

  public int numInstructions() {
    return instructions.size();
  }

  /** Returns the instruction with the given {@link Instruction#id}. */
  public Instruction instruction(int id) {
    return instructions.get(id);
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  /** The reachable blocks, in reverse postorder; the entry block is first. */
  public ImmutableList<Block> reversePostorder() {
    checkFinished();
    return reversePostorder;
  }

  /** All loops in this function; a loop always precedes the loops nested in it. */
  public ImmutableList<Loop> loops() {
    checkFinished();
    return loops;
  }

  /** Returns the loop whose header is the named block, or null if there is none. */
  public @Nullable Loop loopWithHeader(String headerName) {
    for (Loop loop : loops()) {
      if (loop.header.name.equals(headerName)) {
        return loop;
      }
    }
    return null;
  }

  /** Returns the named block, or null if there is none. */
  public @Nullable Block block(String blockName) {
    for (Block block : blocks) {
      if (block.name.equals(blockName)) {
        return block;
      }
    }
    return null;
  }

  /** Returns the named instruction, or null if there is none. */
  public @Nullable Instruction instruction(String instName) {
    for (Instruction inst : instructions) {
      if (inst.name().equals(instName)) {
        return inst;
      }
    }
    return null;
  }

  private void checkFinished() {
    Preconditions.checkState(finished, "%s has not been finished", name());
  }

  void setFinished(ImmutableList<Block> reversePostorder, ImmutableList<Loop> loops) {
    this.reversePostorder = reversePostorder;
    this.loops = loops;
    this.finished = true;
  }
}
