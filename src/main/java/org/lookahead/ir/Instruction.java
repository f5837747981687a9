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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An instruction is an opcode, a result type and a list of operands, plus the few opcode-specific
 * attributes (comparison predicate, allocated type, successors, ...) that the analysis needs.
 *
 * <p>Operand conventions:
 *
 * <ul>
 *   <li>LOAD: pointer
 *   <li>STORE: value, pointer
 *   <li>GEP: base pointer, then one or more indices
 *   <li>MEMSET: destination, byte value, length
 *   <li>MEMCPY: destination, source, length
 *   <li>SELECT: condition, value if true, value if false
 *   <li>PHI: one incoming value per incoming block
 *   <li>CALL: the actual arguments (the callee is separate)
 *   <li>COND_BR, SWITCH: the condition
 *   <li>RET: the returned value, if any
 * </ul>
 *
 * <p>Instructions are created by a {@link FunctionBuilder}, and are immutable once the function has
 * been finished.
 */
public final class Instruction extends Value {
  public final Opcode opcode;
  public final Block block;

  /** Unique within the function; instructions are numbered in the order they were created. */
  public final int id;

  private final List<Value> operands = new ArrayList<>();
  private final List<Block> incomingBlocks = new ArrayList<>();
  private ImmutableList<Block> successors = ImmutableList.of();
  private ImmutableList<Constant.Int> caseValues = ImmutableList.of();

  @Nullable Predicate predicate;
  @Nullable Type auxType;
  int alignment;
  boolean isVolatile;
  @Nullable Value callee;

  private ImmutableList<Instruction> users;
  private int order = -1;

  Instruction(Opcode opcode, Type type, String name, Block block, int id) {
    super(type, name);
    this.opcode = opcode;
    this.block = block;
    this.id = id;
  }

  public Function function() {
    return block.function;
  }

  public int numOperands() {
    return operands.size();
  }

  public Value operand(int i) {
    return operands.get(i);
  }

  public List<Value> operands() {
    return Collections.unmodifiableList(operands);
  }

  /** True if this instruction produces a value that other instructions may use. */
  public boolean hasValue() {
    return !type().isVoid();
  }

  public boolean isTerminator() {
    return opcode.isTerminator();
  }

  /** The comparison predicate of an ICMP. */
  public Predicate predicate() {
    Preconditions.checkState(opcode == Opcode.ICMP);
    return predicate;
  }

  /** The allocated type of an ALLOCA. */
  public Type allocatedType() {
    Preconditions.checkState(opcode == Opcode.ALLOCA);
    return auxType;
  }

  /** The element type that the first index of a GEP steps over. */
  public Type sourceElementType() {
    Preconditions.checkState(opcode == Opcode.GEP);
    return auxType;
  }

  /** The alignment of an ALLOCA, in bytes. */
  public int alignment() {
    Preconditions.checkState(opcode == Opcode.ALLOCA);
    return alignment;
  }

  public boolean isVolatile() {
    return isVolatile;
  }

  /** The pointer operand of a LOAD or STORE. */
  public Value pointerOperand() {
    return switch (opcode) {
      case LOAD -> operand(0);
      case STORE -> operand(1);
      default -> throw new IllegalStateException("no pointer operand: " + opcode);
    };
  }

  /** The type read by a LOAD or written by a STORE. */
  public Type accessType() {
    return switch (opcode) {
      case LOAD -> type();
      case STORE -> operand(0).type();
      default -> throw new IllegalStateException("not a memory access: " + opcode);
    };
  }

  /** The callee of a CALL; usually a Function, but may be any pointer-valued operand. */
  public Value callee() {
    Preconditions.checkState(opcode == Opcode.CALL);
    return callee;
  }

  /** The called Function, or null if this is not a direct call. */
  public @Nullable Function calledFunction() {
    return (opcode == Opcode.CALL && callee instanceof Function f) ? f : null;
  }

  public int numIncoming() {
    return incomingBlocks.size();
  }

  public Block incomingBlock(int i) {
    return incomingBlocks.get(i);
  }

  public Value incomingValue(int i) {
    return operands.get(i);
  }

  /** Returns the value a PHI receives from the given predecessor, or null if there is none. */
  public @Nullable Value incomingValueFor(Block pred) {
    int i = incomingBlocks.indexOf(pred);
    return (i < 0) ? null : operands.get(i);
  }

  /** The successors of a terminator; for a SWITCH the default comes first. */
  public ImmutableList<Block> successors() {
    return successors;
  }

  /** The case values of a SWITCH, matching {@code successors().subList(1, ...)}. */
  public ImmutableList<Constant.Int> caseValues() {
    return caseValues;
  }

  /** The instructions that use this instruction's value, without duplicates. */
  public ImmutableList<Instruction> users() {
    Preconditions.checkState(users != null, "function not finished");
    return users;
  }

  /** The position of this instruction in a reverse postorder walk of its function. */
  public int order() {
    return order;
  }

  void addOperand(Value v) {
    operands.add(v);
  }

  void addIncoming(Value v, Block pred) {
    operands.add(v);
    incomingBlocks.add(pred);
  }

  void setSuccessors(ImmutableList<Block> successors, ImmutableList<Constant.Int> caseValues) {
    this.successors = successors;
    this.caseValues = caseValues;
  }

  void setUsers(ImmutableList<Instruction> users) {
    this.users = users;
  }

  void setOrder(int order) {
    this.order = order;
  }

  /** Returns a printable form such as {@code %x = add i32 %a, 1}. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    if (hasValue()) {
      sb.append(asOperand()).append(" = ");
    }
    sb.append(opcode);
    if (opcode == Opcode.ICMP) {
      sb.append(' ').append(predicate);
    }
    if (hasValue()) {
      sb.append(' ').append(type());
    }
    if (opcode == Opcode.CALL) {
      sb.append(' ').append(callee.asOperand());
    }
    if (opcode == Opcode.PHI) {
      for (int i = 0; i < numIncoming(); i++) {
        sb.append(i == 0 ? " " : ", ")
            .append('[')
            .append(incomingValue(i).asOperand())
            .append(", ")
            .append(incomingBlock(i).asOperand())
            .append(']');
      }
    } else if (!operands.isEmpty()) {
      sb.append(
          operands.stream().map(Value::asOperand).collect(Collectors.joining(", ", " ", "")));
    }
    if (!successors.isEmpty()) {
      sb.append(
          successors.stream()
              .map(Block::asOperand)
              .collect(Collectors.joining(", ", operands.isEmpty() ? " " : ", ", "")));
    }
    return sb.toString();
  }
}
