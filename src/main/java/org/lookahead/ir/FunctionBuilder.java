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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Builds the body of a Function. A typical use:
 *
 * <pre>
 * FunctionBuilder fb = new FunctionBuilder(f);
 * Block entry = fb.newBlock("entry");
 * Block exit = fb.newBlock("exit");
 * fb.setBlock(entry);
 * Instruction x = fb.add("x", f.argument(0), Constant.of(Type.I32, 1));
 * fb.br(exit);
 * fb.setBlock(exit);
 * fb.ret(x);
 * fb.finish();
 * </pre>
 *
 * <p>The first block created is the function's entry block. Instructions are appended to the
 * current block; PHI instructions may have incoming values added at any time before {@link
 * #finish}, which verifies the function and computes predecessors, users, reverse postorder and
 * loops.
 */
public final class FunctionBuilder {
  private final Function function;
  private @Nullable Block current;

  public FunctionBuilder(Function function) {
    Preconditions.checkArgument(
        function.isDeclaration() && !function.isFinished(), "%s already has a body", function);
    this.function = function;
  }

  public Function function() {
    return function;
  }

  public Block newBlock(String name) {
    Preconditions.checkState(!function.isFinished());
    Block block = new Block(function, name, function.blocks.size());
    function.blocks.add(block);
    return block;
  }

  /** Subsequent instructions will be appended to {@code block}. */
  @CanIgnoreReturnValue
  public FunctionBuilder setBlock(Block block) {
    Preconditions.checkArgument(block.function == function);
    this.current = block;
    return this;
  }

  private Instruction emit(Opcode opcode, Type type, String name, Value... operands) {
    Preconditions.checkState(current != null, "no current block");
    Preconditions.checkState(!function.isFinished());
    Instruction inst = new Instruction(opcode, type, name, current, function.instructions.size());
    for (Value v : operands) {
      inst.addOperand(v);
    }
    current.instructions.add(inst);
    function.instructions.add(inst);
    return inst;
  }

  public Instruction alloca(String name, Type allocated) {
    return alloca(name, allocated, function.module.layout.alignment(allocated));
  }

  public Instruction alloca(String name, Type allocated, int alignment) {
    Instruction inst = emit(Opcode.ALLOCA, Type.PTR, name);
    inst.auxType = allocated;
    inst.alignment = alignment;
    return inst;
  }

  public Instruction load(String name, Type type, Value ptr) {
    return emit(Opcode.LOAD, type, name, ptr);
  }

  public Instruction volatileLoad(String name, Type type, Value ptr) {
    Instruction inst = load(name, type, ptr);
    inst.isVolatile = true;
    return inst;
  }

  @CanIgnoreReturnValue
  public Instruction store(Value value, Value ptr) {
    return emit(Opcode.STORE, Type.VOID, "", value, ptr);
  }

  @CanIgnoreReturnValue
  public Instruction volatileStore(Value value, Value ptr) {
    Instruction inst = store(value, ptr);
    inst.isVolatile = true;
    return inst;
  }

  /**
   * Computes an address within an object: the first index steps over elements of type {@code
   * sourceType}, and each later index selects a struct field or array element within it.
   */
  public Instruction gep(String name, Type sourceType, Value base, Value... indices) {
    Preconditions.checkArgument(indices.length > 0, "gep needs at least one index");
    Value[] operands = new Value[indices.length + 1];
    operands[0] = base;
    System.arraycopy(indices, 0, operands, 1, indices.length);
    Instruction inst = emit(Opcode.GEP, Type.PTR, name, operands);
    inst.auxType = sourceType;
    return inst;
  }

  @CanIgnoreReturnValue
  public Instruction memset(Value dest, Value byteValue, Value length) {
    return emit(Opcode.MEMSET, Type.VOID, "", dest, byteValue, length);
  }

  @CanIgnoreReturnValue
  public Instruction memcpy(Value dest, Value src, Value length) {
    return emit(Opcode.MEMCPY, Type.VOID, "", dest, src, length);
  }

  /** Emits an integer arithmetic or bitwise instruction; the result has the type of {@code a}. */
  public Instruction binary(Opcode opcode, String name, Value a, Value b) {
    Preconditions.checkArgument(opcode.isBinary(), "%s is not a binary opcode", opcode);
    return emit(opcode, a.type(), name, a, b);
  }

  public Instruction add(String name, Value a, Value b) {
    return binary(Opcode.ADD, name, a, b);
  }

  public Instruction sub(String name, Value a, Value b) {
    return binary(Opcode.SUB, name, a, b);
  }

  public Instruction and(String name, Value a, Value b) {
    return binary(Opcode.AND, name, a, b);
  }

  public Instruction or(String name, Value a, Value b) {
    return binary(Opcode.OR, name, a, b);
  }

  public Instruction icmp(String name, Predicate predicate, Value a, Value b) {
    Instruction inst = emit(Opcode.ICMP, Type.I1, name, a, b);
    inst.predicate = predicate;
    return inst;
  }

  public Instruction cast(Opcode opcode, String name, Type to, Value v) {
    Preconditions.checkArgument(opcode.isCast(), "%s is not a cast", opcode);
    return emit(opcode, to, name, v);
  }

  public Instruction select(String name, Value cond, Value ifTrue, Value ifFalse) {
    return emit(Opcode.SELECT, ifTrue.type(), name, cond, ifTrue, ifFalse);
  }

  /** Emits a PHI with no incoming values; add them with {@link #addIncoming}. */
  public Instruction phi(String name, Type type) {
    return emit(Opcode.PHI, type, name);
  }

  @CanIgnoreReturnValue
  public FunctionBuilder addIncoming(Instruction phi, Value value, Block pred) {
    Preconditions.checkArgument(phi.opcode == Opcode.PHI);
    Preconditions.checkState(!function.isFinished());
    phi.addIncoming(value, pred);
    return this;
  }

  /** Emits a direct call; the result type is the callee's return type. */
  @CanIgnoreReturnValue
  public Instruction call(String name, Function callee, Value... args) {
    return callIndirect(name, callee.returnType, callee, args);
  }

  /** Emits a call through an arbitrary pointer-valued operand. */
  @CanIgnoreReturnValue
  public Instruction callIndirect(String name, Type returnType, Value callee, Value... args) {
    Instruction inst = emit(Opcode.CALL, returnType, name, args);
    inst.callee = callee;
    return inst;
  }

  public Instruction vaRegArea(String name) {
    Preconditions.checkState(function.isVarArg, "%s is not variadic", function);
    return emit(Opcode.VA_REG_AREA, Type.PTR, name);
  }

  public Instruction vaOverflowArea(String name) {
    Preconditions.checkState(function.isVarArg, "%s is not variadic", function);
    return emit(Opcode.VA_OVERFLOW_AREA, Type.PTR, name);
  }

  @CanIgnoreReturnValue
  public Instruction br(Block target) {
    Instruction inst = emit(Opcode.BR, Type.VOID, "");
    inst.setSuccessors(ImmutableList.of(target), ImmutableList.of());
    return inst;
  }

  @CanIgnoreReturnValue
  public Instruction condBr(Value cond, Block ifTrue, Block ifFalse) {
    Instruction inst = emit(Opcode.COND_BR, Type.VOID, "", cond);
    inst.setSuccessors(ImmutableList.of(ifTrue, ifFalse), ImmutableList.of());
    return inst;
  }

  /** Emits a multi-way branch; {@code cases} is iterated in order. */
  @CanIgnoreReturnValue
  public Instruction switchOn(Value cond, Block defaultTarget, Map<Constant.Int, Block> cases) {
    Instruction inst = emit(Opcode.SWITCH, Type.VOID, "", cond);
    ImmutableMap<Constant.Int, Block> copy = ImmutableMap.copyOf(cases);
    inst.setSuccessors(
        ImmutableList.<Block>builder().add(defaultTarget).addAll(copy.values()).build(),
        copy.keySet().asList());
    return inst;
  }

  @CanIgnoreReturnValue
  public Instruction ret() {
    return emit(Opcode.RET, Type.VOID, "");
  }

  @CanIgnoreReturnValue
  public Instruction ret(Value value) {
    return emit(Opcode.RET, Type.VOID, "", value);
  }

  @CanIgnoreReturnValue
  public Instruction unreachable() {
    return emit(Opcode.UNREACHABLE, Type.VOID, "");
  }

  /**
   * Verifies the function and computes the derived information (predecessors, users, reverse
   * postorder, loops). No further changes may be made.
   */
  public Function finish() {
    Preconditions.checkState(!function.isFinished());
    Preconditions.checkState(!function.blocks.isEmpty(), "no blocks");
    Verifier.verify(function);
    List<List<Block>> preds = new ArrayList<>();
    for (int i = 0; i < function.blocks.size(); i++) {
      preds.add(new ArrayList<>());
    }
    for (Block block : function.blocks) {
      for (Block succ : block.successors()) {
        List<Block> p = preds.get(succ.index);
        if (!p.contains(block)) {
          p.add(block);
        }
      }
    }
    for (Block block : function.blocks) {
      block.setPredecessors(ImmutableList.copyOf(preds.get(block.index)));
    }
    computeUsers();
    LoopFinder finder = new LoopFinder(function);
    ImmutableList<Block> rpo = finder.reversePostorder();
    int order = 0;
    for (Block block : rpo) {
      for (Instruction inst : block.instructions) {
        inst.setOrder(order++);
      }
    }
    // Unreachable instructions sort after everything else.
    for (Instruction inst : function.instructions) {
      if (inst.order() < 0) {
        inst.setOrder(order++);
      }
    }
    function.setFinished(rpo, finder.findLoops());
    return function;
  }

  private void computeUsers() {
    List<List<Instruction>> users = new ArrayList<>();
    for (int i = 0; i < function.instructions.size(); i++) {
      users.add(new ArrayList<>());
    }
    for (Instruction inst : function.instructions) {
      for (Value v : inst.operands()) {
        if (v instanceof Instruction def) {
          List<Instruction> u = users.get(def.id);
          if (u.isEmpty() || u.get(u.size() - 1) != inst) {
            u.add(inst);
          }
        } else if (v instanceof Argument arg && arg.function == function) {
          arg.addUser(inst);
        }
      }
    }
    for (Instruction inst : function.instructions) {
      inst.setUsers(ImmutableList.copyOf(users.get(inst.id)));
    }
    for (Argument arg : function.arguments()) {
      arg.freezeUsers();
    }
  }
}
