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

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Function;
import org.lookahead.ir.FunctionBuilder;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Module;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.Type;

@RunWith(TestParameterInjector.class)
public class ConstantFolderTest {

  /** A binary operation on i32 constants, and its result (null if it cannot be folded). */
  enum BinaryCase {
    ADD(Opcode.ADD, 7, 5, 12L),
    ADD_WRAPS(Opcode.ADD, Integer.MAX_VALUE, 1, (long) Integer.MIN_VALUE),
    SUB(Opcode.SUB, 5, 7, -2L),
    MUL_WRAPS(Opcode.MUL, 65536, 65536, 0L),
    UDIV(Opcode.UDIV, -1, 2, (long) Integer.MAX_VALUE),
    SDIV(Opcode.SDIV, -7, 2, -3L),
    SREM(Opcode.SREM, -7, 2, -1L),
    UREM(Opcode.UREM, 7, 3, 1L),
    UREM_BY_ZERO(Opcode.UREM, 7, 0, null),
    SDIV_BY_ZERO(Opcode.SDIV, 7, 0, null),
    SDIV_OVERFLOW(Opcode.SDIV, Integer.MIN_VALUE, -1, null),
    AND(Opcode.AND, 12, 10, 8L),
    OR(Opcode.OR, 12, 3, 15L),
    XOR(Opcode.XOR, 6, 3, 5L),
    SHL(Opcode.SHL, 1, 31, (long) Integer.MIN_VALUE),
    SHL_TOO_FAR(Opcode.SHL, 1, 32, null),
    LSHR(Opcode.LSHR, -1, 28, 15L),
    ASHR(Opcode.ASHR, -16, 2, -4L);

    final Opcode opcode;
    final int left;
    final int right;
    final @Nullable Long expected;

    BinaryCase(Opcode opcode, int left, int right, @Nullable Long expected) {
      this.opcode = opcode;
      this.left = left;
      this.right = right;
      this.expected = expected;
    }
  }

  @Test
  public void binary(@TestParameter BinaryCase testCase) {
    Function f = new Module().addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction r =
        fb.binary(
            testCase.opcode,
            "r",
            Constant.of(Type.I32, testCase.left),
            Constant.of(Type.I32, testCase.right));
    fb.ret();
    fb.finish();
    LatticeValue value = solve(f).value(r);
    if (testCase.expected == null) {
      assertThat(value).isEqualTo(LatticeValue.OVERDEF);
    } else {
      assertThat(value).isEqualTo(LatticeValue.scalar(Constant.of(Type.I32, testCase.expected)));
    }
  }

  @Test
  public void casts() {
    Function f = new Module().addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction trunc = fb.cast(Opcode.TRUNC, "trunc", Type.I8, Constant.of(Type.I32, 300));
    Instruction zext = fb.cast(Opcode.ZEXT, "zext", Type.I32, Constant.of(Type.I8, -1));
    Instruction sext = fb.cast(Opcode.SEXT, "sext", Type.I32, Constant.of(Type.I8, -1));
    Instruction p2i = fb.cast(Opcode.PTRTOINT, "p2i", Type.I64, Constant.NULL);
    Instruction i2p = fb.cast(Opcode.INTTOPTR, "i2p", Type.PTR, Constant.of(Type.I64, 0));
    Instruction i2pNonzero =
        fb.cast(Opcode.INTTOPTR, "i2p.1", Type.PTR, Constant.of(Type.I64, 4096));
    fb.ret();
    fb.finish();
    Context root = solve(f);
    assertThat(root.value(trunc)).isEqualTo(scalar(Type.I8, 44));
    assertThat(root.value(zext)).isEqualTo(scalar(Type.I32, 255));
    assertThat(root.value(sext)).isEqualTo(scalar(Type.I32, -1));
    assertThat(root.value(p2i)).isEqualTo(scalar(Type.I64, 0));
    assertThat(root.value(i2p)).isEqualTo(LatticeValue.scalar(Constant.NULL));
    assertThat(root.value(i2pNonzero)).isEqualTo(LatticeValue.OVERDEF);
  }

  @Test
  public void selectOnConstant() {
    Function f = new Module().addFunction("f", Type.VOID, Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction chooseArg =
        fb.select("a", Constant.TRUE, f.argument(0), Constant.of(Type.I32, 1));
    Instruction chooseConst =
        fb.select("b", Constant.FALSE, f.argument(0), Constant.of(Type.I32, 1));
    fb.ret();
    fb.finish();
    Context root = solve(f);
    // The root's arguments could be anything
    assertThat(root.value(chooseArg)).isEqualTo(LatticeValue.OVERDEF);
    assertThat(root.value(chooseConst)).isEqualTo(scalar(Type.I32, 1));
  }

  @Test
  public void bitwiseIdentities() {
    Function f = new Module().addFunction("f", Type.VOID, Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction and = fb.and("and", f.argument(0), Constant.of(Type.I32, 0));
    Instruction or = fb.or("or", Constant.of(Type.I32, -1), f.argument(0));
    Instruction add = fb.add("add", f.argument(0), Constant.of(Type.I32, 0));
    fb.ret();
    fb.finish();
    Context root = solve(f);
    assertThat(root.value(and)).isEqualTo(scalar(Type.I32, 0));
    assertThat(root.value(or)).isEqualTo(scalar(Type.I32, -1));
    assertThat(root.value(add)).isEqualTo(LatticeValue.OVERDEF);
  }

  @Test
  public void unknownOperands() {
    Function f = new Module().addFunction("f", Type.VOID, Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction add = fb.add("add", f.argument(0), Constant.of(Type.I32, 1));
    fb.ret();
    fb.finish();
    LatticeValue one = scalar(Type.I32, 1);
    LatticeValue[] unknown = {LatticeValue.UNKNOWN, one};
    assertThat(ConstantFolder.INSTANCE.fold(add, unknown, Phase.OPTIMISTIC))
        .isEqualTo(LatticeValue.UNKNOWN);
    // Anything that is neither a scalar nor unknown wins
    LatticeValue[] mixed = {LatticeValue.OVERDEF, LatticeValue.UNKNOWN};
    assertThat(ConstantFolder.INSTANCE.fold(add, mixed, Phase.OPTIMISTIC))
        .isEqualTo(LatticeValue.OVERDEF);
    LatticeValue[] both = {one, one};
    assertThat(ConstantFolder.INSTANCE.fold(add, both, Phase.OPTIMISTIC))
        .isEqualTo(scalar(Type.I32, 2));
  }

  static LatticeValue scalar(Type.IntType type, long value) {
    return LatticeValue.scalar(Constant.of(type, value));
  }

  static Context solve(Function f) {
    ContextTree tree = new ContextTree(f);
    new Solver(tree, ResourceModel.NONE).run();
    return tree.root();
  }
}
