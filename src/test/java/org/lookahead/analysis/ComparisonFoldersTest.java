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
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Module;
import org.lookahead.ir.Opcode;
import org.lookahead.ir.Predicate;
import org.lookahead.ir.Type;

@RunWith(TestParameterInjector.class)
public class ComparisonFoldersTest {

  static final LatticeValue TRUE = LatticeValue.scalar(Constant.TRUE);
  static final LatticeValue FALSE = LatticeValue.scalar(Constant.FALSE);

  /** Compares an unknowable i32 with a constant; a null result means nothing is known. */
  enum ExtremalCase {
    UGT_ALL_ONES(Predicate.UGT, -1, false),
    UGE_ZERO(Predicate.UGE, 0, true),
    ULT_ZERO(Predicate.ULT, 0, false),
    ULE_ALL_ONES(Predicate.ULE, -1, true),
    SGT_MAX(Predicate.SGT, Integer.MAX_VALUE, false),
    SGE_MIN(Predicate.SGE, Integer.MIN_VALUE, true),
    SLT_MIN(Predicate.SLT, Integer.MIN_VALUE, false),
    SLE_MAX(Predicate.SLE, Integer.MAX_VALUE, true),
    ULT_FIVE(Predicate.ULT, 5, null),
    SGT_ALL_ONES(Predicate.SGT, -1, null),
    EQ_ZERO(Predicate.EQ, 0, null);

    final Predicate predicate;
    final int constant;
    final @Nullable Boolean expected;

    ExtremalCase(Predicate predicate, int constant, @Nullable Boolean expected) {
      this.predicate = predicate;
      this.constant = constant;
      this.expected = expected;
    }
  }

  @Test
  public void extremal(@TestParameter ExtremalCase testCase, @TestParameter boolean constantFirst) {
    Function f = new Module().addFunction("f", Type.VOID, Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Constant c = Constant.of(Type.I32, testCase.constant);
    Instruction cmp =
        constantFirst
            ? fb.icmp("cmp", testCase.predicate.swapped(), c, f.argument(0))
            : fb.icmp("cmp", testCase.predicate, f.argument(0), c);
    fb.ret();
    fb.finish();
    LatticeValue expected =
        (testCase.expected == null)
            ? LatticeValue.OVERDEF
            : LatticeValue.scalar(Constant.of(testCase.expected));
    assertThat(ConstantFolderTest.solve(f).value(cmp)).isEqualTo(expected);
  }

  @Test
  public void resourceHandles() {
    Module module = new Module();
    Function open = module.addFunction("open", Type.I32, Type.PTR);
    GlobalVariable path = module.addGlobal("path", Type.I8, null, true);
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction fd = fb.call("fd", open, path);
    Instruction failed = fb.icmp("failed", Predicate.SLT, fd, Constant.of(Type.I32, 0));
    Instruction ok = fb.icmp("ok", Predicate.SGT, fd, Constant.of(Type.I32, -1));
    Instruction isMinusOne = fb.icmp("eq", Predicate.EQ, fd, Constant.of(Type.I32, -1));
    Instruction swapped = fb.icmp("swapped", Predicate.SLE, Constant.of(Type.I32, 0), fd);
    Instruction isThree = fb.icmp("three", Predicate.EQ, fd, Constant.of(Type.I32, 3));
    Instruction wide = fb.cast(Opcode.SEXT, "wide", Type.I64, fd);
    Instruction wideFailed =
        fb.icmp("wide.failed", Predicate.SLT, wide, Constant.of(Type.I64, 0));
    Instruction narrow = fb.cast(Opcode.TRUNC, "narrow", Type.I16, fd);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    new Solver(tree, new PosixResourceModel()).run();
    InlineAttempt root = tree.root();
    assertThat(root.value(fd)).isEqualTo(LatticeValue.resource(new ResourceHandle(fd, root)));
    assertThat(root.value(failed)).isEqualTo(FALSE);
    assertThat(root.value(ok)).isEqualTo(TRUE);
    assertThat(root.value(isMinusOne)).isEqualTo(FALSE);
    assertThat(root.value(swapped)).isEqualTo(TRUE);
    assertThat(root.value(isThree)).isEqualTo(LatticeValue.OVERDEF);
    assertThat(root.value(wide)).isEqualTo(root.value(fd));
    assertThat(root.value(wideFailed)).isEqualTo(FALSE);
    // Too narrow to hold every handle
    assertThat(root.value(narrow)).isEqualTo(LatticeValue.OVERDEF);
  }

  @Test
  public void resourcesNeedAModel() {
    Module module = new Module();
    Function open = module.addFunction("open", Type.I32, Type.PTR);
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction fd = fb.call("fd", open, Constant.NULL);
    Instruction failed = fb.icmp("failed", Predicate.SLT, fd, Constant.of(Type.I32, 0));
    fb.ret();
    fb.finish();
    Context root = ConstantFolderTest.solve(f);
    assertThat(root.value(fd)).isEqualTo(LatticeValue.OVERDEF);
    assertThat(root.value(failed)).isEqualTo(LatticeValue.OVERDEF);
  }

  @Test
  public void pointers() {
    Module module = new Module();
    Function f = module.addFunction("f", Type.VOID, Type.PTR);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.array(Type.I8, 16));
    Instruction b = fb.alloca("b", Type.I32);
    Instruction a4 = fb.gep("a4", Type.I8, a, Constant.of(Type.I64, 4));
    Instruction a8 = fb.gep("a8", Type.I8, a, Constant.of(Type.I64, 8));
    Instruction aEqB = fb.icmp("a.eq.b", Predicate.EQ, a, b);
    Instruction aNeB = fb.icmp("a.ne.b", Predicate.NE, a, b);
    Instruction aIsNull = fb.icmp("a.null", Predicate.EQ, a, Constant.NULL);
    Instruction nullBelowB = fb.icmp("null.ult.b", Predicate.ULT, Constant.NULL, b);
    Instruction ordered = fb.icmp("ordered", Predicate.ULT, a4, a8);
    Instruction same = fb.icmp("same", Predicate.EQ, a8, a8);
    Instruction aUltB = fb.icmp("a.ult.b", Predicate.ULT, a, b);
    Instruction argEqA = fb.icmp("arg.eq.a", Predicate.EQ, f.argument(0), a);
    fb.ret();
    fb.finish();
    Context root = ConstantFolderTest.solve(f);
    assertThat(root.value(aEqB)).isEqualTo(FALSE);
    assertThat(root.value(aNeB)).isEqualTo(TRUE);
    assertThat(root.value(aIsNull)).isEqualTo(FALSE);
    assertThat(root.value(nullBelowB)).isEqualTo(TRUE);
    assertThat(root.value(ordered)).isEqualTo(TRUE);
    assertThat(root.value(same)).isEqualTo(TRUE);
    // The relative order of distinct objects is not known
    assertThat(root.value(aUltB)).isEqualTo(LatticeValue.OVERDEF);
    assertThat(root.value(argEqA)).isEqualTo(LatticeValue.OVERDEF);
  }
}
