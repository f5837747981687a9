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

package org.lookahead.dse;

import static com.google.common.truth.Truth.assertThat;

import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.ContextTree;
import org.lookahead.analysis.InlineAttempt;
import org.lookahead.analysis.PeelAttempt;
import org.lookahead.analysis.PosixResourceModel;
import org.lookahead.analysis.ResourceModel;
import org.lookahead.analysis.Solver;
import org.lookahead.ir.Block;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Function;
import org.lookahead.ir.FunctionBuilder;
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Module;
import org.lookahead.ir.Predicate;
import org.lookahead.ir.Type;
import org.lookahead.ir.Value;

@RunWith(JUnit4.class)
public class DeadStoreAnalysisTest {

  private static Constant i32(long value) {
    return Constant.of(Type.I32, value);
  }

  private static DeadStoreAnalysis.Result analyze(ContextTree tree, ResourceModel resources) {
    new Solver(tree, resources).run();
    return new DeadStoreAnalysis(tree, new HypotheticalAliasQuery(), resources).run();
  }

  private static DeadStoreAnalysis.Result analyze(ContextTree tree) {
    return analyze(tree, ResourceModel.NONE);
  }

  @Test
  public void overwrittenStore() {
    Function f = new Module().addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.I32);
    Instruction first = fb.store(i32(1), a);
    Instruction second = fb.store(i32(2), a);
    fb.ret(fb.load("v", Type.I32, a));
    fb.finish();
    ContextTree tree = new ContextTree(f);
    Context root = tree.root();
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(result.isDead(first, root)).isTrue();
    assertThat(result.isDead(second, root)).isFalse();
    assertThat(result.isDead(a, root)).isFalse();
    assertThat(result.deadWriters()).containsExactly(new InstructionRef(first, root));
  }

  /**
   * Builds
   *
   * <pre>
   * entry: %a = alloca i32
   *        store 1, %a
   *        condbr %c, else, then
   * then:  %v = load %p
   *        br join
   * else:  br join
   * join:  store 2, %a
   *        %x = load %a
   *        ret %x
   * </pre>
   *
   * where {@code %c} is the first argument (or true, if {@code constantCondition}) and {@code %p}
   * is the second argument (or another alloca, if {@code loadFromAlloca}).
   */
  private static Function loadOnOnePath(boolean constantCondition, boolean loadFromAlloca) {
    Function f = new Module().addFunction("f", Type.I32, Type.I1, Type.PTR);
    FunctionBuilder fb = new FunctionBuilder(f);
    Block entry = fb.newBlock("entry");
    Block thenBlock = fb.newBlock("then");
    Block elseBlock = fb.newBlock("else");
    Block join = fb.newBlock("join");
    fb.setBlock(entry);
    Instruction a = fb.alloca("a", Type.I32);
    Instruction b = fb.alloca("b", Type.I32);
    fb.store(i32(1), a);
    fb.condBr(
        constantCondition ? fb.icmp("c", Predicate.EQ, i32(1), i32(1)) : f.argument(0),
        elseBlock,
        thenBlock);
    fb.setBlock(thenBlock);
    fb.load("v", Type.I32, loadFromAlloca ? b : f.argument(1));
    fb.br(join);
    fb.setBlock(elseBlock).br(join);
    fb.setBlock(join);
    fb.store(i32(2), a);
    fb.ret(fb.load("x", Type.I32, a));
    return fb.finish();
  }

  private static Instruction firstStore(Function f) {
    return f.entry().instructions().get(2);
  }

  @Test
  public void loadThatMayAliasOnOnePath() {
    Function f = loadOnOnePath(false, false);
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(firstStore(f), tree.root())).isFalse();
  }

  @Test
  public void loadFromAnotherObject() {
    Function f = loadOnOnePath(false, true);
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(firstStore(f), tree.root())).isTrue();
  }

  @Test
  public void loadOnDeadPath() {
    // The condition is true, so only the path through "else" is live
    Function f = loadOnOnePath(true, false);
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(tree.root().isBlockLive(f.block("then"))).isFalse();
    assertThat(result.isDead(firstStore(f), tree.root())).isTrue();
  }

  @Test
  public void returnEndsStackLifetime() {
    Function f = new Module().addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.I32);
    Instruction store = fb.store(i32(1), a);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(result.isDead(store, tree.root())).isTrue();
    // Nothing reads the allocation either
    assertThat(result.isDead(a, tree.root())).isTrue();
  }

  @Test
  public void globalsOutliveTheProgram() {
    Module module = new Module();
    GlobalVariable g = module.addGlobal("g", Type.I32, i32(0), false);
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction store = fb.store(i32(1), g);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(store, tree.root())).isFalse();
  }

  @Test
  public void volatileStoresAreKept() {
    Function f = new Module().addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.I32);
    Instruction store = fb.volatileStore(i32(1), a);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(store, tree.root())).isFalse();
  }

  /** Stores to {@code %src}, then copies it to {@code dst} (a new alloca if null). */
  private static Function copyThrough(Module module, @Nullable GlobalVariable dst) {
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction src = fb.alloca("src", Type.I32);
    Value target = (dst != null) ? dst : fb.alloca("dst", Type.I32);
    fb.store(i32(5), src);
    fb.memcpy(target, src, Constant.of(Type.I64, 4));
    fb.ret();
    return fb.finish();
  }

  @Test
  public void deadCopyDoesNotReadItsSource() {
    Function f = copyThrough(new Module(), null);
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree);
    Instruction store = f.entry().instructions().get(2);
    Instruction memcpy = f.entry().instructions().get(3);
    assertThat(result.isDead(memcpy, tree.root())).isTrue();
    assertThat(result.isDead(store, tree.root())).isTrue();
  }

  @Test
  public void liveCopyReadsItsSource() {
    Module module = new Module();
    GlobalVariable g = module.addGlobal("g", Type.I32, null, false);
    Function f = copyThrough(module, g);
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree);
    Instruction store = f.entry().instructions().get(1);
    Instruction memcpy = f.entry().instructions().get(2);
    assertThat(result.isDead(memcpy, tree.root())).isFalse();
    assertThat(result.isDead(store, tree.root())).isFalse();
  }

  @Test
  public void partialOverwrite() {
    Function f = new Module().addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction buf = fb.alloca("buf", Type.array(Type.I8, 8));
    Instruction memset = fb.memset(buf, Constant.of(Type.I8, 0), Constant.of(Type.I64, 8));
    fb.store(i32(1), buf);
    Instruction high = fb.gep("high", Type.I8, buf, Constant.of(Type.I64, 4));
    fb.ret(fb.load("v", Type.I32, high));
    fb.finish();
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(memset, tree.root())).isFalse();
  }

  @Test
  public void fullOverwriteInTwoParts() {
    Function f = new Module().addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction buf = fb.alloca("buf", Type.array(Type.I8, 8));
    Instruction memset = fb.memset(buf, Constant.of(Type.I8, 0), Constant.of(Type.I64, 8));
    fb.store(i32(1), buf);
    Instruction high = fb.gep("high", Type.I8, buf, Constant.of(Type.I64, 4));
    fb.store(i32(2), high);
    fb.ret(fb.load("v", Type.I32, high));
    fb.finish();
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(memset, tree.root())).isTrue();
  }

  @Test
  public void heapObjectFreed() {
    Module module = new Module();
    Function malloc = module.addFunction("malloc", Type.PTR, Type.I64).setReturnsNoAlias(true);
    Function free =
        module
            .addFunction("free", Type.VOID, Type.PTR)
            .setDeallocates(true)
            .setMemoryEffects(Function.MemoryEffects.ARG_MEM_ONLY);
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction m = fb.call("m", malloc, Constant.of(Type.I64, 4));
    Instruction store = fb.store(i32(1), m);
    fb.call("", free, m);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(result.isDead(store, tree.root())).isTrue();
    assertThat(result.isDead(m, tree.root())).isTrue();
  }

  @Test
  public void heapObjectNotFreed() {
    Module module = new Module();
    Function malloc = module.addFunction("malloc", Type.PTR, Type.I64).setReturnsNoAlias(true);
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction m = fb.call("m", malloc, Constant.of(Type.I64, 4));
    Instruction store = fb.store(i32(1), m);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(store, tree.root())).isFalse();
  }

  @Test
  public void callsThatCannotRead() {
    Module module = new Module();
    Function pure =
        module.addFunction("pure", Type.VOID).setMemoryEffects(Function.MemoryEffects.NONE);
    Function opaque = module.addFunction("opaque", Type.VOID);
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.I32);
    Instruction first = fb.store(i32(1), a);
    fb.call("", pure);
    Instruction second = fb.store(i32(2), a);
    fb.call("", opaque);
    fb.ret();
    fb.finish();
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(result.isDead(first, tree.root())).isTrue();
    // Nothing is known about what opaque() reads
    assertThat(result.isDead(second, tree.root())).isFalse();
  }

  @Test
  public void storeOverwrittenByInlinedCallee() {
    Module module = new Module();
    Function set = module.addFunction("set", Type.VOID, Type.PTR);
    FunctionBuilder sb = new FunctionBuilder(set);
    sb.setBlock(sb.newBlock("entry"));
    Instruction inner = sb.store(i32(2), set.argument(0));
    sb.ret();
    sb.finish();
    Function f = module.addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.I32);
    Instruction outer = fb.store(i32(1), a);
    Instruction call = fb.call("", set, a);
    fb.ret(fb.load("v", Type.I32, a));
    fb.finish();

    ContextTree tree = new ContextTree(f);
    InlineAttempt ia = tree.root().getOrCreateInlineAttempt(call);
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(result.isDead(outer, tree.root())).isTrue();
    assertThat(result.isDead(inner, ia)).isFalse();
    assertThat(result.writersTraversing(ia))
        .containsExactly(new InstructionRef(outer, tree.root()));
  }

  @Test
  public void storeReadByUninlinedCallee() {
    Module module = new Module();
    Function set = module.addFunction("set", Type.VOID, Type.PTR);
    FunctionBuilder sb = new FunctionBuilder(set);
    sb.setBlock(sb.newBlock("entry"));
    sb.store(i32(2), set.argument(0));
    sb.ret();
    sb.finish();
    Function f = module.addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction a = fb.alloca("a", Type.I32);
    Instruction outer = fb.store(i32(1), a);
    fb.call("", set, a);
    fb.ret(fb.load("v", Type.I32, a));
    fb.finish();
    ContextTree tree = new ContextTree(f);
    assertThat(analyze(tree).isDead(outer, tree.root())).isFalse();
  }

  @Test
  public void copyInCalleeKilledByLaterCopyInCaller() {
    Module module = new Module();
    Function copy = module.addFunction("copy", Type.VOID, Type.PTR, Type.PTR);
    FunctionBuilder cb = new FunctionBuilder(copy);
    cb.setBlock(cb.newBlock("entry"));
    Instruction inner = cb.memcpy(copy.argument(1), copy.argument(0), Constant.of(Type.I64, 4));
    cb.ret();
    cb.finish();
    Function f = module.addFunction("f", Type.VOID);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction x = fb.alloca("x", Type.I32);
    Instruction y = fb.alloca("y", Type.I32);
    Instruction z = fb.alloca("z", Type.I32);
    Instruction store = fb.store(i32(1), x);
    Instruction call = fb.call("", copy, x, y);
    Instruction outer = fb.memcpy(z, y, Constant.of(Type.I64, 4));
    fb.ret();
    fb.finish();

    ContextTree tree = new ContextTree(f);
    InlineAttempt ia = tree.root().getOrCreateInlineAttempt(call);
    DeadStoreAnalysis.Result result = analyze(tree);
    // z is never read, so the last copy is dead; then nothing reads y, and nothing reads x
    assertThat(result.isDead(outer, tree.root())).isTrue();
    assertThat(result.isDead(inner, ia)).isTrue();
    assertThat(result.isDead(store, tree.root())).isTrue();
  }

  @Test
  public void resolvedReadOverwritten() {
    Module module = new Module();
    Function open = module.addFunction("open", Type.I32, Type.PTR);
    Function read = module.addFunction("read", Type.I64, Type.I32, Type.PTR, Type.I64);
    GlobalVariable path = module.addGlobal("path", Type.I8, null, true);
    Function f = module.addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    fb.setBlock(fb.newBlock("entry"));
    Instruction buf = fb.alloca("buf", Type.I32);
    Instruction fd = fb.call("fd", open, path);
    Instruction n = fb.call("n", read, fd, buf, Constant.of(Type.I64, 4));
    Instruction store = fb.store(i32(7), buf);
    fb.ret(fb.load("v", Type.I32, buf));
    fb.finish();
    ContextTree tree = new ContextTree(f);
    DeadStoreAnalysis.Result result = analyze(tree, new PosixResourceModel());
    assertThat(result.isDead(n, tree.root())).isTrue();
    assertThat(result.isDead(store, tree.root())).isFalse();
  }

  @Test
  public void storesInPeeledIterations() {
    Function f = new Module().addFunction("f", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    Block entry = fb.newBlock("entry");
    Block header = fb.newBlock("header");
    Block latch = fb.newBlock("latch");
    Block exit = fb.newBlock("exit");
    fb.setBlock(entry);
    Instruction a = fb.alloca("a", Type.I32);
    fb.br(header);
    fb.setBlock(header);
    Instruction i = fb.phi("i", Type.I32);
    fb.condBr(fb.icmp("cmp", Predicate.SLT, i, i32(2)), latch, exit);
    fb.setBlock(latch);
    Instruction store = fb.store(i, a);
    Instruction inc = fb.add("inc", i, i32(1));
    fb.br(header);
    fb.setBlock(exit);
    fb.ret(fb.load("v", Type.I32, a));
    fb.addIncoming(i, i32(0), entry).addIncoming(i, inc, latch);
    fb.finish();

    ContextTree tree = new ContextTree(f);
    PeelAttempt pa = tree.root().getOrCreatePeelAttempt(f.loopWithHeader("header"));
    for (int n = 0; n < 3; n++) {
      pa.nextIteration();
    }
    DeadStoreAnalysis.Result result = analyze(tree);
    assertThat(pa.isTerminated()).isTrue();
    // The first iteration's store is overwritten by the second's, which reaches the exit
    assertThat(result.isDead(store, pa.getIteration(0))).isTrue();
    assertThat(result.isDead(store, pa.getIteration(1))).isFalse();
    assertThat(result.writersTraversing(pa.getIteration(1)))
        .contains(new InstructionRef(store, pa.getIteration(0)));
  }
}
