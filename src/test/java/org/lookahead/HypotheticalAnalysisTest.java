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

package org.lookahead;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lookahead.analysis.LatticeValue;
import org.lookahead.analysis.PeelAttempt;
import org.lookahead.ir.Block;
import org.lookahead.ir.Constant;
import org.lookahead.ir.Function;
import org.lookahead.ir.FunctionBuilder;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Module;
import org.lookahead.ir.Predicate;
import org.lookahead.ir.Type;
import org.lookahead.report.AnalysisReport;

@RunWith(JUnit4.class)
public class HypotheticalAnalysisTest {

  /** Counts from 0 to 3 and returns the final count. */
  private static Function countToThree() {
    Function f = new Module().addFunction("count", Type.I32);
    FunctionBuilder fb = new FunctionBuilder(f);
    Block entry = fb.newBlock("entry");
    Block header = fb.newBlock("header");
    Block latch = fb.newBlock("latch");
    Block exit = fb.newBlock("exit");
    fb.setBlock(entry).br(header);
    fb.setBlock(header);
    Instruction i = fb.phi("i", Type.I32);
    fb.condBr(fb.icmp("cmp", Predicate.SLT, i, Constant.of(Type.I32, 3)), latch, exit);
    fb.setBlock(latch);
    Instruction inc = fb.add("inc", i, Constant.of(Type.I32, 1));
    fb.br(header);
    fb.setBlock(exit);
    Instruction r = fb.phi("r", Type.I32);
    fb.ret(r);
    fb.addIncoming(i, Constant.of(Type.I32, 0), entry)
        .addIncoming(i, inc, latch)
        .addIncoming(r, i, header);
    return fb.finish();
  }

  @Test
  public void peelUntilTerminated() {
    Function f = countToThree();
    HypotheticalAnalysis analysis =
        HypotheticalAnalysis.builder(f).setPeelUntilTerminated(true).build();
    PeelAttempt pa = analysis.tree().root().getOrCreatePeelAttempt(f.loopWithHeader("header"));
    pa.nextIteration();
    AnalysisReport report = analysis.run();
    assertThat(pa.numIterations()).isEqualTo(4);
    assertThat(pa.isTerminated()).isTrue();
    assertThat(analysis.tree().root().value(f.instruction("r")))
        .isEqualTo(LatticeValue.scalar(Constant.of(Type.I32, 3)));
    assertThat(report.contexts()).hasSize(5);
    assertThat(analysis.deadStores().deadWriters()).isEmpty();
  }

  @Test
  public void iterationCapFromFlags() {
    Function f = countToThree();
    HypotheticalAnalysis analysis =
        HypotheticalAnalysis.builder(f)
            .setFlags(List.of("--int-max-iterations=2"))
            .setPeelUntilTerminated(true)
            .build();
    PeelAttempt pa = analysis.tree().root().getOrCreatePeelAttempt(f.loopWithHeader("header"));
    pa.nextIteration();
    analysis.run();
    assertThat(pa.numIterations()).isEqualTo(2);
    assertThat(pa.isTerminated()).isFalse();
    assertThat(analysis.tree().root().value(f.instruction("r"))).isEqualTo(LatticeValue.OVERDEF);
  }

  @Test
  public void withoutPeelingUntilTerminated() {
    Function f = countToThree();
    HypotheticalAnalysis analysis = HypotheticalAnalysis.builder(f).build();
    PeelAttempt pa = analysis.tree().root().getOrCreatePeelAttempt(f.loopWithHeader("header"));
    pa.nextIteration();
    analysis.run();
    assertThat(pa.numIterations()).isEqualTo(1);
  }

  @Test
  public void deadStoresBeforeRun() {
    HypotheticalAnalysis analysis = HypotheticalAnalysis.builder(countToThree()).build();
    assertThrows(IllegalStateException.class, analysis::deadStores);
  }
}
