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
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lookahead.ir.Edge;
import org.lookahead.ir.Function;
import org.lookahead.ir.Loop;
import org.lookahead.ir.Module;

@RunWith(JUnit4.class)
public class AnalysisOptionsTest {

  private final Module module = new Module();
  private final Function count = SolverTest.countingLoop(module, 4);
  private final Loop loop = count.loopWithHeader("header");

  @Test
  public void defaults() {
    AnalysisOptions options = AnalysisOptions.DEFAULTS;
    assertThat(options.maxPointerTargets).isEqualTo(AnalysisOptions.DEFAULT_MAX_POINTER_TARGETS);
    assertThat(options.mallocAlignment).isEqualTo(16);
    assertThat(options.maxIterations(loop)).isEqualTo(AnalysisOptions.DEFAULT_MAX_ITERATIONS);
    assertThat(options.optimisticEdge(loop)).isNull();
  }

  @Test
  public void parseFlags() {
    AnalysisOptions options =
        AnalysisOptions.parse(
            module,
            List.of(
                "--int-max-iterations=5",
                "--int-max-pointer-targets=4",
                "--int-malloc-alignment=8",
                "--int-loop-max=count,header,3",
                "--int-optimistic-loop=count, header, exit",
                "--int-always-inline=count"));
    assertThat(options.defaultMaxIterations).isEqualTo(5);
    assertThat(options.maxPointerTargets).isEqualTo(4);
    assertThat(options.mallocAlignment).isEqualTo(8);
    assertThat(options.maxIterations(loop)).isEqualTo(3);
    assertThat(options.optimisticEdge(loop))
        .isEqualTo(new Edge(count.block("header"), count.block("exit")));
  }

  @Test
  public void badFlags() {
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-no-such-flag=1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("int-max-iterations=1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-max-iterations=x")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-loop-max=nowhere,header,3")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-loop-max=count,exit,3")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-loop-max=count,header")));
    // The entry block is not in a loop
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-optimistic-loop=count,entry,header")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisOptions.parse(module, List.of("--int-malloc-alignment=12")));
  }

  @Test
  public void oneOptimisticEdgePerLoop() {
    AnalysisOptions.Builder builder =
        AnalysisOptions.builder()
            .setOptimisticEdge(loop, new Edge(count.block("header"), count.block("exit")));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            builder.setOptimisticEdge(
                loop, new Edge(count.block("latch"), count.block("header"))));
    // The edge must start inside the loop
    assertThrows(
        IllegalArgumentException.class,
        () ->
            AnalysisOptions.builder()
                .setOptimisticEdge(loop, new Edge(count.block("entry"), count.block("header"))));
  }
}
