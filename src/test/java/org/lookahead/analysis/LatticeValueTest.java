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
import static org.lookahead.analysis.LatticeValue.OVERDEF;
import static org.lookahead.analysis.LatticeValue.UNKNOWN;

import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lookahead.ir.Constant;
import org.lookahead.ir.GlobalVariable;
import org.lookahead.ir.Module;
import org.lookahead.ir.Type;

@RunWith(JUnit4.class)
public class LatticeValueTest {

  static final LatticeValue.Joiner joiner = new LatticeValue.Joiner(2);

  static final Module module = new Module();
  static final GlobalVariable A = module.addGlobal("a", Type.I32, null, false);
  static final GlobalVariable B = module.addGlobal("b", Type.I32, null, false);
  static final GlobalVariable C = module.addGlobal("c", Type.I32, null, false);

  static final LatticeValue ONE = LatticeValue.scalar(Constant.of(Type.I32, 1));
  static final LatticeValue TWO = LatticeValue.scalar(Constant.of(Type.I32, 2));

  static LatticeValue ptr(GlobalVariable g, long offset) {
    return LatticeValue.pointer(MemoryObject.global(g), offset);
  }

  @Test
  public void unknownIsIdentity() {
    for (LatticeValue v : List.of(UNKNOWN, OVERDEF, ONE, ptr(A, 0))) {
      assertThat(joiner.join(UNKNOWN, v)).isEqualTo(v);
      assertThat(joiner.join(v, UNKNOWN)).isEqualTo(v);
    }
  }

  @Test
  public void overdefAbsorbs() {
    for (LatticeValue v : List.of(UNKNOWN, OVERDEF, ONE, ptr(A, 0))) {
      assertThat(joiner.join(OVERDEF, v)).isEqualTo(OVERDEF);
      assertThat(joiner.join(v, OVERDEF)).isEqualTo(OVERDEF);
    }
  }

  @Test
  public void scalars() {
    assertThat(joiner.join(ONE, ONE)).isEqualTo(ONE);
    // Scalars are compared by value, not identity
    assertThat(joiner.join(ONE, LatticeValue.scalar(Constant.of(Type.I32, 1)))).isEqualTo(ONE);
    assertThat(joiner.join(ONE, TWO)).isEqualTo(OVERDEF);
    // Same value, different width
    assertThat(joiner.join(ONE, LatticeValue.scalar(Constant.of(Type.I64, 1))))
        .isEqualTo(OVERDEF);
  }

  @Test
  public void categoriesDoNotMix() {
    assertThat(joiner.join(ONE, ptr(A, 0))).isEqualTo(OVERDEF);
    assertThat(joiner.join(LatticeValue.scalar(Constant.NULL), ptr(A, 0))).isEqualTo(OVERDEF);
  }

  @Test
  public void pointerTargetsAreUnioned() {
    LatticeValue ab = joiner.join(ptr(A, 0), ptr(B, 4));
    assertThat(ab).isInstanceOf(LatticeValue.PointerBase.class);
    LatticeValue.PointerBase pb = (LatticeValue.PointerBase) ab;
    assertThat(pb.targets)
        .containsExactly(
            new PointerTarget(MemoryObject.global(A), 0),
            new PointerTarget(MemoryObject.global(B), 4));
    assertThat(pb.single()).isNull();
    assertThat(pb.members()).containsExactly(ptr(A, 0), ptr(B, 4));
    // Order does not matter
    assertThat(joiner.join(ptr(B, 4), ptr(A, 0))).isEqualTo(ab);
    // Joining a member again changes nothing
    assertThat(joiner.join(ab, ptr(A, 0))).isEqualTo(ab);
  }

  @Test
  public void pointerTargetLimit() {
    LatticeValue ab = joiner.join(ptr(A, 0), ptr(B, 0));
    assertThat(joiner.join(ab, ptr(C, 0))).isEqualTo(OVERDEF);
    assertThat(new LatticeValue.Joiner(3).join(ab, ptr(C, 0)))
        .isInstanceOf(LatticeValue.PointerBase.class);
    // Different offsets in one object are different targets
    assertThat(joiner.join(ab, ptr(A, 8))).isEqualTo(OVERDEF);
  }

  @Test
  public void joinIsCommutativeAndAssociative() {
    List<LatticeValue> values =
        List.of(
            UNKNOWN,
            OVERDEF,
            ONE,
            TWO,
            ptr(A, 0),
            ptr(A, 8),
            ptr(B, 0),
            ptr(C, 0),
            joiner.join(ptr(A, 0), ptr(B, 0)));
    for (int limit = 2; limit <= 4; limit++) {
      LatticeValue.Joiner j = new LatticeValue.Joiner(limit);
      for (LatticeValue x : values) {
        for (LatticeValue y : values) {
          assertThat(j.join(x, y)).isEqualTo(j.join(y, x));
          for (LatticeValue z : values) {
            assertThat(j.join(j.join(x, y), z)).isEqualTo(j.join(x, j.join(y, z)));
          }
        }
      }
    }
  }

  @Test
  public void indeterminateOffsets() {
    PointerTarget t = new PointerTarget(MemoryObject.global(A), 4);
    assertThat(t.plus(4, true).offset()).isEqualTo(8);
    PointerTarget lost = t.plus(0, false);
    assertThat(lost.hasKnownOffset()).isFalse();
    assertThat(lost.plus(4, true).hasKnownOffset()).isFalse();
  }

  @Test
  public void mergeSkipsUnknownWhileOptimistic() {
    Evaluator evaluator =
        new Evaluator(AnalysisOptions.DEFAULTS, module.layout, ResourceModel.NONE);
    assertThat(evaluator.merge(List.of(ONE, UNKNOWN), Phase.OPTIMISTIC)).isEqualTo(ONE);
    assertThat(evaluator.merge(List.of(UNKNOWN, UNKNOWN), Phase.OPTIMISTIC)).isEqualTo(UNKNOWN);
    assertThat(evaluator.merge(List.of(ONE, UNKNOWN), Phase.FINALIZING)).isEqualTo(OVERDEF);
    assertThat(evaluator.merge(List.of(ONE, ONE), Phase.FINALIZING)).isEqualTo(ONE);
    assertThat(evaluator.merge(List.of(), Phase.FINALIZING)).isEqualTo(UNKNOWN);
  }

  @Test
  public void rendering() {
    assertThat(ONE.toString()).isEqualTo("1");
    assertThat(UNKNOWN.toString()).isEqualTo("unknown");
    assertThat(ptr(A, 4).toString()).isEqualTo("ptr{@a+4}");
  }
}
