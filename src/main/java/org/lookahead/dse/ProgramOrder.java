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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import org.lookahead.analysis.Context;
import org.lookahead.analysis.ContextTree;
import org.lookahead.analysis.InlineAttempt;
import org.lookahead.analysis.PeelAttempt;
import org.lookahead.analysis.PeelIteration;
import org.lookahead.ir.Block;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Opcode;

/** Enumerates the instructions evaluated in a ContextTree, in the order they would execute. */
public final class ProgramOrder {

  private ProgramOrder() {}

  /**
   * Returns every live instruction of every enabled, live context reachable from the root. Each
   * context's live blocks are listed in reverse postorder. An active inline attempt is listed
   * immediately after its call. The iterations of an expanding peel attempt are listed, in order,
   * where the loop's header would be; the enclosing context does not list the loop's blocks.
   */
  public static ImmutableList<InstructionRef> of(ContextTree tree) {
    ImmutableList.Builder<InstructionRef> result = ImmutableList.builder();
    append(tree.root(), result);
    return result.build();
  }

  private static void append(Context c, ImmutableList.Builder<InstructionRef> result) {
    if (c.isDead() || !c.isEnabled()) {
      return;
    }
    Set<PeelAttempt> expanded = new HashSet<>();
    for (Block block : c.liveBlocks()) {
      PeelAttempt pa = c.expandingAttempt(block);
      if (pa != null) {
        // The header comes first in reverse postorder
        if (expanded.add(pa)) {
          for (PeelIteration it : pa.iterations()) {
            append(it, result);
          }
        }
        continue;
      }
      for (Instruction inst : block.instructions()) {
        result.add(new InstructionRef(inst, c));
        if (inst.opcode == Opcode.CALL) {
          InlineAttempt callee = c.activeInlineAttempt(inst);
          if (callee != null) {
            append(callee, result);
          }
        }
      }
    }
  }
}
