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

import org.jspecify.annotations.Nullable;
import org.lookahead.ir.Instruction;

/**
 * One way of computing an instruction's lattice value from the values of its operands. The
 * Evaluator tries the folders registered for an opcode in order, and uses the first non-null
 * result.
 */
@FunctionalInterface
interface Folder {
  /**
   * Returns the value of {@code inst}, or null if this folder does not apply.
   *
   * @param ops the operand values; each is UNKNOWN, OVERDEF, or a single-member value (a
   *     Pointer-Base with more than one target is split by the caller)
   */
  @Nullable LatticeValue fold(Instruction inst, LatticeValue[] ops, Phase phase);
}
