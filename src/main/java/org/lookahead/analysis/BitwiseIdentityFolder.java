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
import org.lookahead.ir.Constant;
import org.lookahead.ir.Instruction;
import org.lookahead.ir.Opcode;

/** {@code x & 0} is 0 and {@code x | -1} is -1, whatever {@code x} is. */
final class BitwiseIdentityFolder implements Folder {
  static final BitwiseIdentityFolder INSTANCE = new BitwiseIdentityFolder();

  private BitwiseIdentityFolder() {}

  @Override
  public @Nullable LatticeValue fold(Instruction inst, LatticeValue[] ops, Phase phase) {
    for (LatticeValue op : ops) {
      Constant c = op.constant();
      if (c == null) {
        continue;
      } else if (inst.opcode == Opcode.AND && c.isZero()) {
        return LatticeValue.scalar(c);
      } else if (inst.opcode == Opcode.OR && c.isAllOnes()) {
        return LatticeValue.scalar(c);
      }
    }
    return null;
  }
}
