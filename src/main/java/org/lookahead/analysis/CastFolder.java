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
import org.lookahead.ir.Type;
import org.lookahead.ir.TypeLayout;

/**
 * Casts of non-scalar values. A pointer survives a cast between pointers and integers at least as
 * wide as a pointer; a resource handle survives a cast between pointers and integers of at least
 * 32 bits. Variadic-frame pointers pass through any cast.
 */
final class CastFolder implements Folder {
  private static final int HANDLE_BITS = 32;

  private final int pointerBits;

  CastFolder(TypeLayout layout) {
    this.pointerBits = layout.pointerSize() * 8;
  }

  @Override
  public @Nullable LatticeValue fold(Instruction inst, LatticeValue[] ops, Phase phase) {
    LatticeValue op = ops[0];
    Type from = inst.operand(0).type();
    Type to = inst.type();
    return switch (op.category()) {
      case UNKNOWN, OVERDEF, VARARG -> op;
      case SCALAR -> null;
      case POINTER ->
          (holds(from, pointerBits) && holds(to, pointerBits)) ? op : LatticeValue.OVERDEF;
      case RESOURCE ->
          (holds(from, HANDLE_BITS) && holds(to, HANDLE_BITS)) ? op : LatticeValue.OVERDEF;
    };
  }

  private static boolean holds(Type type, int bits) {
    return type.isPointer() || (type instanceof Type.IntType t && t.bits >= bits);
  }
}
