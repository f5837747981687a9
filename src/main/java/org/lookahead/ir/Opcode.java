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

package org.lookahead.ir;

import java.util.Locale;

/** The tag of an Instruction. */
public enum Opcode {
  // Memory
  ALLOCA(Kind.MEMORY, 0),
  LOAD(Kind.MEMORY, 1),
  STORE(Kind.MEMORY, 2),
  GEP(Kind.MEMORY, -1),
  /** {@code memset(dest, byte, length)} */
  MEMSET(Kind.MEMORY, 3),
  /** {@code memcpy(dest, src, length)} */
  MEMCPY(Kind.MEMORY, 3),

  // Integer arithmetic
  ADD(Kind.BINARY, 2),
  SUB(Kind.BINARY, 2),
  MUL(Kind.BINARY, 2),
  UDIV(Kind.BINARY, 2),
  SDIV(Kind.BINARY, 2),
  UREM(Kind.BINARY, 2),
  SREM(Kind.BINARY, 2),
  AND(Kind.BINARY, 2),
  OR(Kind.BINARY, 2),
  XOR(Kind.BINARY, 2),
  SHL(Kind.BINARY, 2),
  LSHR(Kind.BINARY, 2),
  ASHR(Kind.BINARY, 2),

  ICMP(Kind.COMPARE, 2),

  TRUNC(Kind.CAST, 1),
  ZEXT(Kind.CAST, 1),
  SEXT(Kind.CAST, 1),
  PTRTOINT(Kind.CAST, 1),
  INTTOPTR(Kind.CAST, 1),
  BITCAST(Kind.CAST, 1),

  SELECT(Kind.OTHER, 3),
  PHI(Kind.OTHER, -1),
  CALL(Kind.OTHER, -1),

  /** The register save area of a variadic function's frame. */
  VA_REG_AREA(Kind.OTHER, 0),
  /** The first stack-passed variadic argument of a variadic function's frame. */
  VA_OVERFLOW_AREA(Kind.OTHER, 0),

  // Terminators
  BR(Kind.TERMINATOR, 0),
  COND_BR(Kind.TERMINATOR, 1),
  SWITCH(Kind.TERMINATOR, 1),
  RET(Kind.TERMINATOR, -1),
  UNREACHABLE(Kind.TERMINATOR, 0);

  public enum Kind {
    MEMORY,
    BINARY,
    COMPARE,
    CAST,
    OTHER,
    TERMINATOR
  }

  public final Kind kind;

  /** The required number of operands, or -1 if it varies. */
  final int numOperands;

  Opcode(Kind kind, int numOperands) {
    this.kind = kind;
    this.numOperands = numOperands;
  }

  public boolean isTerminator() {
    return kind == Kind.TERMINATOR;
  }

  public boolean isCast() {
    return kind == Kind.CAST;
  }

  public boolean isBinary() {
    return kind == Kind.BINARY;
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
