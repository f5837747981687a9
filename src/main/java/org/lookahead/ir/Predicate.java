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

/** The comparison performed by an {@link Opcode#ICMP} instruction. */
public enum Predicate {
  EQ,
  NE,
  UGT,
  UGE,
  ULT,
  ULE,
  SGT,
  SGE,
  SLT,
  SLE;

  public boolean isEquality() {
    return this == EQ || this == NE;
  }

  public boolean isSigned() {
    return this == SGT || this == SGE || this == SLT || this == SLE;
  }

  public boolean isUnsigned() {
    return this == UGT || this == UGE || this == ULT || this == ULE;
  }

  /** Returns the predicate that gives the same result when the operands are exchanged. */
  public Predicate swapped() {
    return switch (this) {
      case EQ, NE -> this;
      case UGT -> ULT;
      case UGE -> ULE;
      case ULT -> UGT;
      case ULE -> UGE;
      case SGT -> SLT;
      case SGE -> SLE;
      case SLT -> SGT;
      case SLE -> SGE;
    };
  }

  /** Returns the signed version of an unsigned predicate; other predicates are unchanged. */
  public Predicate signed() {
    return switch (this) {
      case UGT -> SGT;
      case UGE -> SGE;
      case ULT -> SLT;
      case ULE -> SLE;
      default -> this;
    };
  }

  /** Applies this predicate to the result of comparing the left operand to the right one. */
  public boolean test(int comparison) {
    return switch (this) {
      case EQ -> comparison == 0;
      case NE -> comparison != 0;
      case UGT, SGT -> comparison > 0;
      case UGE, SGE -> comparison >= 0;
      case ULT, SLT -> comparison < 0;
      case ULE, SLE -> comparison <= 0;
    };
  }

  /** Applies this predicate to two integer constants of the same width. */
  public boolean test(Constant.Int left, Constant.Int right) {
    int cmp =
        isSigned()
            ? left.signedValue().compareTo(right.signedValue())
            : left.unsignedValue().compareTo(right.unsignedValue());
    return test(cmp);
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
