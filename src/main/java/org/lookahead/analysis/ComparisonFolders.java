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
import org.lookahead.ir.Predicate;

/** Folders for ICMP that can decide comparisons involving non-scalar values. */
final class ComparisonFolders {

  private ComparisonFolders() {}

  /**
   * Compares a resource handle with an integer constant. A handle from a successful open is never
   * negative, so it is unequal to (and greater than) any negative constant and at least zero.
   */
  static final Folder RESOURCE =
      (inst, ops, phase) -> {
        boolean leftIsHandle = ops[0] instanceof LatticeValue.Resource;
        if (!leftIsHandle && !(ops[1] instanceof LatticeValue.Resource)) {
          return null;
        }
        LatticeValue other = leftIsHandle ? ops[1] : ops[0];
        Predicate pred = leftIsHandle ? inst.predicate() : inst.predicate().swapped();
        if (other.isUnknown()) {
          return LatticeValue.UNKNOWN;
        }
        if (!(other.constant() instanceof Constant.Int c) || c.width() > 64) {
          return LatticeValue.OVERDEF;
        }
        long v = c.longValue();
        Boolean result =
            switch (pred) {
              case EQ, SLE -> v < 0 ? false : null;
              case NE, SGT -> v < 0 ? true : null;
              case SGE -> v <= 0 ? true : null;
              case SLT -> v <= 0 ? false : null;
              default -> null;
            };
        return toValue(result);
      };

  /**
   * Compares two pointers. Null is unequal to any identified object; two pointers into the same
   * object compare by offset; pointers into different identified objects are unequal.
   */
  static final Folder POINTER =
      (inst, ops, phase) -> {
        Predicate pred = inst.predicate();
        PointerTarget left = target(ops[0]);
        PointerTarget right = target(ops[1]);
        boolean leftNull = isNull(ops[0]);
        boolean rightNull = isNull(ops[1]);
        if ((leftNull && right != null && right.object().isIdentified())
            || (rightNull && left != null && left.object().isIdentified())) {
          // Treat null as 0 and an object address as 1
          return toValue(pred.test(leftNull ? -1 : 1));
        } else if (left == null || right == null) {
          return null;
        } else if (left.object().equals(right.object())) {
          if (!left.hasKnownOffset() || !right.hasKnownOffset()) {
            return null;
          }
          return toValue(pred.signed().test(Long.compare(left.offset(), right.offset())));
        } else if (pred.isEquality()
            && left.object().isIdentified()
            && right.object().isIdentified()) {
          return toValue(pred == Predicate.NE);
        }
        return null;
      };

  /**
   * Compares any value with the extreme value of its type: nothing is unsigned-greater than
   * all-ones, nothing is unsigned-less than zero, and likewise for the signed extremes.
   */
  static final Folder EXTREMAL =
      (inst, ops, phase) -> {
        Predicate pred = inst.predicate();
        if (pred.isEquality()) {
          return null;
        }
        Constant c0 = ops[0].constant();
        Constant c1 = ops[1].constant();
        if ((c0 == null) == (c1 == null)) {
          return null;
        }
        Constant c = c1;
        if (c == null) {
          c = c0;
          pred = pred.swapped();
        }
        if (!(c instanceof Constant.Int k)) {
          return null;
        }
        Boolean result =
            switch (pred) {
              case UGT -> k.isAllOnes() ? false : null;
              case UGE -> k.isZero() ? true : null;
              case ULT -> k.isZero() ? false : null;
              case ULE -> k.isAllOnes() ? true : null;
              case SGT -> k.isMaxSigned() ? false : null;
              case SGE -> k.isMinSigned() ? true : null;
              case SLT -> k.isMinSigned() ? false : null;
              case SLE -> k.isMaxSigned() ? true : null;
              default -> null;
            };
        return toValue(result);
      };

  private static @Nullable PointerTarget target(LatticeValue v) {
    return (v instanceof LatticeValue.PointerBase pb) ? pb.single() : null;
  }

  /** True for the null pointer and for integer zero (e.g. a null pointer cast to an integer). */
  private static boolean isNull(LatticeValue v) {
    Constant c = v.constant();
    return c != null && c.isZero();
  }

  private static @Nullable LatticeValue toValue(@Nullable Boolean b) {
    return (b == null) ? null : LatticeValue.scalar(Constant.of(b));
  }
}
