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

import com.google.common.base.Preconditions;
import java.util.BitSet;

/**
 * The bytes of a write that have been overwritten along one path. A coverage of unknown size can
 * never be complete.
 */
final class ByteCoverage {
  private final long size;
  private final BitSet covered;

  ByteCoverage(long size) {
    Preconditions.checkArgument(size == Location.UNKNOWN_SIZE || size >= 0);
    this.size = size;
    this.covered = new BitSet();
  }

  private ByteCoverage(long size, BitSet covered) {
    this.size = size;
    this.covered = covered;
  }

  ByteCoverage copy() {
    return new ByteCoverage(size, (BitSet) covered.clone());
  }

  /** Marks the bytes in [from, to) as covered; bytes outside the write are ignored. */
  void cover(long from, long to) {
    long start = Math.max(from, 0);
    long end = (size == Location.UNKNOWN_SIZE) ? to : Math.min(to, size);
    if (start < end && end <= Integer.MAX_VALUE) {
      covered.set((int) start, (int) end);
    }
  }

  /** True if every byte in [from, to) is covered. */
  boolean isCovered(long from, long to) {
    if (from < 0 || to > Integer.MAX_VALUE) {
      return false;
    } else if (from >= to) {
      return true;
    }
    int firstClear = covered.nextClearBit((int) from);
    return firstClear >= to;
  }

  boolean isComplete() {
    return size != Location.UNKNOWN_SIZE && isCovered(0, size);
  }

  /** True if every byte covered by {@code other} is also covered by this. */
  boolean containsAll(ByteCoverage other) {
    BitSet missing = (BitSet) other.covered.clone();
    missing.andNot(covered);
    return missing.isEmpty();
  }

  @Override
  public String toString() {
    return covered + "/" + (size == Location.UNKNOWN_SIZE ? "?" : size);
  }
}
