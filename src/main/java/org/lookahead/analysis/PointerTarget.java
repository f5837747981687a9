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

/** One candidate for what a pointer points to: an object and a byte offset within it. */
public record PointerTarget(MemoryObject object, long offset) {

  /** The offset of a pointer whose position within its object is not known. */
  public static final long INDETERMINATE = Long.MAX_VALUE;

  public boolean hasKnownOffset() {
    return offset != INDETERMINATE;
  }

  /** Returns a target in the same object with the given offset added, if both are known. */
  public PointerTarget plus(long delta, boolean deltaKnown) {
    if (!deltaKnown || !hasKnownOffset()) {
      return new PointerTarget(object, INDETERMINATE);
    }
    return new PointerTarget(object, offset + delta);
  }

  @Override
  public String toString() {
    return object + (hasKnownOffset() ? "+" + offset : "+?");
  }
}
