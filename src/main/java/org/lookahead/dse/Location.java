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

import org.lookahead.analysis.Context;
import org.lookahead.ir.Value;

/**
 * A range of memory: {@code size} bytes starting at the address given by {@code pointer} as
 * evaluated in {@code context}.
 */
public record Location(Value pointer, Context context, long size) {

  /** The size of a location whose extent is not known. */
  public static final long UNKNOWN_SIZE = -1;

  public boolean hasKnownSize() {
    return size != UNKNOWN_SIZE;
  }

  @Override
  public String toString() {
    return pointer.asOperand() + "#" + context.index + "[" + (hasKnownSize() ? size : "?") + "]";
  }
}
