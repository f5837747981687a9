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
import org.lookahead.ir.Value;

/** Models calls that open, read or otherwise act on file-descriptor-like resources. */
public interface ResourceModel {

  /** A read call whose destination and size are known. */
  record ResolvedRead(Value buffer, long size) {}

  /** True if {@code call}, evaluated in {@code context}, is known to return a valid handle. */
  boolean isSuccessfulOpen(Instruction call, Context context);

  /**
   * If {@code call} reads a known number of bytes into a buffer, returns the buffer operand and the
   * size; otherwise null.
   */
  @Nullable ResolvedRead resolvedRead(Instruction call, Context context);

  /** A model that knows nothing about any call. */
  ResourceModel NONE =
      new ResourceModel() {
        @Override
        public boolean isSuccessfulOpen(Instruction call, Context context) {
          return false;
        }

        @Override
        public @Nullable ResolvedRead resolvedRead(Instruction call, Context context) {
          return null;
        }
      };
}
