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

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a function fails verification (missing terminators, wrong operand counts, mismatched
 * types). There is no recovery; the function must be fixed by whoever built it.
 */
public class MalformedIrException extends RuntimeException {
  public final @Nullable Instruction instruction;
  public final String detail;

  @FormatMethod
  public MalformedIrException(@Nullable Instruction instruction, String format, Object... args) {
    this.instruction = instruction;
    this.detail = String.format(format, args);
  }

  @Override
  public String getMessage() {
    if (instruction == null) {
      return detail;
    }
    return String.format("%s (at %s: %s)", detail, instruction.block, instruction.describe());
  }
}
