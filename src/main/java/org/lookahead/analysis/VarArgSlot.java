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

/**
 * A position within the variadic-argument frame of one inlined call.
 *
 * @param frame the inline attempt whose call site supplies the variadic arguments
 * @param kind whether this is the base of the register save area or a specific argument
 * @param position for an ARGUMENT slot, the index of the variadic argument (0 is the first
 *     argument after the fixed parameters); unused for the register save area
 */
public record VarArgSlot(InlineAttempt frame, Kind kind, int position) {

  public enum Kind {
    REGISTER_AREA,
    ARGUMENT
  }

  public static VarArgSlot registerArea(InlineAttempt frame) {
    return new VarArgSlot(frame, Kind.REGISTER_AREA, 0);
  }

  public static VarArgSlot argument(InlineAttempt frame, int position) {
    return new VarArgSlot(frame, Kind.ARGUMENT, position);
  }

  @Override
  public String toString() {
    return kind == Kind.REGISTER_AREA
        ? "va_regs#" + frame.index
        : "va_arg" + position + "#" + frame.index;
  }
}
