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
import org.lookahead.ir.Function;
import org.lookahead.ir.Instruction;

/**
 * Recognizes direct calls to functions named {@code open} and {@code read}. Every {@code open} is
 * assumed to succeed; a {@code read(fd, buffer, count)} is resolved when {@code fd} is a handle
 * from a successful open and {@code count} is a constant.
 */
public final class PosixResourceModel implements ResourceModel {

  @Override
  public boolean isSuccessfulOpen(Instruction call, Context context) {
    Function callee = call.calledFunction();
    return callee != null && callee.name().equals("open") && call.type().isInteger();
  }

  @Override
  public @Nullable ResolvedRead resolvedRead(Instruction call, Context context) {
    Function callee = call.calledFunction();
    if (callee == null || !callee.name().equals("read") || call.numOperands() != 3) {
      return null;
    }
    LatticeValue fd = context.operandValue(call.operand(0));
    LatticeValue count = context.operandValue(call.operand(2));
    if (fd instanceof LatticeValue.Resource
        && count.constant() instanceof Constant.Int n
        && n.width() <= 64
        && n.longValue() >= 0) {
      return new ResolvedRead(call.operand(1), n.longValue());
    }
    return null;
  }
}
