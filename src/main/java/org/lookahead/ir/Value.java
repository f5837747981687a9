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

/**
 * Anything that can appear as an operand: a Constant, a GlobalVariable or Function (both of which
 * are pointers), a function Argument, or the result of an Instruction.
 */
public abstract class Value {
  private final Type type;
  private final String name;

  Value(Type type, String name) {
    this.type = type;
    this.name = name;
  }

  public final Type type() {
    return type;
  }

  public final String name() {
    return name;
  }

  /** Returns the string used to refer to this value as an operand, e.g. {@code %x} or {@code 7}. */
  public String asOperand() {
    return "%" + name;
  }

  @Override
  public String toString() {
    return asOperand();
  }
}
