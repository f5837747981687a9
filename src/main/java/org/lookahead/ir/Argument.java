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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** A formal parameter of a Function. */
public final class Argument extends Value {
  public final Function function;
  public final int index;
  private boolean noAlias;

  private final List<Instruction> users = new ArrayList<>();
  private ImmutableList<Instruction> frozenUsers = ImmutableList.of();

  Argument(Function function, int index, Type type, String name) {
    super(type, name);
    this.function = function;
    this.index = index;
  }

  /** True if this pointer argument does not alias any other pointer visible to the callee. */
  public boolean isNoAlias() {
    return noAlias;
  }

  public void setNoAlias(boolean noAlias) {
    this.noAlias = noAlias;
  }

  /** The instructions that use this argument; empty until the function is finished. */
  public ImmutableList<Instruction> users() {
    return frozenUsers;
  }

  void addUser(Instruction inst) {
    if (users.isEmpty() || users.get(users.size() - 1) != inst) {
      users.add(inst);
    }
  }

  void freezeUsers() {
    frozenUsers = ImmutableList.copyOf(users);
  }
}
