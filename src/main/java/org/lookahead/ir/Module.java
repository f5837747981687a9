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

import com.google.common.base.Preconditions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A collection of functions and global variables sharing one TypeLayout. */
public final class Module {
  public final TypeLayout layout;
  private final Map<String, Function> functions = new LinkedHashMap<>();
  private final Map<String, GlobalVariable> globals = new LinkedHashMap<>();

  public Module(TypeLayout layout) {
    this.layout = layout;
  }

  public Module() {
    this(DataLayout.LP64);
  }

  /**
   * Adds a new function; it is a declaration until a {@link FunctionBuilder} is used to give it a
   * body.
   */
  public Function addFunction(String name, Type returnType, List<Type> params, boolean isVarArg) {
    Preconditions.checkArgument(!functions.containsKey(name), "duplicate function %s", name);
    Function f = new Function(this, name, returnType, params, isVarArg);
    functions.put(name, f);
    return f;
  }

  public Function addFunction(String name, Type returnType, Type... params) {
    return addFunction(name, returnType, List.of(params), false);
  }

  /** Adds a global variable; {@code initializer} may be null if its contents are unspecified. */
  public GlobalVariable addGlobal(
      String name, Type valueType, @Nullable Constant initializer, boolean isConstant) {
    Preconditions.checkArgument(!globals.containsKey(name), "duplicate global %s", name);
    GlobalVariable g =
        new GlobalVariable(name, valueType, initializer, isConstant, layout.alignment(valueType));
    globals.put(name, g);
    return g;
  }

  public @Nullable Function function(String name) {
    return functions.get(name);
  }

  public @Nullable GlobalVariable global(String name) {
    return globals.get(name);
  }

  public Iterable<Function> functions() {
    return functions.values();
  }
}
