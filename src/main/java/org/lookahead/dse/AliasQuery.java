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
import org.lookahead.ir.Instruction;

/** Answers alias and mod-ref questions about context-relative memory locations. */
public interface AliasQuery {

  AliasResult alias(Location a, Location b);

  /** Whether {@code call}, executed in {@code context}, may read or write {@code location}. */
  ModRef modRef(Instruction call, Context context, Location location);

  /** Assumes that any two locations may alias and that any call may read or write anything. */
  AliasQuery CONSERVATIVE =
      new AliasQuery() {
        @Override
        public AliasResult alias(Location a, Location b) {
          return AliasResult.MAY_ALIAS;
        }

        @Override
        public ModRef modRef(Instruction call, Context context, Location location) {
          return ModRef.MOD_REF;
        }
      };
}
