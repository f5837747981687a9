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

/** The two stages of a Solver run. */
public enum Phase {
  /**
   * Unknown operands are skipped by merges and keep other instructions Unknown; branches on
   * Unknown conditions are not yet taken.
   */
  OPTIMISTIC,
  /** Any Unknown operand is treated as Overdef, and no instruction is left Unknown. */
  FINALIZING
}
