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

/** A control-flow edge between two blocks of the same function. */
public record Edge(Block from, Block to) {
  public Edge {
    if (from.function != to.function) {
      throw new IllegalArgumentException("Edge crosses functions: " + from + " -> " + to);
    }
  }

  @Override
  public String toString() {
    return from.name + " -> " + to.name;
  }
}
